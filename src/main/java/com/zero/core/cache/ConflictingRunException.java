package com.zero.core.cache;

import java.util.List;

/**
 * Thrown when an analyzer run is requested for a (target, analyzer) key that is
 * already being produced by another run.
 */
public class ConflictingRunException extends RuntimeException {

    private final String target;
    private final List<String> analyzerIds;

    public ConflictingRunException(String target, List<String> analyzerIds) {
        super("Analyzer run already in progress for " + target + ": " + String.join(", ", analyzerIds));
        this.target = target;
        this.analyzerIds = List.copyOf(analyzerIds);
    }

    public String getTarget() {
        return target;
    }

    public List<String> getAnalyzerIds() {
        return analyzerIds;
    }
}
