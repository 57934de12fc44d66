package com.zero.core.registry;

import java.util.List;

/**
 * Thrown when one or more requested analyzer ids are not registered.
 */
public class UnknownAnalyzerException extends RuntimeException {

    private final List<String> ids;

    public UnknownAnalyzerException(List<String> ids) {
        super("Unknown analyzer" + (ids.size() == 1 ? "" : "s") + ": " + String.join(", ", ids));
        this.ids = List.copyOf(ids);
    }

    public List<String> getIds() {
        return ids;
    }
}
