package com.zero.core.registry;

/**
 * Thrown when an analyzer id is registered twice.
 */
public class DuplicateAnalyzerException extends RuntimeException {

    private final String analyzerId;

    public DuplicateAnalyzerException(String analyzerId) {
        super("Analyzer already registered: " + analyzerId);
        this.analyzerId = analyzerId;
    }

    public String getAnalyzerId() {
        return analyzerId;
    }
}
