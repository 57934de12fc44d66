package com.zero.core.scheduler;

/**
 * Thrown when a registered analyzer declares a dependency that is not registered.
 */
public class UnknownDependencyException extends RuntimeException {

    private final String analyzerId;
    private final String missing;

    public UnknownDependencyException(String analyzerId, String missing) {
        super("Analyzer " + analyzerId + " depends on unregistered analyzer " + missing);
        this.analyzerId = analyzerId;
        this.missing = missing;
    }

    public String getAnalyzerId() {
        return analyzerId;
    }

    public String getMissing() {
        return missing;
    }
}
