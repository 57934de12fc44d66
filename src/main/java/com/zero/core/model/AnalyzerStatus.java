package com.zero.core.model;

/**
 * Status of an individual analyzer within a job.
 */
public enum AnalyzerStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == SKIPPED;
    }

    /** True when dependents of an analyzer in this state must not run. */
    public boolean blocksDependents() {
        return this == FAILED || this == SKIPPED;
    }
}
