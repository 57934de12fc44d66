package com.zero.core.model;

/**
 * Lifecycle status of a scan job.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    DONE,
    ERROR,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == ERROR || this == CANCELLED;
    }
}
