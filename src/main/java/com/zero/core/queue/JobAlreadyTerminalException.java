package com.zero.core.queue;

import com.zero.core.model.JobStatus;

/**
 * Thrown when cancelling a job that has already finished.
 */
public class JobAlreadyTerminalException extends RuntimeException {

    private final String jobId;
    private final JobStatus status;

    public JobAlreadyTerminalException(String jobId, JobStatus status) {
        super("Job " + jobId + " already finished with status " + status);
        this.jobId = jobId;
        this.status = status;
    }

    public String getJobId() {
        return jobId;
    }

    public JobStatus getStatus() {
        return status;
    }
}
