package com.capturebot.common.exception;

import java.util.UUID;

/** Thrown when a job id does not resolve to a stored job. */
public class JobNotFoundException extends RuntimeException {

    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
