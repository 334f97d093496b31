package com.capturebot.common.exception;

/** Fatal for the job: the worker has no handler for this job type. */
public class UnsupportedJobTypeException extends RuntimeException {

    private final String jobType;

    public UnsupportedJobTypeException(String jobType) {
        super("Unsupported job_type: " + jobType);
        this.jobType = jobType;
    }

    public String getJobType() {
        return jobType;
    }
}
