package com.whereq.orbit.exception;

/**
 * Thrown when no executor is registered for a job type.
 * The scheduler treats it as non-fatal and leaves the job in scheduling.
 */
public class ExecutorNotFoundException extends OrbitException {

    private final String jobType;

    public ExecutorNotFoundException(String jobType) {
        super("No executor registered for job type: " + jobType);
        this.jobType = jobType;
    }

    public String getJobType() {
        return jobType;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INTERNAL;
    }
}
