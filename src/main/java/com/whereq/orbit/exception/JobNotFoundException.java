package com.whereq.orbit.exception;

/**
 * Thrown when a job id does not resolve to a persisted job
 */
public class JobNotFoundException extends OrbitException {

    public JobNotFoundException(Long jobId) {
        super("Job not found: " + jobId);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }
}
