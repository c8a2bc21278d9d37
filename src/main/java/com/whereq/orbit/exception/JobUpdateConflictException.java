package com.whereq.orbit.exception;

/**
 * Thrown when a job record changed between read and write.
 * Raised to the caller only after the store has given up retrying.
 */
public class JobUpdateConflictException extends OrbitException {

    public JobUpdateConflictException(Long jobId) {
        super("Job " + jobId + " was modified concurrently");
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CONFLICT;
    }
}
