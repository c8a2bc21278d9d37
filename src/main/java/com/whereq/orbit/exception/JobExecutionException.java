package com.whereq.orbit.exception;

/**
 * Thrown when a job cannot be submitted to or removed from the cluster
 */
public class JobExecutionException extends OrbitException {

    public JobExecutionException(String message) {
        super(message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INTERNAL;
    }
}
