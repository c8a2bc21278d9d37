package com.whereq.orbit.exception;

/**
 * Thrown when an operation is not valid for the current job status
 */
public class InvalidJobTransitionException extends OrbitException {

    public InvalidJobTransitionException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CONFLICT;
    }
}
