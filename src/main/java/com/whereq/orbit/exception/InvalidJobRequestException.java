package com.whereq.orbit.exception;

/**
 * Thrown when a job submission fails validation
 */
public class InvalidJobRequestException extends OrbitException {

    public InvalidJobRequestException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INVALID_REQUEST;
    }
}
