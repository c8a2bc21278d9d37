package com.whereq.orbit.exception;

/**
 * Base class of all errors surfaced by the admission and scheduling engine
 */
public abstract class OrbitException extends RuntimeException {

    protected OrbitException(String message) {
        super(message);
    }

    protected OrbitException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();
}
