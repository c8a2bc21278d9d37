package com.whereq.orbit.exception;

/**
 * Error categories an API layer maps to client-facing responses
 */
public enum ErrorKind {
    /**
     * Referenced user, project, job or checkpoint does not exist
     */
    NOT_FOUND,

    /**
     * Caller is not allowed to use the requested resource
     */
    FORBIDDEN,

    /**
     * Request conflicts with current state (quota, lifecycle)
     */
    CONFLICT,

    /**
     * Malformed request
     */
    INVALID_REQUEST,

    /**
     * Failure inside the platform or the cluster
     */
    INTERNAL
}
