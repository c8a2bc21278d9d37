package com.whereq.orbit.exception;

/**
 * Thrown when the requesting user does not exist
 */
public class UserNotFoundException extends OrbitException {

    public UserNotFoundException(Long userId) {
        super("User not found: " + userId);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }
}
