package com.whereq.orbit.exception;

/**
 * Thrown when a GPU job cannot be tied to an existing project
 */
public class ProjectNotFoundException extends OrbitException {

    public ProjectNotFoundException(Long projectId) {
        super("Project not found: " + projectId);
    }

    public ProjectNotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }
}
