package com.whereq.orbit.exception;

/**
 * Thrown when the requested GPU access type is not in the project allow-list
 */
public class GpuAccessDeniedException extends OrbitException {

    public GpuAccessDeniedException(String gpuType, Long projectId) {
        super("GPU access type '" + gpuType + "' not allowed for project " + projectId);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.FORBIDDEN;
    }
}
