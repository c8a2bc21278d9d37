package com.whereq.orbit.exception;

/**
 * Thrown when a restart references a checkpoint the job does not have
 */
public class CheckpointNotFoundException extends OrbitException {

    public CheckpointNotFoundException(Long jobId, Long checkpointId) {
        super("Checkpoint " + checkpointId + " not found for job " + jobId);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }
}
