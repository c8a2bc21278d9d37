package com.whereq.orbit.exception;

/**
 * Exception thrown when a job would push its project over the GPU quota
 */
public class QuotaExceededException extends OrbitException {

    private final long currentUsage;
    private final long requestedUnits;
    private final long quota;

    public QuotaExceededException(long currentUsage, long requestedUnits, long quota) {
        super(String.format("GPU quota exceeded: current=%d, requested=%d, quota=%d",
            currentUsage, requestedUnits, quota));
        this.currentUsage = currentUsage;
        this.requestedUnits = requestedUnits;
        this.quota = quota;
    }

    public long getCurrentUsage() {
        return currentUsage;
    }

    public long getRequestedUnits() {
        return requestedUnits;
    }

    public long getQuota() {
        return quota;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CONFLICT;
    }
}
