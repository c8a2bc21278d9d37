package com.whereq.orbit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Job lifecycle states
 *
 * State transitions:
 * QUEUED → SCHEDULING → RUNNING → {COMPLETED, FAILED, CANCELLED}
 * SCHEDULING → FAILED (submission error)
 * {COMPLETED, FAILED, CANCELLED} → QUEUED (restart)
 */
public enum JobStatus {
    /**
     * Admitted, waiting to be picked up by the scheduler
     */
    QUEUED("queued"),

    /**
     * Popped from the queue, handed to an executor
     */
    SCHEDULING("scheduling"),

    /**
     * Submitted to the cluster
     */
    RUNNING("running"),

    /**
     * Completed successfully
     */
    COMPLETED("completed"),

    /**
     * Terminated with error
     */
    FAILED("failed"),

    /**
     * User-initiated cancellation
     */
    CANCELLED("cancelled");

    private final String token;

    JobStatus(String token) {
        this.token = token;
    }

    @JsonValue
    public String getToken() {
        return token;
    }

    @JsonCreator
    public static JobStatus fromToken(String token) {
        for (JobStatus status : values()) {
            if (status.token.equalsIgnoreCase(token)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + token);
    }

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if the job holds (or is about to hold) cluster resources.
     * Queued and scheduling jobs count as pending.
     */
    public boolean isConsumingQuota() {
        return this == RUNNING || this == QUEUED || this == SCHEDULING;
    }

    @Override
    public String toString() {
        return token;
    }
}
