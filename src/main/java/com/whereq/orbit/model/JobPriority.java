package com.whereq.orbit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Priority tiers, lowest first. Higher tiers are dispatched first.
 */
public enum JobPriority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String token;

    JobPriority(String token) {
        this.token = token;
    }

    @JsonValue
    public String getToken() {
        return token;
    }

    @JsonCreator
    public static JobPriority fromToken(String token) {
        if (token == null || token.isBlank()) {
            return LOW;
        }
        for (JobPriority priority : values()) {
            if (priority.token.equalsIgnoreCase(token)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown job priority: " + token);
    }

    @Override
    public String toString() {
        return token;
    }
}
