package com.actguard.execution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of an action execution. JSON uses the lowercase name (e.g. {@code "succeeded"}).
 * Output validation only ever moves a status to {@link #FAILED}.
 */
public enum ExecutionStatus {
    REQUESTED,
    SCHEDULED,
    DELAYED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMEOUT,
    ABANDONED,
    CANCELING,
    CANCELED,
    PENDING,
    PAUSED,
    PAUSING,
    RESUMING;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** True once the execution reached a terminal state. */
    public boolean isCompleted() {
        return this == SUCCEEDED || this == FAILED || this == TIMEOUT || this == CANCELED || this == ABANDONED;
    }

    /**
     * Parses the wire value (case-insensitive).
     *
     * @throws IllegalArgumentException for blank or unknown values
     */
    @JsonCreator
    public static ExecutionStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Execution status must be non-blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ExecutionStatus s : values()) {
            if (s.name().equals(normalized)) return s;
        }
        throw new IllegalArgumentException("Unknown execution status: " + value);
    }
}
