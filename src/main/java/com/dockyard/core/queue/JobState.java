package com.dockyard.core.queue;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Lifecycle states of a queued job.
 * <p>
 * Transitions are monotonic: {@code queued -> running -> terminal}, or
 * {@code queued -> cancelled} directly. A running job may go back to
 * {@code queued} only through a retry with backoff, a handler reschedule or
 * an administrative force-unlock.
 */
public enum JobState {
    QUEUED("queued"),
    RUNNING("running"),
    SUCCEEDED("succeeded"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    JobState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public static JobState fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job state: " + value));
    }
}
