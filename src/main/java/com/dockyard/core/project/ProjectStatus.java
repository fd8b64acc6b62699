package com.dockyard.core.project;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Durable status of a project's preview environment. This is the source of truth
 * the presence manager reconciles against after a restart.
 */
public enum ProjectStatus {
    CREATED("created"),
    STARTING("starting"),
    RUNNING("running"),
    STOPPED("stopped"),
    ERROR("error"),
    DELETING("deleting");

    private final String value;

    ProjectStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Statuses from which a heartbeat starts the containers. */
    public boolean isStartable() {
        return this == CREATED || this == STOPPED || this == ERROR;
    }

    public static ProjectStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown project status: " + value));
    }
}
