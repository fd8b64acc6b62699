package com.dockyard.core.production;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Production deployment lifecycle. Legal transitions:
 * <pre>
 * stopped  -> queued
 * queued   -> building | failed
 * building -> running | failed
 * running  -> queued | stopped | failed
 * failed   -> queued
 * </pre>
 * {@code queued} and {@code building} are active and block new deploys.
 */
public enum ProductionStatus {
    STOPPED("stopped"),
    QUEUED("queued"),
    BUILDING("building"),
    RUNNING("running"),
    FAILED("failed");

    private static final Map<ProductionStatus, Set<ProductionStatus>> TRANSITIONS = Map.of(
            STOPPED, EnumSet.of(QUEUED),
            QUEUED, EnumSet.of(BUILDING, FAILED),
            BUILDING, EnumSet.of(RUNNING, FAILED),
            RUNNING, EnumSet.of(QUEUED, STOPPED, FAILED),
            FAILED, EnumSet.of(QUEUED)
    );

    private final String value;

    ProductionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean canTransitionTo(ProductionStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isActive() {
        return this == QUEUED || this == BUILDING;
    }

    public static ProductionStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown production status: " + value));
    }
}
