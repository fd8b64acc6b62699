package com.dockyard.core.ports;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum PortType {
    /** Stable public port of a project's production deployment. */
    BASE("base"),
    /** Internal port of one deployed build. */
    VERSION("version"),
    /** OS-assigned port for preview and agent runtime containers. */
    DEV("dev");

    private final String value;

    PortType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static PortType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown port type: " + value));
    }
}
