package com.dockyard.core.project;

import com.dockyard.core.production.ProductionState;

import java.time.Instant;

/**
 * A tenant project: one preview environment plus one production deployment.
 *
 * @param path       host directory holding the project sources
 * @param devPort    host port of the preview server
 * @param runtimePort host port of the agent runtime
 */
public record Project(
        String id,
        String name,
        String path,
        ProjectStatus status,
        Integer devPort,
        Integer runtimePort,
        String bootstrapSessionId,
        ProductionState production,
        Instant createdAt,
        Instant updatedAt
) {

    public String previewUrl() {
        return devPort != null ? "http://127.0.0.1:" + devPort : null;
    }
}
