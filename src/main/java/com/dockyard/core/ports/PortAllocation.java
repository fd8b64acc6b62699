package com.dockyard.core.ports;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted port reservation. {@code port} is unique across all allocations.
 *
 * @param hash release hash for {@link PortType#VERSION} ports, otherwise {@code null}
 */
public record PortAllocation(
        int port,
        PortType portType,
        String projectId,
        String hash,
        Instant createdAt,
        Instant updatedAt
) {

    public boolean isOwnedBy(String projectId, String hash) {
        return Objects.equals(this.projectId, projectId)
                && Objects.equals(this.hash, hash);
    }
}
