package com.dockyard.core.ports;

import java.util.List;
import java.util.Optional;

/**
 * Persistent registry of port allocations.
 * Implementations: {@link JdbcPortStore} and {@link InMemoryPortStore}.
 */
public interface PortStore {

    Optional<PortAllocation> findByPort(int port);

    Optional<PortAllocation> findByProject(String projectId, PortType portType);

    List<PortAllocation> listByProject(String projectId);

    /**
     * Inserts an allocation.
     *
     * @throws PortConflictException if the port is already registered
     */
    PortAllocation register(PortAllocation allocation);

    boolean unregister(int port);
}
