package com.dockyard.core.ports;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Non-durable {@link PortStore} used when no DataSource is configured and in tests.
 */
public class InMemoryPortStore implements PortStore {

    private final Map<Integer, PortAllocation> allocations = new TreeMap<>();

    @Override
    public synchronized Optional<PortAllocation> findByPort(int port) {
        return Optional.ofNullable(allocations.get(port));
    }

    @Override
    public synchronized Optional<PortAllocation> findByProject(String projectId, PortType portType) {
        return allocations.values().stream()
                .filter(a -> a.portType() == portType && projectId.equals(a.projectId()))
                .min(Comparator.comparing(PortAllocation::createdAt));
    }

    @Override
    public synchronized List<PortAllocation> listByProject(String projectId) {
        return allocations.values().stream()
                .filter(a -> projectId.equals(a.projectId()))
                .toList();
    }

    @Override
    public synchronized PortAllocation register(PortAllocation allocation) {
        if (allocations.containsKey(allocation.port())) {
            throw new PortConflictException("Port " + allocation.port() + " is already registered");
        }
        allocations.put(allocation.port(), allocation);
        return allocation;
    }

    @Override
    public synchronized boolean unregister(int port) {
        return allocations.remove(port) != null;
    }
}
