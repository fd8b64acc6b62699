package com.dockyard.core.ports;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Issues ports for preview containers and production deployments.
 * <ul>
 *   <li>{@link #allocatePort()}: whatever the OS hands out for port 0.</li>
 *   <li>{@link #allocateProjectBasePort(String)}: deterministic per project in
 *       {@value #BASE_PORT_START}-{@value #BASE_PORT_END}, linear-probing past ports that
 *       are registered or bound, persisted so repeated calls return the same port.</li>
 *   <li>{@link #deriveVersionPort(String, String)}: pure function into
 *       {@value #VERSION_PORT_START}-{@value #VERSION_PORT_END}; callers register it.</li>
 * </ul>
 */
public class PortAllocator {

    private static final Logger log = LoggerFactory.getLogger(PortAllocator.class);

    public static final int BASE_PORT_START = 3000;
    public static final int BASE_PORT_END = 3999;
    public static final int VERSION_PORT_START = 5000;
    public static final int VERSION_PORT_END = 5999;

    private final PortStore store;
    private final PortProbe probe;
    private final Clock clock;

    public PortAllocator(PortStore store, PortProbe probe, Clock clock) {
        this.store = store;
        this.probe = probe;
        this.clock = clock;
    }

    public int allocatePort() {
        return probe.ephemeralPort();
    }

    /**
     * Returns the project's base port, allocating and persisting it on first use.
     *
     * @throws PortExhaustedException if no port in the base range is free
     */
    public synchronized int allocateProjectBasePort(String projectId) {
        Optional<PortAllocation> existing = store.findByProject(projectId, PortType.BASE);
        if (existing.isPresent()) {
            return existing.get().port();
        }

        int range = BASE_PORT_END - BASE_PORT_START + 1;
        int offset = hashToRange(projectId, range);
        for (int i = 0; i < range; i++) {
            int candidate = BASE_PORT_START + (offset + i) % range;
            Optional<PortAllocation> holder = store.findByPort(candidate);
            if (holder.isPresent()) {
                if (projectId.equals(holder.get().projectId()) && holder.get().portType() == PortType.BASE) {
                    return candidate;
                }
                continue;
            }
            if (!probe.isAvailable(candidate)) {
                log.debug("Base port {} for project {} is bound by another process; probing", candidate, projectId);
                continue;
            }
            try {
                registerPort(candidate, PortType.BASE, projectId, null);
            } catch (PortConflictException e) {
                // Registered concurrently by another process
                continue;
            }
            if (i > 0) {
                log.info("Project {} base port {} (preferred {} was taken)", projectId, candidate, BASE_PORT_START + offset);
            } else {
                log.info("Project {} base port {}", projectId, candidate);
            }
            return candidate;
        }
        throw new PortExhaustedException("No free base port in range " + BASE_PORT_START + "-" + BASE_PORT_END);
    }

    /**
     * Deterministic internal port for one deployed build. Performs no I/O.
     */
    public static int deriveVersionPort(String projectId, String hash) {
        int range = VERSION_PORT_END - VERSION_PORT_START + 1;
        return VERSION_PORT_START + hashToRange(projectId + ":" + hash, range);
    }

    /**
     * Persists an allocation. Registering a port that the same owner already holds is a no-op.
     *
     * @throws PortConflictException if the port belongs to someone else
     */
    public PortAllocation registerPort(int port, PortType portType, String projectId, String hash) {
        Optional<PortAllocation> existing = store.findByPort(port);
        if (existing.isPresent()) {
            PortAllocation held = existing.get();
            if (held.portType() == portType && held.isOwnedBy(projectId, hash)) {
                return held;
            }
            throw new PortConflictException("Port " + port + " is already registered to project "
                    + held.projectId() + " (" + held.portType().value() + ")");
        }
        Instant now = clock.instant();
        return store.register(new PortAllocation(port, portType, projectId, hash, now, now));
    }

    public boolean unregisterPort(int port) {
        boolean removed = store.unregister(port);
        if (removed) {
            log.debug("Port {} unregistered", port);
        }
        return removed;
    }

    public List<PortAllocation> listPorts(String projectId) {
        return store.listByProject(projectId);
    }

    /**
     * Releases every version port registered for one of {@code hashes}.
     *
     * @return number of ports released
     */
    public int unregisterVersionPorts(String projectId, Collection<String> hashes) {
        int released = 0;
        for (PortAllocation allocation : store.listByProject(projectId)) {
            if (allocation.portType() == PortType.VERSION && hashes.contains(allocation.hash())
                    && store.unregister(allocation.port())) {
                released++;
            }
        }
        if (released > 0) {
            log.debug("Released {} version port(s) for project {}", released, projectId);
        }
        return released;
    }

    /**
     * 32-bit string hash ({@code h * 31 + c}) folded into {@code [0, range)}.
     */
    static int hashToRange(String value, int range) {
        int hash = value.hashCode();
        return (int) (Math.abs((long) hash) % range);
    }
}
