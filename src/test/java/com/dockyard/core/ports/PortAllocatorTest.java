package com.dockyard.core.ports;

import com.dockyard.core.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PortAllocatorTest {

    /** Hashes to offset 42, i.e. preferred base port 3042. */
    private static final String PROJECT = "site221";

    private InMemoryPortStore store;
    private FakePortProbe probe;
    private PortAllocator allocator;

    @BeforeEach
    void setUp() {
        store = new InMemoryPortStore();
        probe = new FakePortProbe();
        allocator = new PortAllocator(store, probe, MutableClock.startingAt("2026-03-01T10:00:00Z"));
    }

    @Nested
    @DisplayName("allocateProjectBasePort")
    class BasePortTests {

        @Test
        @DisplayName("hashes the project id into the base range")
        void deterministicPort() {
            assertEquals(3042, allocator.allocateProjectBasePort(PROJECT));
        }

        @Test
        @DisplayName("returns the same port on repeated calls")
        void stable() {
            int first = allocator.allocateProjectBasePort(PROJECT);
            int second = allocator.allocateProjectBasePort(PROJECT);
            assertEquals(first, second);
            assertEquals(1, store.listByProject(PROJECT).size());
        }

        @Test
        @DisplayName("probes past a port registered to another project")
        void probesPastRegistered() {
            allocator.registerPort(3042, PortType.BASE, "someone-else", null);
            assertEquals(3043, allocator.allocateProjectBasePort(PROJECT));
        }

        @Test
        @DisplayName("probes past a port bound by another process")
        void probesPastBound() {
            probe.bind(3042, 3043);
            assertEquals(3044, allocator.allocateProjectBasePort(PROJECT));
        }

        @Test
        @DisplayName("wraps around to the start of the range")
        void wrapsAround() {
            for (int port = 3042; port <= PortAllocator.BASE_PORT_END; port++) {
                probe.bind(port);
            }
            assertEquals(PortAllocator.BASE_PORT_START, allocator.allocateProjectBasePort(PROJECT));
        }

        @Test
        @DisplayName("fails when every base port is taken")
        void exhausted() {
            for (int port = PortAllocator.BASE_PORT_START; port <= PortAllocator.BASE_PORT_END; port++) {
                probe.bind(port);
            }
            assertThrows(PortExhaustedException.class, () -> allocator.allocateProjectBasePort(PROJECT));
        }

        @Test
        @DisplayName("distinct projects never share a registered port")
        void distinctProjects() {
            Set<Integer> ports = new HashSet<>();
            for (int i = 0; i < 200; i++) {
                assertTrue(ports.add(allocator.allocateProjectBasePort("project-" + i)));
            }
        }
    }

    @Nested
    @DisplayName("version ports")
    class VersionPortTests {

        @Test
        @DisplayName("deriveVersionPort is deterministic and in range")
        void deriveVersionPort() {
            int port = PortAllocator.deriveVersionPort(PROJECT, "abcd1234");
            assertEquals(port, PortAllocator.deriveVersionPort(PROJECT, "abcd1234"));
            assertTrue(port >= PortAllocator.VERSION_PORT_START && port <= PortAllocator.VERSION_PORT_END);
        }

        @Test
        @DisplayName("deriveVersionPort does not touch the store")
        void noSideEffects() {
            PortAllocator.deriveVersionPort(PROJECT, "abcd1234");
            assertTrue(store.listByProject(PROJECT).isEmpty());
        }

        @Test
        @DisplayName("unregisterVersionPorts releases only the given hashes")
        void unregisterVersionPorts() {
            allocator.registerPort(5001, PortType.VERSION, PROJECT, "h1");
            allocator.registerPort(5002, PortType.VERSION, PROJECT, "h2");
            allocator.allocateProjectBasePort(PROJECT);

            assertEquals(1, allocator.unregisterVersionPorts(PROJECT, List.of("h1", "unknown")));

            List<PortAllocation> remaining = allocator.listPorts(PROJECT);
            assertEquals(2, remaining.size());
            assertTrue(remaining.stream().noneMatch(a -> "h1".equals(a.hash())));
        }
    }

    @Nested
    @DisplayName("registerPort")
    class RegisterTests {

        @Test
        @DisplayName("re-registering by the same owner is a no-op")
        void idempotent() {
            PortAllocation first = allocator.registerPort(5100, PortType.VERSION, PROJECT, "h1");
            PortAllocation second = allocator.registerPort(5100, PortType.VERSION, PROJECT, "h1");
            assertEquals(first, second);
        }

        @Test
        @DisplayName("a port owned by someone else conflicts")
        void conflict() {
            allocator.registerPort(5100, PortType.VERSION, PROJECT, "h1");
            assertThrows(PortConflictException.class,
                    () -> allocator.registerPort(5100, PortType.VERSION, PROJECT, "h2"));
            assertThrows(PortConflictException.class,
                    () -> allocator.registerPort(5100, PortType.VERSION, "other", "h1"));
        }

        @Test
        @DisplayName("unregister frees the port for reuse")
        void unregister() {
            allocator.registerPort(5100, PortType.VERSION, PROJECT, "h1");
            assertTrue(allocator.unregisterPort(5100));
            assertFalse(allocator.unregisterPort(5100));
            allocator.registerPort(5100, PortType.VERSION, "other", "h9");
        }
    }

    @Test
    @DisplayName("allocatePort returns what the OS assigns")
    void allocatePort() {
        assertEquals(40000, allocator.allocatePort());
        assertEquals(40001, allocator.allocatePort());
    }
}
