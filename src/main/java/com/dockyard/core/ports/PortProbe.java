package com.dockyard.core.ports;

/**
 * Access to the host's TCP ports.
 */
public interface PortProbe {

    /** True when nothing is listening on the port on the loopback interface. */
    boolean isAvailable(int port);

    /** Binds port 0, releases it and returns the port the OS assigned. */
    int ephemeralPort();
}
