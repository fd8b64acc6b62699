package com.dockyard.core.ports;

/**
 * Thrown when a port is already registered to a different owner.
 * Resolving it requires re-allocation by an operator.
 */
public class PortConflictException extends RuntimeException {
    public PortConflictException(String message) {
        super(message);
    }
}
