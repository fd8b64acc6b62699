package com.dockyard.core.ports;

/**
 * Thrown when every port in an allocation range is registered or bound.
 */
public class PortExhaustedException extends RuntimeException {
    public PortExhaustedException(String message) {
        super(message);
    }
}
