package com.dockyard.core.production;

public class RollbackFailedException extends RuntimeException {
    public RollbackFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
