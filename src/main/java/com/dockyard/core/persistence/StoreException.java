package com.dockyard.core.persistence;

/**
 * Unchecked wrapper for SQL failures in the JDBC stores.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
