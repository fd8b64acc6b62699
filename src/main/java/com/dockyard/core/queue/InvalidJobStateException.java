package com.dockyard.core.queue;

/**
 * Thrown when an action is not legal for the job's current state,
 * e.g. deleting a running job or force-unlocking a job whose lease is still valid.
 */
public class InvalidJobStateException extends RuntimeException {
    public InvalidJobStateException(String message) {
        super(message);
    }
}
