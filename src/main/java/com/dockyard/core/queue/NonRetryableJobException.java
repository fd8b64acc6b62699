package com.dockyard.core.queue;

/**
 * Marks a handler failure that must not be retried, such as a precondition
 * violation. The job goes straight to failed regardless of remaining attempts.
 */
public class NonRetryableJobException extends RuntimeException {
    public NonRetryableJobException(String message) {
        super(message);
    }

    public NonRetryableJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
