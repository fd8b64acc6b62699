package com.dockyard.core.queue;

import java.time.Duration;

/**
 * Thrown by a handler to put its job back in the queue after {@code delay}
 * without consuming an attempt. Used by handlers that poll an external
 * condition, such as waiting for a container to answer.
 */
public class RescheduleException extends RuntimeException {

    private final Duration delay;

    public RescheduleException(Duration delay, String reason) {
        super(reason);
        this.delay = delay;
    }

    public Duration getDelay() {
        return delay;
    }
}
