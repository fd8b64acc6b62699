package com.dockyard.core.queue;

/**
 * Singleton dispatcher settings, read on every claim cycle.
 */
public record QueueSettings(boolean paused, int concurrency) {

    public static final int MIN_CONCURRENCY = 1;
    public static final int MAX_CONCURRENCY = 20;
    public static final int DEFAULT_CONCURRENCY = 2;

    public QueueSettings {
        if (concurrency < MIN_CONCURRENCY || concurrency > MAX_CONCURRENCY) {
            throw new IllegalArgumentException("Concurrency must be between "
                    + MIN_CONCURRENCY + " and " + MAX_CONCURRENCY + ", got " + concurrency);
        }
    }

    public static QueueSettings defaults() {
        return new QueueSettings(false, DEFAULT_CONCURRENCY);
    }

    public QueueSettings withPaused(boolean paused) {
        return new QueueSettings(paused, concurrency);
    }

    public QueueSettings withConcurrency(int concurrency) {
        return new QueueSettings(paused, concurrency);
    }
}
