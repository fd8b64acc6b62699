package com.dockyard.core.queue;

import java.time.Instant;

/**
 * Optional parameters for {@link JobStore#enqueue}.
 *
 * @param runAt       earliest time the job may be claimed; {@code null} means now
 * @param maxAttempts {@code null} means the configured default
 */
public record EnqueueOptions(
        String projectId,
        int priority,
        String dedupeKey,
        Instant runAt,
        Integer maxAttempts
) {

    public static EnqueueOptions defaults() {
        return new EnqueueOptions(null, 0, null, null, null);
    }

    public static EnqueueOptions forProject(String projectId, String dedupeKey) {
        return new EnqueueOptions(projectId, 0, dedupeKey, null, null);
    }

    public EnqueueOptions withPriority(int priority) {
        return new EnqueueOptions(projectId, priority, dedupeKey, runAt, maxAttempts);
    }

    public EnqueueOptions withMaxAttempts(int maxAttempts) {
        return new EnqueueOptions(projectId, priority, dedupeKey, runAt, maxAttempts);
    }

    public EnqueueOptions withRunAt(Instant runAt) {
        return new EnqueueOptions(projectId, priority, dedupeKey, runAt, maxAttempts);
    }
}
