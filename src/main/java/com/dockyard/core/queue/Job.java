package com.dockyard.core.queue;

import com.fasterxml.jackson.annotation.JsonRawValue;

import java.time.Instant;

/**
 * Snapshot of a row in the job table.
 * <p>
 * The lock fields ({@code lockedAt}, {@code lockExpiresAt}, {@code lockedBy}) are
 * set if and only if {@code state} is {@link JobState#RUNNING}. {@code dedupeActive}
 * is true while the job holds its dedupe slot, i.e. until it reaches a terminal state.
 *
 * @param payload JSON object text handed to the job handler
 */
public record Job(
        String id,
        String type,
        JobState state,
        @JsonRawValue String payload,
        String projectId,
        int priority,
        int attempts,
        int maxAttempts,
        Instant runAt,
        Instant lockedAt,
        Instant lockExpiresAt,
        String lockedBy,
        String dedupeKey,
        boolean dedupeActive,
        Instant cancelRequestedAt,
        Instant cancelledAt,
        String lastError,
        Instant createdAt,
        Instant updatedAt
) {

    public boolean isCancelRequested() {
        return cancelRequestedAt != null;
    }

    /**
     * True when the job is running but its lease ran out, i.e. the dispatcher
     * holding it is presumed dead.
     */
    public boolean isLeaseExpired(Instant now) {
        return state == JobState.RUNNING && lockExpiresAt != null && lockExpiresAt.isBefore(now);
    }
}
