package com.dockyard.core.queue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Non-durable {@link JobStore} used when no DataSource is configured and in tests.
 * All methods synchronize on the store, which gives the same atomicity as the
 * conditional updates of {@link JdbcJobStore}.
 */
public class InMemoryJobStore implements JobStore {

    private final Map<String, Row> rows = new LinkedHashMap<>();
    private QueueSettings settings = QueueSettings.defaults();

    @Override
    public synchronized Job enqueue(String type, String payload, EnqueueOptions options,
                                    int defaultMaxAttempts, Instant now) {
        if (options.dedupeKey() != null) {
            for (Row row : rows.values()) {
                if (row.dedupeActive && options.dedupeKey().equals(row.dedupeKey)) {
                    return row.toJob();
                }
            }
        }
        Row row = new Row();
        row.id = UUID.randomUUID().toString();
        row.type = type;
        row.state = JobState.QUEUED;
        row.payload = payload;
        row.projectId = options.projectId();
        row.priority = options.priority();
        row.maxAttempts = options.maxAttempts() != null ? options.maxAttempts() : defaultMaxAttempts;
        row.runAt = options.runAt() != null ? options.runAt() : now;
        row.dedupeKey = options.dedupeKey();
        row.dedupeActive = options.dedupeKey() != null;
        row.createdAt = now;
        row.updatedAt = now;
        rows.put(row.id, row);
        return row.toJob();
    }

    @Override
    public synchronized Optional<Job> findById(String id) {
        return Optional.ofNullable(rows.get(id)).map(Row::toJob);
    }

    @Override
    public synchronized List<Job> list(JobFilter filter, int limit, int offset) {
        return rows.values().stream()
                .map(Row::toJob)
                .filter(filter::matches)
                .sorted(Comparator.comparing(Job::createdAt).reversed())
                .skip(offset)
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized long count(JobFilter filter) {
        return rows.values().stream().map(Row::toJob).filter(filter::matches).count();
    }

    @Override
    public synchronized int countRunning() {
        return (int) rows.values().stream().filter(r -> r.state == JobState.RUNNING).count();
    }

    @Override
    public synchronized List<Job> findActive(String projectId, Collection<String> types) {
        return rows.values().stream()
                .filter(r -> projectId.equals(r.projectId))
                .filter(r -> !r.state.isTerminal())
                .filter(r -> types.contains(r.type))
                .map(Row::toJob)
                .toList();
    }

    @Override
    public synchronized Optional<Job> findLatestFailed(String projectId) {
        return rows.values().stream()
                .filter(r -> projectId.equals(r.projectId) && r.state == JobState.FAILED)
                .max(Comparator.comparing(r -> r.updatedAt))
                .map(Row::toJob);
    }

    @Override
    public synchronized List<Job> claim(int limit, String workerId, Instant now, Duration lease) {
        Set<String> busyProjects = new HashSet<>();
        for (Row row : rows.values()) {
            if (row.state == JobState.RUNNING && row.projectId != null) {
                busyProjects.add(row.projectId);
            }
        }
        List<Row> candidates = rows.values().stream()
                .filter(r -> r.state == JobState.QUEUED)
                .filter(r -> !r.runAt.isAfter(now))
                .filter(r -> r.lockExpiresAt == null || r.lockExpiresAt.isBefore(now))
                .sorted(Comparator.comparingInt((Row r) -> r.priority).reversed()
                        .thenComparing(r -> r.runAt))
                .toList();

        List<Job> claimed = new ArrayList<>();
        for (Row row : candidates) {
            if (claimed.size() >= limit) {
                break;
            }
            if (row.projectId != null && !busyProjects.add(row.projectId)) {
                continue;
            }
            row.state = JobState.RUNNING;
            row.lockedAt = now;
            row.lockExpiresAt = now.plus(lease);
            row.lockedBy = workerId;
            row.updatedAt = now;
            claimed.add(row.toJob());
        }
        return claimed;
    }

    @Override
    public synchronized boolean renewLease(String id, String workerId, Instant lockExpiresAt, Instant now) {
        Row row = ownedRunning(id, workerId);
        if (row == null) return false;
        row.lockExpiresAt = lockExpiresAt;
        row.updatedAt = now;
        return true;
    }

    @Override
    public synchronized boolean markSucceeded(String id, String workerId, Instant now) {
        Row row = ownedRunning(id, workerId);
        if (row == null) return false;
        row.finish(JobState.SUCCEEDED, now);
        return true;
    }

    @Override
    public synchronized boolean markFailed(String id, String workerId, int attempts, String error, Instant now) {
        Row row = ownedRunning(id, workerId);
        if (row == null) return false;
        row.attempts = attempts;
        row.lastError = error;
        row.finish(JobState.FAILED, now);
        return true;
    }

    @Override
    public synchronized boolean retryLater(String id, String workerId, int attempts, Instant runAt,
                                           String error, Instant now) {
        Row row = ownedRunning(id, workerId);
        if (row == null) return false;
        row.attempts = attempts;
        row.lastError = error;
        row.requeue(runAt, now);
        return true;
    }

    @Override
    public synchronized boolean reschedule(String id, String workerId, Instant runAt, Instant now) {
        Row row = ownedRunning(id, workerId);
        if (row == null) return false;
        row.requeue(runAt, now);
        return true;
    }

    @Override
    public synchronized boolean markCancelled(String id, String workerId, Instant now) {
        Row row = ownedRunning(id, workerId);
        if (row == null) return false;
        row.cancelledAt = now;
        row.finish(JobState.CANCELLED, now);
        return true;
    }

    @Override
    public synchronized int recoverExpired(Instant now) {
        int recovered = 0;
        for (Row row : rows.values()) {
            if (row.state == JobState.RUNNING && row.lockExpiresAt != null && row.lockExpiresAt.isBefore(now)) {
                row.requeue(now, now);
                recovered++;
            }
        }
        return recovered;
    }

    @Override
    public synchronized boolean cancelQueued(String id, Instant now) {
        Row row = rows.get(id);
        if (row == null || row.state != JobState.QUEUED) return false;
        row.cancelledAt = now;
        row.finish(JobState.CANCELLED, now);
        return true;
    }

    @Override
    public synchronized boolean requestCancel(String id, Instant now) {
        Row row = rows.get(id);
        if (row == null || row.state != JobState.RUNNING) return false;
        if (row.cancelRequestedAt == null) {
            row.cancelRequestedAt = now;
        }
        row.updatedAt = now;
        return true;
    }

    @Override
    public synchronized boolean isCancelRequested(String id) {
        Row row = rows.get(id);
        return row != null && row.cancelRequestedAt != null;
    }

    @Override
    public synchronized boolean forceUnlock(String id, Instant now) {
        Row row = rows.get(id);
        if (row == null || row.state != JobState.RUNNING
                || row.lockExpiresAt == null || !row.lockExpiresAt.isBefore(now)) {
            return false;
        }
        row.requeue(now, now);
        return true;
    }

    @Override
    public synchronized boolean runNow(String id, Instant now) {
        Row row = rows.get(id);
        if (row == null || row.state != JobState.QUEUED) return false;
        row.runAt = Instant.EPOCH;
        row.updatedAt = now;
        return true;
    }

    @Override
    public synchronized boolean delete(String id) {
        Row row = rows.get(id);
        if (row == null || !row.state.isTerminal()) return false;
        rows.remove(id);
        return true;
    }

    @Override
    public synchronized int deleteByState(JobState state) {
        if (!state.isTerminal()) {
            return 0;
        }
        int before = rows.size();
        rows.values().removeIf(r -> r.state == state);
        return before - rows.size();
    }

    @Override
    public synchronized QueueSettings getSettings() {
        return settings;
    }

    @Override
    public synchronized void saveSettings(QueueSettings settings) {
        this.settings = Objects.requireNonNull(settings);
    }

    private Row ownedRunning(String id, String workerId) {
        Row row = rows.get(id);
        if (row == null || row.state != JobState.RUNNING || !workerId.equals(row.lockedBy)) {
            return null;
        }
        return row;
    }

    private static final class Row {
        String id;
        String type;
        JobState state;
        String payload;
        String projectId;
        int priority;
        int attempts;
        int maxAttempts;
        Instant runAt;
        Instant lockedAt;
        Instant lockExpiresAt;
        String lockedBy;
        String dedupeKey;
        boolean dedupeActive;
        Instant cancelRequestedAt;
        Instant cancelledAt;
        String lastError;
        Instant createdAt;
        Instant updatedAt;

        void finish(JobState terminal, Instant now) {
            state = terminal;
            clearLock();
            dedupeActive = false;
            updatedAt = now;
        }

        void requeue(Instant nextRunAt, Instant now) {
            state = JobState.QUEUED;
            runAt = nextRunAt;
            clearLock();
            updatedAt = now;
        }

        void clearLock() {
            lockedAt = null;
            lockExpiresAt = null;
            lockedBy = null;
        }

        Job toJob() {
            return new Job(id, type, state, payload, projectId, priority, attempts, maxAttempts,
                    runAt, lockedAt, lockExpiresAt, lockedBy, dedupeKey, dedupeActive,
                    cancelRequestedAt, cancelledAt, lastError, createdAt, updatedAt);
        }
    }
}
