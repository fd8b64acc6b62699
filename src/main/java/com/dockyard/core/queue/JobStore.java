package com.dockyard.core.queue;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for jobs and the singleton {@link QueueSettings}.
 * <p>
 * Every state mutation is a conditional update: it only applies when the row is
 * still in the expected state (and, for dispatcher-owned transitions, still
 * locked by the calling worker). The boolean results report whether the update
 * applied, so several dispatcher instances can share one store safely.
 * Implementations: {@link JdbcJobStore} (PostgreSQL) and {@link InMemoryJobStore}.
 */
public interface JobStore {

    /**
     * Inserts a queued job. When {@code options.dedupeKey()} is held by an active
     * job, returns that job instead of inserting a new one.
     */
    Job enqueue(String type, String payload, EnqueueOptions options, int defaultMaxAttempts, Instant now);

    Optional<Job> findById(String id);

    List<Job> list(JobFilter filter, int limit, int offset);

    long count(JobFilter filter);

    int countRunning();

    /** Non-terminal jobs of the given types for a project. */
    List<Job> findActive(String projectId, Collection<String> types);

    /** Most recently updated failed job for a project. */
    Optional<Job> findLatestFailed(String projectId);

    // ── Dispatcher transitions ──────────────────────────────────────

    /**
     * Claims up to {@code limit} runnable jobs, ordered by priority desc then runAt asc,
     * skipping jobs whose project already has a running job.
     */
    List<Job> claim(int limit, String workerId, Instant now, Duration lease);

    boolean renewLease(String id, String workerId, Instant lockExpiresAt, Instant now);

    boolean markSucceeded(String id, String workerId, Instant now);

    boolean markFailed(String id, String workerId, int attempts, String error, Instant now);

    /** Back to queued after a handler error, with the attempt counted. */
    boolean retryLater(String id, String workerId, int attempts, Instant runAt, String error, Instant now);

    /** Back to queued without counting an attempt. */
    boolean reschedule(String id, String workerId, Instant runAt, Instant now);

    boolean markCancelled(String id, String workerId, Instant now);

    /** Requeues running jobs whose lease expired before {@code now}. */
    int recoverExpired(Instant now);

    // ── Administrative transitions ──────────────────────────────────

    boolean cancelQueued(String id, Instant now);

    boolean requestCancel(String id, Instant now);

    boolean isCancelRequested(String id);

    /** Resets a running job whose lease expired back to queued. */
    boolean forceUnlock(String id, Instant now);

    boolean runNow(String id, Instant now);

    /** Deletes a job only if it is terminal. */
    boolean delete(String id);

    int deleteByState(JobState state);

    // ── Settings ────────────────────────────────────────────────────

    QueueSettings getSettings();

    void saveSettings(QueueSettings settings);
}
