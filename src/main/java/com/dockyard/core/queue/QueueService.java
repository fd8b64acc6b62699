package com.dockyard.core.queue;

import com.dockyard.core.queue.JobPayloads.ProjectPayload;
import com.dockyard.core.queue.JobPayloads.ReleasePayload;
import com.dockyard.core.queue.JobPayloads.ReleaseReadyPayload;
import com.dockyard.core.queue.JobPayloads.WaitReadyPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point for everything that creates, reads or administers jobs.
 * <p>
 * The typed {@code enqueue*} methods attach the project id and the per-type dedupe
 * key, so calling one twice while the first job is still active returns the same job.
 * Callers must not assume they get a fresh id back.
 */
@Service
public class QueueService {

    private static final Logger log = LoggerFactory.getLogger(QueueService.class);

    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final int MAX_PAGE_SIZE = 500;

    private final JobStore store;
    private final QueueProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public QueueService(JobStore store, QueueProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ── Enqueue ─────────────────────────────────────────────────────────

    public Job enqueue(String type, Object payload, EnqueueOptions options) {
        Job job = store.enqueue(type, toJson(payload), options, properties.getDefaultMaxAttempts(), clock.instant());
        log.debug("Enqueued job {} type={} project={} dedupe={}", job.id(), type, options.projectId(), options.dedupeKey());
        return job;
    }

    public Job enqueueComposeUp(String projectId, String reason) {
        return enqueueForProject(JobType.DOCKER_COMPOSE_UP, projectId, new ProjectPayload(projectId, reason));
    }

    public Job enqueueWaitReady(String projectId, Instant startedAt) {
        return enqueueForProject(JobType.DOCKER_WAIT_READY, projectId,
                new WaitReadyPayload(projectId, startedAt.toEpochMilli()));
    }

    /**
     * Enqueues a container stop. Pending start work for the project is cancelled
     * first: queued start jobs directly, running ones cooperatively.
     */
    public Job enqueueDockerStop(String projectId, String reason) {
        int cancelled = cancelActiveJobs(projectId, JobType.PREVIEW_START);
        if (cancelled > 0) {
            log.info("Cancelled {} pending start job(s) for project {} before stop", cancelled, projectId);
        }
        return enqueueForProject(JobType.DOCKER_STOP, projectId, new ProjectPayload(projectId, reason));
    }

    public Job enqueueSessionCreate(String projectId, String reason) {
        return enqueueForProject(JobType.RUNTIME_SESSION_CREATE, projectId, new ProjectPayload(projectId, reason));
    }

    public Job enqueueProductionBuild(String projectId) {
        // A single failed build step is terminal for the deployment; the user redeploys.
        return enqueue(JobType.PRODUCTION_BUILD.wireName(), new ProjectPayload(projectId, "deploy"),
                EnqueueOptions.forProject(projectId, JobType.PRODUCTION_BUILD.dedupeKey(projectId)).withMaxAttempts(1));
    }

    public Job enqueueProductionStart(String projectId, String hash) {
        return enqueue(JobType.PRODUCTION_START.wireName(), new ReleasePayload(projectId, hash),
                EnqueueOptions.forProject(projectId, JobType.PRODUCTION_START.dedupeKey(projectId)).withMaxAttempts(1));
    }

    public Job enqueueProductionWaitReady(String projectId, String hash, int port, String previousHash,
                                          Instant startedAt) {
        return enqueue(JobType.PRODUCTION_WAIT_READY.wireName(),
                new ReleaseReadyPayload(projectId, hash, port, previousHash, startedAt.toEpochMilli()),
                EnqueueOptions.forProject(projectId, JobType.PRODUCTION_WAIT_READY.dedupeKey(projectId)).withMaxAttempts(1));
    }

    public Job enqueueProductionStop(String projectId) {
        return enqueueForProject(JobType.PRODUCTION_STOP, projectId, new ProjectPayload(projectId, "stop"));
    }

    private Job enqueueForProject(JobType type, String projectId, Object payload) {
        return enqueue(type.wireName(), payload, EnqueueOptions.forProject(projectId, type.dedupeKey(projectId)));
    }

    // ── Read ────────────────────────────────────────────────────────────

    public JobPage listJobs(JobFilter filter, int page, int pageSize) {
        int safePage = Math.max(1, page);
        int safeSize = pageSize <= 0 ? DEFAULT_PAGE_SIZE : Math.min(pageSize, MAX_PAGE_SIZE);
        List<Job> jobs = store.list(filter, safeSize, (safePage - 1) * safeSize);
        return JobPage.of(jobs, store.count(filter), safePage, safeSize);
    }

    public long countJobs(JobFilter filter) {
        return store.count(filter);
    }

    public Job getJob(String id) {
        return store.findById(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    public Optional<Job> latestFailure(String projectId) {
        return store.findLatestFailed(projectId);
    }

    public boolean hasActiveJobs(String projectId, Set<JobType> types) {
        return !store.findActive(projectId, wireNames(types)).isEmpty();
    }

    public int countRunning() {
        return store.countRunning();
    }

    // ── Administrative actions ──────────────────────────────────────────

    /**
     * Cancels a queued job immediately, or flags a running job for cooperative cancellation.
     */
    public Job cancel(String id) {
        Job job = getJob(id);
        Instant now = clock.instant();
        boolean applied = switch (job.state()) {
            case QUEUED -> store.cancelQueued(id, now);
            case RUNNING -> store.requestCancel(id, now);
            default -> throw new InvalidJobStateException("Job " + id + " is already " + job.state().value());
        };
        if (!applied) {
            throw new InvalidJobStateException("Job " + id + " changed state while cancelling; retry the request");
        }
        log.info("Cancel {} for job {} ({})", job.state() == JobState.QUEUED ? "applied" : "requested", id, job.type());
        return getJob(id);
    }

    /**
     * Resubmits a failed or cancelled job as a brand-new job id.
     */
    public Job retry(String id) {
        Job job = getJob(id);
        if (job.state() != JobState.FAILED && job.state() != JobState.CANCELLED) {
            throw new InvalidJobStateException("Only failed or cancelled jobs can be retried; job " + id
                    + " is " + job.state().value());
        }
        var options = new EnqueueOptions(job.projectId(), job.priority(), job.dedupeKey(), null, job.maxAttempts());
        Job copy = store.enqueue(job.type(), job.payload(), options, properties.getDefaultMaxAttempts(), clock.instant());
        log.info("Job {} resubmitted as {}", id, copy.id());
        return copy;
    }

    public Job runNow(String id) {
        Job job = getJob(id);
        if (job.state() != JobState.QUEUED || !store.runNow(id, clock.instant())) {
            throw new InvalidJobStateException("Only queued jobs can be run now; job " + id + " is " + job.state().value());
        }
        return getJob(id);
    }

    /**
     * Releases a job whose dispatcher is presumed dead. Rejected unless the job is
     * running and its lease has expired.
     */
    public Job forceUnlock(String id) {
        Job job = getJob(id);
        Instant now = clock.instant();
        if (!job.isLeaseExpired(now) || !store.forceUnlock(id, now)) {
            throw new InvalidJobStateException("Job " + id + " is not locked past its lease");
        }
        log.warn("Force-unlocked job {} ({}) previously held by {}", id, job.type(), job.lockedBy());
        return getJob(id);
    }

    public void deleteJob(String id) {
        Job job = getJob(id);
        if (!job.state().isTerminal() || !store.delete(id)) {
            throw new InvalidJobStateException("Only terminal jobs can be deleted; job " + id + " is " + job.state().value());
        }
    }

    public int deleteJobsByState(JobState state) {
        if (!state.isTerminal()) {
            throw new InvalidJobStateException("Cannot delete jobs in non-terminal state " + state.value());
        }
        int deleted = store.deleteByState(state);
        log.info("Deleted {} {} job(s)", deleted, state.value());
        return deleted;
    }

    /**
     * Cancels every non-terminal job of the given types for a project.
     *
     * @return number of jobs cancelled or flagged for cancellation
     */
    public int cancelActiveJobs(String projectId, Set<JobType> types) {
        Instant now = clock.instant();
        int count = 0;
        for (Job job : store.findActive(projectId, wireNames(types))) {
            boolean applied = job.state() == JobState.QUEUED
                    ? store.cancelQueued(job.id(), now)
                    : store.requestCancel(job.id(), now);
            if (applied) {
                count++;
            }
        }
        return count;
    }

    public QueueSettings getSettings() {
        return store.getSettings();
    }

    public QueueSettings setConcurrency(int concurrency) {
        QueueSettings updated = store.getSettings().withConcurrency(concurrency);
        store.saveSettings(updated);
        return updated;
    }

    public QueueSettings setPaused(boolean paused) {
        QueueSettings updated = store.getSettings().withPaused(paused);
        store.saveSettings(updated);
        log.info("Queue {}", paused ? "paused" : "resumed");
        return updated;
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    private static Set<String> wireNames(Set<JobType> types) {
        return types.stream().map(JobType::wireName).collect(Collectors.toSet());
    }

    /**
     * Payloads are always written through the mapper so the stored text is valid JSON;
     * a plain string becomes a JSON string literal.
     */
    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload != null ? payload : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
