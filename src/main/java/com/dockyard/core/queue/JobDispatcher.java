package com.dockyard.core.queue;

import com.dockyard.core.logging.MdcContext;
import com.dockyard.core.metrics.OrchestratorMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Polls the {@link JobStore} at a fixed interval, claims runnable jobs within the
 * global concurrency limit and runs them on a worker pool.
 * <p>
 * Each cycle: when the queue is paused nothing is claimed (in-flight jobs keep
 * running); otherwise up to {@code concurrency - running} jobs are claimed with a
 * fresh lease. While a handler runs, its lease is renewed periodically. The
 * handler outcome decides the next state:
 * <ul>
 *   <li>success: succeeded, dedupe slot released</li>
 *   <li>{@link RescheduleException}: queued again after the requested delay, no attempt counted</li>
 *   <li>{@link JobCancelledException}: cancelled</li>
 *   <li>{@link NonRetryableJobException}: failed</li>
 *   <li>any other error: attempt counted, queued with backoff while attempts remain, else failed</li>
 * </ul>
 * Every transition is conditional on this dispatcher still holding the lock, so
 * a job that was force-unlocked and claimed elsewhere is never overwritten.
 */
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final JobStore store;
    private final QueueProperties properties;
    private final Map<String, JobHandler> handlers;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final OrchestratorMetrics metrics;
    private final Executor workers;
    private final String workerId;

    private final Map<String, Job> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2, r -> {
        Thread t = new Thread(r, "job-dispatcher");
        t.setDaemon(true);
        return t;
    });

    public JobDispatcher(JobStore store, QueueProperties properties, Collection<JobHandler> handlers,
                         ObjectMapper objectMapper, Clock clock, OrchestratorMetrics metrics) {
        this(store, properties, handlers, objectMapper, clock, metrics, newWorkerPool());
    }

    JobDispatcher(JobStore store, QueueProperties properties, Collection<JobHandler> handlers,
                  ObjectMapper objectMapper, Clock clock, OrchestratorMetrics metrics, Executor workers) {
        this.store = store;
        this.properties = properties;
        this.handlers = handlers.stream().collect(Collectors.toMap(JobHandler::type, Function.identity()));
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metrics = metrics;
        this.workers = workers;
        this.workerId = resolveHostName() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Starts polling. A dispatcher is single-use: its executors are shut down by
     * {@link #stop()}, so starting it again is rejected.
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Job dispatcher " + workerId + " was stopped and cannot be restarted");
        }
        if (!properties.isEnabled()) {
            log.info("Job dispatcher disabled (dockyard.queue.enabled=false)");
            return;
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        if (properties.isRecoverExpiredOnStartup()) {
            int recovered = store.recoverExpired(clock.instant());
            if (recovered > 0) {
                log.warn("Requeued {} job(s) with expired leases", recovered);
            }
        }
        long pollMs = properties.getPollInterval().toMillis();
        long renewMs = properties.getLeaseRenewInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::safePoll, 0, pollMs, TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(this::renewLeases, renewMs, renewMs, TimeUnit.MILLISECONDS);
        log.info("Job dispatcher {} started (poll={}ms, lease={}s, handlers={})",
                workerId, pollMs, properties.getLeaseDuration().toSeconds(), handlers.keySet());
    }

    public void stop() {
        stopped.set(true);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (workers instanceof ExecutorService pool) {
            pool.shutdown();
        }
        started.set(false);
        if (!inFlight.isEmpty()) {
            log.warn("Job dispatcher stopped with {} job(s) in flight; their leases will expire", inFlight.size());
        } else {
            log.info("Job dispatcher {} stopped", workerId);
        }
    }

    /**
     * Runs one claim cycle.
     *
     * @return number of jobs claimed and handed to workers
     */
    public int pollOnce() {
        QueueSettings settings = store.getSettings();
        if (settings.paused()) {
            log.trace("Queue paused; skipping claim cycle");
            return 0;
        }
        int slots = settings.concurrency() - store.countRunning();
        if (slots <= 0) {
            return 0;
        }

        Instant now = clock.instant();
        List<Job> claimed = store.claim(slots, workerId, now, properties.getLeaseDuration());
        if (claimed.isEmpty()) {
            return 0;
        }
        if (metrics != null) {
            metrics.recordJobsClaimed(claimed.size());
        }

        for (Job job : claimed) {
            inFlight.put(job.id(), job);
            try {
                workers.execute(() -> execute(job));
            } catch (RejectedExecutionException e) {
                // Shutting down: hand the job back untouched
                inFlight.remove(job.id());
                store.reschedule(job.id(), workerId, now, clock.instant());
                log.warn("Worker pool rejected job {}; returned it to the queue", job.id());
            }
        }
        return claimed.size();
    }

    /**
     * Extends the lease of every job this dispatcher is running.
     */
    public void renewLeases() {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(properties.getLeaseDuration());
        for (String jobId : inFlight.keySet()) {
            try {
                if (!store.renewLease(jobId, workerId, expiresAt, now)) {
                    log.warn("Lost lease on job {}; it was unlocked or finished elsewhere", jobId);
                }
            } catch (RuntimeException e) {
                log.warn("Failed to renew lease on job {}: {}", jobId, e.getMessage());
            }
        }
    }

    private void safePoll() {
        try {
            pollOnce();
        } catch (RuntimeException e) {
            log.error("Job dispatcher poll cycle failed", e);
        }
    }

    void execute(Job job) {
        MdcContext.setJob(job.id(), job.type(), job.projectId());
        long startNanos = System.nanoTime();
        String outcome = "failed";
        try {
            outcome = runHandler(job);
        } catch (RuntimeException e) {
            log.error("Failed to record outcome of job {}", job.id(), e);
        } finally {
            inFlight.remove(job.id());
            if (metrics != null) {
                metrics.recordJobExecution(job.type(), outcome,
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
            }
            MdcContext.clear();
        }
    }

    private String runHandler(Job job) {
        JobHandler handler = handlers.get(job.type());
        if (handler == null) {
            log.error("No handler registered for job type '{}'", job.type());
            store.markFailed(job.id(), workerId, job.attempts() + 1,
                    "No handler registered for job type " + job.type(), clock.instant());
            return "failed";
        }

        try {
            if (job.isCancelRequested()) {
                throw new JobCancelledException(job.id());
            }
            log.info("Running job {} ({}), attempt {}/{}", job.id(), job.type(), job.attempts() + 1, job.maxAttempts());
            handler.handle(new JobContext(job, store, objectMapper));
            transitioned(store.markSucceeded(job.id(), workerId, clock.instant()), job, "succeeded");
            log.info("Job {} ({}) succeeded", job.id(), job.type());
            return "succeeded";
        } catch (RescheduleException e) {
            Instant now = clock.instant();
            transitioned(store.reschedule(job.id(), workerId, now.plus(e.getDelay()), now), job, "rescheduled");
            log.debug("Job {} rescheduled in {}ms: {}", job.id(), e.getDelay().toMillis(), e.getMessage());
            return "rescheduled";
        } catch (JobCancelledException e) {
            transitioned(store.markCancelled(job.id(), workerId, clock.instant()), job, "cancelled");
            log.info("Job {} ({}) cancelled", job.id(), job.type());
            return "cancelled";
        } catch (NonRetryableJobException e) {
            String error = JobErrors.sanitize(e);
            transitioned(store.markFailed(job.id(), workerId, job.attempts() + 1, error, clock.instant()), job, "failed");
            log.error("Job {} ({}) failed permanently: {}", job.id(), job.type(), error);
            return "failed";
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return handleFailure(job, e);
        }
    }

    private String handleFailure(Job job, Exception e) {
        String error = JobErrors.sanitize(e);
        int attempts = job.attempts() + 1;
        Instant now = clock.instant();
        if (attempts < job.maxAttempts()) {
            Duration delay = backoff(attempts, properties.getBackoffBase(), properties.getBackoffMax());
            transitioned(store.retryLater(job.id(), workerId, attempts, now.plus(delay), error, now), job, "retry");
            log.warn("Job {} ({}) failed attempt {}/{}, retrying in {}s: {}",
                    job.id(), job.type(), attempts, job.maxAttempts(), delay.toSeconds(), error);
            return "retried";
        }
        transitioned(store.markFailed(job.id(), workerId, attempts, error, now), job, "failed");
        log.error("Job {} ({}) failed after {} attempt(s): {}", job.id(), job.type(), attempts, error, e);
        return "failed";
    }

    private void transitioned(boolean applied, Job job, String transition) {
        if (!applied) {
            log.warn("Job {} was no longer locked by {}; {} transition skipped", job.id(), workerId, transition);
        }
    }

    /**
     * Exponential backoff: {@code base * 2^(attempts-1)}, capped at {@code max}.
     */
    public static Duration backoff(int attempts, Duration base, Duration max) {
        int exponent = Math.max(0, Math.min(attempts - 1, 20));
        Duration delay = base.multipliedBy(1L << exponent);
        return delay.compareTo(max) > 0 ? max : delay;
    }

    public boolean isStarted() {
        return started.get();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public String getWorkerId() {
        return workerId;
    }

    private static ExecutorService newWorkerPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "job-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "dispatcher";
        }
    }
}
