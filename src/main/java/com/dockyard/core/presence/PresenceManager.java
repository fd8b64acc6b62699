package com.dockyard.core.presence;

import com.dockyard.core.logging.MdcContext;
import com.dockyard.core.metrics.OrchestratorMetrics;
import com.dockyard.core.project.Project;
import com.dockyard.core.project.ProjectService;
import com.dockyard.core.project.ProjectStatus;
import com.dockyard.core.queue.Job;
import com.dockyard.core.queue.QueueService;
import com.dockyard.sandbox.HealthProbe;
import com.dockyard.sandbox.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decides when a project's preview containers should run, based on viewer heartbeats.
 * <p>
 * {@link #handleHeartbeat} records the viewer, probes the preview and agent runtime
 * and reconciles the project's durable status with what the probes observe,
 * enqueuing a start when needed. The reaper ({@link #runReaper}) runs on its own
 * interval and enqueues a stop for projects nobody has watched for the grace
 * period and the idle timeout. Both take the same per-project lock, so a heartbeat
 * and a reaper pass never decide for the same project at once.
 * <p>
 * Presence state lives only in memory. After a restart the first heartbeat
 * rebuilds it from the project's status.
 */
public class PresenceManager {

    private static final Logger log = LoggerFactory.getLogger(PresenceManager.class);

    static final String MSG_STARTING = "Starting containers...";
    static final String MSG_RESTARTING = "Restarting containers...";
    static final String MSG_WAITING_PREVIEW = "Waiting for preview...";
    static final String MSG_WAITING_RUNTIME = "Waiting for agent runtime...";
    static final String MSG_FAILED = "Failed to start containers";
    static final String MSG_DELETING = "Project is being deleted...";

    static final long FAST_POLL_MS = 500;
    static final long MEDIUM_POLL_MS = 1000;
    static final long SLOW_POLL_MS = 2000;

    private final ProjectService projectService;
    private final QueueService queueService;
    private final HealthProbe probe;
    private final SandboxProperties sandboxProperties;
    private final PresenceProperties properties;
    private final Clock clock;
    private final OrchestratorMetrics metrics;

    private final Map<String, PresenceRecord> records = new ConcurrentHashMap<>();
    private final KeyedLockRegistry locks = new KeyedLockRegistry();

    private final ExecutorService probeExecutor = Executors.newCachedThreadPool(daemonFactory("presence-probe"));
    private ScheduledExecutorService reaper;

    public PresenceManager(ProjectService projectService, QueueService queueService, HealthProbe probe,
                           SandboxProperties sandboxProperties, PresenceProperties properties,
                           Clock clock, OrchestratorMetrics metrics) {
        this.projectService = projectService;
        this.queueService = queueService;
        this.probe = probe;
        this.sandboxProperties = sandboxProperties;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
    }

    public synchronized void start() {
        if (!properties.isReaperEnabled() || reaper != null) {
            return;
        }
        reaper = Executors.newSingleThreadScheduledExecutor(daemonFactory("presence-reaper"));
        long intervalMs = properties.getReaperInterval().toMillis();
        reaper.scheduleWithFixedDelay(this::safeRunReaper, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Presence reaper started (interval={}ms, grace={}s, idle={}s)", intervalMs,
                properties.getGracePeriod().toSeconds(), properties.getIdleTimeout().toSeconds());
    }

    public synchronized void stop() {
        if (reaper != null) {
            reaper.shutdownNow();
            reaper = null;
            log.info("Presence reaper stopped");
        }
        probeExecutor.shutdownNow();
    }

    // ── Heartbeat ───────────────────────────────────────────────────────

    /**
     * Records a viewer heartbeat and reconciles the project's containers.
     *
     * @throws com.dockyard.core.project.ProjectNotFoundException if the project does not exist
     */
    public PresenceResponse handleHeartbeat(String projectId, String viewerId) {
        return locks.withLock(projectId, () -> {
            MdcContext.setProject(projectId);
            try {
                PresenceResponse response = reconcile(projectId, viewerId);
                if (metrics != null) {
                    metrics.recordHeartbeat(response.status().value());
                }
                return response;
            } finally {
                MdcContext.clear();
            }
        });
    }

    private PresenceResponse reconcile(String projectId, String viewerId) {
        Project project = projectService.getProject(projectId);
        PresenceRecord record = records.computeIfAbsent(projectId, PresenceRecord::new);
        String setupError = queueService.latestFailure(projectId).map(Job::lastError).orElse(null);

        if (project.status() == ProjectStatus.DELETING) {
            return new PresenceResponse(projectId, ProjectStatus.DELETING, 0, project.previewUrl(),
                    false, false, MSG_DELETING, SLOW_POLL_MS, project.bootstrapSessionId(), setupError);
        }

        Instant now = clock.instant();
        record.touch(viewerId, now);

        CompletableFuture<Boolean> previewProbe = probeAsync(project.devPort(),
                sandboxProperties.getPreview().getHealthPath());
        CompletableFuture<Boolean> runtimeProbe = probeAsync(project.runtimePort(),
                sandboxProperties.getRuntime().getHealthPath());
        boolean previewReady = previewProbe.join();
        boolean runtimeReady = runtimeProbe.join();

        ProjectStatus status = project.status();
        String message = null;
        long nextPollMs = properties.getHeartbeatInterval().toMillis();

        if (previewReady && runtimeReady) {
            if (status != ProjectStatus.RUNNING) {
                projectService.updateStatus(projectId, ProjectStatus.RUNNING);
                status = ProjectStatus.RUNNING;
            }
            record.finishStarting();
        } else if (record.isStarting() || status == ProjectStatus.STARTING) {
            if (!record.isStarting()) {
                // Start was in flight before this process came up
                record.beginStarting(now);
            }
            Duration elapsed = Duration.between(record.startedAt(), now);
            if (elapsed.compareTo(properties.getStartupCeiling()) > 0) {
                log.warn("Project {} did not start within {}s (preview={}, runtime={})", projectId,
                        properties.getStartupCeiling().toSeconds(), previewReady, runtimeReady);
                projectService.updateStatus(projectId, ProjectStatus.ERROR);
                record.finishStarting();
                status = ProjectStatus.ERROR;
                message = MSG_FAILED;
                nextPollMs = SLOW_POLL_MS;
            } else {
                status = ProjectStatus.STARTING;
                message = waitingMessage(previewReady, runtimeReady);
                nextPollMs = adaptivePollMs(elapsed);
            }
        } else if (status.isStartable()) {
            return beginStart(project, record, now, MSG_STARTING, "presence", previewReady, runtimeReady, setupError);
        } else if (status == ProjectStatus.RUNNING && !previewReady && !runtimeReady) {
            log.warn("Project {} is marked running but neither container answers; restarting", projectId);
            projectService.updateStatus(projectId, ProjectStatus.STOPPED);
            return beginStart(project, record, now, MSG_RESTARTING, "crash", previewReady, runtimeReady, setupError);
        } else if (status == ProjectStatus.RUNNING) {
            message = waitingMessage(previewReady, runtimeReady);
            nextPollMs = SLOW_POLL_MS;
        }

        return new PresenceResponse(projectId, status, record.viewerCount(), project.previewUrl(),
                previewReady, runtimeReady, message, nextPollMs, project.bootstrapSessionId(), setupError);
    }

    private PresenceResponse beginStart(Project project, PresenceRecord record, Instant now, String message,
                                        String reason, boolean previewReady, boolean runtimeReady,
                                        String setupError) {
        record.beginStarting(now);
        ProjectStatus status = ProjectStatus.STARTING;
        long nextPollMs = FAST_POLL_MS;
        try {
            Job job = queueService.enqueueComposeUp(project.id(), reason);
            log.info("Start of project {} requested (job {}, reason {})", project.id(), job.id(), reason);
        } catch (RuntimeException e) {
            log.error("Failed to enqueue start for project {}", project.id(), e);
            projectService.updateStatus(project.id(), ProjectStatus.ERROR);
            record.finishStarting();
            status = ProjectStatus.ERROR;
            message = MSG_FAILED;
            nextPollMs = SLOW_POLL_MS;
        }
        return new PresenceResponse(project.id(), status, record.viewerCount(), project.previewUrl(),
                previewReady, runtimeReady, message, nextPollMs, project.bootstrapSessionId(), setupError);
    }

    private CompletableFuture<Boolean> probeAsync(Integer port, String path) {
        if (port == null) {
            return CompletableFuture.completedFuture(false);
        }
        return CompletableFuture.supplyAsync(() -> probe.isUp(port, path, properties.getProbeTimeout()), probeExecutor)
                .exceptionally(e -> {
                    log.debug("Probe of port {} failed: {}", port, e.getMessage());
                    return false;
                });
    }

    static String waitingMessage(boolean previewReady, boolean runtimeReady) {
        if (!previewReady && !runtimeReady) {
            return MSG_STARTING;
        }
        return previewReady ? MSG_WAITING_RUNTIME : MSG_WAITING_PREVIEW;
    }

    /**
     * Polls fast right after a start and backs off as it drags on.
     */
    static long adaptivePollMs(Duration elapsed) {
        long ms = elapsed.toMillis();
        if (ms < 1500) {
            return FAST_POLL_MS;
        }
        if (ms < 6500) {
            return MEDIUM_POLL_MS;
        }
        return SLOW_POLL_MS;
    }

    // ── Reaper ──────────────────────────────────────────────────────────

    /**
     * One pass over all tracked projects.
     *
     * @return number of stop jobs enqueued
     */
    public int runReaper() {
        int stopped = 0;
        for (String projectId : new ArrayList<>(records.keySet())) {
            boolean enqueued = locks.withLock(projectId, () -> {
                MdcContext.setProject(projectId);
                try {
                    return reapProject(projectId);
                } finally {
                    MdcContext.clear();
                }
            });
            if (enqueued) {
                stopped++;
            }
        }
        return stopped;
    }

    private boolean reapProject(String projectId) {
        PresenceRecord record = records.get(projectId);
        if (record == null) {
            return false;
        }
        Instant now = clock.instant();
        if (record.isStarting()) {
            Optional<Project> starting = projectService.findProject(projectId);
            if (starting.isPresent() && starting.get().status() == ProjectStatus.STARTING) {
                return false;
            }
            // The start finished without a heartbeat observing it
            record.finishStarting();
        }

        int pruned = record.pruneViewers(now, properties.getHeartbeatInterval().multipliedBy(2));
        if (pruned > 0) {
            log.debug("Pruned {} stale viewer(s) of project {}", pruned, projectId);
        }
        if (record.viewerCount() > 0) {
            record.cancelStop();
            return false;
        }
        if (record.stopAt() == null) {
            record.scheduleStop(now.plus(properties.getGracePeriod()));
            log.debug("Project {} has no viewers; stop scheduled at {}", projectId, record.stopAt());
            return false;
        }
        if (now.isBefore(record.stopAt())) {
            return false;
        }
        Instant lastSeen = record.lastHeartbeatAt() != null
                ? record.lastHeartbeatAt()
                : record.stopAt().minus(properties.getGracePeriod());
        Duration idle = Duration.between(lastSeen, now);
        if (idle.compareTo(properties.getGracePeriod()) < 0 || idle.compareTo(properties.getIdleTimeout()) < 0) {
            return false;
        }

        Optional<Project> project = projectService.findProject(projectId);
        boolean enqueued = false;
        if (project.isPresent() && needsStop(project.get().status())) {
            queueService.enqueueDockerStop(projectId, "idle");
            enqueued = true;
            if (metrics != null) {
                metrics.recordReaperStop();
            }
            log.info("Project {} idle for {}s; stop enqueued", projectId, idle.toSeconds());
        }
        records.remove(projectId);
        return enqueued;
    }

    private static boolean needsStop(ProjectStatus status) {
        return status == ProjectStatus.RUNNING || status == ProjectStatus.STARTING;
    }

    private void safeRunReaper() {
        try {
            runReaper();
        } catch (RuntimeException e) {
            log.error("Presence reaper pass failed", e);
        }
    }

    /** Number of projects with in-memory presence state. */
    public int trackedProjects() {
        return records.size();
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
