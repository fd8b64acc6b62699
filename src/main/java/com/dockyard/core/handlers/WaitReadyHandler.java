package com.dockyard.core.handlers;

import com.dockyard.core.project.Project;
import com.dockyard.core.project.ProjectService;
import com.dockyard.core.project.ProjectStatus;
import com.dockyard.core.queue.JobContext;
import com.dockyard.core.queue.JobHandler;
import com.dockyard.core.queue.JobPayloads.WaitReadyPayload;
import com.dockyard.core.queue.JobType;
import com.dockyard.core.queue.NonRetryableJobException;
import com.dockyard.core.queue.QueueService;
import com.dockyard.core.queue.RescheduleException;
import com.dockyard.sandbox.HealthProbe;
import com.dockyard.sandbox.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Polls the preview and agent runtime until both answer. Each unsuccessful
 * probe re-queues the job without counting an attempt; past the ready timeout
 * the project is marked {@code error}.
 */
@Component
public class WaitReadyHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(WaitReadyHandler.class);

    private final ProjectService projectService;
    private final QueueService queueService;
    private final HealthProbe probe;
    private final SandboxProperties properties;
    private final Clock clock;

    public WaitReadyHandler(ProjectService projectService, QueueService queueService, HealthProbe probe,
                            SandboxProperties properties, Clock clock) {
        this.projectService = projectService;
        this.queueService = queueService;
        this.probe = probe;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String type() {
        return JobType.DOCKER_WAIT_READY.wireName();
    }

    @Override
    public void handle(JobContext context) {
        WaitReadyPayload payload = context.payload(WaitReadyPayload.class);
        Optional<Project> found = projectService.findProject(payload.projectId());
        if (found.isEmpty() || found.get().status() == ProjectStatus.DELETING) {
            log.info("Project {} is gone or deleting; not waiting for readiness", payload.projectId());
            return;
        }
        Project project = found.get();
        context.throwIfCancelRequested();

        Duration timeout = properties.getProbeTimeout();
        boolean previewReady = probe.isUp(project.devPort(), properties.getPreview().getHealthPath(), timeout);
        boolean runtimeReady = probe.isUp(project.runtimePort(), properties.getRuntime().getHealthPath(), timeout);

        if (previewReady && runtimeReady) {
            projectService.updateStatus(project.id(), ProjectStatus.RUNNING);
            if (project.bootstrapSessionId() == null) {
                queueService.enqueueSessionCreate(project.id(), "ready");
            }
            log.info("Project {} preview and runtime are ready", project.id());
            return;
        }

        Duration elapsed = Duration.between(Instant.ofEpochMilli(payload.startedAtMs()), clock.instant());
        if (elapsed.compareTo(properties.getReadyTimeout()) > 0) {
            projectService.updateStatus(project.id(), ProjectStatus.ERROR);
            throw new NonRetryableJobException("Containers for project " + project.id() + " not ready after "
                    + elapsed.toSeconds() + "s (preview=" + previewReady + ", runtime=" + runtimeReady + ")");
        }
        throw new RescheduleException(properties.getReadyPollInterval(),
                "waiting for " + (previewReady ? "agent runtime" : "preview"));
    }
}
