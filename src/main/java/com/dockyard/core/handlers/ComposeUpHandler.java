package com.dockyard.core.handlers;

import com.dockyard.core.project.Project;
import com.dockyard.core.project.ProjectService;
import com.dockyard.core.project.ProjectStatus;
import com.dockyard.core.queue.JobContext;
import com.dockyard.core.queue.JobHandler;
import com.dockyard.core.queue.JobPayloads.ProjectPayload;
import com.dockyard.core.queue.JobType;
import com.dockyard.core.queue.QueueService;
import com.dockyard.sandbox.ContainerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Starts the preview and agent runtime containers, then hands off to
 * {@code docker.waitReady}.
 */
@Component
public class ComposeUpHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(ComposeUpHandler.class);

    private final ProjectService projectService;
    private final ContainerRuntime runtime;
    private final QueueService queueService;
    private final Clock clock;

    public ComposeUpHandler(ProjectService projectService, ContainerRuntime runtime,
                            QueueService queueService, Clock clock) {
        this.projectService = projectService;
        this.runtime = runtime;
        this.queueService = queueService;
        this.clock = clock;
    }

    @Override
    public String type() {
        return JobType.DOCKER_COMPOSE_UP.wireName();
    }

    @Override
    public void handle(JobContext context) {
        ProjectPayload payload = context.payload(ProjectPayload.class);
        Optional<Project> found = projectService.findProject(payload.projectId());
        if (found.isEmpty()) {
            log.warn("Project {} not found for compose-up; skipping", payload.projectId());
            return;
        }
        Project project = found.get();
        if (project.status() == ProjectStatus.DELETING) {
            log.info("Skipping compose-up for deleting project {}", project.id());
            return;
        }

        projectService.updateStatus(project.id(), ProjectStatus.STARTING);
        context.throwIfCancelRequested();

        runtime.startPreview(project);
        context.throwIfCancelRequested();

        queueService.enqueueWaitReady(project.id(), clock.instant());
        log.info("Containers started for project {} (reason: {})", project.id(), payload.reason());
    }
}
