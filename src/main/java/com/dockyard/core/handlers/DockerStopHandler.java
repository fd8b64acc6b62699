package com.dockyard.core.handlers;

import com.dockyard.core.project.Project;
import com.dockyard.core.project.ProjectService;
import com.dockyard.core.project.ProjectStatus;
import com.dockyard.core.queue.JobContext;
import com.dockyard.core.queue.JobHandler;
import com.dockyard.core.queue.JobPayloads.ProjectPayload;
import com.dockyard.core.queue.JobType;
import com.dockyard.sandbox.ContainerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class DockerStopHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(DockerStopHandler.class);

    private final ProjectService projectService;
    private final ContainerRuntime runtime;

    public DockerStopHandler(ProjectService projectService, ContainerRuntime runtime) {
        this.projectService = projectService;
        this.runtime = runtime;
    }

    @Override
    public String type() {
        return JobType.DOCKER_STOP.wireName();
    }

    @Override
    public void handle(JobContext context) {
        ProjectPayload payload = context.payload(ProjectPayload.class);
        runtime.stopPreview(payload.projectId());

        Optional<Project> project = projectService.findProject(payload.projectId());
        if (project.isPresent() && project.get().status() != ProjectStatus.DELETING) {
            projectService.updateStatus(payload.projectId(), ProjectStatus.STOPPED);
        }
        log.info("Containers stopped for project {} (reason: {})", payload.projectId(), payload.reason());
    }
}
