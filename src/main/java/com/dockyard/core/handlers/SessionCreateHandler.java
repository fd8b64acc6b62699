package com.dockyard.core.handlers;

import com.dockyard.core.project.Project;
import com.dockyard.core.project.ProjectService;
import com.dockyard.core.queue.JobContext;
import com.dockyard.core.queue.JobHandler;
import com.dockyard.core.queue.JobPayloads.ProjectPayload;
import com.dockyard.core.queue.JobType;
import com.dockyard.sandbox.AgentRuntimeClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Bootstraps the agent session of a project. Idempotent: a project that
 * already has a session is left alone.
 */
@Component
public class SessionCreateHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(SessionCreateHandler.class);

    private final ProjectService projectService;
    private final AgentRuntimeClient agentRuntimeClient;

    public SessionCreateHandler(ProjectService projectService, AgentRuntimeClient agentRuntimeClient) {
        this.projectService = projectService;
        this.agentRuntimeClient = agentRuntimeClient;
    }

    @Override
    public String type() {
        return JobType.RUNTIME_SESSION_CREATE.wireName();
    }

    @Override
    public void handle(JobContext context) throws Exception {
        ProjectPayload payload = context.payload(ProjectPayload.class);
        Optional<Project> found = projectService.findProject(payload.projectId());
        if (found.isEmpty()) {
            log.warn("Project {} not found for session bootstrap; skipping", payload.projectId());
            return;
        }
        Project project = found.get();
        if (project.bootstrapSessionId() != null) {
            log.debug("Project {} already has session {}", project.id(), project.bootstrapSessionId());
            return;
        }
        context.throwIfCancelRequested();

        String sessionId = agentRuntimeClient.createSession(project.runtimePort());
        projectService.setBootstrapSession(project.id(), sessionId);
    }
}
