package com.dockyard.dispatch.api;

import com.dockyard.core.project.Project;
import com.dockyard.core.project.ProjectService;
import com.dockyard.core.queue.Job;
import com.dockyard.core.queue.QueueService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private final ProjectService projectService;
    private final QueueService queueService;

    public ProjectController(ProjectService projectService, QueueService queueService) {
        this.projectService = projectService;
        this.queueService = queueService;
    }

    @PostMapping
    public ResponseEntity<Project> register(@RequestBody RegisterRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        Project project = projectService.registerProject(request.id(), request.name(), request.path());
        return ResponseEntity.status(HttpStatus.CREATED).body(project);
    }

    @GetMapping
    public List<Project> list() {
        return projectService.listProjects();
    }

    @GetMapping("/{projectId}")
    public Project get(@PathVariable String projectId) {
        return projectService.getProject(projectId);
    }

    /**
     * POST /api/v1/projects/{id}/stop: Stop the sandbox containers now
     * instead of waiting for the reaper.
     */
    @PostMapping("/{projectId}/stop")
    public ResponseEntity<Map<String, Object>> stop(@PathVariable String projectId) {
        projectService.getProject(projectId);
        Job job = queueService.enqueueDockerStop(projectId, "manual");
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("projectId", projectId, "jobId", job.id()));
    }

    public record RegisterRequest(String id, String name, String path) {}
}
