package com.dockyard.dispatch.api;

import com.dockyard.core.production.ProductionService;
import com.dockyard.core.production.ProductionState;
import com.dockyard.core.production.ReleaseVersion;
import com.dockyard.core.queue.Job;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for a project's production deployment.
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/production")
public class ProductionController {

    private final ProductionService productionService;

    public ProductionController(ProductionService productionService) {
        this.productionService = productionService;
    }

    @GetMapping
    public ProductionState status(@PathVariable String projectId) {
        return productionService.getStatus(projectId);
    }

    /**
     * POST /api/v1/projects/{id}/production/deploy: Queue a build and release.
     * 409 while another deployment is active.
     */
    @PostMapping("/deploy")
    public ResponseEntity<Map<String, Object>> deploy(@PathVariable String projectId) {
        Job job = productionService.deploy(projectId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(accepted(projectId, job));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop(@PathVariable String projectId) {
        Job job = productionService.stop(projectId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(accepted(projectId, job));
    }

    /**
     * POST /api/v1/projects/{id}/production/rollback: Restore a staged release.
     * Runs synchronously and answers with the resulting production state.
     */
    @PostMapping("/rollback")
    public ProductionState rollback(@PathVariable String projectId, @RequestBody RollbackRequest request) {
        if (request == null || request.hash() == null || request.hash().isBlank()) {
            throw new IllegalArgumentException("hash is required");
        }
        return productionService.rollback(projectId, request.hash());
    }

    @GetMapping("/versions")
    public List<ReleaseVersion> versions(@PathVariable String projectId) {
        return productionService.listVersions(projectId);
    }

    private static Map<String, Object> accepted(String projectId, Job job) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("projectId", projectId);
        body.put("jobId", job.id());
        body.put("jobType", job.type());
        body.put("state", job.state().value());
        return body;
    }

    public record RollbackRequest(String hash) {}
}
