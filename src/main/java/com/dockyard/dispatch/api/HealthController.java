package com.dockyard.dispatch.api;

import com.dockyard.core.health.HealthCheckService;
import com.dockyard.core.health.HealthStatus;
import com.dockyard.core.queue.JobFilter;
import com.dockyard.core.queue.JobState;
import com.dockyard.core.queue.QueueService;
import com.dockyard.core.queue.QueueSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestrator health: component checks plus a snapshot of the job queue.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthCheckService healthCheckService;
    private final QueueService queueService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService,
                            @Autowired(required = false) QueueService queueService) {
        this.healthCheckService = healthCheckService;
        this.queueService = queueService;
    }

    /**
     * GET /api/v1/health: 503 when any component is DOWN, otherwise 200 with
     * {@code status} UP or DEGRADED. A paused queue or in-memory stores only degrade.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        List<HealthStatus> checks = healthCheckService != null ? healthCheckService.checkAll() : List.of();

        HealthStatus.Status overall = healthCheckService == null ? HealthStatus.Status.DOWN : HealthStatus.Status.UP;
        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : checks) {
            overall = worse(overall, check.status());
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("status", check.status().name());
            info.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                info.put("metadata", check.metadata());
            }
            components.put(check.component(), info);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", overall.name());
        result.put("dockerReachable", isUp(checks, "docker"));
        result.put("queue", queueSnapshot());
        result.put("components", components);

        HttpStatus httpStatus = overall == HealthStatus.Status.DOWN ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(httpStatus).body(result);
    }

    private Map<String, Object> queueSnapshot() {
        Map<String, Object> queue = new LinkedHashMap<>();
        if (queueService == null) {
            queue.put("available", false);
            return queue;
        }
        try {
            QueueSettings settings = queueService.getSettings();
            queue.put("available", true);
            queue.put("paused", settings.paused());
            queue.put("concurrency", settings.concurrency());
            queue.put("running", queueService.countRunning());
            queue.put("queued", queueService.countJobs(new JobFilter(JobState.QUEUED, null, null, null)));
            queue.put("failed", queueService.countJobs(new JobFilter(JobState.FAILED, null, null, null)));
        } catch (RuntimeException e) {
            log.warn("Queue snapshot unavailable: {}", e.getMessage());
            queue.clear();
            queue.put("available", false);
            queue.put("error", e.getMessage());
        }
        return queue;
    }

    private static HealthStatus.Status worse(HealthStatus.Status a, HealthStatus.Status b) {
        if (a == HealthStatus.Status.DOWN || b == HealthStatus.Status.DOWN) {
            return HealthStatus.Status.DOWN;
        }
        if (a == HealthStatus.Status.DEGRADED || b == HealthStatus.Status.DEGRADED) {
            return HealthStatus.Status.DEGRADED;
        }
        return HealthStatus.Status.UP;
    }

    private static boolean isUp(List<HealthStatus> checks, String component) {
        return checks.stream()
                .anyMatch(c -> c.component().equals(component) && c.status() == HealthStatus.Status.UP);
    }
}
