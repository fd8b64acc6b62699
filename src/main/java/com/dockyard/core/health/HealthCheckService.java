package com.dockyard.core.health;

import com.dockyard.core.queue.JobDispatcher;
import com.dockyard.core.queue.QueueService;
import com.dockyard.core.queue.QueueSettings;
import com.dockyard.sandbox.ContainerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DataSource dataSource;
    private final ContainerRuntime containerRuntime;
    private final JobDispatcher dispatcher;
    private final QueueService queueService;

    public HealthCheckService(
            @Autowired(required = false) DataSource dataSource,
            @Autowired(required = false) ContainerRuntime containerRuntime,
            @Autowired(required = false) JobDispatcher dispatcher,
            @Autowired(required = false) QueueService queueService) {
        this.dataSource = dataSource;
        this.containerRuntime = containerRuntime;
        this.dispatcher = dispatcher;
        this.queueService = queueService;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDatabase());
        results.add(checkDocker());
        results.add(checkDispatcher());
        return results;
    }

    HealthStatus checkDatabase() {
        if (dataSource == null) {
            // In-memory stores are a supported mode, not an outage
            return new HealthStatus("database", HealthStatus.Status.DEGRADED,
                    "No DataSource configured; using in-memory stores", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    HealthStatus checkDocker() {
        if (containerRuntime == null) {
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "No container runtime configured", Map.of());
        }
        try {
            if (containerRuntime.ping()) {
                return new HealthStatus("docker", HealthStatus.Status.UP,
                        "Docker daemon reachable", Map.of());
            }
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "Docker daemon did not answer ping", Map.of());
        } catch (Exception e) {
            log.warn("Docker health check failed: {}", e.getMessage());
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "Docker error: " + e.getMessage(), Map.of());
        }
    }

    HealthStatus checkDispatcher() {
        if (dispatcher == null) {
            return new HealthStatus("dispatcher", HealthStatus.Status.DOWN,
                    "Job dispatcher not available", Map.of());
        }
        Map<String, String> metadata = Map.of(
                "workerId", dispatcher.getWorkerId(),
                "inFlight", String.valueOf(dispatcher.inFlightCount()));
        if (!dispatcher.isStarted()) {
            return new HealthStatus("dispatcher", HealthStatus.Status.DEGRADED,
                    "Job dispatcher not polling", metadata);
        }
        if (queueService != null) {
            try {
                QueueSettings settings = queueService.getSettings();
                if (settings.paused()) {
                    return new HealthStatus("dispatcher", HealthStatus.Status.DEGRADED,
                            "Queue paused", metadata);
                }
            } catch (Exception e) {
                log.warn("Queue settings unavailable: {}", e.getMessage());
                return new HealthStatus("dispatcher", HealthStatus.Status.DOWN,
                        "Queue settings unavailable: " + e.getMessage(), metadata);
            }
        }
        return new HealthStatus("dispatcher", HealthStatus.Status.UP,
                "Job dispatcher polling", metadata);
    }
}
