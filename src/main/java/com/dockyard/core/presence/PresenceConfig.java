package com.dockyard.core.presence;

import com.dockyard.core.metrics.OrchestratorMetrics;
import com.dockyard.core.project.ProjectService;
import com.dockyard.core.queue.QueueService;
import com.dockyard.sandbox.HealthProbe;
import com.dockyard.sandbox.SandboxProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PresenceConfig {

    @Bean(initMethod = "start", destroyMethod = "stop")
    public PresenceManager presenceManager(ProjectService projectService, QueueService queueService,
                                           HealthProbe healthProbe, SandboxProperties sandboxProperties,
                                           PresenceProperties presenceProperties, Clock clock,
                                           OrchestratorMetrics metrics) {
        return new PresenceManager(projectService, queueService, healthProbe, sandboxProperties,
                presenceProperties, clock, metrics);
    }
}
