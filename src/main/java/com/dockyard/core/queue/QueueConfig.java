package com.dockyard.core.queue;

import com.dockyard.core.metrics.OrchestratorMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class QueueConfig {

    /**
     * The dispatcher starts polling once the context is refreshed and is stopped
     * on shutdown. With {@code dockyard.queue.enabled=false} (CLI mode) it is
     * created but never polls.
     */
    @Bean(initMethod = "start", destroyMethod = "stop")
    public JobDispatcher jobDispatcher(JobStore store, QueueProperties properties, List<JobHandler> handlers,
                                       ObjectMapper objectMapper, Clock clock, OrchestratorMetrics metrics) {
        return new JobDispatcher(store, properties, handlers, objectMapper, clock, metrics);
    }
}
