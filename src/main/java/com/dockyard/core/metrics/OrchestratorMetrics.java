package com.dockyard.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the job queue, presence and production deployments.
 */
@Service
public class OrchestratorMetrics {

    private final MeterRegistry registry;

    public OrchestratorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordJobExecution(String jobType, String outcome, long ms) {
        Timer.builder("dockyard.job.duration")
                .tag("type", jobType)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordJobsClaimed(int count) {
        Counter.builder("dockyard.jobs.claimed")
                .register(registry)
                .increment(count);
    }

    public void recordHeartbeat(String status) {
        Counter.builder("dockyard.presence.heartbeats")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordReaperStop() {
        Counter.builder("dockyard.presence.reaper_stops")
                .description("Stop jobs enqueued for idle projects")
                .register(registry)
                .increment();
    }

    public void recordDeployment(String result) {
        Counter.builder("dockyard.production.deployments")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    /**
     * @param automatic true when triggered by a failed promotion rather than a user request
     */
    public void recordRollback(boolean automatic, boolean succeeded) {
        Counter.builder("dockyard.production.rollbacks")
                .tag("trigger", automatic ? "automatic" : "manual")
                .tag("result", succeeded ? "succeeded" : "failed")
                .register(registry)
                .increment();
    }
}
