package com.dockyard.core.handlers;

import com.dockyard.core.production.ProductionProperties;
import com.dockyard.core.production.ProductionService;
import com.dockyard.core.queue.JobContext;
import com.dockyard.core.queue.JobPayloads.ReleaseReadyPayload;
import com.dockyard.core.queue.JobType;
import com.dockyard.core.queue.RescheduleException;
import com.dockyard.sandbox.HealthProbe;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Probes the production container until it answers HTTP, then marks the
 * deployment running.
 */
@Component
public class ProductionWaitReadyHandler extends AbstractProductionHandler {

    private final HealthProbe probe;
    private final ProductionProperties properties;
    private final Clock clock;

    public ProductionWaitReadyHandler(ProductionService productionService, HealthProbe probe,
                                      ProductionProperties properties, Clock clock) {
        super(productionService);
        this.probe = probe;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String type() {
        return JobType.PRODUCTION_WAIT_READY.wireName();
    }

    @Override
    protected void execute(JobContext context) {
        ReleaseReadyPayload payload = context.payload(ReleaseReadyPayload.class);
        context.throwIfCancelRequested();

        if (probe.isUp(payload.port(), "/", properties.getProbeTimeout())) {
            productionService.completeDeployment(payload.projectId(), payload.hash(), payload.port());
            return;
        }
        Duration elapsed = Duration.between(Instant.ofEpochMilli(payload.startedAtMs()), clock.instant());
        if (elapsed.compareTo(properties.getReadyTimeout()) > 0) {
            throw new IllegalStateException("Production container did not become ready within "
                    + properties.getReadyTimeout().toSeconds() + "s");
        }
        throw new RescheduleException(properties.getReadyPollInterval(), "production not ready on port " + payload.port());
    }

    @Override
    protected String releaseHash(JobContext context) {
        return context.payload(ReleaseReadyPayload.class).hash();
    }
}
