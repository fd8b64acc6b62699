package com.dockyard.core.handlers;

import com.dockyard.core.production.ProductionService;
import com.dockyard.core.production.ProductionService.StartedRelease;
import com.dockyard.core.queue.JobContext;
import com.dockyard.core.queue.JobPayloads.ReleasePayload;
import com.dockyard.core.queue.JobType;
import com.dockyard.core.queue.QueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class ProductionStartHandler extends AbstractProductionHandler {

    private static final Logger log = LoggerFactory.getLogger(ProductionStartHandler.class);

    private final QueueService queueService;
    private final Clock clock;

    public ProductionStartHandler(ProductionService productionService, QueueService queueService, Clock clock) {
        super(productionService);
        this.queueService = queueService;
        this.clock = clock;
    }

    @Override
    public String type() {
        return JobType.PRODUCTION_START.wireName();
    }

    @Override
    protected void execute(JobContext context) throws Exception {
        ReleasePayload payload = context.payload(ReleasePayload.class);
        context.throwIfCancelRequested();

        StartedRelease started = productionService.startRelease(payload.projectId(), payload.hash());
        queueService.enqueueProductionWaitReady(payload.projectId(), payload.hash(), started.basePort(),
                started.previousHash(), clock.instant());
        log.info("Release {} of project {} started on port {} (version port {})",
                payload.hash(), payload.projectId(), started.basePort(), started.versionPort());
        productionService.cleanup(payload.projectId());
    }

    @Override
    protected String releaseHash(JobContext context) {
        return context.payload(ReleasePayload.class).hash();
    }
}
