package com.dockyard.core.handlers;

import com.dockyard.core.production.ProductionService;
import com.dockyard.core.queue.JobContext;
import com.dockyard.core.queue.JobHandler;
import com.dockyard.core.queue.JobPayloads.ProjectPayload;
import com.dockyard.core.queue.JobType;
import org.springframework.stereotype.Component;

/**
 * Tears down a production deployment. Not an {@link AbstractProductionHandler}:
 * a failed stop is retried and never triggers a rollback.
 */
@Component
public class ProductionStopHandler implements JobHandler {

    private final ProductionService productionService;

    public ProductionStopHandler(ProductionService productionService) {
        this.productionService = productionService;
    }

    @Override
    public String type() {
        return JobType.PRODUCTION_STOP.wireName();
    }

    @Override
    public void handle(JobContext context) throws Exception {
        ProjectPayload payload = context.payload(ProjectPayload.class);
        productionService.teardown(payload.projectId());
    }
}
