package com.dockyard.core.handlers;

import com.dockyard.core.production.ProductionService;
import com.dockyard.core.project.ProjectNotFoundException;
import com.dockyard.core.queue.JobCancelledException;
import com.dockyard.core.queue.JobContext;
import com.dockyard.core.queue.JobErrors;
import com.dockyard.core.queue.JobHandler;
import com.dockyard.core.queue.NonRetryableJobException;
import com.dockyard.core.queue.RescheduleException;

/**
 * Base for the steps of a production deployment. Any failure marks the
 * deployment failed (which may trigger the one-level automatic rollback) and
 * ends the job without retry; the user redeploys instead.
 */
abstract class AbstractProductionHandler implements JobHandler {

    protected final ProductionService productionService;

    protected AbstractProductionHandler(ProductionService productionService) {
        this.productionService = productionService;
    }

    @Override
    public final void handle(JobContext context) throws Exception {
        try {
            execute(context);
        } catch (RescheduleException e) {
            throw e;
        } catch (ProjectNotFoundException e) {
            throw new NonRetryableJobException(e.getMessage(), e);
        } catch (JobCancelledException e) {
            productionService.failDeployment(context.projectId(), releaseHash(context), "Deployment cancelled");
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            String error = JobErrors.sanitize(e);
            productionService.failDeployment(context.projectId(), releaseHash(context), error);
            throw new NonRetryableJobException(error, e);
        }
    }

    protected abstract void execute(JobContext context) throws Exception;

    /**
     * Release this step works on, or null before the build has produced one.
     */
    protected abstract String releaseHash(JobContext context);
}
