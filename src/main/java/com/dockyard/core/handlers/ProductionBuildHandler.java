package com.dockyard.core.handlers;

import com.dockyard.core.production.BuildRunner;
import com.dockyard.core.production.ProductionProperties;
import com.dockyard.core.production.ProductionService;
import com.dockyard.core.production.ReleaseStore;
import com.dockyard.core.project.Project;
import com.dockyard.core.project.ProjectService;
import com.dockyard.core.project.ProjectStatus;
import com.dockyard.core.queue.JobContext;
import com.dockyard.core.queue.JobPayloads.ProjectPayload;
import com.dockyard.core.queue.JobType;
import com.dockyard.core.queue.QueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs the project build, stages the output as a content-addressed release
 * and enqueues {@code production.start} for it.
 */
@Component
public class ProductionBuildHandler extends AbstractProductionHandler {

    private static final Logger log = LoggerFactory.getLogger(ProductionBuildHandler.class);

    private final ProjectService projectService;
    private final BuildRunner buildRunner;
    private final ReleaseStore releaseStore;
    private final QueueService queueService;
    private final ProductionProperties properties;

    public ProductionBuildHandler(ProductionService productionService, ProjectService projectService,
                                  BuildRunner buildRunner, ReleaseStore releaseStore,
                                  QueueService queueService, ProductionProperties properties) {
        super(productionService);
        this.projectService = projectService;
        this.buildRunner = buildRunner;
        this.releaseStore = releaseStore;
        this.queueService = queueService;
        this.properties = properties;
    }

    @Override
    public String type() {
        return JobType.PRODUCTION_BUILD.wireName();
    }

    @Override
    protected void execute(JobContext context) throws Exception {
        ProjectPayload payload = context.payload(ProjectPayload.class);
        Project project = projectService.getProject(payload.projectId());
        if (project.status() == ProjectStatus.DELETING) {
            log.info("Skipping production build for deleting project {}", project.id());
            return;
        }

        productionService.markBuilding(project.id());
        context.throwIfCancelRequested();

        Path projectDir = Path.of(project.path());
        buildRunner.build(projectDir, properties.getBuildCommand(), properties.getBuildTimeout());
        context.throwIfCancelRequested();

        String hash = releaseStore.stage(project.id(), projectDir.resolve(properties.getDistDir()),
                projectDir.resolve(properties.getDockerfile()));
        queueService.enqueueProductionStart(project.id(), hash);
        log.info("Build of project {} staged as release {}", project.id(), hash);
    }

    @Override
    protected String releaseHash(JobContext context) {
        return null;
    }
}
