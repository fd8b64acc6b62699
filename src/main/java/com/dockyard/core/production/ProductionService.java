package com.dockyard.core.production;

import com.dockyard.core.metrics.OrchestratorMetrics;
import com.dockyard.core.ports.PortAllocation;
import com.dockyard.core.ports.PortAllocator;
import com.dockyard.core.ports.PortType;
import com.dockyard.core.project.Project;
import com.dockyard.core.project.ProjectNotFoundException;
import com.dockyard.core.project.ProjectStore;
import com.dockyard.core.queue.Job;
import com.dockyard.core.queue.JobType;
import com.dockyard.core.queue.QueueService;
import com.dockyard.sandbox.ContainerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Production deployment state machine.
 * <p>
 * A deploy is the job chain {@code production.build -> production.start ->
 * production.waitReady}; this service validates requests, owns every
 * {@link ProductionStatus} transition and performs rollbacks synchronously.
 * Transitions are conditional on the status read beforehand, so two racing
 * requests cannot both move the same project.
 */
@Service
public class ProductionService {

    private static final Logger log = LoggerFactory.getLogger(ProductionService.class);

    private static final Set<JobType> PRODUCTION_JOBS = EnumSet.of(
            JobType.PRODUCTION_BUILD, JobType.PRODUCTION_START, JobType.PRODUCTION_WAIT_READY, JobType.PRODUCTION_STOP);

    private final ProjectStore projectStore;
    private final ReleaseStore releaseStore;
    private final PortAllocator portAllocator;
    private final ContainerRuntime runtime;
    private final QueueService queueService;
    private final ProductionProperties properties;
    private final Clock clock;
    private final OrchestratorMetrics metrics;

    public ProductionService(ProjectStore projectStore, ReleaseStore releaseStore, PortAllocator portAllocator,
                             ContainerRuntime runtime, QueueService queueService, ProductionProperties properties,
                             Clock clock, @Autowired(required = false) OrchestratorMetrics metrics) {
        this.projectStore = projectStore;
        this.releaseStore = releaseStore;
        this.portAllocator = portAllocator;
        this.runtime = runtime;
        this.queueService = queueService;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
    }

    // ── User actions ────────────────────────────────────────────────────

    public ProductionState getStatus(String projectId) {
        return requireProject(projectId).production();
    }

    /**
     * Starts a deployment by enqueuing the build job.
     *
     * @throws DeploymentInProgressException if a deployment is queued or building,
     *                                       or a production job is still active
     */
    public Job deploy(String projectId) {
        ProductionState current = requireProject(projectId).production();
        if (hasActiveDeployment(projectId)) {
            throw new DeploymentInProgressException(projectId);
        }
        if (!current.status().canTransitionTo(ProductionStatus.QUEUED)
                || !projectStore.updateProduction(projectId, current.status(),
                        current.withStatus(ProductionStatus.QUEUED).withError(null))) {
            throw new DeploymentInProgressException(projectId);
        }
        Job job = queueService.enqueueProductionBuild(projectId);
        log.info("Deployment queued for project {} (job {})", projectId, job.id());
        return job;
    }

    /**
     * Enqueues teardown of the running deployment.
     */
    public Job stop(String projectId) {
        ProductionState current = requireProject(projectId).production();
        if (queueService.hasActiveJobs(projectId, JobType.PRODUCTION_DEPLOY)) {
            throw new DeploymentInProgressException(projectId);
        }
        if (current.status() != ProductionStatus.RUNNING) {
            throw new InvalidTransitionException(projectId, current.status(), ProductionStatus.STOPPED);
        }
        Job job = queueService.enqueueProductionStop(projectId);
        log.info("Production stop queued for project {} (job {})", projectId, job.id());
        return job;
    }

    /**
     * Restores a previously staged release: stops the running container, repoints
     * {@code current}, starts the target on the same base port and runs cleanup.
     *
     * @throws DeploymentInProgressException if a deployment is in flight
     * @throws InvalidTransitionException    if nothing is deployed or the target is already active
     * @throws VersionNotFoundException      if the target release is not staged
     * @throws RollbackFailedException       if the target could not be started
     */
    public ProductionState rollback(String projectId, String targetHash) {
        Project project = requireProject(projectId);
        if (hasActiveDeployment(projectId)) {
            throw new DeploymentInProgressException(projectId);
        }
        String currentHash = project.production().hash() != null
                ? project.production().hash()
                : releaseStore.currentHash(projectId).orElse(null);
        if (currentHash == null) {
            throw new InvalidTransitionException("Project " + projectId + " has no production release to roll back from");
        }
        if (currentHash.equals(targetHash)) {
            throw new InvalidTransitionException("Release " + targetHash + " is already active for project " + projectId);
        }
        if (!releaseStore.exists(projectId, targetHash)) {
            throw new VersionNotFoundException(projectId, targetHash);
        }
        log.info("Rolling back project {} from {} to {}", projectId, currentHash, targetHash);
        return restore(projectId, targetHash, false, null);
    }

    public List<ReleaseVersion> listVersions(String projectId) {
        requireProject(projectId);
        try {
            return releaseStore.listVersions(projectId);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list releases for project " + projectId, e);
        }
    }

    public boolean hasActiveDeployment(String projectId) {
        return requireProject(projectId).production().status().isActive()
                || queueService.hasActiveJobs(projectId, PRODUCTION_JOBS);
    }

    /**
     * One-level rollback target after {@code failedHash} failed: whatever {@code current}
     * points at if that is not the failed release, else what it pointed at before.
     */
    public Optional<String> getPreviousReleaseHash(String projectId, String failedHash) {
        Optional<String> current = releaseStore.currentHash(projectId);
        if (current.isPresent() && !current.get().equals(failedHash)) {
            return current;
        }
        return releaseStore.previousHash(projectId)
                .filter(prev -> !prev.equals(failedHash))
                .filter(prev -> releaseStore.exists(projectId, prev));
    }

    // ── Deployment steps (called from job handlers) ─────────────────────

    /**
     * Moves a queued deployment to building. A no-op when it already is, so a
     * redelivered build job does not fail on its own earlier transition.
     */
    public void markBuilding(String projectId) {
        if (getStatus(projectId).status() == ProductionStatus.BUILDING) {
            return;
        }
        transition(projectId, ProductionStatus.BUILDING, s -> s.withStartedAt(clock.instant()));
    }

    /**
     * Starts one staged release: allocates the base port, registers the version port,
     * replaces the running container, promotes the release and runs the new container.
     */
    public StartedRelease startRelease(String projectId, String hash) throws IOException {
        if (!releaseStore.exists(projectId, hash)) {
            throw new VersionNotFoundException(projectId, hash);
        }
        int basePort = portAllocator.allocateProjectBasePort(projectId);
        int versionPort = PortAllocator.deriveVersionPort(projectId, hash);
        portAllocator.registerPort(versionPort, PortType.VERSION, projectId, hash);

        String previousHash = releaseStore.currentHash(projectId).filter(h -> !h.equals(hash)).orElse(null);
        stopContainerQuietly(projectId);
        String image = runtime.buildProductionImage(projectId, hash, releaseStore.releaseDir(projectId, hash));
        // Repoint before restart: a failed start leaves current on a complete release
        releaseStore.promote(projectId, hash);
        runtime.startProduction(projectId, image, basePort, versionPort);
        return new StartedRelease(hash, basePort, versionPort, previousHash);
    }

    public void completeDeployment(String projectId, String hash, int port) {
        transition(projectId, ProductionStatus.RUNNING, s -> s
                .withHash(hash)
                .withPort(port)
                .withUrl(productionUrl(port))
                .withError(null));
        if (metrics != null) {
            metrics.recordDeployment("succeeded");
        }
        log.info("Project {} release {} is live on port {}", projectId, hash, port);
        cleanup(projectId);
    }

    /**
     * Marks the deployment failed and, when enabled, restores the previous release once.
     * A failed build has not touched the running container, so nothing is restored.
     *
     * @param failedHash release that failed, or null when the build itself failed
     */
    public void failDeployment(String projectId, String failedHash, String error) {
        ProductionState current = getStatus(projectId);
        if (current.status().canTransitionTo(ProductionStatus.FAILED)) {
            projectStore.updateProduction(projectId, current.status(),
                    current.withStatus(ProductionStatus.FAILED).withError(error));
        } else {
            log.warn("Project {} production is {}; not marking failed", projectId, current.status().value());
        }
        if (metrics != null) {
            metrics.recordDeployment("failed");
        }
        log.error("Deployment of project {} failed (release {}): {}", projectId, failedHash, error);

        if (!properties.isAutoRollback()) {
            return;
        }
        if (failedHash == null) {
            log.info("Build of project {} failed before any release was started; live release left running",
                    projectId);
            return;
        }
        Optional<String> previous = getPreviousReleaseHash(projectId, failedHash);
        if (previous.isEmpty()) {
            log.info("No previous release to restore for project {}", projectId);
            return;
        }
        try {
            restore(projectId, previous.get(), true,
                    "Deployment failed, restored release " + previous.get() + ": " + error);
        } catch (RuntimeException e) {
            log.error("Automatic rollback of project {} to {} failed", projectId, previous.get(), e);
        }
    }

    /**
     * Tears down the production deployment: container, images, version ports and release directories.
     */
    public void teardown(String projectId) throws IOException {
        stopContainerQuietly(projectId);
        try {
            runtime.removeProductionImages(projectId);
        } catch (RuntimeException e) {
            log.warn("Failed to remove production images for project {}: {}", projectId, e.getMessage());
        }
        for (PortAllocation allocation : portAllocator.listPorts(projectId)) {
            if (allocation.portType() == PortType.VERSION) {
                portAllocator.unregisterPort(allocation.port());
            }
        }
        releaseStore.deleteAll(projectId);

        ProductionState current = getStatus(projectId);
        if (current.status().canTransitionTo(ProductionStatus.STOPPED)) {
            transition(projectId, ProductionStatus.STOPPED, s -> s.withHash(null).withUrl(null).withError(null));
            log.info("Production stopped for project {}", projectId);
        } else {
            log.warn("Project {} production is {}; left as is after teardown", projectId, current.status().value());
        }
    }

    /**
     * Keeps the newest releases and releases the version ports of the deleted ones.
     */
    public List<String> cleanup(String projectId) {
        try {
            List<String> deleted = releaseStore.cleanup(projectId, properties.getKeepVersions());
            if (!deleted.isEmpty()) {
                portAllocator.unregisterVersionPorts(projectId, deleted);
            }
            return deleted;
        } catch (IOException | RuntimeException e) {
            log.warn("Release cleanup failed for project {}: {}", projectId, e.getMessage());
            return List.of();
        }
    }

    // ── Internals ───────────────────────────────────────────────────────

    private ProductionState restore(String projectId, String targetHash, boolean automatic, String note) {
        transition(projectId, ProductionStatus.QUEUED, UnaryOperator.identity());
        transition(projectId, ProductionStatus.BUILDING, s -> s.withStartedAt(clock.instant()));
        try {
            StartedRelease started = startRelease(projectId, targetHash);
            ProductionState state = transition(projectId, ProductionStatus.RUNNING, s -> s
                    .withHash(targetHash)
                    .withPort(started.basePort())
                    .withUrl(productionUrl(started.basePort()))
                    .withError(note)
                    .withStartedAt(clock.instant()));
            if (metrics != null) {
                metrics.recordRollback(automatic, true);
            }
            log.info("Project {} rolled back to {} on port {}{}", projectId, targetHash, started.basePort(),
                    automatic ? " (automatic)" : "");
            cleanup(projectId);
            return state;
        } catch (IOException | RuntimeException e) {
            String error = "Rollback to " + targetHash + " failed: " + e.getMessage();
            ProductionState current = getStatus(projectId);
            if (current.status().canTransitionTo(ProductionStatus.FAILED)) {
                projectStore.updateProduction(projectId, current.status(),
                        current.withStatus(ProductionStatus.FAILED).withError(error));
            }
            if (metrics != null) {
                metrics.recordRollback(automatic, false);
            }
            throw new RollbackFailedException(error, e);
        }
    }

    private ProductionState transition(String projectId, ProductionStatus to, UnaryOperator<ProductionState> change) {
        ProductionState current = getStatus(projectId);
        if (!current.status().canTransitionTo(to)) {
            throw new InvalidTransitionException(projectId, current.status(), to);
        }
        ProductionState next = change.apply(current).withStatus(to);
        if (!projectStore.updateProduction(projectId, current.status(), next)) {
            throw new InvalidTransitionException("Production status of project " + projectId + " changed concurrently");
        }
        log.debug("Project {} production {} -> {}", projectId, current.status().value(), to.value());
        return next;
    }

    private void stopContainerQuietly(String projectId) {
        try {
            runtime.stopProduction(projectId);
        } catch (RuntimeException e) {
            log.warn("Failed to stop production container for project {}: {}", projectId, e.getMessage());
        }
    }

    private Project requireProject(String projectId) {
        return projectStore.findById(projectId).orElseThrow(() -> new ProjectNotFoundException(projectId));
    }

    static String productionUrl(int port) {
        return "http://localhost:" + port;
    }

    /**
     * Outcome of {@link #startRelease}.
     *
     * @param previousHash release that was current before this one, or null
     */
    public record StartedRelease(String hash, int basePort, int versionPort, String previousHash) {}
}
