package com.dockyard.sandbox;

import com.dockyard.core.project.Project;

import java.nio.file.Path;

/**
 * Abstraction over the container engine. Every call blocks until the engine
 * answers or the configured command timeout elapses; failures surface as
 * unchecked exceptions so the calling job can be retried.
 */
public interface ContainerRuntime {

    /**
     * Starts the preview server and agent runtime containers for a project,
     * replacing any stale containers left by a previous run.
     */
    void startPreview(Project project);

    /**
     * Stops and removes the preview and agent runtime containers. Containers that
     * are already gone are ignored.
     */
    void stopPreview(String projectId);

    /**
     * Builds the production image from the {@code Dockerfile} at the root of a release directory.
     *
     * @return the image tag, {@code prod-<projectId>:<hash>}
     */
    String buildProductionImage(String projectId, String hash, Path releaseDir);

    /**
     * Runs the production container, publishing the container port on both host ports.
     *
     * @return the container id
     */
    String startProduction(String projectId, String image, int basePort, int versionPort);

    void stopProduction(String projectId);

    void removeProductionImages(String projectId);

    /** True when the engine answers a ping. */
    boolean ping();

    static String previewContainerName(String projectId) {
        return "preview-" + projectId;
    }

    static String runtimeContainerName(String projectId) {
        return "runtime-" + projectId;
    }

    static String productionContainerName(String projectId) {
        return "prod-" + projectId;
    }

    static String productionImage(String projectId, String hash) {
        return "prod-" + projectId + ":" + hash;
    }
}
