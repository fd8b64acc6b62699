package com.dockyard.sandbox;

import com.dockyard.core.project.Project;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.BuildImageResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Image;
import com.github.dockerjava.api.model.Ports;
import com.github.dockerjava.api.model.RestartPolicy;
import com.github.dockerjava.api.model.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * {@link ContainerRuntime} backed by the Docker Engine API.
 *
 * <p>Per project it manages three containers:
 * <ul>
 *   <li>{@code preview-<id>}: dev server with the project directory mounted at /app</li>
 *   <li>{@code runtime-<id>}: agent runtime with the project directory mounted at /workspace</li>
 *   <li>{@code prod-<id>}: production image built from a release directory</li>
 * </ul>
 * All containers carry the {@value #PROJECT_LABEL} label.
 */
public class DockerContainerRuntime implements ContainerRuntime {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerRuntime.class);

    static final String PROJECT_LABEL = "dockyard.project";

    private final DockerClient dockerClient;
    private final SandboxProperties properties;

    public DockerContainerRuntime(DockerClient dockerClient, SandboxProperties properties) {
        this.dockerClient = dockerClient;
        this.properties = properties;
    }

    @Override
    public void startPreview(Project project) {
        if (project.devPort() == null || project.runtimePort() == null) {
            throw new IllegalStateException("Project " + project.id() + " has no preview ports assigned");
        }
        var preview = properties.getPreview();
        var runtime = properties.getRuntime();

        String previewName = ContainerRuntime.previewContainerName(project.id());
        removeQuietly(previewName);
        String previewId = createAndStart(previewName, preview.getImage(), project,
                new Bind(project.path(), new Volume("/app"), AccessMode.rw), "/app",
                preview.getContainerPort(), project.devPort(),
                List.of("sh", "-c", preview.getCommand()));
        log.info("Preview container {} started ({}), port {}", previewName, previewId, project.devPort());

        String runtimeName = ContainerRuntime.runtimeContainerName(project.id());
        removeQuietly(runtimeName);
        String runtimeId = createAndStart(runtimeName, runtime.getImage(), project,
                new Bind(project.path(), new Volume("/workspace"), AccessMode.rw), "/workspace",
                runtime.getContainerPort(), project.runtimePort(), List.of());
        log.info("Agent runtime container {} started ({}), port {}", runtimeName, runtimeId, project.runtimePort());
    }

    private String createAndStart(String name, String image, Project project, Bind bind, String workingDir,
                                  int containerPort, int hostPort, List<String> command) {
        ExposedPort exposed = ExposedPort.tcp(containerPort);
        Ports bindings = new Ports();
        bindings.bind(exposed, Ports.Binding.bindPort(hostPort));

        var hostConfig = HostConfig.newHostConfig()
                .withBinds(bind)
                .withPortBindings(bindings)
                .withExtraHosts("host.docker.internal:host-gateway");

        var create = dockerClient.createContainerCmd(image)
                .withName(name)
                .withHostConfig(hostConfig)
                .withExposedPorts(exposed)
                .withWorkingDir(workingDir)
                .withLabels(Map.of(PROJECT_LABEL, project.id()));
        if (!command.isEmpty()) {
            create = create.withCmd(command);
        }
        String containerId = create.exec().getId();
        dockerClient.startContainerCmd(containerId).exec();
        return containerId;
    }

    @Override
    public void stopPreview(String projectId) {
        stopAndRemove(ContainerRuntime.previewContainerName(projectId));
        stopAndRemove(ContainerRuntime.runtimeContainerName(projectId));
    }

    @Override
    public String buildProductionImage(String projectId, String hash, Path releaseDir) {
        String tag = ContainerRuntime.productionImage(projectId, hash);
        var production = properties.getProduction();
        log.info("Building production image {} from {}", tag, releaseDir);

        String imageId = dockerClient.buildImageCmd(releaseDir.toFile())
                .withTags(Set.of(tag))
                .withLabels(Map.of(PROJECT_LABEL, projectId))
                .exec(new BuildImageResultCallback())
                .awaitImageId(production.getImageBuildTimeout().toSeconds(), TimeUnit.SECONDS);
        log.info("Production image {} built ({})", tag, imageId);
        return tag;
    }

    @Override
    public String startProduction(String projectId, String image, int basePort, int versionPort) {
        String name = ContainerRuntime.productionContainerName(projectId);
        removeQuietly(name);

        ExposedPort exposed = ExposedPort.tcp(properties.getProduction().getContainerPort());
        Ports bindings = new Ports();
        bindings.bind(exposed, Ports.Binding.bindPort(basePort));
        bindings.bind(exposed, Ports.Binding.bindPort(versionPort));

        var hostConfig = HostConfig.newHostConfig()
                .withPortBindings(bindings)
                .withRestartPolicy(RestartPolicy.unlessStoppedRestart());

        String containerId = dockerClient.createContainerCmd(image)
                .withName(name)
                .withHostConfig(hostConfig)
                .withExposedPorts(exposed)
                .withLabels(Map.of(PROJECT_LABEL, projectId))
                .exec()
                .getId();
        dockerClient.startContainerCmd(containerId).exec();
        log.info("Production container {} started from {} on ports {} and {}", name, image, basePort, versionPort);
        return containerId;
    }

    @Override
    public void stopProduction(String projectId) {
        stopAndRemove(ContainerRuntime.productionContainerName(projectId));
    }

    @Override
    public void removeProductionImages(String projectId) {
        List<Image> images = dockerClient.listImagesCmd()
                .withLabelFilter(Map.of(PROJECT_LABEL, projectId))
                .exec();
        for (Image image : images) {
            try {
                dockerClient.removeImageCmd(image.getId()).withForce(true).exec();
                log.info("Removed production image {} for project {}", image.getId(), projectId);
            } catch (NotFoundException e) {
                log.debug("Image {} already removed", image.getId());
            }
        }
    }

    @Override
    public boolean ping() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (RuntimeException e) {
            log.debug("Docker ping failed: {}", e.getMessage());
            return false;
        }
    }

    private void stopAndRemove(String containerName) {
        try {
            dockerClient.stopContainerCmd(containerName).withTimeout(10).exec();
        } catch (NotFoundException e) {
            log.debug("Container {} not found; nothing to stop", containerName);
            return;
        } catch (NotModifiedException e) {
            log.debug("Container {} was already stopped", containerName);
        }
        removeQuietly(containerName);
        log.info("Container {} stopped and removed", containerName);
    }

    private void removeQuietly(String containerName) {
        try {
            dockerClient.removeContainerCmd(containerName).withForce(true).exec();
            log.debug("Removed container {}", containerName);
        } catch (NotFoundException e) {
            log.trace("No container {} to remove", containerName);
        }
    }
}
