package com.dockyard.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "dockyard.sandbox")
public class SandboxProperties {

    private String dockerHost = "unix:///var/run/docker.sock";
    private Duration connectionTimeout = Duration.ofSeconds(10);
    private Duration responseTimeout = Duration.ofMinutes(2);
    private Duration probeTimeout = Duration.ofSeconds(2);
    private Duration readyTimeout = Duration.ofMinutes(5);
    private Duration readyPollInterval = Duration.ofSeconds(1);

    private Preview preview = new Preview();
    private Runtime runtime = new Runtime();
    private Production production = new Production();

    public String getDockerHost() { return dockerHost; }
    public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
    public Duration getConnectionTimeout() { return connectionTimeout; }
    public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }
    public Duration getResponseTimeout() { return responseTimeout; }
    public void setResponseTimeout(Duration responseTimeout) { this.responseTimeout = responseTimeout; }
    public Duration getProbeTimeout() { return probeTimeout; }
    public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }
    public Duration getReadyTimeout() { return readyTimeout; }
    public void setReadyTimeout(Duration readyTimeout) { this.readyTimeout = readyTimeout; }
    public Duration getReadyPollInterval() { return readyPollInterval; }
    public void setReadyPollInterval(Duration readyPollInterval) { this.readyPollInterval = readyPollInterval; }
    public Preview getPreview() { return preview; }
    public void setPreview(Preview preview) { this.preview = preview; }
    public Runtime getRuntime() { return runtime; }
    public void setRuntime(Runtime runtime) { this.runtime = runtime; }
    public Production getProduction() { return production; }
    public void setProduction(Production production) { this.production = production; }

    /** Dev server container serving the live preview. */
    public static class Preview {
        private String image = "node:20-alpine";
        private int containerPort = 4321;
        private String command = "corepack enable && pnpm install && pnpm dev --host 0.0.0.0 --port 4321";
        private String healthPath = "/";

        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public int getContainerPort() { return containerPort; }
        public void setContainerPort(int containerPort) { this.containerPort = containerPort; }
        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public String getHealthPath() { return healthPath; }
        public void setHealthPath(String healthPath) { this.healthPath = healthPath; }
    }

    /** Agent runtime container the AI session talks to. */
    public static class Runtime {
        private String image = "ghcr.io/sst/opencode:latest";
        private int containerPort = 4096;
        private String healthPath = "/";
        private Duration requestTimeout = Duration.ofSeconds(10);

        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public int getContainerPort() { return containerPort; }
        public void setContainerPort(int containerPort) { this.containerPort = containerPort; }
        public String getHealthPath() { return healthPath; }
        public void setHealthPath(String healthPath) { this.healthPath = healthPath; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }

    public static class Production {
        private int containerPort = 3000;
        private Duration imageBuildTimeout = Duration.ofMinutes(5);

        public int getContainerPort() { return containerPort; }
        public void setContainerPort(int containerPort) { this.containerPort = containerPort; }
        public Duration getImageBuildTimeout() { return imageBuildTimeout; }
        public void setImageBuildTimeout(Duration imageBuildTimeout) { this.imageBuildTimeout = imageBuildTimeout; }
    }
}
