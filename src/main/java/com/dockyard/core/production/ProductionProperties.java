package com.dockyard.core.production;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "dockyard.production")
public class ProductionProperties {

    private String root = "data/production";
    private String buildCommand = "pnpm run build";
    private String distDir = "dist";
    private String dockerfile = "Dockerfile.prod";
    private String defaultDockerfile = """
            FROM node:20-alpine
            WORKDIR /app
            COPY dist/ ./
            RUN npm install -g serve@14
            EXPOSE 3000
            CMD ["serve", "-s", ".", "-l", "3000"]
            """;
    private Duration buildTimeout = Duration.ofMinutes(5);
    private Duration readyTimeout = Duration.ofMinutes(5);
    private Duration readyPollInterval = Duration.ofSeconds(2);
    private Duration probeTimeout = Duration.ofSeconds(5);
    private int keepVersions = 2;
    private boolean autoRollback = true;

    public String getRoot() { return root; }
    public void setRoot(String root) { this.root = root; }
    public String getBuildCommand() { return buildCommand; }
    public void setBuildCommand(String buildCommand) { this.buildCommand = buildCommand; }
    public String getDistDir() { return distDir; }
    public void setDistDir(String distDir) { this.distDir = distDir; }
    public String getDockerfile() { return dockerfile; }
    public void setDockerfile(String dockerfile) { this.dockerfile = dockerfile; }
    public String getDefaultDockerfile() { return defaultDockerfile; }
    public void setDefaultDockerfile(String defaultDockerfile) { this.defaultDockerfile = defaultDockerfile; }
    public Duration getBuildTimeout() { return buildTimeout; }
    public void setBuildTimeout(Duration buildTimeout) { this.buildTimeout = buildTimeout; }
    public Duration getReadyTimeout() { return readyTimeout; }
    public void setReadyTimeout(Duration readyTimeout) { this.readyTimeout = readyTimeout; }
    public Duration getReadyPollInterval() { return readyPollInterval; }
    public void setReadyPollInterval(Duration readyPollInterval) { this.readyPollInterval = readyPollInterval; }
    public Duration getProbeTimeout() { return probeTimeout; }
    public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }
    public int getKeepVersions() { return keepVersions; }
    public void setKeepVersions(int keepVersions) { this.keepVersions = keepVersions; }
    public boolean isAutoRollback() { return autoRollback; }
    public void setAutoRollback(boolean autoRollback) { this.autoRollback = autoRollback; }
}
