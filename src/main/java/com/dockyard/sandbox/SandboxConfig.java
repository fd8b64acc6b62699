package com.dockyard.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SandboxConfig {

    @Bean
    public DockerClient dockerClient(SandboxProperties properties) {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", properties.getDockerHost());
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .connectionTimeout(properties.getConnectionTimeout())
                .responseTimeout(properties.getResponseTimeout())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public ContainerRuntime containerRuntime(DockerClient dockerClient, SandboxProperties properties) {
        return new DockerContainerRuntime(dockerClient, properties);
    }

    @Bean
    public HealthProbe healthProbe() {
        return new HealthProbe();
    }

    @Bean
    public AgentRuntimeClient agentRuntimeClient(ObjectMapper objectMapper, SandboxProperties properties) {
        return new AgentRuntimeClient(objectMapper, properties.getRuntime().getRequestTimeout());
    }
}
