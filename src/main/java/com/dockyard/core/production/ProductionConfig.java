package com.dockyard.core.production;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class ProductionConfig {

    private static final Logger log = LoggerFactory.getLogger(ProductionConfig.class);

    @Bean
    public ReleaseStore releaseStore(ProductionProperties properties) {
        Path root = Path.of(properties.getRoot()).toAbsolutePath().normalize();
        log.info("Production releases stored under {}", root);
        return new ReleaseStore(root, properties.getDefaultDockerfile());
    }

    @Bean
    public BuildRunner buildRunner() {
        return new ProcessBuildRunner();
    }
}
