package com.dockyard.dispatch.cli;

import com.dockyard.core.health.HealthCheckService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: dockyard health
 * <p>
 * Runs every health check and prints the results. Exits 1 when a component is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        boolean anyDown = false;
        boolean anyDegraded = false;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    anyDown = true;
                }
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    anyDegraded = true;
                }
            }
        }

        ConsoleOutput.rule();
        if (anyDown) {
            ConsoleOutput.error("Overall: one or more components down");
            return 1;
        }
        if (anyDegraded) {
            ConsoleOutput.warn("Overall: operational, degraded");
        } else {
            ConsoleOutput.success("Overall: all systems operational");
        }
        return 0;
    }
}
