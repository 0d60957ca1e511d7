package com.keystone.dispatch.cli;

import com.keystone.core.health.HealthCheckService;
import com.keystone.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: keystone health
 * <p>
 * Runs all health checks and prints one line per component. Exits 1 only when
 * a component is DOWN; escalated tasks waiting for a human show as DEGRADED.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"--verbose", "-v"}, description = "Print component metadata")
    private boolean verbose;

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

        List<HealthStatus> checks = healthCheckService.checkAll();
        int down = 0;
        int degraded = 0;
        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    down++;
                }
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    degraded++;
                }
            }
            if (verbose) {
                check.metadata().forEach((key, value) -> System.out.println("    " + key + " = " + value));
            }
        }

        System.out.println("──────────────────────────────────");
        if (down > 0) {
            ConsoleOutput.error("Overall: DOWN (" + down + " of " + checks.size() + " components)");
        } else if (degraded > 0) {
            ConsoleOutput.warn("Overall: UP, " + degraded + " component(s) need a human");
        } else {
            ConsoleOutput.success("Overall: all components UP");
        }
        return down > 0 ? 1 : 0;
    }
}
