package com.socmind.dispatch.cli;

import com.socmind.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: socmind health
 * <p>
 * Prints each health check; exits 1 when a component is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check engine health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        boolean anyDown = false;
        boolean allUp = true;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    allUp = false;
                }
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                    anyDown = true;
                }
            }
            check.metadata().forEach((k, v) -> System.out.println("    " + k + ": " + v));
        }
        ConsoleOutput.rule();
        if (allUp) {
            ConsoleOutput.success("Overall: all components operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
        return anyDown ? 1 : 0;
    }
}
