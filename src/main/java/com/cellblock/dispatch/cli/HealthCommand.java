package com.cellblock.dispatch.cli;

import com.cellblock.core.health.HealthCheckService;
import com.cellblock.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: cellblock health
 * <p>
 * Reports whether this machine can host runtimes: a java executable to spawn them with,
 * an endpoint for spawned runtimes to call back into, and the state of the name pool.
 * Exits with 1 when any of them is not up, so scripts can gate on it.
 */
@Command(name = "health", mixinStandardHelpOptions = true,
        description = "Check that runtimes can be spawned and reached")
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
            ConsoleOutput.error("No health checks configured");
            return 1;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        long notUp = checks.stream().filter(check -> check.status() != HealthStatus.Status.UP).count();
        checks.forEach(HealthCommand::print);

        ConsoleOutput.rule();
        if (notUp == 0) {
            ConsoleOutput.success("Ready to host runtimes (" + checks.size() + " checks passed)");
            return 0;
        }
        ConsoleOutput.error("Not ready: " + notUp + " of " + checks.size() + " checks failed");
        return 1;
    }

    private static void print(HealthStatus check) {
        String label = check.component() + ": " + check.detail();
        switch (check.status()) {
            case UP -> ConsoleOutput.success(label);
            case DEGRADED -> ConsoleOutput.info(label);
            case DOWN -> ConsoleOutput.error(label);
        }
        check.metadata().forEach((key, value) -> ConsoleOutput.info("  " + key + " = " + value));
    }
}
