package com.sentinel.dispatch.cli;

import com.sentinel.core.health.HealthCheckService;
import com.sentinel.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: sentinel health
 * <p>
 * A DEGRADED local tier is reported but does not fail the command, since runs
 * still cascade to the cloud tier. Any DOWN component exits with {@link #EXIT_UNHEALTHY}.
 */
@Command(name = "health", mixinStandardHelpOptions = true,
        description = "Check the model tiers and the audit directory")
@Component
public class HealthCommand implements Callable<Integer> {

    static final int EXIT_UNHEALTHY = 2;

    @Option(names = {"-v", "--verbose"}, description = "Show the endpoint, model or path behind each check")
    private boolean verbose;

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            report(check);
        }

        System.out.println("──────────────────────────────────");
        boolean anyDown = checks.stream().anyMatch(c -> c.status() == HealthStatus.Status.DOWN);
        if (anyDown) {
            ConsoleOutput.error("Overall: one or more components down");
            return EXIT_UNHEALTHY;
        }
        if (checks.stream().allMatch(HealthStatus::isUp)) {
            ConsoleOutput.success("Overall: all components operational");
        } else {
            ConsoleOutput.warn("Overall: one or more components degraded");
        }
        return 0;
    }

    private void report(HealthStatus check) {
        String label = check.component() + ": " + check.detail();
        switch (check.status()) {
            case UP -> ConsoleOutput.success(label);
            case DEGRADED -> ConsoleOutput.warn(label);
            case DOWN -> ConsoleOutput.error(label);
        }
        if (verbose) {
            check.metadata().forEach((key, value) -> ConsoleOutput.info("    " + key + " = " + value));
        }
    }
}
