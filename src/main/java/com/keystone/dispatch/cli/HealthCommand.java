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
 * Checks the attempt graph, tool servers, memory store and LLM configuration. Exits 1 when
 * any reported component is DOWN, so the command doubles as a readiness probe.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"--component", "-c"}, split = ",",
            description = "Only report these components (graph, tools, memory, llm)")
    private List<String> components;

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

        List<HealthStatus> checks = healthCheckService.checkAll().stream()
                .filter(check -> components == null || components.contains(check.component()))
                .toList();
        if (checks.isEmpty()) {
            ConsoleOutput.error("No component matches " + components);
            return 1;
        }

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
            check.metadata().forEach((key, value) -> System.out.println("    " + key + ": " + value));
        }

        System.out.println(ConsoleOutput.RULE);
        return switch (HealthStatus.overall(checks)) {
            case UP -> {
                ConsoleOutput.success("Overall: all systems operational");
                yield 0;
            }
            case DEGRADED -> {
                ConsoleOutput.warn("Overall: degraded, some runs may fail");
                yield 0;
            }
            case DOWN -> {
                ConsoleOutput.error("Overall: one or more components down");
                yield 1;
            }
        };
    }
}
