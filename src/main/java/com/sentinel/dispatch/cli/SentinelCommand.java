package com.sentinel.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for the Integration Sentinel.
 * Routes to subcommands: inject, run, inspect, health.
 */
@Command(
        name = "sentinel",
        mixinStandardHelpOptions = true,
        version = "Integration Sentinel 0.1.0",
        description = "Per-task validation loop for wave-based build orchestration",
        subcommands = {
                InjectCommand.class,
                RunCommand.class,
                InspectCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SentinelCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
