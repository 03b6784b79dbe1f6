package com.sentinel.dispatch.cli;

import com.sentinel.core.runner.SentinelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments, delegates to the appropriate command and keeps its exit
 * code for {@link org.springframework.boot.SpringApplication#exit}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final SentinelCommand sentinelCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SentinelCommand sentinelCommand, IFactory factory) {
        this.sentinelCommand = sentinelCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine().execute(args);
    }

    CommandLine commandLine() {
        return new CommandLine(sentinelCommand, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler(CliRunner::handleExecutionException);
    }

    /**
     * Collaborator faults (git, plan, validation) end the command with exit code 1
     * and a one-line message instead of a stack trace; anything else propagates.
     */
    static int handleExecutionException(Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult)
            throws Exception {
        if (e instanceof SentinelException) {
            log.error("{} failed", commandLine.getCommandName(), e);
            ConsoleOutput.error(e.getMessage());
            return RunCommand.EXIT_ERROR;
        }
        throw e;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
