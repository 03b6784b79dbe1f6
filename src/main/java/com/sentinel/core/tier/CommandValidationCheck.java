package com.sentinel.core.tier;

import com.sentinel.core.config.SentinelProperties;
import com.sentinel.core.model.Task;
import com.sentinel.core.model.TestResult;
import com.sentinel.core.runner.SentinelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Validation check that runs the configured test command through {@code sh -c}
 * in the project root and parses its output.
 */
@Component
public class CommandValidationCheck implements ValidationCheck {

    private static final Logger log = LoggerFactory.getLogger(CommandValidationCheck.class);

    private final Path workDir;
    private final String command;
    private final int timeoutSeconds;
    private final TestOutputParser parser = new TestOutputParser();

    @Autowired
    public CommandValidationCheck(SentinelProperties properties) {
        this(properties.projectRootPath(),
                properties.getValidation().getCommand(),
                properties.getValidation().getTimeoutSeconds());
    }

    public CommandValidationCheck(Path workDir, String command, int timeoutSeconds) {
        this.workDir = workDir;
        this.command = command;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public TestResult run(Task task) {
        log.info("Validating {} with '{}'", task.id(), command);
        long start = System.currentTimeMillis();
        Process process;
        try {
            process = new ProcessBuilder(List.of("sh", "-c", command))
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new SentinelException("Could not start validation command '" + command + "'", e);
        }

        // Drain output on a separate thread so a chatty test run cannot block on a full pipe
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                long elapsed = System.currentTimeMillis() - start;
                log.warn("Validation command for {} timed out after {}s", task.id(), timeoutSeconds);
                return new TestResult(task.id(), false, 0, 0,
                        "Validation timed out after " + timeoutSeconds + "s", elapsed);
            }
            String text = output.get(10, TimeUnit.SECONDS);
            long elapsed = System.currentTimeMillis() - start;
            return parser.parse(task.id(), text, process.exitValue(), elapsed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new SentinelException("Interrupted while validating " + task.id(), e);
        } catch (ExecutionException | java.util.concurrent.TimeoutException e) {
            throw new SentinelException("Could not read validation output for " + task.id(), e);
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SentinelException("Failed reading validation output", e);
        }
    }
}
