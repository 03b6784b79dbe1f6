package com.sentinel.dispatch.cli;

import com.sentinel.core.health.HealthCheckService;
import com.sentinel.core.health.HealthStatus;
import com.sentinel.core.runner.SentinelException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CliRunnerTest {

    private final HealthCheckService healthCheckService = mock(HealthCheckService.class);

    private CliRunner runner() {
        CommandLine.IFactory factory = new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
        return new CliRunner(new SentinelCommand(), factory);
    }

    @Test
    @DisplayName("Exit code of the executed command is exposed to Spring Boot")
    void exitCode() {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                HealthStatus.up("audit-dir", "Audit directory writable", Map.of())));
        CliRunner runner = runner();

        runner.run("health");

        assertEquals(0, runner.getExitCode());
    }

    @Test
    @DisplayName("A SentinelException escaping a command becomes exit code 1")
    void collaboratorFault() {
        when(healthCheckService.checkAll()).thenThrow(new SentinelException("git ls-files failed"));
        CliRunner runner = runner();

        runner.run("health");

        assertEquals(RunCommand.EXIT_ERROR, runner.getExitCode());
    }

    @Test
    @DisplayName("Unknown options are usage errors")
    void usageError() {
        CliRunner runner = runner();
        runner.run("--bogus");
        assertEquals(CommandLine.ExitCode.USAGE, runner.getExitCode());
    }
}
