package com.sentinel.core.tier;

import com.sentinel.core.model.Task;
import com.sentinel.core.model.TestResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CommandValidationCheckTest {

    private static final Task TASK = new Task("SENTINEL-TASK-001", "Sentinel", "v", Set.of("TASK-001"), null, List.of());

    @TempDir
    Path workDir;

    @Test
    @DisplayName("Parses the command's test summary")
    void parsesOutput() {
        var check = new CommandValidationCheck(workDir, "echo 'Tests run: 3, Failures: 0, Errors: 0'", 30);
        TestResult result = check.run(TASK);
        assertTrue(result.passed());
        assertEquals(3, result.totalTests());
    }

    @Test
    @DisplayName("Non-zero exit fails validation")
    void nonZeroExit() {
        var check = new CommandValidationCheck(workDir, "echo broken >&2; exit 2", 30);
        TestResult result = check.run(TASK);
        assertFalse(result.passed());
        assertTrue(result.output().contains("broken"));
    }

    @Test
    @DisplayName("A command exceeding its timeout fails validation")
    void timeout() {
        var check = new CommandValidationCheck(workDir, "sleep 10", 1);
        TestResult result = check.run(TASK);
        assertFalse(result.passed());
        assertTrue(result.output().contains("timed out"));
    }
}
