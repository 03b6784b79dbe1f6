package com.sentinel.core.plan;

import com.sentinel.core.model.ExecutionPlan;
import com.sentinel.core.model.Task;
import com.sentinel.core.model.TaskStatus;
import com.sentinel.core.model.Wave;
import com.sentinel.core.runner.SentinelException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PlanStoreTest {

    @TempDir
    Path dir;

    private final PlanStore store = new PlanStore();

    @Test
    @DisplayName("Reads waves, tolerating unknown fields and missing optional ones")
    void read() throws IOException {
        Path file = dir.resolve("plan.json");
        Files.writeString(file, """
                {
                  "objective": "ignored",
                  "waves": [
                    { "number": 1, "fileLocks": ["src/Cli.java"],
                      "tasks": [ { "id": "TASK-001", "agentRole": "CODER", "status": "DONE",
                                   "targetFiles": ["src/Cli.java"] } ] },
                    { "number": 2,
                      "tasks": [ { "id": "TASK-002", "agentRole": "TESTER", "dependencies": ["TASK-001"] } ] }
                  ]
                }
                """);

        ExecutionPlan plan = store.read(file);

        assertEquals(2, plan.waves().size());
        Task first = plan.findTask("TASK-001").orElseThrow();
        assertEquals(TaskStatus.DONE, first.status());
        assertEquals(List.of("src/Cli.java"), first.targetFiles());
        Task second = plan.findTask("TASK-002").orElseThrow();
        assertEquals(TaskStatus.PENDING, second.status());
        assertEquals(Set.of(), plan.waves().get(1).fileLocks());
        assertEquals(2, plan.waveOf("TASK-002").orElseThrow().number());
    }

    @Test
    @DisplayName("Written plans read back equal")
    void writeThenRead() {
        Path file = dir.resolve("plan.json");
        var parent = new Task("TASK-001", "CODER", "Add CLI", Set.of(), null, List.of("src/Cli.java"));
        var plan = new ExecutionPlan(List.of(
                new Wave(1, List.of(parent, Task.sentinelFor(parent)), Set.of("src/Cli.java"))));

        store.write(file, plan);

        assertEquals(plan, store.read(file));
    }

    @Test
    @DisplayName("Unreadable plan is a SentinelException")
    void missing() {
        assertThrows(SentinelException.class, () -> store.read(dir.resolve("nope.json")));
    }
}
