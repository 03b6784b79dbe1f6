package com.sentinel.core.tier;

import com.sentinel.core.llm.LlmService;
import com.sentinel.core.llm.StructuredResponse;
import com.sentinel.core.model.Task;
import com.sentinel.core.model.TestResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LlmRepairAgentTest {

    @TempDir
    Path root;

    private LlmService llm;
    private LlmRepairAgent agent;
    private RepairRequest request;

    @BeforeEach
    void setUp() throws IOException {
        llm = mock(LlmService.class);
        agent = new LlmRepairAgent(llm, new EditGuard(root, List.of(".sentinel/**")), 0.0025, 0.01);
        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve("src/Parser.java"), "class Parser { int parse() { return 0; } }");
        var task = new Task("TASK-001", "CODER", "Add parser", Set.of(), null, List.of("src/Parser.java"));
        request = new RepairRequest(task, 2, 1,
                new TestResult("TASK-001", false, 1, 1, "expected 1 but was 0", 10));
    }

    private void answer(RepairPlan plan, int promptTokens, int completionTokens) {
        when(llm.structuredCall(anyString(), anyString(), eq(RepairPlan.class)))
                .thenReturn(new StructuredResponse<>(plan, promptTokens, completionTokens));
    }

    @Test
    @DisplayName("Applies whole-file edits and prices the call from token usage")
    void appliesEdits() throws Exception {
        answer(new RepairPlan("return 1", List.of(
                new RepairPlan.FileEdit("src/Parser.java", "class Parser { int parse() { return 1; } }"))), 2000, 500);

        RepairOutcome outcome = agent.repair(request);

        assertEquals(List.of("src/Parser.java"), outcome.filesWritten());
        assertEquals(2 * 0.0025 + 0.5 * 0.01, outcome.costUsd(), 1e-9);
        assertTrue(Files.readString(root.resolve("src/Parser.java")).contains("return 1"));
    }

    @Test
    @DisplayName("Prompt carries the test output and current target file content")
    void prompt() {
        String prompt = agent.buildPrompt(request);
        assertTrue(prompt.contains("expected 1 but was 0"));
        assertTrue(prompt.contains("--- src/Parser.java ---"));
        assertTrue(prompt.contains("return 0"));
    }

    @Test
    @DisplayName("Edits into .git or the audit directory are rejected")
    void rejectsProtectedPaths() {
        answer(new RepairPlan("sneaky", List.of(
                new RepairPlan.FileEdit(".git/config", "x"),
                new RepairPlan.FileEdit(".sentinel/runs/a.json", "x"),
                new RepairPlan.FileEdit("../outside.txt", "x"))), 100, 100);

        var e = assertThrows(RepairException.class, () -> agent.repair(request));
        assertTrue(e.costUsd() > 0);
        assertFalse(Files.exists(root.resolve(".git/config")));
    }

    @Test
    @DisplayName("No edits and model failures become RepairException")
    void noEdits() {
        answer(new RepairPlan("nothing to do", List.of()), 10, 10);
        assertThrows(RepairException.class, () -> agent.repair(request));

        reset(llm);
        when(llm.structuredCall(anyString(), anyString(), any())).thenThrow(new IllegalStateException("connection refused"));
        var e = assertThrows(RepairException.class, () -> agent.repair(request));
        assertEquals(0.0, e.costUsd());
    }
}
