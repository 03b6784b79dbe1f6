package com.sentinel.core.audit;

import com.sentinel.core.model.RunResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SummaryRendererTest {

    @Test
    @DisplayName("Summary names outcome, tiers, files, violations and cascade decision")
    void sections() {
        String summary = SummaryRenderer.render(ManifestWriterTest.manifest(RunResult.FAIL, null));

        assertTrue(summary.startsWith("# SENTINEL-TASK-001: FAIL"));
        assertTrue(summary.contains("Validation of TASK-001 still fails after all tiers (7 iterations, $0.4200)"));
        assertTrue(summary.contains("- Tier 1: skipped (UNAVAILABLE)"));
        assertTrue(summary.contains("- Tier 2: failed after 7 iterations, 12.5s, $0.4200 (ITERATION_CAP)"));
        assertTrue(summary.contains("- `src/A.java`"));
        assertTrue(summary.contains("- cross_wave: observed 1, budget 0"));
        assertTrue(summary.contains("Cascade (auto): warned 1 pending task"));
        assertFalse(summary.contains("## Error"));
    }

    @Test
    @DisplayName("Errors get their own section")
    void error() {
        String summary = SummaryRenderer.render(ManifestWriterTest.manifest(RunResult.ERROR, "SentinelException: git failed"));
        assertTrue(summary.contains("ended with an internal error"));
        assertTrue(summary.contains("## Error\n\nSentinelException: git failed"));
    }
}
