package com.sentinel.core.audit;

import com.sentinel.core.model.CascadeMode;
import com.sentinel.core.model.ChangeRadiusViolation;
import com.sentinel.core.model.Manifest;
import com.sentinel.core.model.RadiusAxis;
import com.sentinel.core.model.RunResult;
import com.sentinel.core.model.TierExitReason;
import com.sentinel.core.model.TierResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ManifestWriterTest {

    @TempDir
    Path tempDir;

    static Manifest manifest(RunResult result, String error) {
        return manifest("SENTINEL-TASK-001", result, error);
    }

    static Manifest manifest(String taskId, RunResult result, String error) {
        return new Manifest(
                taskId, "TASK-001", result, 2, 7, 0.42,
                List.of("src/A.java", "src/B.java"),
                List.of(TierResult.skipped(1),
                        new TierResult(2, true, false, result == RunResult.PASS, 7, 0.42, 12.5,
                                result == RunResult.PASS ? TierExitReason.PASSED : TierExitReason.ITERATION_CAP)),
                List.of(new ChangeRadiusViolation(RadiusAxis.CROSS_WAVE, 1, 0)),
                CascadeMode.AUTO, "warned 1 pending task", error,
                Instant.parse("2026-01-01T10:00:00Z"), Instant.parse("2026-01-01T10:05:00Z"));
    }

    @Nested
    @DisplayName("write")
    class Write {

        @Test
        @DisplayName("Writes the manifest, patch and summary triple")
        void writesTriple() throws IOException {
            var writer = new ManifestWriter(tempDir.resolve("runs"));

            Path dir = writer.write(manifest(RunResult.PASS, null), "diff --git a/x b/x\n");

            assertEquals(tempDir.resolve("runs").resolve("SENTINEL-TASK-001"), dir);
            assertTrue(Files.isRegularFile(dir.resolve(ManifestWriter.MANIFEST)));
            assertEquals("diff --git a/x b/x\n", Files.readString(dir.resolve(ManifestWriter.PATCH)));
            assertTrue(Files.readString(dir.resolve(ManifestWriter.SUMMARY)).startsWith("# SENTINEL-TASK-001: PASS"));
            try (Stream<Path> files = Files.list(dir)) {
                assertEquals(3, files.count(), "no temp files left behind");
            }
        }

        @Test
        @DisplayName("Manifest JSON uses snake_case keys and ISO timestamps")
        void snakeCase() throws IOException {
            var writer = new ManifestWriter(tempDir);
            Path dir = writer.write(manifest(RunResult.FAIL, null), "");

            String json = Files.readString(dir.resolve(ManifestWriter.MANIFEST));
            assertTrue(json.contains("\"task_id\" : \"SENTINEL-TASK-001\""));
            assertTrue(json.contains("\"tier_used\" : 2"));
            assertTrue(json.contains("\"cost_usd\" : 0.42"));
            assertTrue(json.contains("\"files_changed\""));
            assertTrue(json.contains("\"axis\" : \"cross_wave\""));
            assertTrue(json.contains("\"started_at\" : \"2026-01-01T10:00:00Z\""));
        }

        @Test
        @DisplayName("An empty patch is written as an empty file")
        void emptyPatch() throws IOException {
            var writer = new ManifestWriter(tempDir);
            Path dir = writer.write(manifest(RunResult.FAIL, null), null);
            assertEquals("", Files.readString(dir.resolve(ManifestWriter.PATCH)));
        }

        @Test
        @DisplayName("Write failure raises ManifestWriteException carrying the run result")
        void failure() throws IOException {
            Path blocker = tempDir.resolve("not-a-dir");
            Files.writeString(blocker, "x");
            var writer = new ManifestWriter(blocker);

            var e = assertThrows(ManifestWriteException.class, () -> writer.write(manifest(RunResult.ERROR, "boom"), ""));
            assertEquals(RunResult.ERROR, e.result());
            assertTrue(e.getMessage().contains("ERROR"));
            assertEquals("SENTINEL-TASK-001", e.sentinelTaskId());
        }

        @Test
        @DisplayName("An existing triple is never replaced")
        void existingTriple() throws IOException {
            var writer = new ManifestWriter(tempDir);
            Path dir = writer.write(manifest(RunResult.PASS, null), "first\n");
            assertTrue(writer.exists("SENTINEL-TASK-001"));

            var e = assertThrows(ManifestWriteException.class, () -> writer.write(manifest(RunResult.FAIL, null), "second\n"));

            assertInstanceOf(FileAlreadyExistsException.class, e.getCause());
            assertEquals(RunResult.FAIL, e.result());
            assertEquals(RunResult.PASS, writer.read("SENTINEL-TASK-001").orElseThrow().result());
            assertEquals("first\n", Files.readString(dir.resolve(ManifestWriter.PATCH)));
        }

        @Test
        @DisplayName("A task id that would leave the audit directory is rejected")
        void escapingTaskId() {
            var writer = new ManifestWriter(tempDir.resolve("runs"));

            var e = assertThrows(ManifestWriteException.class, () -> writer.write(manifest("../escape", RunResult.PASS, null), ""));

            assertInstanceOf(IllegalArgumentException.class, e.getCause());
            assertFalse(Files.exists(tempDir.resolve("escape")));
        }
    }

    @Test
    @DisplayName("dirFor accepts only single path segments")
    void dirFor() {
        var writer = new ManifestWriter(tempDir);
        assertEquals(tempDir.resolve("SENTINEL-TASK-001"), writer.dirFor("SENTINEL-TASK-001"));
        for (String id : List.of("../x", "a/b", "a\\b", "..", ".", "", "/etc")) {
            assertThrows(IllegalArgumentException.class, () -> writer.dirFor(id), id);
        }
        assertFalse(writer.exists("SENTINEL-MISSING"));
    }

    @Test
    @DisplayName("read returns what write persisted")
    void readBack() {
        var writer = new ManifestWriter(tempDir);
        Manifest original = manifest(RunResult.FAIL, null);
        writer.write(original, "");

        assertEquals(original, writer.read("SENTINEL-TASK-001").orElseThrow());
        assertTrue(writer.read("SENTINEL-MISSING").isEmpty());
    }
}
