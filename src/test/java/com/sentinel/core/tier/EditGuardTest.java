package com.sentinel.core.tier;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EditGuardTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("Paths inside the project resolve; traversal, .git and denied globs do not")
    void resolveWritable() {
        var guard = new EditGuard(root, List.of(".sentinel/runs/**", "tasks.md"));

        assertEquals(root.toAbsolutePath().normalize().resolve("src/A.java"),
                guard.resolveWritable("./src/A.java").orElseThrow());
        assertTrue(guard.resolveWritable("../escape.txt").isEmpty());
        assertTrue(guard.resolveWritable(".git/HEAD").isEmpty());
        assertTrue(guard.resolveWritable(".sentinel/runs/SENTINEL-T/manifest.json").isEmpty());
        assertTrue(guard.resolveWritable("tasks.md").isEmpty());
        assertTrue(guard.resolveWritable("").isEmpty());
        assertTrue(guard.resolveWritable(".").isEmpty());
    }
}
