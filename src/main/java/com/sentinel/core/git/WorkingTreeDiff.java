package com.sentinel.core.git;

import com.sentinel.core.model.FileChange;

import java.util.List;

/**
 * Working-tree changes since a {@link Baseline}.
 *
 * @param patch raw unified diff; empty string when nothing changed
 * @param files per-file change records in diff order
 */
public record WorkingTreeDiff(
    String patch,
    List<FileChange> files
) {

    public WorkingTreeDiff {
        patch = patch != null ? patch : "";
        files = files != null ? List.copyOf(files) : List.of();
    }

    public static WorkingTreeDiff empty() {
        return new WorkingTreeDiff("", List.of());
    }

    public List<String> paths() {
        return files.stream().map(FileChange::path).toList();
    }
}
