package com.sentinel.core.radius;

import com.sentinel.core.model.ExecutionPlan;
import com.sentinel.core.model.FileChange;
import com.sentinel.core.model.InterfaceReport;
import com.sentinel.core.model.Wave;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything the change-radius evaluation looks at.
 *
 * @param files        files changed since the run's baseline
 * @param interfaces   per-file interface reports
 * @param foreignLocks file locks held by waves other than the Sentinel's own
 */
public record RadiusInput(
    List<FileChange> files,
    List<InterfaceReport> interfaces,
    Set<String> foreignLocks
) {

    public RadiusInput {
        files = files != null ? List.copyOf(files) : List.of();
        interfaces = interfaces != null ? List.copyOf(interfaces) : List.of();
        foreignLocks = foreignLocks != null ? Set.copyOf(foreignLocks) : Set.of();
    }

    /**
     * Collects the file locks of every wave that does not contain {@code taskId}.
     */
    public static Set<String> foreignLocks(ExecutionPlan plan, String taskId) {
        var locks = new LinkedHashSet<String>();
        for (Wave wave : plan.waves()) {
            if (!wave.contains(taskId)) {
                locks.addAll(wave.fileLocks());
            }
        }
        return locks;
    }
}
