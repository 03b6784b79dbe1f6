package com.sentinel.core.tier;

import java.util.List;

/**
 * Structured answer expected from a repair model call.
 *
 * @param summary one-paragraph explanation of the fix
 * @param edits   whole-file replacements
 */
public record RepairPlan(
    String summary,
    List<FileEdit> edits
) {

    /**
     * @param path    project-relative path
     * @param content complete new file content
     */
    public record FileEdit(String path, String content) {}
}
