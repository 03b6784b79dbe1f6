package com.sentinel.core.model;

import java.io.Serializable;

/**
 * Tracks a single file change in the working tree since a Sentinel run began.
 *
 * @param path         relative path within the project
 * @param action       one of "created", "modified", "deleted"
 * @param linesAdded   lines added
 * @param linesRemoved lines removed
 */
public record FileChange(
    String path,
    String action,
    int linesAdded,
    int linesRemoved
) implements Serializable {

    public int grossLines() {
        return linesAdded + linesRemoved;
    }
}
