package com.sentinel.core.model;

import java.io.Serializable;
import java.util.Set;

/**
 * Structural changes to the top-level symbols of one modified file.
 */
public record InterfaceReport(
    String path,
    Set<String> symbolsAdded,
    Set<String> symbolsRemoved,
    Set<String> symbolsChanged
) implements Serializable {

    public InterfaceReport {
        symbolsAdded = symbolsAdded != null ? Set.copyOf(symbolsAdded) : Set.of();
        symbolsRemoved = symbolsRemoved != null ? Set.copyOf(symbolsRemoved) : Set.of();
        symbolsChanged = symbolsChanged != null ? Set.copyOf(symbolsChanged) : Set.of();
    }

    public static InterfaceReport empty(String path) {
        return new InterfaceReport(path, Set.of(), Set.of(), Set.of());
    }

    public int changeCount() {
        return symbolsAdded.size() + symbolsRemoved.size() + symbolsChanged.size();
    }

    public boolean hasChanges() {
        return changeCount() > 0;
    }
}
