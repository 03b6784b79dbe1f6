package com.sentinel.core.diff;

import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Accumulates name → signature pairs; repeated names (overloads) merge into one
 * order-independent entry.
 */
final class Symbols {

    private final Map<String, TreeSet<String>> byName = new TreeMap<>();

    void add(String name, String signature) {
        if (name == null || name.isBlank()) {
            return;
        }
        byName.computeIfAbsent(name, k -> new TreeSet<>()).add(SourceText.normalize(signature));
    }

    Map<String, String> toMap() {
        var result = new TreeMap<String, String>();
        byName.forEach((name, sigs) -> result.put(name, String.join(" | ", sigs)));
        return result;
    }
}
