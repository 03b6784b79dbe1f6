package com.sentinel.core.diff;

import com.sentinel.core.model.InterfaceReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Structural comparison of a file's top-level symbols before and after a change.
 * <p>
 * Comments and whitespace are removed before symbols are extracted, so reformatting
 * or re-commenting a declaration never reports it as changed. Files in languages
 * without an extractor produce an empty report. The result only feeds change-radius
 * evaluation; nothing here blocks a run.
 */
@Component
public class InterfaceDiff {

    private static final Logger log = LoggerFactory.getLogger(InterfaceDiff.class);

    private final Map<String, SymbolExtractor> byExtension = new HashMap<>();

    public InterfaceDiff() {
        for (var extractor : List.of(new JavaSymbolExtractor(), new PythonSymbolExtractor(),
                new ScriptSymbolExtractor(), new GoSymbolExtractor())) {
            for (String ext : extractor.extensions()) {
                byExtension.put(ext, extractor);
            }
        }
    }

    public boolean supports(String path) {
        return extractorFor(path) != null;
    }

    /**
     * @param path   project-relative path (selects the language)
     * @param before content at baseline; empty for a created file
     * @param after  current content; empty for a deleted file
     */
    public InterfaceReport compare(String path, String before, String after) {
        SymbolExtractor extractor = extractorFor(path);
        if (extractor == null) {
            return InterfaceReport.empty(path);
        }
        Map<String, String> old = extractor.extract(before);
        Map<String, String> now = extractor.extract(after);

        var added = new TreeSet<String>();
        var removed = new TreeSet<String>();
        var changed = new TreeSet<String>();
        for (var entry : now.entrySet()) {
            String previous = old.get(entry.getKey());
            if (previous == null) {
                added.add(entry.getKey());
            } else if (!previous.equals(entry.getValue())) {
                changed.add(entry.getKey());
            }
        }
        for (String name : old.keySet()) {
            if (!now.containsKey(name)) {
                removed.add(name);
            }
        }
        var report = new InterfaceReport(path, added, removed, changed);
        if (report.hasChanges()) {
            log.info("Interface changes in {}: +{} -{} ~{}", path, added, removed, changed);
        }
        return report;
    }

    private SymbolExtractor extractorFor(String path) {
        if (path == null) {
            return null;
        }
        int dot = path.lastIndexOf('.');
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        if (dot < 0 || dot < slash) {
            return null;
        }
        return byExtension.get(path.substring(dot + 1).toLowerCase());
    }
}
