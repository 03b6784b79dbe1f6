package com.sentinel.core.radius;

import com.sentinel.core.config.SentinelProperties;
import com.sentinel.core.model.ChangeRadiusViolation;
import com.sentinel.core.model.FileChange;
import com.sentinel.core.model.InterfaceReport;
import com.sentinel.core.model.LineCountMode;
import com.sentinel.core.model.RadiusAxis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scores a change on four independent axes. Every axis is evaluated on every call
 * and contributes at most one violation.
 */
@Component
public class ChangeRadiusEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ChangeRadiusEvaluator.class);

    private final int maxFiles;
    private final int maxLines;
    private final boolean allowInterface;
    private final LineCountMode lineCountMode;

    @Autowired
    public ChangeRadiusEvaluator(SentinelProperties properties) {
        this(properties.getMaxFiles(), properties.getMaxLines(), properties.isAllowInterface(),
                properties.lineCounting());
    }

    public ChangeRadiusEvaluator(int maxFiles, int maxLines, boolean allowInterface, LineCountMode lineCountMode) {
        this.maxFiles = maxFiles;
        this.maxLines = maxLines;
        this.allowInterface = allowInterface;
        this.lineCountMode = lineCountMode;
    }

    public List<ChangeRadiusViolation> evaluate(RadiusInput input) {
        var violations = new ArrayList<ChangeRadiusViolation>();

        long files = input.files().stream().map(FileChange::path).distinct().count();
        if (files > maxFiles) {
            violations.add(new ChangeRadiusViolation(RadiusAxis.FILES, files, maxFiles));
        }

        long lines = countLines(input.files());
        if (lines > maxLines) {
            violations.add(new ChangeRadiusViolation(RadiusAxis.LINES, lines, maxLines));
        }

        long symbols = input.interfaces().stream().mapToLong(InterfaceReport::changeCount).sum();
        if (symbols > 0 && !allowInterface) {
            violations.add(new ChangeRadiusViolation(RadiusAxis.INTERFACE, symbols, 0));
        }

        Set<String> collisions = collisions(input.files(), input.foreignLocks());
        if (!collisions.isEmpty()) {
            log.warn("Files locked by other waves were modified: {}", collisions);
            violations.add(new ChangeRadiusViolation(RadiusAxis.CROSS_WAVE, collisions.size(), 0));
        }

        log.info("Change radius: {} file(s), {} line(s) ({}), {} symbol change(s), {} cross-wave -> {} violation(s)",
                files, lines, lineCountMode.name().toLowerCase(), symbols, collisions.size(), violations.size());
        return violations;
    }

    private long countLines(List<FileChange> files) {
        long added = files.stream().mapToLong(FileChange::linesAdded).sum();
        long removed = files.stream().mapToLong(FileChange::linesRemoved).sum();
        return lineCountMode == LineCountMode.NET ? Math.abs(added - removed) : added + removed;
    }

    private static Set<String> collisions(List<FileChange> files, Set<String> locks) {
        var hits = new LinkedHashSet<String>();
        for (FileChange file : files) {
            for (String lock : locks) {
                if (filesMatch(file.path(), lock)) {
                    hits.add(file.path());
                    break;
                }
            }
        }
        return hits;
    }

    /**
     * Checks if two file paths refer to the same file.
     * Handles relative vs. absolute paths by checking if one is a suffix of the other.
     */
    static boolean filesMatch(String file1, String file2) {
        String n1 = normalizePath(file1);
        String n2 = normalizePath(file2);

        if (n1.equals(n2)) return true;
        return n1.endsWith("/" + n2) || n2.endsWith("/" + n1);
    }

    private static String normalizePath(String path) {
        return path.startsWith("./") ? path.substring(2) : path;
    }
}
