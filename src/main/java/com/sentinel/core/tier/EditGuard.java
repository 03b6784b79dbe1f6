package com.sentinel.core.tier;

import com.sentinel.core.config.SentinelProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides which paths a repair action may write: inside the project root, and
 * not under version-control metadata or the Sentinel's own audit directory.
 */
@Component
public class EditGuard {

    private final Path root;
    private final List<String> deniedGlobs;

    @Autowired
    public EditGuard(SentinelProperties properties) {
        this(properties.projectRootPath(), List.of(properties.getAuditDir() + "/**", properties.getTaskList()));
    }

    public EditGuard(Path root, List<String> extraDeniedGlobs) {
        this.root = root.toAbsolutePath().normalize();
        var globs = new ArrayList<String>(List.of(".git/**", ".git"));
        globs.addAll(extraDeniedGlobs);
        this.deniedGlobs = List.copyOf(globs);
    }

    /**
     * Resolves {@code relativePath} against the project root when writable.
     */
    public Optional<Path> resolveWritable(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            return Optional.empty();
        }
        String cleaned = relativePath.startsWith("./") ? relativePath.substring(2) : relativePath;
        Path resolved = root.resolve(cleaned).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            return Optional.empty();
        }
        Path relative = root.relativize(resolved);
        if (matchesAny(relative)) {
            return Optional.empty();
        }
        return Optional.of(resolved);
    }

    public Path root() {
        return root;
    }

    private boolean matchesAny(Path relative) {
        for (String glob : deniedGlobs) {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
            if (matcher.matches(relative)) {
                return true;
            }
        }
        return false;
    }
}
