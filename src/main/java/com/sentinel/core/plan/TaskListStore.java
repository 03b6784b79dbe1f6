package com.sentinel.core.plan;

import com.sentinel.core.config.SentinelProperties;
import com.sentinel.core.runner.SentinelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The persisted Markdown checklist of plan tasks ({@code - [ ] ID: ...} / {@code - [x] ID: ...}).
 *
 * <p>The Sentinel only ever appends: new checklist lines at the end of the file and
 * warning blocks directly below incomplete entries. Existing lines are never edited.
 */
@Component
public class TaskListStore {

    private static final Logger log = LoggerFactory.getLogger(TaskListStore.class);

    /** {@code - [ ] TASK-001: ...}; group 1 is the indent, group 2 the marker, group 3 the id. */
    static final Pattern ENTRY = Pattern.compile("^(\\s*)- \\[( |x|X)\\] ([A-Za-z0-9_.\\-]+):.*$");

    private final Path file;

    @Autowired
    public TaskListStore(SentinelProperties properties) {
        this(properties.taskListPath());
    }

    public TaskListStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public synchronized boolean hasEntry(String taskId) {
        for (String line : read().split("\r?\n")) {
            Matcher m = ENTRY.matcher(line);
            if (m.matches() && m.group(3).equals(taskId)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Appends {@code - [ ] <taskId>: <description>} unless an entry for the id exists.
     *
     * @return true when a line was written
     */
    public synchronized boolean appendEntry(String taskId, String description) {
        if (hasEntry(taskId)) {
            log.debug("Task list already has an entry for {}", taskId);
            return false;
        }
        String content = read();
        String newline = content.contains("\r\n") ? "\r\n" : "\n";
        var sb = new StringBuilder(content);
        if (!content.isEmpty() && !content.endsWith("\n")) {
            sb.append(newline);
        }
        sb.append("- [ ] ").append(taskId).append(": ").append(description).append(newline);
        write(sb.toString());
        log.info("Appended checklist entry for {} to {}", taskId, file.getFileName());
        return true;
    }

    /**
     * Inserts {@code blockLines} (as quoted lines) directly below every incomplete entry.
     * Complete entries and all other lines are left byte-for-byte intact.
     *
     * @param blockLines  annotation lines, without the quote prefix
     * @param excludedIds entries that must not be annotated
     * @return number of entries annotated
     */
    public synchronized int annotateIncomplete(List<String> blockLines, Set<String> excludedIds) {
        String content = read();
        if (content.isEmpty()) {
            return 0;
        }
        String newline = content.contains("\r\n") ? "\r\n" : "\n";

        var out = new StringBuilder(content.length() + 256);
        int annotated = 0;
        int pos = 0;
        while (pos < content.length()) {
            int nl = content.indexOf('\n', pos);
            int end = nl < 0 ? content.length() : nl + 1;
            String raw = content.substring(pos, end);
            out.append(raw);

            String line = raw.endsWith("\n") ? raw.substring(0, raw.length() - 1) : raw;
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            Matcher m = ENTRY.matcher(line);
            if (m.matches() && " ".equals(m.group(2)) && !excludedIds.contains(m.group(3))) {
                if (nl < 0) {
                    out.append(newline);
                }
                String indent = m.group(1) + "  ";
                for (String blockLine : blockLines) {
                    out.append(indent).append("> ").append(blockLine).append(newline);
                }
                annotated++;
            }
            pos = end;
        }

        if (annotated > 0) {
            write(out.toString());
            log.info("Annotated {} incomplete task(s) in {}", annotated, file.getFileName());
        }
        return annotated;
    }

    /**
     * Ids of all entries, with their completion flag, in file order.
     */
    public synchronized List<Entry> entries() {
        var entries = new ArrayList<Entry>();
        for (String line : read().split("\r?\n")) {
            Matcher m = ENTRY.matcher(line);
            if (m.matches()) {
                entries.add(new Entry(m.group(3), !" ".equals(m.group(2))));
            }
        }
        return entries;
    }

    public record Entry(String taskId, boolean done) {}

    private String read() {
        if (!Files.exists(file)) {
            return "";
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SentinelException("Failed to read task list " + file, e);
        }
    }

    private void write(String content) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path tmp = Files.createTempFile(parent, ".tasks", ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new SentinelException("Failed to write task list " + file, e);
        }
    }
}
