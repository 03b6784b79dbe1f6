package com.sentinel.core.git;

import com.sentinel.core.config.SentinelProperties;
import com.sentinel.core.model.FileChange;
import com.sentinel.core.runner.SentinelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Diff-since primitives over the project's git working tree.
 *
 * <p>The Sentinel never commits; the orchestrator does that after a wave completes.
 * This class shells out to the {@code git} CLI via {@link ProcessBuilder}
 * rather than depending on JGit.
 */
@Component
public class GitWorkspace {

    private static final Logger log = LoggerFactory.getLogger(GitWorkspace.class);

    static final String INDEX_ENV = "GIT_INDEX_FILE";

    /** {@code git diff --numstat} line: "12\t3\tsrc/Foo.java" ("-" for binary files). */
    static final Pattern NUMSTAT_LINE = Pattern.compile("^(\\d+|-)\\t(\\d+|-)\\t(.+)$");

    /** {@code git diff --name-status} line: "M\tsrc/Foo.java". */
    static final Pattern NAME_STATUS_LINE = Pattern.compile("^([AMDTUX])\\t(.+)$");

    private final Path root;
    private final List<String> excludedPaths;

    @Autowired
    public GitWorkspace(SentinelProperties properties) {
        this(properties.projectRootPath(), List.of(properties.getAuditDir(), properties.getTaskList()));
    }

    public GitWorkspace(Path root, List<String> excludedPaths) {
        this.root = root;
        this.excludedPaths = List.copyOf(excludedPaths);
    }

    /**
     * Captures the current working tree state, untracked files included, without
     * touching the index or stash list.
     */
    public Baseline baseline() {
        String tree = snapshotTree();
        log.info("Baseline tree {}", abbreviate(tree));
        return new Baseline(tree, Instant.now());
    }

    /**
     * Computes the raw patch and per-file records of everything changed since {@code baseline}.
     * Both sides are full snapshots, so files that were untracked at baseline time are diffed
     * like any other.
     */
    public WorkingTreeDiff diffSince(Baseline baseline) {
        String current = snapshotTree();
        List<String> pathspec = pathspec();

        GitResult patch = runGit(concat(List.of("diff", "--no-color", "--no-ext-diff", "--no-renames",
                baseline.ref(), current), pathspec));
        GitResult numstat = runGit(concat(List.of("diff", "--numstat", "--no-renames",
                baseline.ref(), current), pathspec));
        GitResult nameStatus = runGit(concat(List.of("diff", "--name-status", "--no-renames",
                baseline.ref(), current), pathspec));
        if (!patch.ok() || !numstat.ok() || !nameStatus.ok()) {
            throw new SentinelException("git diff against " + abbreviate(baseline.ref()) + " failed");
        }

        List<FileChange> files = parseNumstat(numstat.output(), parseNameStatus(nameStatus.output()));
        log.info("Diff since {}: {} file(s) changed", abbreviate(baseline.ref()), files.size());
        return new WorkingTreeDiff(patch.output(), files);
    }

    /**
     * Content of {@code path} in the baseline snapshot; empty when it did not exist.
     */
    public String contentAt(Baseline baseline, String path) {
        GitResult show = runGit("show", baseline.ref() + ":" + path);
        return show.ok() ? show.output() : "";
    }

    /**
     * Current content of {@code path} in the working tree; empty when deleted.
     */
    public String currentContent(String path) {
        Path file = root.resolve(path);
        if (!Files.isRegularFile(file)) {
            return "";
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SentinelException("Failed to read " + path, e);
        }
    }

    /**
     * Writes the working tree (minus ignored and excluded paths) as a tree object via a
     * throwaway index file. Works before the first commit, since no HEAD is read.
     */
    String snapshotTree() {
        Path indexDir;
        try {
            indexDir = Files.createTempDirectory("sentinel-index");
        } catch (IOException e) {
            throw new SentinelException("Cannot create a scratch index directory", e);
        }
        Map<String, String> env = Map.of(INDEX_ENV, indexDir.resolve("index").toString());
        try {
            GitResult add = runGit(env, concat(List.of("add", "-A"), pathspec()).toArray(String[]::new));
            if (!add.ok()) {
                throw new SentinelException("Cannot snapshot " + root + ": git add exited " + add.exitCode());
            }
            GitResult tree = runGit(env, "write-tree");
            if (!tree.ok() || tree.output().isBlank()) {
                throw new SentinelException("Cannot snapshot " + root + ": git write-tree exited " + tree.exitCode());
            }
            return tree.output().trim();
        } finally {
            deleteRecursively(indexDir);
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        } catch (IOException e) {
            log.warn("Could not remove scratch index {}: {}", dir, e.getMessage());
        }
    }

    private List<String> pathspec() {
        var spec = new ArrayList<String>();
        spec.add("--");
        spec.add(".");
        for (String excluded : excludedPaths) {
            spec.add(":(exclude)" + excluded);
        }
        return spec;
    }

    /**
     * Parses {@code git diff --name-status} into path → action.
     */
    Map<String, String> parseNameStatus(String output) {
        var actions = new HashMap<String, String>();
        if (output == null || output.isBlank()) {
            return actions;
        }
        for (String line : output.split("\n")) {
            Matcher m = NAME_STATUS_LINE.matcher(line);
            if (!m.matches()) {
                continue;
            }
            String action = switch (m.group(1)) {
                case "A" -> "created";
                case "D" -> "deleted";
                default -> "modified";
            };
            actions.put(m.group(2).trim(), action);
        }
        return actions;
    }

    /**
     * Parses {@code git diff --numstat} output. Binary files ("-") count as zero lines.
     */
    List<FileChange> parseNumstat(String output, Map<String, String> actions) {
        if (output == null || output.isBlank()) {
            return List.of();
        }
        var results = new ArrayList<FileChange>();
        for (String line : output.split("\n")) {
            Matcher m = NUMSTAT_LINE.matcher(line);
            if (!m.matches()) {
                continue;
            }
            int added = "-".equals(m.group(1)) ? 0 : Integer.parseInt(m.group(1));
            int removed = "-".equals(m.group(2)) ? 0 : Integer.parseInt(m.group(2));
            String path = m.group(3).trim();
            results.add(new FileChange(path, actions.getOrDefault(path, "modified"), added, removed));
        }
        return results;
    }

    /**
     * Runs a git command in the project root and captures stdout.
     */
    GitResult runGit(List<String> args) {
        return runGit(args.toArray(String[]::new));
    }

    GitResult runGit(String... args) {
        return runGit(Map.of(), args);
    }

    GitResult runGit(Map<String, String> env, String... args) {
        var command = new ArrayList<String>();
        command.add("git");
        command.addAll(List.of(args));
        log.debug("Running: {}", String.join(" ", command));

        try {
            var builder = new ProcessBuilder(command)
                    .directory(root.toFile())
                    .redirectErrorStream(false);
            builder.environment().putAll(env);
            var process = builder.start();
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
            String output = drain(process.getInputStream());
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.debug("git {} exited {}: {}", args.length > 0 ? args[0] : "", exitCode, stderr.get().trim());
            }
            return new GitResult(exitCode, output);
        } catch (IOException | ExecutionException e) {
            log.error("Git command failed: {}", String.join(" ", command), e);
            throw new SentinelException("Git command failed: " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SentinelException("Interrupted running " + String.join(" ", command), e);
        }
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SentinelException("Failed reading git output", e);
        }
    }

    private static List<String> concat(List<String> head, List<String> tail) {
        var all = new ArrayList<String>(head);
        all.addAll(tail);
        return all;
    }

    private static String abbreviate(String ref) {
        return ref.length() > 10 ? ref.substring(0, 10) : ref;
    }

    /**
     * Exit code and captured stdout of one git invocation.
     */
    record GitResult(int exitCode, String output) {
        boolean ok() {
            return exitCode == 0;
        }
    }
}
