package com.sentinel.core.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sentinel.core.config.SentinelProperties;
import com.sentinel.core.model.Manifest;
import com.sentinel.core.runner.SentinelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Persists the audit triple of a run under {@code <audit-dir>/<sentinelTaskId>/}.
 * <p>
 * Each file is written to a temporary sibling and moved into place, so a crash
 * never leaves a half-written file behind. {@code manifest.json} is moved last:
 * its presence marks a complete triple.
 */
@Component
public class ManifestWriter {

    private static final Logger log = LoggerFactory.getLogger(ManifestWriter.class);

    public static final String MANIFEST = "manifest.json";
    public static final String PATCH = "diff.patch";
    public static final String SUMMARY = "summary.md";

    private final Path auditDir;
    private final ObjectMapper mapper;

    @Autowired
    public ManifestWriter(SentinelProperties properties) {
        this(properties.auditDirPath());
    }

    public ManifestWriter(Path auditDir) {
        this.auditDir = auditDir;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path auditDir() {
        return auditDir;
    }

    /**
     * Artifact directory of one run.
     *
     * @throws IllegalArgumentException when the task id is not a single path segment
     */
    public Path dirFor(String sentinelTaskId) {
        if (sentinelTaskId == null || sentinelTaskId.isBlank() || sentinelTaskId.equals(".")
                || sentinelTaskId.equals("..") || sentinelTaskId.contains("/") || sentinelTaskId.contains("\\")) {
            throw new IllegalArgumentException("Task id '" + sentinelTaskId + "' is not a single path segment");
        }
        Path dir = auditDir.resolve(sentinelTaskId).normalize();
        if (!auditDir.normalize().equals(dir.getParent())) {
            throw new IllegalArgumentException("Task id '" + sentinelTaskId + "' resolves outside " + auditDir);
        }
        return dir;
    }

    /**
     * Whether a complete audit triple already exists for {@code sentinelTaskId}.
     */
    public boolean exists(String sentinelTaskId) {
        return Files.isRegularFile(dirFor(sentinelTaskId).resolve(MANIFEST));
    }

    /**
     * Writes {@code diff.patch}, {@code summary.md} and {@code manifest.json}.
     * An existing triple is never replaced.
     *
     * @param patch raw unified diff; {@code null} is written as an empty file
     * @return the run's artifact directory
     * @throws ManifestWriteException when any file cannot be written or the triple already exists
     */
    public Path write(Manifest manifest, String patch) {
        Path dir;
        try {
            dir = dirFor(manifest.taskId());
            if (Files.exists(dir.resolve(MANIFEST))) {
                throw new FileAlreadyExistsException(dir.resolve(MANIFEST).toString(), null,
                        "audit record already exists");
            }
            Files.createDirectories(dir);
            writeAtomically(dir, PATCH, patch != null ? patch : "");
            writeAtomically(dir, SUMMARY, SummaryRenderer.render(manifest));
            writeAtomically(dir, MANIFEST, mapper.writeValueAsString(manifest));
        } catch (IOException | RuntimeException e) {
            throw new ManifestWriteException(manifest.taskId(), manifest.result(), e);
        }
        log.info("Wrote audit artifacts for {} to {}", manifest.taskId(), dir);
        return dir;
    }

    /**
     * Reads a previously written manifest.
     */
    public Optional<Manifest> read(String sentinelTaskId) {
        Path file = dirFor(sentinelTaskId).resolve(MANIFEST);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), Manifest.class));
        } catch (IOException e) {
            throw new SentinelException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private static void writeAtomically(Path dir, String name, String content) throws IOException {
        Path tmp = Files.createTempFile(dir, "." + name, ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, dir.resolve(name), StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported in {}, falling back to replace", dir);
                Files.move(tmp, dir.resolve(name), StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
