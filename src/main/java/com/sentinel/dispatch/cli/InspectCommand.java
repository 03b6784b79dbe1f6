package com.sentinel.dispatch.cli;

import com.sentinel.core.audit.ManifestWriter;
import com.sentinel.core.model.Manifest;
import com.sentinel.core.runner.SentinelException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Optional;

/**
 * CLI command: sentinel inspect &lt;sentinel-task-id&gt;
 * <p>
 * Shows the manifest a past run left in the audit directory.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect the manifest of a past run")
@Component
public class InspectCommand implements Runnable {

    @Parameters(index = "0", description = "Sentinel task ID")
    private String taskId;

    private final ManifestWriter manifestWriter;

    public InspectCommand(ManifestWriter manifestWriter) {
        this.manifestWriter = manifestWriter;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Optional<Manifest> manifest;
        try {
            manifest = manifestWriter.read(taskId);
        } catch (SentinelException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        if (manifest.isEmpty()) {
            ConsoleOutput.error("No manifest for " + taskId + " in " + manifestWriter.auditDir());
            return;
        }
        ConsoleOutput.manifest(manifest.get());
        System.out.println();
        ConsoleOutput.info("Summary: " + manifestWriter.dirFor(taskId).resolve(ManifestWriter.SUMMARY));
    }
}
