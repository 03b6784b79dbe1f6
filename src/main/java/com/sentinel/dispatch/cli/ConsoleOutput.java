package com.sentinel.dispatch.cli;

import com.sentinel.core.events.SentinelEvent;
import com.sentinel.core.model.ChangeRadiusViolation;
import com.sentinel.core.model.Manifest;
import com.sentinel.core.model.RunResult;
import com.sentinel.core.model.TierResult;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Sentinel CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) INTEGRATION SENTINEL v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SENTINEL]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void tier(TierResult tier) {
        String status;
        if (tier.skipped()) {
            status = "@|fg(yellow) SKIPPED|@";
        } else if (tier.passed()) {
            status = "@|fg(green) PASS|@";
        } else {
            status = "@|fg(red) FAIL|@";
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [TIER " + tier.tier() + "]|@ " + status + " " + tier.iterations() + " iteration"
                        + (tier.iterations() != 1 ? "s" : "")
                        + String.format(Locale.ROOT, ", %.1fs, $%.4f", tier.durationS(), tier.costUsd())
                        + " (" + tier.exitReason() + ")"));
    }

    public static void violation(ChangeRadiusViolation violation) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) [RADIUS]|@ " + violation.describe()));
    }

    public static void fileChange(String path) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) ~|@ " + path));
    }

    public static void event(SentinelEvent event) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|faint " + event.eventType() + "|@ " + event.payload()));
    }

    public static void manifest(Manifest manifest) {
        System.out.println();
        System.out.println("SENTINEL " + manifest.taskId() + " (validates " + manifest.parentTaskId() + ")");
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  Result:     " + colored(manifest.result())));
        System.out.println("  Tier used:  " + manifest.tierUsed());
        System.out.println("  Iterations: " + manifest.iterations());
        System.out.println(String.format(Locale.ROOT, "  Cost:       $%.4f", manifest.costUsd()));
        System.out.println("  Cascade:    " + manifest.cascadeMode().name().toLowerCase(Locale.ROOT).replace('_', '-')
                + (manifest.cascadeDecision() != null ? " / " + manifest.cascadeDecision() : ""));
        System.out.println("  Started:    " + manifest.startedAt());
        System.out.println("  Finished:   " + manifest.finishedAt());
        for (TierResult tier : manifest.tiers()) {
            tier(tier);
        }
        if (!manifest.filesChanged().isEmpty()) {
            System.out.println();
            System.out.println("  FILES CHANGED:");
            manifest.filesChanged().forEach(ConsoleOutput::fileChange);
        }
        manifest.violations().forEach(ConsoleOutput::violation);
        if (manifest.error() != null) {
            error("Error: " + manifest.error());
        }
    }

    private static String colored(RunResult result) {
        return switch (result) {
            case PASS -> "@|fg(green),bold PASS|@";
            case FAIL -> "@|fg(red),bold FAIL|@";
            case ERROR -> "@|fg(magenta),bold ERROR|@";
        };
    }
}
