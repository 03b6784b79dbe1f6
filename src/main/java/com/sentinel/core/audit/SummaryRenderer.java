package com.sentinel.core.audit;

import com.sentinel.core.model.ChangeRadiusViolation;
import com.sentinel.core.model.Manifest;
import com.sentinel.core.model.RunResult;
import com.sentinel.core.model.TierResult;

import java.util.Locale;

/**
 * Renders {@code summary.md}: short prose that the next task's agent reads as context.
 */
public final class SummaryRenderer {

    private SummaryRenderer() {}

    public static String render(Manifest manifest) {
        var sb = new StringBuilder();
        sb.append("# ").append(manifest.taskId()).append(": ").append(manifest.result()).append("\n\n");
        sb.append(outcomeSentence(manifest)).append("\n\n");

        sb.append("## Tiers\n\n");
        if (manifest.tiers().isEmpty()) {
            sb.append("No tier ran.\n");
        }
        for (TierResult tier : manifest.tiers()) {
            sb.append("- ").append(tierLine(tier)).append('\n');
        }

        sb.append("\n## Files changed\n\n");
        if (manifest.filesChanged().isEmpty()) {
            sb.append("No files changed.\n");
        }
        for (String path : manifest.filesChanged()) {
            sb.append("- `").append(path).append("`\n");
        }

        sb.append("\n## Change radius\n\n");
        if (manifest.violations().isEmpty()) {
            sb.append("Within budget on all axes.\n");
        } else {
            for (ChangeRadiusViolation violation : manifest.violations()) {
                sb.append("- ").append(violation.describe()).append('\n');
            }
            sb.append("\nCascade (").append(manifest.cascadeMode().name().toLowerCase(Locale.ROOT).replace('_', '-'))
                    .append("): ").append(manifest.cascadeDecision() != null ? manifest.cascadeDecision() : "not applied")
                    .append('\n');
        }

        if (manifest.error() != null) {
            sb.append("\n## Error\n\n").append(manifest.error()).append('\n');
        }
        return sb.toString();
    }

    private static String outcomeSentence(Manifest manifest) {
        String parent = manifest.parentTaskId() != null ? manifest.parentTaskId() : "the parent task";
        String totals = String.format(Locale.ROOT, "%d iteration%s, $%.4f", manifest.iterations(),
                manifest.iterations() != 1 ? "s" : "", manifest.costUsd());
        if (manifest.result() == RunResult.PASS) {
            return "Validation of " + parent + " passed on tier " + manifest.tierUsed() + " (" + totals + ").";
        }
        if (manifest.result() == RunResult.FAIL) {
            return "Validation of " + parent + " still fails after all tiers (" + totals
                    + "). Downstream tasks build on a failing tree.";
        }
        return "The run for " + parent + " ended with an internal error (" + totals + "); see below.";
    }

    private static String tierLine(TierResult tier) {
        if (tier.skipped()) {
            return "Tier " + tier.tier() + ": skipped (" + tier.exitReason() + ")";
        }
        return String.format(Locale.ROOT, "Tier %d: %s after %d iteration%s, %.1fs, $%.4f (%s)",
                tier.tier(), tier.passed() ? "passed" : "failed", tier.iterations(),
                tier.iterations() != 1 ? "s" : "", tier.durationS(), tier.costUsd(), tier.exitReason());
    }
}
