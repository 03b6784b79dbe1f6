package com.sentinel.core.tier;

import com.sentinel.core.config.SentinelProperties;
import com.sentinel.core.llm.LlmService;
import com.sentinel.core.llm.StructuredResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Repair action backed by a tier's chat model. The model sees the failing test
 * output plus the task's target files and answers with whole-file replacements,
 * which are written into the working tree through the {@link EditGuard}.
 */
public class LlmRepairAgent implements RepairAgent {

    private static final Logger log = LoggerFactory.getLogger(LlmRepairAgent.class);

    static final int MAX_OUTPUT_CHARS = 8_000;
    static final int MAX_FILE_CHARS = 40_000;

    private static final String SYSTEM_PROMPT =
            "You are a build-repair assistant. A coding task just finished and its tests fail. " +
            "Make the smallest change that makes the tests pass. Do not rename or remove public " +
            "functions or types unless the failure requires it. Return every file you change " +
            "with its complete new content; paths are relative to the project root. " +
            "Return an empty edit list if you cannot find a safe fix.";

    private final LlmService llm;
    private final EditGuard guard;
    private final double inputCostPer1k;
    private final double outputCostPer1k;

    public LlmRepairAgent(LlmService llm, EditGuard guard, SentinelProperties.Tier tier) {
        this(llm, guard, tier.getInputCostPer1k(), tier.getOutputCostPer1k());
    }

    public LlmRepairAgent(LlmService llm, EditGuard guard, double inputCostPer1k, double outputCostPer1k) {
        this.llm = llm;
        this.guard = guard;
        this.inputCostPer1k = inputCostPer1k;
        this.outputCostPer1k = outputCostPer1k;
    }

    @Override
    public RepairOutcome repair(RepairRequest request) throws RepairException {
        StructuredResponse<RepairPlan> response;
        try {
            response = llm.structuredCall(SYSTEM_PROMPT, buildPrompt(request), RepairPlan.class);
        } catch (RuntimeException e) {
            throw new RepairException("Tier " + request.tier() + " model call failed: " + e.getMessage(), 0.0, e);
        }
        double cost = price(response.promptTokens(), response.completionTokens());
        RepairPlan plan = response.value();
        if (plan == null || plan.edits() == null || plan.edits().isEmpty()) {
            throw new RepairException("Tier " + request.tier() + " model proposed no edits", cost);
        }

        var written = new ArrayList<String>();
        for (var edit : plan.edits()) {
            Optional<Path> target = guard.resolveWritable(edit.path());
            if (target.isEmpty()) {
                log.warn("Rejected repair edit outside writable area: {}", edit.path());
                continue;
            }
            try {
                Files.createDirectories(target.get().getParent());
                Files.writeString(target.get(), edit.content() != null ? edit.content() : "", StandardCharsets.UTF_8);
                written.add(guard.root().relativize(target.get()).toString());
            } catch (IOException e) {
                throw new RepairException("Failed to apply edit to " + edit.path() + ": " + e.getMessage(), cost, e);
            }
        }
        if (written.isEmpty()) {
            throw new RepairException("All proposed edits were rejected", cost);
        }
        log.info("Tier {} repair iteration {} rewrote {} file(s): {}",
                request.tier(), request.iteration(), written.size(), written);
        return new RepairOutcome(plan.summary(), written, cost);
    }

    double price(int promptTokens, int completionTokens) {
        return promptTokens / 1000.0 * inputCostPer1k + completionTokens / 1000.0 * outputCostPer1k;
    }

    String buildPrompt(RepairRequest request) {
        var task = request.task();
        var sb = new StringBuilder();
        sb.append("Task: ").append(task.id()).append(" (").append(task.agentRole()).append(")\n");
        if (task.description() != null && !task.description().isBlank()) {
            sb.append("Description: ").append(task.description()).append('\n');
        }
        sb.append("Repair attempt ").append(request.iteration()).append('\n');
        sb.append("\nTest output (tail):\n");
        sb.append(tail(request.lastResult().output(), MAX_OUTPUT_CHARS)).append('\n');

        for (String file : task.targetFiles()) {
            Optional<Path> path = guard.resolveWritable(file);
            if (path.isEmpty() || !Files.isRegularFile(path.get())) {
                continue;
            }
            try {
                String content = Files.readString(path.get(), StandardCharsets.UTF_8);
                sb.append("\n--- ").append(file).append(" ---\n");
                sb.append(content.length() > MAX_FILE_CHARS ? content.substring(0, MAX_FILE_CHARS) : content);
                sb.append('\n');
            } catch (IOException e) {
                log.debug("Skipping unreadable file {}: {}", file, e.getMessage());
            }
        }
        return sb.toString();
    }

    private static String tail(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(text.length() - max);
    }
}
