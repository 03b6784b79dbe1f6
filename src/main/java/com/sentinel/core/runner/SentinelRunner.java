package com.sentinel.core.runner;

import com.sentinel.core.audit.ManifestWriteException;
import com.sentinel.core.audit.ManifestWriter;
import com.sentinel.core.cascade.CascadeAnalyzer;
import com.sentinel.core.config.SentinelProperties;
import com.sentinel.core.diff.InterfaceDiff;
import com.sentinel.core.events.EventBus;
import com.sentinel.core.events.SentinelEvent;
import com.sentinel.core.git.Baseline;
import com.sentinel.core.git.GitWorkspace;
import com.sentinel.core.git.WorkingTreeDiff;
import com.sentinel.core.logging.MdcContext;
import com.sentinel.core.metrics.SentinelMetrics;
import com.sentinel.core.model.CascadeDecision;
import com.sentinel.core.model.ChangeRadiusViolation;
import com.sentinel.core.model.ExecutionPlan;
import com.sentinel.core.model.FileChange;
import com.sentinel.core.model.InterfaceReport;
import com.sentinel.core.model.Manifest;
import com.sentinel.core.model.RunResult;
import com.sentinel.core.model.SentinelOutcome;
import com.sentinel.core.model.Task;
import com.sentinel.core.model.TierResult;
import com.sentinel.core.probe.AvailabilityProbe;
import com.sentinel.core.radius.ChangeRadiusEvaluator;
import com.sentinel.core.radius.RadiusInput;
import com.sentinel.core.tier.RepairAgent;
import com.sentinel.core.tier.TierExecutor;
import com.sentinel.core.tier.TierSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Drives one Sentinel task through its state machine:
 * <pre>
 * PROBING -> TIER1_RUNNING -> [TIER2_RUNNING] -> DIFFING -> EVALUATING -> [CASCADING] -> WRITING -> DONE | HALTED
 * </pre>
 * PROBING goes straight to TIER2_RUNNING when the local endpoint is down; a tier-1
 * pass goes straight to DIFFING. WRITING runs in a {@code finally} block around the
 * whole body, so the audit triple exists after every run, including one that faulted.
 * A halt decided while cascading is raised as {@link WaveHaltException} only after
 * the write has completed.
 * <p>
 * All per-run data lives in a {@link Run} created per call; the runner itself is
 * stateless and safe to use for distinct tasks concurrently.
 */
@Service
public class SentinelRunner {

    private static final Logger log = LoggerFactory.getLogger(SentinelRunner.class);

    private final boolean enabled;
    private final TierSpec localTier;
    private final TierSpec cloudTier;
    private final AvailabilityProbe probe;
    private final TierExecutor tierExecutor;
    private final GitWorkspace git;
    private final InterfaceDiff interfaceDiff;
    private final ChangeRadiusEvaluator radiusEvaluator;
    private final CascadeAnalyzer cascadeAnalyzer;
    private final ManifestWriter manifestWriter;
    private final SentinelMetrics metrics;
    private final EventBus eventBus;
    private final Clock clock;

    public SentinelRunner(SentinelProperties properties,
                          AvailabilityProbe probe,
                          TierExecutor tierExecutor,
                          @Qualifier("localTier") RepairAgent localAgent,
                          @Qualifier("cloudTier") RepairAgent cloudAgent,
                          GitWorkspace git,
                          InterfaceDiff interfaceDiff,
                          ChangeRadiusEvaluator radiusEvaluator,
                          CascadeAnalyzer cascadeAnalyzer,
                          ManifestWriter manifestWriter,
                          SentinelMetrics metrics,
                          EventBus eventBus,
                          Clock clock) {
        this.enabled = properties.isEnabled();
        this.localTier = TierSpec.local(properties.getTiers().getLocal(), localAgent);
        this.cloudTier = TierSpec.cloud(properties.getTiers().getCloud(), cloudAgent);
        this.probe = probe;
        this.tierExecutor = tierExecutor;
        this.git = git;
        this.interfaceDiff = interfaceDiff;
        this.radiusEvaluator = radiusEvaluator;
        this.cascadeAnalyzer = cascadeAnalyzer;
        this.manifestWriter = manifestWriter;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Runs the Sentinel task {@code task} of {@code plan}.
     *
     * @return the run's manifest, violations and cascade decision
     * @throws WaveHaltException       when the cascade decided to halt the wave (artifacts already written)
     * @throws ManifestWriteException  when the audit artifacts could not be written
     * @throws IllegalStateException   when the Sentinel is disabled, {@code task} is not a Sentinel task,
     *                                 or {@code task} already has an audit record
     * @throws IllegalArgumentException when the task id cannot name an audit directory
     */
    public SentinelOutcome run(Task task, ExecutionPlan plan) throws WaveHaltException {
        if (!enabled) {
            throw new IllegalStateException("Sentinel is disabled (sentinel.enabled=false); refusing to run " + task.id());
        }
        if (!task.isSentinel() || task.parentId() == null) {
            throw new IllegalStateException(task.id() + " is not a Sentinel task (role " + task.agentRole() + ")");
        }
        if (manifestWriter.exists(task.id())) {
            throw new IllegalStateException(task.id() + " already has an audit record in "
                    + manifestWriter.dirFor(task.id()) + "; refusing to overwrite it");
        }

        var run = new Run(task, plan, clock.instant());
        MdcContext.setRun(task.id(), task.parentId());
        try {
            log.info("Sentinel {} validating {}", task.id(), task.parentId());
            publish(run, "sentinel.started", Map.of("parentTaskId", task.parentId()));

            try {
                drive(run);
                run.completed = true;
            } catch (RuntimeException e) {
                run.fault = e;
                log.error("Sentinel {} faulted in {}: {}", task.id(), run.state, e.getMessage(), e);
            } finally {
                run.state = SentinelRunState.WRITING;
                write(run);
            }

            if (run.decision != null && run.decision.halt()) {
                run.state = SentinelRunState.HALTED;
                String reason = run.decision.choice() != null
                        ? run.decision.choice().name().toLowerCase(Locale.ROOT).replace('_', '-')
                        : "halt";
                metrics.recordWaveHalt();
                publish(run, "wave.halted", Map.of("reason", reason, "violations", describe(run.violations)));
                log.warn("Sentinel {} halts the wave ({})", task.id(), reason);
                throw new WaveHaltException(reason, run.violations, task.id());
            }

            run.state = SentinelRunState.DONE;
            publish(run, "sentinel.completed", Map.of("result", run.manifest.result().name()));
            return new SentinelOutcome(run.manifest, List.copyOf(run.violations), run.decision, run.artifactDir);
        } finally {
            MdcContext.clear();
        }
    }

    private void drive(Run run) {
        SentinelRunState next = SentinelRunState.PROBING;
        while (next != SentinelRunState.WRITING) {
            log.debug("Sentinel {}: {} -> {}", run.task.id(), run.state, next);
            run.state = next;
            next = switch (next) {
                case PROBING -> probe(run);
                case TIER1_RUNNING -> runTier(run, localTier);
                case TIER2_RUNNING -> runTier(run, cloudTier);
                case DIFFING -> diff(run);
                case EVALUATING -> evaluate(run);
                case CASCADING -> cascade(run);
                default -> throw new IllegalStateException("Unexpected state " + next);
            };
        }
    }

    private SentinelRunState probe(Run run) {
        run.baseline = git.baseline();
        boolean available = probe.isAvailable();
        metrics.recordProbe(available);
        if (available) {
            return SentinelRunState.TIER1_RUNNING;
        }
        TierResult skipped = TierResult.skipped(TierSpec.LOCAL);
        record(run, skipped);
        log.info("Local tier unavailable, escalating {} to tier {}", run.task.id(), TierSpec.CLOUD);
        return SentinelRunState.TIER2_RUNNING;
    }

    private SentinelRunState runTier(Run run, TierSpec spec) {
        TierResult result = tierExecutor.execute(spec, run.task);
        record(run, result);
        if (spec.tier() == TierSpec.LOCAL && !result.passed()) {
            return SentinelRunState.TIER2_RUNNING;
        }
        return SentinelRunState.DIFFING;
    }

    private SentinelRunState diff(Run run) {
        run.diff = git.diffSince(run.baseline);
        for (FileChange file : run.diff.files()) {
            if (!interfaceDiff.supports(file.path())) {
                continue;
            }
            String before = "created".equals(file.action()) ? "" : git.contentAt(run.baseline, file.path());
            String after = "deleted".equals(file.action()) ? "" : git.currentContent(file.path());
            run.interfaces.add(interfaceDiff.compare(file.path(), before, after));
        }
        return SentinelRunState.EVALUATING;
    }

    private SentinelRunState evaluate(Run run) {
        var input = new RadiusInput(run.diff.files(), run.interfaces,
                RadiusInput.foreignLocks(run.plan, run.task.id()));
        run.violations.addAll(radiusEvaluator.evaluate(input));
        for (ChangeRadiusViolation violation : run.violations) {
            metrics.recordViolation(violation.axis());
            publish(run, "radius.violation", Map.of(
                    "axis", violation.axis().label(),
                    "observed", violation.observed(),
                    "budget", violation.budget()));
        }
        return run.violations.isEmpty() ? SentinelRunState.WRITING : SentinelRunState.CASCADING;
    }

    private SentinelRunState cascade(Run run) {
        run.decision = cascadeAnalyzer.apply(run.task.id(), run.violations);
        publish(run, "cascade.applied", Map.of(
                "mode", run.decision.mode().name(),
                "decision", run.decision.label(),
                "annotated", run.decision.annotated()));
        return SentinelRunState.WRITING;
    }

    private void record(Run run, TierResult result) {
        run.tiers.add(result);
        metrics.recordTier(result);
        if (result.skipped()) {
            publish(run, "tier.skipped", Map.of("tier", result.tier(), "reason", result.exitReason().name()));
        } else {
            publish(run, "tier.completed", Map.of(
                    "tier", result.tier(),
                    "passed", result.passed(),
                    "iterations", result.iterations(),
                    "costUsd", result.costUsd(),
                    "exitReason", result.exitReason().name()));
        }
    }

    private void write(Run run) {
        Instant finished = clock.instant();
        run.manifest = buildManifest(run, finished);
        String patch = run.diff != null ? run.diff.patch() : "";
        try {
            run.artifactDir = manifestWriter.write(run.manifest, patch);
        } catch (ManifestWriteException e) {
            if (run.fault != null) {
                e.addSuppressed(run.fault);
            }
            log.error("Sentinel {} could not write its audit artifacts; run result was {}",
                    run.task.id(), run.manifest.result(), e);
            throw e;
        }
        metrics.recordRunResult(run.manifest.result());
        metrics.recordCost(run.manifest.costUsd());
        metrics.recordRunDuration(Duration.between(run.startedAt, finished).toMillis());
        publish(run, "manifest.written", Map.of(
                "result", run.manifest.result().name(),
                "path", run.artifactDir.toString()));
        log.info("Sentinel {} finished: {} (tier {}, {} iteration(s), ${})", run.task.id(),
                run.manifest.result(), run.manifest.tierUsed(), run.manifest.iterations(),
                String.format(Locale.ROOT, "%.4f", run.manifest.costUsd()));
    }

    private Manifest buildManifest(Run run, Instant finished) {
        RunResult result = result(run);
        int tierUsed = run.tiers.stream().filter(t -> t.iterations() > 0).mapToInt(TierResult::tier).max().orElse(0);
        int iterations = run.tiers.stream().mapToInt(TierResult::iterations).sum();
        double cost = run.tiers.stream().mapToDouble(TierResult::costUsd).sum();
        List<String> files = run.diff != null ? run.diff.paths() : List.of();
        return new Manifest(
                run.task.id(),
                run.task.parentId(),
                result,
                tierUsed,
                iterations,
                cost,
                files,
                run.tiers,
                run.violations,
                cascadeAnalyzer.mode(),
                run.decision != null ? run.decision.label() : null,
                errorMessage(run),
                run.startedAt,
                finished);
    }

    private static RunResult result(Run run) {
        if (run.fault != null || !run.completed) {
            return RunResult.ERROR;
        }
        TierResult last = null;
        for (TierResult tier : run.tiers) {
            if (tier.attempted()) {
                last = tier;
            }
        }
        return last != null && last.passed() ? RunResult.PASS : RunResult.FAIL;
    }

    private static String errorMessage(Run run) {
        if (run.fault != null) {
            return run.fault.getClass().getSimpleName() + ": " + run.fault.getMessage();
        }
        if (!run.completed) {
            return "Run aborted in state " + run.state;
        }
        return null;
    }

    private static List<String> describe(List<ChangeRadiusViolation> violations) {
        return violations.stream().map(ChangeRadiusViolation::describe).toList();
    }

    private void publish(Run run, String type, Map<String, Object> payload) {
        if (!eventBus.hasSubscribers(run.task.id())) {
            return;
        }
        eventBus.publish(new SentinelEvent(type, run.task.id(), new LinkedHashMap<>(payload), clock.instant()));
    }

    /**
     * Mutable bookkeeping of a single invocation.
     */
    private static final class Run {
        final Task task;
        final ExecutionPlan plan;
        final Instant startedAt;
        final List<TierResult> tiers = new ArrayList<>();
        final List<InterfaceReport> interfaces = new ArrayList<>();
        final List<ChangeRadiusViolation> violations = new ArrayList<>();
        SentinelRunState state = SentinelRunState.PROBING;
        Baseline baseline;
        WorkingTreeDiff diff;
        CascadeDecision decision;
        RuntimeException fault;
        boolean completed;
        Manifest manifest;
        Path artifactDir;

        Run(Task task, ExecutionPlan plan, Instant startedAt) {
            this.task = task;
            this.plan = plan;
            this.startedAt = startedAt;
        }
    }
}
