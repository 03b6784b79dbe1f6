package com.sentinel.dispatch.cli;

import com.sentinel.core.audit.ManifestWriteException;
import com.sentinel.core.events.EventBus;
import com.sentinel.core.model.ExecutionPlan;
import com.sentinel.core.model.RunResult;
import com.sentinel.core.model.SentinelOutcome;
import com.sentinel.core.model.Task;
import com.sentinel.core.plan.PlanStore;
import com.sentinel.core.runner.SentinelException;
import com.sentinel.core.runner.SentinelRunner;
import com.sentinel.core.runner.WaveHaltException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: sentinel run &lt;sentinel-task-id&gt; --plan &lt;file&gt;
 * <p>
 * Runs one Sentinel task and reports its outcome. Exit code 0 when the run
 * completed (PASS or FAIL), 3 when the wave must halt, 1 on error.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run one Sentinel task")
@Component
public class RunCommand implements Callable<Integer> {

    static final int EXIT_DONE = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_HALTED = 3;

    @Parameters(index = "0", description = "Sentinel task ID (e.g. SENTINEL-TASK-001)")
    private String taskId;

    @Option(names = {"--plan", "-p"}, required = true, description = "Execution plan JSON file")
    private Path planFile;

    @Option(names = {"--watch", "-w"}, description = "Print run events as they happen")
    private boolean watch;

    private final PlanStore planStore;
    private final SentinelRunner runner;
    private final EventBus eventBus;

    public RunCommand(PlanStore planStore, SentinelRunner runner, EventBus eventBus) {
        this.planStore = planStore;
        this.runner = runner;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ExecutionPlan plan;
        try {
            plan = planStore.read(planFile);
        } catch (SentinelException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_ERROR;
        }
        Optional<Task> task = plan.findTask(taskId);
        if (task.isEmpty()) {
            ConsoleOutput.error("Task " + taskId + " not found in " + planFile);
            return EXIT_ERROR;
        }

        ConsoleOutput.info("Validating " + task.get().parentId() + " with " + taskId);
        EventBus.Subscription subscription = watch ? eventBus.subscribe(taskId, ConsoleOutput::event) : null;
        try {
            SentinelOutcome outcome = runner.run(task.get(), plan);
            ConsoleOutput.manifest(outcome.manifest());
            ConsoleOutput.info("Artifacts: " + outcome.artifactDir());
            if (outcome.manifest().result() == RunResult.ERROR) {
                ConsoleOutput.error("Run ended with an internal error");
                return EXIT_ERROR;
            }
            if (outcome.decision() != null) {
                ConsoleOutput.warn("Cascade: " + outcome.decision().label());
            }
            ConsoleOutput.success("Wave may proceed");
            return EXIT_DONE;
        } catch (WaveHaltException e) {
            ConsoleOutput.error("Wave halted by " + e.sentinelTaskId() + " (" + e.reason() + ")");
            e.violations().forEach(ConsoleOutput::violation);
            return EXIT_HALTED;
        } catch (ManifestWriteException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_ERROR;
        } catch (IllegalStateException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_ERROR;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }
}
