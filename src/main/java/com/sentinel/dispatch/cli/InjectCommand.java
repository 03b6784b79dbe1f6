package com.sentinel.dispatch.cli;

import com.sentinel.core.model.ExecutionPlan;
import com.sentinel.core.model.Task;
import com.sentinel.core.model.Wave;
import com.sentinel.core.plan.PlanStore;
import com.sentinel.core.plan.SentinelInjector;
import com.sentinel.core.runner.SentinelException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: sentinel inject --plan &lt;file&gt; [--write]
 * <p>
 * Inserts a Sentinel task after every regular task of the plan and prints the
 * expanded plan. Only with {@code --write} are the plan file and the task list changed;
 * checklist entries are appended after the plan file is written.
 */
@Command(name = "inject", mixinStandardHelpOptions = true, description = "Insert Sentinel tasks into a plan")
@Component
public class InjectCommand implements Callable<Integer> {

    @Option(names = {"--plan", "-p"}, required = true, description = "Execution plan JSON file")
    private Path planFile;

    @Option(names = "--write", description = "Write the expanded plan back to the plan file")
    private boolean write;

    private final PlanStore planStore;
    private final SentinelInjector injector;

    public InjectCommand(PlanStore planStore, SentinelInjector injector) {
        this.planStore = planStore;
        this.injector = injector;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ExecutionPlan plan;
        ExecutionPlan expanded;
        int before;
        try {
            plan = planStore.read(planFile);
            before = plan.tasks().size();
            expanded = injector.preview(plan);
        } catch (SentinelException | IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        int added = expanded.tasks().size() - before;
        if (added == 0) {
            ConsoleOutput.info("No Sentinel tasks inserted (disabled, or every task is already guarded)");
        }
        for (Wave wave : expanded.waves()) {
            System.out.println("WAVE " + wave.number());
            for (Task task : wave.tasks()) {
                System.out.printf("  %-24s [%-10s] %s%n", task.id(), task.agentRole(),
                        task.description() != null ? task.description() : "");
            }
        }

        if (write && added > 0) {
            try {
                planStore.write(planFile, expanded);
                injector.inject(plan);
            } catch (SentinelException e) {
                ConsoleOutput.error(e.getMessage());
                return 1;
            }
            ConsoleOutput.success("Inserted " + added + " Sentinel task" + (added != 1 ? "s" : "")
                    + " into " + planFile);
        } else if (added > 0) {
            ConsoleOutput.info("Inserted " + added + " Sentinel task" + (added != 1 ? "s" : "")
                    + " (dry run; pass --write to update " + planFile + ")");
        }
        return 0;
    }
}
