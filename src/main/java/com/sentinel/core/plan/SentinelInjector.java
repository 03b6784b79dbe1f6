package com.sentinel.core.plan;

import com.sentinel.core.config.SentinelProperties;
import com.sentinel.core.model.ExecutionPlan;
import com.sentinel.core.model.Task;
import com.sentinel.core.model.Wave;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands a task plan by inserting one Sentinel task directly after every
 * regular task.
 *
 * <p>With {@code sentinel.enabled=false} the plan is returned unchanged, and it must
 * not already contain Sentinel tasks: the build that produces the Sentinel itself runs
 * with the flag off so it cannot validate itself recursively.
 */
@Service
public class SentinelInjector {

    private static final Logger log = LoggerFactory.getLogger(SentinelInjector.class);

    private final SentinelProperties properties;
    private final TaskListStore taskList;

    public SentinelInjector(SentinelProperties properties, TaskListStore taskList) {
        this.properties = properties;
        this.taskList = taskList;
    }

    /**
     * Expands an ordered task plan and appends a checklist entry for every inserted Sentinel.
     *
     * @param plan tasks in plan order
     * @return the expanded plan; the input list itself when disabled
     * @throws IllegalStateException when disabled and the plan already holds Sentinel tasks
     */
    public List<Task> inject(List<Task> plan) {
        if (!properties.isEnabled()) {
            assertNoSentinels(plan);
            return plan;
        }
        return expand(plan, guardedParents(plan), true);
    }

    /**
     * Expands every wave of an execution plan; Sentinel tasks stay in their parent's wave.
     */
    public ExecutionPlan inject(ExecutionPlan plan) {
        return expandWaves(plan, true);
    }

    /**
     * Same expansion as {@link #inject(ExecutionPlan)} but leaves the task list untouched.
     */
    public ExecutionPlan preview(ExecutionPlan plan) {
        return expandWaves(plan, false);
    }

    private ExecutionPlan expandWaves(ExecutionPlan plan, boolean record) {
        if (!properties.isEnabled()) {
            assertNoSentinels(plan.tasks());
            return plan;
        }
        Set<String> guarded = guardedParents(plan.tasks());
        var waves = new ArrayList<Wave>();
        for (var wave : plan.waves()) {
            waves.add(wave.withTasks(expand(wave.tasks(), guarded, record)));
        }
        return new ExecutionPlan(waves);
    }

    private List<Task> expand(List<Task> tasks, Set<String> guarded, boolean record) {
        var expanded = new ArrayList<Task>(tasks.size() * 2);
        int inserted = 0;
        for (var task : tasks) {
            expanded.add(task);
            if (task.isSentinel() || guarded.contains(task.id())) {
                continue;
            }
            var sentinel = Task.sentinelFor(task);
            expanded.add(sentinel);
            guarded.add(task.id());
            if (record) {
                taskList.appendEntry(sentinel.id(), sentinel.description());
            }
            inserted++;
        }
        if (record) {
            log.info("Injected {} Sentinel task(s) into {} task(s)", inserted, tasks.size());
        } else {
            log.debug("Previewed {} Sentinel task(s) for {} task(s)", inserted, tasks.size());
        }
        return expanded;
    }

    /** Parents that already have a Sentinel somewhere in the plan. */
    private static Set<String> guardedParents(List<Task> plan) {
        var guarded = new HashSet<String>();
        for (var task : plan) {
            if (task.isSentinel() && task.parentId() != null) {
                guarded.add(task.parentId());
            }
        }
        return guarded;
    }

    private static void assertNoSentinels(List<Task> plan) {
        long count = plan.stream().filter(Task::isSentinel).count();
        if (count > 0) {
            throw new IllegalStateException(
                    "sentinel.enabled=false but the plan already contains %d Sentinel task(s)".formatted(count));
        }
    }
}
