package com.sentinel.core.cascade;

import com.sentinel.core.config.SentinelProperties;
import com.sentinel.core.model.CascadeChoice;
import com.sentinel.core.model.CascadeDecision;
import com.sentinel.core.model.CascadeMode;
import com.sentinel.core.model.ChangeRadiusViolation;
import com.sentinel.core.plan.TaskListStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Propagates a change-radius violation to downstream work.
 * <p>
 * In {@code auto} mode every incomplete task-list entry (other than the running
 * Sentinel's own) receives a quoted warning block; completed entries are never
 * touched. In {@code human-gated} mode the {@link HumanGate} decides: auto-apply
 * annotates exactly like auto mode, the two halting choices leave the task list
 * alone and mark the decision as a halt.
 */
@Component
public class CascadeAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CascadeAnalyzer.class);

    static final String WARNING_HEADER = "[SENTINEL CASCADE WARNING]";

    private final CascadeMode mode;
    private final TaskListStore taskList;
    private final HumanGate gate;

    @Autowired
    public CascadeAnalyzer(SentinelProperties properties, TaskListStore taskList, HumanGate gate) {
        this(properties.cascadeMode(), taskList, gate);
    }

    public CascadeAnalyzer(CascadeMode mode, TaskListStore taskList, HumanGate gate) {
        this.mode = mode;
        this.taskList = taskList;
        this.gate = gate;
    }

    public CascadeMode mode() {
        return mode;
    }

    public CascadeDecision apply(String sentinelTaskId, List<ChangeRadiusViolation> violations) {
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("No violations to cascade for " + sentinelTaskId);
        }
        if (mode == CascadeMode.AUTO) {
            return new CascadeDecision(mode, null, annotate(sentinelTaskId, violations), false);
        }

        CascadeChoice choice = gate.ask(sentinelTaskId, violations);
        if (choice.halts()) {
            log.warn("{} cascade resolved to {}; wave will halt", sentinelTaskId, choice);
            return new CascadeDecision(mode, choice, 0, true);
        }
        return new CascadeDecision(mode, choice, annotate(sentinelTaskId, violations), false);
    }

    private int annotate(String sentinelTaskId, List<ChangeRadiusViolation> violations) {
        int annotated = taskList.annotateIncomplete(warningBlock(sentinelTaskId, violations), Set.of(sentinelTaskId));
        log.info("{} cascade warned {} pending task(s)", sentinelTaskId, annotated);
        return annotated;
    }

    static List<String> warningBlock(String sentinelTaskId, List<ChangeRadiusViolation> violations) {
        var lines = new ArrayList<String>();
        lines.add(WARNING_HEADER + " raised by " + sentinelTaskId);
        for (ChangeRadiusViolation violation : violations) {
            lines.add("- " + violation.axis().label() + ": observed " + violation.observed()
                    + ", budget " + violation.budget());
        }
        return lines;
    }
}
