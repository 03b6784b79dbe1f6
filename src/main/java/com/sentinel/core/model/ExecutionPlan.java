package com.sentinel.core.model;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered waves of tasks. Tasks are looked up through a flat id index rather
 * than by following references between task objects.
 */
public record ExecutionPlan(List<Wave> waves) implements Serializable {

    public ExecutionPlan {
        waves = waves != null ? List.copyOf(waves) : List.of();
    }

    /**
     * All tasks flattened in plan order.
     */
    public List<Task> tasks() {
        return waves.stream().flatMap(w -> w.tasks().stream()).toList();
    }

    public Map<String, Task> index() {
        var byId = new LinkedHashMap<String, Task>();
        for (var task : tasks()) {
            byId.put(task.id(), task);
        }
        return byId;
    }

    public Optional<Task> findTask(String taskId) {
        return Optional.ofNullable(index().get(taskId));
    }

    public Optional<Wave> waveOf(String taskId) {
        return waves.stream().filter(w -> w.contains(taskId)).findFirst();
    }
}
