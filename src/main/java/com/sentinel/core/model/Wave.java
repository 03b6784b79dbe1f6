package com.sentinel.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Set;

/**
 * One batch of tasks executed and checkpointed together.
 *
 * @param number    1-based wave number
 * @param tasks     tasks in plan order
 * @param fileLocks files owned by this wave; no other wave may modify them
 */
public record Wave(
    int number,
    List<Task> tasks,
    Set<String> fileLocks
) implements Serializable {

    public Wave {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        fileLocks = fileLocks != null ? Set.copyOf(fileLocks) : Set.of();
    }

    public Wave withTasks(List<Task> newTasks) {
        return new Wave(number, newTasks, fileLocks);
    }

    public boolean contains(String taskId) {
        return tasks.stream().anyMatch(t -> t.id().equals(taskId));
    }
}
