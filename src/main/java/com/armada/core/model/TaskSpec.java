package com.armada.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Everything needed to create a task. A retry reuses the spec of the failed task.
 *
 * @param type         kind of work
 * @param description  free-text instructions for the agent
 * @param priority     queue tier, NORMAL when null
 * @param dependencies edges to other tasks, empty when null
 * @param tier         hierarchy tier used for quota accounting, WORKER when null
 */
public record TaskSpec(
    TaskType type,
    String description,
    TaskPriority priority,
    List<TaskDependency> dependencies,
    HierarchyTier tier
) implements Serializable {

    public TaskSpec {
        priority = priority != null ? priority : TaskPriority.NORMAL;
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        tier = tier != null ? tier : HierarchyTier.WORKER;
    }

    public static TaskSpec of(TaskType type, String description) {
        return new TaskSpec(type, description, TaskPriority.NORMAL, List.of(), HierarchyTier.WORKER);
    }

    public TaskSpec withPriority(TaskPriority priority) {
        return new TaskSpec(type, description, priority, dependencies, tier);
    }

    public TaskSpec withDependencies(List<TaskDependency> dependencies) {
        return new TaskSpec(type, description, priority, dependencies, tier);
    }
}
