package com.armada.core.model;

import java.io.Serializable;

/**
 * Edge in the task dependency graph.
 *
 * @param taskId id of the task depended upon
 * @param type   REQUIRED or SOFT semantics
 */
public record TaskDependency(String taskId, DependencyType type) implements Serializable {

    public static TaskDependency required(String taskId) {
        return new TaskDependency(taskId, DependencyType.REQUIRED);
    }

    public static TaskDependency soft(String taskId) {
        return new TaskDependency(taskId, DependencyType.SOFT);
    }
}
