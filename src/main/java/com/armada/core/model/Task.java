package com.armada.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a task owned by the scheduler.
 *
 * @param id           unique identifier (e.g. "task-3f2a...")
 * @param missionId    owning mission
 * @param spec         what to do, kept intact so a retry can duplicate it
 * @param status       current lifecycle status
 * @param retryAttempt 0 for an original task, incremented per retry
 * @param retriedFrom  id of the failed task this one retries (nullable)
 * @param createdAt    creation time
 * @param startedAt    set on the first successful start (nullable)
 * @param completedAt  set when the task reaches a terminal status (nullable)
 * @param result       run outcome, present once COMPLETED or FAILED (nullable)
 * @param cancelReason reason given to cancel (nullable)
 */
public record Task(
    String id,
    String missionId,
    TaskSpec spec,
    TaskStatus status,
    int retryAttempt,
    String retriedFrom,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    TaskResult result,
    String cancelReason
) implements Serializable {

    public TaskType type() {
        return spec.type();
    }

    public String description() {
        return spec.description();
    }

    public TaskPriority priority() {
        return spec.priority();
    }

    public List<TaskDependency> dependencies() {
        return spec.dependencies();
    }

    public HierarchyTier tier() {
        return spec.tier();
    }
}
