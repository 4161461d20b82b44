package com.armada.core.model;

/**
 * Lifecycle status of a task owned by the scheduler.
 */
public enum TaskStatus {
    PENDING,
    BLOCKED,    // waiting on a dependency, re-evaluated after every completion
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
