package com.armada.core.model;

import java.io.Serializable;

/**
 * Outcome of a task run.
 *
 * @param success    whether the task succeeded
 * @param output     agent output on success (nullable)
 * @param error      failure reason (nullable)
 * @param durationMs wall time between start and completion
 */
public record TaskResult(
    boolean success,
    String output,
    String error,
    long durationMs
) implements Serializable {

    public static TaskResult success(String output, long durationMs) {
        return new TaskResult(true, output, null, durationMs);
    }

    public static TaskResult failure(String error, long durationMs) {
        return new TaskResult(false, null, error, durationMs);
    }
}
