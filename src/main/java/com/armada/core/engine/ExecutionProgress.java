package com.armada.core.engine;

import java.time.Instant;

/**
 * Point-in-time view of a run, pushed to progress listeners.
 *
 * @param stage         planning, validation, execution, merge, verification, completion,
 *                      failed or cancelled
 * @param currentTaskId scheduler id of the task being worked on (nullable)
 */
public record ExecutionProgress(
    String executionId,
    String missionId,
    String stage,
    String currentTaskId,
    int tasksCompleted,
    int tasksTotal,
    String message,
    Instant timestamp
) {
}
