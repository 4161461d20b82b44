package com.armada.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * @param tasksTotal          tasks added to the mission
 * @param tasksCompleted      tasks reported as completed
 * @param phaseProgress       percent of the current phase, 0-100
 * @param overallProgress     percent of the whole mission, 0-100
 * @param startedAt           when the mission was started (nullable)
 * @param estimatedCompletion linear estimate from completed-task throughput (nullable)
 */
public record MissionProgress(
    int tasksTotal,
    int tasksCompleted,
    double phaseProgress,
    double overallProgress,
    Instant startedAt,
    Instant estimatedCompletion
) implements Serializable {

    public static MissionProgress initial() {
        return new MissionProgress(0, 0, 0, 0, null, null);
    }
}
