package com.armada.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Immutable snapshot of a mission owned by the mission state machine.
 *
 * @param reason failure or cancellation reason (nullable)
 */
public record Mission(
    String id,
    String title,
    String description,
    TaskPriority priority,
    MissionStatus status,
    MissionPhase phase,
    MissionProgress progress,
    String reason,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt
) implements Serializable {
}
