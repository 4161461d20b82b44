package com.armada.core.model;

import java.io.Serializable;

/**
 * Input for creating a mission.
 */
public record MissionConfig(
    String title,
    String description,
    TaskPriority priority
) implements Serializable {

    public MissionConfig {
        priority = priority != null ? priority : TaskPriority.NORMAL;
    }
}
