package com.armada.core.model;

/**
 * Overall status of a mission. COMPLETED and CANCELLED are terminal.
 */
public enum MissionStatus {
    PENDING,
    ACTIVE,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
