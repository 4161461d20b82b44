package com.armada.core.model;

/**
 * Mission phases in canonical order.
 */
public enum MissionPhase {
    PLANNING,
    VALIDATION,
    EXECUTION,
    VERIFICATION,
    COMPLETION
}
