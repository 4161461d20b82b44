package com.armada.core.model;

/**
 * Kind of work a task asks an agent to perform.
 */
public enum TaskType {
    ANALYZE,
    PLAN,
    IMPLEMENT,
    REVIEW,
    TEST,
    FIX,
    DOCUMENT,
    REFACTOR
}
