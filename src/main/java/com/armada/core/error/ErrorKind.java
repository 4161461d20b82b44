package com.armada.core.error;

/**
 * Stable, machine-readable failure categories surfaced by the orchestration core.
 */
public enum ErrorKind {
    NOT_FOUND("not_found"),
    INVALID_STATE("invalid_state"),
    DEPENDENCIES_UNMET("dependencies_unmet"),
    INVALID_TRANSITION("invalid_transition"),
    CAPACITY_EXCEEDED("capacity_exceeded"),
    QUOTA_EXCEEDED("quota_exceeded"),
    TIMEOUT("timeout"),
    CANCELLED("cancelled"),
    EXECUTION_FAILED("execution_failed"),
    VALIDATION_FAILED("validation_failed"),
    VERIFICATION_FAILED("verification_failed"),
    MERGE_FAILED("merge_failed"),
    NO_ROLLBACK_POINT("no_rollback_point"),
    SHUTDOWN("shutdown");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
