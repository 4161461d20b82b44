package com.armada.core.model;

public enum DependencyType {
    /** The target must be COMPLETED. */
    REQUIRED,
    /** The target must not be RUNNING. */
    SOFT
}
