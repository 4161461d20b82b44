package com.armada.core.engine;

public enum ExecutionStatus {
    IDLE,
    RUNNING
}
