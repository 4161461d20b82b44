package com.armada.core.pool;

public enum AgentStatus {
    IDLE,
    BUSY
}
