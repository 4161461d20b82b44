package com.armada.core.pool;

public record PoolStats(
    int totalAgents,
    int idleAgents,
    int busyAgents,
    int maxAgents,
    int queuedRequests,
    int inFlightRequests,
    long totalRequests,
    long totalTokens,
    long totalErrors
) {
}
