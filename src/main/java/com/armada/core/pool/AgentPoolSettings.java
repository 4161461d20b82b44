package com.armada.core.pool;

import java.time.Duration;

/**
 * @param maxAgents           ceiling on live agents
 * @param idleTimeout         idle age after which an agent may be retired; also the sweep interval
 * @param requestTimeout      how long a request may wait in the queue before failing with TIMEOUT
 * @param minDispatchInterval minimum gap between two dispatches
 */
public record AgentPoolSettings(
    int maxAgents,
    Duration idleTimeout,
    Duration requestTimeout,
    Duration minDispatchInterval
) {

    public static final AgentPoolSettings DEFAULT = new AgentPoolSettings(
            5, Duration.ofSeconds(30), Duration.ofMinutes(2), Duration.ofMillis(100));

    public AgentPoolSettings {
        if (maxAgents < 1) {
            throw new IllegalArgumentException("maxAgents must be >= 1");
        }
    }
}
