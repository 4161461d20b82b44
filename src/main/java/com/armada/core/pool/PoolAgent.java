package com.armada.core.pool;

import java.time.Instant;

/**
 * Immutable snapshot of a pool agent. The pool never hands out its live records.
 *
 * @param id           agent identifier (e.g. "agent-1f3c...")
 * @param status       IDLE or BUSY
 * @param createdAt    creation time
 * @param lastActiveAt last acquire, release or completed call
 * @param requestCount completed model calls
 * @param tokenCount   total tokens across completed calls
 * @param errorCount   failed model calls
 */
public record PoolAgent(
    String id,
    AgentStatus status,
    Instant createdAt,
    Instant lastActiveAt,
    long requestCount,
    long tokenCount,
    long errorCount
) {
}
