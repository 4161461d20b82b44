package com.armada.core.pool;

/**
 * Normalized result of one agent call.
 *
 * @param durationMs   wall time of the model call, excluding queue wait
 * @param model        model reported by the back end (nullable)
 * @param finishReason finish reason reported by the back end (nullable)
 */
public record AgentResponse(
    String requestId,
    String agentId,
    String content,
    TokenUsage tokenUsage,
    long durationMs,
    String model,
    String finishReason
) {
}
