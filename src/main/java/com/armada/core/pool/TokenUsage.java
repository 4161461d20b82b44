package com.armada.core.pool;

/**
 * Token counts of one agent response, as reported by the model.
 */
public record TokenUsage(long promptTokens, long completionTokens, long totalTokens) {
}
