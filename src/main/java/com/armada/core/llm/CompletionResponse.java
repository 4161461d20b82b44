package com.armada.core.llm;

/**
 * @param content      generated text
 * @param usage        token counters
 * @param finishReason why generation stopped, as reported by the back end (nullable)
 * @param model        model that produced the content (nullable)
 */
public record CompletionResponse(
    String content,
    CompletionUsage usage,
    String finishReason,
    String model
) {
}
