package com.armada.core.llm;

import java.util.List;

/**
 * A single prompt for a model back end.
 *
 * @param systemPrompt  instructions for the model's role (nullable)
 * @param prompt        user prompt text
 * @param maxTokens     completion token ceiling (nullable for the back end's default)
 * @param temperature   sampling temperature (nullable for the back end's default)
 * @param stopSequences sequences that end generation, empty when null
 */
public record CompletionRequest(
    String systemPrompt,
    String prompt,
    Integer maxTokens,
    Double temperature,
    List<String> stopSequences
) {

    public CompletionRequest {
        stopSequences = stopSequences != null ? List.copyOf(stopSequences) : List.of();
    }

    public static CompletionRequest of(String prompt) {
        return new CompletionRequest(null, prompt, null, null, List.of());
    }
}
