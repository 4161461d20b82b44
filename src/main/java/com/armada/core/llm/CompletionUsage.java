package com.armada.core.llm;

/**
 * Token counters reported for one completion.
 */
public record CompletionUsage(long promptTokens, long completionTokens, long totalTokens) {

    public static final CompletionUsage NONE = new CompletionUsage(0, 0, 0);

    public static CompletionUsage of(long promptTokens, long completionTokens) {
        return new CompletionUsage(promptTokens, completionTokens, promptTokens + completionTokens);
    }
}
