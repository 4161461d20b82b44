package com.armada.core.llm;

/**
 * Pluggable "complete a prompt, return usage counters" capability behind every agent call.
 */
public interface ModelCompletion {

    /**
     * Provider name the calls are accounted against in the quota tracker.
     */
    String provider();

    /**
     * Runs one completion. Implementations throw on transport or back-end failure.
     */
    CompletionResponse complete(CompletionRequest request);
}
