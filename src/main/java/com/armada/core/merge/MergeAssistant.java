package com.armada.core.merge;

import com.armada.core.concurrent.CancellationToken;

import java.util.Optional;

/**
 * Model-assisted conflict resolution, tried after the automatic merge fails.
 */
@FunctionalInterface
public interface MergeAssistant {

    /** Never resolves; the cascade goes straight to MANUAL. */
    MergeAssistant NONE = (conflict, automatic, token) -> Optional.empty();

    /**
     * @param automatic the failed line-level attempt, conflict markers included
     * @return merged content, or empty when no usable answer came back
     */
    Optional<String> resolve(MergeConflict conflict, MergeOutcome automatic, CancellationToken token);
}
