package com.armada.core.engine;

import com.armada.core.capability.ImpactAnalysis;
import com.armada.core.capability.VerificationResult;
import com.armada.core.error.ErrorKind;
import com.armada.core.merge.MergeResolution;
import com.armada.core.model.FileChange;
import com.armada.core.model.MissionStatus;

import java.util.List;

/**
 * Outcome of one run.
 *
 * @param status            COMPLETED, FAILED or CANCELLED
 * @param mergedChanges     changes written to the workspace
 * @param manualResolutions conflicts left for a person; their branches stay active
 * @param impact            impact analysis of the plan's up-front changes (nullable)
 * @param verification      verification outcome (nullable when the run stopped earlier)
 * @param errorKind         why the run did not complete (nullable)
 * @param message           human summary
 */
public record ExecutionResult(
    String executionId,
    String missionId,
    MissionStatus status,
    long durationMs,
    int tasksCompleted,
    int tasksTotal,
    List<FileChange> mergedChanges,
    List<MergeResolution> manualResolutions,
    ImpactAnalysis impact,
    VerificationResult verification,
    ErrorKind errorKind,
    String message
) {

    public ExecutionResult {
        mergedChanges = List.copyOf(mergedChanges);
        manualResolutions = List.copyOf(manualResolutions);
    }

    public boolean success() {
        return status == MissionStatus.COMPLETED;
    }
}
