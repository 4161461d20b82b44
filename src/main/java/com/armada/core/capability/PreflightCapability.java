package com.armada.core.capability;

import com.armada.core.model.FileChange;

import java.util.List;

/**
 * Checks a planned change set before execution starts.
 */
public interface PreflightCapability {

    /** Lets every change set through. */
    PreflightCapability PASS_THROUGH = new PreflightCapability() {
        @Override
        public PreflightReport check(List<FileChange> changes) {
            return PreflightReport.clear();
        }

        @Override
        public ImpactAnalysis analyze(List<FileChange> changes) {
            return new ImpactAnalysis(changes.stream().map(FileChange::path).toList(), 0, RiskLevel.LOW,
                    changes.size() + " file(s) affected");
        }
    };

    PreflightReport check(List<FileChange> changes);

    ImpactAnalysis analyze(List<FileChange> changes);
}
