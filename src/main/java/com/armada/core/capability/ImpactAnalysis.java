package com.armada.core.capability;

import java.util.List;

/**
 * @param affectedFiles paths touched by the change set
 * @param riskScore     0-100
 * @param riskLevel     bucket of the score
 * @param summary       one-line human description
 */
public record ImpactAnalysis(List<String> affectedFiles, int riskScore, RiskLevel riskLevel, String summary) {

    public ImpactAnalysis {
        affectedFiles = List.copyOf(affectedFiles);
    }
}
