package com.armada.core.capability;

import java.util.List;

/**
 * @param canProceed false when any blocking error was found
 * @param errors     blocking problems
 * @param warnings   problems that are logged but do not block
 * @param riskLevel  overall risk of the change set
 */
public record PreflightReport(boolean canProceed, List<String> errors, List<String> warnings, RiskLevel riskLevel) {

    public PreflightReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static PreflightReport clear() {
        return new PreflightReport(true, List.of(), List.of(), RiskLevel.LOW);
    }
}
