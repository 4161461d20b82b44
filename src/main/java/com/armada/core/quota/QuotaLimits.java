package com.armada.core.quota;

/**
 * Thresholds expressed as usage ratios in [0,1].
 *
 * @param warningThreshold  ratio at which the state becomes WARNING
 * @param criticalThreshold ratio at which the state becomes CRITICAL
 * @param hardStopThreshold ratio at which the state becomes EXCEEDED and execution stops
 */
public record QuotaLimits(double warningThreshold, double criticalThreshold, double hardStopThreshold) {

    public static final QuotaLimits DEFAULT = new QuotaLimits(0.8, 0.9, 0.95);

    public QuotaLimits {
        if (warningThreshold < 0 || hardStopThreshold > 1
                || warningThreshold > criticalThreshold || criticalThreshold > hardStopThreshold) {
            throw new IllegalArgumentException("Quota thresholds must satisfy 0 <= warning <= critical <= hardStop <= 1");
        }
    }

    public QuotaState stateFor(double ratio) {
        if (ratio >= hardStopThreshold) {
            return QuotaState.EXCEEDED;
        }
        if (ratio >= criticalThreshold) {
            return QuotaState.CRITICAL;
        }
        if (ratio >= warningThreshold) {
            return QuotaState.WARNING;
        }
        return QuotaState.OK;
    }
}
