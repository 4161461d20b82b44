package com.armada.core.quota;

import java.time.Duration;

/**
 * @param provider provider the status is for
 * @param ratio    usage ratio in [0,1]
 * @param state    level derived from the ratio and the window limits
 * @param resetIn  time until the window rotates, never negative
 * @param window   the window the ratio was computed from
 */
public record QuotaStatus(
    String provider,
    double ratio,
    QuotaState state,
    Duration resetIn,
    QuotaWindow window
) {

    public boolean canExecute() {
        return state != QuotaState.EXCEEDED;
    }
}
