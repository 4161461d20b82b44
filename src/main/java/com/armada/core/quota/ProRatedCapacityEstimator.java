package com.armada.core.quota;

import java.time.Duration;
import java.time.Instant;

/**
 * Scales the nominal ceiling by the elapsed fraction of the window, so bursts early in a
 * window count against a smaller allowance. The fraction never drops below {@code minFraction}.
 */
public class ProRatedCapacityEstimator implements CapacityEstimator {

    private final double callsPerWindow;
    private final double minFraction;

    public ProRatedCapacityEstimator(double callsPerWindow, double minFraction) {
        if (callsPerWindow <= 0 || minFraction <= 0 || minFraction > 1) {
            throw new IllegalArgumentException("callsPerWindow must be positive and minFraction in (0,1]");
        }
        this.callsPerWindow = callsPerWindow;
        this.minFraction = minFraction;
    }

    @Override
    public double estimateCapacity(QuotaWindow window, Instant now) {
        long total = window.duration().toMillis();
        long elapsed = Duration.between(window.start(), now).toMillis();
        double fraction = total <= 0 ? 1.0 : Math.min(1.0, Math.max(minFraction, (double) elapsed / total));
        return callsPerWindow * fraction;
    }
}
