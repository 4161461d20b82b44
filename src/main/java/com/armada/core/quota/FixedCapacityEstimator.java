package com.armada.core.quota;

import java.time.Instant;

/**
 * Same nominal call ceiling for every window.
 */
public class FixedCapacityEstimator implements CapacityEstimator {

    public static final int DEFAULT_CALLS_PER_WINDOW = 100;

    private final double callsPerWindow;

    public FixedCapacityEstimator() {
        this(DEFAULT_CALLS_PER_WINDOW);
    }

    public FixedCapacityEstimator(double callsPerWindow) {
        if (callsPerWindow <= 0) {
            throw new IllegalArgumentException("callsPerWindow must be positive");
        }
        this.callsPerWindow = callsPerWindow;
    }

    @Override
    public double estimateCapacity(QuotaWindow window, Instant now) {
        return callsPerWindow;
    }
}
