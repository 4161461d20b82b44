package com.armada.core.quota;

import java.time.Instant;

/**
 * Estimates how many calls a provider window can absorb. Providers publish no hard limit,
 * so the result is a heuristic denominator for the usage ratio.
 */
@FunctionalInterface
public interface CapacityEstimator {

    /**
     * @return estimated call capacity, must be positive
     */
    double estimateCapacity(QuotaWindow window, Instant now);
}
