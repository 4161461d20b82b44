package com.armada.core.quota;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable view of one provider's accounting window.
 */
public record QuotaWindow(
    String id,
    String provider,
    Instant start,
    Instant end,
    UsageCounters usage,
    QuotaLimits limits
) {

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(end);
    }

    QuotaWindow withUsage(UsageCounters usage) {
        return new QuotaWindow(id, provider, start, end, usage, limits);
    }
}
