package com.armada.core.quota;

import java.time.Instant;

/**
 * Point-in-time usage snapshot kept for trend display.
 */
public record UsageHistoryEntry(
    Instant timestamp,
    String provider,
    long callCount,
    long tokensSent,
    long tokensReceived,
    double ratio
) {
}
