package com.armada.core.quota;

/**
 * Calls and tokens accounted to one hierarchy tier inside a window.
 */
public record TierUsage(long callCount, long tokensSent, long tokensReceived) {

    public static final TierUsage EMPTY = new TierUsage(0, 0, 0);

    public TierUsage plus(long sent, long received) {
        return new TierUsage(callCount + 1, tokensSent + sent, tokensReceived + received);
    }
}
