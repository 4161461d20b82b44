package com.armada.core.quota;

import com.armada.core.model.HierarchyTier;

import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate usage of a window with a per-tier breakdown.
 */
public record UsageCounters(
    long callCount,
    long tokensSent,
    long tokensReceived,
    Map<HierarchyTier, TierUsage> byTier
) {

    public UsageCounters {
        byTier = byTier.isEmpty() ? Map.of() : Map.copyOf(byTier);
    }

    public static UsageCounters empty() {
        return new UsageCounters(0, 0, 0, Map.of());
    }

    public UsageCounters plus(HierarchyTier tier, long sent, long received) {
        Map<HierarchyTier, TierUsage> tiers = new EnumMap<>(HierarchyTier.class);
        tiers.putAll(byTier);
        tiers.put(tier, tiers.getOrDefault(tier, TierUsage.EMPTY).plus(sent, received));
        return new UsageCounters(callCount + 1, tokensSent + sent, tokensReceived + received, tiers);
    }

    public TierUsage forTier(HierarchyTier tier) {
        return byTier.getOrDefault(tier, TierUsage.EMPTY);
    }
}
