package com.armada.core.quota;

import com.armada.core.events.ArmadaEvent;
import com.armada.core.events.EventPublisher;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.model.HierarchyTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Accounts model calls per provider inside rolling windows and answers whether a provider
 * may still be called.
 * <p>
 * Windows are created lazily and replaced once their end time passes. Each upward change of
 * {@link QuotaState} inside a window emits exactly one notification; rotation emits
 * {@code quota.reset} and starts the provider over at OK.
 */
public class QuotaTracker {

    private static final Logger log = LoggerFactory.getLogger(QuotaTracker.class);

    public static final Duration DEFAULT_WINDOW = Duration.ofHours(5);
    static final int MAX_HISTORY_ENTRIES = 12;
    static final Duration HISTORY_INTERVAL = Duration.ofMinutes(5);

    private final EventPublisher events;
    private final ArmadaMetrics metrics;
    private final CapacityEstimator capacityEstimator;
    private final QuotaLimits limits;
    private final Duration windowDuration;
    private final Clock clock;
    private final Set<String> providers = new LinkedHashSet<>();

    private final Map<String, QuotaWindow> windows = new HashMap<>();
    private final Map<String, QuotaState> notifiedStates = new HashMap<>();
    private final Map<String, Deque<UsageHistoryEntry>> history = new HashMap<>();
    private final Map<String, Instant> lastHistoryAt = new HashMap<>();

    public QuotaTracker(EventPublisher events, ArmadaMetrics metrics) {
        this(events, metrics, new FixedCapacityEstimator(), QuotaLimits.DEFAULT, DEFAULT_WINDOW,
                Clock.systemUTC(), List.of());
    }

    /**
     * @param providers providers reported by {@link #getAllStatuses()} even before first use
     */
    public QuotaTracker(EventPublisher events, ArmadaMetrics metrics, CapacityEstimator capacityEstimator,
                        QuotaLimits limits, Duration windowDuration, Clock clock, List<String> providers) {
        this.events = events;
        this.metrics = metrics;
        this.capacityEstimator = capacityEstimator;
        this.limits = limits;
        this.windowDuration = windowDuration;
        this.clock = clock;
        this.providers.addAll(providers);
    }

    /**
     * Accounts one call against the provider's current window.
     */
    public void recordUsage(String provider, HierarchyTier tier, long tokensSent, long tokensReceived) {
        List<ArmadaEvent> pending = new ArrayList<>();
        QuotaStatus status;
        QuotaState raisedFrom = null;
        synchronized (this) {
            QuotaWindow window = currentWindow(provider, pending);
            window = window.withUsage(window.usage().plus(tier, tokensSent, tokensReceived));
            windows.put(provider, window);
            status = statusOf(window);

            maybeRecordHistory(provider, window, status.ratio(), pending);

            QuotaState previous = notifiedStates.getOrDefault(provider, QuotaState.OK);
            if (status.state().isAbove(previous)) {
                raisedFrom = previous;
                pending.add(ArmadaEvent.of(status.state().eventType(), null, provider, Map.of(
                        "ratio", status.ratio(),
                        "previousState", previous.name(),
                        "resetInMs", status.resetIn().toMillis())));
            }
            notifiedStates.put(provider, status.state());
        }
        log.debug("Recorded {} usage for {} ({} sent, {} received): {} calls, ratio {}",
                tier, provider, tokensSent, tokensReceived, status.window().usage().callCount(),
                String.format("%.2f", status.ratio()));
        if (raisedFrom != null) {
            log.warn("Quota for {} rose from {} to {} (ratio {})", provider, raisedFrom, status.state(),
                    String.format("%.2f", status.ratio()));
            metrics.recordQuotaTransition(provider, status.state().name().toLowerCase());
        }
        pending.forEach(events::publish);
    }

    /**
     * False only when the provider's usage has reached the hard-stop threshold.
     */
    public boolean canExecute(String provider) {
        return getStatus(provider).canExecute();
    }

    public QuotaStatus getStatus(String provider) {
        List<ArmadaEvent> pending = new ArrayList<>();
        QuotaStatus status;
        synchronized (this) {
            status = statusOf(currentWindow(provider, pending));
        }
        pending.forEach(events::publish);
        return status;
    }

    public Duration getTimeUntilReset(String provider) {
        return getStatus(provider).resetIn();
    }

    /**
     * Status of every configured provider plus any provider that has recorded usage.
     */
    public Map<String, QuotaStatus> getAllStatuses() {
        List<String> known;
        synchronized (this) {
            known = new ArrayList<>(providers);
        }
        Map<String, QuotaStatus> result = new LinkedHashMap<>();
        for (String provider : known) {
            result.put(provider, getStatus(provider));
        }
        return result;
    }

    /**
     * Oldest-first usage snapshots, at most one per five minutes and twelve in total.
     */
    public synchronized List<UsageHistoryEntry> getUsageHistory(String provider) {
        Deque<UsageHistoryEntry> entries = history.get(provider);
        return entries != null ? List.copyOf(entries) : List.of();
    }

    public QuotaLimits limits() {
        return limits;
    }

    // Must hold monitor.
    private QuotaWindow currentWindow(String provider, List<ArmadaEvent> pending) {
        providers.add(provider);
        Instant now = clock.instant();
        QuotaWindow existing = windows.get(provider);
        if (existing != null && !existing.isExpired(now)) {
            return existing;
        }
        QuotaWindow fresh = new QuotaWindow("qw-" + provider + "-" + UUID.randomUUID(), provider,
                now, now.plus(windowDuration), UsageCounters.empty(), limits);
        windows.put(provider, fresh);
        notifiedStates.put(provider, QuotaState.OK);
        if (existing != null) {
            log.info("Quota window for {} rotated after {} calls", provider, existing.usage().callCount());
            pending.add(ArmadaEvent.of("quota.reset", null, provider, Map.of(
                    "previousCalls", existing.usage().callCount(),
                    "windowEnd", fresh.end().toString())));
        }
        return fresh;
    }

    // Must hold monitor.
    private QuotaStatus statusOf(QuotaWindow window) {
        Instant now = clock.instant();
        double capacity = capacityEstimator.estimateCapacity(window, now);
        double ratio = capacity <= 0 ? 1.0 : Math.min(1.0, window.usage().callCount() / capacity);
        Duration resetIn = Duration.between(now, window.end());
        if (resetIn.isNegative()) {
            resetIn = Duration.ZERO;
        }
        return new QuotaStatus(window.provider(), ratio, window.limits().stateFor(ratio), resetIn, window);
    }

    // Must hold monitor.
    private void maybeRecordHistory(String provider, QuotaWindow window, double ratio, List<ArmadaEvent> pending) {
        Instant now = clock.instant();
        Instant last = lastHistoryAt.get(provider);
        if (last != null && Duration.between(last, now).compareTo(HISTORY_INTERVAL) < 0) {
            return;
        }
        Deque<UsageHistoryEntry> entries = history.computeIfAbsent(provider, p -> new ArrayDeque<>());
        entries.addLast(new UsageHistoryEntry(now, provider, window.usage().callCount(),
                window.usage().tokensSent(), window.usage().tokensReceived(), ratio));
        while (entries.size() > MAX_HISTORY_ENTRIES) {
            entries.removeFirst();
        }
        lastHistoryAt.put(provider, now);
        pending.add(ArmadaEvent.of("quota.history", null, provider, Map.of(
                "entries", entries.size(),
                "ratio", ratio)));
    }
}
