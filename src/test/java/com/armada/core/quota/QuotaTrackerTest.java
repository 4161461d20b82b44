package com.armada.core.quota;

import com.armada.core.MutableClock;
import com.armada.core.events.ArmadaEvent;
import com.armada.core.events.EventBus;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.model.HierarchyTier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuotaTrackerTest {

    private static final String PROVIDER = "openai";

    private MutableClock clock;
    private List<ArmadaEvent> published;
    private SimpleMeterRegistry registry;
    private QuotaTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        published = new ArrayList<>();
        EventBus bus = new EventBus();
        bus.subscribeAll(published::add);
        registry = new SimpleMeterRegistry();
        tracker = new QuotaTracker(bus, new ArmadaMetrics(registry), new FixedCapacityEstimator(100),
                QuotaLimits.DEFAULT, Duration.ofHours(5), clock, List.of("anthropic"));
    }

    private void use(int calls) {
        for (int i = 0; i < calls; i++) {
            tracker.recordUsage(PROVIDER, HierarchyTier.WORKER, 100, 50);
        }
    }

    private long count(String eventType) {
        return published.stream().filter(e -> e.eventType().equals(eventType)).count();
    }

    @Nested
    @DisplayName("thresholds")
    class ThresholdTests {

        @Test
        @DisplayName("fresh provider is OK and executable")
        void freshProvider() {
            QuotaStatus status = tracker.getStatus(PROVIDER);

            assertEquals(QuotaState.OK, status.state());
            assertEquals(0.0, status.ratio());
            assertTrue(tracker.canExecute(PROVIDER));
            assertEquals(Duration.ofHours(5), status.resetIn());
        }

        @Test
        @DisplayName("states rise with the usage ratio")
        void statesRise() {
            use(79);
            assertEquals(QuotaState.OK, tracker.getStatus(PROVIDER).state());
            use(1);
            assertEquals(QuotaState.WARNING, tracker.getStatus(PROVIDER).state());
            use(10);
            assertEquals(QuotaState.CRITICAL, tracker.getStatus(PROVIDER).state());
            use(5);
            assertEquals(QuotaState.EXCEEDED, tracker.getStatus(PROVIDER).state());
        }

        @Test
        @DisplayName("96 of 100 calls blocks the provider")
        void hardStop() {
            use(96);

            assertFalse(tracker.canExecute(PROVIDER));
            assertEquals(0.96, tracker.getStatus(PROVIDER).ratio(), 1e-9);
        }

        @Test
        @DisplayName("ratio is capped at one")
        void ratioCapped() {
            use(120);

            assertEquals(1.0, tracker.getStatus(PROVIDER).ratio());
        }
    }

    @Nested
    @DisplayName("notifications")
    class NotificationTests {

        @Test
        @DisplayName("each upward transition notifies exactly once")
        void oneNotificationPerTransition() {
            use(100);

            assertEquals(1, count("quota.warning"));
            assertEquals(1, count("quota.critical"));
            assertEquals(1, count("quota.exceeded"));
            assertEquals(1.0, registry.find("armada.quota.transitions").tag("state", "exceeded").counter().count());
        }

        @Test
        @DisplayName("jumping several levels notifies only the reached level")
        void jumpNotifiesReachedLevel() {
            List<ArmadaEvent> events = new ArrayList<>();
            var bus = new EventBus();
            bus.subscribeAll(events::add);
            var jumpy = new QuotaTracker(bus, ArmadaMetrics.noop(), new FixedCapacityEstimator(2),
                    QuotaLimits.DEFAULT, Duration.ofHours(5), clock, List.of());

            jumpy.recordUsage(PROVIDER, HierarchyTier.WORKER, 1, 1);
            jumpy.recordUsage(PROVIDER, HierarchyTier.WORKER, 1, 1);

            List<String> types = events.stream().map(ArmadaEvent::eventType)
                    .filter(t -> !t.equals("quota.history")).toList();
            assertEquals(List.of("quota.exceeded"), types);
        }
    }

    @Nested
    @DisplayName("window rotation")
    class RotationTests {

        @Test
        @DisplayName("expired window is replaced and usage starts over")
        void rotation() {
            use(96);
            assertFalse(tracker.canExecute(PROVIDER));

            clock.advance(Duration.ofHours(5));

            assertTrue(tracker.canExecute(PROVIDER));
            assertEquals(0, tracker.getStatus(PROVIDER).window().usage().callCount());
            assertEquals(1, count("quota.reset"));
        }

        @Test
        @DisplayName("transitions notify again in the next window")
        void notifiesAgainAfterRotation() {
            use(80);
            clock.advance(Duration.ofHours(6));
            use(80);

            assertEquals(2, count("quota.warning"));
        }

        @Test
        @DisplayName("resetIn counts down with the clock")
        void resetInCountsDown() {
            use(1);
            clock.advance(Duration.ofHours(2));

            assertEquals(Duration.ofHours(3), tracker.getTimeUntilReset(PROVIDER));
        }
    }

    @Nested
    @DisplayName("accounting")
    class AccountingTests {

        @Test
        @DisplayName("usage is split by hierarchy tier")
        void perTier() {
            tracker.recordUsage(PROVIDER, HierarchyTier.WORKER, 10, 5);
            tracker.recordUsage(PROVIDER, HierarchyTier.OVERLORD, 20, 15);
            tracker.recordUsage(PROVIDER, HierarchyTier.WORKER, 1, 1);

            UsageCounters usage = tracker.getStatus(PROVIDER).window().usage();
            assertEquals(3, usage.callCount());
            assertEquals(31, usage.tokensSent());
            assertEquals(2, usage.forTier(HierarchyTier.WORKER).callCount());
            assertEquals(20, usage.forTier(HierarchyTier.OVERLORD).tokensSent());
            assertEquals(0, usage.forTier(HierarchyTier.SOVEREIGN).callCount());
        }

        @Test
        @DisplayName("getAllStatuses lists configured and used providers")
        void allStatuses() {
            use(1);

            var statuses = tracker.getAllStatuses();

            assertEquals(List.of("anthropic", PROVIDER), new ArrayList<>(statuses.keySet()));
            assertEquals(QuotaState.OK, statuses.get("anthropic").state());
        }

        @Test
        @DisplayName("history keeps one entry per interval, bounded in size")
        void historyIsBounded() {
            for (int i = 0; i < 20; i++) {
                use(1);
                clock.advance(Duration.ofMinutes(1));
                use(1);
                clock.advance(QuotaTracker.HISTORY_INTERVAL);
            }

            List<UsageHistoryEntry> history = tracker.getUsageHistory(PROVIDER);
            assertEquals(QuotaTracker.MAX_HISTORY_ENTRIES, history.size());
            assertTrue(history.get(0).timestamp().isBefore(history.get(history.size() - 1).timestamp()));
        }
    }

    @Test
    @DisplayName("pro-rated estimator shrinks capacity early in the window")
    void proRatedEstimator() {
        var estimator = new ProRatedCapacityEstimator(100, 0.1);
        var prorated = new QuotaTracker(new EventBus(), ArmadaMetrics.noop(), estimator,
                QuotaLimits.DEFAULT, Duration.ofHours(5), clock, List.of());

        for (int i = 0; i < 10; i++) {
            prorated.recordUsage(PROVIDER, HierarchyTier.WORKER, 1, 1);
        }
        assertFalse(prorated.canExecute(PROVIDER));

        clock.advance(Duration.ofMinutes(150));
        assertEquals(0.2, prorated.getStatus(PROVIDER).ratio(), 1e-9);
    }

    @Test
    @DisplayName("limits reject inverted thresholds")
    void invalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> new QuotaLimits(0.9, 0.8, 0.95));
    }
}
