package com.armada.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for mission execution, the agent pool and quota tracking.
 */
public class ArmadaMetrics {

    private final MeterRegistry registry;

    public ArmadaMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Metrics sink that records into an empty composite registry, i.e. nowhere.
     */
    public static ArmadaMetrics noop() {
        return new ArmadaMetrics(new CompositeMeterRegistry());
    }

    // --- Tasks ---

    public void recordTaskCompletion(String taskType, boolean success, long ms) {
        Timer.builder("armada.task.duration")
                .tag("type", taskType)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskTimeout() {
        Counter.builder("armada.task.timeouts")
                .description("Tasks force-failed by the per-task timer")
                .register(registry)
                .increment();
    }

    public void recordTaskRetry(String taskType) {
        Counter.builder("armada.task.retries")
                .tag("type", taskType)
                .register(registry)
                .increment();
    }

    // --- Agent pool ---

    /**
     * Records one model call made by a pool agent.
     *
     * @param provider provider the call was accounted against
     * @param success  whether the call returned a response
     * @param ms       wall time of the model call
     */
    public void recordModelCall(String provider, boolean success, long ms) {
        Timer.builder("armada.pool.model_call.duration")
                .tag("provider", provider)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordQueueWait(long ms) {
        Timer.builder("armada.pool.queue.wait")
                .description("Time a request spent queued before dispatch")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a request that never reached an agent.
     *
     * @param reason error code, e.g. "quota_exceeded", "timeout", "cancelled"
     */
    public void recordRequestRejected(String reason) {
        Counter.builder("armada.pool.requests.rejected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAgentLifecycle(String event) {
        Counter.builder("armada.pool.agents")
                .tag("event", event)
                .register(registry)
                .increment();
    }

    public void recordTokens(String provider, long total) {
        DistributionSummary.builder("armada.pool.tokens")
                .tag("provider", provider)
                .register(registry)
                .record(total);
    }

    // --- Quota ---

    public void recordQuotaTransition(String provider, String state) {
        Counter.builder("armada.quota.transitions")
                .tag("provider", provider)
                .tag("state", state)
                .register(registry)
                .increment();
    }

    // --- Branches and merges ---

    /**
     * Records a detected conflict and how it was resolved.
     *
     * @param strategy "auto", "ai_assisted" or "manual"
     */
    public void recordMergeConflict(String strategy) {
        Counter.builder("armada.merge.conflicts")
                .description("Conflicts between active branches by resolution strategy")
                .tag("strategy", strategy)
                .register(registry)
                .increment();
    }

    public void recordBranchMerge(boolean success) {
        Counter.builder("armada.merge.branches")
                .tag("result", success ? "merged" : "failed")
                .register(registry)
                .increment();
    }

    // --- Missions ---

    public void recordPhaseDuration(String phase, long ms) {
        Timer.builder("armada.mission.phase.duration")
                .tag("phase", phase)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordMissionResult(String status) {
        Counter.builder("armada.missions.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordExecution(String outcome, long ms) {
        Timer.builder("armada.execution.duration")
                .description("End-to-end run time of a mission execution")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
