package com.armada.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "armada")
public class ArmadaProperties {

    private Scheduler scheduler = new Scheduler();
    private Pool pool = new Pool();
    private Quota quota = new Quota();
    private Merge merge = new Merge();
    private Coordinator coordinator = new Coordinator();
    private Workspace workspace = new Workspace();

    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }
    public Pool getPool() { return pool; }
    public void setPool(Pool pool) { this.pool = pool; }
    public Quota getQuota() { return quota; }
    public void setQuota(Quota quota) { this.quota = quota; }
    public Merge getMerge() { return merge; }
    public void setMerge(Merge merge) { this.merge = merge; }
    public Coordinator getCoordinator() { return coordinator; }
    public void setCoordinator(Coordinator coordinator) { this.coordinator = coordinator; }
    public Workspace getWorkspace() { return workspace; }
    public void setWorkspace(Workspace workspace) { this.workspace = workspace; }

    public static class Scheduler {
        private int maxConcurrent = 10;
        private Duration taskTimeout = Duration.ofMinutes(5);

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
        public Duration getTaskTimeout() { return taskTimeout; }
        public void setTaskTimeout(Duration taskTimeout) { this.taskTimeout = taskTimeout; }
    }

    public static class Pool {
        /** Provider name the pool's calls are accounted against. */
        private String provider = "openai";
        private int maxAgents = 5;
        private Duration idleTimeout = Duration.ofSeconds(30);
        private Duration requestTimeout = Duration.ofMinutes(2);
        private Duration minDispatchInterval = Duration.ofMillis(100);

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public int getMaxAgents() { return maxAgents; }
        public void setMaxAgents(int maxAgents) { this.maxAgents = maxAgents; }
        public Duration getIdleTimeout() { return idleTimeout; }
        public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
        public Duration getMinDispatchInterval() { return minDispatchInterval; }
        public void setMinDispatchInterval(Duration minDispatchInterval) { this.minDispatchInterval = minDispatchInterval; }
    }

    public static class Quota {
        private Duration window = Duration.ofHours(5);
        private double warningThreshold = 0.8;
        private double criticalThreshold = 0.9;
        private double hardStopThreshold = 0.95;
        private double callsPerWindow = 100;
        /** "fixed" or "pro-rated". */
        private String estimator = "fixed";
        private double minWindowFraction = 0.1;
        private List<String> providers = new ArrayList<>();

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
        public double getWarningThreshold() { return warningThreshold; }
        public void setWarningThreshold(double warningThreshold) { this.warningThreshold = warningThreshold; }
        public double getCriticalThreshold() { return criticalThreshold; }
        public void setCriticalThreshold(double criticalThreshold) { this.criticalThreshold = criticalThreshold; }
        public double getHardStopThreshold() { return hardStopThreshold; }
        public void setHardStopThreshold(double hardStopThreshold) { this.hardStopThreshold = hardStopThreshold; }
        public double getCallsPerWindow() { return callsPerWindow; }
        public void setCallsPerWindow(double callsPerWindow) { this.callsPerWindow = callsPerWindow; }
        public String getEstimator() { return estimator; }
        public void setEstimator(String estimator) { this.estimator = estimator; }
        public double getMinWindowFraction() { return minWindowFraction; }
        public void setMinWindowFraction(double minWindowFraction) { this.minWindowFraction = minWindowFraction; }
        public List<String> getProviders() { return providers; }
        public void setProviders(List<String> providers) { this.providers = providers; }
    }

    public static class Merge {
        /** Ask an agent to merge conflicts the line-level merge cannot. */
        private boolean aiAssisted = true;

        public boolean isAiAssisted() { return aiAssisted; }
        public void setAiAssisted(boolean aiAssisted) { this.aiAssisted = aiAssisted; }
    }

    public static class Coordinator {
        private int maxAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(250);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getRetryBackoff() { return retryBackoff; }
        public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }
    }

    public static class Workspace {
        private String root = ".";

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
    }
}
