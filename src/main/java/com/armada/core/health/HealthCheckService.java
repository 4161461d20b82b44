package com.armada.core.health;

import com.armada.core.llm.ModelCompletion;
import com.armada.core.pool.AgentPool;
import com.armada.core.pool.PoolStats;
import com.armada.core.quota.QuotaState;
import com.armada.core.quota.QuotaStatus;
import com.armada.core.quota.QuotaTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ModelCompletion modelCompletion;
    private final AgentPool agentPool;
    private final QuotaTracker quotaTracker;

    public HealthCheckService(
            @Autowired(required = false) ModelCompletion modelCompletion,
            @Autowired(required = false) AgentPool agentPool,
            @Autowired(required = false) QuotaTracker quotaTracker) {
        this.modelCompletion = modelCompletion;
        this.agentPool = agentPool;
        this.quotaTracker = quotaTracker;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkModel());
        results.add(checkPool());
        results.add(checkQuota());
        return results;
    }

    private HealthStatus checkModel() {
        if (modelCompletion == null) {
            return HealthStatus.down("model",
                    "No model completion configured", Map.of());
        }
        return HealthStatus.up("model",
                "Model completion available (" + modelCompletion.provider() + ")",
                Map.of("provider", modelCompletion.provider()));
    }

    private HealthStatus checkPool() {
        if (agentPool == null) {
            return HealthStatus.down("pool",
                    "No agent pool configured", Map.of());
        }
        try {
            PoolStats stats = agentPool.getStats();
            var metadata = Map.of(
                    "agents", String.valueOf(stats.totalAgents()),
                    "busy", String.valueOf(stats.busyAgents()),
                    "queued", String.valueOf(stats.queuedRequests()),
                    "max", String.valueOf(stats.maxAgents()));
            if (stats.busyAgents() >= stats.maxAgents() && stats.queuedRequests() > 0) {
                return HealthStatus.degraded("pool",
                        "All agents busy, " + stats.queuedRequests() + " request(s) waiting", metadata);
            }
            return HealthStatus.up("pool",
                    stats.idleAgents() + " idle of " + stats.totalAgents() + " agent(s)", metadata);
        } catch (Exception e) {
            log.warn("Agent pool health check failed: {}", e.getMessage());
            return HealthStatus.down("pool",
                    "Agent pool error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkQuota() {
        if (quotaTracker == null) {
            return HealthStatus.down("quota",
                    "No quota tracker configured", Map.of());
        }
        var statuses = quotaTracker.getAllStatuses();
        if (statuses.isEmpty()) {
            return HealthStatus.up("quota",
                    "No usage recorded yet", Map.of());
        }
        var metadata = new TreeMap<String, String>();
        QuotaState worst = QuotaState.OK;
        for (QuotaStatus status : statuses.values()) {
            metadata.put(status.provider(), status.state().name().toLowerCase()
                    + " (" + Math.round(status.ratio() * 100) + "%)");
            if (status.state().ordinal() > worst.ordinal()) {
                worst = status.state();
            }
        }
        return switch (worst) {
            case EXCEEDED -> HealthStatus.down("quota",
                    "Quota exceeded for at least one provider", metadata);
            case WARNING, CRITICAL -> HealthStatus.degraded("quota",
                    "Quota " + worst.name().toLowerCase() + " for at least one provider", metadata);
            case OK -> HealthStatus.up("quota",
                    "All providers within quota", metadata);
        };
    }
}
