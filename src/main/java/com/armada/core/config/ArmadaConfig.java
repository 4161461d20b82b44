package com.armada.core.config;

import com.armada.core.branch.VirtualBranchManager;
import com.armada.core.capability.ApprovalCapability;
import com.armada.core.capability.PreflightCapability;
import com.armada.core.capability.RollbackCapability;
import com.armada.core.capability.SnapshotRollbackService;
import com.armada.core.capability.VerificationCapability;
import com.armada.core.capability.WorkspacePreflightCheck;
import com.armada.core.concurrent.RetryPolicy;
import com.armada.core.engine.ExecutionCoordinator;
import com.armada.core.engine.SafetyGates;
import com.armada.core.events.EventBus;
import com.armada.core.llm.ModelCompletion;
import com.armada.core.llm.SpringAiModelCompletion;
import com.armada.core.merge.MergeAssistant;
import com.armada.core.merge.MergeEngine;
import com.armada.core.merge.PoolMergeAssistant;
import com.armada.core.merge.RegionAnalyzer;
import com.armada.core.merge.ThreeWayMerger;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.mission.MissionStateMachine;
import com.armada.core.pool.AgentPool;
import com.armada.core.pool.AgentPoolSettings;
import com.armada.core.quota.CapacityEstimator;
import com.armada.core.quota.FixedCapacityEstimator;
import com.armada.core.quota.ProRatedCapacityEstimator;
import com.armada.core.quota.QuotaLimits;
import com.armada.core.quota.QuotaTracker;
import com.armada.core.scheduler.TaskScheduler;
import com.armada.core.workspace.LocalWorkspaceFiles;
import com.armada.core.workspace.WorkspaceFiles;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the orchestration core. Every component takes its collaborators through the
 * constructor, so tests build the same graph by hand without a Spring context.
 */
@Configuration
public class ArmadaConfig {

    private static final Logger log = LoggerFactory.getLogger(ArmadaConfig.class);

    @Bean
    public Clock armadaClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ArmadaMetrics armadaMetrics(MeterRegistry registry) {
        return new ArmadaMetrics(registry);
    }

    @Bean
    public EventBus eventBus() {
        EventBus bus = new EventBus();
        bus.subscribeType("quota.", event -> {
            switch (event.eventType()) {
                case "quota.warning", "quota.critical", "quota.exceeded" ->
                        log.warn("Provider {} reached {} (ratio {})",
                                event.subjectId(), event.eventType(), event.payload().get("ratio"));
                case "quota.reset" -> log.info("Quota window for {} rotated", event.subjectId());
                default -> { }
            }
        });
        return bus;
    }

    @Bean
    @ConditionalOnMissingBean
    public ModelCompletion modelCompletion(ChatClient.Builder builder, ArmadaProperties properties) {
        return new SpringAiModelCompletion(builder.build(), properties.getPool().getProvider());
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkspaceFiles workspaceFiles(ArmadaProperties properties) {
        Path root = Path.of(properties.getWorkspace().getRoot()).toAbsolutePath().normalize();
        log.info("Workspace root: {}", root);
        return new LocalWorkspaceFiles(root);
    }

    @Bean
    public QuotaTracker quotaTracker(EventBus eventBus, ArmadaMetrics metrics, ArmadaProperties properties, Clock clock) {
        var quota = properties.getQuota();
        CapacityEstimator estimator = "pro-rated".equalsIgnoreCase(quota.getEstimator())
                ? new ProRatedCapacityEstimator(quota.getCallsPerWindow(), quota.getMinWindowFraction())
                : new FixedCapacityEstimator(quota.getCallsPerWindow());
        var limits = new QuotaLimits(quota.getWarningThreshold(), quota.getCriticalThreshold(),
                quota.getHardStopThreshold());
        List<String> providers = new ArrayList<>(quota.getProviders());
        if (!providers.contains(properties.getPool().getProvider())) {
            providers.add(properties.getPool().getProvider());
        }
        return new QuotaTracker(eventBus, metrics, estimator, limits, quota.getWindow(), clock, providers);
    }

    @Bean
    public RetryPolicy retryPolicy(ArmadaProperties properties) {
        var coordinator = properties.getCoordinator();
        return new RetryPolicy(coordinator.getMaxAttempts(), coordinator.getRetryBackoff());
    }

    @Bean(destroyMethod = "shutdown")
    public TaskScheduler taskScheduler(EventBus eventBus, ArmadaMetrics metrics, ArmadaProperties properties,
                                       RetryPolicy retryPolicy, Clock clock) {
        var scheduler = properties.getScheduler();
        return new TaskScheduler(eventBus, metrics, scheduler.getMaxConcurrent(), scheduler.getTaskTimeout(),
                retryPolicy, clock, null);
    }

    @Bean(destroyMethod = "shutdown")
    public AgentPool agentPool(ModelCompletion modelCompletion, QuotaTracker quotaTracker, EventBus eventBus,
                               ArmadaMetrics metrics, ArmadaProperties properties, Clock clock) {
        var pool = properties.getPool();
        var settings = new AgentPoolSettings(pool.getMaxAgents(), pool.getIdleTimeout(),
                pool.getRequestTimeout(), pool.getMinDispatchInterval());
        return new AgentPool(modelCompletion, quotaTracker, eventBus, metrics, settings, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RollbackCapability rollbackCapability(WorkspaceFiles workspaceFiles, Clock clock) {
        return new SnapshotRollbackService(workspaceFiles, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public PreflightCapability preflightCapability(WorkspaceFiles workspaceFiles) {
        return new WorkspacePreflightCheck(workspaceFiles);
    }

    @Bean
    public MissionStateMachine missionStateMachine(TaskScheduler scheduler, RollbackCapability rollback,
                                                   EventBus eventBus, ArmadaMetrics metrics, Clock clock) {
        return new MissionStateMachine(scheduler, rollback, eventBus, metrics, clock);
    }

    @Bean
    public VirtualBranchManager virtualBranchManager(WorkspaceFiles workspaceFiles, EventBus eventBus,
                                                     ArmadaMetrics metrics, Clock clock) {
        return new VirtualBranchManager(workspaceFiles, new ThreeWayMerger(), eventBus, metrics, clock);
    }

    @Bean
    public MergeEngine mergeEngine(VirtualBranchManager branches, AgentPool agentPool, EventBus eventBus,
                                   ArmadaMetrics metrics, ArmadaProperties properties, Clock clock) {
        MergeAssistant assistant = properties.getMerge().isAiAssisted()
                ? new PoolMergeAssistant(agentPool)
                : MergeAssistant.NONE;
        return new MergeEngine(branches, new RegionAnalyzer(), new ThreeWayMerger(), assistant,
                eventBus, metrics, clock);
    }

    @Bean
    public ExecutionCoordinator executionCoordinator(MissionStateMachine missions, TaskScheduler scheduler,
                                                     AgentPool agentPool, VirtualBranchManager branches,
                                                     MergeEngine mergeEngine, WorkspaceFiles workspaceFiles,
                                                     RollbackCapability rollback, PreflightCapability preflight,
                                                     ObjectProvider<ApprovalCapability> approval,
                                                     ObjectProvider<VerificationCapability> verification,
                                                     RetryPolicy retryPolicy, EventBus eventBus,
                                                     ArmadaMetrics metrics, Clock clock) {
        var gates = new SafetyGates(preflight, approval.getIfAvailable(), verification.getIfAvailable(), rollback);
        return new ExecutionCoordinator(missions, scheduler, agentPool, branches, mergeEngine, workspaceFiles,
                gates, retryPolicy, eventBus, metrics, clock);
    }
}
