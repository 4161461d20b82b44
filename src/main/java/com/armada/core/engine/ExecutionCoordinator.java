package com.armada.core.engine;

import com.armada.core.branch.BranchStatus;
import com.armada.core.branch.VirtualBranch;
import com.armada.core.branch.VirtualBranchManager;
import com.armada.core.capability.ApprovalDecision;
import com.armada.core.capability.ImpactAnalysis;
import com.armada.core.capability.PreflightReport;
import com.armada.core.capability.VerificationRequest;
import com.armada.core.capability.VerificationResult;
import com.armada.core.concurrent.CancellationToken;
import com.armada.core.concurrent.RetryPolicy;
import com.armada.core.error.ArmadaException;
import com.armada.core.error.ErrorKind;
import com.armada.core.events.ArmadaEvent;
import com.armada.core.events.EventBus;
import com.armada.core.events.EventPublisher;
import com.armada.core.logging.MdcContext;
import com.armada.core.merge.MergeConflict;
import com.armada.core.merge.MergeEngine;
import com.armada.core.merge.MergeResolution;
import com.armada.core.merge.MergeStrategy;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.mission.MissionStateMachine;
import com.armada.core.model.FileChange;
import com.armada.core.model.Mission;
import com.armada.core.model.MissionStatus;
import com.armada.core.model.Task;
import com.armada.core.model.TaskDependency;
import com.armada.core.model.TaskResult;
import com.armada.core.model.TaskSpec;
import com.armada.core.model.TaskStatus;
import com.armada.core.pool.AgentPool;
import com.armada.core.pool.AgentRequest;
import com.armada.core.pool.AgentResponse;
import com.armada.core.pool.ContextItem;
import com.armada.core.scheduler.TaskScheduler;
import com.armada.core.workspace.WorkspaceFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Drives a mission through planning, validation, execution, merge and verification.
 * <p>
 * Tasks run one after another in dependency order. Each task gets a scheduler record,
 * a pool call with bounded retries, and a virtual branch holding the files it produced.
 * Branches are merged after all tasks succeeded. Any failure once execution began
 * abandons the run's branches and rolls the mission back.
 */
public class ExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    static final String SYSTEM_CONTEXT = """
            You are an engineering agent executing one task of a larger mission.
            Follow the project's conventions and keep changes focused on the task.

            Output format:
            - Return every file you create or change in full, in its own fenced code block.
            - Put the file path on the opening fence line, for example: ```java src/main/java/App.java
            - Mention briefly what you changed after the code blocks.""";

    private final MissionStateMachine missions;
    private final TaskScheduler scheduler;
    private final AgentPool pool;
    private final VirtualBranchManager branches;
    private final MergeEngine mergeEngine;
    private final WorkspaceFiles files;
    private final ResponseChangeParser parser;
    private final SafetyGates gates;
    private final RetryPolicy retryPolicy;
    private final EventPublisher events;
    private final ArmadaMetrics metrics;
    private final Clock clock;

    private final Map<String, Run> runs = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<ExecutionProgress>> progressListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong completedRuns = new AtomicLong();
    private final AtomicLong failedRuns = new AtomicLong();
    private final AtomicLong cancelledRuns = new AtomicLong();

    public ExecutionCoordinator(MissionStateMachine missions, TaskScheduler scheduler, AgentPool pool,
                                VirtualBranchManager branches, MergeEngine mergeEngine, WorkspaceFiles files,
                                SafetyGates gates, RetryPolicy retryPolicy, EventPublisher events,
                                ArmadaMetrics metrics, Clock clock) {
        this.missions = missions;
        this.scheduler = scheduler;
        this.pool = pool;
        this.branches = branches;
        this.mergeEngine = mergeEngine;
        this.files = files;
        this.parser = new ResponseChangeParser(files);
        this.gates = gates;
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.DEFAULT;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs the plan to the end. Phase failures and cancellation are reported in the result
     * and leave the mission FAILED or CANCELLED.
     *
     * @throws ArmadaException NOT_FOUND for an unknown mission, INVALID_STATE when the
     *                         mission is not PENDING or already has a run
     */
    public ExecutionResult execute(ExecutionPlan plan, CancellationToken token) {
        String missionId = plan.missionId();
        String executionId = "exec-" + UUID.randomUUID();
        CancellationToken cancellation = (token != null ? token : CancellationToken.none()).child();
        Run run = new Run(executionId, plan, cancellation, clock.instant());

        if (runs.putIfAbsent(missionId, run) != null) {
            throw new ArmadaException(ErrorKind.INVALID_STATE, "Mission " + missionId + " is already executing");
        }
        MdcContext.setExecution(missionId, executionId);
        try {
            missions.start(missionId);
            log.info("Starting execution {} of mission {} ({} tasks)", executionId, missionId, plan.tasks().size());
            return runPhases(run);
        } finally {
            runs.remove(missionId, run);
            MdcContext.clear();
        }
    }

    private ExecutionResult runPhases(Run run) {
        String missionId = run.plan.missionId();
        try {
            enter(run, "planning", "Analysing plan");
            plan(run);
            missions.advancePhase(missionId);

            enter(run, "validation", "Validating plan");
            List<PlannedTask> ordered = validate(run);
            missions.advancePhase(missionId);

            enter(run, "execution", "Executing " + ordered.size() + " task(s)");
            run.executionStarted = true;
            executeTasks(run, ordered);

            enter(run, "merge", "Merging " + run.branchIds.size() + " branch(es)");
            merge(run);
            missions.advancePhase(missionId);

            enter(run, "verification", "Verifying merged changes");
            verify(run);
            missions.advancePhase(missionId);

            enter(run, "completion", "Completing mission");
            missions.complete(missionId);
            completedRuns.incrementAndGet();
            metrics.recordExecution("completed", elapsed(run));
            notifyProgress(run, "completion", null, "Mission completed");
            log.info("Execution {} completed in {}ms", run.executionId, elapsed(run));
            return result(run, MissionStatus.COMPLETED, null, "Mission completed");
        } catch (ArmadaException e) {
            if (e.is(ErrorKind.CANCELLED) || run.token.isCancelled()) {
                return cancelled(run, e);
            }
            return failed(run, e);
        }
    }

    private void enter(Run run, String stage, String message) {
        run.token.throwIfCancelled("Execution " + run.executionId);
        run.stage = stage;
        notifyProgress(run, stage, null, message);
    }

    private void plan(Run run) {
        List<FileChange> changes = run.plan.changes();
        if (changes.isEmpty()) {
            return;
        }
        ImpactAnalysis impact = gates.preflight().analyze(changes);
        run.impact = impact;
        log.info("Impact of mission {}: {} (risk {} / {})", run.plan.missionId(), impact.summary(),
                impact.riskScore(), impact.riskLevel());
    }

    private List<PlannedTask> validate(Run run) {
        List<PlannedTask> ordered = run.plan.dependencyOrder();
        List<FileChange> changes = run.plan.changes();
        if (!changes.isEmpty()) {
            PreflightReport report = gates.preflight().check(changes);
            report.warnings().forEach(w -> log.warn("Preflight warning for mission {}: {}", run.plan.missionId(), w));
            if (!report.canProceed()) {
                throw new ArmadaException(ErrorKind.VALIDATION_FAILED,
                        "Preflight failed: " + String.join("; ", report.errors()));
            }
        }
        return ordered;
    }

    private void executeTasks(Run run, List<PlannedTask> ordered) {
        String missionId = run.plan.missionId();
        Set<String> backupPaths = run.plan.affectedPaths();
        if (!backupPaths.isEmpty()) {
            gates.rollback().backup(backupPaths, missionId);
        }
        Map<String, String> taskIdsByKey = new HashMap<>();
        for (PlannedTask planned : ordered) {
            run.token.throwIfCancelled("Execution " + run.executionId);
            List<TaskDependency> dependencies = planned.dependsOn().stream()
                    .map(key -> TaskDependency.required(taskIdsByKey.get(key)))
                    .toList();
            TaskSpec spec = new TaskSpec(planned.type(), planned.description(), planned.priority(),
                    dependencies, planned.tier());
            Task finished = runTask(run, planned, missions.addTask(missionId, spec));
            taskIdsByKey.put(planned.key(), finished.id());
            run.tasksCompleted++;
            missions.taskCompleted(missionId, finished.id());
            notifyProgress(run, "execution", finished.id(), "Task " + planned.key() + " completed");
        }
    }

    /**
     * Attempt loop for one planned task. Each failed attempt is recorded in the scheduler
     * and retried as a new task carrying the typed retry counter.
     */
    private Task runTask(Run run, PlannedTask planned, Task first) {
        String missionId = run.plan.missionId();
        Task task = first;
        int attempts = 0;
        while (true) {
            run.token.throwIfCancelled("Task " + planned.key());
            attempts++;
            MdcContext.setTask(missionId, task.id());
            notifyProgress(run, "execution", task.id(), "Running task " + planned.key()
                    + (attempts > 1 ? " (attempt " + attempts + ")" : ""));
            try {
                AgentResponse response = attempt(run, planned, task);
                recordBranch(run, planned, task, response);
                return scheduler.get(task.id()).orElse(task);
            } catch (ArmadaException e) {
                if (e.is(ErrorKind.CANCELLED) || run.token.isCancelled()) {
                    throw ArmadaException.cancelled("Task " + planned.key() + " cancelled");
                }
                if (!retryPolicy.isRetryable(e) || !retryPolicy.hasAttemptsLeft(attempts)) {
                    throw new ArmadaException(e.kind(), "Task " + planned.key() + " failed after "
                            + attempts + " attempt(s): " + e.getMessage(), e);
                }
                log.warn("Task {} attempt {} failed, retrying: {}", planned.key(), attempts, e.getMessage());
                pause(retryPolicy.delayAfter(attempts), run.token);
                task = scheduler.retry(task.id());
            } finally {
                MdcContext.clearTask();
            }
        }
    }

    private AgentResponse attempt(Run run, PlannedTask planned, Task task) {
        scheduler.start(task.id());
        CancellationToken callToken = run.token.child();
        CancellationToken.Registration link = scheduler.cancellationToken(task.id())
                .onCancel(() -> callToken.cancel("Task " + task.id() + " stopped"));
        long startedAt = clock.millis();
        try {
            AgentRequest request = AgentRequest.forTask(run.plan.missionId(), task.id(), planned.tier(),
                    SYSTEM_CONTEXT + "\n\nTask type: " + planned.type() + "\nPriority: " + planned.priority(),
                    context(planned), planned.effectivePrompt());
            AgentResponse response = pool.execute(request, callToken);
            if (!finishTask(task.id(), TaskResult.success(response.content(), clock.millis() - startedAt))) {
                throw new ArmadaException(ErrorKind.EXECUTION_FAILED, "Task " + task.id() + " timed out");
            }
            return response;
        } catch (ArmadaException e) {
            finishTask(task.id(), TaskResult.failure(e.getMessage(), clock.millis() - startedAt));
            if (e.is(ErrorKind.CANCELLED) && !run.token.isCancelled() && timedOut(task.id())) {
                throw new ArmadaException(ErrorKind.EXECUTION_FAILED, "Task " + task.id() + " timed out", e);
            }
            throw e;
        } finally {
            link.remove();
        }
    }

    /**
     * @return false when the task is no longer RUNNING, i.e. its timer already failed it
     */
    private boolean finishTask(String taskId, TaskResult result) {
        try {
            scheduler.complete(taskId, result);
            return true;
        } catch (ArmadaException e) {
            if (!e.is(ErrorKind.INVALID_STATE)) {
                throw e;
            }
            log.debug("Task {} already finished: {}", taskId, e.getMessage());
            return false;
        }
    }

    private boolean timedOut(String taskId) {
        return scheduler.get(taskId).map(t -> t.status() == TaskStatus.FAILED).orElse(false);
    }

    private List<ContextItem> context(PlannedTask planned) {
        List<ContextItem> items = new ArrayList<>();
        for (String path : planned.contextFiles()) {
            files.read(path).ifPresentOrElse(
                    content -> items.add(ContextItem.file(path, content)),
                    () -> log.debug("Context file {} does not exist", path));
        }
        return items;
    }

    private void recordBranch(Run run, PlannedTask planned, Task task, AgentResponse response) {
        List<FileChange> changes = parser.parse(response.content());
        Task current = scheduler.get(task.id()).orElse(task);
        ApprovalDecision decision = gates.approval().requestApproval(current, changes);
        if (!decision.approved()) {
            throw new ArmadaException(ErrorKind.VALIDATION_FAILED, "Changes of task " + planned.key()
                    + " rejected: " + (decision.reason() != null ? decision.reason() : "no reason given"));
        }
        if (decision.modifications() != null) {
            log.info("Approval replaced {} change(s) of task {} with {}", changes.size(), planned.key(),
                    decision.modifications().size());
            changes = decision.modifications();
        }
        VirtualBranch branch = branches.createBranch(response.agentId(), task.id());
        run.branchIds.add(branch.id());
        if (!changes.isEmpty()) {
            branches.recordChanges(branch.id(), changes);
        }
        log.info("Task {} produced {} change(s) on branch {}", planned.key(), changes.size(), branch.id());
    }

    private void merge(Run run) {
        List<VirtualBranch> candidates = run.branchIds.stream()
                .map(branches::getBranch)
                .flatMap(Optional::stream)
                .toList();
        Set<String> pendingPaths = new LinkedHashSet<>();
        candidates.forEach(b -> b.changes().forEach(c -> pendingPaths.add(c.path())));
        if (pendingPaths.isEmpty()) {
            log.info("No changes to merge for mission {}", run.plan.missionId());
            return;
        }

        Set<String> backup = new LinkedHashSet<>(run.plan.affectedPaths());
        backup.addAll(pendingPaths);
        gates.rollback().backup(backup, run.plan.missionId());

        List<MergeConflict> conflicts = mergeEngine.detectConflicts(run.branchIds);
        List<MergeResolution> resolved = new ArrayList<>();
        Set<String> skipped = new HashSet<>();
        Map<String, MergeConflict> byId = new HashMap<>();
        for (MergeConflict conflict : conflicts) {
            byId.put(conflict.id(), conflict);
            MergeResolution resolution = mergeEngine.resolveConflict(conflict, run.token);
            if (resolution.strategy() == MergeStrategy.MANUAL) {
                run.manualResolutions.add(resolution);
                skipped.add(conflict.branch1Id());
                skipped.add(conflict.branch2Id());
            } else {
                resolved.add(resolution);
            }
        }
        for (MergeResolution resolution : resolved) {
            MergeConflict conflict = byId.get(resolution.conflictId());
            if (skipped.contains(conflict.branch1Id()) || skipped.contains(conflict.branch2Id())) {
                continue;
            }
            mergeEngine.applyResolution(resolution);
        }

        int merged = 0;
        for (String branchId : run.branchIds) {
            if (skipped.contains(branchId)) {
                log.warn("Skipping branch {}: conflicts need manual resolution", branchId);
                continue;
            }
            try {
                VirtualBranch result = branches.mergeBranch(branchId);
                run.mergedChanges.addAll(result.changes());
                merged++;
            } catch (ArmadaException e) {
                if (!e.is(ErrorKind.MERGE_FAILED)) {
                    throw e;
                }
                log.warn("Branch {} not merged: {}", branchId, e.getMessage());
            }
        }
        if (merged == 0) {
            throw new ArmadaException(ErrorKind.MERGE_FAILED, "No branch of the run could be merged ("
                    + skipped.size() + " awaiting manual resolution)");
        }
        log.info("Merged {} of {} branch(es) for mission {}", merged, run.branchIds.size(), run.plan.missionId());
    }

    private void verify(Run run) {
        VerificationResult result = gates.verification().verify(
                new VerificationRequest(run.plan.missionId(), run.mergedChanges));
        run.verification = result;
        if (!result.valid()) {
            throw new ArmadaException(ErrorKind.VERIFICATION_FAILED, "Verification failed: " + result.summary());
        }
        log.info("Verification passed for mission {}: {}", run.plan.missionId(), result.summary());
    }

    private ExecutionResult failed(Run run, ArmadaException error) {
        String missionId = run.plan.missionId();
        String reason = failureReason(run, error);
        log.error("Execution {} failed during {}: {}", run.executionId, run.stage, error.getMessage());
        cleanUp(run);
        try {
            missions.fail(missionId, reason);
        } catch (ArmadaException e) {
            log.warn("Mission {} not marked failed: {}", missionId, e.getMessage());
        }
        failedRuns.incrementAndGet();
        metrics.recordExecution("failed", elapsed(run));
        notifyProgress(run, "failed", null, reason);
        return result(run, MissionStatus.FAILED, error.kind(), reason);
    }

    private ExecutionResult cancelled(Run run, ArmadaException error) {
        String missionId = run.plan.missionId();
        String reason = run.token.reason() != null ? run.token.reason() : error.getMessage();
        log.info("Execution {} cancelled during {}: {}", run.executionId, run.stage, reason);
        cleanUp(run);
        try {
            missions.cancel(missionId, "Execution cancelled: " + reason);
        } catch (ArmadaException e) {
            log.warn("Mission {} not marked cancelled: {}", missionId, e.getMessage());
        }
        cancelledRuns.incrementAndGet();
        metrics.recordExecution("cancelled", elapsed(run));
        notifyProgress(run, "cancelled", null, "Execution cancelled");
        return result(run, MissionStatus.CANCELLED, ErrorKind.CANCELLED, "Execution cancelled: " + reason);
    }

    private String failureReason(Run run, ArmadaException error) {
        return switch (run.stage) {
            case "validation" -> "Validation failed: " + error.getMessage();
            case "merge" -> "Merge failed, changes rolled back: " + error.getMessage();
            case "verification" -> "Verification failed, changes rolled back: " + error.getMessage();
            case "execution" -> "Execution failed, changes rolled back: " + error.getMessage();
            default -> "Execution failed during " + run.stage + ": " + error.getMessage();
        };
    }

    /**
     * Abandons the run's open branches and rolls the mission back after a failure in
     * validation or any later phase. A validation failure normally finds no rollback point,
     * since the run's own backup is taken when execution starts; that case is only logged.
     */
    private void cleanUp(Run run) {
        for (String branchId : run.branchIds) {
            boolean active = branches.getBranch(branchId)
                    .map(b -> b.status() == BranchStatus.ACTIVE)
                    .orElse(false);
            if (active) {
                branches.abandonBranch(branchId);
            }
        }
        mergeEngine.clearConflicts(run.branchIds);
        if (!run.executionStarted && !"validation".equals(run.stage)) {
            return;
        }
        try {
            List<String> restored = missions.rollback(run.plan.missionId());
            log.info("Rolled back {} file(s) for mission {}", restored.size(), run.plan.missionId());
        } catch (ArmadaException e) {
            if (e.is(ErrorKind.NO_ROLLBACK_POINT)) {
                log.info("Nothing to roll back for mission {}", run.plan.missionId());
            } else {
                log.error("Rollback of mission {} failed: {}", run.plan.missionId(), e.getMessage(), e);
            }
        }
    }

    private void pause(Duration delay, CancellationToken token) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        CountDownLatch wake = new CountDownLatch(1);
        CancellationToken.Registration registration = token.onCancel(wake::countDown);
        try {
            wake.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ArmadaException.cancelled("Interrupted while waiting to retry");
        } finally {
            registration.remove();
        }
    }

    /**
     * Cancels the running execution of a mission. The run itself moves the mission to
     * CANCELLED at its next checkpoint.
     *
     * @return false when the mission has no running execution
     */
    public boolean cancel(String missionId) {
        Run run = runs.get(missionId);
        if (run == null) {
            return false;
        }
        log.info("Cancelling execution {} of mission {}", run.executionId, missionId);
        run.token.cancel("Execution cancelled by user");
        return true;
    }

    public ExecutionStatus getStatus(String missionId) {
        return runs.containsKey(missionId) ? ExecutionStatus.RUNNING : ExecutionStatus.IDLE;
    }

    public Optional<ExecutionProgress> getCurrentProgress(String missionId) {
        Run run = runs.get(missionId);
        return run != null ? Optional.ofNullable(run.progress) : Optional.empty();
    }

    public EventBus.Subscription onProgress(Consumer<ExecutionProgress> listener) {
        progressListeners.add(listener);
        return () -> progressListeners.remove(listener);
    }

    public CoordinatorStats getStats() {
        return new CoordinatorStats(runs.size(), completedRuns.get(), failedRuns.get(), cancelledRuns.get());
    }

    private void notifyProgress(Run run, String stage, String taskId, String message) {
        ExecutionProgress progress = new ExecutionProgress(run.executionId, run.plan.missionId(), stage, taskId,
                run.tasksCompleted, run.plan.tasks().size(), message, clock.instant());
        run.progress = progress;
        for (Consumer<ExecutionProgress> listener : progressListeners) {
            try {
                listener.accept(progress);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed: {}", e.getMessage(), e);
            }
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("executionId", run.executionId);
        payload.put("stage", stage);
        payload.put("tasksCompleted", run.tasksCompleted);
        payload.put("tasksTotal", run.plan.tasks().size());
        payload.put("message", message);
        events.publish(ArmadaEvent.of("execution.progress", run.plan.missionId(), taskId, payload));
    }

    private ExecutionResult result(Run run, MissionStatus status, ErrorKind kind, String message) {
        MissionStatus finalStatus = missions.get(run.plan.missionId()).map(Mission::status).orElse(status);
        return new ExecutionResult(run.executionId, run.plan.missionId(), finalStatus, elapsed(run),
                run.tasksCompleted, run.plan.tasks().size(), run.mergedChanges, run.manualResolutions,
                run.impact, run.verification, kind, message);
    }

    private long elapsed(Run run) {
        return Duration.between(run.startedAt, clock.instant()).toMillis();
    }

    private static final class Run {
        final String executionId;
        final ExecutionPlan plan;
        final CancellationToken token;
        final Instant startedAt;
        final List<String> branchIds = new ArrayList<>();
        final List<FileChange> mergedChanges = new ArrayList<>();
        final List<MergeResolution> manualResolutions = new ArrayList<>();
        volatile String stage = "planning";
        volatile ExecutionProgress progress;
        volatile boolean executionStarted;
        int tasksCompleted;
        ImpactAnalysis impact;
        VerificationResult verification;

        Run(String executionId, ExecutionPlan plan, CancellationToken token, Instant startedAt) {
            this.executionId = executionId;
            this.plan = plan;
            this.token = token;
            this.startedAt = startedAt;
        }
    }
}
