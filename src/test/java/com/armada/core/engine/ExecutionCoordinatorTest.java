package com.armada.core.engine;

import com.armada.core.branch.VirtualBranchManager;
import com.armada.core.capability.ApprovalCapability;
import com.armada.core.capability.ApprovalDecision;
import com.armada.core.capability.SnapshotRollbackService;
import com.armada.core.capability.VerificationCapability;
import com.armada.core.capability.VerificationResult;
import com.armada.core.capability.WorkspacePreflightCheck;
import com.armada.core.concurrent.CancellationToken;
import com.armada.core.concurrent.RetryPolicy;
import com.armada.core.error.ArmadaException;
import com.armada.core.error.ErrorKind;
import com.armada.core.events.EventBus;
import com.armada.core.llm.ScriptedModelCompletion;
import com.armada.core.merge.MergeAssistant;
import com.armada.core.merge.MergeEngine;
import com.armada.core.merge.MergeStrategy;
import com.armada.core.merge.RegionAnalyzer;
import com.armada.core.merge.ThreeWayMerger;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.mission.MissionStateMachine;
import com.armada.core.model.FileChange;
import com.armada.core.model.Mission;
import com.armada.core.model.MissionConfig;
import com.armada.core.model.MissionPhase;
import com.armada.core.model.MissionStatus;
import com.armada.core.model.Task;
import com.armada.core.model.TaskPriority;
import com.armada.core.model.TaskStatus;
import com.armada.core.model.TaskType;
import com.armada.core.pool.AgentPool;
import com.armada.core.quota.QuotaTracker;
import com.armada.core.scheduler.TaskScheduler;
import com.armada.core.workspace.InMemoryWorkspaceFiles;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static com.armada.core.llm.ScriptedModelCompletion.reply;
import static org.junit.jupiter.api.Assertions.*;

class ExecutionCoordinatorTest {

    private static final String ORIGINAL_A = "export const a = 1;";

    private InMemoryWorkspaceFiles files;
    private SimpleMeterRegistry registry;
    private EventBus bus;
    private ArmadaMetrics metrics;
    private TaskScheduler scheduler;
    private SnapshotRollbackService rollback;
    private MissionStateMachine missions;
    private ScriptedModelCompletion model;
    private AgentPool pool;
    private VirtualBranchManager branches;
    private MergeEngine mergeEngine;

    @BeforeEach
    void setUp() {
        files = new InMemoryWorkspaceFiles(Map.of("src/a.ts", ORIGINAL_A));
        registry = new SimpleMeterRegistry();
        bus = new EventBus();
        metrics = new ArmadaMetrics(registry);
        scheduler = new TaskScheduler(bus, metrics, 5, Duration.ofMinutes(5), Clock.systemUTC(), null);
        rollback = new SnapshotRollbackService(files);
        missions = new MissionStateMachine(scheduler, rollback, bus, metrics);
        model = new ScriptedModelCompletion();
        pool = new AgentPool(model, new QuotaTracker(bus, ArmadaMetrics.noop()), bus, metrics);
        ThreeWayMerger merger = new ThreeWayMerger();
        branches = new VirtualBranchManager(files, merger, bus, metrics);
        mergeEngine = new MergeEngine(branches, new RegionAnalyzer(), merger, MergeAssistant.NONE, bus, metrics);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
        scheduler.shutdown();
    }

    private ExecutionCoordinator coordinator(SafetyGates gates) {
        return new ExecutionCoordinator(missions, scheduler, pool, branches, mergeEngine, files, gates,
                new RetryPolicy(3, Duration.ZERO), bus, metrics, Clock.systemUTC());
    }

    private ExecutionCoordinator coordinator() {
        return coordinator(new SafetyGates(new WorkspacePreflightCheck(files), null, null, rollback));
    }

    private String newMission() {
        return missions.create(new MissionConfig("Add feature", "Feature work", TaskPriority.HIGH)).id();
    }

    private static String file(String path, String content) {
        return "Done.\n```ts " + path + "\n" + content + "\n```\n";
    }

    @Nested
    @DisplayName("Successful runs")
    class Success {

        @Test
        @DisplayName("Tasks run in dependency order and their changes are merged")
        void happyPath() {
            model.thenReply(file("src/a.ts", "export const a = 2;"))
                    .thenReply(file("src/b.ts", "export const b = 1;"));
            String missionId = newMission();
            ExecutionCoordinator coordinator = coordinator();
            List<String> stages = new CopyOnWriteArrayList<>();
            coordinator.onProgress(p -> stages.add(p.stage()));
            ExecutionPlan plan = ExecutionPlan.of(missionId, List.of(
                    PlannedTask.of("second", TaskType.TEST, "Add b", "first"),
                    PlannedTask.of("first", TaskType.IMPLEMENT, "Change a")));

            ExecutionResult result = coordinator.execute(plan, CancellationToken.none());

            assertTrue(result.success());
            assertEquals(MissionStatus.COMPLETED, result.status());
            assertEquals(2, result.tasksCompleted());
            assertEquals(2, result.tasksTotal());
            assertEquals(2, result.mergedChanges().size());
            assertEquals(Map.of("src/a.ts", "export const a = 2;", "src/b.ts", "export const b = 1;"), files.snapshot());
            assertTrue(model.requests().get(0).prompt().contains("Change a"));

            Mission mission = missions.get(missionId).orElseThrow();
            assertEquals(MissionPhase.COMPLETION, mission.phase());
            assertTrue(stages.containsAll(List.of("planning", "validation", "execution", "merge", "verification")));
            assertEquals("completion", stages.get(stages.size() - 1));
            assertEquals(ExecutionStatus.IDLE, coordinator.getStatus(missionId));
            assertEquals(1, coordinator.getStats().completed());
            assertEquals(1, registry.timer("armada.execution.duration", "outcome", "completed").count());
        }

        @Test
        @DisplayName("A failed attempt is retried as a new scheduler task")
        void retriesFailedAttempt() {
            model.thenFail(new IllegalStateException("provider hiccup"))
                    .thenReply(file("src/a.ts", "export const a = 2;"));
            String missionId = newMission();

            ExecutionResult result = coordinator().execute(
                    ExecutionPlan.of(missionId, List.of(PlannedTask.of("only", TaskType.IMPLEMENT, "Change a"))),
                    CancellationToken.none());

            assertTrue(result.success());
            List<Task> tasks = scheduler.getByMission(missionId);
            assertEquals(2, tasks.size());
            assertTrue(tasks.stream().anyMatch(t -> t.status() == TaskStatus.FAILED));
            assertTrue(tasks.stream().anyMatch(t -> t.status() == TaskStatus.COMPLETED && t.retryAttempt() == 1));
            assertEquals(1.0, registry.counter("armada.task.retries", "type", "IMPLEMENT").count());
        }

        @Test
        @DisplayName("Manually resolvable conflicts leave their branches active and merge the rest")
        void manualConflictKeepsBranches() {
            model.thenReply(file("src/a.ts", "export const a = 2;"))
                    .thenReply(file("src/a.ts", "export const a = 3;"))
                    .thenReply(file("src/b.ts", "export const b = 1;"));
            String missionId = newMission();

            ExecutionResult result = coordinator().execute(ExecutionPlan.of(missionId, List.of(
                    PlannedTask.of("one", TaskType.IMPLEMENT, "Set a to 2"),
                    PlannedTask.of("two", TaskType.IMPLEMENT, "Set a to 3"),
                    PlannedTask.of("three", TaskType.IMPLEMENT, "Add b"))), CancellationToken.none());

            assertTrue(result.success());
            assertEquals(1, result.manualResolutions().size());
            assertEquals(MergeStrategy.MANUAL, result.manualResolutions().get(0).strategy());
            assertEquals(List.of("src/b.ts"), result.mergedChanges().stream().map(FileChange::path).toList());
            assertEquals(ORIGINAL_A, files.read("src/a.ts").orElseThrow());
            assertEquals(2, branches.getActiveBranches().size());
        }

        @Test
        @DisplayName("Approval can replace a task's changes")
        void approvalModifications() {
            model.thenReply(file("src/a.ts", "export const a = 2;"));
            ApprovalCapability approval = (task, changes) ->
                    ApprovalDecision.approveWith(List.of(FileChange.create("src/c.ts", "export const c = 1;")));
            String missionId = newMission();

            ExecutionResult result = coordinator(new SafetyGates(null, approval, null, rollback)).execute(
                    ExecutionPlan.of(missionId, List.of(PlannedTask.of("only", TaskType.IMPLEMENT, "Change a"))),
                    CancellationToken.none());

            assertTrue(result.success());
            assertEquals(ORIGINAL_A, files.read("src/a.ts").orElseThrow());
            assertEquals("export const c = 1;", files.read("src/c.ts").orElseThrow());
        }
    }

    @Nested
    @DisplayName("Failed runs")
    class Failure {

        @Test
        @DisplayName("Exhausted retries fail the mission")
        void retriesExhausted() {
            model.otherwise(r -> {
                throw new IllegalStateException("provider down");
            });
            String missionId = newMission();
            ExecutionCoordinator coordinator = coordinator();

            ExecutionResult result = coordinator.execute(
                    ExecutionPlan.of(missionId, List.of(PlannedTask.of("only", TaskType.IMPLEMENT, "Change a"))),
                    CancellationToken.none());

            assertEquals(MissionStatus.FAILED, result.status());
            assertEquals(ErrorKind.EXECUTION_FAILED, result.errorKind());
            assertTrue(result.message().contains("after 3 attempt(s)"), result.message());
            assertEquals(3, model.requests().size());
            assertEquals(MissionStatus.FAILED, missions.get(missionId).orElseThrow().status());
            assertEquals(1, coordinator.getStats().failed());
        }

        @Test
        @DisplayName("Failed verification rolls merged changes back")
        void verificationFailureRollsBack() {
            model.thenReply(file("src/a.ts", "export const a = 2;"))
                    .thenReply(file("src/b.ts", "export const b = 1;"));
            VerificationCapability verification = request ->
                    VerificationResult.failed("1 test failed", List.of("AuthTest"));
            String missionId = newMission();
            ExecutionCoordinator coordinator = coordinator(new SafetyGates(null, null, verification, rollback));

            ExecutionResult result = coordinator.execute(ExecutionPlan.of(missionId, List.of(
                    PlannedTask.of("first", TaskType.IMPLEMENT, "Change a"),
                    PlannedTask.of("second", TaskType.IMPLEMENT, "Add b"))), CancellationToken.none());

            assertEquals(MissionStatus.FAILED, result.status());
            assertEquals(ErrorKind.VERIFICATION_FAILED, result.errorKind());
            assertTrue(result.message().startsWith("Verification failed, changes rolled back"));
            assertFalse(result.verification().valid());
            assertEquals(Map.of("src/a.ts", ORIGINAL_A), files.snapshot());
            assertEquals(1, coordinator.getStats().failed());
        }

        @Test
        @DisplayName("A preflight error stops the run before any task executes")
        void validationFailure() {
            String missionId = newMission();
            ExecutionPlan plan = new ExecutionPlan(missionId,
                    List.of(PlannedTask.of("only", TaskType.IMPLEMENT, "Fix it")),
                    List.of(FileChange.create("src/broken.ts", "function f() { return (1; }")), List.of());

            ExecutionResult result = coordinator().execute(plan, CancellationToken.none());

            assertEquals(MissionStatus.FAILED, result.status());
            assertEquals(ErrorKind.VALIDATION_FAILED, result.errorKind());
            assertTrue(result.message().startsWith("Validation failed"));
            assertNotNull(result.impact());
            assertTrue(model.requests().isEmpty());
        }

        @Test
        @DisplayName("A validation failure restores an existing rollback point of the mission")
        void validationFailureRollsBack() {
            String missionId = newMission();
            rollback.backup(List.of("src/a.ts"), missionId);
            files.write("src/a.ts", "drifted");
            ExecutionPlan plan = new ExecutionPlan(missionId,
                    List.of(PlannedTask.of("only", TaskType.IMPLEMENT, "Fix it")),
                    List.of(FileChange.create("src/broken.ts", "function f() { return (1; }")), List.of());

            ExecutionResult result = coordinator().execute(plan, CancellationToken.none());

            assertEquals(ErrorKind.VALIDATION_FAILED, result.errorKind());
            assertEquals(ORIGINAL_A, files.read("src/a.ts").orElseThrow());
            assertEquals(MissionStatus.FAILED, missions.get(missionId).orElseThrow().status());
            assertTrue(model.requests().isEmpty());
        }

        @Test
        @DisplayName("A dependency cycle is a validation failure")
        void dependencyCycle() {
            String missionId = newMission();

            ExecutionResult result = coordinator().execute(ExecutionPlan.of(missionId, List.of(
                    PlannedTask.of("a", TaskType.IMPLEMENT, "A", "b"),
                    PlannedTask.of("b", TaskType.IMPLEMENT, "B", "a"))), CancellationToken.none());

            assertEquals(ErrorKind.VALIDATION_FAILED, result.errorKind());
            assertTrue(model.requests().isEmpty());
        }

        @Test
        @DisplayName("Rejected changes fail the task without retrying")
        void approvalRejection() {
            model.otherwise(r -> reply(file("src/a.ts", "export const a = 2;")));
            ApprovalCapability approval = (task, changes) -> ApprovalDecision.reject("touches secrets");
            String missionId = newMission();

            ExecutionResult result = coordinator(new SafetyGates(null, approval, null, rollback)).execute(
                    ExecutionPlan.of(missionId, List.of(PlannedTask.of("only", TaskType.IMPLEMENT, "Change a"))),
                    CancellationToken.none());

            assertEquals(MissionStatus.FAILED, result.status());
            assertTrue(result.message().contains("touches secrets"));
            assertEquals(1, model.requests().size());
            assertTrue(branches.getActiveBranches().isEmpty());
        }

        @Test
        @DisplayName("Unknown and non-pending missions are rejected up front")
        void rejectsBadMission() {
            ExecutionCoordinator coordinator = coordinator();

            ArmadaException unknown = assertThrows(ArmadaException.class, () -> coordinator.execute(
                    ExecutionPlan.of("mission-missing", List.of()), CancellationToken.none()));
            assertEquals(ErrorKind.NOT_FOUND, unknown.kind());

            String missionId = newMission();
            missions.start(missionId);
            ArmadaException started = assertThrows(ArmadaException.class, () -> coordinator.execute(
                    ExecutionPlan.of(missionId, List.of()), CancellationToken.none()));
            assertEquals(ErrorKind.INVALID_STATE, started.kind());
            assertEquals(ExecutionStatus.IDLE, coordinator.getStatus(missionId));
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("A cancelled token stops the run before planning")
        void cancelledUpFront() {
            CancellationToken token = CancellationToken.create();
            token.cancel("user abort");
            String missionId = newMission();

            ExecutionResult result = coordinator().execute(
                    ExecutionPlan.of(missionId, List.of(PlannedTask.of("only", TaskType.IMPLEMENT, "Change a"))), token);

            assertEquals(MissionStatus.CANCELLED, result.status());
            assertEquals(ErrorKind.CANCELLED, result.errorKind());
            assertTrue(result.message().contains("user abort"));
            assertTrue(model.requests().isEmpty());
        }

        @Test
        @DisplayName("Cancelling a running execution abandons its branches")
        void cancelMidRun() {
            String missionId = newMission();
            ExecutionCoordinator coordinator = coordinator();
            AtomicReference<ExecutionStatus> seen = new AtomicReference<>();
            model.otherwise(r -> {
                seen.set(coordinator.getStatus(missionId));
                coordinator.cancel(missionId);
                return reply(file("src/a.ts", "export const a = 2;"));
            });

            ExecutionResult result = coordinator.execute(
                    ExecutionPlan.of(missionId, List.of(PlannedTask.of("only", TaskType.IMPLEMENT, "Change a"))),
                    CancellationToken.none());

            assertEquals(ExecutionStatus.RUNNING, seen.get());
            assertEquals(MissionStatus.CANCELLED, result.status());
            assertEquals(MissionStatus.CANCELLED, missions.get(missionId).orElseThrow().status());
            assertEquals(ORIGINAL_A, files.read("src/a.ts").orElseThrow());
            assertTrue(branches.getActiveBranches().isEmpty());
            assertEquals(1, coordinator.getStats().cancelled());
            assertFalse(coordinator.cancel(missionId));
        }
    }
}
