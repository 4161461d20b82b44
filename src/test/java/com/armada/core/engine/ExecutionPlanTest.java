package com.armada.core.engine;

import com.armada.core.capability.ApprovalCapability;
import com.armada.core.capability.PreflightCapability;
import com.armada.core.capability.SnapshotRollbackService;
import com.armada.core.capability.VerificationCapability;
import com.armada.core.error.ArmadaException;
import com.armada.core.error.ErrorKind;
import com.armada.core.model.FileChange;
import com.armada.core.model.HierarchyTier;
import com.armada.core.model.TaskPriority;
import com.armada.core.model.TaskType;
import com.armada.core.workspace.InMemoryWorkspaceFiles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionPlanTest {

    private static List<String> keys(List<PlannedTask> tasks) {
        return tasks.stream().map(PlannedTask::key).toList();
    }

    @Nested
    @DisplayName("dependencyOrder")
    class DependencyOrder {

        @Test
        @DisplayName("Plan order is kept where dependencies allow")
        void keepsPlanOrder() {
            ExecutionPlan plan = ExecutionPlan.of("m", List.of(
                    PlannedTask.of("test", TaskType.TEST, "Test", "impl"),
                    PlannedTask.of("analyze", TaskType.ANALYZE, "Analyze"),
                    PlannedTask.of("impl", TaskType.IMPLEMENT, "Implement", "analyze"),
                    PlannedTask.of("docs", TaskType.DOCUMENT, "Docs")));

            assertEquals(List.of("analyze", "impl", "test", "docs"), keys(plan.dependencyOrder()));
        }

        @Test
        @DisplayName("Duplicate keys, unknown dependencies and cycles are rejected")
        void rejectsInvalidPlans() {
            ArmadaException duplicate = assertThrows(ArmadaException.class, () -> ExecutionPlan.of("m", List.of(
                    PlannedTask.of("a", TaskType.IMPLEMENT, "A"),
                    PlannedTask.of("a", TaskType.TEST, "A again"))).dependencyOrder());
            assertEquals(ErrorKind.VALIDATION_FAILED, duplicate.kind());

            ArmadaException unknown = assertThrows(ArmadaException.class, () -> ExecutionPlan.of("m", List.of(
                    PlannedTask.of("a", TaskType.IMPLEMENT, "A", "ghost"))).dependencyOrder());
            assertTrue(unknown.getMessage().contains("ghost"));

            ArmadaException cycle = assertThrows(ArmadaException.class, () -> ExecutionPlan.of("m", List.of(
                    PlannedTask.of("root", TaskType.ANALYZE, "Root"),
                    PlannedTask.of("a", TaskType.IMPLEMENT, "A", "b"),
                    PlannedTask.of("b", TaskType.IMPLEMENT, "B", "a"))).dependencyOrder());
            assertEquals("Dependency cycle among tasks [a, b]", cycle.getMessage());
        }
    }

    @Test
    @DisplayName("Affected paths cover changes, extra paths and context files")
    void affectedPaths() {
        PlannedTask withContext = new PlannedTask("a", TaskType.IMPLEMENT, "A", null, null, null, null,
                List.of("src/ctx.ts", "src/x.ts"));
        ExecutionPlan plan = new ExecutionPlan("m", List.of(withContext),
                List.of(FileChange.create("src/x.ts", "x")), List.of("package.json"));

        assertEquals(List.of("src/x.ts", "package.json", "src/ctx.ts"), List.copyOf(plan.affectedPaths()));
        assertEquals(Set.of(), ExecutionPlan.of("m", List.of()).affectedPaths());
    }

    @Test
    @DisplayName("Planned tasks fill defaults and fall back to the description as prompt")
    void plannedTaskDefaults() {
        PlannedTask task = new PlannedTask("k", null, "Describe", " ", null, null, null, null);

        assertEquals(TaskType.IMPLEMENT, task.type());
        assertEquals(TaskPriority.NORMAL, task.priority());
        assertEquals(HierarchyTier.WORKER, task.tier());
        assertEquals("Describe", task.effectivePrompt());
        assertThrows(IllegalArgumentException.class, () -> PlannedTask.of(" ", TaskType.TEST, "x"));
    }

    @Test
    @DisplayName("Safety gates default to pass-through variants but need a rollback capability")
    void safetyGatesDefaults() {
        SafetyGates gates = SafetyGates.defaults(new SnapshotRollbackService(new InMemoryWorkspaceFiles()));

        assertSame(PreflightCapability.PASS_THROUGH, gates.preflight());
        assertSame(ApprovalCapability.AUTO_APPROVE, gates.approval());
        assertSame(VerificationCapability.ACCEPT_ALL, gates.verification());
        assertThrows(IllegalArgumentException.class, () -> new SafetyGates(null, null, null, null));
    }
}
