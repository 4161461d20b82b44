package com.armada.core.branch;

import com.armada.core.error.ArmadaException;
import com.armada.core.error.ErrorKind;
import com.armada.core.events.ArmadaEvent;
import com.armada.core.events.EventBus;
import com.armada.core.merge.ThreeWayMerger;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.model.FileChange;
import com.armada.core.workspace.InMemoryWorkspaceFiles;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class VirtualBranchManagerTest {

    /** Fails any write whose content contains "FAIL". */
    private static class FailingFiles extends InMemoryWorkspaceFiles {
        FailingFiles(Map<String, String> initial) {
            super(initial);
        }

        @Override
        public void write(String path, String content) {
            if (content.contains("FAIL")) {
                throw new IllegalStateException("disk full writing " + path);
            }
            super.write(path, content);
        }
    }

    private FailingFiles files;
    private SimpleMeterRegistry registry;
    private List<ArmadaEvent> published;
    private VirtualBranchManager manager;

    @BeforeEach
    void setUp() {
        files = new FailingFiles(Map.of("a.ts", "a\nb\nc", "b.ts", "old b"));
        registry = new SimpleMeterRegistry();
        EventBus events = new EventBus();
        published = new ArrayList<>();
        events.subscribeAll(published::add);
        manager = new VirtualBranchManager(files, new ThreeWayMerger(), events, new ArmadaMetrics(registry));
    }

    @Nested
    @DisplayName("Recording changes")
    class Recording {

        @Test
        @DisplayName("A missing original is filled from the base snapshot")
        void fillsOriginal() {
            VirtualBranch branch = manager.createBranch("agent-1", "task-1");

            VirtualBranch updated = manager.recordChange(branch.id(), FileChange.modify("a.ts", null, "A\nb\nc"));

            assertEquals("a\nb\nc", updated.changeFor("a.ts").orElseThrow().originalContent());
            assertEquals("a\nb\nc", files.read("a.ts").orElseThrow());
        }

        @Test
        @DisplayName("A later change to the same path replaces the earlier one")
        void replacesPerPath() {
            VirtualBranch branch = manager.createBranch("agent-1", "task-1");
            manager.recordChange(branch.id(), FileChange.modify("a.ts", null, "first"));

            VirtualBranch updated = manager.recordChanges(branch.id(), List.of(
                    FileChange.modify("a.ts", null, "second"),
                    FileChange.create("n.ts", "new")));

            assertEquals(2, updated.changes().size());
            assertEquals("second", updated.changeFor("a.ts").orElseThrow().modifiedContent());
        }

        @Test
        @DisplayName("Unknown and closed branches are rejected")
        void rejectsUnknownOrClosed() {
            ArmadaException unknown = assertThrows(ArmadaException.class,
                    () -> manager.recordChange("branch-missing", FileChange.create("x", "y")));
            assertEquals(ErrorKind.NOT_FOUND, unknown.kind());

            VirtualBranch branch = manager.createBranch("agent-1", "task-1");
            manager.abandonBranch(branch.id());
            ArmadaException closed = assertThrows(ArmadaException.class,
                    () -> manager.recordChange(branch.id(), FileChange.create("x", "y")));
            assertEquals(ErrorKind.INVALID_STATE, closed.kind());
        }

        @Test
        @DisplayName("Snapshots keep first-touch content until a merge writes the path")
        void snapshotLifecycle() {
            assertEquals("old b", manager.snapshotFile("b.ts"));
            files.write("b.ts", "edited outside");
            assertEquals("old b", manager.snapshotFile("b.ts"));
            assertNull(manager.snapshotFile("missing.ts"));

            VirtualBranch branch = manager.createBranch("agent-1", "task-1");
            manager.recordChange(branch.id(), FileChange.modify("b.ts", "edited outside", "merged b"));
            manager.mergeBranch(branch.id());

            assertEquals("merged b", manager.snapshotFile("b.ts"));
        }
    }

    @Nested
    @DisplayName("mergeBranch")
    class Merging {

        @Test
        @DisplayName("Every change is applied and the branch is closed")
        void appliesChanges() {
            VirtualBranch branch = manager.createBranch("agent-1", "task-1");
            manager.recordChanges(branch.id(), List.of(
                    FileChange.modify("a.ts", null, "A\nb\nc"),
                    FileChange.create("n.ts", "new"),
                    FileChange.delete("b.ts", null)));

            VirtualBranch merged = manager.mergeBranch(branch.id());

            assertEquals(BranchStatus.MERGED, merged.status());
            assertNotNull(merged.closedAt());
            assertEquals(Map.of("a.ts", "A\nb\nc", "n.ts", "new"), files.snapshot());
            assertEquals(1.0, registry.counter("armada.merge.branches", "result", "merged").count());
            assertTrue(published.stream().anyMatch(e -> e.eventType().equals("branch.merged")));
        }

        @Test
        @DisplayName("A failed write restores every path and leaves the branch active")
        void atomicOnFailure() {
            VirtualBranch branch = manager.createBranch("agent-1", "task-1");
            manager.recordChanges(branch.id(), List.of(
                    FileChange.modify("a.ts", null, "A\nb\nc"),
                    FileChange.create("n.ts", "new"),
                    FileChange.modify("b.ts", null, "FAIL")));

            ArmadaException e = assertThrows(ArmadaException.class, () -> manager.mergeBranch(branch.id()));

            assertEquals(ErrorKind.MERGE_FAILED, e.kind());
            assertEquals(Map.of("a.ts", "a\nb\nc", "b.ts", "old b"), files.snapshot());
            assertEquals(BranchStatus.ACTIVE, manager.getBranch(branch.id()).orElseThrow().status());
            assertEquals(1.0, registry.counter("armada.merge.branches", "result", "failed").count());
        }

        @Test
        @DisplayName("A change made against an older base is rebased onto the workspace")
        void rebasesOntoWorkspace() {
            VirtualBranch first = manager.createBranch("agent-1", "task-1");
            VirtualBranch second = manager.createBranch("agent-2", "task-2");
            manager.recordChange(first.id(), FileChange.modify("a.ts", null, "A\nb\nc"));
            manager.recordChange(second.id(), FileChange.modify("a.ts", null, "a\nb\nC"));

            manager.mergeBranch(first.id());
            manager.mergeBranch(second.id());

            assertEquals("A\nb\nC", files.read("a.ts").orElseThrow());
        }

        @Test
        @DisplayName("A rebase that conflicts fails the merge without writing")
        void uncleanRebase() {
            VirtualBranch first = manager.createBranch("agent-1", "task-1");
            VirtualBranch second = manager.createBranch("agent-2", "task-2");
            manager.recordChange(first.id(), FileChange.modify("a.ts", null, "A\nb\nc"));
            manager.recordChange(second.id(), FileChange.modify("a.ts", null, "Z\nb\nc"));
            manager.mergeBranch(first.id());

            ArmadaException e = assertThrows(ArmadaException.class, () -> manager.mergeBranch(second.id()));

            assertEquals(ErrorKind.MERGE_FAILED, e.kind());
            assertEquals("A\nb\nc", files.read("a.ts").orElseThrow());
            assertEquals(BranchStatus.ACTIVE, manager.getBranch(second.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("Each merge advances the base reference of later branches")
        void baseRefAdvances() {
            VirtualBranch first = manager.createBranch("agent-1", "task-1");
            manager.recordChange(first.id(), FileChange.create("n.ts", "new"));
            manager.mergeBranch(first.id());

            assertEquals("gen-0", first.baseRef());
            assertEquals("gen-1", manager.createBranch("agent-2", "task-2").baseRef());
        }
    }

    @Test
    @DisplayName("Lookups by agent and task only see active branches")
    void lookups() {
        VirtualBranch branch = manager.createBranch("agent-1", "task-1");

        assertEquals(Optional.of(branch.id()), manager.getBranchForAgent("agent-1").map(VirtualBranch::id));
        assertEquals(Optional.of(branch.id()), manager.getBranchForTask("task-1").map(VirtualBranch::id));

        manager.abandonBranch(branch.id());

        assertTrue(manager.getBranchForAgent("agent-1").isEmpty());
        assertTrue(manager.getBranchForTask("task-1").isEmpty());
        assertTrue(manager.getActiveBranches().isEmpty());
    }

    @Test
    @DisplayName("Conflicting files are the paths both branches touch")
    void conflictingFiles() {
        VirtualBranch first = manager.createBranch("agent-1", "task-1");
        VirtualBranch second = manager.createBranch("agent-2", "task-2");
        manager.recordChanges(first.id(), List.of(FileChange.create("x.ts", "1"), FileChange.modify("a.ts", null, "1")));
        manager.recordChanges(second.id(), List.of(FileChange.modify("a.ts", null, "2"), FileChange.create("y.ts", "2")));

        assertEquals(List.of("a.ts"), manager.getConflictingFiles(first.id(), second.id()));
    }

    @Test
    @DisplayName("Only closed branches can be deleted")
    void deleteBranch() {
        VirtualBranch branch = manager.createBranch("agent-1", "task-1");

        ArmadaException e = assertThrows(ArmadaException.class, () -> manager.deleteBranch(branch.id()));
        assertEquals(ErrorKind.INVALID_STATE, e.kind());

        manager.abandonBranch(branch.id());
        manager.deleteBranch(branch.id());

        assertTrue(manager.getBranch(branch.id()).isEmpty());
    }

    @Test
    @DisplayName("Stats count branches by status and pending changes")
    void stats() {
        VirtualBranch merged = manager.createBranch("agent-1", "task-1");
        manager.recordChange(merged.id(), FileChange.create("n.ts", "new"));
        manager.mergeBranch(merged.id());
        VirtualBranch abandoned = manager.createBranch("agent-2", "task-2");
        manager.abandonBranch(abandoned.id());
        VirtualBranch active = manager.createBranch("agent-3", "task-3");
        manager.recordChanges(active.id(), List.of(FileChange.create("p.ts", "p"), FileChange.create("q.ts", "q")));

        assertEquals(new BranchStats(3, 1, 1, 1, 2), manager.getStats());
    }
}
