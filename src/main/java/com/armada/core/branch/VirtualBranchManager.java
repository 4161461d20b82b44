package com.armada.core.branch;

import com.armada.core.error.ArmadaException;
import com.armada.core.error.ErrorKind;
import com.armada.core.events.ArmadaEvent;
import com.armada.core.events.EventPublisher;
import com.armada.core.merge.MergeOutcome;
import com.armada.core.merge.ThreeWayMerger;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.model.ChangeType;
import com.armada.core.model.FileChange;
import com.armada.core.workspace.WorkspaceFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps one isolated change set per in-flight task and merges them into the workspace.
 * <p>
 * A merge is all-or-nothing: if any write fails, every path already written is restored
 * and the branch stays ACTIVE. When the workspace moved on since a change was recorded the
 * change is rebased with a three-way merge, and an unclean rebase fails the merge.
 */
public class VirtualBranchManager {

    private static final Logger log = LoggerFactory.getLogger(VirtualBranchManager.class);

    private final WorkspaceFiles files;
    private final ThreeWayMerger merger;
    private final EventPublisher events;
    private final ArmadaMetrics metrics;
    private final Clock clock;

    private final Map<String, BranchRecord> branches = new LinkedHashMap<>();
    /** Base content per path, captured on first touch and refreshed by merges. */
    private final Map<String, Optional<String>> fileSnapshots = new HashMap<>();
    private long generation;

    public VirtualBranchManager(WorkspaceFiles files, ThreeWayMerger merger, EventPublisher events, ArmadaMetrics metrics) {
        this(files, merger, events, metrics, Clock.systemUTC());
    }

    public VirtualBranchManager(WorkspaceFiles files, ThreeWayMerger merger, EventPublisher events,
                                ArmadaMetrics metrics, Clock clock) {
        this.files = files;
        this.merger = merger;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
    }

    public VirtualBranch createBranch(String agentId, String taskId) {
        VirtualBranch snapshot;
        synchronized (this) {
            BranchRecord record = new BranchRecord("branch-" + UUID.randomUUID(), agentId, taskId,
                    "gen-" + generation, clock.instant());
            branches.put(record.id, record);
            snapshot = record.snapshot();
        }
        log.debug("Created branch {} for task {} (agent {})", snapshot.id(), taskId, agentId);
        events.publish(ArmadaEvent.of("branch.created", null, snapshot.id(), Map.of(
                "taskId", String.valueOf(taskId),
                "agentId", String.valueOf(agentId))));
        return snapshot;
    }

    /**
     * Records a change, replacing any earlier change to the same path. A missing original
     * content is filled from the base snapshot.
     *
     * @throws ArmadaException NOT_FOUND, or INVALID_STATE when the branch is not ACTIVE
     */
    public VirtualBranch recordChange(String branchId, FileChange change) {
        FileChange withBase = change;
        if (change.originalContent() == null && change.type() != ChangeType.CREATE) {
            withBase = new FileChange(change.path(), change.type(), snapshotFile(change.path()), change.modifiedContent());
        }
        synchronized (this) {
            BranchRecord record = requireActive(branchId);
            record.changes.put(withBase.path(), withBase);
            return record.snapshot();
        }
    }

    public VirtualBranch recordChanges(String branchId, Collection<FileChange> changes) {
        VirtualBranch snapshot = getBranch(branchId).orElseThrow(() -> ArmadaException.notFound("Branch", branchId));
        for (FileChange change : changes) {
            snapshot = recordChange(branchId, change);
        }
        return snapshot;
    }

    /**
     * Drops a path from an active branch; used when a conflict resolution moves the path
     * into the other branch.
     */
    public VirtualBranch discardChange(String branchId, String path) {
        synchronized (this) {
            BranchRecord record = requireActive(branchId);
            record.changes.remove(path);
            return record.snapshot();
        }
    }

    public VirtualBranch abandonBranch(String branchId) {
        VirtualBranch snapshot;
        synchronized (this) {
            BranchRecord record = requireActive(branchId);
            record.status = BranchStatus.ABANDONED;
            record.closedAt = clock.instant();
            snapshot = record.snapshot();
        }
        log.info("Abandoned branch {} ({} changes discarded)", branchId, snapshot.changes().size());
        events.publish(ArmadaEvent.of("branch.abandoned", null, branchId, Map.of(
                "taskId", String.valueOf(snapshot.taskId()))));
        return snapshot;
    }

    /**
     * Applies every change of the branch to the workspace and marks it MERGED.
     *
     * @throws ArmadaException MERGE_FAILED after restoring every path already written;
     *                         the branch stays ACTIVE
     */
    public synchronized VirtualBranch mergeBranch(String branchId) {
        BranchRecord record = requireActive(branchId);
        Map<String, Optional<String>> written = new LinkedHashMap<>();
        try {
            for (FileChange change : record.changes.values()) {
                Optional<String> current = files.read(change.path());
                written.put(change.path(), current);
                apply(change, current.orElse(null));
            }
        } catch (RuntimeException e) {
            restore(written);
            metrics.recordBranchMerge(false);
            log.warn("Merge of branch {} failed, restored {} file(s): {}", branchId, written.size(), e.getMessage());
            throw new ArmadaException(ErrorKind.MERGE_FAILED,
                    "Merge of branch " + branchId + " failed: " + e.getMessage(), e);
        }

        generation++;
        for (FileChange change : record.changes.values()) {
            fileSnapshots.put(change.path(), files.read(change.path()));
        }
        record.status = BranchStatus.MERGED;
        record.closedAt = clock.instant();
        VirtualBranch snapshot = record.snapshot();
        metrics.recordBranchMerge(true);
        log.info("Merged branch {} ({} file(s))", branchId, snapshot.changes().size());
        events.publish(ArmadaEvent.of("branch.merged", null, branchId, Map.of(
                "taskId", String.valueOf(snapshot.taskId()),
                "files", snapshot.changes().size())));
        return snapshot;
    }

    public synchronized Optional<VirtualBranch> getBranch(String branchId) {
        BranchRecord record = branches.get(branchId);
        return record != null ? Optional.of(record.snapshot()) : Optional.empty();
    }

    public synchronized Optional<VirtualBranch> getBranchForAgent(String agentId) {
        return branches.values().stream()
                .filter(b -> b.status == BranchStatus.ACTIVE && Objects.equals(b.agentId, agentId))
                .findFirst()
                .map(BranchRecord::snapshot);
    }

    public synchronized Optional<VirtualBranch> getBranchForTask(String taskId) {
        return branches.values().stream()
                .filter(b -> b.status == BranchStatus.ACTIVE && Objects.equals(b.taskId, taskId))
                .findFirst()
                .map(BranchRecord::snapshot);
    }

    public synchronized List<VirtualBranch> getActiveBranches() {
        List<VirtualBranch> active = new ArrayList<>();
        for (BranchRecord record : branches.values()) {
            if (record.status == BranchStatus.ACTIVE) {
                active.add(record.snapshot());
            }
        }
        return active;
    }

    /**
     * Paths changed by both branches.
     */
    public synchronized List<String> getConflictingFiles(String branchId1, String branchId2) {
        BranchRecord first = require(branchId1);
        BranchRecord second = require(branchId2);
        List<String> shared = new ArrayList<>();
        for (String path : first.changes.keySet()) {
            if (second.changes.containsKey(path)) {
                shared.add(path);
            }
        }
        return shared;
    }

    public synchronized BranchStats getStats() {
        int active = 0;
        int merged = 0;
        int abandoned = 0;
        int pending = 0;
        for (BranchRecord record : branches.values()) {
            switch (record.status) {
                case ACTIVE -> {
                    active++;
                    pending += record.changes.size();
                }
                case MERGED -> merged++;
                case ABANDONED -> abandoned++;
            }
        }
        return new BranchStats(branches.size(), active, merged, abandoned, pending);
    }

    /**
     * Base content of a path: the content when first touched by any branch, or after the
     * last merge that wrote it. Null when the file does not exist.
     */
    public synchronized String snapshotFile(String path) {
        return fileSnapshots.computeIfAbsent(path, files::read).orElse(null);
    }

    /**
     * Forgets a closed branch.
     *
     * @throws ArmadaException INVALID_STATE for an active branch
     */
    public synchronized void deleteBranch(String branchId) {
        BranchRecord record = require(branchId);
        if (record.status == BranchStatus.ACTIVE) {
            throw new ArmadaException(ErrorKind.INVALID_STATE, "Branch " + branchId + " is still active");
        }
        branches.remove(branchId);
    }

    // Must hold monitor.
    private void apply(FileChange change, String current) {
        if (change.type() == ChangeType.DELETE) {
            files.delete(change.path());
            return;
        }
        String target = change.modifiedContent() != null ? change.modifiedContent() : "";
        String base = change.originalContent();
        boolean workspaceMoved = current != null && base != null && !current.equals(base) && !current.equals(target);
        if (workspaceMoved) {
            MergeOutcome rebased = merger.merge(base, current, target);
            if (!rebased.clean()) {
                throw new IllegalStateException(change.path() + " changed in the workspace and cannot be rebased ("
                        + rebased.conflictCount() + " conflicting hunk(s))");
            }
            target = rebased.content();
        }
        files.write(change.path(), target);
    }

    private void restore(Map<String, Optional<String>> written) {
        List<String> paths = new ArrayList<>(written.keySet());
        for (int i = paths.size() - 1; i >= 0; i--) {
            String path = paths.get(i);
            Optional<String> previous = written.get(path);
            try {
                if (previous.isPresent()) {
                    files.write(path, previous.get());
                } else {
                    files.delete(path);
                }
            } catch (RuntimeException e) {
                log.error("Failed to restore {} after merge failure: {}", path, e.getMessage(), e);
            }
        }
    }

    private BranchRecord require(String branchId) {
        BranchRecord record = branches.get(branchId);
        if (record == null) {
            throw ArmadaException.notFound("Branch", branchId);
        }
        return record;
    }

    private BranchRecord requireActive(String branchId) {
        BranchRecord record = require(branchId);
        if (record.status != BranchStatus.ACTIVE) {
            throw new ArmadaException(ErrorKind.INVALID_STATE, "Branch " + branchId + " is " + record.status);
        }
        return record;
    }

    private static final class BranchRecord {
        final String id;
        final String agentId;
        final String taskId;
        final String baseRef;
        final Instant createdAt;
        final Map<String, FileChange> changes = new LinkedHashMap<>();
        BranchStatus status = BranchStatus.ACTIVE;
        Instant closedAt;

        BranchRecord(String id, String agentId, String taskId, String baseRef, Instant createdAt) {
            this.id = id;
            this.agentId = agentId;
            this.taskId = taskId;
            this.baseRef = baseRef;
            this.createdAt = createdAt;
        }

        VirtualBranch snapshot() {
            return new VirtualBranch(id, agentId, taskId, baseRef, List.copyOf(changes.values()),
                    status, createdAt, closedAt);
        }
    }
}
