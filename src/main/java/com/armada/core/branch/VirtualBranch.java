package com.armada.core.branch;

import com.armada.core.model.FileChange;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of an isolated per-task change set.
 *
 * @param id       branch identifier (e.g. "branch-8c1d...")
 * @param agentId  agent that produced the changes
 * @param taskId   task the branch was created for
 * @param baseRef  workspace generation the branch was cut from
 * @param changes  one change per path, in first-recorded order
 * @param status   ACTIVE until merged or abandoned
 * @param closedAt when the branch was merged or abandoned (nullable)
 */
public record VirtualBranch(
    String id,
    String agentId,
    String taskId,
    String baseRef,
    List<FileChange> changes,
    BranchStatus status,
    Instant createdAt,
    Instant closedAt
) {

    public Optional<FileChange> changeFor(String path) {
        return changes.stream().filter(c -> c.path().equals(path)).findFirst();
    }

    public boolean touches(String path) {
        return changeFor(path).isPresent();
    }
}
