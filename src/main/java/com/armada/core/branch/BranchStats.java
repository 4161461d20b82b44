package com.armada.core.branch;

/**
 * @param pendingChanges file changes held by active branches
 */
public record BranchStats(int total, int active, int merged, int abandoned, int pendingChanges) {
}
