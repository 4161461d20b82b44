package com.armada.core.merge;

import com.armada.core.model.FileChange;

import java.time.Instant;
import java.util.List;

/**
 * Two active branches changing overlapping regions of the same file. Derived from the
 * branches on detection; the branches remain the source of truth.
 *
 * @param id          stable for the unordered branch pair and path
 * @param baseContent content both changes were made against ("" for new files)
 * @param branch1Id   lower of the two branch ids
 * @param branch2Id   higher of the two branch ids
 * @param ours        branch1's change to the path
 * @param theirs      branch2's change to the path
 * @param regions     regions changed on both sides, by start line
 */
public record MergeConflict(
    String id,
    String path,
    String baseContent,
    String branch1Id,
    String branch2Id,
    FileChange ours,
    FileChange theirs,
    List<CodeRegion> regions,
    Instant detectedAt
) {

    public boolean involves(String branchId) {
        return branch1Id.equals(branchId) || branch2Id.equals(branchId);
    }
}
