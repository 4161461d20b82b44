package com.armada.core.merge;

/**
 * Result of a line-level three-way merge.
 *
 * @param clean         true when no hunk conflicted
 * @param content       merged text; conflicting hunks carry ours/theirs markers
 * @param conflictCount number of conflicting hunks
 */
public record MergeOutcome(boolean clean, String content, int conflictCount) {
}
