package com.armada.core.merge;

/**
 * Outcome of resolving one conflict.
 *
 * @param resolvedContent merged file content; null for MANUAL until content is chosen
 * @param oursContent     branch1's version, unmodified
 * @param theirsContent   branch2's version, unmodified
 * @param markedContent   both versions between conflict markers, for manual editing
 */
public record MergeResolution(
    String conflictId,
    String path,
    MergeStrategy strategy,
    String resolvedContent,
    String oursContent,
    String theirsContent,
    String markedContent
) {

    public boolean isResolved() {
        return resolvedContent != null;
    }

    /**
     * Content picked or edited by whoever handles a MANUAL resolution.
     */
    public MergeResolution withChosenContent(String content) {
        return new MergeResolution(conflictId, path, strategy, content, oursContent, theirsContent, markedContent);
    }
}
