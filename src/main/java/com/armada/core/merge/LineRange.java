package com.armada.core.merge;

/**
 * Half-open range of base lines {@code [start, end)} replaced by a change. An insertion
 * has {@code start == end}.
 */
public record LineRange(int start, int end) {

    /**
     * Ranges overlap when they share a line, or when an insertion sits inside or at the
     * edge of the other range.
     */
    public boolean overlaps(LineRange other) {
        if (start == end || other.start == other.end) {
            return start <= other.end && other.start <= end;
        }
        return start < other.end && other.start < end;
    }
}
