package com.armada.core.merge;

/**
 * A declared region of a file. Lines are 1-based and inclusive.
 */
public record CodeRegion(String path, RegionType type, String name, int startLine, int endLine) {

    /**
     * Same path and intersecting line ranges.
     */
    public boolean overlaps(CodeRegion other) {
        if (!path.equals(other.path)) {
            return false;
        }
        return !(endLine < other.startLine || other.endLine < startLine);
    }

    /**
     * Identity of the region across versions of the same file.
     */
    public String key() {
        return type + ":" + name;
    }

    public String describe() {
        return type.name().toLowerCase() + " " + name + " (lines " + startLine + "-" + endLine + ")";
    }
}
