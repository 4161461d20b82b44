package com.armada.core.workspace;

import java.util.Optional;

/**
 * Minimal file access used by merges, rollback snapshots and preflight checks.
 * Paths are workspace-relative with forward slashes.
 */
public interface WorkspaceFiles {

    boolean exists(String path);

    /**
     * @return file content, or empty when the file does not exist
     */
    Optional<String> read(String path);

    /**
     * Creates or replaces the file, including missing parent directories.
     */
    void write(String path, String content);

    /**
     * Deletes the file if present.
     */
    void delete(String path);
}
