package com.armada.core.workspace;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link WorkspaceFiles}, used for dry runs and tests.
 */
public class InMemoryWorkspaceFiles implements WorkspaceFiles {

    private final Map<String, String> files = new ConcurrentHashMap<>();

    public InMemoryWorkspaceFiles() {
    }

    public InMemoryWorkspaceFiles(Map<String, String> initial) {
        files.putAll(initial);
    }

    @Override
    public boolean exists(String path) {
        return files.containsKey(path);
    }

    @Override
    public Optional<String> read(String path) {
        return Optional.ofNullable(files.get(path));
    }

    @Override
    public void write(String path, String content) {
        files.put(path, content);
    }

    @Override
    public void delete(String path) {
        files.remove(path);
    }

    /**
     * Sorted copy of every file.
     */
    public Map<String, String> snapshot() {
        return new TreeMap<>(files);
    }
}
