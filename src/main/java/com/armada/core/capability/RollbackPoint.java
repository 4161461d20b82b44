package com.armada.core.capability;

import java.time.Instant;
import java.util.List;

/**
 * A restorable set of file snapshots taken for a mission.
 */
public record RollbackPoint(
    String id,
    String missionId,
    Instant createdAt,
    List<FileSnapshot> files
) {

    public RollbackPoint {
        files = List.copyOf(files);
    }

    public List<String> paths() {
        return files.stream().map(FileSnapshot::path).toList();
    }
}
