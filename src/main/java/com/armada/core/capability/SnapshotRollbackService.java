package com.armada.core.capability;

import com.armada.core.error.ArmadaException;
import com.armada.core.workspace.WorkspaceFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link RollbackCapability} that keeps file snapshots in memory. At most
 * {@value #MAX_POINTS_PER_MISSION} points are retained per mission; the oldest are dropped first.
 */
public class SnapshotRollbackService implements RollbackCapability {

    private static final Logger log = LoggerFactory.getLogger(SnapshotRollbackService.class);

    static final int MAX_POINTS_PER_MISSION = 50;

    private final WorkspaceFiles files;
    private final Clock clock;
    /** Oldest first per mission. */
    private final Map<String, Deque<RollbackPoint>> pointsByMission = new HashMap<>();
    private final Map<String, RollbackPoint> pointsById = new HashMap<>();

    public SnapshotRollbackService(WorkspaceFiles files) {
        this(files, Clock.systemUTC());
    }

    public SnapshotRollbackService(WorkspaceFiles files, Clock clock) {
        this.files = files;
        this.clock = clock;
    }

    @Override
    public RollbackPoint backup(Collection<String> paths, String missionId) {
        List<FileSnapshot> snapshots = new ArrayList<>();
        for (String path : new LinkedHashSet<>(paths)) {
            String content = files.read(path).orElse(null);
            snapshots.add(new FileSnapshot(path, content != null, content));
        }
        RollbackPoint point = new RollbackPoint("rp-" + UUID.randomUUID(), missionId, clock.instant(), snapshots);
        synchronized (this) {
            Deque<RollbackPoint> points = pointsByMission.computeIfAbsent(missionId, m -> new ArrayDeque<>());
            points.addLast(point);
            pointsById.put(point.id(), point);
            while (points.size() > MAX_POINTS_PER_MISSION) {
                pointsById.remove(points.removeFirst().id());
            }
        }
        log.info("Created rollback point {} for mission {} ({} files)", point.id(), missionId, snapshots.size());
        return point;
    }

    @Override
    public List<String> rollback(String pointId) {
        RollbackPoint point;
        synchronized (this) {
            point = pointsById.get(pointId);
        }
        if (point == null) {
            throw ArmadaException.notFound("Rollback point", pointId);
        }
        List<String> restored = new ArrayList<>();
        for (FileSnapshot snapshot : point.files()) {
            if (snapshot.existed()) {
                files.write(snapshot.path(), snapshot.content());
            } else {
                files.delete(snapshot.path());
            }
            restored.add(snapshot.path());
        }
        log.info("Rolled back {} files to point {}", restored.size(), pointId);
        return restored;
    }

    @Override
    public synchronized List<RollbackPoint> getHistory(String missionId) {
        Deque<RollbackPoint> points = pointsByMission.get(missionId);
        if (points == null) {
            return List.of();
        }
        List<RollbackPoint> newestFirst = new ArrayList<>(points.size());
        Iterator<RollbackPoint> it = points.descendingIterator();
        while (it.hasNext()) {
            newestFirst.add(it.next());
        }
        return newestFirst;
    }
}
