package com.armada.core.engine;

import com.armada.core.error.ArmadaException;
import com.armada.core.error.ErrorKind;
import com.armada.core.model.FileChange;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What a run executes for an existing, PENDING mission.
 *
 * @param tasks   tasks in plan order
 * @param changes changes known up front; checked by preflight and impact analysis
 * @param paths   further workspace paths to back up before execution
 */
public record ExecutionPlan(
    String missionId,
    List<PlannedTask> tasks,
    List<FileChange> changes,
    List<String> paths
) {

    public ExecutionPlan {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        changes = changes != null ? List.copyOf(changes) : List.of();
        paths = paths != null ? List.copyOf(paths) : List.of();
    }

    public static ExecutionPlan of(String missionId, List<PlannedTask> tasks) {
        return new ExecutionPlan(missionId, tasks, List.of(), List.of());
    }

    public ExecutionPlan withMissionId(String id) {
        return new ExecutionPlan(id, tasks, changes, paths);
    }

    /**
     * Every path the plan names: up-front changes, extra paths and task context files.
     */
    public Set<String> affectedPaths() {
        Set<String> all = new LinkedHashSet<>();
        changes.forEach(c -> all.add(c.path()));
        all.addAll(paths);
        tasks.forEach(t -> all.addAll(t.contextFiles()));
        return all;
    }

    /**
     * Tasks ordered so that each comes after everything it depends on; plan order is kept
     * where dependencies allow.
     *
     * @throws ArmadaException VALIDATION_FAILED on duplicate keys, unknown dependencies or cycles
     */
    public List<PlannedTask> dependencyOrder() {
        Map<String, PlannedTask> byKey = new LinkedHashMap<>();
        for (PlannedTask task : tasks) {
            if (byKey.putIfAbsent(task.key(), task) != null) {
                throw new ArmadaException(ErrorKind.VALIDATION_FAILED, "Duplicate task key: " + task.key());
            }
        }
        for (PlannedTask task : tasks) {
            for (String dependency : task.dependsOn()) {
                if (!byKey.containsKey(dependency)) {
                    throw new ArmadaException(ErrorKind.VALIDATION_FAILED,
                            "Task " + task.key() + " depends on unknown task " + dependency);
                }
            }
        }

        List<PlannedTask> ordered = new ArrayList<>();
        Set<String> done = new HashSet<>();
        while (ordered.size() < tasks.size()) {
            PlannedTask next = null;
            for (PlannedTask task : tasks) {
                if (!done.contains(task.key()) && done.containsAll(task.dependsOn())) {
                    next = task;
                    break;
                }
            }
            if (next == null) {
                List<String> stuck = tasks.stream().map(PlannedTask::key).filter(k -> !done.contains(k)).toList();
                throw new ArmadaException(ErrorKind.VALIDATION_FAILED, "Dependency cycle among tasks " + stuck);
            }
            done.add(next.key());
            ordered.add(next);
        }
        return ordered;
    }
}
