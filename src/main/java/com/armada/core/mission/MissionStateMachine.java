package com.armada.core.mission;

import com.armada.core.capability.RollbackCapability;
import com.armada.core.capability.RollbackPoint;
import com.armada.core.error.ArmadaException;
import com.armada.core.error.ErrorKind;
import com.armada.core.events.ArmadaEvent;
import com.armada.core.events.EventPublisher;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.model.Mission;
import com.armada.core.model.MissionConfig;
import com.armada.core.model.MissionPhase;
import com.armada.core.model.MissionProgress;
import com.armada.core.model.MissionStatus;
import com.armada.core.model.Task;
import com.armada.core.model.TaskSpec;
import com.armada.core.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns mission records and enforces the {@link PhaseGraph}.
 * <p>
 * Status and phase are independent: status follows the lifecycle
 * (PENDING, ACTIVE, PAUSED, then COMPLETED, FAILED or CANCELLED) while the phase moves along
 * the graph. Task progress is tracked through the {@link TaskScheduler}.
 */
public class MissionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(MissionStateMachine.class);

    private final TaskScheduler scheduler;
    private final RollbackCapability rollback;
    private final EventPublisher events;
    private final ArmadaMetrics metrics;
    private final Clock clock;

    private final Map<String, MissionRecord> missions = new LinkedHashMap<>();

    public MissionStateMachine(TaskScheduler scheduler, RollbackCapability rollback,
                               EventPublisher events, ArmadaMetrics metrics) {
        this(scheduler, rollback, events, metrics, Clock.systemUTC());
    }

    public MissionStateMachine(TaskScheduler scheduler, RollbackCapability rollback,
                               EventPublisher events, ArmadaMetrics metrics, Clock clock) {
        this.scheduler = scheduler;
        this.rollback = rollback;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Mission create(MissionConfig config) {
        Mission snapshot;
        synchronized (this) {
            MissionRecord record = new MissionRecord("mission-" + UUID.randomUUID(), config, clock.instant());
            missions.put(record.id, record);
            snapshot = record.snapshot();
        }
        log.info("Created mission {}: {}", snapshot.id(), config.title());
        publish("mission.created", snapshot, Map.of("title", String.valueOf(config.title())));
        return snapshot;
    }

    /**
     * @throws ArmadaException INVALID_STATE unless the mission is PENDING
     */
    public Mission start(String missionId) {
        Mission snapshot;
        synchronized (this) {
            MissionRecord record = require(missionId);
            requireStatus(record, MissionStatus.PENDING, "started");
            Instant now = clock.instant();
            record.status = MissionStatus.ACTIVE;
            record.startedAt = now;
            record.phaseEnteredAt = now;
            record.updatedAt = now;
            snapshot = record.snapshot();
        }
        log.info("Mission {} started", missionId);
        publish("mission.started", snapshot, Map.of());
        return snapshot;
    }

    public Mission pause(String missionId) {
        Mission snapshot;
        synchronized (this) {
            MissionRecord record = require(missionId);
            requireStatus(record, MissionStatus.ACTIVE, "paused");
            record.status = MissionStatus.PAUSED;
            record.updatedAt = clock.instant();
            snapshot = record.snapshot();
        }
        log.info("Mission {} paused", missionId);
        publish("mission.paused", snapshot, Map.of());
        return snapshot;
    }

    public Mission resume(String missionId) {
        Mission snapshot;
        synchronized (this) {
            MissionRecord record = require(missionId);
            requireStatus(record, MissionStatus.PAUSED, "resumed");
            record.status = MissionStatus.ACTIVE;
            record.updatedAt = clock.instant();
            snapshot = record.snapshot();
        }
        log.info("Mission {} resumed", missionId);
        publish("mission.resumed", snapshot, Map.of());
        return snapshot;
    }

    /**
     * Moves to the next phase in canonical order.
     *
     * @throws ArmadaException INVALID_TRANSITION at COMPLETION or when the edge is not allowed
     */
    public Mission advancePhase(String missionId) {
        MissionPhase current;
        synchronized (this) {
            current = require(missionId).phase;
        }
        MissionPhase next = PhaseGraph.next(current).orElseThrow(() -> new ArmadaException(
                ErrorKind.INVALID_TRANSITION, "Mission " + missionId + " is already at its final phase"));
        return changePhase(missionId, current, next);
    }

    /**
     * Moves along an explicit edge of the phase graph, including the backward recovery edges.
     *
     * @throws ArmadaException INVALID_TRANSITION when the edge is not in the graph
     */
    public Mission transitionTo(String missionId, MissionPhase target) {
        MissionPhase current;
        synchronized (this) {
            current = require(missionId).phase;
        }
        return changePhase(missionId, current, target);
    }

    private Mission changePhase(String missionId, MissionPhase expected, MissionPhase target) {
        Mission snapshot;
        long phaseMs;
        synchronized (this) {
            MissionRecord record = require(missionId);
            if (record.status.isTerminal() || record.status == MissionStatus.FAILED) {
                throw new ArmadaException(ErrorKind.INVALID_STATE,
                        "Mission " + missionId + " is " + record.status + "; phase cannot change");
            }
            if (record.phase != expected || !PhaseGraph.isAllowed(record.phase, target)) {
                throw new ArmadaException(ErrorKind.INVALID_TRANSITION,
                        "Invalid phase transition: " + record.phase + " -> " + target);
            }
            Instant now = clock.instant();
            phaseMs = record.phaseEnteredAt != null ? Duration.between(record.phaseEnteredAt, now).toMillis() : 0;
            record.phase = target;
            record.phaseEnteredAt = now;
            record.phaseProgress = 0;
            record.overallProgress = PhaseGraph.overallProgressAt(target);
            record.updatedAt = now;
            snapshot = record.snapshot();
        }
        metrics.recordPhaseDuration(expected.name().toLowerCase(), phaseMs);
        log.info("Mission {} phase {} -> {}", missionId, expected, target);
        publish("mission.phase_changed", snapshot, Map.of(
                "from", expected.name(),
                "to", target.name()));
        return snapshot;
    }

    /**
     * @throws ArmadaException INVALID_STATE unless the mission is ACTIVE
     */
    public Mission complete(String missionId) {
        Mission snapshot;
        synchronized (this) {
            MissionRecord record = require(missionId);
            requireStatus(record, MissionStatus.ACTIVE, "completed");
            Instant now = clock.instant();
            record.status = MissionStatus.COMPLETED;
            record.phase = MissionPhase.COMPLETION;
            record.phaseProgress = 100;
            record.overallProgress = 100;
            record.completedAt = now;
            record.updatedAt = now;
            snapshot = record.snapshot();
        }
        metrics.recordMissionResult("completed");
        log.info("Mission {} completed", missionId);
        publish("mission.completed", snapshot, Map.of());
        return snapshot;
    }

    /**
     * @throws ArmadaException INVALID_STATE when the mission already finished or failed
     */
    public Mission fail(String missionId, String reason) {
        Mission snapshot;
        synchronized (this) {
            MissionRecord record = require(missionId);
            if (record.status.isTerminal() || record.status == MissionStatus.FAILED) {
                throw new ArmadaException(ErrorKind.INVALID_STATE,
                        "Mission " + missionId + " already finished: " + record.status);
            }
            Instant now = clock.instant();
            record.status = MissionStatus.FAILED;
            record.reason = reason;
            record.completedAt = now;
            record.updatedAt = now;
            snapshot = record.snapshot();
        }
        metrics.recordMissionResult("failed");
        log.error("Mission {} failed: {}", missionId, reason);
        publish("mission.failed", snapshot, Map.of("error", String.valueOf(reason)));
        return snapshot;
    }

    /**
     * Cancels every unfinished task of the mission, then the mission itself.
     *
     * @throws ArmadaException INVALID_STATE when the mission is COMPLETED or CANCELLED
     */
    public Mission cancel(String missionId, String reason) {
        synchronized (this) {
            MissionRecord record = require(missionId);
            if (record.status.isTerminal()) {
                throw new ArmadaException(ErrorKind.INVALID_STATE,
                        "Mission " + missionId + " already finished: " + record.status);
            }
        }
        int cancelledTasks = 0;
        for (Task task : scheduler.getByMission(missionId)) {
            if (task.status().isTerminal()) {
                continue;
            }
            try {
                scheduler.cancel(task.id(), "Mission cancelled");
                cancelledTasks++;
            } catch (ArmadaException e) {
                // finished between the listing and the cancel
                log.debug("Task {} not cancelled: {}", task.id(), e.getMessage());
            }
        }

        Mission snapshot;
        synchronized (this) {
            MissionRecord record = require(missionId);
            if (record.status.isTerminal()) {
                throw new ArmadaException(ErrorKind.INVALID_STATE,
                        "Mission " + missionId + " already finished: " + record.status);
            }
            Instant now = clock.instant();
            record.status = MissionStatus.CANCELLED;
            record.reason = reason;
            record.completedAt = now;
            record.updatedAt = now;
            snapshot = record.snapshot();
        }
        metrics.recordMissionResult("cancelled");
        log.info("Mission {} cancelled ({} tasks cancelled): {}", missionId, cancelledTasks, reason);
        publish("mission.cancelled", snapshot, Map.of(
                "reason", String.valueOf(reason),
                "cancelledTasks", cancelledTasks));
        return snapshot;
    }

    /**
     * Restores the most recent rollback point and sends the mission back to PLANNING.
     *
     * @return restored paths
     * @throws ArmadaException NO_ROLLBACK_POINT when the mission has none
     */
    public List<String> rollback(String missionId) {
        synchronized (this) {
            require(missionId);
        }
        List<RollbackPoint> history = rollback.getHistory(missionId);
        if (history.isEmpty()) {
            throw new ArmadaException(ErrorKind.NO_ROLLBACK_POINT,
                    "No rollback points available for mission " + missionId);
        }
        RollbackPoint latest = history.get(0);
        List<String> restored = rollback.rollback(latest.id());

        Mission snapshot;
        synchronized (this) {
            MissionRecord record = require(missionId);
            Instant now = clock.instant();
            record.phase = MissionPhase.PLANNING;
            record.phaseEnteredAt = now;
            record.phaseProgress = 0;
            record.overallProgress = PhaseGraph.overallProgressAt(MissionPhase.PLANNING);
            record.updatedAt = now;
            snapshot = record.snapshot();
        }
        log.warn("Mission {} rolled back to point {} ({} files)", missionId, latest.id(), restored.size());
        publish("mission.rolled_back", snapshot, Map.of(
                "pointId", latest.id(),
                "restoredFiles", restored.size()));
        return restored;
    }

    /**
     * Creates a task for the mission through the scheduler and counts it in the progress.
     */
    public Task addTask(String missionId, TaskSpec spec) {
        synchronized (this) {
            require(missionId);
        }
        Task task = scheduler.create(missionId, spec);
        synchronized (this) {
            MissionRecord record = require(missionId);
            record.tasksTotal++;
            record.updatedAt = clock.instant();
        }
        return task;
    }

    /**
     * Counts a completed task, recomputing phase progress and the linear completion estimate.
     */
    public MissionProgress taskCompleted(String missionId, String taskId) {
        MissionProgress progress;
        Mission snapshot;
        synchronized (this) {
            MissionRecord record = require(missionId);
            record.tasksCompleted++;
            if (record.tasksTotal > 0) {
                record.phaseProgress = Math.min(100.0, record.tasksCompleted * 100.0 / record.tasksTotal);
            }
            Instant now = clock.instant();
            if (record.startedAt != null) {
                long elapsedMs = Math.max(1, Duration.between(record.startedAt, now).toMillis());
                int remaining = Math.max(0, record.tasksTotal - record.tasksCompleted);
                double msPerTask = (double) elapsedMs / record.tasksCompleted;
                record.estimatedCompletion = now.plusMillis((long) (remaining * msPerTask));
            }
            record.updatedAt = now;
            snapshot = record.snapshot();
            progress = snapshot.progress();
        }
        log.debug("Mission {} task {} completed ({}/{})", missionId, taskId,
                progress.tasksCompleted(), progress.tasksTotal());
        publish("mission.progress", snapshot, progressPayload(progress));
        return progress;
    }

    /**
     * Sets the phase progress, clamped to 0-100.
     */
    public MissionProgress updateProgress(String missionId, double phaseProgress) {
        Mission snapshot;
        synchronized (this) {
            MissionRecord record = require(missionId);
            record.phaseProgress = Math.max(0, Math.min(100, phaseProgress));
            record.updatedAt = clock.instant();
            snapshot = record.snapshot();
        }
        publish("mission.progress", snapshot, progressPayload(snapshot.progress()));
        return snapshot.progress();
    }

    public synchronized Optional<Mission> get(String missionId) {
        MissionRecord record = missions.get(missionId);
        return record != null ? Optional.of(record.snapshot()) : Optional.empty();
    }

    public synchronized MissionProgress getProgress(String missionId) {
        return require(missionId).snapshot().progress();
    }

    public synchronized List<Mission> getActive() {
        List<Mission> active = new ArrayList<>();
        for (MissionRecord record : missions.values()) {
            if (record.status == MissionStatus.ACTIVE) {
                active.add(record.snapshot());
            }
        }
        return active;
    }

    public synchronized MissionStats getStats() {
        Map<MissionStatus, Integer> counts = new HashMap<>();
        for (MissionRecord record : missions.values()) {
            counts.merge(record.status, 1, Integer::sum);
        }
        return new MissionStats(missions.size(),
                counts.getOrDefault(MissionStatus.PENDING, 0),
                counts.getOrDefault(MissionStatus.ACTIVE, 0),
                counts.getOrDefault(MissionStatus.PAUSED, 0),
                counts.getOrDefault(MissionStatus.COMPLETED, 0),
                counts.getOrDefault(MissionStatus.FAILED, 0),
                counts.getOrDefault(MissionStatus.CANCELLED, 0));
    }

    /**
     * Drops COMPLETED and CANCELLED missions along with their finished tasks.
     *
     * @return number of missions removed
     */
    public int clearCompleted() {
        List<String> removed = new ArrayList<>();
        synchronized (this) {
            Iterator<MissionRecord> it = missions.values().iterator();
            while (it.hasNext()) {
                MissionRecord record = it.next();
                if (record.status.isTerminal()) {
                    it.remove();
                    removed.add(record.id);
                }
            }
        }
        removed.forEach(scheduler::clearCompleted);
        log.info("Cleared {} finished missions", removed.size());
        return removed.size();
    }

    private MissionRecord require(String missionId) {
        MissionRecord record = missions.get(missionId);
        if (record == null) {
            throw ArmadaException.notFound("Mission", missionId);
        }
        return record;
    }

    private static void requireStatus(MissionRecord record, MissionStatus expected, String action) {
        if (record.status != expected) {
            throw new ArmadaException(ErrorKind.INVALID_STATE,
                    "Mission " + record.id + " cannot be " + action + " from status " + record.status);
        }
    }

    private static Map<String, Object> progressPayload(MissionProgress progress) {
        return Map.of(
                "tasksTotal", progress.tasksTotal(),
                "tasksCompleted", progress.tasksCompleted(),
                "phaseProgress", progress.phaseProgress(),
                "overallProgress", progress.overallProgress());
    }

    private void publish(String type, Mission mission, Map<String, Object> payload) {
        events.publish(ArmadaEvent.of(type, mission.id(), mission.id(), payload));
    }

    private static final class MissionRecord {
        final String id;
        final MissionConfig config;
        final Instant createdAt;

        MissionStatus status = MissionStatus.PENDING;
        MissionPhase phase = MissionPhase.PLANNING;
        int tasksTotal;
        int tasksCompleted;
        double phaseProgress;
        double overallProgress;
        Instant startedAt;
        Instant phaseEnteredAt;
        Instant estimatedCompletion;
        Instant updatedAt;
        Instant completedAt;
        String reason;

        MissionRecord(String id, MissionConfig config, Instant createdAt) {
            this.id = id;
            this.config = config;
            this.createdAt = createdAt;
            this.updatedAt = createdAt;
        }

        Mission snapshot() {
            return new Mission(id, config.title(), config.description(), config.priority(), status, phase,
                    new MissionProgress(tasksTotal, tasksCompleted, phaseProgress, overallProgress,
                            startedAt, estimatedCompletion),
                    reason, createdAt, updatedAt, completedAt);
        }
    }
}
