package com.armada.core.scheduler;

import com.armada.core.concurrent.CancellationToken;
import com.armada.core.concurrent.RetryPolicy;
import com.armada.core.error.ArmadaException;
import com.armada.core.error.ErrorKind;
import com.armada.core.events.ArmadaEvent;
import com.armada.core.events.EventPublisher;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.model.DependencyType;
import com.armada.core.model.Task;
import com.armada.core.model.TaskDependency;
import com.armada.core.model.TaskResult;
import com.armada.core.model.TaskSpec;
import com.armada.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns task records, the priority queue and the dependency graph.
 * <p>
 * Tasks are ordered by priority tier, then creation order. A task only enters RUNNING when
 * every REQUIRED dependency is COMPLETED and no SOFT dependency is RUNNING; a dependency on
 * a task the scheduler does not know is treated as unmet. Tasks that fail the dependency
 * check are parked as BLOCKED and re-evaluated after every completion.
 * <p>
 * Every start arms an independent timer that force-fails the task if it is still running
 * when the timer fires.
 */
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    public static final int DEFAULT_MAX_CONCURRENT = 10;
    public static final Duration DEFAULT_TASK_TIMEOUT = Duration.ofMinutes(5);
    static final String TIMEOUT_ERROR = "Task timed out";

    private static final Comparator<TaskRecord> QUEUE_ORDER = Comparator
            .comparingInt((TaskRecord r) -> r.spec.priority().rank())
            .thenComparing(r -> r.createdAt)
            .thenComparingLong(r -> r.sequence);

    private final EventPublisher events;
    private final ArmadaMetrics metrics;
    private final int maxConcurrent;
    private final Duration taskTimeout;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final ScheduledExecutorService timers;
    private final boolean ownsTimers;

    private final Object lock = new Object();
    /** Insertion order doubles as creation order for blocked-task re-evaluation. */
    private final Map<String, TaskRecord> tasks = new LinkedHashMap<>();
    private final TreeSet<TaskRecord> queue = new TreeSet<>(QUEUE_ORDER);
    private long nextSequence;
    private int running;

    public TaskScheduler(EventPublisher events, ArmadaMetrics metrics) {
        this(events, metrics, DEFAULT_MAX_CONCURRENT, DEFAULT_TASK_TIMEOUT, Clock.systemUTC(), null);
    }

    public TaskScheduler(EventPublisher events, ArmadaMetrics metrics, int maxConcurrent,
                         Duration taskTimeout, Clock clock, ScheduledExecutorService timers) {
        this(events, metrics, maxConcurrent, taskTimeout, RetryPolicy.DEFAULT, clock, timers);
    }

    /**
     * @param retryPolicy bounds {@link #retry}; the execution coordinator shares the same instance
     * @param timers      executor for per-task timeout timers; when null the scheduler creates
     *                    and owns a single daemon thread
     */
    public TaskScheduler(EventPublisher events, ArmadaMetrics metrics, int maxConcurrent,
                         Duration taskTimeout, RetryPolicy retryPolicy, Clock clock,
                         ScheduledExecutorService timers) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1");
        }
        this.events = events;
        this.metrics = metrics;
        this.maxConcurrent = maxConcurrent;
        this.taskTimeout = taskTimeout;
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.DEFAULT;
        this.clock = clock;
        this.ownsTimers = timers == null;
        this.timers = timers != null ? timers : Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "armada-task-timers");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Creates a PENDING task for the given mission.
     */
    public Task create(String missionId, TaskSpec spec) {
        return create(missionId, spec, 0, null);
    }

    private Task create(String missionId, TaskSpec spec, int retryAttempt, String retriedFrom) {
        if (spec == null || spec.type() == null) {
            throw new ArmadaException(ErrorKind.VALIDATION_FAILED, "Task spec requires a type");
        }
        Task snapshot;
        synchronized (lock) {
            TaskRecord record = new TaskRecord("task-" + UUID.randomUUID(), missionId, spec,
                    retryAttempt, retriedFrom, clock.instant(), nextSequence++);
            tasks.put(record.id, record);
            queue.add(record);
            snapshot = record.snapshot();
        }
        log.info("Created task {} [{}:{}] for mission {}", snapshot.id(), spec.type(), spec.priority(), missionId);
        publish("task.created", snapshot, Map.of(
                "type", spec.type().name(),
                "priority", spec.priority().name(),
                "retryAttempt", retryAttempt));
        return snapshot;
    }

    /**
     * Moves a task to RUNNING and arms its timeout timer.
     *
     * @throws ArmadaException NOT_FOUND, INVALID_STATE, DEPENDENCIES_UNMET (task becomes
     *                         BLOCKED) or CAPACITY_EXCEEDED
     */
    public Task start(String taskId) {
        Task snapshot;
        synchronized (lock) {
            TaskRecord record = require(taskId);
            if (record.status != TaskStatus.PENDING && record.status != TaskStatus.BLOCKED) {
                throw new ArmadaException(ErrorKind.INVALID_STATE,
                        "Task " + taskId + " cannot start from status " + record.status);
            }
            if (!dependenciesMet(record)) {
                record.status = TaskStatus.BLOCKED;
                log.debug("Task {} blocked on dependencies {}", taskId, record.spec.dependencies());
                throw new ArmadaException(ErrorKind.DEPENDENCIES_UNMET,
                        "Task " + taskId + " has unmet dependencies");
            }
            if (running >= maxConcurrent) {
                throw new ArmadaException(ErrorKind.CAPACITY_EXCEEDED,
                        "Concurrent task limit reached (" + maxConcurrent + ")");
            }
            record.status = TaskStatus.RUNNING;
            record.startedAt = clock.instant();
            queue.remove(record);
            running++;
            record.timer = timers.schedule(() -> onTimeout(taskId),
                    taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
            snapshot = record.snapshot();
        }
        log.info("Started task {} ({} running)", taskId, runningCount());
        publish("task.started", snapshot, Map.of());
        return snapshot;
    }

    /**
     * Stores the result, moves the task to COMPLETED or FAILED and unblocks dependants.
     *
     * @throws ArmadaException NOT_FOUND, or INVALID_STATE when the task is not RUNNING
     */
    public Task complete(String taskId, TaskResult result) {
        Task snapshot;
        List<Task> unblocked;
        synchronized (lock) {
            TaskRecord record = require(taskId);
            if (record.status != TaskStatus.RUNNING) {
                throw new ArmadaException(ErrorKind.INVALID_STATE,
                        "Task " + taskId + " is not running (status " + record.status + ")");
            }
            finish(record, result);
            snapshot = record.snapshot();
            unblocked = reevaluateBlocked();
        }
        metrics.recordTaskCompletion(snapshot.type().name(), result.success(), result.durationMs());
        if (result.success()) {
            log.info("Task {} completed in {}ms", taskId, result.durationMs());
            publish("task.completed", snapshot, Map.of("durationMs", result.durationMs()));
        } else {
            log.warn("Task {} failed: {}", taskId, result.error());
            publish("task.failed", snapshot, Map.of(
                    "error", String.valueOf(result.error()),
                    "durationMs", result.durationMs()));
        }
        publishUnblocked(unblocked);
        return snapshot;
    }

    /**
     * Cancels a non-terminal task and signals its cancellation token.
     *
     * @throws ArmadaException NOT_FOUND, or INVALID_STATE for completed, failed or
     *                         already cancelled tasks
     */
    public Task cancel(String taskId, String reason) {
        Task snapshot;
        CancellationToken token;
        List<Task> unblocked;
        synchronized (lock) {
            TaskRecord record = require(taskId);
            if (record.status.isTerminal()) {
                throw new ArmadaException(ErrorKind.INVALID_STATE,
                        "Task " + taskId + " is already " + record.status);
            }
            if (record.status == TaskStatus.RUNNING) {
                running--;
            }
            cancelTimer(record);
            queue.remove(record);
            record.status = TaskStatus.CANCELLED;
            record.cancelReason = reason;
            record.completedAt = clock.instant();
            token = record.token;
            snapshot = record.snapshot();
            // a cancelled SOFT dependency may free a waiting task
            unblocked = reevaluateBlocked();
        }
        token.cancel(reason);
        log.info("Cancelled task {}: {}", taskId, reason);
        publish("task.cancelled", snapshot, Map.of("reason", String.valueOf(reason)));
        publishUnblocked(unblocked);
        return snapshot;
    }

    /**
     * Highest-priority PENDING task whose dependencies are met, oldest first within a tier.
     */
    public Optional<Task> getNext() {
        synchronized (lock) {
            for (TaskRecord record : queue) {
                if (record.status == TaskStatus.PENDING && dependenciesMet(record)) {
                    return Optional.of(record.snapshot());
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Creates a new task from a FAILED task's spec with the retry counter advanced.
     *
     * @throws ArmadaException NOT_FOUND, or INVALID_STATE when the task has not failed or
     *                         its attempts under the retry policy are used up
     */
    public Task retry(String taskId) {
        TaskRecord failed;
        synchronized (lock) {
            failed = require(taskId);
            if (failed.status != TaskStatus.FAILED) {
                throw new ArmadaException(ErrorKind.INVALID_STATE,
                        "Only failed tasks can be retried; " + taskId + " is " + failed.status);
            }
            if (!retryPolicy.hasAttemptsLeft(failed.retryAttempt + 1)) {
                throw new ArmadaException(ErrorKind.INVALID_STATE,
                        "Task " + taskId + " used all " + retryPolicy.maxAttempts() + " attempt(s)");
            }
        }
        metrics.recordTaskRetry(failed.spec.type().name());
        Task retry = create(failed.missionId, failed.spec, failed.retryAttempt + 1, failed.id);
        log.info("Retrying task {} as {} (attempt {})", taskId, retry.id(), retry.retryAttempt());
        return retry;
    }

    public Optional<Task> get(String taskId) {
        synchronized (lock) {
            TaskRecord record = tasks.get(taskId);
            return record != null ? Optional.of(record.snapshot()) : Optional.empty();
        }
    }

    public List<Task> getByMission(String missionId) {
        synchronized (lock) {
            List<Task> result = new ArrayList<>();
            for (TaskRecord record : tasks.values()) {
                if (record.missionId != null && record.missionId.equals(missionId)) {
                    result.add(record.snapshot());
                }
            }
            return result;
        }
    }

    public Optional<TaskResult> getResult(String taskId) {
        synchronized (lock) {
            TaskRecord record = tasks.get(taskId);
            return record != null ? Optional.ofNullable(record.result) : Optional.empty();
        }
    }

    /**
     * Token that is cancelled when the task is cancelled. Running work should poll it.
     */
    public CancellationToken cancellationToken(String taskId) {
        synchronized (lock) {
            return require(taskId).token;
        }
    }

    public TaskStats getStats() {
        synchronized (lock) {
            Map<TaskStatus, Integer> counts = new HashMap<>();
            for (TaskRecord record : tasks.values()) {
                counts.merge(record.status, 1, Integer::sum);
            }
            return new TaskStats(
                    tasks.size(),
                    counts.getOrDefault(TaskStatus.PENDING, 0),
                    counts.getOrDefault(TaskStatus.BLOCKED, 0),
                    counts.getOrDefault(TaskStatus.RUNNING, 0),
                    counts.getOrDefault(TaskStatus.COMPLETED, 0),
                    counts.getOrDefault(TaskStatus.FAILED, 0),
                    counts.getOrDefault(TaskStatus.CANCELLED, 0));
        }
    }

    /**
     * Drops terminal tasks of a mission.
     *
     * @return number of tasks removed
     */
    public int clearCompleted(String missionId) {
        int removed = 0;
        synchronized (lock) {
            Iterator<TaskRecord> it = tasks.values().iterator();
            while (it.hasNext()) {
                TaskRecord record = it.next();
                if (record.status.isTerminal() && record.missionId != null && record.missionId.equals(missionId)) {
                    it.remove();
                    removed++;
                }
            }
        }
        log.debug("Cleared {} finished tasks of mission {}", removed, missionId);
        return removed;
    }

    /**
     * Disarms every timer. Owned timer threads are stopped.
     */
    public void shutdown() {
        synchronized (lock) {
            for (TaskRecord record : tasks.values()) {
                cancelTimer(record);
            }
        }
        if (ownsTimers) {
            timers.shutdownNow();
        }
        log.info("Task scheduler shut down");
    }

    int runningCount() {
        synchronized (lock) {
            return running;
        }
    }

    void onTimeout(String taskId) {
        Task snapshot;
        CancellationToken token;
        List<Task> unblocked;
        synchronized (lock) {
            TaskRecord record = tasks.get(taskId);
            if (record == null || record.status != TaskStatus.RUNNING) {
                return;
            }
            long elapsed = Duration.between(record.startedAt, clock.instant()).toMillis();
            record.timer = null;
            finish(record, TaskResult.failure(TIMEOUT_ERROR, elapsed));
            token = record.token;
            snapshot = record.snapshot();
            unblocked = reevaluateBlocked();
        }
        // aborts whatever still works on the task
        token.cancel(TIMEOUT_ERROR);
        log.warn("Task {} timed out after {}", taskId, taskTimeout);
        metrics.recordTaskTimeout();
        metrics.recordTaskCompletion(snapshot.type().name(), false, snapshot.result().durationMs());
        publish("task.timed_out", snapshot, Map.of("timeoutMs", taskTimeout.toMillis()));
        publish("task.failed", snapshot, Map.of("error", TIMEOUT_ERROR));
        publishUnblocked(unblocked);
    }

    // Must hold lock.
    private void finish(TaskRecord record, TaskResult result) {
        cancelTimer(record);
        record.result = result;
        record.status = result.success() ? TaskStatus.COMPLETED : TaskStatus.FAILED;
        record.completedAt = clock.instant();
        running--;
    }

    // Must hold lock.
    private List<Task> reevaluateBlocked() {
        List<Task> unblocked = new ArrayList<>();
        for (TaskRecord record : tasks.values()) {
            if (record.status == TaskStatus.BLOCKED && dependenciesMet(record)) {
                record.status = TaskStatus.PENDING;
                unblocked.add(record.snapshot());
            }
        }
        return unblocked;
    }

    // Must hold lock.
    private boolean dependenciesMet(TaskRecord record) {
        for (TaskDependency dependency : record.spec.dependencies()) {
            TaskRecord target = tasks.get(dependency.taskId());
            if (target == null) {
                return false;
            }
            if (dependency.type() == DependencyType.REQUIRED && target.status != TaskStatus.COMPLETED) {
                return false;
            }
            if (dependency.type() == DependencyType.SOFT && target.status == TaskStatus.RUNNING) {
                return false;
            }
        }
        return true;
    }

    private TaskRecord require(String taskId) {
        TaskRecord record = tasks.get(taskId);
        if (record == null) {
            throw ArmadaException.notFound("Task", taskId);
        }
        return record;
    }

    private static void cancelTimer(TaskRecord record) {
        if (record.timer != null) {
            record.timer.cancel(false);
            record.timer = null;
        }
    }

    private void publishUnblocked(List<Task> unblocked) {
        for (Task task : unblocked) {
            log.info("Task {} unblocked", task.id());
            publish("task.unblocked", task, Map.of());
        }
    }

    private void publish(String type, Task task, Map<String, Object> payload) {
        events.publish(ArmadaEvent.of(type, task.missionId(), task.id(), payload));
    }

    /**
     * Mutable record guarded by the scheduler lock. Callers only ever see {@link Task} snapshots.
     */
    private static final class TaskRecord {
        final String id;
        final String missionId;
        final TaskSpec spec;
        final int retryAttempt;
        final String retriedFrom;
        final Instant createdAt;
        final long sequence;
        final CancellationToken token = CancellationToken.create();

        TaskStatus status = TaskStatus.PENDING;
        Instant startedAt;
        Instant completedAt;
        TaskResult result;
        String cancelReason;
        ScheduledFuture<?> timer;

        TaskRecord(String id, String missionId, TaskSpec spec, int retryAttempt, String retriedFrom,
                   Instant createdAt, long sequence) {
            this.id = id;
            this.missionId = missionId;
            this.spec = spec;
            this.retryAttempt = retryAttempt;
            this.retriedFrom = retriedFrom;
            this.createdAt = createdAt;
            this.sequence = sequence;
        }

        Task snapshot() {
            return new Task(id, missionId, spec, status, retryAttempt, retriedFrom,
                    createdAt, startedAt, completedAt, result, cancelReason);
        }
    }
}
