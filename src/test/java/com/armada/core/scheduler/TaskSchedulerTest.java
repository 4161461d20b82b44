package com.armada.core.scheduler;

import com.armada.core.concurrent.CancellationToken;
import com.armada.core.concurrent.RetryPolicy;
import com.armada.core.error.ArmadaException;
import com.armada.core.error.ErrorKind;
import com.armada.core.events.ArmadaEvent;
import com.armada.core.events.EventBus;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.model.Task;
import com.armada.core.model.TaskDependency;
import com.armada.core.model.TaskPriority;
import com.armada.core.model.TaskResult;
import com.armada.core.model.TaskSpec;
import com.armada.core.model.TaskStatus;
import com.armada.core.model.TaskType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class TaskSchedulerTest {

    private static final String MISSION = "M-1";

    private EventBus events;
    private List<ArmadaEvent> published;
    private SimpleMeterRegistry registry;
    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        events = new EventBus();
        published = new CopyOnWriteArrayList<>();
        events.subscribeAll(published::add);
        registry = new SimpleMeterRegistry();
        scheduler = new TaskScheduler(events, new ArmadaMetrics(registry), 3,
                Duration.ofMinutes(5), Clock.systemUTC(), null);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private Task create(TaskPriority priority, TaskDependency... dependencies) {
        return scheduler.create(MISSION, new TaskSpec(TaskType.IMPLEMENT, "work", priority, List.of(dependencies), null));
    }

    private List<String> eventTypes() {
        return published.stream().map(ArmadaEvent::eventType).toList();
    }

    @Nested
    @DisplayName("queue order")
    class QueueOrderTests {

        @Test
        @DisplayName("getNext prefers higher priority then older tasks")
        void priorityThenAge() {
            Task low = create(TaskPriority.LOW);
            Task normal1 = create(TaskPriority.NORMAL);
            Task normal2 = create(TaskPriority.NORMAL);
            Task critical = create(TaskPriority.CRITICAL);

            List<String> order = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                Task next = scheduler.getNext().orElseThrow();
                order.add(next.id());
                scheduler.start(next.id());
            }

            assertEquals(List.of(critical.id(), normal1.id(), normal2.id()), order);
            assertNotEquals(low.id(), order.get(0));
        }

        @Test
        @DisplayName("getNext skips tasks with unmet dependencies")
        void skipsBlocked() {
            Task first = create(TaskPriority.LOW);
            create(TaskPriority.CRITICAL, TaskDependency.required(first.id()));

            assertEquals(first.id(), scheduler.getNext().orElseThrow().id());
        }

        @Test
        @DisplayName("getNext is empty when nothing is startable")
        void emptyWhenNothingReady() {
            create(TaskPriority.HIGH, TaskDependency.required("task-unknown"));

            assertTrue(scheduler.getNext().isEmpty());
        }
    }

    @Nested
    @DisplayName("dependencies")
    class DependencyTests {

        @Test
        @DisplayName("start on unmet REQUIRED dependency blocks the task")
        void unmetDependencyBlocks() {
            Task a = create(TaskPriority.NORMAL);
            Task b = create(TaskPriority.NORMAL, TaskDependency.required(a.id()));

            var error = assertThrows(ArmadaException.class, () -> scheduler.start(b.id()));

            assertEquals(ErrorKind.DEPENDENCIES_UNMET, error.kind());
            assertEquals(TaskStatus.BLOCKED, scheduler.get(b.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("completing the dependency unblocks the dependant")
        void completionUnblocks() {
            Task a = create(TaskPriority.NORMAL);
            Task b = create(TaskPriority.NORMAL, TaskDependency.required(a.id()));
            assertThrows(ArmadaException.class, () -> scheduler.start(b.id()));

            scheduler.start(a.id());
            scheduler.complete(a.id(), TaskResult.success("done", 5));

            assertEquals(TaskStatus.PENDING, scheduler.get(b.id()).orElseThrow().status());
            assertTrue(eventTypes().contains("task.unblocked"));
            assertEquals(TaskStatus.RUNNING, scheduler.start(b.id()).status());
        }

        @Test
        @DisplayName("failed REQUIRED dependency keeps the dependant blocked")
        void failedDependencyKeepsBlocked() {
            Task a = create(TaskPriority.NORMAL);
            Task b = create(TaskPriority.NORMAL, TaskDependency.required(a.id()));
            scheduler.start(a.id());
            scheduler.complete(a.id(), TaskResult.failure("broken", 5));

            var error = assertThrows(ArmadaException.class, () -> scheduler.start(b.id()));
            assertEquals(ErrorKind.DEPENDENCIES_UNMET, error.kind());
        }

        @Test
        @DisplayName("SOFT dependency only waits while the target runs")
        void softDependency() {
            Task a = create(TaskPriority.NORMAL);
            Task b = create(TaskPriority.NORMAL, TaskDependency.soft(a.id()));

            scheduler.start(a.id());
            assertThrows(ArmadaException.class, () -> scheduler.start(b.id()));

            scheduler.cancel(a.id(), "not needed");
            assertEquals(TaskStatus.RUNNING, scheduler.start(b.id()).status());
        }

        @Test
        @DisplayName("random dependency chains never start a task before its dependencies")
        void randomChainsRespectOrder() {
            Random random = new Random(42);
            List<Task> created = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                List<TaskDependency> deps = new ArrayList<>();
                for (Task earlier : created) {
                    if (random.nextInt(4) == 0) {
                        deps.add(TaskDependency.required(earlier.id()));
                    }
                }
                TaskPriority priority = TaskPriority.values()[random.nextInt(TaskPriority.values().length)];
                created.add(create(priority, deps.toArray(new TaskDependency[0])));
            }

            List<String> finished = new ArrayList<>();
            while (finished.size() < created.size()) {
                Task next = scheduler.getNext().orElseThrow();
                for (TaskDependency dependency : next.dependencies()) {
                    assertTrue(finished.contains(dependency.taskId()),
                            next.id() + " offered before " + dependency.taskId());
                }
                scheduler.start(next.id());
                scheduler.complete(next.id(), TaskResult.success("ok", 1));
                finished.add(next.id());
            }
            assertEquals(20, scheduler.getStats().completed());
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("start beyond maxConcurrent is rejected")
        void capacity() {
            for (int i = 0; i < 3; i++) {
                scheduler.start(create(TaskPriority.NORMAL).id());
            }
            Task extra = create(TaskPriority.NORMAL);

            var error = assertThrows(ArmadaException.class, () -> scheduler.start(extra.id()));

            assertEquals(ErrorKind.CAPACITY_EXCEEDED, error.kind());
            assertEquals(TaskStatus.PENDING, scheduler.get(extra.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("complete requires a running task")
        void completeRequiresRunning() {
            Task task = create(TaskPriority.NORMAL);

            var error = assertThrows(ArmadaException.class,
                    () -> scheduler.complete(task.id(), TaskResult.success("x", 1)));
            assertEquals(ErrorKind.INVALID_STATE, error.kind());
        }

        @Test
        @DisplayName("unknown task ids raise NOT_FOUND")
        void unknownTask() {
            var error = assertThrows(ArmadaException.class, () -> scheduler.start("task-missing"));
            assertEquals(ErrorKind.NOT_FOUND, error.kind());
        }

        @Test
        @DisplayName("cancel signals the token and cannot be repeated")
        void cancelSignalsToken() {
            Task task = create(TaskPriority.NORMAL);
            scheduler.start(task.id());
            CancellationToken token = scheduler.cancellationToken(task.id());

            Task cancelled = scheduler.cancel(task.id(), "user");

            assertEquals(TaskStatus.CANCELLED, cancelled.status());
            assertEquals("user", cancelled.cancelReason());
            assertTrue(token.isCancelled());
            var error = assertThrows(ArmadaException.class, () -> scheduler.cancel(task.id(), "again"));
            assertEquals(ErrorKind.INVALID_STATE, error.kind());
            assertEquals(0, scheduler.runningCount());
        }

        @Test
        @DisplayName("retry duplicates the spec of a failed task")
        void retryFailedTask() {
            Task task = create(TaskPriority.HIGH);
            scheduler.start(task.id());
            scheduler.complete(task.id(), TaskResult.failure("flaky", 3));

            Task retry = scheduler.retry(task.id());

            assertNotEquals(task.id(), retry.id());
            assertEquals(1, retry.retryAttempt());
            assertEquals(task.id(), retry.retriedFrom());
            assertEquals(task.spec(), retry.spec());
            assertEquals(TaskStatus.PENDING, retry.status());
            assertEquals(1.0, registry.find("armada.task.retries").counter().count());
        }

        @Test
        @DisplayName("retry stops once the retry policy's attempts are used up")
        void retryBoundedByPolicy() {
            var bounded = new TaskScheduler(events, ArmadaMetrics.noop(), 3, Duration.ofMinutes(5),
                    new RetryPolicy(2, Duration.ZERO), Clock.systemUTC(), null);
            try {
                Task first = bounded.create(MISSION, new TaskSpec(TaskType.FIX, "flaky", TaskPriority.NORMAL, List.of(), null));
                bounded.start(first.id());
                bounded.complete(first.id(), TaskResult.failure("boom", 1));

                Task second = bounded.retry(first.id());
                bounded.start(second.id());
                bounded.complete(second.id(), TaskResult.failure("boom again", 1));

                var error = assertThrows(ArmadaException.class, () -> bounded.retry(second.id()));
                assertEquals(ErrorKind.INVALID_STATE, error.kind());
                assertTrue(error.getMessage().contains("2 attempt(s)"));
                assertEquals(1, second.retryAttempt());
                assertEquals(2, bounded.getByMission(MISSION).size());
            } finally {
                bounded.shutdown();
            }
        }

        @Test
        @DisplayName("retry rejects tasks that did not fail")
        void retryRequiresFailure() {
            Task task = create(TaskPriority.NORMAL);

            var error = assertThrows(ArmadaException.class, () -> scheduler.retry(task.id()));
            assertEquals(ErrorKind.INVALID_STATE, error.kind());
        }

        @Test
        @DisplayName("clearCompleted drops only terminal tasks of the mission")
        void clearCompleted() {
            Task done = create(TaskPriority.NORMAL);
            Task open = create(TaskPriority.NORMAL);
            scheduler.start(done.id());
            scheduler.complete(done.id(), TaskResult.success("ok", 1));

            assertEquals(1, scheduler.clearCompleted(MISSION));
            assertTrue(scheduler.get(done.id()).isEmpty());
            assertTrue(scheduler.get(open.id()).isPresent());
        }
    }

    @Nested
    @DisplayName("timeouts")
    class TimeoutTests {

        @Test
        @DisplayName("timer fails a running task, cancels its token and frees capacity")
        void timeoutFailsTask() {
            Task task = create(TaskPriority.NORMAL);
            scheduler.start(task.id());
            CancellationToken token = scheduler.cancellationToken(task.id());

            scheduler.onTimeout(task.id());

            Task failed = scheduler.get(task.id()).orElseThrow();
            assertEquals(TaskStatus.FAILED, failed.status());
            assertEquals(TaskScheduler.TIMEOUT_ERROR, failed.result().error());
            assertTrue(token.isCancelled());
            assertEquals(0, scheduler.runningCount());
            assertTrue(eventTypes().contains("task.timed_out"));
            assertEquals(1.0, registry.find("armada.task.timeouts").counter().count());
        }

        @Test
        @DisplayName("timer firing after completion is ignored")
        void lateTimerIgnored() {
            Task task = create(TaskPriority.NORMAL);
            scheduler.start(task.id());
            scheduler.complete(task.id(), TaskResult.success("ok", 1));

            scheduler.onTimeout(task.id());

            assertEquals(TaskStatus.COMPLETED, scheduler.get(task.id()).orElseThrow().status());
            assertFalse(eventTypes().contains("task.timed_out"));
        }

        @Test
        @DisplayName("armed timer fires on its own")
        void realTimerFires() throws InterruptedException {
            var quick = new TaskScheduler(events, ArmadaMetrics.noop(), 1, Duration.ofMillis(30),
                    Clock.systemUTC(), null);
            try {
                Task task = quick.create(MISSION, TaskSpec.of(TaskType.TEST, "slow"));
                quick.start(task.id());

                long deadline = System.currentTimeMillis() + 2000;
                while (quick.get(task.id()).orElseThrow().status() == TaskStatus.RUNNING
                        && System.currentTimeMillis() < deadline) {
                    Thread.sleep(10);
                }

                assertEquals(TaskStatus.FAILED, quick.get(task.id()).orElseThrow().status());
            } finally {
                quick.shutdown();
            }
        }
    }

    @Test
    @DisplayName("stats count tasks by status")
    void stats() {
        Task a = create(TaskPriority.NORMAL);
        Task b = create(TaskPriority.NORMAL, TaskDependency.required(a.id()));
        create(TaskPriority.NORMAL);
        scheduler.start(a.id());
        assertThrows(ArmadaException.class, () -> scheduler.start(b.id()));

        TaskStats stats = scheduler.getStats();

        assertEquals(3, stats.total());
        assertEquals(1, stats.running());
        assertEquals(1, stats.blocked());
        assertEquals(1, stats.pending());
    }
}
