package com.armada.core.pool;

import com.armada.core.concurrent.CancellationToken;
import com.armada.core.error.ArmadaException;
import com.armada.core.error.ErrorKind;
import com.armada.core.events.ArmadaEvent;
import com.armada.core.events.EventPublisher;
import com.armada.core.llm.CompletionRequest;
import com.armada.core.llm.CompletionResponse;
import com.armada.core.llm.CompletionUsage;
import com.armada.core.llm.ModelCompletion;
import com.armada.core.logging.MdcContext;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.quota.QuotaTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool of reusable agents, each performing one model call at a time.
 * <p>
 * Requests pass a quota check, then wait in a FIFO queue drained by a single thread. The
 * drain loop enforces the minimum dispatch interval, takes an idle agent or creates one up
 * to the ceiling, and stops when neither is possible; every release restarts it. Model calls
 * run on a separate executor so the drain loop never blocks on a back end.
 * <p>
 * Queued requests have their own deadline timer. A periodic sweep retires agents idle for
 * longer than the idle timeout, always keeping at least one.
 */
public class AgentPool {

    private static final Logger log = LoggerFactory.getLogger(AgentPool.class);

    private final ModelCompletion model;
    private final QuotaTracker quotaTracker;
    private final EventPublisher events;
    private final ArmadaMetrics metrics;
    private final AgentPoolSettings settings;
    private final Clock clock;

    private final ExecutorService drainExecutor;
    private final ExecutorService callExecutor;
    private final ScheduledExecutorService timers;
    private final ScheduledFuture<?> idleSweep;

    private final Object lock = new Object();
    private final Map<String, AgentRecord> agents = new LinkedHashMap<>();
    private final ArrayDeque<QueuedRequest> queue = new ArrayDeque<>();
    private long lastDispatchNanos;
    private int inFlight;
    private boolean shutdown;

    private volatile long minIntervalNanos;

    public AgentPool(ModelCompletion model, QuotaTracker quotaTracker, EventPublisher events, ArmadaMetrics metrics) {
        this(model, quotaTracker, events, metrics, AgentPoolSettings.DEFAULT, Clock.systemUTC());
    }

    public AgentPool(ModelCompletion model, QuotaTracker quotaTracker, EventPublisher events, ArmadaMetrics metrics,
                     AgentPoolSettings settings, Clock clock) {
        this.model = model;
        this.quotaTracker = quotaTracker;
        this.events = events;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
        this.minIntervalNanos = settings.minDispatchInterval().toNanos();
        this.lastDispatchNanos = System.nanoTime() - minIntervalNanos;

        this.drainExecutor = Executors.newSingleThreadExecutor(daemonThreads("armada-pool-drain"));
        this.callExecutor = Executors.newFixedThreadPool(settings.maxAgents(), daemonThreads("armada-pool-call"));
        this.timers = Executors.newSingleThreadScheduledExecutor(daemonThreads("armada-pool-timer"));
        long sweepMs = settings.idleTimeout().toMillis();
        this.idleSweep = timers.scheduleAtFixedRate(this::sweepSafely, sweepMs, sweepMs, TimeUnit.MILLISECONDS);

        log.info("Agent pool started: maxAgents={}, idleTimeout={}, requestTimeout={}, minInterval={}",
                settings.maxAgents(), settings.idleTimeout(), settings.requestTimeout(), settings.minDispatchInterval());
    }

    /**
     * Takes an idle agent, or creates one if below the ceiling. The caller must {@link #release} it.
     */
    public Optional<PoolAgent> acquire() {
        AgentRecord agent;
        boolean created;
        synchronized (lock) {
            int before = agents.size();
            agent = acquireLocked();
            created = agents.size() > before;
        }
        if (agent == null) {
            return Optional.empty();
        }
        if (created) {
            announceCreated(agent.id);
        }
        return Optional.of(snapshotOf(agent));
    }

    /**
     * Returns an agent to IDLE and resumes draining.
     *
     * @throws ArmadaException NOT_FOUND for an unknown agent
     */
    public void release(String agentId) {
        synchronized (lock) {
            AgentRecord agent = agents.get(agentId);
            if (agent == null) {
                throw ArmadaException.notFound("Agent", agentId);
            }
            agent.status = AgentStatus.IDLE;
            agent.lastActiveAt = clock.instant();
        }
        scheduleDrain();
    }

    /**
     * Runs a request and blocks until its response is available.
     *
     * @throws ArmadaException QUOTA_EXCEEDED (never queued), CANCELLED, TIMEOUT, SHUTDOWN,
     *                         or EXECUTION_FAILED when the model call fails
     */
    public AgentResponse execute(AgentRequest request, CancellationToken token) {
        try {
            return submit(request, token).join();
        } catch (CompletionException e) {
            throw ArmadaException.wrap(e);
        } catch (CancellationException e) {
            throw ArmadaException.cancelled("Request " + request.id() + " cancelled");
        }
    }

    /**
     * Asynchronous form of {@link #execute}. Admission failures come back as an already
     * failed future.
     */
    public CompletableFuture<AgentResponse> submit(AgentRequest request, CancellationToken token) {
        CancellationToken cancellation = token != null ? token : CancellationToken.none();
        if (cancellation.isCancelled()) {
            return rejected(ErrorKind.CANCELLED, "Request " + request.id() + " cancelled before admission");
        }
        String provider = model.provider();
        if (!quotaTracker.canExecute(provider)) {
            log.warn("Rejecting request {}: quota exceeded for {}", request.id(), provider);
            return rejected(ErrorKind.QUOTA_EXCEEDED, "Quota exceeded for provider " + provider);
        }

        QueuedRequest queued = new QueuedRequest(request, cancellation);
        queued.cancelRegistration = cancellation.onCancel(() -> cancelRequest(queued));
        synchronized (lock) {
            if (shutdown) {
                queued.cancelRegistration.remove();
                return rejected(ErrorKind.SHUTDOWN, "Agent pool is shut down");
            }
            if (queued.future.isDone()) {
                return queued.future;
            }
            queue.addLast(queued);
            queued.timer = timers.schedule(() -> expire(queued),
                    settings.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }
        log.debug("Queued request {} ({} waiting)", request.id(), queuedCount());
        scheduleDrain();
        return queued.future;
    }

    public PoolStats getStats() {
        synchronized (lock) {
            int idle = 0;
            long requests = 0;
            long tokens = 0;
            long errors = 0;
            for (AgentRecord agent : agents.values()) {
                if (agent.status == AgentStatus.IDLE) {
                    idle++;
                }
                requests += agent.requestCount;
                tokens += agent.tokenCount;
                errors += agent.errorCount;
            }
            return new PoolStats(agents.size(), idle, agents.size() - idle, settings.maxAgents(),
                    queue.size(), inFlight, requests, tokens, errors);
        }
    }

    public List<PoolAgent> getAll() {
        synchronized (lock) {
            List<PoolAgent> result = new ArrayList<>(agents.size());
            for (AgentRecord agent : agents.values()) {
                result.add(agent.snapshot());
            }
            return result;
        }
    }

    public int getAvailableCount() {
        synchronized (lock) {
            int idle = 0;
            for (AgentRecord agent : agents.values()) {
                if (agent.status == AgentStatus.IDLE) {
                    idle++;
                }
            }
            return idle;
        }
    }

    /**
     * Sets the minimum dispatch interval to {@code 1000 / callsPerSecond} milliseconds.
     */
    public void setRateLimit(double callsPerSecond) {
        if (callsPerSecond <= 0) {
            throw new IllegalArgumentException("callsPerSecond must be positive");
        }
        minIntervalNanos = (long) (TimeUnit.SECONDS.toNanos(1) / callsPerSecond);
        log.info("Pool rate limit set to {} calls/s", callsPerSecond);
    }

    /**
     * Retires agents idle longer than the idle timeout, never the last agent.
     *
     * @return number of agents retired
     */
    public int retireIdleAgents() {
        List<String> retired = new ArrayList<>();
        synchronized (lock) {
            Instant now = clock.instant();
            Iterator<AgentRecord> it = agents.values().iterator();
            while (it.hasNext() && agents.size() > 1) {
                AgentRecord agent = it.next();
                if (agent.status == AgentStatus.IDLE
                        && Duration.between(agent.lastActiveAt, now).compareTo(settings.idleTimeout()) > 0) {
                    it.remove();
                    retired.add(agent.id);
                }
            }
        }
        for (String agentId : retired) {
            log.debug("Retired idle agent {}", agentId);
            metrics.recordAgentLifecycle("retired");
            events.publish(ArmadaEvent.of("agent.retired", null, agentId, Map.of()));
        }
        return retired.size();
    }

    /**
     * Fails every queued request with SHUTDOWN and stops all pool threads. In-flight calls are
     * interrupted.
     */
    public void shutdown() {
        List<QueuedRequest> abandoned;
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            abandoned = new ArrayList<>(queue);
            queue.clear();
        }
        idleSweep.cancel(false);
        for (QueuedRequest queued : abandoned) {
            queued.cancelTimer();
            queued.cancelRegistration.remove();
            queued.fail(new ArmadaException(ErrorKind.SHUTDOWN, "Agent pool shut down"));
        }
        drainExecutor.shutdownNow();
        callExecutor.shutdownNow();
        timers.shutdownNow();
        log.info("Agent pool shut down ({} queued requests rejected)", abandoned.size());
    }

    /**
     * Renders the prompt as optional {@code <system>} and {@code <context>} blocks followed by
     * the {@code <task>} block.
     */
    static String buildPrompt(AgentRequest request) {
        List<String> parts = new ArrayList<>();
        if (request.systemContext() != null && !request.systemContext().isBlank()) {
            parts.add("<system>\n" + request.systemContext() + "\n</system>");
        }
        if (!request.context().isEmpty()) {
            parts.add("<context>");
            for (ContextItem item : request.context()) {
                parts.add("<" + item.type() + " path=\"" + (item.path() != null ? item.path() : "") + "\">");
                parts.add(item.content());
                parts.add("</" + item.type() + ">");
            }
            parts.add("</context>");
        }
        parts.add("<task>");
        parts.add(request.prompt());
        parts.add("</task>");
        return String.join("\n\n", parts);
    }

    private void scheduleDrain() {
        try {
            drainExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.debug("Drain not scheduled, pool is shutting down");
        }
    }

    /**
     * Single-threaded dispatch loop. Returns when the queue is empty or no agent is available.
     */
    private void drain() {
        while (true) {
            long waitNanos;
            synchronized (lock) {
                if (shutdown || queue.isEmpty()) {
                    return;
                }
                waitNanos = lastDispatchNanos + minIntervalNanos - System.nanoTime();
            }
            if (waitNanos > 0) {
                try {
                    TimeUnit.NANOSECONDS.sleep(waitNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }

            AgentRecord agent;
            QueuedRequest next;
            boolean created;
            synchronized (lock) {
                if (shutdown || queue.isEmpty()) {
                    return;
                }
                int before = agents.size();
                agent = acquireLocked();
                if (agent == null) {
                    return;
                }
                created = agents.size() > before;
                next = queue.pollFirst();
                next.cancelTimer();
                if (next.future.isDone() || next.token.isCancelled()) {
                    agent.status = AgentStatus.IDLE;
                    next.dispatchable = false;
                } else {
                    lastDispatchNanos = System.nanoTime();
                    inFlight++;
                    next.dispatchable = true;
                }
            }
            if (created) {
                announceCreated(agent.id);
            }
            if (!next.dispatchable) {
                next.fail(ArmadaException.cancelled("Request " + next.request.id() + " cancelled"));
                continue;
            }
            metrics.recordQueueWait(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - next.enqueuedNanos));
            AgentRecord dispatched = agent;
            try {
                callExecutor.execute(() -> run(dispatched, next));
            } catch (RejectedExecutionException e) {
                synchronized (lock) {
                    inFlight--;
                    dispatched.status = AgentStatus.IDLE;
                }
                next.fail(new ArmadaException(ErrorKind.SHUTDOWN, "Agent pool shut down"));
                return;
            }
        }
    }

    private void run(AgentRecord agent, QueuedRequest queued) {
        AgentRequest request = queued.request;
        String provider = model.provider();
        MdcContext.setAgent(agent.id);
        if (request.taskId() != null) {
            MdcContext.setTask(request.missionId(), request.taskId());
        }
        long start = System.nanoTime();
        try {
            CompletionResponse completion = model.complete(new CompletionRequest(
                    null, buildPrompt(request), request.maxTokens(), request.temperature(), request.stopSequences()));
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            CompletionUsage usage = completion.usage() != null ? completion.usage() : CompletionUsage.NONE;

            synchronized (lock) {
                agent.requestCount++;
                agent.tokenCount += usage.totalTokens();
                agent.lastActiveAt = clock.instant();
            }
            quotaTracker.recordUsage(provider, request.tier(), usage.promptTokens(), usage.completionTokens());
            metrics.recordModelCall(provider, true, durationMs);
            metrics.recordTokens(provider, usage.totalTokens());

            AgentResponse response = new AgentResponse(request.id(), agent.id, completion.content(),
                    new TokenUsage(usage.promptTokens(), usage.completionTokens(), usage.totalTokens()),
                    durationMs, completion.model(), completion.finishReason());
            log.debug("Agent {} completed request {} in {}ms ({} tokens)",
                    agent.id, request.id(), durationMs, usage.totalTokens());
            events.publish(ArmadaEvent.of("agent.response", request.missionId(), agent.id, Map.of(
                    "requestId", request.id(),
                    "durationMs", durationMs,
                    "tokens", usage.totalTokens())));
            queued.future.complete(response);
        } catch (RuntimeException e) {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            synchronized (lock) {
                agent.errorCount++;
            }
            metrics.recordModelCall(provider, false, durationMs);
            log.warn("Agent {} failed request {}: {}", agent.id, request.id(), e.getMessage());
            queued.fail(ArmadaException.wrap(e));
        } finally {
            queued.cancelRegistration.remove();
            synchronized (lock) {
                inFlight--;
            }
            release(agent.id);
            MdcContext.clear();
        }
    }

    // Must hold lock.
    private AgentRecord acquireLocked() {
        for (AgentRecord agent : agents.values()) {
            if (agent.status == AgentStatus.IDLE) {
                agent.status = AgentStatus.BUSY;
                agent.lastActiveAt = clock.instant();
                return agent;
            }
        }
        if (agents.size() >= settings.maxAgents()) {
            return null;
        }
        AgentRecord agent = new AgentRecord("agent-" + UUID.randomUUID(), clock.instant());
        agent.status = AgentStatus.BUSY;
        agents.put(agent.id, agent);
        return agent;
    }

    private void announceCreated(String agentId) {
        log.info("Created agent {}", agentId);
        metrics.recordAgentLifecycle("created");
        events.publish(ArmadaEvent.of("agent.created", null, agentId, Map.of()));
    }

    private void cancelRequest(QueuedRequest queued) {
        boolean wasQueued;
        synchronized (lock) {
            wasQueued = queue.remove(queued);
        }
        if (wasQueued) {
            queued.cancelTimer();
            metrics.recordRequestRejected(ErrorKind.CANCELLED.code());
            log.debug("Request {} cancelled while queued", queued.request.id());
        }
        queued.fail(ArmadaException.cancelled("Request " + queued.request.id() + " cancelled"));
    }

    private void expire(QueuedRequest queued) {
        synchronized (lock) {
            if (!queue.remove(queued)) {
                return;
            }
        }
        queued.cancelRegistration.remove();
        metrics.recordRequestRejected(ErrorKind.TIMEOUT.code());
        log.warn("Request {} timed out after {} in queue", queued.request.id(), settings.requestTimeout());
        queued.fail(new ArmadaException(ErrorKind.TIMEOUT,
                "Request " + queued.request.id() + " timed out after " + settings.requestTimeout()));
    }

    private CompletableFuture<AgentResponse> rejected(ErrorKind kind, String message) {
        metrics.recordRequestRejected(kind.code());
        return CompletableFuture.failedFuture(new ArmadaException(kind, message));
    }

    private int queuedCount() {
        synchronized (lock) {
            return queue.size();
        }
    }

    private void sweepSafely() {
        try {
            retireIdleAgents();
        } catch (RuntimeException e) {
            log.warn("Idle agent sweep failed: {}", e.getMessage(), e);
        }
    }

    private PoolAgent snapshotOf(AgentRecord agent) {
        synchronized (lock) {
            return agent.snapshot();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Live agent state guarded by the pool lock.
     */
    private static final class AgentRecord {
        final String id;
        final Instant createdAt;
        AgentStatus status = AgentStatus.IDLE;
        Instant lastActiveAt;
        long requestCount;
        long tokenCount;
        long errorCount;

        AgentRecord(String id, Instant createdAt) {
            this.id = id;
            this.createdAt = createdAt;
            this.lastActiveAt = createdAt;
        }

        PoolAgent snapshot() {
            return new PoolAgent(id, status, createdAt, lastActiveAt, requestCount, tokenCount, errorCount);
        }
    }

    private static final class QueuedRequest {
        final AgentRequest request;
        final CancellationToken token;
        final CompletableFuture<AgentResponse> future = new CompletableFuture<>();
        final long enqueuedNanos = System.nanoTime();
        volatile CancellationToken.Registration cancelRegistration = () -> { };
        volatile ScheduledFuture<?> timer;
        boolean dispatchable;

        QueuedRequest(AgentRequest request, CancellationToken token) {
            this.request = request;
            this.token = token;
        }

        void cancelTimer() {
            ScheduledFuture<?> t = timer;
            if (t != null) {
                t.cancel(false);
            }
        }

        void fail(ArmadaException error) {
            future.completeExceptionally(error);
        }
    }
}
