package com.armada.core.concurrent;

import com.armada.core.error.ArmadaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal passed through every long-running call chain.
 * <p>
 * Callers poll {@link #isCancelled()} before suspension points or register callbacks
 * with {@link #onCancel(Runnable)}. Child tokens are cancelled together with their parent,
 * never the other way round.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CopyOnWriteArrayList<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile String reason;

    private CancellationToken() {
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * A fresh token nobody else holds, for callers that do not need to cancel.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String reason() {
        return reason;
    }

    public void cancel() {
        cancel("cancelled");
    }

    /**
     * Cancels the token and runs registered callbacks once. Later calls are no-ops.
     */
    public void cancel(String reason) {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        this.reason = reason;
        for (Runnable callback : callbacks) {
            runSafely(callback);
        }
        callbacks.clear();
    }

    /**
     * Registers a callback; runs it immediately if already cancelled.
     *
     * @return handle that removes the callback
     */
    public Registration onCancel(Runnable callback) {
        if (isCancelled()) {
            runSafely(callback);
            return () -> { };
        }
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            runSafely(callback);
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Returns a token that is cancelled whenever this one is.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        onCancel(() -> child.cancel(reason));
        return child;
    }

    /**
     * @throws ArmadaException with kind CANCELLED when the token has been cancelled
     */
    public void throwIfCancelled(String what) {
        if (isCancelled()) {
            throw ArmadaException.cancelled(what + " cancelled" + (reason != null ? ": " + reason : ""));
        }
    }

    private void runSafely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    @FunctionalInterface
    public interface Registration {
        void remove();
    }
}
