package com.phillippitts.clipcast.service.debounce;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keyed debounce and throttle for externally triggered actions.
 *
 * <p>All access to the pending-timer and last-execution maps is serialized by one lock.
 * Actions always run outside the lock, and an exception thrown by an action is logged and
 * never reaches the caller.
 *
 * <p>Debounced actions run on the injected scheduler; throttled and immediate actions run
 * on the calling thread.
 */
public class DebounceManager {

    private static final Logger LOG = LogManager.getLogger(DebounceManager.class);

    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Lock lock = new ReentrantLock();

    // Guarded by lock
    private final Map<String, ScheduledFuture<?>> pending = new HashMap<>();
    private final Map<String, Long> lastExecution = new HashMap<>();

    public DebounceManager(ScheduledExecutorService scheduler) {
        this(scheduler, Clock.systemUTC());
    }

    public DebounceManager(ScheduledExecutorService scheduler, Clock clock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs {@code action} after {@code delayMs} of quiescence under {@code key}. Any earlier
     * call under the same key that has not run yet is cancelled, so only the last call in a
     * burst executes.
     */
    public void debounce(String key, long delayMs, Runnable action) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(action, "action");
        lock.lock();
        try {
            cancelPending(key);
            AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
            ScheduledFuture<?> future = scheduler.schedule(
                    () -> runIfCurrent(key, self, action),
                    Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
            self.set(future);
            pending.put(key, future);
        } catch (RejectedExecutionException e) {
            LOG.warn("Debounce '{}' rejected: scheduler is shut down", key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} now if at least {@code intervalMs} passed since the last execution
     * under {@code key}.
     *
     * @return true if the action ran
     */
    public boolean throttle(String key, long intervalMs, Runnable action) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(action, "action");
        lock.lock();
        try {
            long now = clock.millis();
            Long last = lastExecution.get(key);
            if (last != null && now - last < intervalMs) {
                LOG.debug("Throttled '{}' ({}ms since last run)", key, now - last);
                return false;
            }
            lastExecution.put(key, now);
        } finally {
            lock.unlock();
        }
        safeRun(key, action);
        return true;
    }

    /**
     * Cancels any pending debounce under {@code key} and runs {@code action} immediately.
     */
    public void executeNow(String key, Runnable action) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(action, "action");
        lock.lock();
        try {
            cancelPending(key);
            lastExecution.put(key, clock.millis());
        } finally {
            lock.unlock();
        }
        safeRun(key, action);
    }

    public boolean isPending(String key) {
        lock.lock();
        try {
            ScheduledFuture<?> f = pending.get(key);
            return f != null && !f.isDone();
        } finally {
            lock.unlock();
        }
    }

    /** Cancels a pending debounce; returns true if one was pending. */
    public boolean cancel(String key) {
        lock.lock();
        try {
            return cancelPending(key);
        } finally {
            lock.unlock();
        }
    }

    public void cancelAll() {
        lock.lock();
        try {
            pending.values().forEach(f -> f.cancel(false));
            pending.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return milliseconds since the last execution under {@code key}, or -1 if it never ran
     */
    public long timeSinceLastExecution(String key) {
        lock.lock();
        try {
            Long last = lastExecution.get(key);
            return last == null ? -1L : clock.millis() - last;
        } finally {
            lock.unlock();
        }
    }

    /** Cancels everything and forgets execution history. */
    public void clear() {
        lock.lock();
        try {
            pending.values().forEach(f -> f.cancel(false));
            pending.clear();
            lastExecution.clear();
        } finally {
            lock.unlock();
        }
    }

    /** Cancels outstanding work and stops the scheduler. */
    public void shutdown() {
        clear();
        scheduler.shutdownNow();
    }

    // Caller holds the lock
    private boolean cancelPending(String key) {
        ScheduledFuture<?> previous = pending.remove(key);
        if (previous != null) {
            previous.cancel(false);
            return true;
        }
        return false;
    }

    private void runIfCurrent(String key, AtomicReference<ScheduledFuture<?>> self, Runnable action) {
        lock.lock();
        try {
            // Superseded by a later call, or cancelled while waiting for the lock
            ScheduledFuture<?> mine = self.get();
            if (mine == null || pending.get(key) != mine) {
                return;
            }
            pending.remove(key);
            lastExecution.put(key, clock.millis());
        } finally {
            lock.unlock();
        }
        safeRun(key, action);
    }

    private static void safeRun(String key, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.error("Action '{}' failed", key, e);
        }
    }
}
