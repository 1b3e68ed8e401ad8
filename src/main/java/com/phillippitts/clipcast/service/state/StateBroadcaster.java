package com.phillippitts.clipcast.service.state;

import com.phillippitts.clipcast.domain.AppState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Fans published {@link AppState} values out to any number of readers.
 *
 * <p>Each subscriber owns a single-slot mailbox: publishing overwrites the slot and, if no
 * delivery is in flight, schedules a drain on the executor. A slow reader therefore only ever
 * sees the latest value and never blocks {@link #publish(AppState)}. Deliveries to one
 * subscriber are sequential and in publication order (skipping overwritten values).
 */
public final class StateBroadcaster {

    private static final Logger LOG = LogManager.getLogger(StateBroadcaster.class);

    private final Executor executor;
    private final Set<Subscription> subscriptions = new CopyOnWriteArraySet<>();

    public StateBroadcaster(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Registers a reader and immediately offers it {@code initial}.
     */
    public Subscription subscribe(Consumer<AppState> listener, AppState initial) {
        Subscription subscription = new Subscription(Objects.requireNonNull(listener, "listener"));
        subscriptions.add(subscription);
        if (initial != null) {
            subscription.offer(initial);
        }
        return subscription;
    }

    /** Non-blocking; safe to call while holding the state lock. */
    public void publish(AppState state) {
        for (Subscription s : subscriptions) {
            s.offer(state);
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    /**
     * Handle returned to readers. Closing it stops further deliveries.
     */
    public final class Subscription implements AutoCloseable {

        private final Consumer<AppState> listener;
        private final AtomicReference<AppState> mailbox = new AtomicReference<>();
        private final AtomicBoolean draining = new AtomicBoolean();
        private volatile boolean closed;

        private Subscription(Consumer<AppState> listener) {
            this.listener = listener;
        }

        void offer(AppState state) {
            if (closed) {
                return;
            }
            mailbox.set(state);
            scheduleDrain();
        }

        private void scheduleDrain() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                LOG.warn("State delivery rejected: {}", e.toString());
            }
        }

        private void drain() {
            try {
                AppState next;
                while (!closed && (next = mailbox.getAndSet(null)) != null) {
                    try {
                        listener.accept(next);
                    } catch (RuntimeException e) {
                        LOG.warn("State listener failed on {}: {}", next.name(), e.toString());
                    }
                }
            } finally {
                draining.set(false);
            }
            // A value may have arrived between the last poll and releasing the flag
            if (!closed && mailbox.get() != null) {
                scheduleDrain();
            }
        }

        public boolean isClosed() {
            return closed;
        }

        @Override
        public void close() {
            closed = true;
            mailbox.set(null);
            subscriptions.remove(this);
        }
    }
}
