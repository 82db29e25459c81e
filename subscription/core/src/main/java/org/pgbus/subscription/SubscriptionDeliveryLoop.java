/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.pgbus.subscription;

import org.jspecify.annotations.Nullable;
import org.pgbus.eventbus.api.Event;
import org.pgbus.eventbus.api.EventBusConnectionException;
import org.pgbus.subscription.spi.StoreConnection;
import org.pgbus.subscription.spi.StoreConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.pgbus.retry.internal.RetryExecution.executeWithRetry;
import static org.pgbus.subscription.DeliveryState.ACQUIRING_LOCK;
import static org.pgbus.subscription.DeliveryState.CHECKPOINTING;
import static org.pgbus.subscription.DeliveryState.CLOSED;
import static org.pgbus.subscription.DeliveryState.DELIVERING;
import static org.pgbus.subscription.DeliveryState.FAILED;
import static org.pgbus.subscription.DeliveryState.FETCHING;
import static org.pgbus.subscription.DeliveryState.IDLE_WAITING;
import static org.pgbus.subscription.DeliveryState.RESUMING;

/**
 * Delivers the events of one subscription, in ascending id order, as an infinite {@link Iterator}.
 * <p>
 * Iterating first acquires the {@link SubscriptionLease} of the subscription (blocking for as long as another consumer
 * holds it), then resumes after the last checkpoint and hands out events batch by batch. The checkpoint of a batch is
 * written when the next event is requested after the last event of the batch has been handed out, so an event is never
 * checkpointed before its consumer is done with it. When no events are available the loop waits for a notification,
 * at most {@link SubscriptionConfig#maxIdleWait}.
 * </p>
 * <p>
 * Transient store errors ({@link TransientFailures}) make the loop give up its lease, back off according to
 * {@link SubscriptionConfig#transientErrorRetryStrategy} and start over from {@link DeliveryState#ACQUIRING_LOCK}.
 * Other errors move it to {@link DeliveryState#FAILED} and are rethrown from {@link #hasNext()}.
 * </p>
 * <p>
 * Iteration must happen from one thread at a time. {@link #close()} may be called from any thread.
 * </p>
 */
public class SubscriptionDeliveryLoop implements Iterator<Event>, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionDeliveryLoop.class);

    private final String subscriptionId;
    private final long lockNumber;
    private final StoreConnectionFactory connectionFactory;
    private final SubscriptionConfig config;
    private final Consumer<DeliveryState> stateListener;

    private final CountDownLatch closedLatch = new CountDownLatch(1);

    private final Object monitor = new Object();
    // Guarded by monitor
    private @Nullable Thread loopThread;
    private boolean suspended;
    private boolean interruptedByClose;

    private volatile boolean closed;
    private volatile DeliveryState state = ACQUIRING_LOCK;
    private volatile @Nullable StoreConnection connection;
    private volatile @Nullable SubscriptionLease lease;
    private volatile @Nullable String lastSeenId;

    // Confined to the iterating thread
    private final Deque<Event> batch = new ArrayDeque<>();
    private @Nullable String pendingCheckpoint;
    private @Nullable Event nextEvent;
    private @Nullable RuntimeException failure;

    public SubscriptionDeliveryLoop(String subscriptionId, StoreConnectionFactory connectionFactory, SubscriptionConfig config) {
        this(subscriptionId, connectionFactory, config, __ -> {
        });
    }

    /**
     * @param stateListener Invoked after every state transition, from the thread causing it
     */
    public SubscriptionDeliveryLoop(String subscriptionId, StoreConnectionFactory connectionFactory, SubscriptionConfig config, Consumer<DeliveryState> stateListener) {
        requireNonNull(subscriptionId, "Subscription id cannot be null");
        requireNonNull(connectionFactory, StoreConnectionFactory.class.getSimpleName() + " cannot be null");
        requireNonNull(config, SubscriptionConfig.class.getSimpleName() + " cannot be null");
        requireNonNull(stateListener, "State listener cannot be null");
        if (subscriptionId.isBlank() || subscriptionId.length() > Event.MAX_ID_LENGTH) {
            throw new IllegalArgumentException("Subscription id must be non-blank and at most " + Event.MAX_ID_LENGTH + " characters");
        }
        this.subscriptionId = subscriptionId;
        this.lockNumber = LockNumbers.lockNumber(subscriptionId);
        this.connectionFactory = connectionFactory;
        this.config = config;
        this.stateListener = stateListener;
    }

    @Override
    public boolean hasNext() {
        if (nextEvent != null) {
            return true;
        }
        RuntimeException previousFailure = failure;
        if (previousFailure != null) {
            throw previousFailure;
        }
        if (closed) {
            return false;
        }

        enterLoop();
        try {
            nextEvent = executeWithRetry(this::advance, e -> !closed && TransientFailures.isTransient(e), config.transientErrorRetryStrategy).get();
        } catch (RuntimeException e) {
            if (closed) {
                logDebug("Subscription {} was closed while in state {} ({})", subscriptionId, state, e.toString());
                return false;
            }
            fail(e);
            throw e;
        } finally {
            leaveLoop();
        }
        return nextEvent != null;
    }

    @Override
    public Event next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Subscription " + subscriptionId + " is closed");
        }
        Event event = requireNonNull(nextEvent);
        nextEvent = null;
        return event;
    }

    /**
     * Cancel the loop. Wakes a lock backoff immediately, interrupts an idle wait and closes the store connection, which
     * releases the lease. No checkpoint is written.
     */
    @Override
    public void close() {
        final boolean loopBusy;
        synchronized (monitor) {
            if (closed) {
                return;
            }
            closed = true;
            Thread thread = loopThread;
            loopBusy = thread != null && thread != Thread.currentThread();
            if (loopBusy && suspended) {
                interruptedByClose = true;
                thread.interrupt();
            }
            if (!state.isTerminal()) {
                state = CLOSED;
            }
        }
        closedLatch.countDown();

        SubscriptionLease current = lease;
        if (current != null && !loopBusy) {
            lease = null;
            connection = null;
            current.release();
        } else {
            closeConnection();
        }
        log.info("Closed subscription {}", subscriptionId);
        notifyStateListener(state);
    }

    public String subscriptionId() {
        return subscriptionId;
    }

    public DeliveryState state() {
        return state;
    }

    /**
     * @return The id of the last checkpointed event known to this loop, {@code null} if none.
     */
    public @Nullable String lastSeenId() {
        return lastSeenId;
    }

    public boolean isClosed() {
        return closed;
    }

    private @Nullable Event advance() {
        resumeAfterSuspension();
        try {
            while (!closed) {
                switch (state) {
                    case ACQUIRING_LOCK:
                        acquireLease();
                        break;
                    case RESUMING:
                        resume();
                        break;
                    case FETCHING:
                        fetch();
                        break;
                    case DELIVERING: {
                        Event event = batch.poll();
                        if (event != null) {
                            return event;
                        }
                        transition(CHECKPOINTING);
                        break;
                    }
                    case CHECKPOINTING:
                        checkpoint();
                        break;
                    case IDLE_WAITING:
                        idleWait();
                        break;
                    default:
                        return null;
                }
            }
            return null;
        } catch (RuntimeException e) {
            if (!closed && TransientFailures.isTransient(e)) {
                log.warn("Transient store error for subscription {} in state {}, giving up lease ({})", subscriptionId, state, e.toString());
                dropLease();
                // The transient error retry strategy backs off before the next attempt
                suspend();
            }
            throw e;
        }
    }

    private void acquireLease() {
        while (!closed) {
            Optional<SubscriptionLease> acquired = tryAcquireLease();
            if (acquired.isPresent()) {
                lease = acquired.get();
                log.info("Acquired lease of subscription {} (lockNumber={})", subscriptionId, lockNumber);
                transition(RESUMING);
                return;
            }

            logDebug("Lock {} of subscription {} is not available, retrying in {}", lockNumber, subscriptionId, config.lockRetryBackoff);
            try {
                if (closedLatch.await(config.lockRetryBackoff.toMillis(), MILLISECONDS)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close();
            }
        }
    }

    private Optional<SubscriptionLease> tryAcquireLease() {
        StoreConnection current = connection;
        if (current == null) {
            try {
                current = connectionFactory.open();
            } catch (EventBusConnectionException e) {
                log.warn("Failed to connect to the store for subscription {} ({})", subscriptionId, e.toString());
                return Optional.empty();
            }
            connection = current;
            if (closed) {
                closeConnection();
                return Optional.empty();
            }
        }

        logDebug("Trying to acquire lock {} of subscription {}", lockNumber, subscriptionId);
        try {
            return SubscriptionLease.tryAcquire(current, subscriptionId);
        } catch (RuntimeException e) {
            if (!TransientFailures.isTransient(e)) {
                throw e;
            }
            log.warn("Failed to acquire lock {} of subscription {} ({})", lockNumber, subscriptionId, e.toString());
            closeConnection();
            return Optional.empty();
        }
    }

    private void resume() {
        String checkpoint = requireLease().resume();
        lastSeenId = checkpoint;
        logDebug("Resuming subscription {} after {}", subscriptionId, checkpoint == null ? "<beginning of log>" : checkpoint);
        transition(FETCHING);
    }

    private void fetch() {
        List<Event> events = requireLease().fetchNext(config.batchSize);
        if (events.isEmpty()) {
            transition(IDLE_WAITING);
            return;
        }
        logDebug("Fetched {} event(s) for subscription {}", events.size(), subscriptionId);
        batch.addAll(events);
        pendingCheckpoint = events.get(events.size() - 1).id();
        transition(DELIVERING);
    }

    private void checkpoint() {
        String eventId = requireNonNull(pendingCheckpoint);
        requireLease().checkpoint(eventId);
        lastSeenId = eventId;
        pendingCheckpoint = null;
        logDebug("Saved checkpoint {} for subscription {}", eventId, subscriptionId);
        transition(FETCHING);
    }

    private void idleWait() {
        SubscriptionLease current = requireLease();
        suspend();
        final boolean notified;
        try {
            if (closed) {
                return;
            }
            notified = current.awaitActivity(config.maxIdleWait);
        } catch (InterruptedException e) {
            if (!closed) {
                // Interrupted by someone other than close()
                Thread.currentThread().interrupt();
                close();
            }
            return;
        } finally {
            resumeAfterSuspension();
        }
        logDebug("Subscription {} woke up ({})", subscriptionId, notified ? "notified" : "max idle wait elapsed");
        transition(FETCHING);
    }

    private void dropLease() {
        SubscriptionLease lost = lease;
        lease = null;
        batch.clear();
        pendingCheckpoint = null;
        closeConnection();
        if (lost != null) {
            log.info("Lost lease of subscription {} at {}", subscriptionId, lost.cursor());
        }
        transition(ACQUIRING_LOCK);
    }

    private void fail(RuntimeException e) {
        failure = e;
        synchronized (monitor) {
            if (state != CLOSED) {
                state = FAILED;
            }
        }
        log.error("Subscription {} failed", subscriptionId, e);
        lease = null;
        closeConnection();
        notifyStateListener(FAILED);
    }

    private SubscriptionLease requireLease() {
        SubscriptionLease current = lease;
        if (current == null) {
            throw new IllegalStateException("Subscription " + subscriptionId + " holds no lease in state " + state);
        }
        return current;
    }

    private void transition(DeliveryState next) {
        final DeliveryState previous;
        synchronized (monitor) {
            previous = state;
            if (previous.isTerminal()) {
                return;
            }
            state = next;
        }
        logDebug("Subscription {} transitioned from {} to {}", subscriptionId, previous, next);
        notifyStateListener(next);
    }

    private void notifyStateListener(DeliveryState newState) {
        try {
            stateListener.accept(newState);
        } catch (RuntimeException e) {
            log.warn("State listener of subscription {} threw an exception", subscriptionId, e);
        }
    }

    private void closeConnection() {
        StoreConnection current = connection;
        connection = null;
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close store connection of subscription {}", subscriptionId, e);
        }
    }

    private void enterLoop() {
        synchronized (monitor) {
            loopThread = Thread.currentThread();
        }
    }

    private void leaveLoop() {
        synchronized (monitor) {
            loopThread = null;
            suspended = false;
            if (interruptedByClose) {
                interruptedByClose = false;
                // Clear the interrupt sent by close() so it doesn't leak into the caller
                Thread.interrupted();
            }
        }
    }

    private void suspend() {
        synchronized (monitor) {
            suspended = true;
        }
    }

    private void resumeAfterSuspension() {
        synchronized (monitor) {
            suspended = false;
        }
    }

    private static void logDebug(String message, Object... params) {
        if (log.isDebugEnabled()) {
            log.debug(message, params);
        }
    }
}
