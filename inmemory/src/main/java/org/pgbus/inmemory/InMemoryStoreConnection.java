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

package org.pgbus.inmemory;

import org.jspecify.annotations.Nullable;
import org.pgbus.eventbus.api.Event;
import org.pgbus.eventbus.api.EventBusConnectionException;
import org.pgbus.subscription.spi.CheckpointStore;
import org.pgbus.subscription.spi.EventStore;
import org.pgbus.subscription.spi.LockCoordinator;
import org.pgbus.subscription.spi.NotificationWaiter;
import org.pgbus.subscription.spi.StoreConnection;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * A connection to an {@link InMemoryStore}. Advisory locks acquired through it are owned by the connection and released
 * when it's closed. Every operation on a closed connection throws {@link EventBusConnectionException}.
 */
public class InMemoryStoreConnection implements StoreConnection, EventStore, CheckpointStore, LockCoordinator, NotificationWaiter {
    private final InMemoryStore store;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    InMemoryStoreConnection(InMemoryStore store) {
        this.store = store;
    }

    @Override
    public EventStore events() {
        return this;
    }

    @Override
    public CheckpointStore checkpoints() {
        return this;
    }

    @Override
    public LockCoordinator locks() {
        return this;
    }

    @Override
    public NotificationWaiter notifications() {
        return this;
    }

    @Override
    public void append(Event event) {
        requireNonNull(event, Event.class.getSimpleName() + " cannot be null");
        ensureOpen();
        store.append(event);
    }

    @Override
    public List<Event> fetchAfter(@Nullable String afterId, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be greater than zero");
        }
        ensureOpen();
        return store.fetchAfter(afterId, limit);
    }

    @Override
    public void save(String subscriptionId, String eventId) {
        ensureOpen();
        store.saveCheckpoint(subscriptionId, eventId);
    }

    @Override
    public Optional<String> load(String subscriptionId) {
        ensureOpen();
        return store.loadCheckpoint(subscriptionId);
    }

    @Override
    public void delete(String subscriptionId) {
        ensureOpen();
        store.deleteCheckpoint(subscriptionId);
    }

    @Override
    public boolean tryAcquire(long lockNumber) {
        ensureOpen();
        return store.tryLock(lockNumber, this);
    }

    @Override
    public void release(long lockNumber) {
        ensureOpen();
        store.unlock(lockNumber, this);
    }

    @Override
    public boolean waitForActivity(Duration maxWait) throws InterruptedException {
        requireNonNull(maxWait, "Max wait cannot be null");
        ensureOpen();
        return store.awaitActivity(this, maxWait);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            store.closed(this);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    void ensureOpen() {
        if (closed.get()) {
            throw new EventBusConnectionException("Connection is closed", null);
        }
    }
}
