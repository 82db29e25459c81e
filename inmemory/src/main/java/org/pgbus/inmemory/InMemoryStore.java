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
import org.pgbus.eventbus.api.DuplicateEventIdException;
import org.pgbus.eventbus.api.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The shared state behind {@link InMemoryStoreConnection}s: the event log ordered by id, the checkpoints, the owners of
 * advisory locks and the notification channel.
 */
public class InMemoryStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition activity = lock.newCondition();

    // Guarded by lock
    private final NavigableMap<String, Event> events = new TreeMap<>();
    private final Map<String, String> checkpoints = new HashMap<>();
    private final Map<Long, InMemoryStoreConnection> lockOwners = new HashMap<>();
    private long notificationCount;
    private int waiting;
    private boolean notificationsSuppressed;

    private final Set<InMemoryStoreConnection> connections = ConcurrentHashMap.newKeySet();

    public InMemoryStoreConnection connect() {
        InMemoryStoreConnection connection = new InMemoryStoreConnection(this);
        connections.add(connection);
        return connection;
    }

    /**
     * Stop (or resume) broadcasting wake signals on append, to simulate lost notifications.
     */
    public void suppressNotifications(boolean suppress) {
        lock.lock();
        try {
            notificationsSuppressed = suppress;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close the connection holding the given advisory lock, as if its session was terminated.
     *
     * @return <code>true</code> if a connection held the lock
     */
    public boolean terminateLockHolder(long lockNumber) {
        final InMemoryStoreConnection owner;
        lock.lock();
        try {
            owner = lockOwners.get(lockNumber);
        } finally {
            lock.unlock();
        }
        if (owner == null) {
            return false;
        }
        log.debug("Terminating connection holding lock {}", lockNumber);
        owner.close();
        return true;
    }

    public List<Event> allEvents() {
        lock.lock();
        try {
            return new ArrayList<>(events.values());
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> checkpoint(String subscriptionId) {
        return loadCheckpoint(subscriptionId);
    }

    public boolean isLocked(long lockNumber) {
        lock.lock();
        try {
            return lockOwners.containsKey(lockNumber);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The number of connections currently waiting for a notification
     */
    public int waitingConnections() {
        lock.lock();
        try {
            return waiting;
        } finally {
            lock.unlock();
        }
    }

    public int openConnections() {
        return connections.size();
    }

    void append(Event event) {
        lock.lock();
        try {
            if (events.containsKey(event.id())) {
                throw new DuplicateEventIdException(event.id(), null);
            }
            events.put(event.id(), event);
            if (!notificationsSuppressed) {
                // Payload "<id>:<type>" is only informative, waiters re-fetch
                log.trace("Notify {}:{}", event.id(), event.type());
                notificationCount++;
                activity.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    List<Event> fetchAfter(@Nullable String afterId, int limit) {
        lock.lock();
        try {
            NavigableMap<String, Event> candidates = afterId == null ? events : events.tailMap(afterId, false);
            List<Event> result = new ArrayList<>(Math.min(limit, candidates.size()));
            for (Event event : candidates.values()) {
                if (result.size() == limit) {
                    break;
                }
                result.add(event);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    void saveCheckpoint(String subscriptionId, String eventId) {
        lock.lock();
        try {
            checkpoints.put(subscriptionId, eventId);
        } finally {
            lock.unlock();
        }
    }

    Optional<String> loadCheckpoint(String subscriptionId) {
        lock.lock();
        try {
            return Optional.ofNullable(checkpoints.get(subscriptionId));
        } finally {
            lock.unlock();
        }
    }

    void deleteCheckpoint(String subscriptionId) {
        lock.lock();
        try {
            checkpoints.remove(subscriptionId);
        } finally {
            lock.unlock();
        }
    }

    boolean tryLock(long lockNumber, InMemoryStoreConnection connection) {
        lock.lock();
        try {
            InMemoryStoreConnection owner = lockOwners.putIfAbsent(lockNumber, connection);
            return owner == null || owner == connection;
        } finally {
            lock.unlock();
        }
    }

    void unlock(long lockNumber, InMemoryStoreConnection connection) {
        lock.lock();
        try {
            lockOwners.remove(lockNumber, connection);
        } finally {
            lock.unlock();
        }
    }

    boolean awaitActivity(InMemoryStoreConnection connection, Duration maxWait) throws InterruptedException {
        lock.lock();
        try {
            long armedAt = notificationCount;
            long nanos = maxWait.toNanos();
            waiting++;
            try {
                while (notificationCount == armedAt && !connection.isClosed()) {
                    if (nanos <= 0) {
                        return false;
                    }
                    nanos = activity.awaitNanos(nanos);
                }
            } finally {
                waiting--;
            }
            connection.ensureOpen();
            return true;
        } finally {
            lock.unlock();
        }
    }

    void closed(InMemoryStoreConnection connection) {
        connections.remove(connection);
        lock.lock();
        try {
            lockOwners.values().removeIf(owner -> owner == connection);
            // Wake up waits on the closed connection
            activity.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return InMemoryStore.class.getSimpleName() + "[events=" + events.size() + ", checkpoints=" + checkpoints + ", locks=" + lockOwners.keySet() + "]";
        } finally {
            lock.unlock();
        }
    }
}
