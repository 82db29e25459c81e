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
import org.pgbus.subscription.spi.StoreConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Exclusive right to consume a subscription, backed by an advisory lock held by a dedicated {@link StoreConnection}.
 * The lease keeps the cursor ({@code lastSeenId}) of the subscription. It lives as long as its connection, closing the
 * connection releases the lock.
 * <p>
 * A lease is confined to the thread running the delivery loop, except for {@link #close()}.
 */
public class SubscriptionLease implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionLease.class);

    private final String subscriptionId;
    private final long lockNumber;
    private final StoreConnection connection;
    private volatile @Nullable String cursor;

    private SubscriptionLease(String subscriptionId, long lockNumber, StoreConnection connection) {
        this.subscriptionId = subscriptionId;
        this.lockNumber = lockNumber;
        this.connection = connection;
    }

    /**
     * Try to acquire the lease of {@code subscriptionId} on the given connection, without blocking.
     *
     * @return The lease, or empty if another connection holds the lock of the subscription
     */
    public static Optional<SubscriptionLease> tryAcquire(StoreConnection connection, String subscriptionId) {
        Objects.requireNonNull(connection, StoreConnection.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(subscriptionId, "Subscription id cannot be null");
        long lockNumber = LockNumbers.lockNumber(subscriptionId);
        if (connection.locks().tryAcquire(lockNumber)) {
            return Optional.of(new SubscriptionLease(subscriptionId, lockNumber, connection));
        }
        return Optional.empty();
    }

    /**
     * Load the checkpoint of the subscription and move the cursor to it.
     *
     * @return The new cursor, {@code null} if the subscription has never been checkpointed
     */
    public @Nullable String resume() {
        cursor = connection.checkpoints().load(subscriptionId).orElse(null);
        return cursor;
    }

    public List<Event> fetchNext(int limit) {
        return connection.events().fetchAfter(cursor, limit);
    }

    /**
     * Persist {@code eventId} as checkpoint and move the cursor to it.
     */
    public void checkpoint(String eventId) {
        connection.checkpoints().save(subscriptionId, eventId);
        cursor = eventId;
    }

    public boolean awaitActivity(Duration maxWait) throws InterruptedException {
        return connection.notifications().waitForActivity(maxWait);
    }

    /**
     * Release the lock explicitly and close the connection. Must not be called while another thread uses the connection.
     */
    public void release() {
        try {
            connection.locks().release(lockNumber);
        } catch (RuntimeException e) {
            log.warn("Failed to release lock {} of subscription {}, closing the connection instead", lockNumber, subscriptionId, e);
        } finally {
            connection.close();
        }
    }

    /**
     * Close the connection, which releases the lock implicitly.
     */
    @Override
    public void close() {
        connection.close();
    }

    public String subscriptionId() {
        return subscriptionId;
    }

    public long lockNumber() {
        return lockNumber;
    }

    public StoreConnection connection() {
        return connection;
    }

    public @Nullable String cursor() {
        return cursor;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", SubscriptionLease.class.getSimpleName() + "[", "]")
                .add("subscriptionId='" + subscriptionId + "'")
                .add("lockNumber=" + lockNumber)
                .add("cursor='" + cursor + "'")
                .toString();
    }
}
