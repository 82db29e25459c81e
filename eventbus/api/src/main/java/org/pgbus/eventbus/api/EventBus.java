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

package org.pgbus.eventbus.api;

import java.util.function.Consumer;

/**
 * A durable, ordered, at-least-once publish/subscribe event bus.
 * <p>
 * Events are appended to a shared log and delivered to subscriptions in ascending id order. Each subscription has a durable
 * checkpoint and at most one live consumer at any time across all processes sharing the same store.
 * </p>
 */
public interface EventBus {

    /**
     * Connect to the store and create the tables the bus needs if they don't exist. Calling {@code start} more than once
     * has no additional effect.
     *
     * @throws EventBusConnectionException If the store cannot be reached
     */
    void start();

    /**
     * Close all subscriptions opened through this bus and release its resources. Safe to call several times and when the bus
     * was never started.
     */
    void stop();

    /**
     * Append an event to the log and wake up waiting subscribers. The event is durable once this method returns.
     *
     * @param event The event to publish
     * @throws DuplicateEventIdException If an event with the same id already exists
     * @throws IllegalStateException     If the bus is not started
     */
    void publish(Event event);

    /**
     * Subscribe to the log using the given subscription id. The returned handle yields an infinite ordered sequence of events
     * starting right after the last checkpoint of the subscription. Blocks (when iterated) until the subscription lease
     * is acquired, which only happens when no other consumer holds the same subscription id.
     * <p>
     * Always close the subscription, preferably using try-with-resources:
     * <pre>
     * try (EventSubscription subscription = eventBus.subscribe("orders")) {
     *     for (Event event : subscription) {
     *         ...
     *     }
     * }
     * </pre>
     *
     * @param subscriptionId The id of the subscription, at most {@value Event#MAX_ID_LENGTH} characters
     * @return A handle that can be iterated once
     */
    EventSubscription subscribe(String subscriptionId);

    /**
     * Subscribe to the log and invoke {@code action} for each event in a background thread.
     *
     * @param subscriptionId The id of the subscription
     * @param action         The action to invoke for each event
     * @return A handle to the running background subscription
     */
    BackgroundSubscription subscribe(String subscriptionId, Consumer<Event> action);

    /**
     * Cancel the background subscription with the given id and delete its checkpoint so that a later subscription with
     * the same id starts from the beginning of the log. Does nothing if no such subscription is running in this bus,
     * the checkpoint is then left to whoever holds the lease.
     *
     * @param subscriptionId The id of the subscription to cancel
     */
    void cancelSubscription(String subscriptionId);
}
