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
import org.pgbus.subscription.AbstractEventBus;
import org.pgbus.subscription.SubscriptionConfig;
import org.pgbus.subscription.spi.StoreConnectionFactory;

import static java.util.Objects.requireNonNull;

/**
 * An event bus backed by an {@link InMemoryStore}. Events and checkpoints are lost when the JVM exits.
 */
public class InMemoryEventBus extends AbstractEventBus {
    private final InMemoryStore store;
    private @Nullable InMemoryStoreConnection publisherConnection;

    public InMemoryEventBus() {
        this(new InMemoryStore(), SubscriptionConfig.defaults());
    }

    public InMemoryEventBus(InMemoryStore store, SubscriptionConfig subscriptionConfig) {
        super(subscriptionConfig);
        this.store = requireNonNull(store, InMemoryStore.class.getSimpleName() + " cannot be null");
    }

    @Override
    protected void doStart() {
        publisherConnection = store.connect();
    }

    @Override
    protected void doStop() {
        InMemoryStoreConnection connection = publisherConnection;
        publisherConnection = null;
        if (connection != null) {
            connection.close();
        }
    }

    @Override
    protected void doPublish(Event event) {
        requireNonNull(publisherConnection).append(event);
    }

    @Override
    protected StoreConnectionFactory connectionFactory() {
        return store::connect;
    }

    @Override
    protected void deleteCheckpoint(String subscriptionId) {
        store.deleteCheckpoint(subscriptionId);
    }

    public InMemoryStore store() {
        return store;
    }
}
