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
import org.pgbus.eventbus.api.BackgroundSubscription;
import org.pgbus.eventbus.api.Event;
import org.pgbus.eventbus.api.EventBus;
import org.pgbus.eventbus.api.EventSubscription;
import org.pgbus.subscription.internal.ExecutorShutdown;
import org.pgbus.subscription.spi.StoreConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Base class of {@link EventBus} implementations built on {@link SubscriptionDeliveryLoop}. Keeps track of the
 * subscriptions opened through the bus so that {@link #stop()} can close them. Subclasses provide the store.
 */
public abstract class AbstractEventBus implements EventBus {
    private static final Logger log = LoggerFactory.getLogger(AbstractEventBus.class);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final SubscriptionConfig subscriptionConfig;
    private final Set<DeliveryLoopEventSubscription> subscriptions = ConcurrentHashMap.newKeySet();
    private final ConcurrentMap<String, BackgroundDeliverySubscription> backgroundSubscriptions = new ConcurrentHashMap<>();

    private volatile boolean started;
    private @Nullable ExecutorService backgroundExecutor;

    protected AbstractEventBus(SubscriptionConfig subscriptionConfig) {
        this.subscriptionConfig = requireNonNull(subscriptionConfig, SubscriptionConfig.class.getSimpleName() + " cannot be null");
    }

    /**
     * Connect to the store and create what's missing. Invoked once per {@link #start()}.
     */
    protected abstract void doStart();

    /**
     * Release the resources acquired by {@link #doStart()}. Invoked after all subscriptions are closed.
     */
    protected abstract void doStop();

    protected abstract void doPublish(Event event);

    protected abstract StoreConnectionFactory connectionFactory();

    protected abstract void deleteCheckpoint(String subscriptionId);

    @Override
    public synchronized void start() {
        if (started) {
            return;
        }
        doStart();
        backgroundExecutor = Executors.newCachedThreadPool(new SubscriptionThreadFactory(getClass().getSimpleName()));
        started = true;
        log.info("Started {}", getClass().getSimpleName());
    }

    @Override
    public synchronized void stop() {
        if (!started) {
            return;
        }
        started = false;
        List<DeliveryLoopEventSubscription> open = new ArrayList<>(subscriptions);
        open.forEach(DeliveryLoopEventSubscription::close);
        subscriptions.clear();

        backgroundSubscriptions.values().forEach(BackgroundDeliverySubscription::cancel);
        backgroundSubscriptions.clear();
        ExecutorService executor = backgroundExecutor;
        backgroundExecutor = null;
        if (executor != null) {
            ExecutorShutdown.shutdownGracefully(executor, SHUTDOWN_TIMEOUT);
        }

        doStop();
        log.info("Stopped {}", getClass().getSimpleName());
    }

    @Override
    public void publish(Event event) {
        requireNonNull(event, Event.class.getSimpleName() + " cannot be null");
        requireStarted();
        doPublish(event);
        logDebug("Published event (id={}, type={})", event.id(), event.type());
    }

    @Override
    public EventSubscription subscribe(String subscriptionId) {
        requireNonNull(subscriptionId, "Subscription id cannot be null");
        requireStarted();
        SubscriptionDeliveryLoop loop = new SubscriptionDeliveryLoop(subscriptionId, connectionFactory(), subscriptionConfig);
        DeliveryLoopEventSubscription subscription = new DeliveryLoopEventSubscription(loop, subscriptions::remove);
        subscriptions.add(subscription);
        logDebug("Subscribed (subscriptionId={})", subscriptionId);
        return subscription;
    }

    @Override
    public synchronized BackgroundSubscription subscribe(String subscriptionId, Consumer<Event> action) {
        requireNonNull(subscriptionId, "Subscription id cannot be null");
        requireNonNull(action, "Action cannot be null");
        requireStarted();
        if (backgroundSubscriptions.containsKey(subscriptionId)) {
            throw new IllegalArgumentException("Subscription " + subscriptionId + " is already defined.");
        }

        SubscriptionLoopFactory loopFactory = (id, stateListener) -> new SubscriptionDeliveryLoop(id, connectionFactory(), subscriptionConfig, stateListener);
        BackgroundDeliverySubscription subscription = new BackgroundDeliverySubscription(subscriptionId, loopFactory, action, subscriptionConfig.actionRetryStrategy,
                stopped -> backgroundSubscriptions.remove(subscriptionId, stopped));
        backgroundSubscriptions.put(subscriptionId, subscription);
        requireNonNull(backgroundExecutor).execute(subscription);
        logDebug("Started background subscription (subscriptionId={})", subscriptionId);
        return subscription;
    }

    @Override
    public synchronized void cancelSubscription(String subscriptionId) {
        requireNonNull(subscriptionId, "Subscription id cannot be null");
        logDebug("Cancelling subscription (subscriptionId={})", subscriptionId);
        BackgroundDeliverySubscription subscription = backgroundSubscriptions.remove(subscriptionId);
        if (subscription == null) {
            // The lease may belong to another bus, which would recreate the checkpoint on its next batch
            log.info("No background subscription {} in this bus, checkpoint is kept", subscriptionId);
            return;
        }
        subscription.cancel();
        if (!subscription.awaitStopped(SHUTDOWN_TIMEOUT)) {
            log.warn("Background subscription {} didn't stop within {}", subscriptionId, SHUTDOWN_TIMEOUT);
        }
        deleteCheckpoint(subscriptionId);
    }

    /**
     * @return The number of subscriptions opened with {@link #subscribe(String)} that are not yet closed
     */
    public int openSubscriptionCount() {
        return subscriptions.size();
    }

    public boolean isStarted() {
        return started;
    }

    public SubscriptionConfig subscriptionConfig() {
        return subscriptionConfig;
    }

    protected void requireStarted() {
        if (!started) {
            throw new IllegalStateException(getClass().getSimpleName() + " is not started");
        }
    }

    private static void logDebug(String message, Object... params) {
        if (log.isDebugEnabled()) {
            log.debug(message, params);
        }
    }

    private static class SubscriptionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();
        private final String prefix;

        private SubscriptionThreadFactory(String busName) {
            this.prefix = busName + "-subscription-";
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
