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
import org.pgbus.retry.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.StringJoiner;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.pgbus.retry.internal.RetryExecution.executeWithRetry;

/**
 * Runs a {@link SubscriptionDeliveryLoop} and invokes an action for each event. Meant to be submitted to an executor.
 * <p>
 * If the action throws, it's retried according to {@link SubscriptionConfig#actionRetryStrategy}. When retries are
 * exhausted the subscription stops with that failure, and since the loop is never asked for the next event, the batch
 * containing the failed event is not checkpointed.
 * </p>
 */
public class BackgroundDeliverySubscription implements BackgroundSubscription, Runnable {
    private static final Logger log = LoggerFactory.getLogger(BackgroundDeliverySubscription.class);

    private final SubscriptionDeliveryLoop loop;
    private final Consumer<Event> action;
    private final RetryStrategy retryStrategy;
    private final Consumer<BackgroundDeliverySubscription> onStop;

    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile @Nullable Throwable failure;
    private volatile boolean running = true;

    /**
     * @param onStop Invoked once, from the subscription thread, when the subscription stops
     */
    public BackgroundDeliverySubscription(String subscriptionId, SubscriptionLoopFactory loopFactory, Consumer<Event> action, RetryStrategy retryStrategy, Consumer<BackgroundDeliverySubscription> onStop) {
        this.loop = loopFactory.create(subscriptionId, state -> {
            if (state == DeliveryState.RESUMING) {
                started.countDown();
            }
        });
        this.action = action;
        this.retryStrategy = retryStrategy;
        this.onStop = onStop;
    }

    @Override
    public String id() {
        return loop.subscriptionId();
    }

    @Override
    public boolean waitUntilStarted(Duration timeout) {
        try {
            return started.await(timeout.toMillis(), MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public @Nullable Throwable failure() {
        return failure;
    }

    @Override
    public void cancel() {
        running = false;
        loop.close();
    }

    /**
     * Wait for the subscription thread to finish after {@link #cancel()} or a failure.
     *
     * @return <code>true</code> if the subscription stopped within the given Duration, <code>false</code> otherwise.
     */
    public boolean awaitStopped(Duration timeout) {
        try {
            return stopped.await(timeout.toMillis(), MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        }
    }

    public DeliveryState state() {
        return loop.state();
    }

    @Override
    public void run() {
        try {
            Consumer<Event> actionWithRetry = executeWithRetry(action, __ -> !loop.isClosed(), retryStrategy);
            while (loop.hasNext()) {
                actionWithRetry.accept(loop.next());
            }
        } catch (Throwable e) {
            if (!loop.isClosed()) {
                log.error("Background subscription {} stopped because of an error", id(), e);
                failure = e;
            }
        } finally {
            running = false;
            loop.close();
            stopped.countDown();
            onStop.accept(this);
        }
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", BackgroundDeliverySubscription.class.getSimpleName() + "[", "]")
                .add("id='" + id() + "'")
                .add("state=" + loop.state())
                .add("running=" + running)
                .toString();
    }
}
