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

package org.pgbus.example;

import org.pgbus.eventbus.api.Event;
import org.pgbus.eventbus.api.EventBus;
import org.pgbus.eventbus.api.EventBusConnectionException;
import org.pgbus.eventbus.api.EventSubscription;
import org.pgbus.eventbus.api.SortableIdGenerator;
import org.pgbus.postgresql.PostgresEventBus;
import org.pgbus.postgresql.PostgresEventBusConfig;
import org.pgbus.retry.RetryStrategy;
import org.pgbus.subscription.SubscriptionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Publishes an event of type {@code test} every three seconds, or, when started with a subscription id as argument,
 * consumes that subscription and logs every event it receives. The database is read from {@code DATABASE_URL}.
 */
public class ProducerConsumerApplication {
    private static final Logger log = LoggerFactory.getLogger(ProducerConsumerApplication.class);

    static final String EVENT_TYPE = "test";
    private static final Duration PUBLISH_INTERVAL = Duration.ofSeconds(3);

    private final EventBus eventBus;
    private final Duration publishInterval;
    private final RetryStrategy publishRetryStrategy;
    private final CountDownLatch shutdown = new CountDownLatch(1);
    private volatile EventSubscription subscription;

    public ProducerConsumerApplication(EventBus eventBus) {
        this(eventBus, PUBLISH_INTERVAL, publishRetryStrategy(Duration.ofSeconds(1)));
    }

    ProducerConsumerApplication(EventBus eventBus, Duration publishInterval, RetryStrategy publishRetryStrategy) {
        this.eventBus = eventBus;
        this.publishInterval = publishInterval;
        this.publishRetryStrategy = publishRetryStrategy;
    }

    /**
     * Retries publishing while the database is unreachable, other errors are rethrown right away
     */
    static RetryStrategy publishRetryStrategy(Duration backoff) {
        return RetryStrategy.fixed(backoff)
                .maxAttempts(5)
                .retryIf(EventBusConnectionException.class::isInstance)
                .onError(e -> log.warn("Failed to publish event ({})", e.getMessage()));
    }

    public static void main(String[] args) throws InterruptedException {
        String databaseUrl = System.getenv("DATABASE_URL");
        if (databaseUrl == null || databaseUrl.isBlank()) {
            log.error("DATABASE_URL is not set");
            System.exit(1);
        }

        SubscriptionConfig subscriptionConfig = SubscriptionConfig.builder()
                .transientErrorRetryStrategy(RetryStrategy.exponentialBackoff(Duration.ofMillis(500), Duration.ofSeconds(30), 2.0)
                        .onRetryableError(e -> log.warn("Lost connection to the database, reconnecting ({})", e.getMessage())))
                .build();
        PostgresEventBus eventBus = new PostgresEventBus(PostgresEventBusConfig.builder(DatabaseUrl.parse(databaseUrl).toDataSource())
                .subscriptionConfig(subscriptionConfig)
                .build());
        eventBus.start();
        ProducerConsumerApplication application = new ProducerConsumerApplication(eventBus);
        Runtime.getRuntime().addShutdownHook(new Thread(application::shutdown));

        if (args.length == 0) {
            log.info("Starting producer");
            application.produce(SortableIdGenerator.timeBased());
        } else {
            log.info("Starting consumer (subscriptionId={})", args[0]);
            application.consume(args[0]);
        }
    }

    void produce(SortableIdGenerator ids) throws InterruptedException {
        while (!shutdown.await(publishInterval.toMillis(), TimeUnit.MILLISECONDS)) {
            Event event = new Event(ids.next(), EVENT_TYPE);
            publishRetryStrategy.execute(() -> eventBus.publish(event));
            log.info("Published {}", event);
        }
    }

    void consume(String subscriptionId) {
        try (EventSubscription subscription = eventBus.subscribe(subscriptionId)) {
            this.subscription = subscription;
            for (Event event : subscription) {
                log.info("Received {}", event);
            }
        }
    }

    void shutdown() {
        log.info("Shutting down");
        shutdown.countDown();
        EventSubscription current = subscription;
        if (current != null) {
            current.close();
        }
        eventBus.stop();
    }
}
