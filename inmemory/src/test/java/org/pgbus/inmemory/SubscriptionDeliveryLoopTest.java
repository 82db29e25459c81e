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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.pgbus.eventbus.api.CheckpointWriteException;
import org.pgbus.eventbus.api.Event;
import org.pgbus.eventbus.api.EventBusConnectionException;
import org.pgbus.eventbus.api.EventBusException;
import org.pgbus.retry.RetryStrategy;
import org.pgbus.subscription.DeliveryState;
import org.pgbus.subscription.LockNumbers;
import org.pgbus.subscription.SubscriptionConfig;
import org.pgbus.subscription.SubscriptionDeliveryLoop;
import org.pgbus.subscription.spi.StoreConnectionFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("Subscription delivery loop")
@DisplayNameGeneration(ReplaceUnderscores.class)
@Timeout(20)
class SubscriptionDeliveryLoopTest {
    private static final String SUBSCRIPTION_ID = "test_client";
    private static final long LOCK_NUMBER = LockNumbers.lockNumber(SUBSCRIPTION_ID);

    private InMemoryStore store;
    private InMemoryStoreConnection publisher;
    private List<SubscriptionDeliveryLoop> loops;
    private List<Thread> consumers;

    @BeforeEach
    void create_store() {
        store = new InMemoryStore();
        publisher = store.connect();
        loops = new ArrayList<>();
        consumers = new ArrayList<>();
    }

    @AfterEach
    void close_loops() throws InterruptedException {
        loops.forEach(SubscriptionDeliveryLoop::close);
        for (Thread consumer : consumers) {
            consumer.join(5000);
        }
        publisher.close();
    }

    @Test
    void delivers_published_events_in_order_and_checkpoints_each_batch() {
        // Given
        publish("a1", "a2");
        SubscriptionDeliveryLoop loop = newLoop(store::connect, config().maxIdleWait(Duration.ofSeconds(10)).build());
        CopyOnWriteArrayList<Event> received = consumeInBackground(loop);
        await().atMost(2, SECONDS).until(() -> store.checkpoint(SUBSCRIPTION_ID).orElse(""), equalTo("a2"));
        await().atMost(2, SECONDS).until(store::waitingConnections, equalTo(1));

        // When
        publish("a3");

        // Then
        await().atMost(2, SECONDS).until(() -> store.checkpoint(SUBSCRIPTION_ID).orElse(""), equalTo("a3"));
        assertAll(
                () -> assertThat(received).extracting(Event::id).containsExactly("a1", "a2", "a3"),
                () -> assertThat(loop.lastSeenId()).isEqualTo("a3")
        );
    }

    @Test
    void resumes_after_the_checkpoint() {
        // Given
        publish("e1", "e2", "e3");
        publisher.save(SUBSCRIPTION_ID, "e1");
        SubscriptionDeliveryLoop loop = newLoop(store::connect, config().build());

        // When
        List<Event> events = List.of(loop.next(), loop.next());

        // Then
        assertThat(events).extracting(Event::id).containsExactly("e2", "e3");
    }

    @Test
    void checkpoint_is_written_only_when_the_event_after_the_last_event_of_the_batch_is_requested() {
        // Given
        publish("e1", "e2", "e3");
        SubscriptionDeliveryLoop loop = newLoop(store::connect, config().batchSize(2).build());

        // When
        loop.next();
        loop.next();
        String checkpointBeforeNextBatch = store.checkpoint(SUBSCRIPTION_ID).orElse(null);
        Event third = loop.next();

        // Then
        assertAll(
                () -> assertThat(checkpointBeforeNextBatch).isNull(),
                () -> assertThat(third.id()).isEqualTo("e3"),
                () -> assertThat(store.checkpoint(SUBSCRIPTION_ID)).hasValue("e2")
        );
    }

    @Test
    void delivers_events_even_when_notifications_are_lost() {
        // Given
        store.suppressNotifications(true);
        SubscriptionDeliveryLoop loop = newLoop(store::connect, config().maxIdleWait(Duration.ofMillis(300)).build());
        CopyOnWriteArrayList<Event> received = consumeInBackground(loop);
        await().atMost(2, SECONDS).until(loop::state, equalTo(DeliveryState.IDLE_WAITING));

        // When
        publish("e1");

        // Then
        await().atMost(3, SECONDS).untilAsserted(() -> assertThat(received).extracting(Event::id).containsExactly("e1"));
    }

    @Nested
    @DisplayName("lease")
    class LeaseTest {

        @Test
        void only_one_loop_can_consume_a_subscription_at_a_time() {
            // Given
            publish("e1", "e2");
            SubscriptionDeliveryLoop first = newLoop(store::connect, config().build());
            CopyOnWriteArrayList<Event> receivedByFirst = consumeInBackground(first);
            await().atMost(2, SECONDS).until(first::state, equalTo(DeliveryState.IDLE_WAITING));

            // When
            SubscriptionDeliveryLoop second = newLoop(store::connect, config().build());
            CopyOnWriteArrayList<Event> receivedBySecond = consumeInBackground(second);
            publish("e3");

            // Then
            await().atMost(2, SECONDS).untilAsserted(() -> assertThat(receivedByFirst).extracting(Event::id).containsExactly("e1", "e2", "e3"));
            await().during(300, MILLISECONDS).atMost(1, SECONDS).until(second::state, equalTo(DeliveryState.ACQUIRING_LOCK));
            assertThat(receivedBySecond).isEmpty();
        }

        @Test
        void another_loop_takes_over_after_the_first_is_closed_and_continues_after_its_checkpoint() {
            // Given
            publish("e1", "e2");
            SubscriptionDeliveryLoop first = newLoop(store::connect, config().build());
            CopyOnWriteArrayList<Event> receivedByFirst = consumeInBackground(first);
            await().atMost(2, SECONDS).until(() -> store.checkpoint(SUBSCRIPTION_ID).orElse(""), equalTo("e2"));
            SubscriptionDeliveryLoop second = newLoop(store::connect, config().build());
            CopyOnWriteArrayList<Event> receivedBySecond = consumeInBackground(second);

            // When
            first.close();
            await().atMost(2, SECONDS).until(second::state, equalTo(DeliveryState.IDLE_WAITING));
            publish("e3");

            // Then
            await().atMost(2, SECONDS).untilAsserted(() -> assertThat(receivedBySecond).extracting(Event::id).containsExactly("e3"));
            assertThat(receivedByFirst).extracting(Event::id).containsExactly("e1", "e2");
        }

        @Test
        void a_competitor_acquires_the_lease_within_one_backoff_when_the_holders_connection_dies() {
            // Given
            SubscriptionDeliveryLoop first = newLoop(store::connect, config().transientErrorRetryStrategy(RetryStrategy.fixed(Duration.ofSeconds(3))).build());
            consumeInBackground(first);
            await().atMost(2, SECONDS).until(first::state, equalTo(DeliveryState.IDLE_WAITING));
            SubscriptionDeliveryLoop second = newLoop(store::connect, config().lockRetryBackoff(Duration.ofMillis(200)).build());
            CopyOnWriteArrayList<Event> receivedBySecond = consumeInBackground(second);
            await().atMost(1, SECONDS).until(second::state, equalTo(DeliveryState.ACQUIRING_LOCK));

            // When
            boolean terminated = store.terminateLockHolder(LOCK_NUMBER);

            // Then
            assertThat(terminated).isTrue();
            await().atMost(1, SECONDS).until(second::state, equalTo(DeliveryState.IDLE_WAITING));
            publish("e1");
            await().atMost(2, SECONDS).untilAsserted(() -> assertThat(receivedBySecond).extracting(Event::id).containsExactly("e1"));
        }

        @Test
        void a_crash_between_delivery_and_checkpoint_redelivers_at_most_one_batch() {
            // Given
            publish("e1", "e2", "e3", "e4", "e5");
            SubscriptionDeliveryLoop crashing = newLoop(store::connect, config().batchSize(2).build());
            List<String> beforeCrash = List.of(crashing.next().id(), crashing.next().id(), crashing.next().id());

            // When
            crashing.close();
            SubscriptionDeliveryLoop recovering = newLoop(store::connect, config().batchSize(2).build());
            List<String> afterCrash = List.of(recovering.next().id(), recovering.next().id(), recovering.next().id());

            // Then
            assertAll(
                    () -> assertThat(beforeCrash).containsExactly("e1", "e2", "e3"),
                    () -> assertThat(afterCrash).containsExactly("e3", "e4", "e5")
            );
        }

        @Test
        void closing_the_loop_releases_the_lock_and_connection() {
            // Given
            publish("e1");
            SubscriptionDeliveryLoop loop = newLoop(store::connect, config().build());
            loop.next();

            // When
            loop.close();

            // Then
            assertAll(
                    () -> assertThat(store.isLocked(LOCK_NUMBER)).isFalse(),
                    () -> assertThat(store.openConnections()).isEqualTo(1), // the publisher
                    () -> assertThat(loop.state()).isEqualTo(DeliveryState.CLOSED),
                    () -> assertThat(loop.hasNext()).isFalse()
            );
        }
    }

    @Nested
    @DisplayName("store errors")
    class StoreErrorsTest {

        @Test
        void reconnects_and_resumes_after_a_transient_error_while_fetching() {
            // Given
            FaultInjectingConnectionFactory factory = new FaultInjectingConnectionFactory(store)
                    .failFetch(2, () -> new EventBusConnectionException("connection reset", null));
            publish("e1", "e2");
            SubscriptionDeliveryLoop loop = newLoop(factory, config().build());
            CopyOnWriteArrayList<Event> received = consumeInBackground(loop);

            // When
            await().atMost(3, SECONDS).until(loop::state, equalTo(DeliveryState.IDLE_WAITING));
            publish("e3");

            // Then
            await().atMost(3, SECONDS).untilAsserted(() -> assertThat(received).extracting(Event::id).containsExactly("e1", "e2", "e3"));
            assertThat(factory.openedConnections()).isEqualTo(2);
        }

        @Test
        void redelivers_the_batch_after_a_transient_error_while_checkpointing() {
            // Given
            FaultInjectingConnectionFactory factory = new FaultInjectingConnectionFactory(store)
                    .failSave(1, () -> new CheckpointWriteException(SUBSCRIPTION_ID, "e2", new EventBusConnectionException("connection reset", null)));
            publish("e1", "e2");
            SubscriptionDeliveryLoop loop = newLoop(factory, config().build());
            CopyOnWriteArrayList<Event> received = consumeInBackground(loop);

            // When
            await().atMost(3, SECONDS).until(() -> store.checkpoint(SUBSCRIPTION_ID).orElse(""), equalTo("e2"));

            // Then
            assertThat(received).extracting(Event::id).containsExactly("e1", "e2", "e1", "e2");
        }

        @Test
        void stops_with_failure_and_releases_the_lease_after_a_non_transient_error() {
            // Given
            FaultInjectingConnectionFactory factory = new FaultInjectingConnectionFactory(store)
                    .failFetch(1, () -> new EventBusException("relation \"events\" does not exist"));
            SubscriptionDeliveryLoop loop = newLoop(factory, config().build());

            // When
            Throwable throwable = catchThrowable(loop::hasNext);

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(EventBusException.class).hasMessageContaining("does not exist"),
                    () -> assertThat(loop.state()).isEqualTo(DeliveryState.FAILED),
                    () -> assertThat(store.isLocked(LOCK_NUMBER)).isFalse()
            );
        }

        @Test
        void fails_when_transient_error_retries_are_exhausted() {
            // Given
            FaultInjectingConnectionFactory factory = new FaultInjectingConnectionFactory(store)
                    .failFetch(1, () -> new EventBusConnectionException("connection reset", null))
                    .failFetch(2, () -> new EventBusConnectionException("connection reset", null));
            SubscriptionDeliveryLoop loop = newLoop(factory, config().transientErrorRetryStrategy(RetryStrategy.retry().maxAttempts(2)).build());

            // When
            Throwable throwable = catchThrowable(loop::hasNext);

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(EventBusConnectionException.class),
                    () -> assertThat(loop.state()).isEqualTo(DeliveryState.FAILED)
            );
        }
    }

    @Nested
    @DisplayName("cancellation")
    class CancellationTest {

        @Test
        void close_interrupts_an_idle_wait() throws InterruptedException {
            // Given
            SubscriptionDeliveryLoop loop = newLoop(store::connect, config().maxIdleWait(Duration.ofSeconds(30)).build());
            consumeInBackground(loop);
            await().atMost(2, SECONDS).until(loop::state, equalTo(DeliveryState.IDLE_WAITING));
            Thread consumer = consumers.get(0);

            // When
            loop.close();

            // Then
            consumer.join(2000);
            assertAll(
                    () -> assertThat(consumer.isAlive()).isFalse(),
                    () -> assertThat(loop.state()).isEqualTo(DeliveryState.CLOSED),
                    () -> assertThat(store.isLocked(LOCK_NUMBER)).isFalse()
            );
        }

        @Test
        void close_wakes_up_a_lock_backoff() throws InterruptedException {
            // Given
            InMemoryStoreConnection holder = store.connect();
            holder.tryAcquire(LOCK_NUMBER);
            SubscriptionDeliveryLoop loop = newLoop(store::connect, config().lockRetryBackoff(Duration.ofSeconds(30)).build());
            consumeInBackground(loop);
            await().pollDelay(200, MILLISECONDS).atMost(1, SECONDS).until(loop::state, equalTo(DeliveryState.ACQUIRING_LOCK));
            Thread consumer = consumers.get(0);

            // When
            loop.close();

            // Then
            consumer.join(2000);
            assertAll(
                    () -> assertThat(consumer.isAlive()).isFalse(),
                    () -> assertThat(store.isLocked(LOCK_NUMBER)).isTrue()
            );
            holder.close();
        }

        @Test
        void close_does_not_write_a_checkpoint() {
            // Given
            publish("e1", "e2");
            SubscriptionDeliveryLoop loop = newLoop(store::connect, config().build());
            loop.next();
            loop.next();

            // When
            loop.close();

            // Then
            assertThat(store.checkpoint(SUBSCRIPTION_ID)).isEmpty();
        }
    }

    private SubscriptionConfig.Builder config() {
        return SubscriptionConfig.builder()
                .lockRetryBackoff(Duration.ofMillis(100))
                .maxIdleWait(Duration.ofSeconds(1))
                .transientErrorRetryStrategy(RetryStrategy.fixed(Duration.ofMillis(50)));
    }

    private SubscriptionDeliveryLoop newLoop(StoreConnectionFactory connectionFactory, SubscriptionConfig config) {
        SubscriptionDeliveryLoop loop = new SubscriptionDeliveryLoop(SUBSCRIPTION_ID, connectionFactory, config);
        loops.add(loop);
        return loop;
    }

    private CopyOnWriteArrayList<Event> consumeInBackground(SubscriptionDeliveryLoop loop) {
        CopyOnWriteArrayList<Event> received = new CopyOnWriteArrayList<>();
        Thread consumer = new Thread(() -> loop.forEachRemaining(received::add), "consumer-" + consumers.size());
        consumer.setDaemon(true);
        consumers.add(consumer);
        consumer.start();
        return received;
    }

    private void publish(String... ids) {
        for (String id : ids) {
            publisher.append(new Event(id, "test"));
        }
    }
}
