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

package org.pgbus.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.pgbus.retry.RetryStrategy.Retry;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.pgbus.retry.internal.RetryExecution.executeWithRetry;

@DisplayName("Retry Strategy")
@DisplayNameGeneration(ReplaceUnderscores.class)
@Timeout(10)
public class RetryStrategyTest {

    @Test
    void does_not_retry_when_retry_strategy_is_none() {
        // Given
        RetryStrategy retryStrategy = RetryStrategy.none();

        AtomicInteger counter = new AtomicInteger(0);

        // When
        Throwable throwable = catchThrowable(() -> retryStrategy.execute(() -> {
            if (counter.incrementAndGet() == 1) {
                throw new IllegalArgumentException("expected");
            }
        }));

        // Then
        assertAll(
                () -> assertThat(counter).hasValue(1),
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("expected")
        );
    }

    @Test
    void retries_until_the_runnable_succeeds() {
        // Given
        Retry retryStrategy = RetryStrategy.retry();
        AtomicInteger counter = new AtomicInteger(0);

        // When
        retryStrategy.execute(() -> {
            if (counter.incrementAndGet() < 3) {
                throw new IllegalStateException("expected");
            }
        });

        // Then
        assertThat(counter).hasValue(3);
    }

    @Test
    void supplier_result_is_returned_once_it_succeeds() {
        // Given
        AtomicInteger counter = new AtomicInteger(0);
        Supplier<String> supplier = executeWithRetry(() -> {
            if (counter.incrementAndGet() < 3) {
                throw new IllegalStateException("expected");
            }
            return "done";
        }, __ -> true, RetryStrategy.retry());

        // When
        String result = supplier.get();

        // Then
        assertAll(
                () -> assertThat(result).isEqualTo("done"),
                () -> assertThat(counter).hasValue(3)
        );
    }

    @Test
    void rethrows_last_error_when_max_attempts_is_exhausted() {
        // Given
        Retry retryStrategy = RetryStrategy.retry().maxAttempts(4);
        AtomicInteger counter = new AtomicInteger(0);

        // When
        Throwable throwable = catchThrowable(() -> retryStrategy.execute(() -> {
            throw new IllegalArgumentException("expected" + counter.incrementAndGet());
        }));

        // Then
        assertAll(
                () -> assertThat(counter).hasValue(4),
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("expected4")
        );
    }

    @Test
    void does_not_retry_errors_that_do_not_match_retry_predicate() {
        // Given
        Retry retryStrategy = RetryStrategy.retry().retryIf(IllegalStateException.class::isInstance);
        AtomicInteger counter = new AtomicInteger(0);

        // When
        Throwable throwable = catchThrowable(() -> retryStrategy.execute(() -> {
            counter.incrementAndGet();
            throw new IllegalArgumentException("expected");
        }));

        // Then
        assertAll(
                () -> assertThat(counter).hasValue(1),
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class)
        );
    }

    @Test
    void stops_retrying_when_shutdown_predicate_returns_false() {
        // Given
        AtomicBoolean shutdown = new AtomicBoolean(false);
        AtomicInteger counter = new AtomicInteger(0);
        Runnable runnable = executeWithRetry((Runnable) () -> {
            if (counter.incrementAndGet() == 2) {
                shutdown.set(true);
            }
            throw new IllegalStateException("expected");
        }, __ -> !shutdown.get(), RetryStrategy.retry());

        // When
        Throwable throwable = catchThrowable(runnable::run);

        // Then
        assertAll(
                () -> assertThat(counter).hasValue(2),
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class)
        );
    }

    @Nested
    @DisplayName("Backoff")
    class BackoffTest {

        @Test
        void fixed_backoff_waits_between_attempts() {
            // Given
            Retry retryStrategy = RetryStrategy.fixed(Duration.ofMillis(100)).maxAttempts(3);
            long start = System.nanoTime();

            // When
            catchThrowable(() -> retryStrategy.execute(() -> {
                throw new IllegalStateException("expected");
            }));

            // Then
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(200));
        }

        @Test
        void exponential_backoff_is_capped_by_max() {
            // Given
            Retry retryStrategy = RetryStrategy.exponentialBackoff(Duration.ofMillis(10), Duration.ofMillis(40), 4.0).maxAttempts(4);
            long start = System.nanoTime();

            // When
            catchThrowable(() -> retryStrategy.execute(() -> {
                throw new IllegalStateException("expected");
            }));

            // Then
            // 10 + 40 + 40
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(90)).isLessThan(Duration.ofSeconds(5));
        }

        @Test
        void fixed_backoff_must_be_positive() {
            Throwable throwable = catchThrowable(() -> Backoff.fixed(0));

            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Millis must be greater than zero");
        }
    }

    @Nested
    @DisplayName("Listeners")
    class ListenersTest {

        @Test
        void error_listener_is_invoked_for_every_error_and_retryable_listener_only_for_retried_ones() {
            // Given
            CopyOnWriteArrayList<Throwable> errors = new CopyOnWriteArrayList<>();
            CopyOnWriteArrayList<Throwable> retryableErrors = new CopyOnWriteArrayList<>();
            Retry retryStrategy = RetryStrategy.retry()
                    .maxAttempts(3)
                    .onError(errors::add)
                    .onRetryableError(retryableErrors::add);

            // When
            catchThrowable(() -> retryStrategy.execute(() -> {
                throw new IllegalStateException("expected");
            }));

            // Then
            assertAll(
                    () -> assertThat(errors).hasSize(3),
                    () -> assertThat(retryableErrors).hasSize(2)
            );
        }

        @Test
        void retry_strategy_is_immutable() {
            // Given
            Retry original = RetryStrategy.retry();

            // When
            Retry changed = original.maxAttempts(2);

            // Then
            assertThat(changed).isNotEqualTo(original);
        }
    }
}
