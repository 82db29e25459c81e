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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.pgbus.retry.RetryStrategy;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("Subscription config")
@DisplayNameGeneration(ReplaceUnderscores.class)
class SubscriptionConfigTest {

    @Test
    void defaults_are_batch_size_5_lock_backoff_5_seconds_and_max_idle_wait_10_seconds() {
        SubscriptionConfig config = SubscriptionConfig.defaults();

        assertAll(
                () -> assertThat(config.batchSize).isEqualTo(5),
                () -> assertThat(config.lockRetryBackoff).isEqualTo(Duration.ofSeconds(5)),
                () -> assertThat(config.maxIdleWait).isEqualTo(Duration.ofSeconds(10)),
                () -> assertThat(config.actionRetryStrategy).isSameAs(RetryStrategy.none())
        );
    }

    @Test
    void to_builder_keeps_all_settings() {
        // Given
        SubscriptionConfig config = SubscriptionConfig.builder().batchSize(2).lockRetryBackoff(Duration.ofMillis(100)).maxIdleWait(Duration.ofMillis(200)).build();

        // When
        SubscriptionConfig copy = config.toBuilder().build();

        // Then
        assertThat(copy).isEqualTo(config);
    }

    @Test
    void batch_size_must_be_positive() {
        Throwable throwable = catchThrowable(() -> SubscriptionConfig.builder().batchSize(0).build());

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Batch size must be greater than zero");
    }

    @Test
    void lock_retry_backoff_must_be_positive() {
        Throwable throwable = catchThrowable(() -> SubscriptionConfig.builder().lockRetryBackoff(Duration.ZERO).build());

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Lock retry backoff must be greater than zero");
    }

    @Test
    void max_idle_wait_must_be_positive() {
        Throwable throwable = catchThrowable(() -> SubscriptionConfig.builder().maxIdleWait(Duration.ZERO).build());

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Max idle wait must be greater than zero");
    }
}
