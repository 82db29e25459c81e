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

import org.pgbus.retry.RetryStrategy;

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Settings of a {@link SubscriptionDeliveryLoop}.
 */
public class SubscriptionConfig {
    public static final int DEFAULT_BATCH_SIZE = 5;
    public static final Duration DEFAULT_LOCK_RETRY_BACKOFF = Duration.ofSeconds(5);
    public static final Duration DEFAULT_MAX_IDLE_WAIT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_TRANSIENT_ERROR_BACKOFF = Duration.ofSeconds(5);

    /**
     * Max number of events fetched (and checkpointed) at a time.
     */
    public final int batchSize;
    /**
     * How long to wait before trying to acquire the subscription lock again after it was found taken.
     */
    public final Duration lockRetryBackoff;
    /**
     * Upper bound of an idle wait. The loop re-fetches after this long even if no notification arrived.
     */
    public final Duration maxIdleWait;
    /**
     * How to back off when the lease is lost because of a connection failure. Only transient errors are ever retried.
     */
    public final RetryStrategy transientErrorRetryStrategy;
    /**
     * How to retry the action of a background subscription that throws.
     */
    public final RetryStrategy actionRetryStrategy;

    private SubscriptionConfig(int batchSize, Duration lockRetryBackoff, Duration maxIdleWait, RetryStrategy transientErrorRetryStrategy, RetryStrategy actionRetryStrategy) {
        requireNonNull(lockRetryBackoff, "Lock retry backoff cannot be null");
        requireNonNull(maxIdleWait, "Max idle wait cannot be null");
        requireNonNull(transientErrorRetryStrategy, "Transient error " + RetryStrategy.class.getSimpleName() + " cannot be null");
        requireNonNull(actionRetryStrategy, "Action " + RetryStrategy.class.getSimpleName() + " cannot be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be greater than zero");
        }
        if (lockRetryBackoff.isNegative() || lockRetryBackoff.isZero()) {
            throw new IllegalArgumentException("Lock retry backoff must be greater than zero");
        }
        if (maxIdleWait.isNegative() || maxIdleWait.isZero()) {
            throw new IllegalArgumentException("Max idle wait must be greater than zero");
        }
        this.batchSize = batchSize;
        this.lockRetryBackoff = lockRetryBackoff;
        this.maxIdleWait = maxIdleWait;
        this.transientErrorRetryStrategy = transientErrorRetryStrategy;
        this.actionRetryStrategy = actionRetryStrategy;
    }

    public static SubscriptionConfig defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .batchSize(batchSize)
                .lockRetryBackoff(lockRetryBackoff)
                .maxIdleWait(maxIdleWait)
                .transientErrorRetryStrategy(transientErrorRetryStrategy)
                .actionRetryStrategy(actionRetryStrategy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubscriptionConfig)) return false;
        SubscriptionConfig that = (SubscriptionConfig) o;
        return batchSize == that.batchSize && Objects.equals(lockRetryBackoff, that.lockRetryBackoff) && Objects.equals(maxIdleWait, that.maxIdleWait)
                && Objects.equals(transientErrorRetryStrategy, that.transientErrorRetryStrategy) && Objects.equals(actionRetryStrategy, that.actionRetryStrategy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(batchSize, lockRetryBackoff, maxIdleWait, transientErrorRetryStrategy, actionRetryStrategy);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", SubscriptionConfig.class.getSimpleName() + "[", "]")
                .add("batchSize=" + batchSize)
                .add("lockRetryBackoff=" + lockRetryBackoff)
                .add("maxIdleWait=" + maxIdleWait)
                .add("transientErrorRetryStrategy=" + transientErrorRetryStrategy)
                .add("actionRetryStrategy=" + actionRetryStrategy)
                .toString();
    }

    public static final class Builder {
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Duration lockRetryBackoff = DEFAULT_LOCK_RETRY_BACKOFF;
        private Duration maxIdleWait = DEFAULT_MAX_IDLE_WAIT;
        private RetryStrategy transientErrorRetryStrategy = RetryStrategy.fixed(DEFAULT_TRANSIENT_ERROR_BACKOFF);
        private RetryStrategy actionRetryStrategy = RetryStrategy.none();

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder lockRetryBackoff(Duration lockRetryBackoff) {
            this.lockRetryBackoff = lockRetryBackoff;
            return this;
        }

        public Builder maxIdleWait(Duration maxIdleWait) {
            this.maxIdleWait = maxIdleWait;
            return this;
        }

        public Builder transientErrorRetryStrategy(RetryStrategy transientErrorRetryStrategy) {
            this.transientErrorRetryStrategy = transientErrorRetryStrategy;
            return this;
        }

        public Builder actionRetryStrategy(RetryStrategy actionRetryStrategy) {
            this.actionRetryStrategy = actionRetryStrategy;
            return this;
        }

        public SubscriptionConfig build() {
            return new SubscriptionConfig(batchSize, lockRetryBackoff, maxIdleWait, transientErrorRetryStrategy, actionRetryStrategy);
        }
    }
}
