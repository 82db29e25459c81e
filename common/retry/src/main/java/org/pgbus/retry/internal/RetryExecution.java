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

package org.pgbus.retry.internal;

import org.pgbus.retry.Backoff;
import org.pgbus.retry.MaxAttempts;
import org.pgbus.retry.RetryStrategy;
import org.pgbus.retry.RetryStrategy.DontRetry;

import java.util.Iterator;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Internal class for executing functions with retry capability. Never use this class directly from your own code!
 */
public class RetryExecution {

    /**
     * @param shutdownPredicate Retrying stops as soon as this predicate returns {@code false}, e.g. when the caller is shutting down.
     */
    public static <T> Supplier<T> executeWithRetry(Supplier<T> supplier, Predicate<Throwable> shutdownPredicate, RetryStrategy retryStrategy) {
        if (retryStrategy instanceof DontRetry) {
            return supplier;
        }
        RetryImpl retry = applyShutdownPredicate(shutdownPredicate, retryStrategy);
        return () -> execute(supplier, retry, convertToDelayStream(retry.backoff));
    }

    public static Runnable executeWithRetry(Runnable runnable, Predicate<Throwable> shutdownPredicate, RetryStrategy retryStrategy) {
        Supplier<Void> supplier = executeWithRetry(() -> {
            runnable.run();
            return null;
        }, shutdownPredicate, retryStrategy);
        return supplier::get;
    }

    public static <T> Consumer<T> executeWithRetry(Consumer<T> fn, Predicate<Throwable> shutdownPredicate, RetryStrategy retryStrategy) {
        return t -> executeWithRetry(() -> fn.accept(t), shutdownPredicate, retryStrategy).run();
    }

    private static RetryImpl applyShutdownPredicate(Predicate<Throwable> shutdownPredicate, RetryStrategy retryStrategy) {
        RetryImpl retry = (RetryImpl) retryStrategy;
        return retry.retryIf(shutdownPredicate.and(retry.retryPredicate));
    }

    private static <T> T execute(Supplier<T> supplier, RetryImpl retry, Iterator<Long> delay) {
        int attempt = 1;
        for (; ; ) {
            long backoffMillis = delay.next();
            try {
                return supplier.get();
            } catch (Throwable e) {
                boolean shouldRetryAgain = !isExhausted(attempt, retry.maxAttempts) && retry.retryPredicate.test(e);
                retry.errorListener.accept(e);
                if (!shouldRetryAgain) {
                    return rethrow(e);
                }
                retry.retryableErrorListener.accept(e);

                if (backoffMillis > 0) {
                    try {
                        TimeUnit.MILLISECONDS.sleep(backoffMillis);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        return rethrow(e);
                    }
                }
                attempt++;
            }
        }
    }

    // Lets checked exceptions thrown by the action escape unchanged
    @SuppressWarnings("unchecked")
    private static <T, E extends Throwable> T rethrow(Throwable t) throws E {
        throw (E) t;
    }

    private static boolean isExhausted(int attempt, MaxAttempts maxAttempts) {
        if (maxAttempts instanceof MaxAttempts.Infinite) {
            return false;
        }
        return attempt >= ((MaxAttempts.Limit) maxAttempts).limit();
    }

    private static Iterator<Long> convertToDelayStream(Backoff backoff) {
        final Stream<Long> delay;
        if (backoff instanceof Backoff.None) {
            delay = Stream.iterate(0L, __ -> 0L);
        } else if (backoff instanceof Backoff.Fixed fixed) {
            long millis = fixed.millis();
            delay = Stream.iterate(millis, __ -> millis);
        } else if (backoff instanceof Backoff.Exponential strategy) {
            long initialMillis = strategy.initial().toMillis();
            long maxMillis = strategy.max().toMillis();
            double multiplier = strategy.multiplier();
            delay = Stream.iterate(initialMillis, current -> Math.min(maxMillis, Math.round(current * multiplier)));
        } else {
            throw new IllegalStateException("Invalid backoff: " + backoff.getClass().getName());
        }
        return delay.iterator();
    }
}
