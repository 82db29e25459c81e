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

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * A subscription whose events are handed to an action in a background thread.
 * You may wish to wait ({@link #waitUntilStarted(Duration)}) for the subscription to acquire its lease before continuing.
 */
public interface BackgroundSubscription {

    /**
     * @return The id of the subscription
     */
    String id();

    /**
     * Synchronous, <strong>blocking</strong> call that returns once the subscription has acquired its lease or the
     * {@link Duration timeout} exceeds.
     *
     * @return <code>true</code> if the subscription was started within the given Duration, <code>false</code> otherwise.
     */
    boolean waitUntilStarted(Duration timeout);

    /**
     * @return <code>true</code> if the subscription is neither cancelled nor failed.
     */
    boolean isRunning();

    /**
     * @return The error that stopped the subscription, or {@code null} if it hasn't failed.
     */
    @Nullable
    Throwable failure();

    /**
     * Stop the subscription and release its lease. The checkpoint is kept.
     */
    void cancel();
}
