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

package org.pgbus.subscription.spi;

import java.time.Duration;

/**
 * Waits for wake signals broadcast by {@link EventStore#append}. Each call arms a new wait; signals sent before the
 * wait was armed never end it.
 */
public interface NotificationWaiter {

    /**
     * Block until a signal arrives or {@code maxWait} elapses.
     *
     * @return <code>true</code> if woken by a signal, <code>false</code> on timeout.
     * @throws InterruptedException If the waiting thread is interrupted
     */
    boolean waitForActivity(Duration maxWait) throws InterruptedException;
}
