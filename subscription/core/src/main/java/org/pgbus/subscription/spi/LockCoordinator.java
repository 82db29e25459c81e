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

/**
 * Session scoped mutual exclusion keyed by a 64-bit number. A lock is owned by the connection that acquired it and is
 * released implicitly when that connection closes.
 */
public interface LockCoordinator {

    /**
     * Try to acquire the lock without blocking.
     *
     * @return <code>true</code> if the lock was acquired, <code>false</code> if it's held by someone else.
     */
    boolean tryAcquire(long lockNumber);

    void release(long lockNumber);
}
