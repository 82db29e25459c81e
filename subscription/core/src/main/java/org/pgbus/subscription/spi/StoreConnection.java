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
 * A connection to the store, exclusive to one subscription lease. Locks acquired through {@link #locks()} belong to this
 * connection.
 */
public interface StoreConnection extends AutoCloseable {

    EventStore events();

    CheckpointStore checkpoints();

    LockCoordinator locks();

    NotificationWaiter notifications();

    /**
     * Close the connection, releasing every lock it holds. May be called from any thread and more than once.
     */
    @Override
    void close();
}
