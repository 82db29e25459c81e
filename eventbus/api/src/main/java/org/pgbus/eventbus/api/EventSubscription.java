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

import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A scoped subscription handle returned by {@link EventBus#subscribe(String)}. Iterating blocks waiting for new events
 * and never ends by itself, it ends when the subscription is {@link #close() closed} (from any thread) or if a
 * non-recoverable error occurs. The handle can only be iterated once.
 */
public interface EventSubscription extends Iterable<Event>, AutoCloseable {

    /**
     * @return The id of the subscription
     */
    String id();

    @Override
    Iterator<Event> iterator();

    /**
     * @return The events of this subscription as an (infinite) sequential {@link Stream}.
     */
    default Stream<Event> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    /**
     * Cancel the subscription and release its lease. May be called from any thread. No checkpoint is written.
     */
    @Override
    void close();
}
