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

import org.jspecify.annotations.Nullable;
import org.pgbus.eventbus.api.DuplicateEventIdException;
import org.pgbus.eventbus.api.Event;

import java.util.List;

/**
 * The append-only log of events, ordered by event id.
 */
public interface EventStore {

    /**
     * Append an event and broadcast a wake signal (payload {@code "<id>:<type>"}) to waiting subscribers.
     * Listeners must not be woken before the event is visible to them.
     *
     * @throws DuplicateEventIdException If an event with the same id is already stored. Nothing is written in this case.
     */
    void append(Event event);

    /**
     * Fetch up to {@code limit} events with an id greater than {@code afterId}, in ascending id order.
     *
     * @param afterId Exclusive lower bound, or {@code null} to read from the beginning of the log
     * @param limit   Max number of events to return, must be greater than zero
     */
    List<Event> fetchAfter(@Nullable String afterId, int limit);
}
