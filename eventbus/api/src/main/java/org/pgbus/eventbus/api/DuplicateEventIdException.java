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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * An exception thrown if an event with the same id already exists in the log. The log is left unchanged.
 */
public class DuplicateEventIdException extends EventBusException {
    private final String eventId;

    public DuplicateEventIdException(String eventId, @Nullable Throwable cause) {
        super("Duplicate event detected with id " + eventId, cause);
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DuplicateEventIdException)) return false;
        DuplicateEventIdException that = (DuplicateEventIdException) o;
        return Objects.equals(eventId, that.eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", DuplicateEventIdException.class.getSimpleName() + "[", "]")
                .add("eventId='" + eventId + "'")
                .toString();
    }
}
