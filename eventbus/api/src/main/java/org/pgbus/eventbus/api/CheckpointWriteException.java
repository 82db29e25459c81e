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
 * Thrown when the checkpoint of a subscription couldn't be written. Transient if the {@link #getCause() cause} is an
 * {@link EventBusConnectionException}.
 */
public class CheckpointWriteException extends EventBusException {
    private final String subscriptionId;
    private final String eventId;

    public CheckpointWriteException(String subscriptionId, String eventId, @Nullable Throwable cause) {
        super("Failed to save checkpoint " + eventId + " for subscription " + subscriptionId, cause);
        this.subscriptionId = subscriptionId;
        this.eventId = eventId;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public String getEventId() {
        return eventId;
    }

    public boolean isCausedByConnectionFailure() {
        return getCause() instanceof EventBusConnectionException;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CheckpointWriteException)) return false;
        CheckpointWriteException that = (CheckpointWriteException) o;
        return Objects.equals(subscriptionId, that.subscriptionId) && Objects.equals(eventId, that.eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subscriptionId, eventId);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", CheckpointWriteException.class.getSimpleName() + "[", "]")
                .add("subscriptionId='" + subscriptionId + "'")
                .add("eventId='" + eventId + "'")
                .add("cause=" + getCause())
                .toString();
    }
}
