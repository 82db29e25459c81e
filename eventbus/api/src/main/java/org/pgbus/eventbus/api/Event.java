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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable event. The {@code id} identifies the event and defines its position in the log, ids are compared
 * lexically and are expected to be monotonic with creation time (see {@link SortableIdGenerator}).
 *
 * @param id   The id of the event, at most {@value #MAX_ID_LENGTH} characters
 * @param type The type of the event, at most {@value #MAX_TYPE_LENGTH} characters
 * @param data Optional payload
 */
public record Event(String id, String type, @Nullable Map<String, Object> data) {
    public static final int MAX_ID_LENGTH = 32;
    public static final int MAX_TYPE_LENGTH = 64;

    public Event {
        requireText(id, "id", MAX_ID_LENGTH);
        requireText(type, "type", MAX_TYPE_LENGTH);
        data = data == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public Event(String id, String type) {
        this(id, type, null);
    }

    private static void requireText(String value, String name, int maxLength) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be blank");
        }
        if (value.length() > maxLength) {
            throw new IllegalArgumentException(name + " cannot be longer than " + maxLength + " characters, was " + value.length());
        }
    }
}
