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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("Event")
@DisplayNameGeneration(ReplaceUnderscores.class)
class EventTest {

    @Test
    void data_is_copied_and_cannot_be_modified() {
        // Given
        Map<String, Object> data = new HashMap<>();
        data.put("name", "John");

        // When
        Event event = new Event("a1", "NameDefined", data);
        data.put("name", "Jane");

        // Then
        assertAll(
                () -> assertThat(event.data()).containsEntry("name", "John"),
                () -> assertThat(catchThrowable(() -> event.data().put("other", 1))).isInstanceOf(UnsupportedOperationException.class)
        );
    }

    @Test
    void data_is_optional() {
        Event event = new Event("a1", "test");

        assertThat(event.data()).isNull();
    }

    @Test
    void id_longer_than_32_characters_is_rejected() {
        Throwable throwable = catchThrowable(() -> new Event("x".repeat(33), "test"));

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageStartingWith("id cannot be longer than 32 characters");
    }

    @Test
    void type_longer_than_64_characters_is_rejected() {
        Throwable throwable = catchThrowable(() -> new Event("a1", "t".repeat(65)));

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageStartingWith("type cannot be longer than 64 characters");
    }

    @Test
    void blank_id_is_rejected() {
        Throwable throwable = catchThrowable(() -> new Event("  ", "test"));

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("id cannot be blank");
    }

    @Test
    void events_with_same_values_are_equal() {
        assertThat(new Event("a1", "test", Map.of("k", "v"))).isEqualTo(new Event("a1", "test", Map.of("k", "v")));
    }
}
