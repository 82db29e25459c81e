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

package org.pgbus.subscription;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.pgbus.eventbus.api.CheckpointWriteException;
import org.pgbus.eventbus.api.DuplicateEventIdException;
import org.pgbus.eventbus.api.EventBusConnectionException;
import org.pgbus.eventbus.api.EventBusException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
@DisplayName("Transient failures")
class TransientFailuresTest {

    @Test
    void connection_failures_are_transient() {
        assertThat(TransientFailures.isTransient(new EventBusConnectionException("connection refused", null))).isTrue();
    }

    @Test
    void checkpoint_write_failures_are_transient_only_when_caused_by_a_connection_failure() {
        assertAll(
                () -> assertThat(TransientFailures.isTransient(new CheckpointWriteException("s", "e1", new EventBusConnectionException("reset", null)))).isTrue(),
                () -> assertThat(TransientFailures.isTransient(new CheckpointWriteException("s", "e1", new EventBusException("constraint violation")))).isFalse()
        );
    }

    @Test
    void other_errors_are_not_transient() {
        assertAll(
                () -> assertThat(TransientFailures.isTransient(new DuplicateEventIdException("e1", null))).isFalse(),
                () -> assertThat(TransientFailures.isTransient(new EventBusException("syntax error"))).isFalse(),
                () -> assertThat(TransientFailures.isTransient(new IllegalStateException())).isFalse()
        );
    }
}
