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

package org.pgbus.postgresql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.pgbus.eventbus.api.DuplicateEventIdException;
import org.pgbus.eventbus.api.Event;
import org.pgbus.eventbus.api.EventBusException;
import org.pgbus.subscription.spi.EventStore;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCallback;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;

import static org.pgbus.postgresql.PostgresExceptionTranslator.translateException;

/**
 * Stores events in a table keyed by event id. The insert and the {@code pg_notify} signal are issued in the same
 * transaction, so listeners are only woken once the event is committed.
 */
class PostgresEventStore implements EventStore {
    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final String channel;
    private final String insertSql;
    private final String fetchAllSql;
    private final String fetchAfterSql;
    private final RowMapper<Event> eventRowMapper;

    PostgresEventStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, PostgresEventBusConfig config) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = config.objectMapper;
        this.channel = config.channel;
        this.insertSql = "INSERT INTO " + config.eventsTable + " (id, type, data) VALUES (?, ?, CAST(? AS JSONB))";
        this.fetchAllSql = "SELECT id, type, data FROM " + config.eventsTable + " ORDER BY id LIMIT ?";
        this.fetchAfterSql = "SELECT id, type, data FROM " + config.eventsTable + " WHERE id > ? ORDER BY id LIMIT ?";
        this.eventRowMapper = (rs, rowNum) -> new Event(rs.getString("id"), rs.getString("type"), readData(rs.getString("id"), rs.getString("data")));
    }

    @Override
    public void append(Event event) {
        String data = writeData(event);
        try {
            transactionTemplate.executeWithoutResult(status -> {
                jdbcTemplate.update(insertSql, event.id(), event.type(), data);
                jdbcTemplate.execute("SELECT pg_notify(?, ?)", (PreparedStatementCallback<Boolean>) ps -> {
                    ps.setString(1, channel);
                    ps.setString(2, event.id() + ":" + event.type());
                    return ps.execute();
                });
            });
        } catch (DuplicateKeyException e) {
            throw new DuplicateEventIdException(event.id(), e);
        } catch (RuntimeException e) {
            throw translateException("Publishing event " + event.id(), e);
        }
    }

    @Override
    public List<Event> fetchAfter(@Nullable String afterId, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be greater than zero");
        }
        try {
            return afterId == null ? jdbcTemplate.query(fetchAllSql, eventRowMapper, limit) : jdbcTemplate.query(fetchAfterSql, eventRowMapper, afterId, limit);
        } catch (RuntimeException e) {
            throw translateException("Fetching events after " + afterId, e);
        }
    }

    private @Nullable String writeData(Event event) {
        Map<String, Object> data = event.data();
        if (data == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new EventBusException("Failed to serialize data of event " + event.id(), e);
        }
    }

    private @Nullable Map<String, Object> readData(String eventId, @Nullable String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, DATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new EventBusException("Failed to deserialize data of event " + eventId, e);
        }
    }
}
