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

import org.pgbus.eventbus.api.CheckpointWriteException;
import org.pgbus.subscription.spi.CheckpointStore;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Optional;

import static org.pgbus.postgresql.PostgresExceptionTranslator.translateException;

class PostgresCheckpointStore implements CheckpointStore {
    private final JdbcTemplate jdbcTemplate;
    private final String upsertSql;
    private final String loadSql;
    private final String deleteSql;

    PostgresCheckpointStore(JdbcTemplate jdbcTemplate, PostgresEventBusConfig config) {
        this.jdbcTemplate = jdbcTemplate;
        this.upsertSql = "INSERT INTO " + config.subscriptionsTable + " (id, checkpoint) VALUES (?, ?) ON CONFLICT (id) DO UPDATE SET checkpoint = EXCLUDED.checkpoint";
        this.loadSql = "SELECT checkpoint FROM " + config.subscriptionsTable + " WHERE id = ?";
        this.deleteSql = "DELETE FROM " + config.subscriptionsTable + " WHERE id = ?";
    }

    @Override
    public void save(String subscriptionId, String eventId) {
        try {
            jdbcTemplate.update(upsertSql, subscriptionId, eventId);
        } catch (RuntimeException e) {
            throw new CheckpointWriteException(subscriptionId, eventId, translateException("Saving checkpoint", e));
        }
    }

    @Override
    public Optional<String> load(String subscriptionId) {
        try {
            List<String> checkpoints = jdbcTemplate.queryForList(loadSql, String.class, subscriptionId);
            return checkpoints.stream().findFirst();
        } catch (RuntimeException e) {
            throw translateException("Loading checkpoint of subscription " + subscriptionId, e);
        }
    }

    @Override
    public void delete(String subscriptionId) {
        try {
            jdbcTemplate.update(deleteSql, subscriptionId);
        } catch (RuntimeException e) {
            throw translateException("Deleting checkpoint of subscription " + subscriptionId, e);
        }
    }
}
