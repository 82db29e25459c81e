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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Creates the tables used by the event bus unless they already exist.
 */
class PostgresSchema {
    private static final Logger log = LoggerFactory.getLogger(PostgresSchema.class);

    private PostgresSchema() {
    }

    static void createIfMissing(JdbcTemplate jdbcTemplate, PostgresEventBusConfig config) {
        createTable(jdbcTemplate, config.eventsTable,
                "CREATE TABLE IF NOT EXISTS " + config.eventsTable + " (id VARCHAR(32) PRIMARY KEY, type VARCHAR(64) NOT NULL, data JSONB)");
        createTable(jdbcTemplate, config.subscriptionsTable,
                "CREATE TABLE IF NOT EXISTS " + config.subscriptionsTable + " (id VARCHAR(32) PRIMARY KEY, checkpoint VARCHAR(32) NOT NULL)");
    }

    private static void createTable(JdbcTemplate jdbcTemplate, String table, String ddl) {
        try {
            jdbcTemplate.execute(ddl);
        } catch (DataIntegrityViolationException e) {
            // Two processes racing on IF NOT EXISTS; the other one created it.
            log.debug("Table {} was created concurrently: {}", table, e.getMessage());
        }
    }
}
