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

import org.pgbus.eventbus.api.Event;
import org.pgbus.subscription.AbstractEventBus;
import org.pgbus.subscription.spi.StoreConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

import static org.pgbus.postgresql.PostgresExceptionTranslator.translateException;

/**
 * An event bus that stores events and checkpoints in PostgreSQL. Any number of processes may share the same tables.
 * Each subscription id is consumed by at most one of them at a time.
 * <p>
 * Publishing borrows a connection from the {@link PostgresEventBusConfig#dataSource data source} per event, while
 * each open subscription keeps its own connection for as long as it holds its lease.
 */
public class PostgresEventBus extends AbstractEventBus {
    private static final Logger log = LoggerFactory.getLogger(PostgresEventBus.class);

    private final PostgresEventBusConfig config;
    private final JdbcTemplate jdbcTemplate;
    private final PostgresEventStore eventStore;
    private final PostgresCheckpointStore checkpointStore;

    public PostgresEventBus(DataSource dataSource) {
        this(PostgresEventBusConfig.defaults(dataSource));
    }

    public PostgresEventBus(PostgresEventBusConfig config) {
        super(config.subscriptionConfig);
        this.config = config;
        this.jdbcTemplate = new JdbcTemplate(config.dataSource);
        TransactionTemplate transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(config.dataSource));
        this.eventStore = new PostgresEventStore(jdbcTemplate, transactionTemplate, config);
        this.checkpointStore = new PostgresCheckpointStore(jdbcTemplate, config);
    }

    @Override
    protected void doStart() {
        try {
            PostgresSchema.createIfMissing(jdbcTemplate, config);
        } catch (RuntimeException e) {
            throw translateException("Starting event bus", e);
        }
        log.info("Using tables {} and {} with notification channel {}", config.eventsTable, config.subscriptionsTable, config.channel);
    }

    @Override
    protected void doStop() {
        // The data source is owned by the caller
    }

    @Override
    protected void doPublish(Event event) {
        eventStore.append(event);
    }

    @Override
    protected StoreConnectionFactory connectionFactory() {
        return () -> PostgresStoreConnection.open(config);
    }

    @Override
    protected void deleteCheckpoint(String subscriptionId) {
        checkpointStore.delete(subscriptionId);
    }

    public PostgresEventBusConfig config() {
        return config;
    }
}
