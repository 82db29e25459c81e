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

import org.pgbus.subscription.spi.CheckpointStore;
import org.pgbus.subscription.spi.EventStore;
import org.pgbus.subscription.spi.LockCoordinator;
import org.pgbus.subscription.spi.NotificationWaiter;
import org.pgbus.subscription.spi.StoreConnection;
import org.postgresql.PGConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.pgbus.postgresql.PostgresExceptionTranslator.translateException;

/**
 * A single database session. Advisory locks and {@code LISTEN} registrations belong to the session, so everything a
 * subscription does while holding its lease goes through the same connection.
 */
class PostgresStoreConnection implements StoreConnection {
    private static final Logger log = LoggerFactory.getLogger(PostgresStoreConnection.class);

    private final Connection connection;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final PostgresEventStore events;
    private final PostgresCheckpointStore checkpoints;
    private final PostgresLockCoordinator locks;
    private final PostgresNotificationWaiter notifications;

    private PostgresStoreConnection(Connection connection, PGConnection pgConnection, PostgresEventBusConfig config) {
        this.connection = connection;
        // suppressClose, the connection is closed by this class only
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource(connection, true);
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        TransactionTemplate transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.events = new PostgresEventStore(jdbcTemplate, transactionTemplate, config);
        this.checkpoints = new PostgresCheckpointStore(jdbcTemplate, config);
        this.locks = new PostgresLockCoordinator(jdbcTemplate);
        this.notifications = new PostgresNotificationWaiter(pgConnection, jdbcTemplate, config.channel);
    }

    static PostgresStoreConnection open(PostgresEventBusConfig config) {
        Connection connection;
        try {
            connection = config.dataSource.getConnection();
        } catch (SQLException | RuntimeException e) {
            throw translateException("Opening database connection", e);
        }
        try {
            connection.setAutoCommit(true);
            return new PostgresStoreConnection(connection, connection.unwrap(PGConnection.class), config);
        } catch (SQLException | RuntimeException e) {
            closeQuietly(connection);
            throw translateException("Opening database connection", e);
        }
    }

    @Override
    public EventStore events() {
        return events;
    }

    @Override
    public CheckpointStore checkpoints() {
        return checkpoints;
    }

    @Override
    public LockCoordinator locks() {
        return locks;
    }

    @Override
    public NotificationWaiter notifications() {
        return notifications;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            closeQuietly(connection);
        }
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close database connection: {}", e.getMessage(), e);
        }
    }
}
