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

import org.pgbus.subscription.spi.NotificationWaiter;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.pgbus.postgresql.PostgresExceptionTranslator.translateException;

/**
 * Waits for {@code NOTIFY} signals on the channel of the event bus. The connection only listens while a wait is in
 * progress, and notifications still queued when the wait ends are discarded, so a signal sent before a wait started
 * never wakes it.
 */
class PostgresNotificationWaiter implements NotificationWaiter {
    private static final Logger log = LoggerFactory.getLogger(PostgresNotificationWaiter.class);
    // Upper bound of a single blocking read, interrupts are noticed in between
    private static final int POLL_SLICE_MILLIS = 500;

    private final PGConnection pgConnection;
    private final JdbcTemplate jdbcTemplate;
    private final String channel;

    PostgresNotificationWaiter(PGConnection pgConnection, JdbcTemplate jdbcTemplate, String channel) {
        this.pgConnection = pgConnection;
        this.jdbcTemplate = jdbcTemplate;
        this.channel = channel;
    }

    @Override
    public boolean waitForActivity(Duration maxWait) throws InterruptedException {
        long deadline = System.nanoTime() + maxWait.toNanos();
        try {
            jdbcTemplate.execute("LISTEN " + channel);
        } catch (RuntimeException e) {
            throw translateException("Listening to channel " + channel, e);
        }
        try {
            while (true) {
                if (Thread.interrupted()) {
                    throw new InterruptedException("Interrupted while waiting for notifications on " + channel);
                }
                long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMillis <= 0) {
                    return false;
                }
                PGNotification[] notifications = pgConnection.getNotifications((int) Math.min(remainingMillis, POLL_SLICE_MILLIS));
                if (hasNotificationOnChannel(notifications)) {
                    return true;
                }
            }
        } catch (SQLException e) {
            throw translateException("Waiting for notifications on " + channel, e);
        } finally {
            stopListening();
        }
    }

    private boolean hasNotificationOnChannel(PGNotification[] notifications) {
        if (notifications == null) {
            return false;
        }
        for (PGNotification notification : notifications) {
            if (channel.equals(notification.getName())) {
                if (log.isTraceEnabled()) {
                    log.trace("Received notification (channel={}, payload={})", notification.getName(), notification.getParameter());
                }
                return true;
            }
        }
        return false;
    }

    private void stopListening() {
        try {
            jdbcTemplate.execute("UNLISTEN " + channel);
            // Drop what arrived before UNLISTEN took effect
            pgConnection.getNotifications();
        } catch (SQLException | RuntimeException e) {
            // The connection is broken or closed, the next statement on it reports the failure
            log.debug("Failed to stop listening on channel {}: {}", channel, e.getMessage());
        }
    }
}
