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

import org.pgbus.eventbus.api.EventBusConnectionException;
import org.pgbus.eventbus.api.EventBusException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;

/**
 * Translates errors raised by the JDBC driver and Spring into the event bus exception hierarchy. Connection failures
 * become {@link EventBusConnectionException}, everything else {@link EventBusException}.
 */
class PostgresExceptionTranslator {
    private static final String CONNECTION_EXCEPTION_CLASS = "08";
    private static final String ADMIN_SHUTDOWN = "57P01";
    private static final String CRASH_SHUTDOWN = "57P02";
    private static final String CANNOT_CONNECT_NOW = "57P03";

    private PostgresExceptionTranslator() {
    }

    static EventBusException translateException(String operation, Throwable e) {
        if (e instanceof EventBusException) {
            return (EventBusException) e;
        } else if (isConnectionFailure(e)) {
            return new EventBusConnectionException(operation + " failed because the database is unreachable: " + e.getMessage(), e);
        }
        return new EventBusException(operation + " failed: " + e.getMessage(), e);
    }

    static boolean isConnectionFailure(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof DataAccessResourceFailureException
                    || current instanceof TransientDataAccessException
                    || current instanceof RecoverableDataAccessException
                    || current instanceof CannotCreateTransactionException
                    || current instanceof SQLTransientConnectionException
                    || current instanceof SQLNonTransientConnectionException) {
                return true;
            } else if (current instanceof SQLException && isConnectionSqlState(((SQLException) current).getSQLState())) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    private static boolean isConnectionSqlState(String sqlState) {
        if (sqlState == null) {
            return false;
        }
        return sqlState.startsWith(CONNECTION_EXCEPTION_CLASS)
                || sqlState.equals(ADMIN_SHUTDOWN)
                || sqlState.equals(CRASH_SHUTDOWN)
                || sqlState.equals(CANNOT_CONNECT_NOW);
    }
}
