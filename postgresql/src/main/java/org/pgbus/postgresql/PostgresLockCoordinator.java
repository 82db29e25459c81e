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

import org.pgbus.subscription.spi.LockCoordinator;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.pgbus.postgresql.PostgresExceptionTranslator.translateException;

/**
 * Session level advisory locks. A lock is held until it's released or the session that acquired it ends.
 */
class PostgresLockCoordinator implements LockCoordinator {
    private final JdbcTemplate jdbcTemplate;

    PostgresLockCoordinator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean tryAcquire(long lockNumber) {
        try {
            return Boolean.TRUE.equals(jdbcTemplate.queryForObject("SELECT pg_try_advisory_lock(?)", Boolean.class, lockNumber));
        } catch (RuntimeException e) {
            throw translateException("Acquiring advisory lock " + lockNumber, e);
        }
    }

    @Override
    public void release(long lockNumber) {
        try {
            jdbcTemplate.queryForObject("SELECT pg_advisory_unlock(?)", Boolean.class, lockNumber);
        } catch (RuntimeException e) {
            throw translateException("Releasing advisory lock " + lockNumber, e);
        }
    }
}
