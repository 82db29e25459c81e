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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.pgbus.subscription.SubscriptionConfig;

import javax.sql.DataSource;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Configuration of the {@link PostgresEventBus}.
 * <p>
 * Every subscription holds a dedicated connection from the {@link #dataSource} for as long as it owns its lease. Advisory
 * locks and {@code LISTEN} registrations live in the database session, so the data source must hand out physical
 * connections (for example {@code PGSimpleDataSource}). A pooling data source would keep the lock alive in the pool
 * after the subscription closes its connection.
 */
public class PostgresEventBusConfig {
    public static final String DEFAULT_EVENTS_TABLE = "events";
    public static final String DEFAULT_SUBSCRIPTIONS_TABLE = "subscriptions";
    public static final String DEFAULT_CHANNEL = "events";

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    public final DataSource dataSource;
    public final String eventsTable;
    public final String subscriptionsTable;
    /**
     * The {@code NOTIFY} channel that publishers signal and subscribers listen to
     */
    public final String channel;
    public final SubscriptionConfig subscriptionConfig;
    /**
     * Maps the data of an event to and from {@code JSONB}
     */
    public final ObjectMapper objectMapper;

    private PostgresEventBusConfig(DataSource dataSource, String eventsTable, String subscriptionsTable, String channel,
                                   SubscriptionConfig subscriptionConfig, ObjectMapper objectMapper) {
        requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        requireNonNull(subscriptionConfig, SubscriptionConfig.class.getSimpleName() + " cannot be null");
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        this.dataSource = dataSource;
        this.eventsTable = requireIdentifier("Events table", eventsTable);
        this.subscriptionsTable = requireIdentifier("Subscriptions table", subscriptionsTable);
        this.channel = requireIdentifier("Channel", channel);
        this.subscriptionConfig = subscriptionConfig;
        this.objectMapper = objectMapper;
        if (this.eventsTable.equals(this.subscriptionsTable)) {
            throw new IllegalArgumentException("Events table and subscriptions table must be different");
        }
    }

    public static Builder builder(DataSource dataSource) {
        return new Builder(dataSource);
    }

    public static PostgresEventBusConfig defaults(DataSource dataSource) {
        return builder(dataSource).build();
    }

    private static String requireIdentifier(String name, String value) {
        requireNonNull(value, name + " cannot be null");
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException(name + " must be a lower case SQL identifier, was " + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PostgresEventBusConfig)) return false;
        PostgresEventBusConfig that = (PostgresEventBusConfig) o;
        return Objects.equals(dataSource, that.dataSource) && Objects.equals(eventsTable, that.eventsTable)
                && Objects.equals(subscriptionsTable, that.subscriptionsTable) && Objects.equals(channel, that.channel)
                && Objects.equals(subscriptionConfig, that.subscriptionConfig) && Objects.equals(objectMapper, that.objectMapper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataSource, eventsTable, subscriptionsTable, channel, subscriptionConfig, objectMapper);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", PostgresEventBusConfig.class.getSimpleName() + "[", "]")
                .add("eventsTable='" + eventsTable + "'")
                .add("subscriptionsTable='" + subscriptionsTable + "'")
                .add("channel='" + channel + "'")
                .add("subscriptionConfig=" + subscriptionConfig)
                .toString();
    }

    public static final class Builder {
        private final DataSource dataSource;
        private String eventsTable = DEFAULT_EVENTS_TABLE;
        private String subscriptionsTable = DEFAULT_SUBSCRIPTIONS_TABLE;
        private String channel = DEFAULT_CHANNEL;
        private SubscriptionConfig subscriptionConfig = SubscriptionConfig.defaults();
        private ObjectMapper objectMapper = new ObjectMapper();

        private Builder(DataSource dataSource) {
            this.dataSource = dataSource;
        }

        public Builder eventsTable(String eventsTable) {
            this.eventsTable = eventsTable;
            return this;
        }

        public Builder subscriptionsTable(String subscriptionsTable) {
            this.subscriptionsTable = subscriptionsTable;
            return this;
        }

        public Builder channel(String channel) {
            this.channel = channel;
            return this;
        }

        public Builder subscriptionConfig(SubscriptionConfig subscriptionConfig) {
            this.subscriptionConfig = subscriptionConfig;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public PostgresEventBusConfig build() {
            return new PostgresEventBusConfig(dataSource, eventsTable, subscriptionsTable, channel, subscriptionConfig, objectMapper);
        }
    }
}
