/*
 * Copyright 2026 the EventLedger authors
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

package org.eventledger.eventstore.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;
import static org.eventledger.eventstore.jdbc.internal.SqlIdentifiers.requireValidIdentifier;

/**
 * Configuration for the {@link JdbcEventStore}
 */
public class JdbcEventStoreConfig {
    public static final String DEFAULT_EVENT_TABLE_NAME = "events";
    public static final String DEFAULT_SNAPSHOT_TABLE_NAME = "snapshots";

    public final String aggregateType;
    public final String eventTableName;
    public final String snapshotTableName;
    public final TransactionTemplate transactionTemplate;
    public final ObjectMapper objectMapper;
    public final int isolationLevel;
    public final Duration queryTimeout;

    /**
     * Create a new instance of {@code JdbcEventStoreConfig} that uses the default table names.
     *
     * @param aggregateType       The aggregate type whose event streams this store manages. Stored alongside every event and snapshot.
     * @param transactionTemplate The transaction template responsible for starting JDBC transactions (see {@link Builder} for overloads).
     */
    public JdbcEventStoreConfig(String aggregateType, TransactionTemplate transactionTemplate) {
        this(aggregateType, DEFAULT_EVENT_TABLE_NAME, DEFAULT_SNAPSHOT_TABLE_NAME, transactionTemplate, new ObjectMapper(), TransactionDefinition.ISOLATION_DEFAULT, null);
    }

    private JdbcEventStoreConfig(String aggregateType, String eventTableName, String snapshotTableName, TransactionTemplate transactionTemplate, ObjectMapper objectMapper,
                                 int isolationLevel, Duration queryTimeout) {
        requireNonNull(aggregateType, "Aggregate type cannot be null");
        requireNonNull(transactionTemplate, TransactionTemplate.class.getSimpleName() + " cannot be null");
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        if (aggregateType.isBlank()) {
            throw new IllegalArgumentException("Aggregate type cannot be blank");
        }
        this.aggregateType = aggregateType;
        this.eventTableName = requireValidIdentifier(eventTableName, "Event table name");
        this.snapshotTableName = requireValidIdentifier(snapshotTableName, "Snapshot table name");
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.isolationLevel = isolationLevel;
        // null means that the driver default is used
        this.queryTimeout = queryTimeout;
        if (queryTimeout != null && (queryTimeout.isNegative() || queryTimeout.isZero())) {
            throw new IllegalArgumentException("Query timeout must be positive but was " + queryTimeout);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JdbcEventStoreConfig)) return false;
        JdbcEventStoreConfig that = (JdbcEventStoreConfig) o;
        return Objects.equals(aggregateType, that.aggregateType) && Objects.equals(eventTableName, that.eventTableName) && Objects.equals(snapshotTableName, that.snapshotTableName) && Objects.equals(transactionTemplate, that.transactionTemplate) && Objects.equals(objectMapper, that.objectMapper) && isolationLevel == that.isolationLevel && Objects.equals(queryTimeout, that.queryTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateType, eventTableName, snapshotTableName, transactionTemplate, objectMapper, isolationLevel, queryTimeout);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", JdbcEventStoreConfig.class.getSimpleName() + "[", "]")
                .add("aggregateType='" + aggregateType + "'")
                .add("eventTableName='" + eventTableName + "'")
                .add("snapshotTableName='" + snapshotTableName + "'")
                .add("transactionTemplate=" + transactionTemplate)
                .add("isolationLevel=" + isolationLevel)
                .add("queryTimeout=" + queryTimeout)
                .toString();
    }

    public static final class Builder {
        private String aggregateType;
        private String eventTableName = DEFAULT_EVENT_TABLE_NAME;
        private String snapshotTableName = DEFAULT_SNAPSHOT_TABLE_NAME;
        private TransactionTemplate transactionTemplate;
        private ObjectMapper objectMapper;
        private int isolationLevel = TransactionDefinition.ISOLATION_DEFAULT;
        private Duration queryTimeout;

        /**
         * @param aggregateType The aggregate type whose event streams the store manages
         * @return A same {@code Builder instance}
         */
        public Builder aggregateType(String aggregateType) {
            this.aggregateType = aggregateType;
            return this;
        }

        /**
         * @param eventTableName The table in which the events are persisted, defaults to {@value #DEFAULT_EVENT_TABLE_NAME}.
         * @return A same {@code Builder instance}
         */
        public Builder eventTableName(String eventTableName) {
            this.eventTableName = eventTableName;
            return this;
        }

        /**
         * @param snapshotTableName The table in which the snapshots are persisted, defaults to {@value #DEFAULT_SNAPSHOT_TABLE_NAME}.
         * @return A same {@code Builder instance}
         */
        public Builder snapshotTableName(String snapshotTableName) {
            this.snapshotTableName = snapshotTableName;
            return this;
        }

        /**
         * @param transactionTemplate The transaction template responsible for starting JDBC transactions
         * @return A same {@code Builder instance}
         */
        public Builder transactionConfig(TransactionTemplate transactionTemplate) {
            this.transactionTemplate = transactionTemplate;
            return this;
        }

        /**
         * @param transactionManager Create a {@link TransactionTemplate} from the supplied {@code transactionManager}
         * @return A same {@code Builder instance}
         */
        public Builder transactionConfig(PlatformTransactionManager transactionManager) {
            this.transactionTemplate = new TransactionTemplate(transactionManager);
            return this;
        }

        /**
         * @param objectMapper The {@link ObjectMapper} used to write and read the JSON text of payloads and metadata
         * @return A same {@code Builder instance}
         */
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * @param isolationLevel The isolation level of the transactions started by the store, one of the {@code ISOLATION_*} constants
         *                       in {@link TransactionDefinition}. Defaults to the isolation level of the supplied transaction template.
         * @return A same {@code Builder instance}
         */
        public Builder isolationLevel(int isolationLevel) {
            this.isolationLevel = isolationLevel;
            return this;
        }

        /**
         * @param queryTimeout The maximum time a single statement may run before the driver cancels it
         * @return A same {@code Builder instance}
         */
        public Builder queryTimeout(Duration queryTimeout) {
            this.queryTimeout = queryTimeout;
            return this;
        }

        public JdbcEventStoreConfig build() {
            return new JdbcEventStoreConfig(aggregateType, eventTableName, snapshotTableName, transactionTemplate, objectMapper == null ? new ObjectMapper() : objectMapper,
                    isolationLevel, queryTimeout);
        }
    }
}
