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

import com.fasterxml.jackson.databind.JsonNode;
import org.eventledger.eventstore.api.AppendResult;
import org.eventledger.eventstore.api.NewEvent;
import org.eventledger.eventstore.api.OptimisticLockException;
import org.eventledger.eventstore.api.StoredEvent;
import org.eventledger.eventstore.api.StoredSnapshot;
import org.eventledger.eventstore.api.blocking.EventStream;
import org.eventledger.eventstore.api.blocking.SnapshotAndEvents;
import org.eventledger.eventstore.api.blocking.SnapshotStore;
import org.eventledger.eventstore.jdbc.internal.JsonColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;
import static org.eventledger.eventstore.jdbc.internal.JdbcExceptionTranslator.translateException;

/**
 * An event store and snapshot store for one aggregate type, backed by a relational database through Spring's {@link JdbcTemplate}.
 * <p>
 * Optimistic concurrency relies on a unique constraint over {@code (aggregate_type, aggregate_id, sequence_number)} in the event table,
 * see {@code db/mysql/eventledger.sql} for the expected schema. Appending verifies the expected version and inserts the new events
 * in the same transaction, when a concurrent writer wins the race the unique constraint is violated and the append fails with an
 * {@link OptimisticLockException} without having written anything.
 * </p>
 */
public class JdbcEventStore implements SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final String aggregateType;
    private final JsonColumns jsonColumns;

    private final String currentVersionSql;
    private final String insertEventSql;
    private final String loadEventsSql;
    private final String loadEventsAfterSql;
    private final String loadSnapshotSql;
    private final String updateSnapshotSql;
    private final String snapshotExistsSql;
    private final String insertSnapshotSql;

    private final RowMapper<StoredEvent> storedEventRowMapper;

    /**
     * Create a new instance of {@code JdbcEventStore} that uses the default table names and a {@link DataSourceTransactionManager} for the supplied {@code dataSource}.
     *
     * @param dataSource    The data source to use
     * @param aggregateType The aggregate type whose event streams this store manages
     */
    public JdbcEventStore(DataSource dataSource, String aggregateType) {
        this(new JdbcTemplate(requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null")),
                new JdbcEventStoreConfig.Builder().aggregateType(aggregateType).transactionConfig(new DataSourceTransactionManager(dataSource)).build());
    }

    /**
     * Create a new instance of {@code JdbcEventStore}
     *
     * @param jdbcTemplate The {@link JdbcTemplate} that the store will use
     * @param config       The {@link JdbcEventStoreConfig} that will be used
     */
    public JdbcEventStore(JdbcTemplate jdbcTemplate, JdbcEventStoreConfig config) {
        requireNonNull(jdbcTemplate, JdbcTemplate.class.getSimpleName() + " cannot be null");
        requireNonNull(config, JdbcEventStoreConfig.class.getSimpleName() + " cannot be null");
        this.jdbcTemplate = config.queryTimeout == null ? jdbcTemplate : withQueryTimeout(jdbcTemplate, config.queryTimeout);
        this.transactionTemplate = config.isolationLevel == TransactionDefinition.ISOLATION_DEFAULT ? config.transactionTemplate : withIsolationLevel(config.transactionTemplate, config.isolationLevel);
        this.aggregateType = config.aggregateType;
        this.jsonColumns = new JsonColumns(config.objectMapper);

        String events = config.eventTableName;
        String snapshots = config.snapshotTableName;
        this.currentVersionSql = "SELECT COALESCE(MAX(sequence_number), 0) FROM " + events + " WHERE aggregate_type = ? AND aggregate_id = ?";
        this.insertEventSql = "INSERT INTO " + events + " (aggregate_type, aggregate_id, sequence_number, event_type, payload, metadata) VALUES (?, ?, ?, ?, ?, ?)";
        String selectEvents = "SELECT aggregate_type, aggregate_id, sequence_number, event_type, payload, metadata FROM " + events + " WHERE aggregate_type = ? AND aggregate_id = ?";
        this.loadEventsSql = selectEvents + " ORDER BY sequence_number ASC";
        this.loadEventsAfterSql = selectEvents + " AND sequence_number > ? ORDER BY sequence_number ASC";
        this.loadSnapshotSql = "SELECT aggregate_type, aggregate_id, last_sequence, payload FROM " + snapshots + " WHERE aggregate_type = ? AND aggregate_id = ?";
        this.updateSnapshotSql = "UPDATE " + snapshots + " SET last_sequence = ?, payload = ? WHERE aggregate_type = ? AND aggregate_id = ? AND last_sequence <= ?";
        this.snapshotExistsSql = "SELECT COUNT(*) FROM " + snapshots + " WHERE aggregate_type = ? AND aggregate_id = ?";
        this.insertSnapshotSql = "INSERT INTO " + snapshots + " (aggregate_type, aggregate_id, last_sequence, payload) VALUES (?, ?, ?, ?)";

        this.storedEventRowMapper = (rs, rowNum) -> new StoredEvent(
                rs.getString("aggregate_type"),
                rs.getString("aggregate_id"),
                rs.getLong("sequence_number"),
                rs.getString("event_type"),
                jsonColumns.readJson("payload", rs.getString("payload")),
                jsonColumns.readMetadata(rs.getString("metadata")));
    }

    @Override
    public AppendResult append(String aggregateId, long expectedVersion, List<NewEvent> events) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(events, "Events cannot be null");
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("Expected version cannot be negative but was " + expectedVersion);
        }

        if (events.isEmpty()) {
            return new AppendResult(aggregateId, expectedVersion, expectedVersion);
        }

        List<Object[]> rows = new ArrayList<>(events.size());
        long sequence = expectedVersion;
        for (NewEvent event : events) {
            sequence++;
            rows.add(new Object[]{aggregateType, aggregateId, sequence, event.eventType(), jsonColumns.writeJson(event.payload()), jsonColumns.writeMetadata(event.metadata())});
        }
        long newVersion = sequence;

        AppendResult result = execute("append " + events.size() + " event(s) to " + aggregateType + " " + aggregateId, () ->
                transactionTemplate.execute(status -> {
                    long currentVersion = queryCurrentVersion(aggregateId);
                    if (currentVersion != expectedVersion) {
                        throw new OptimisticLockException(String.format("%s %s was expected to be at version %d but was at version %d", aggregateType, aggregateId, expectedVersion, currentVersion));
                    }
                    jdbcTemplate.batchUpdate(insertEventSql, rows);
                    return new AppendResult(aggregateId, expectedVersion, newVersion);
                }));
        log.debug("Appended events {} to {} {}", result, aggregateType, aggregateId);
        return result;
    }

    @Override
    public EventStream<StoredEvent> load(String aggregateId) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        return EventStream.of(aggregateId, () -> execute("load events of " + aggregateType + " " + aggregateId,
                () -> jdbcTemplate.query(loadEventsSql, storedEventRowMapper, aggregateType, aggregateId)));
    }

    @Override
    public long currentVersion(String aggregateId) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        return execute("read current version of " + aggregateType + " " + aggregateId, () -> queryCurrentVersion(aggregateId));
    }

    @Override
    public void saveSnapshot(String aggregateId, long sequence, JsonNode state) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(state, "State cannot be null");
        if (sequence < 0) {
            throw new IllegalArgumentException("Snapshot sequence cannot be negative but was " + sequence);
        }
        String payload = jsonColumns.writeJson(state);
        Boolean saved = execute("save snapshot of " + aggregateType + " " + aggregateId + " at sequence " + sequence, () ->
                transactionTemplate.execute(status -> {
                    long currentVersion = queryCurrentVersion(aggregateId);
                    if (sequence > currentVersion) {
                        throw new IllegalArgumentException(String.format("Cannot save a snapshot of %s %s at sequence %d since the latest event has sequence %d", aggregateType, aggregateId, sequence, currentVersion));
                    }
                    if (jdbcTemplate.update(updateSnapshotSql, sequence, payload, aggregateType, aggregateId, sequence) > 0) {
                        return true;
                    }
                    // No row, or a row with a higher sequence that must not be replaced by an older state
                    Integer existing = jdbcTemplate.queryForObject(snapshotExistsSql, Integer.class, aggregateType, aggregateId);
                    if (existing != null && existing > 0) {
                        return false;
                    }
                    jdbcTemplate.update(insertSnapshotSql, aggregateType, aggregateId, sequence, payload);
                    return true;
                }));
        if (Boolean.TRUE.equals(saved)) {
            log.debug("Saved snapshot of {} {} at sequence {}", aggregateType, aggregateId, sequence);
        } else {
            log.debug("Kept the existing snapshot of {} {} since it's newer than sequence {}", aggregateType, aggregateId, sequence);
        }
    }

    @Override
    public SnapshotAndEvents loadFromSnapshot(String aggregateId) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        Optional<StoredSnapshot> snapshot = execute("load snapshot of " + aggregateType + " " + aggregateId, () ->
                jdbcTemplate.query(loadSnapshotSql, (rs, rowNum) -> new StoredSnapshot(
                        rs.getString("aggregate_type"),
                        rs.getString("aggregate_id"),
                        rs.getLong("last_sequence"),
                        jsonColumns.readJson("payload", rs.getString("payload"))), aggregateType, aggregateId)
                        .stream()
                        .findFirst());
        long after = snapshot.map(StoredSnapshot::sequence).orElse(0L);
        EventStream<StoredEvent> events = EventStream.of(aggregateId, () -> execute("load events of " + aggregateType + " " + aggregateId + " after sequence " + after,
                () -> jdbcTemplate.query(loadEventsAfterSql, storedEventRowMapper, aggregateType, aggregateId, after)));
        return new SnapshotAndEvents(snapshot, events);
    }

    /**
     * @return The aggregate type whose event streams this store manages
     */
    public String aggregateType() {
        return aggregateType;
    }

    private long queryCurrentVersion(String aggregateId) {
        Long version = jdbcTemplate.queryForObject(currentVersionSql, Long.class, aggregateType, aggregateId);
        return version == null ? 0 : version;
    }

    // Copies, the supplied templates may be shared with other components
    private static JdbcTemplate withQueryTimeout(JdbcTemplate jdbcTemplate, Duration queryTimeout) {
        JdbcTemplate copy = new JdbcTemplate(requireNonNull(jdbcTemplate.getDataSource(), "JdbcTemplate must have a DataSource"));
        copy.setExceptionTranslator(jdbcTemplate.getExceptionTranslator());
        copy.setFetchSize(jdbcTemplate.getFetchSize());
        copy.setQueryTimeout((int) Math.max(1, queryTimeout.toSeconds()));
        return copy;
    }

    private static TransactionTemplate withIsolationLevel(TransactionTemplate transactionTemplate, int isolationLevel) {
        TransactionTemplate copy = new TransactionTemplate(requireNonNull(transactionTemplate.getTransactionManager(), "TransactionTemplate must have a transaction manager"), transactionTemplate);
        copy.setIsolationLevel(isolationLevel);
        return copy;
    }

    private static <T> T execute(String description, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException | TransactionException e) {
            throw translateException(description, e);
        }
    }
}
