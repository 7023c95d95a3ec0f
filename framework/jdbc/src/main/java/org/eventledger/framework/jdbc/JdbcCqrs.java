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

package org.eventledger.framework.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventledger.application.converter.EventConverter;
import org.eventledger.application.converter.JacksonEventConverter;
import org.eventledger.application.converter.JacksonStateConverter;
import org.eventledger.application.converter.StateConverter;
import org.eventledger.application.service.CqrsFramework;
import org.eventledger.application.store.AggregateStores;
import org.eventledger.dsl.decider.Aggregate;
import org.eventledger.dsl.view.MaterializedView;
import org.eventledger.dsl.view.Query;
import org.eventledger.dsl.view.View;
import org.eventledger.eventstore.jdbc.JdbcEventStore;
import org.eventledger.eventstore.jdbc.JdbcEventStoreConfig;
import org.eventledger.eventstore.jdbc.JdbcViewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * Assembles {@link CqrsFramework} instances backed by a relational database. Every framework, event store and view repository
 * created by the same {@code JdbcCqrs} shares its {@link DataSource}.
 * <p>
 * The {@code DataSource} is owned by this instance: {@link #close()} closes it if it's {@link AutoCloseable}, which is the case for
 * most connection pools. Configure the pool (URL, credentials, size) before handing it over.
 * </p>
 * <pre>
 * try (JdbcCqrs jdbcCqrs = new JdbcCqrs(dataSource)) {
 *     CqrsFramework&lt;AccountCommand, AccountState, AccountEvent&gt; accounts = jdbcCqrs.snapshotting(new Account(), AccountState.class, List.of(), 100);
 *     accounts.execute("acc-1", new Deposit(10));
 * }
 * </pre>
 */
public class JdbcCqrs implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JdbcCqrs.class);

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public JdbcCqrs(DataSource dataSource) {
        this(dataSource, new ObjectMapper());
    }

    /**
     * @param dataSource   The data source to use, it's closed by {@link #close()}
     * @param objectMapper The {@link ObjectMapper} used for events, snapshots and views
     */
    public JdbcCqrs(DataSource dataSource, ObjectMapper objectMapper) {
        requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.objectMapper = objectMapper;
    }

    /**
     * A framework that rebuilds the aggregate from all of its events for every command
     */
    public <C, S, E> CqrsFramework<C, S, E> eventSourced(Aggregate<C, S, E> aggregate, List<? extends Query<E>> queries) {
        return eventSourced(aggregate, new JacksonEventConverter<>(objectMapper), queries);
    }

    public <C, S, E> CqrsFramework<C, S, E> eventSourced(Aggregate<C, S, E> aggregate, EventConverter<E> eventConverter, List<? extends Query<E>> queries) {
        JdbcEventStore eventStore = eventStore(aggregate.aggregateType());
        return new CqrsFramework<>(aggregate, AggregateStores.eventSourced(eventStore, aggregate, eventConverter), queries);
    }

    /**
     * A framework that loads the aggregate from its latest snapshot and the events after it, and saves a new snapshot once
     * {@code snapshotFrequency} events have been committed after the loaded one
     */
    public <C, S, E> CqrsFramework<C, S, E> snapshotting(Aggregate<C, S, E> aggregate, Class<S> stateType, List<? extends Query<E>> queries, int snapshotFrequency) {
        return snapshotting(aggregate, new JacksonEventConverter<>(objectMapper), new JacksonStateConverter<>(objectMapper, stateType), queries, snapshotFrequency);
    }

    public <C, S, E> CqrsFramework<C, S, E> snapshotting(Aggregate<C, S, E> aggregate, EventConverter<E> eventConverter, StateConverter<S> stateConverter,
                                                        List<? extends Query<E>> queries, int snapshotFrequency) {
        JdbcEventStore eventStore = eventStore(aggregate.aggregateType());
        return new CqrsFramework<>(aggregate, AggregateStores.snapshotting(eventStore, aggregate, eventConverter, stateConverter, snapshotFrequency), queries);
    }

    /**
     * A framework that treats the latest state as the unit of load, the snapshot is replaced after every command
     */
    public <C, S, E> CqrsFramework<C, S, E> aggregateStore(Aggregate<C, S, E> aggregate, Class<S> stateType, List<? extends Query<E>> queries) {
        JdbcEventStore eventStore = eventStore(aggregate.aggregateType());
        return new CqrsFramework<>(aggregate, AggregateStores.aggregateStore(eventStore, aggregate, new JacksonEventConverter<>(objectMapper),
                new JacksonStateConverter<>(objectMapper, stateType)), queries);
    }

    /**
     * @param aggregateType The aggregate type whose events the store manages, in the default event and snapshot tables
     */
    public JdbcEventStore eventStore(String aggregateType) {
        return new JdbcEventStore(jdbcTemplate, new JdbcEventStoreConfig.Builder()
                .aggregateType(aggregateType)
                .transactionConfig(transactionTemplate)
                .objectMapper(objectMapper)
                .build());
    }

    /**
     * @param queryName The name of the query, which is also the name of the table that stores its views
     * @param viewType  The type of the view
     */
    public <V> JdbcViewRepository<V> viewRepository(String queryName, Class<V> viewType) {
        return new JdbcViewRepository<>(jdbcTemplate, queryName, viewType, objectMapper);
    }

    /**
     * A {@link MaterializedView} that stores its views in the table named {@code queryName}
     */
    public <V, E> MaterializedView<V, E> materializedView(String queryName, View<V, E> view, Class<V> viewType) {
        return MaterializedView.create(queryName, view, viewRepository(queryName, viewType));
    }

    public DataSource dataSource() {
        return dataSource;
    }

    /**
     * Close the {@link DataSource} if it's {@link AutoCloseable}. Calling {@code close} more than once has no effect.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (dataSource instanceof AutoCloseable) {
            log.info("Closing data source {}", dataSource);
            try {
                ((AutoCloseable) dataSource).close();
            } catch (Exception e) {
                throw new IllegalStateException("Failed to close data source " + dataSource, e);
            }
        }
    }
}
