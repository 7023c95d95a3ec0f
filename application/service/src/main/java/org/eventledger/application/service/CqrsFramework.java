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

package org.eventledger.application.service;

import org.eventledger.application.store.AggregateContext;
import org.eventledger.application.store.AggregateStore;
import org.eventledger.dsl.decider.Aggregate;
import org.eventledger.dsl.decider.Decider.Decision;
import org.eventledger.dsl.view.EventEnvelope;
import org.eventledger.dsl.view.Query;
import org.eventledger.eventstore.api.OptimisticLockException;
import org.eventledger.eventstore.api.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Executes commands against an {@link Aggregate}:
 * <ol>
 *     <li>the aggregate is loaded by the {@link AggregateStore},</li>
 *     <li>the command is decided on the loaded state,</li>
 *     <li>the new events are committed, expecting the aggregate to be at the version it was loaded at,</li>
 *     <li>the committed events are dispatched to every {@link Query} in registration order.</li>
 * </ol>
 * Commands are never retried, an {@link AggregateConflictException} tells the caller that the command may be executed again.
 * A {@link org.eventledger.eventstore.api.StorageProtocolViolationException} is propagated as is.
 *
 * @param <C> The type of commands
 * @param <S> The type of the aggregate state
 * @param <E> The type of the domain events
 */
public class CqrsFramework<C, S, E> {
    private static final Logger log = LoggerFactory.getLogger(CqrsFramework.class);

    private final Aggregate<C, S, E> aggregate;
    private final AggregateStore<S, E> aggregateStore;
    private final List<Query<E>> queries;

    public CqrsFramework(Aggregate<C, S, E> aggregate, AggregateStore<S, E> aggregateStore, List<? extends Query<E>> queries) {
        requireNonNull(aggregate, Aggregate.class.getSimpleName() + " cannot be null");
        requireNonNull(aggregateStore, AggregateStore.class.getSimpleName() + " cannot be null");
        requireNonNull(queries, "Queries cannot be null");
        this.aggregate = aggregate;
        this.aggregateStore = aggregateStore;
        this.queries = List.copyOf(queries);
    }

    /**
     * Execute {@code command} against the aggregate with id {@code aggregateId}
     *
     * @return The committed events, empty if the command didn't result in any events
     * @throws UserErrorException           If the command was rejected
     * @throws AggregateConflictException   If the aggregate was changed concurrently
     * @throws AggregateTechnicalException  If the aggregate couldn't be loaded or committed
     */
    public List<EventEnvelope<E>> execute(String aggregateId, C command) {
        return executeWithMetadata(aggregateId, command, Collections.emptyMap());
    }

    /**
     * Execute {@code command} against the aggregate with id {@code aggregateId} and store {@code metadata} with every new event
     *
     * @return The committed events, empty if the command didn't result in any events
     * @see #execute(String, Object)
     */
    public List<EventEnvelope<E>> executeWithMetadata(String aggregateId, C command, Map<String, String> metadata) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(command, "Command cannot be null");
        requireNonNull(metadata, "Metadata cannot be null");
        if (aggregateId.isBlank()) {
            throw new IllegalArgumentException("Aggregate id cannot be blank");
        }

        final AggregateContext<S> context;
        try {
            context = aggregateStore.load(aggregateId);
        } catch (PersistenceException e) {
            throw translate(aggregateId, e);
        }

        Decision<S, E> decision = aggregate.decideOnState(context.state(), command);
        if (decision.events().isEmpty()) {
            log.debug("Command {} on {} {} resulted in no events", command.getClass().getSimpleName(), aggregate.aggregateType(), aggregateId);
            return Collections.emptyList();
        }

        final List<EventEnvelope<E>> committed;
        try {
            committed = aggregateStore.commit(context, decision, metadata);
        } catch (PersistenceException e) {
            throw translate(aggregateId, e);
        }
        log.debug("Committed {} event(s) to {} {}", committed.size(), aggregate.aggregateType(), aggregateId);

        for (Query<E> query : queries) {
            query.dispatch(aggregateId, committed);
        }
        return committed;
    }

    public String aggregateType() {
        return aggregate.aggregateType();
    }

    private static AggregateException translate(String aggregateId, PersistenceException e) {
        if (e instanceof OptimisticLockException) {
            return new AggregateConflictException(aggregateId, (OptimisticLockException) e);
        }
        return new AggregateTechnicalException(aggregateId, e);
    }
}
