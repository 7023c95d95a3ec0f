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

package org.eventledger.application.store;

import org.eventledger.application.converter.EventConverter;
import org.eventledger.dsl.decider.Decider;
import org.eventledger.dsl.decider.Decider.Decision;
import org.eventledger.dsl.view.EventEnvelope;
import org.eventledger.eventstore.api.AppendResult;
import org.eventledger.eventstore.api.StoredEvent;
import org.eventledger.eventstore.api.blocking.EventStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * An {@link AggregateStore} that rebuilds the state by applying every event of the aggregate to the initial state.
 *
 * @param <S> The type of the aggregate state
 * @param <E> The type of the domain events
 */
public class EventSourcedAggregateStore<S, E> implements AggregateStore<S, E> {

    protected final EventStore eventStore;
    protected final Decider<?, S, E> decider;
    protected final EventConverter<E> eventConverter;

    public EventSourcedAggregateStore(EventStore eventStore, Decider<?, S, E> decider, EventConverter<E> eventConverter) {
        requireNonNull(eventStore, EventStore.class.getSimpleName() + " cannot be null");
        requireNonNull(decider, Decider.class.getSimpleName() + " cannot be null");
        requireNonNull(eventConverter, EventConverter.class.getSimpleName() + " cannot be null");
        this.eventStore = eventStore;
        this.decider = decider;
        this.eventConverter = eventConverter;
    }

    @Override
    public AggregateContext<S> load(String aggregateId) {
        List<StoredEvent> storedEvents = eventStore.load(aggregateId).eventList();
        S state = decider.fold(decider.initialState(), eventConverter.toDomainEvents(storedEvents));
        long currentSequence = storedEvents.isEmpty() ? 0 : storedEvents.get(storedEvents.size() - 1).sequence();
        return new AggregateContext<>(aggregateId, state, currentSequence, 0);
    }

    @Override
    public List<EventEnvelope<E>> commit(AggregateContext<S> context, Decision<S, E> decision, Map<String, String> metadata) {
        List<E> events = decision.events();
        AppendResult result = eventStore.append(context.aggregateId(), context.currentSequence(), eventConverter.toNewEvents(events, metadata));
        List<EventEnvelope<E>> committed = new ArrayList<>(events.size());
        long sequence = result.getOldVersion();
        for (E event : events) {
            committed.add(new EventEnvelope<>(context.aggregateId(), ++sequence, event, metadata));
        }
        return committed;
    }
}
