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
import org.eventledger.application.converter.StateConverter;
import org.eventledger.dsl.decider.Decider;
import org.eventledger.dsl.decider.Decider.Decision;
import org.eventledger.dsl.view.EventEnvelope;
import org.eventledger.eventstore.api.PersistenceException;
import org.eventledger.eventstore.api.StoredEvent;
import org.eventledger.eventstore.api.blocking.SnapshotAndEvents;
import org.eventledger.eventstore.api.blocking.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * An {@link AggregateStore} that loads the latest snapshot and applies the events stored after it. Once at least
 * {@code snapshotFrequency} events have been committed on top of the loaded snapshot, a new snapshot of the state after
 * the commit is saved.
 * <p>
 * The events are committed before the snapshot is saved. If saving the snapshot fails the failure is logged and the
 * commit still succeeds, the next load simply applies more events on top of the older snapshot.
 * </p>
 *
 * @param <S> The type of the aggregate state
 * @param <E> The type of the domain events
 */
public class SnapshottingAggregateStore<S, E> extends EventSourcedAggregateStore<S, E> {
    private static final Logger log = LoggerFactory.getLogger(SnapshottingAggregateStore.class);

    private final SnapshotStore snapshotStore;
    private final StateConverter<S> stateConverter;
    private final int snapshotFrequency;

    public SnapshottingAggregateStore(SnapshotStore snapshotStore, Decider<?, S, E> decider, EventConverter<E> eventConverter, StateConverter<S> stateConverter, int snapshotFrequency) {
        super(snapshotStore, decider, eventConverter);
        requireNonNull(stateConverter, StateConverter.class.getSimpleName() + " cannot be null");
        if (snapshotFrequency < 1) {
            throw new IllegalArgumentException("Snapshot frequency must be greater than 0 but was " + snapshotFrequency);
        }
        this.snapshotStore = snapshotStore;
        this.stateConverter = stateConverter;
        this.snapshotFrequency = snapshotFrequency;
    }

    @Override
    public AggregateContext<S> load(String aggregateId) {
        SnapshotAndEvents snapshotAndEvents = snapshotStore.loadFromSnapshot(aggregateId);
        S snapshotState = snapshotAndEvents.snapshot()
                .map(snapshot -> stateConverter.fromJson(snapshot.state()))
                .orElseGet(decider::initialState);
        long snapshotSequence = snapshotAndEvents.snapshotSequence();

        List<StoredEvent> storedEvents = snapshotAndEvents.events().eventList();
        S state = decider.fold(snapshotState, eventConverter.toDomainEvents(storedEvents));
        long currentSequence = storedEvents.isEmpty() ? snapshotSequence : storedEvents.get(storedEvents.size() - 1).sequence();
        return new AggregateContext<>(aggregateId, state, currentSequence, snapshotSequence);
    }

    @Override
    public List<EventEnvelope<E>> commit(AggregateContext<S> context, Decision<S, E> decision, Map<String, String> metadata) {
        List<EventEnvelope<E>> committed = super.commit(context, decision, metadata);
        if (committed.isEmpty()) {
            return committed;
        }

        long newSequence = committed.get(committed.size() - 1).sequence();
        if (newSequence - context.snapshotSequence() >= snapshotFrequency) {
            try {
                snapshotStore.saveSnapshot(context.aggregateId(), newSequence, stateConverter.toJson(decision.state()));
            } catch (PersistenceException e) {
                log.warn("Failed to save snapshot of aggregate {} at sequence {}, the events were committed: {}", context.aggregateId(), newSequence, e.toString());
            }
        }
        return committed;
    }

    public int snapshotFrequency() {
        return snapshotFrequency;
    }
}
