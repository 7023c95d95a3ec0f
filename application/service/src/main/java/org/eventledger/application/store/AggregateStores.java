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
import org.eventledger.eventstore.api.blocking.EventStore;
import org.eventledger.eventstore.api.blocking.SnapshotStore;

/**
 * Factory methods for the {@link AggregateStore} strategies
 */
public class AggregateStores {

    private AggregateStores() {
    }

    /**
     * Every load replays all events of the aggregate.
     */
    public static <S, E> AggregateStore<S, E> eventSourced(EventStore eventStore, Decider<?, S, E> decider, EventConverter<E> eventConverter) {
        return new EventSourcedAggregateStore<>(eventStore, decider, eventConverter);
    }

    /**
     * Every load replays the events after the latest snapshot, a new snapshot is saved once {@code snapshotFrequency} events have
     * been committed after it.
     */
    public static <S, E> AggregateStore<S, E> snapshotting(SnapshotStore snapshotStore, Decider<?, S, E> decider, EventConverter<E> eventConverter,
                                                          StateConverter<S> stateConverter, int snapshotFrequency) {
        return new SnapshottingAggregateStore<>(snapshotStore, decider, eventConverter, stateConverter, snapshotFrequency);
    }

    /**
     * The latest state is the unit of load: the snapshot is replaced on every commit. Events are still appended and any event after the
     * snapshot is applied on load, so a snapshot that failed to be saved is caught up with by the next commit.
     */
    public static <S, E> AggregateStore<S, E> aggregateStore(SnapshotStore snapshotStore, Decider<?, S, E> decider, EventConverter<E> eventConverter,
                                                            StateConverter<S> stateConverter) {
        return new SnapshottingAggregateStore<>(snapshotStore, decider, eventConverter, stateConverter, 1);
    }
}
