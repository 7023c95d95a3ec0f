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

import static java.util.Objects.requireNonNull;

/**
 * The state of an aggregate as it was loaded, together with what's needed to commit new events on top of it.
 *
 * @param aggregateId      The id of the aggregate
 * @param state            The state after applying every event up to and including {@code currentSequence}
 * @param currentSequence  The sequence number of the latest event, 0 if the aggregate has no events. This is the expected version when committing.
 * @param snapshotSequence The sequence number that the loaded snapshot covers, 0 if the state wasn't loaded from a snapshot
 * @param <S>              The type of the aggregate state
 */
public record AggregateContext<S>(String aggregateId, S state, long currentSequence, long snapshotSequence) {

    public AggregateContext {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        if (currentSequence < 0) {
            throw new IllegalArgumentException("Current sequence cannot be negative but was " + currentSequence);
        }
        if (snapshotSequence < 0 || snapshotSequence > currentSequence) {
            throw new IllegalArgumentException("Snapshot sequence must be between 0 and " + currentSequence + " but was " + snapshotSequence);
        }
    }

    /**
     * @return The number of events that had to be folded on top of the snapshot (or the initial state) when loading
     */
    public long eventsSinceSnapshot() {
        return currentSequence - snapshotSequence;
    }
}
