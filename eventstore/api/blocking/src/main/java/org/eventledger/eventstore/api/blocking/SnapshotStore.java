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

package org.eventledger.eventstore.api.blocking;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An {@link EventStore} that is also able to store the current snapshot of an aggregate instance, which reduces the number of events that must be
 * replayed when loading it.
 */
public interface SnapshotStore extends EventStore {

    /**
     * Replace the current snapshot of the aggregate instance, or create it if it doesn't exist. Must be called <i>after</i> the events
     * up to {@code sequence} have been appended.
     * <p>
     * A snapshot never replaces one with a higher sequence, saving an older state than the stored one leaves the stored one in place.
     * When two callers create the first snapshot of an instance at the same time, one of them fails with an
     * {@link org.eventledger.eventstore.api.OptimisticLockException} and the other one's snapshot is kept.
     * </p>
     *
     * @param aggregateId The id of the aggregate instance
     * @param sequence    The sequence number of the last event that is folded into {@code state}
     * @param state       The serialized aggregate state
     * @throws IllegalArgumentException If {@code sequence} is greater than the current version of the event stream
     */
    void saveSnapshot(String aggregateId, long sequence, JsonNode state);

    /**
     * Load the current snapshot (if any) and the events that were committed after it.
     *
     * @param aggregateId The id of the aggregate instance
     * @return The snapshot and the events with a sequence number greater than the snapshot sequence. If there's no snapshot, all events are returned.
     */
    SnapshotAndEvents loadFromSnapshot(String aggregateId);
}
