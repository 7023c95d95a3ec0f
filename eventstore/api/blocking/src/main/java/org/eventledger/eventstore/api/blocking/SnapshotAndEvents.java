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

import org.eventledger.eventstore.api.StoredEvent;
import org.eventledger.eventstore.api.StoredSnapshot;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The result of {@link SnapshotStore#loadFromSnapshot(String)}.
 *
 * @param snapshot The current snapshot, empty if there is none
 * @param events   The events committed after the snapshot
 */
public record SnapshotAndEvents(Optional<StoredSnapshot> snapshot, EventStream<StoredEvent> events) {

    public SnapshotAndEvents {
        requireNonNull(snapshot, "Snapshot cannot be null");
        requireNonNull(events, "Events cannot be null");
    }

    /**
     * @return The sequence number of the last event folded into the snapshot, {@code 0} if there is no snapshot.
     */
    public long snapshotSequence() {
        return snapshot.map(StoredSnapshot::sequence).orElse(0L);
    }
}
