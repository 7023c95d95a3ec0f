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

package org.eventledger.eventstore.api.reactor;

import com.fasterxml.jackson.databind.JsonNode;
import org.eventledger.eventstore.api.StoredEvent;
import org.eventledger.eventstore.api.StoredSnapshot;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * A non-blocking {@link EventStore} that also stores the current snapshot of an aggregate instance.
 */
public interface SnapshotStore extends EventStore {

    /**
     * Replace (or create) the current snapshot, see {@link org.eventledger.eventstore.api.blocking.SnapshotStore#saveSnapshot(String, long, JsonNode)}.
     */
    Mono<Void> saveSnapshot(String aggregateId, long sequence, JsonNode state);

    /**
     * Load the current snapshot and the events committed after it.
     */
    Mono<SnapshotAndEvents> loadFromSnapshot(String aggregateId);

    /**
     * @param snapshot The current snapshot, empty if there is none
     * @param events   The events committed after the snapshot, re-read on each subscription
     */
    record SnapshotAndEvents(Optional<StoredSnapshot> snapshot, Flux<StoredEvent> events) {
    }
}
