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

package org.eventledger.eventstore.api;

import com.fasterxml.jackson.databind.JsonNode;

import static java.util.Objects.requireNonNull;

/**
 * The current snapshot of an aggregate, i.e. its state folded from all events up to and including {@code sequence}.
 *
 * @param aggregateType The type of the aggregate
 * @param aggregateId   The id of the aggregate instance
 * @param sequence      The sequence number of the last event folded into the snapshot
 * @param state         The serialized aggregate state
 */
public record StoredSnapshot(String aggregateType, String aggregateId, long sequence, JsonNode state) {

    public StoredSnapshot {
        requireNonNull(aggregateType, "Aggregate type cannot be null");
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(state, "State cannot be null");
        if (sequence < 0) {
            throw new IllegalArgumentException("Sequence cannot be negative but was " + sequence);
        }
    }
}
