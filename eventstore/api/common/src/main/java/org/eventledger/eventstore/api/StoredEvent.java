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

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * An event that has been committed to an aggregate's event stream.
 *
 * @param aggregateType The type of the aggregate, for example "BankAccount"
 * @param aggregateId   The id of the aggregate instance
 * @param sequence      The version at which the event was committed. Sequences are contiguous and start at {@code 1}.
 * @param eventType     The event type discriminator
 * @param payload       The serialized domain event
 * @param metadata      The metadata that was stored together with the event
 */
public record StoredEvent(String aggregateType, String aggregateId, long sequence, String eventType, JsonNode payload, Map<String, String> metadata) {

    public StoredEvent {
        requireNonNull(aggregateType, "Aggregate type cannot be null");
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(eventType, "Event type cannot be null");
        requireNonNull(payload, "Payload cannot be null");
        if (sequence < 1) {
            throw new IllegalArgumentException("Sequence must be greater than 0 but was " + sequence);
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
