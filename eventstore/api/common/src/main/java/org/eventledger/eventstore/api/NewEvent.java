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
 * An event that should be appended to an aggregate's event stream. It has no sequence number yet, it's assigned by the store at commit time.
 *
 * @param eventType The event type discriminator, used to deserialize the payload into a domain event when loading
 * @param payload   The serialized domain event
 * @param metadata  Metadata such as correlation id or user id, may be empty but not {@code null}
 */
public record NewEvent(String eventType, JsonNode payload, Map<String, String> metadata) {

    public NewEvent {
        requireNonNull(eventType, "Event type cannot be null");
        requireNonNull(payload, "Payload cannot be null");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public NewEvent(String eventType, JsonNode payload) {
        this(eventType, payload, Map.of());
    }
}
