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

package org.eventledger.dsl.view;

import org.jspecify.annotations.NonNull;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A committed event together with where it belongs: the aggregate that emitted it, its sequence number in the
 * aggregate's event stream and the metadata that was supplied when the command was executed.
 *
 * @param <E> The type of the domain event
 */
public record EventEnvelope<E>(@NonNull String aggregateId, long sequence, @NonNull E payload, @NonNull Map<String, String> metadata) {

    public EventEnvelope {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(payload, "Payload cannot be null");
        if (sequence < 1) {
            throw new IllegalArgumentException("Sequence must be greater than 0 but was " + sequence);
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
