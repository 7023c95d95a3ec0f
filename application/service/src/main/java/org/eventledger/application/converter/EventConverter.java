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

package org.eventledger.application.converter;

import org.eventledger.eventstore.api.NewEvent;
import org.eventledger.eventstore.api.StoredEvent;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts domain events to the representation that is appended to an event store and back.
 *
 * @param <E> The type of your domain event(s) to convert
 */
public interface EventConverter<E> {

    /**
     * @param domainEvent The domain event to convert
     * @param metadata    Metadata to store alongside the event
     * @return A {@link NewEvent} converted from the {@code domainEvent}
     */
    NewEvent toNewEvent(E domainEvent, Map<String, String> metadata);

    /**
     * @param storedEvent The stored event to convert
     * @return The domain event converted from the {@code storedEvent}
     */
    E toDomainEvent(StoredEvent storedEvent);

    default List<NewEvent> toNewEvents(List<E> domainEvents, Map<String, String> metadata) {
        return domainEvents.stream().map(e -> toNewEvent(e, metadata)).collect(Collectors.toList());
    }

    default List<E> toDomainEvents(List<StoredEvent> storedEvents) {
        return storedEvents.stream().map(this::toDomainEvent).collect(Collectors.toList());
    }
}
