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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventledger.eventstore.api.NewEvent;
import org.eventledger.eventstore.api.StoredEvent;
import org.eventledger.eventstore.api.UnknownPersistenceException;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * An {@link EventConverter} that uses a Jackson {@link ObjectMapper} to convert a domain event to the JSON payload of a {@link NewEvent}.
 * The event type is derived from the class of the domain event by an {@link EventTypeMapper}, the fully-qualified class name unless
 * another mapper is supplied. <b>You should definitely change this in production!</b>
 *
 * @param <E> The type of your domain event(s) to convert
 */
public class JacksonEventConverter<E> implements EventConverter<E> {

    private final ObjectMapper objectMapper;
    private final EventTypeMapper<E> eventTypeMapper;

    public JacksonEventConverter(ObjectMapper objectMapper) {
        this(objectMapper, ReflectionEventTypeMapper.qualified());
    }

    public JacksonEventConverter(ObjectMapper objectMapper, EventTypeMapper<E> eventTypeMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(eventTypeMapper, EventTypeMapper.class.getSimpleName() + " cannot be null");
        this.objectMapper = objectMapper;
        this.eventTypeMapper = eventTypeMapper;
    }

    @SuppressWarnings("unchecked")
    @Override
    public NewEvent toNewEvent(E domainEvent, Map<String, String> metadata) {
        requireNonNull(domainEvent, "Domain event cannot be null");
        final JsonNode payload;
        try {
            payload = objectMapper.valueToTree(domainEvent);
        } catch (IllegalArgumentException e) {
            throw new UnknownPersistenceException("Failed to serialize " + domainEvent.getClass().getName() + ": " + e.getMessage(), e);
        }
        return new NewEvent(eventTypeMapper.getEventType((Class<? extends E>) domainEvent.getClass()), payload, metadata);
    }

    @Override
    public E toDomainEvent(StoredEvent storedEvent) {
        requireNonNull(storedEvent, StoredEvent.class.getSimpleName() + " cannot be null");
        Class<? extends E> domainEventType = eventTypeMapper.getDomainEventType(storedEvent.eventType());
        try {
            return objectMapper.treeToValue(storedEvent.payload(), domainEventType);
        } catch (JsonProcessingException e) {
            throw new UnknownPersistenceException(String.format("Failed to deserialize event %d of %s %s to %s: %s", storedEvent.sequence(), storedEvent.aggregateType(),
                    storedEvent.aggregateId(), domainEventType.getName(), e.getOriginalMessage()), e);
        }
    }
}
