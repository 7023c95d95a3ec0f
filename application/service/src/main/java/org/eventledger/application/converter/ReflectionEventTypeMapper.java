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

import org.eventledger.eventstore.api.UnknownPersistenceException;

import static java.util.Objects.requireNonNull;

/**
 * A reflection-based {@link EventTypeMapper} that uses either the qualified or the simple name of a domain event class as event type.
 *
 * @param <E> The base-type of your domain events
 */
public class ReflectionEventTypeMapper<E> implements EventTypeMapper<E> {
    private final String packageName;

    private ReflectionEventTypeMapper(String packageName) {
        this.packageName = packageName;
    }

    @Override
    public String getEventType(Class<? extends E> type) {
        requireNonNull(type, "Type cannot be null");
        return packageName == null ? type.getName() : type.getSimpleName();
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T extends E> Class<T> getDomainEventType(String eventType) {
        requireNonNull(eventType, "Event type cannot be null");
        String className = packageName == null ? eventType : packageName + "." + eventType;
        try {
            return (Class<T>) Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new UnknownPersistenceException("No domain event class found for event type " + eventType, e);
        }
    }

    /**
     * Create an instance of {@link ReflectionEventTypeMapper} that uses the fully-qualified name of a class as event type.
     * This ties the stored events to your class names, <b>renaming or moving an event class makes its stored events unreadable</b>.
     */
    public static <E> ReflectionEventTypeMapper<E> qualified() {
        return new ReflectionEventTypeMapper<>(null);
    }

    /**
     * Create an instance of {@link ReflectionEventTypeMapper} that uses the simple name of a class as event type.
     * <p>
     * When getting the domain event type from the event type, the package name of the supplied {@code domainEventType} is prepended.
     * This assumes that <i>all</i> events are top-level classes in the same package as the {@code domainEventType}.
     */
    public static <E> ReflectionEventTypeMapper<E> simple(Class<E> domainEventType) {
        requireNonNull(domainEventType, "Domain event type cannot be null");
        return new ReflectionEventTypeMapper<>(domainEventType.getPackageName());
    }
}
