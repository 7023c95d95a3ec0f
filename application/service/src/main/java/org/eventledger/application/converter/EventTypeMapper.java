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

/**
 * Maps a domain event class to the event type that is stored with the event, and back.
 *
 * @param <E> The base-type of your domain events
 */
public interface EventTypeMapper<E> {

    String getEventType(Class<? extends E> type);

    <T extends E> Class<T> getDomainEventType(String eventType);
}
