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

import java.util.List;

/**
 * Receives the events of every successful command, after they've been committed.
 *
 * @param <E> The type of the domain events
 */
@FunctionalInterface
public interface Query<E> {

    /**
     * @param aggregateId The aggregate that emitted the events
     * @param events      The committed events in sequence order, never empty
     */
    void dispatch(String aggregateId, List<EventEnvelope<E>> events);
}
