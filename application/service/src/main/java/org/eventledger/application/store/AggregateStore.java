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

package org.eventledger.application.store;

import org.eventledger.dsl.decider.Decider.Decision;
import org.eventledger.dsl.view.EventEnvelope;

import java.util.List;
import java.util.Map;

/**
 * Loads and commits aggregates. The strategy decides whether state is rebuilt from every event or from a snapshot and
 * the events after it.
 *
 * @param <S> The type of the aggregate state
 * @param <E> The type of the domain events
 */
public interface AggregateStore<S, E> {

    /**
     * @param aggregateId The id of the aggregate to load
     * @return The current state of the aggregate, the initial state if there are no events
     */
    AggregateContext<S> load(String aggregateId);

    /**
     * Append the events of {@code decision} to the aggregate, expecting it to still be at the version it had when {@code context} was loaded.
     *
     * @param context  The context returned from {@link #load(String)}
     * @param decision The new events, in order, and the state after applying them to {@code context.state()}
     * @param metadata Metadata to store alongside every event
     * @return The committed events, with the sequence numbers they were stored with
     */
    List<EventEnvelope<E>> commit(AggregateContext<S> context, Decision<S, E> decision, Map<String, String> metadata);
}
