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

import java.util.List;
import java.util.function.BiFunction;

/**
 * A structure for representing and updating views based on a view and an event
 *
 * @param <V> The type of the view that this view definition produces
 * @param <E> The type of the events that are used to create the view
 */
public interface View<V, E> {
    /**
     * @return The view before any event has been applied
     */
    V initialState();

    /**
     * Evolve the view by applying the event
     *
     * @param view  The current view
     * @param event The event, with the aggregate id and sequence number it was stored with
     * @return The evolved view
     */
    V evolve(V view, @NonNull EventEnvelope<E> event);

    default V evolve(V view, @NonNull List<EventEnvelope<E>> events) {
        V current = view;
        for (EventEnvelope<E> event : events) {
            current = evolve(current, event);
        }
        return current;
    }

    static <V, E> View<V, E> create(V initialState, @NonNull BiFunction<V, EventEnvelope<E>, V> evolve) {
        return new View<>() {
            @Override
            public V initialState() {
                return initialState;
            }

            @Override
            public V evolve(V view, @NonNull EventEnvelope<E> event) {
                return evolve.apply(view, event);
            }
        };
    }
}
