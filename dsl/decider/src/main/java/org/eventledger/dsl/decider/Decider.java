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

package org.eventledger.dsl.decider;

import org.jspecify.annotations.NonNull;

import java.util.List;
import java.util.function.BiFunction;

import static java.util.Objects.requireNonNull;

/**
 * A decider is the business logic of an aggregate, expressed as three pure functions:
 * <ol>
 *     <li>{@link #initialState()}, the state of an aggregate that has no events,</li>
 *     <li>{@link #decide(Object, Object)}, which validates a command against the current state and returns the resulting events,</li>
 *     <li>{@link #evolve(Object, Object)}, which applies one event to the state.</li>
 * </ol>
 * A decider rejects a command by throwing an exception from {@code decide}, the state is never touched by {@code decide}.
 *
 * @param <C> The type of commands that the decider can handle
 * @param <S> The state that the decider works on
 * @param <E> The type of events that the decider returns
 */
public interface Decider<C, S, E> {
    S initialState();

    @NonNull
    List<E> decide(@NonNull C command, S state);

    S evolve(S state, @NonNull E event);

    /**
     * Apply the {@code events} to {@code state} in order.
     *
     * @param state  The state to start from
     * @param events The events to apply
     * @return The resulting state
     */
    default S fold(S state, List<E> events) {
        S current = state;
        for (E event : events) {
            current = evolve(current, event);
        }
        return current;
    }

    /**
     * Decide on {@code command} given {@code state} and evolve the state through the resulting events.
     *
     * @return The new events and the state after applying them
     */
    @NonNull
    default Decision<S, E> decideOnState(S state, @NonNull C command) {
        List<E> newEvents = decide(command, state);
        requireNonNull(newEvents, "Decide cannot return null, return an empty list instead");
        return new Decision<>(fold(state, newEvents), newEvents);
    }

    /**
     * Rebuild the state from {@code events}, starting from the {@link #initialState()}, and then decide on {@code command}.
     *
     * @return The new events (not including the supplied ones) and the state after applying them
     */
    @NonNull
    default Decision<S, E> decideOnEvents(List<E> events, @NonNull C command) {
        return decideOnState(fold(initialState(), events), command);
    }

    record Decision<S, E>(S state, List<E> events) {
        public Decision {
            events = events == null ? List.of() : List.copyOf(events);
        }
    }

    static <C, S, E> Decider<C, S, E> create(S initialState, @NonNull BiFunction<C, S, List<E>> decide, @NonNull BiFunction<S, E, S> evolve) {
        requireNonNull(decide, "Decide function cannot be null");
        requireNonNull(evolve, "Evolve function cannot be null");
        return new Decider<>() {
            @Override
            public S initialState() {
                return initialState;
            }

            @NonNull
            @Override
            public List<E> decide(@NonNull C command, S state) {
                return decide.apply(command, state);
            }

            @Override
            public S evolve(S state, @NonNull E event) {
                return evolve.apply(state, event);
            }
        };
    }
}
