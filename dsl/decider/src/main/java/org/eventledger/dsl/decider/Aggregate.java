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

import static java.util.Objects.requireNonNull;

/**
 * A {@link Decider} with a name. The aggregate type is stored with every event and snapshot and tells
 * event streams of different kinds of aggregates apart.
 *
 * @param <C> The type of commands that the aggregate can handle
 * @param <S> The state of the aggregate
 * @param <E> The type of events that the aggregate emits
 */
public interface Aggregate<C, S, E> extends Decider<C, S, E> {

    String aggregateType();

    static <C, S, E> Aggregate<C, S, E> of(String aggregateType, Decider<C, S, E> decider) {
        requireNonNull(aggregateType, "Aggregate type cannot be null");
        requireNonNull(decider, Decider.class.getSimpleName() + " cannot be null");
        return new Aggregate<>() {
            @Override
            public String aggregateType() {
                return aggregateType;
            }

            @Override
            public S initialState() {
                return decider.initialState();
            }

            @NonNull
            @Override
            public List<E> decide(@NonNull C command, S state) {
                return decider.decide(command, state);
            }

            @Override
            public S evolve(S state, @NonNull E event) {
                return decider.evolve(state, event);
            }

            @Override
            public String toString() {
                return "Aggregate[" + aggregateType + "]";
            }
        };
    }
}
