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

package org.eventledger.eventstore.api.blocking;

import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Represents the events of an aggregate instance, ordered by sequence number ascending.
 * <p>
 * An event stream is lazy, finite and restartable: nothing is read until {@link #events()} is called, and every call to
 * {@link #events()} re-reads the current state of the store. It's not a live subscription.
 */
@SuppressWarnings("NullableProblems")
public interface EventStream<T> extends Iterable<T> {

    /**
     * @return The id of the aggregate instance that the events belong to
     */
    String id();

    /**
     * @return The events as a {@link Stream}.
     */
    Stream<T> events();

    @Override
    default Iterator<T> iterator() {
        return events().iterator();
    }

    /**
     * @return {@code true} if there are no events, {@code false} otherwise.
     */
    default boolean isEmpty() {
        return events().findAny().isEmpty();
    }

    /**
     * @return The events in this stream as a list
     */
    default List<T> eventList() {
        return events().collect(Collectors.toList());
    }

    /**
     * Apply a mapping function to the {@link EventStream}
     *
     * @param fn   The function to apply for each event.
     * @param <T2> The return type
     * @return A new {@link EventStream} where events are converted to {@code T2}.
     */
    default <T2> EventStream<T2> map(Function<T, T2> fn) {
        requireNonNull(fn, "Mapping function cannot be null");
        return of(id(), () -> events().map(fn).collect(Collectors.toList()));
    }

    /**
     * Create an {@link EventStream} that calls {@code reader} each time the events are requested.
     *
     * @param id     The aggregate id
     * @param reader Reads the events, invoked once per call to {@link #events()}
     */
    static <T> EventStream<T> of(String id, Supplier<List<T>> reader) {
        requireNonNull(id, "Id cannot be null");
        requireNonNull(reader, "Reader cannot be null");
        return new EventStream<>() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public Stream<T> events() {
                List<T> events = reader.get();
                return events == null ? Stream.empty() : events.stream();
            }

            @Override
            public String toString() {
                return "EventStream{" +
                        "id='" + id + '\'' +
                        '}';
            }
        };
    }

    /**
     * @return An {@link EventStream} without events
     */
    static <T> EventStream<T> empty(String id) {
        return of(id, List::of);
    }
}
