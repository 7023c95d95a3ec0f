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

package org.eventledger.eventstore.jdbc.reactor;

import com.fasterxml.jackson.databind.JsonNode;
import org.eventledger.eventstore.api.AppendResult;
import org.eventledger.eventstore.api.NewEvent;
import org.eventledger.eventstore.api.StoredEvent;
import org.eventledger.eventstore.api.reactor.SnapshotStore;
import org.eventledger.eventstore.jdbc.JdbcEventStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A reactive facade of the {@link JdbcEventStore}. JDBC is a blocking API so every call is subscribed on a {@link Scheduler}
 * meant for blocking work, {@link Schedulers#boundedElastic()} unless another one is supplied.
 * Nothing happens until the returned publisher is subscribed to.
 */
public class ReactorJdbcEventStore implements SnapshotStore {

    private final JdbcEventStore eventStore;
    private final Scheduler scheduler;

    public ReactorJdbcEventStore(JdbcEventStore eventStore) {
        this(eventStore, Schedulers.boundedElastic());
    }

    public ReactorJdbcEventStore(JdbcEventStore eventStore, Scheduler scheduler) {
        requireNonNull(eventStore, JdbcEventStore.class.getSimpleName() + " cannot be null");
        requireNonNull(scheduler, Scheduler.class.getSimpleName() + " cannot be null");
        this.eventStore = eventStore;
        this.scheduler = scheduler;
    }

    @Override
    public Mono<AppendResult> append(String aggregateId, long expectedVersion, List<NewEvent> events) {
        return Mono.fromCallable(() -> eventStore.append(aggregateId, expectedVersion, events)).subscribeOn(scheduler);
    }

    @Override
    public Flux<StoredEvent> load(String aggregateId) {
        return Flux.defer(() -> Flux.fromStream(eventStore.load(aggregateId).events())).subscribeOn(scheduler);
    }

    @Override
    public Mono<Long> currentVersion(String aggregateId) {
        return Mono.fromCallable(() -> eventStore.currentVersion(aggregateId)).subscribeOn(scheduler);
    }

    @Override
    public Mono<Void> saveSnapshot(String aggregateId, long sequence, JsonNode state) {
        return Mono.<Void>fromRunnable(() -> eventStore.saveSnapshot(aggregateId, sequence, state)).subscribeOn(scheduler);
    }

    @Override
    public Mono<SnapshotAndEvents> loadFromSnapshot(String aggregateId) {
        return Mono.fromCallable(() -> {
            org.eventledger.eventstore.api.blocking.SnapshotAndEvents snapshotAndEvents = eventStore.loadFromSnapshot(aggregateId);
            Flux<StoredEvent> events = Flux.defer(() -> Flux.fromStream(snapshotAndEvents.events().events())).subscribeOn(scheduler);
            return new SnapshotAndEvents(snapshotAndEvents.snapshot(), events);
        }).subscribeOn(scheduler);
    }
}
