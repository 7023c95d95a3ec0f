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

package org.eventledger.application;

import com.fasterxml.jackson.databind.JsonNode;
import org.eventledger.eventstore.api.AppendResult;
import org.eventledger.eventstore.api.NewEvent;
import org.eventledger.eventstore.api.OptimisticLockException;
import org.eventledger.eventstore.api.PersistenceConnectionException;
import org.eventledger.eventstore.api.StoredEvent;
import org.eventledger.eventstore.api.StoredSnapshot;
import org.eventledger.eventstore.api.blocking.EventStream;
import org.eventledger.eventstore.api.blocking.SnapshotAndEvents;
import org.eventledger.eventstore.api.blocking.SnapshotStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * A snapshot store that keeps everything in memory and has the same concurrency semantics as the JDBC store
 */
public class InMemorySnapshotStore implements SnapshotStore {
    private final String aggregateType;
    private final Map<String, List<StoredEvent>> events = new ConcurrentHashMap<>();
    private final Map<String, StoredSnapshot> snapshots = new ConcurrentHashMap<>();
    private final List<Long> savedSnapshotSequences = new ArrayList<>();
    private volatile boolean failSnapshots;

    public InMemorySnapshotStore(String aggregateType) {
        this.aggregateType = aggregateType;
    }

    @Override
    public synchronized AppendResult append(String aggregateId, long expectedVersion, List<NewEvent> newEvents) {
        long currentVersion = currentVersion(aggregateId);
        if (newEvents.isEmpty()) {
            return new AppendResult(aggregateId, expectedVersion, expectedVersion);
        }
        if (currentVersion != expectedVersion) {
            throw new OptimisticLockException("Expected version " + expectedVersion + " but was " + currentVersion);
        }
        List<StoredEvent> stream = events.computeIfAbsent(aggregateId, __ -> new ArrayList<>());
        long sequence = currentVersion;
        for (NewEvent newEvent : newEvents) {
            stream.add(new StoredEvent(aggregateType, aggregateId, ++sequence, newEvent.eventType(), newEvent.payload(), newEvent.metadata()));
        }
        return new AppendResult(aggregateId, currentVersion, sequence);
    }

    @Override
    public synchronized EventStream<StoredEvent> load(String aggregateId) {
        return EventStream.of(aggregateId, () -> eventsAfter(aggregateId, 0));
    }

    @Override
    public synchronized long currentVersion(String aggregateId) {
        List<StoredEvent> stream = events.getOrDefault(aggregateId, List.of());
        return stream.isEmpty() ? 0 : stream.get(stream.size() - 1).sequence();
    }

    @Override
    public synchronized void saveSnapshot(String aggregateId, long sequence, JsonNode state) {
        if (failSnapshots) {
            throw new PersistenceConnectionException("Snapshot table unavailable", null);
        }
        if (sequence > currentVersion(aggregateId)) {
            throw new IllegalArgumentException("Snapshot ahead of events");
        }
        StoredSnapshot existing = snapshots.get(aggregateId);
        if (existing != null && existing.sequence() > sequence) {
            return;
        }
        snapshots.put(aggregateId, new StoredSnapshot(aggregateType, aggregateId, sequence, state));
        savedSnapshotSequences.add(sequence);
    }

    @Override
    public synchronized SnapshotAndEvents loadFromSnapshot(String aggregateId) {
        Optional<StoredSnapshot> snapshot = Optional.ofNullable(snapshots.get(aggregateId));
        long after = snapshot.map(StoredSnapshot::sequence).orElse(0L);
        return new SnapshotAndEvents(snapshot, EventStream.of(aggregateId, () -> eventsAfter(aggregateId, after)));
    }

    public void failSnapshots(boolean failSnapshots) {
        this.failSnapshots = failSnapshots;
    }

    public synchronized List<Long> savedSnapshotSequences() {
        return new ArrayList<>(savedSnapshotSequences);
    }

    private synchronized List<StoredEvent> eventsAfter(String aggregateId, long sequence) {
        return events.getOrDefault(aggregateId, List.of()).stream().filter(e -> e.sequence() > sequence).collect(Collectors.toList());
    }
}
