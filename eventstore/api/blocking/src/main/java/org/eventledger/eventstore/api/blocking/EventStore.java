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

import org.eventledger.eventstore.api.AppendResult;
import org.eventledger.eventstore.api.NewEvent;
import org.eventledger.eventstore.api.OptimisticLockException;
import org.eventledger.eventstore.api.PersistenceConnectionException;
import org.eventledger.eventstore.api.StoredEvent;
import org.eventledger.eventstore.api.UnknownPersistenceException;

import java.util.List;

/**
 * An event store that appends events to, and loads events from, the event stream of an aggregate instance.
 * <p>
 * Failures are reported as one of the following exceptions:
 *
 * <table>
 *     <tr><th>Exception</th><th>Description</th></tr>
 *     <tr><td>{@link OptimisticLockException}</td><td>When the expected version didn't match, nothing was written</td></tr>
 *     <tr><td>{@link PersistenceConnectionException}</td><td>When the database couldn't be reached, safe to retry</td></tr>
 *     <tr><td>{@link UnknownPersistenceException}</td><td>Serialization problems and unanticipated database errors</td></tr>
 * </table>
 */
public interface EventStore {

    /**
     * Append {@code events} to the event stream of {@code aggregateId} as a single indivisible unit. The events are
     * assigned contiguous sequence numbers starting at {@code expectedVersion + 1}. Either all events are written or none.
     *
     * @param aggregateId     The id of the aggregate instance
     * @param expectedVersion The version of the event stream that the events were computed from, {@code 0} if the stream is expected to be empty.
     * @param events          The events to append
     * @return The {@link AppendResult}
     * @throws OptimisticLockException If the current version of the stream is not equal to {@code expectedVersion}, or a concurrent writer won the race.
     */
    AppendResult append(String aggregateId, long expectedVersion, List<NewEvent> events);

    /**
     * Load the events of an aggregate instance ordered by sequence number ascending.
     *
     * @param aggregateId The id of the aggregate instance
     * @return A lazy {@link EventStream}, it doesn't contain any events if the aggregate has never been written.
     */
    EventStream<StoredEvent> load(String aggregateId);

    /**
     * @param aggregateId The id of the aggregate instance
     * @return The sequence number of the latest event, {@code 0} if no events have been written.
     */
    long currentVersion(String aggregateId);

    /**
     * @param aggregateId The id of the aggregate instance
     * @return {@code true} if at least one event exists for the aggregate instance
     */
    default boolean exists(String aggregateId) {
        return currentVersion(aggregateId) > 0;
    }
}
