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

package org.eventledger.eventstore.api.reactor;

import org.eventledger.eventstore.api.AppendResult;
import org.eventledger.eventstore.api.NewEvent;
import org.eventledger.eventstore.api.OptimisticLockException;
import org.eventledger.eventstore.api.PersistenceConnectionException;
import org.eventledger.eventstore.api.StoredEvent;
import org.eventledger.eventstore.api.UnknownPersistenceException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * A non-blocking event store. Nothing happens until the returned publisher is subscribed to.
 * May return the following exceptions on the error track:
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
     * Append {@code events} to the event stream of {@code aggregateId} as a single indivisible unit, see
     * {@link org.eventledger.eventstore.api.blocking.EventStore#append(String, long, List)}.
     */
    Mono<AppendResult> append(String aggregateId, long expectedVersion, List<NewEvent> events);

    /**
     * Load the events of an aggregate instance ordered by sequence number ascending. Each subscription re-reads the events.
     */
    Flux<StoredEvent> load(String aggregateId);

    /**
     * @return The sequence number of the latest event, {@code 0} if no events have been written.
     */
    Mono<Long> currentVersion(String aggregateId);

    default Mono<Boolean> exists(String aggregateId) {
        return currentVersion(aggregateId).map(version -> version > 0);
    }
}
