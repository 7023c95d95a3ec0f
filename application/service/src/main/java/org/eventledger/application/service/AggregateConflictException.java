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

package org.eventledger.application.service;

import org.eventledger.eventstore.api.OptimisticLockException;

/**
 * The aggregate was changed by someone else between loading it and committing the new events. Nothing was committed, the
 * command can be executed again against the new state.
 */
public class AggregateConflictException extends AggregateException {

    public AggregateConflictException(String aggregateId, OptimisticLockException cause) {
        super(aggregateId, "Aggregate " + aggregateId + " was modified concurrently: " + cause.getMessage(), cause);
    }
}
