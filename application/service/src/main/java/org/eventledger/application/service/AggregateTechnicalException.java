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

import org.eventledger.eventstore.api.PersistenceErrorKind;
import org.eventledger.eventstore.api.PersistenceException;

/**
 * The aggregate couldn't be loaded or committed because of a connection problem or another persistence failure.
 */
public class AggregateTechnicalException extends AggregateException {
    private final PersistenceErrorKind kind;

    public AggregateTechnicalException(String aggregateId, PersistenceException cause) {
        super(aggregateId, "Failed to execute command on aggregate " + aggregateId + ": " + cause.getMessage(), cause);
        this.kind = cause.kind();
    }

    public PersistenceErrorKind getKind() {
        return kind;
    }
}
