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

package org.eventledger.eventstore.api;

/**
 * The expected version was not fulfilled so nothing was written. In a typical scenario, if an application reads and
 * writes aggregate A from two different places at the same time, one of them wins and the other one gets this exception.
 * Stores never retry on their own, only the caller has enough context to recompute the new events against fresh state.
 */
public class OptimisticLockException extends PersistenceException {

    public OptimisticLockException(String message) {
        this(message, null);
    }

    public OptimisticLockException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public PersistenceErrorKind kind() {
        return PersistenceErrorKind.OPTIMISTIC_LOCK;
    }
}
