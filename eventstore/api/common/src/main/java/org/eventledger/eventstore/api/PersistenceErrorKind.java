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
 * The recoverable kinds of failures that an event store, snapshot store or view repository may report.
 *
 * @see PersistenceException
 */
public enum PersistenceErrorKind {
    /**
     * The expected version precondition failed because a concurrent writer won. Not a bug, the caller should reload and try again.
     */
    OPTIMISTIC_LOCK,
    /**
     * Transport level failure (IO, TLS, connection pool exhausted etc). It's safe for the caller to retry the whole operation.
     */
    CONNECTION_ERROR,
    /**
     * Serialization failures and all storage errors that are not anticipated.
     */
    UNKNOWN_ERROR
}
