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
 * The store and the database disagree about the contract between them (unknown table or column, unexpected result set shape etc).
 * This is a defect rather than a data level conflict and retrying will not help. It's deliberately <i>not</i> a {@link PersistenceException}
 * so that it's never mistaken for a recoverable failure, it should be propagated to the top-level loop of the hosting application
 * that decides how to shut down.
 */
public class StorageProtocolViolationException extends RuntimeException {

    public StorageProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
