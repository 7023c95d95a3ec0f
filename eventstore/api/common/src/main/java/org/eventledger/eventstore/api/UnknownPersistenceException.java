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
 * A failure that is neither a conflict nor a connectivity problem, for example a payload that couldn't be serialized
 * or deserialized. The message contains diagnostic details.
 */
public class UnknownPersistenceException extends PersistenceException {

    public UnknownPersistenceException(String message) {
        this(message, null);
    }

    public UnknownPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public PersistenceErrorKind kind() {
        return PersistenceErrorKind.UNKNOWN_ERROR;
    }
}
