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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Base class of the recoverable failures reported by event stores, snapshot stores and view repositories.
 * Every failure is of exactly one {@link PersistenceErrorKind}:
 *
 * <table>
 *     <tr><th>Exception</th><th>Kind</th></tr>
 *     <tr><td>{@link OptimisticLockException}</td><td>{@link PersistenceErrorKind#OPTIMISTIC_LOCK}</td></tr>
 *     <tr><td>{@link PersistenceConnectionException}</td><td>{@link PersistenceErrorKind#CONNECTION_ERROR}</td></tr>
 *     <tr><td>{@link UnknownPersistenceException}</td><td>{@link PersistenceErrorKind#UNKNOWN_ERROR}</td></tr>
 * </table>
 * <p>
 * A broken contract between the store and the database is not a {@code PersistenceException}, see {@link StorageProtocolViolationException}.
 */
public abstract class PersistenceException extends RuntimeException {

    protected PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return The kind of failure
     */
    public abstract PersistenceErrorKind kind();

    /**
     * @return {@code true} if retrying the whole operation against freshly loaded state may succeed
     */
    public boolean isRetryable() {
        return kind() != PersistenceErrorKind.UNKNOWN_ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PersistenceException that = (PersistenceException) o;
        return kind() == that.kind() && Objects.equals(getMessage(), that.getMessage());
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind(), getMessage());
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", getClass().getSimpleName() + "[", "]")
                .add("kind=" + kind())
                .add("message=" + getMessage())
                .toString();
    }
}
