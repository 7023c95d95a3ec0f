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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Thrown from {@code decide} when a command violates a business rule. The message is meant for the user that issued the command.
 */
public class UserErrorException extends AggregateException {

    public UserErrorException(String message) {
        this(null, message);
    }

    public UserErrorException(String aggregateId, String message) {
        super(aggregateId, message, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserErrorException)) return false;
        UserErrorException that = (UserErrorException) o;
        return Objects.equals(getAggregateId(), that.getAggregateId()) && Objects.equals(getMessage(), that.getMessage());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getAggregateId(), getMessage());
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", UserErrorException.class.getSimpleName() + "[", "]")
                .add("aggregateId='" + getAggregateId() + "'")
                .add("message='" + getMessage() + "'")
                .toString();
    }
}
