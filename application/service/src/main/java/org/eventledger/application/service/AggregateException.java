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

/**
 * Base class of the failures reported when executing a command.
 *
 * <table>
 *     <tr><th>Exception</th><th>Meaning</th></tr>
 *     <tr><td>{@link UserErrorException}</td><td>The command was rejected by the business rules, nothing was committed</td></tr>
 *     <tr><td>{@link AggregateConflictException}</td><td>Another command committed events to the same aggregate first, execute the command again</td></tr>
 *     <tr><td>{@link AggregateTechnicalException}</td><td>The aggregate couldn't be loaded or committed</td></tr>
 * </table>
 */
public abstract class AggregateException extends RuntimeException {
    private final String aggregateId;

    protected AggregateException(String aggregateId, String message, Throwable cause) {
        super(message, cause);
        this.aggregateId = aggregateId;
    }

    /**
     * @return The id of the aggregate that the command was executed against, {@code null} if it's not known
     */
    public String getAggregateId() {
        return aggregateId;
    }
}
