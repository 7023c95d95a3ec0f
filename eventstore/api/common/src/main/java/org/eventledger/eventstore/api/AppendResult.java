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
 * The result of an append to the event store.
 */
public class AppendResult {

    private final String aggregateId;
    private final long oldVersion;
    private final long newVersion;

    public AppendResult(String aggregateId, long oldVersion, long newVersion) {
        this.aggregateId = aggregateId;
        this.oldVersion = oldVersion;
        this.newVersion = newVersion;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    /**
     * @return The version of the event stream before the append
     */
    public long getOldVersion() {
        return oldVersion;
    }

    /**
     * @return The version of the event stream after the append, i.e. the sequence number of the last appended event.
     * Same as {@link #getOldVersion()} if no events were appended.
     */
    public long getNewVersion() {
        return newVersion;
    }

    /**
     * @return {@code true} if at least one event was appended
     */
    public boolean hasAppendedEvents() {
        return newVersion != oldVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AppendResult)) return false;
        AppendResult that = (AppendResult) o;
        return oldVersion == that.oldVersion && newVersion == that.newVersion && Objects.equals(aggregateId, that.aggregateId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, oldVersion, newVersion);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", AppendResult.class.getSimpleName() + "[", "]")
                .add("aggregateId='" + aggregateId + "'")
                .add("oldVersion=" + oldVersion)
                .add("newVersion=" + newVersion)
                .toString();
    }
}
