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

import static java.util.Objects.requireNonNull;

/**
 * A view that was loaded from a view repository together with the context that must be used when writing it back.
 *
 * @param view    The deserialized view
 * @param context The optimistic lock token for the next write
 * @param <V>     The type of the view
 */
public record LoadedView<V>(V view, ViewContext context) {

    public LoadedView {
        requireNonNull(view, "View cannot be null");
        requireNonNull(context, ViewContext.class.getSimpleName() + " cannot be null");
    }

    public String viewId() {
        return context.viewId();
    }

    public long version() {
        return context.version();
    }
}
