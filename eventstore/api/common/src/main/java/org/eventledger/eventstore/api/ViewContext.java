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
 * The optimistic lock token that is handed from a view load to the subsequent write of the same view. It's never persisted.
 * There are exactly two cases:
 *
 * <ol>
 *     <li>{@link NewView}: the view has never been persisted (version {@code 0}), writing it means <i>inserting</i> it.</li>
 *     <li>{@link ExistingView}: the view was loaded at a given version ({@code > 0}), writing it means <i>updating</i> it, given that
 *     nobody else has updated it in between.</li>
 * </ol>
 * <p>
 * Always pass the context returned by the load, never a context with a self-incremented version.
 */
public sealed interface ViewContext {

    /**
     * @param viewId The id of the view instance
     * @return A context for a view that has never been persisted
     */
    static ViewContext newView(String viewId) {
        return new NewView(viewId);
    }

    /**
     * @param viewId  The id of the view instance
     * @param version The version that was observed when the view was loaded, must be greater than {@code 0}.
     * @return A context for a view that exists at the given version
     */
    static ViewContext existingView(String viewId, long version) {
        return new ExistingView(viewId, version);
    }

    /**
     * Create a context from a raw version number, {@code 0} meaning "does not exist".
     */
    static ViewContext of(String viewId, long version) {
        return version == 0 ? newView(viewId) : existingView(viewId, version);
    }

    String viewId();

    /**
     * @return The observed version, {@code 0} if the view doesn't exist.
     */
    long version();

    /**
     * @return The version that is stored after a successful write using this context.
     */
    default long nextVersion() {
        return version() + 1;
    }

    default boolean isNew() {
        return this instanceof NewView;
    }

    record NewView(String viewId) implements ViewContext {
        public NewView {
            requireNonNull(viewId, "View id cannot be null");
        }

        @Override
        public long version() {
            return 0;
        }
    }

    record ExistingView(String viewId, long version) implements ViewContext {
        public ExistingView {
            requireNonNull(viewId, "View id cannot be null");
            if (version < 1) {
                throw new IllegalArgumentException("Version of an existing view must be greater than 0 but was " + version);
            }
        }
    }
}
