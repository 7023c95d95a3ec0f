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

package org.eventledger.eventstore.api.blocking;

import org.eventledger.eventstore.api.LoadedView;
import org.eventledger.eventstore.api.OptimisticLockException;
import org.eventledger.eventstore.api.ViewContext;

import java.util.Optional;

/**
 * Loads and stores materialized views, keyed by view id and versioned for optimistic concurrency.
 *
 * @param <V> The type of the view
 */
public interface ViewRepository<V> {

    /**
     * @param viewId The id of the view instance
     * @return The view and the context to use when writing it back, or empty if the view has never been written.
     */
    Optional<LoadedView<V>> load(String viewId);

    /**
     * Write the view. A {@link ViewContext.NewView new} context inserts the view, an {@link ViewContext.ExistingView existing}
     * context updates it. The stored version after a successful write is {@code context.version() + 1}.
     *
     * @param view    The view to write
     * @param context The context that was returned when the view was loaded, or {@link ViewContext#newView(String)}.
     * @throws OptimisticLockException If the stored version is not equal to {@code context.version()}, nothing is written in that case.
     */
    void updateView(V view, ViewContext context);
}
