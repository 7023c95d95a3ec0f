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

package org.eventledger.eventstore.api.reactor;

import org.eventledger.eventstore.api.LoadedView;
import org.eventledger.eventstore.api.ViewContext;
import reactor.core.publisher.Mono;

/**
 * A non-blocking view repository.
 *
 * @param <V> The type of the view
 * @see org.eventledger.eventstore.api.blocking.ViewRepository
 */
public interface ViewRepository<V> {

    /**
     * @return The view and its context, or an empty {@code Mono} if the view has never been written.
     */
    Mono<LoadedView<V>> load(String viewId);

    /**
     * Insert or update the view depending on {@code context}. Errors with {@link org.eventledger.eventstore.api.OptimisticLockException}
     * if the stored version is not equal to {@code context.version()}.
     */
    Mono<Void> updateView(V view, ViewContext context);
}
