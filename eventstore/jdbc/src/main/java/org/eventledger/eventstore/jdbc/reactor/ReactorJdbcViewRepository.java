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

package org.eventledger.eventstore.jdbc.reactor;

import org.eventledger.eventstore.api.LoadedView;
import org.eventledger.eventstore.api.ViewContext;
import org.eventledger.eventstore.api.reactor.ViewRepository;
import org.eventledger.eventstore.jdbc.JdbcViewRepository;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import static java.util.Objects.requireNonNull;

/**
 * A reactive facade of the {@link JdbcViewRepository}, blocking calls are subscribed on the supplied {@link Scheduler}.
 *
 * @param <V> The type of the view
 */
public class ReactorJdbcViewRepository<V> implements ViewRepository<V> {

    private final JdbcViewRepository<V> viewRepository;
    private final Scheduler scheduler;

    public ReactorJdbcViewRepository(JdbcViewRepository<V> viewRepository) {
        this(viewRepository, Schedulers.boundedElastic());
    }

    public ReactorJdbcViewRepository(JdbcViewRepository<V> viewRepository, Scheduler scheduler) {
        requireNonNull(viewRepository, JdbcViewRepository.class.getSimpleName() + " cannot be null");
        requireNonNull(scheduler, Scheduler.class.getSimpleName() + " cannot be null");
        this.viewRepository = viewRepository;
        this.scheduler = scheduler;
    }

    @Override
    public Mono<LoadedView<V>> load(String viewId) {
        // A callable returning null completes empty
        return Mono.fromCallable(() -> viewRepository.load(viewId).orElse(null)).subscribeOn(scheduler);
    }

    @Override
    public Mono<Void> updateView(V view, ViewContext context) {
        return Mono.<Void>fromRunnable(() -> viewRepository.updateView(view, context)).subscribeOn(scheduler);
    }
}
