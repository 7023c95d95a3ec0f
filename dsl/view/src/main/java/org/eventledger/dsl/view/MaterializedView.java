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

package org.eventledger.dsl.view;

import org.eventledger.eventstore.api.LoadedView;
import org.eventledger.eventstore.api.PersistenceException;
import org.eventledger.eventstore.api.ViewContext;
import org.eventledger.eventstore.api.blocking.ViewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * A materialized view combines a {@link View} and a {@link ViewRepository} into a {@link Query}. For every view affected by
 * the dispatched events it loads the stored view (or starts from {@link View#initialState()}), evolves it and stores it again with
 * the {@link ViewContext} it was loaded with, so that a concurrent update of the same view is detected instead of overwritten.
 * <p>
 * By default the view id is the aggregate id. A {@link PersistenceException} is handed to the {@link ViewErrorHandler}, which
 * logs it unless another handler is configured. Any other exception is propagated.
 * </p>
 *
 * @param <V> The type of the view
 * @param <E> The type of the domain events
 */
public class MaterializedView<V, E> implements Query<E> {
    private static final Logger log = LoggerFactory.getLogger(MaterializedView.class);

    private final String queryName;
    private final View<V, E> view;
    private final ViewRepository<V> viewRepository;
    private final Function<EventEnvelope<E>, String> viewIdMapper;
    private final ViewErrorHandler errorHandler;

    private MaterializedView(String queryName, View<V, E> view, ViewRepository<V> viewRepository, Function<EventEnvelope<E>, String> viewIdMapper, ViewErrorHandler errorHandler) {
        requireNonNull(queryName, "Query name cannot be null");
        requireNonNull(view, View.class.getSimpleName() + " cannot be null");
        requireNonNull(viewRepository, ViewRepository.class.getSimpleName() + " cannot be null");
        requireNonNull(viewIdMapper, "View id mapper cannot be null");
        requireNonNull(errorHandler, ViewErrorHandler.class.getSimpleName() + " cannot be null");
        this.queryName = queryName;
        this.view = view;
        this.viewRepository = viewRepository;
        this.viewIdMapper = viewIdMapper;
        this.errorHandler = errorHandler;
    }

    public static <V, E> MaterializedView<V, E> create(String queryName, View<V, E> view, ViewRepository<V> viewRepository) {
        return new MaterializedView<>(queryName, view, viewRepository, EventEnvelope::aggregateId, MaterializedView::logError);
    }

    /**
     * @param viewIdMapper Derives the id of the view that an event affects
     * @return A new {@code MaterializedView} that uses the supplied {@code viewIdMapper}
     */
    public MaterializedView<V, E> viewIdMapper(Function<EventEnvelope<E>, String> viewIdMapper) {
        return new MaterializedView<>(queryName, view, viewRepository, viewIdMapper, errorHandler);
    }

    /**
     * @param errorHandler Invoked when a view couldn't be loaded or stored
     * @return A new {@code MaterializedView} that uses the supplied {@code errorHandler}
     */
    public MaterializedView<V, E> errorHandler(ViewErrorHandler errorHandler) {
        return new MaterializedView<>(queryName, view, viewRepository, viewIdMapper, errorHandler);
    }

    @Override
    public void dispatch(String aggregateId, List<EventEnvelope<E>> events) {
        Map<String, List<EventEnvelope<E>>> eventsByViewId = new LinkedHashMap<>();
        for (EventEnvelope<E> event : events) {
            String viewId = requireNonNull(viewIdMapper.apply(event), "View id mapper returned null");
            eventsByViewId.computeIfAbsent(viewId, __ -> new ArrayList<>()).add(event);
        }
        eventsByViewId.forEach(this::update);
    }

    /**
     * @param viewId The id of the view
     * @return The current view or empty if no event has affected it yet
     */
    public Optional<V> load(String viewId) {
        return viewRepository.load(viewId).map(LoadedView::view);
    }

    public String queryName() {
        return queryName;
    }

    private void update(String viewId, List<EventEnvelope<E>> events) {
        try {
            Optional<LoadedView<V>> loaded = viewRepository.load(viewId);
            V current = loaded.map(LoadedView::view).orElseGet(view::initialState);
            ViewContext context = loaded.map(LoadedView::context).orElseGet(() -> ViewContext.newView(viewId));
            V updated = view.evolve(current, events);
            viewRepository.updateView(updated, context);
        } catch (PersistenceException e) {
            errorHandler.onError(queryName, viewId, e);
        }
    }

    private static void logError(String queryName, String viewId, PersistenceException e) {
        log.error("Failed to update view {} of query {}: {}", viewId, queryName, e.getMessage(), e);
    }
}
