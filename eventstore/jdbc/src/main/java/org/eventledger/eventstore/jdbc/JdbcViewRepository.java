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

package org.eventledger.eventstore.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventledger.eventstore.api.LoadedView;
import org.eventledger.eventstore.api.OptimisticLockException;
import org.eventledger.eventstore.api.ViewContext;
import org.eventledger.eventstore.api.blocking.ViewRepository;
import org.eventledger.eventstore.jdbc.internal.JsonColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;
import static org.eventledger.eventstore.jdbc.internal.JdbcExceptionTranslator.translateException;
import static org.eventledger.eventstore.jdbc.internal.SqlIdentifiers.requireValidIdentifier;

/**
 * Persists the views of one query in a table named after the query, with the columns {@code view_id}, {@code version} and {@code payload}.
 * <p>
 * A view that doesn't exist yet is inserted at version 1. An existing view is only updated if its stored version still equals the version
 * observed when it was loaded, otherwise the update fails with an {@link OptimisticLockException} and the stored view is left untouched.
 * </p>
 *
 * @param <V> The type of the view
 */
public class JdbcViewRepository<V> implements ViewRepository<V> {
    private static final Logger log = LoggerFactory.getLogger(JdbcViewRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final String queryName;
    private final Class<V> viewType;
    private final JsonColumns jsonColumns;

    private final String selectSql;
    private final String insertSql;
    private final String updateSql;

    public JdbcViewRepository(DataSource dataSource, String queryName, Class<V> viewType) {
        this(new JdbcTemplate(requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null")), queryName, viewType, new ObjectMapper());
    }

    /**
     * Create a new instance of {@code JdbcViewRepository}
     *
     * @param jdbcTemplate The {@link JdbcTemplate} to use
     * @param queryName    The name of the query, also the name of the table in which its views are persisted
     * @param viewType     The type that views are deserialized to
     * @param objectMapper The {@link ObjectMapper} that reads and writes view payloads
     */
    public JdbcViewRepository(JdbcTemplate jdbcTemplate, String queryName, Class<V> viewType, ObjectMapper objectMapper) {
        requireNonNull(jdbcTemplate, JdbcTemplate.class.getSimpleName() + " cannot be null");
        requireNonNull(viewType, "View type cannot be null");
        this.jdbcTemplate = jdbcTemplate;
        this.queryName = requireValidIdentifier(queryName, "Query name");
        this.viewType = viewType;
        this.jsonColumns = new JsonColumns(objectMapper);
        this.selectSql = "SELECT version, payload FROM " + queryName + " WHERE view_id = ?";
        this.insertSql = "INSERT INTO " + queryName + " (view_id, version, payload) VALUES (?, ?, ?)";
        this.updateSql = "UPDATE " + queryName + " SET version = ?, payload = ? WHERE view_id = ? AND version = ?";
    }

    @Override
    public Optional<LoadedView<V>> load(String viewId) {
        requireNonNull(viewId, "View id cannot be null");
        List<LoadedView<V>> views;
        try {
            views = jdbcTemplate.query(selectSql, (rs, rowNum) -> new LoadedView<>(
                    jsonColumns.readValue("payload", rs.getString("payload"), viewType),
                    ViewContext.of(viewId, rs.getLong("version"))), viewId);
        } catch (DataAccessException e) {
            throw translateException("load view " + viewId + " of query " + queryName, e);
        }
        return views.stream().findFirst();
    }

    @Override
    public void updateView(V view, ViewContext context) {
        requireNonNull(view, "View cannot be null");
        requireNonNull(context, ViewContext.class.getSimpleName() + " cannot be null");
        String payload = jsonColumns.writeValue(view);
        String description = (context.isNew() ? "insert" : "update") + " view " + context.viewId() + " of query " + queryName;
        int updated;
        try {
            if (context.isNew()) {
                updated = jdbcTemplate.update(insertSql, context.viewId(), context.nextVersion(), payload);
            } else {
                updated = jdbcTemplate.update(updateSql, context.nextVersion(), payload, context.viewId(), context.version());
            }
        } catch (DataAccessException e) {
            throw translateException(description, e);
        }

        if (updated == 0) {
            throw new OptimisticLockException(String.format("Failed to %s since it's no longer at version %d", description, context.version()));
        }
        log.debug("Stored view {} of query {} at version {}", context.viewId(), queryName, context.nextVersion());
    }

    public String queryName() {
        return queryName;
    }
}
