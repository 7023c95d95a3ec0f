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
import org.eventledger.eventstore.api.NewEvent;
import org.eventledger.eventstore.api.OptimisticLockException;
import org.eventledger.eventstore.api.StoredEvent;
import org.eventledger.eventstore.api.ViewContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * Runs against a real MySQL server, enable with {@code -Deventledger.testcontainers=true} on a machine with Docker.
 */
@Testcontainers
@EnabledIfSystemProperty(named = "eventledger.testcontainers", matches = "true")
@DisplayNameGeneration(ReplaceUnderscores.class)
public class MySqlJdbcEventStoreTest {

    @Container
    private static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0.36");

    private ObjectMapper objectMapper;
    private JdbcEventStore eventStore;
    private JdbcViewRepository<Map<String, Object>> viewRepository;

    @SuppressWarnings({"unchecked", "rawtypes"})
    @BeforeEach
    void create_event_store() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/mysql/eventledger.sql")).execute(dataSource);
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.update("DELETE FROM events");
        jdbcTemplate.update("DELETE FROM snapshots");
        jdbcTemplate.update("DELETE FROM account_query");
        objectMapper = new ObjectMapper();
        eventStore = new JdbcEventStore(dataSource, "Account");
        viewRepository = (JdbcViewRepository) new JdbcViewRepository<>(dataSource, "account_query", Map.class);
    }

    @Test
    void appends_and_loads_events_with_metadata() {
        // When
        eventStore.append("acc-1", 0, List.of(new NewEvent("MoneyDeposited", objectMapper.createObjectNode().put("amount", 100), Map.of("user_id", "u-1"))));
        eventStore.append("acc-1", 1, List.of(new NewEvent("MoneyWithdrawn", objectMapper.createObjectNode().put("amount", 40))));

        // Then
        List<StoredEvent> events = eventStore.load("acc-1").eventList();
        assertThat(events).extracting(StoredEvent::sequence).containsExactly(1L, 2L);
        assertThat(events.get(0).metadata()).containsEntry("user_id", "u-1");
        assertThat(events.get(1).payload().get("amount").asInt()).isEqualTo(40);
    }

    @Test
    void stale_append_fails_with_optimistic_lock() {
        // Given
        eventStore.append("acc-1", 0, List.of(new NewEvent("MoneyDeposited", objectMapper.createObjectNode().put("amount", 100))));

        // When
        Throwable throwable = catchThrowable(() -> eventStore.append("acc-1", 0, List.of(new NewEvent("MoneyDeposited", objectMapper.createObjectNode().put("amount", 1)))));

        // Then
        assertThat(throwable).isExactlyInstanceOf(OptimisticLockException.class);
    }

    @Test
    void stale_view_update_fails_with_optimistic_lock() {
        // Given
        viewRepository.updateView(Map.of("balance", 100), ViewContext.newView("acc-1"));
        LoadedView<Map<String, Object>> loaded = viewRepository.load("acc-1").orElseThrow();
        viewRepository.updateView(Map.of("balance", 60), loaded.context());

        // When
        Throwable throwable = catchThrowable(() -> viewRepository.updateView(Map.of("balance", 0), loaded.context()));

        // Then
        assertThat(throwable).isExactlyInstanceOf(OptimisticLockException.class);
        assertThat(viewRepository.load("acc-1").orElseThrow().view()).containsEntry("balance", 60);
    }
}
