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

package org.eventledger.framework.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.eventledger.application.converter.JacksonEventConverter;
import org.eventledger.application.service.AggregateConflictException;
import org.eventledger.application.service.CqrsFramework;
import org.eventledger.application.service.UserErrorException;
import org.eventledger.application.store.AggregateContext;
import org.eventledger.application.store.AggregateStore;
import org.eventledger.application.store.AggregateStores;
import org.eventledger.dsl.decider.Decider.Decision;
import org.eventledger.dsl.view.EventEnvelope;
import org.eventledger.dsl.view.MaterializedView;
import org.eventledger.eventstore.api.LoadedView;
import org.eventledger.eventstore.api.StoredEvent;
import org.eventledger.eventstore.jdbc.JdbcEventStore;
import org.eventledger.framework.jdbc.UserDomain.ChangeEmail;
import org.eventledger.framework.jdbc.UserDomain.EmailChanged;
import org.eventledger.framework.jdbc.UserDomain.Register;
import org.eventledger.framework.jdbc.UserDomain.User;
import org.eventledger.framework.jdbc.UserDomain.UserCommand;
import org.eventledger.framework.jdbc.UserDomain.UserEvent;
import org.eventledger.framework.jdbc.UserDomain.UserState;
import org.eventledger.framework.jdbc.UserDomain.UserView;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.withSettings;

@DisplayNameGeneration(ReplaceUnderscores.class)
class JdbcCqrsTest {
    private static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());

    private DataSource dataSource;
    private JdbcCqrs jdbcCqrs;

    @BeforeEach
    void create_jdbc_cqrs() {
        DriverManagerDataSource driverManagerDataSource = new DriverManagerDataSource("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        driverManagerDataSource.setDriverClassName("org.h2.Driver");
        new ResourceDatabasePopulator(new ClassPathResource("schema-h2.sql")).execute(driverManagerDataSource);
        dataSource = driverManagerDataSource;
        jdbcCqrs = new JdbcCqrs(dataSource, OBJECT_MAPPER);
    }

    @AfterEach
    void close_jdbc_cqrs() {
        jdbcCqrs.close();
    }

    @Nested
    @DisplayName("event sourced")
    class EventSourced {

        @Test
        void commands_are_committed_and_projected_into_the_view() {
            // Given
            MaterializedView<UserView, UserEvent> users = jdbcCqrs.materializedView("user_views", UserDomain.USER_VIEW, UserView.class);
            CqrsFramework<UserCommand, UserState, UserEvent> cqrs = jdbcCqrs.eventSourced(new User(), List.of(users));

            // When
            cqrs.executeWithMetadata("user-42", new Register("jane@example.com", NOW), Map.of("user_id", "admin"));
            cqrs.execute("user-42", new ChangeEmail("jane.doe@example.com"));

            // Then
            assertThat(users.load("user-42")).hasValue(new UserView("jane.doe@example.com", 1));
            LoadedView<UserView> loaded = jdbcCqrs.viewRepository("user_views", UserView.class).load("user-42").orElseThrow();
            assertThat(loaded.version()).isEqualTo(2);

            List<StoredEvent> events = jdbcCqrs.eventStore("User").load("user-42").eventList();
            assertThat(events).extracting(StoredEvent::sequence).containsExactly(1L, 2L);
            assertThat(events.get(0).metadata()).containsEntry("user_id", "admin");
            assertThat(events.get(0).eventType()).isEqualTo(UserDomain.UserRegistered.class.getName());
        }

        @Test
        void rejected_command_leaves_events_and_view_untouched() {
            // Given
            MaterializedView<UserView, UserEvent> users = jdbcCqrs.materializedView("user_views", UserDomain.USER_VIEW, UserView.class);
            CqrsFramework<UserCommand, UserState, UserEvent> cqrs = jdbcCqrs.eventSourced(new User(), List.of(users));
            cqrs.execute("user-42", new Register("jane@example.com", NOW));

            // When
            Throwable throwable = catchThrowable(() -> cqrs.execute("user-42", new Register("john@example.com", NOW)));

            // Then
            assertThat(throwable).isExactlyInstanceOf(UserErrorException.class).hasMessage("User is already registered");
            assertThat(jdbcCqrs.eventStore("User").currentVersion("user-42")).isEqualTo(1);
            assertThat(users.load("user-42")).hasValue(new UserView("jane@example.com", 0));
        }

        @Test
        void an_event_appended_behind_the_frameworks_back_makes_a_stale_commit_conflict() {
            // Given
            JdbcEventStore eventStore = jdbcCqrs.eventStore("User");
            CqrsFramework<UserCommand, UserState, UserEvent> cqrs = new CqrsFramework<>(new User(), new ConcurrentWriterAggregateStore(eventStore), List.of());
            cqrs.execute("user-42", new Register("jane@example.com", NOW));

            // When
            Throwable throwable = catchThrowable(() -> cqrs.execute("user-42", new ChangeEmail("jane.doe@example.com")));

            // Then
            assertThat(throwable).isExactlyInstanceOf(AggregateConflictException.class);
            assertThat(eventStore.load("user-42").eventList()).extracting(StoredEvent::eventType)
                    .containsExactly(UserDomain.UserRegistered.class.getName(), UserDomain.EmailChanged.class.getName());
        }
    }

    @Nested
    @DisplayName("snapshots")
    class Snapshots {

        @Test
        void snapshotting_framework_saves_snapshots_at_the_configured_frequency() {
            // Given
            CqrsFramework<UserCommand, UserState, UserEvent> cqrs = jdbcCqrs.snapshotting(new User(), UserState.class, List.of(), 2);

            // When
            cqrs.execute("user-42", new Register("a@example.com", NOW));
            cqrs.execute("user-42", new ChangeEmail("b@example.com"));
            cqrs.execute("user-42", new ChangeEmail("c@example.com"));

            // Then
            JdbcEventStore eventStore = jdbcCqrs.eventStore("User");
            assertThat(eventStore.loadFromSnapshot("user-42").snapshotSequence()).isEqualTo(2);
            assertThat(eventStore.loadFromSnapshot("user-42").events().eventList()).extracting(StoredEvent::sequence).containsExactly(3L);
            assertThat(catchThrowable(() -> cqrs.execute("user-42", new Register("d@example.com", NOW)))).isInstanceOf(UserErrorException.class);
        }

        @Test
        void aggregate_store_framework_snapshots_the_latest_state_after_every_command() {
            // Given
            CqrsFramework<UserCommand, UserState, UserEvent> cqrs = jdbcCqrs.aggregateStore(new User(), UserState.class, List.of());

            // When
            cqrs.execute("user-42", new Register("a@example.com", NOW));
            cqrs.execute("user-42", new ChangeEmail("b@example.com"));

            // Then
            JdbcEventStore eventStore = jdbcCqrs.eventStore("User");
            assertThat(eventStore.loadFromSnapshot("user-42").snapshotSequence()).isEqualTo(2);
            assertThat(eventStore.loadFromSnapshot("user-42").snapshot().orElseThrow().state().get("email").asText()).isEqualTo("b@example.com");
            assertThat(new JdbcTemplate(dataSource).queryForObject("SELECT COUNT(*) FROM events", Integer.class)).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        void closing_closes_a_closeable_data_source_once() throws Exception {
            // Given
            DataSource pool = mock(DataSource.class, withSettings().extraInterfaces(AutoCloseable.class));
            JdbcCqrs cqrs = new JdbcCqrs(pool);

            // When
            cqrs.close();
            cqrs.close();

            // Then
            verify((AutoCloseable) pool, times(1)).close();
        }

        @Test
        void closing_with_a_data_source_that_isnt_closeable_does_nothing() {
            // Given
            JdbcCqrs cqrs = new JdbcCqrs(dataSource);

            // When
            Throwable throwable = catchThrowable(cqrs::close);

            // Then
            assertThat(throwable).isNull();
        }
    }

    // Another writer commits an event between load and commit of every command except the first
    private static class ConcurrentWriterAggregateStore implements AggregateStore<UserState, UserEvent> {
        private final AggregateStore<UserState, UserEvent> delegate;

        ConcurrentWriterAggregateStore(JdbcEventStore eventStore) {
            this.delegate = AggregateStores.eventSourced(eventStore, new User(), new JacksonEventConverter<>(OBJECT_MAPPER));
        }

        @Override
        public AggregateContext<UserState> load(String aggregateId) {
            return delegate.load(aggregateId);
        }

        @Override
        public List<EventEnvelope<UserEvent>> commit(AggregateContext<UserState> context, Decision<UserState, UserEvent> decision, Map<String, String> metadata) {
            if (context.currentSequence() > 0) {
                EmailChanged concurrentChange = new EmailChanged("concurrent@example.com");
                delegate.commit(context, new Decision<>(new UserState(concurrentChange.email(), context.state().registeredAt()), List.<UserEvent>of(concurrentChange)), Map.of());
            }
            return delegate.commit(context, decision, metadata);
        }
    }
}
