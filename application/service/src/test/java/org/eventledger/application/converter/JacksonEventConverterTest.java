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

package org.eventledger.application.converter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventledger.application.domain.AccountEvent;
import org.eventledger.application.domain.AccountState;
import org.eventledger.application.domain.MoneyDeposited;
import org.eventledger.eventstore.api.NewEvent;
import org.eventledger.eventstore.api.StoredEvent;
import org.eventledger.eventstore.api.UnknownPersistenceException;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class JacksonEventConverterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void uses_the_qualified_class_name_as_event_type_by_default() {
        // Given
        JacksonEventConverter<AccountEvent> converter = new JacksonEventConverter<>(objectMapper);

        // When
        NewEvent newEvent = converter.toNewEvent(new MoneyDeposited(100), Map.of("user_id", "u-1"));

        // Then
        assertThat(newEvent.eventType()).isEqualTo("org.eventledger.application.domain.MoneyDeposited");
        assertThat(newEvent.payload().get("amount").asInt()).isEqualTo(100);
        assertThat(newEvent.metadata()).containsEntry("user_id", "u-1");
    }

    @Test
    void simple_class_names_are_resolved_in_the_package_of_the_base_type() {
        // Given
        JacksonEventConverter<AccountEvent> converter = new JacksonEventConverter<>(objectMapper, ReflectionEventTypeMapper.simple(AccountEvent.class));
        NewEvent newEvent = converter.toNewEvent(new MoneyDeposited(100), Map.of());

        // When
        AccountEvent domainEvent = converter.toDomainEvent(new StoredEvent("Account", "acc-1", 1, newEvent.eventType(), newEvent.payload(), Map.of()));

        // Then
        assertThat(newEvent.eventType()).isEqualTo("MoneyDeposited");
        assertThat(domainEvent).isEqualTo(new MoneyDeposited(100));
    }

    @Test
    void unknown_event_type_is_an_unknown_persistence_error() {
        // Given
        JacksonEventConverter<AccountEvent> converter = new JacksonEventConverter<>(objectMapper);

        // When
        Throwable throwable = catchThrowable(() -> converter.toDomainEvent(new StoredEvent("Account", "acc-1", 1, "com.example.Gone", objectMapper.createObjectNode(), Map.of())));

        // Then
        assertThat(throwable).isExactlyInstanceOf(UnknownPersistenceException.class).hasMessage("No domain event class found for event type com.example.Gone");
    }

    @Test
    void payload_that_doesnt_match_the_event_class_is_an_unknown_persistence_error() {
        // Given
        JacksonEventConverter<AccountEvent> converter = new JacksonEventConverter<>(objectMapper);

        // When
        Throwable throwable = catchThrowable(() -> converter.toDomainEvent(new StoredEvent("Account", "acc-1", 7, MoneyDeposited.class.getName(),
                objectMapper.createObjectNode().put("amount", "a lot"), Map.of())));

        // Then
        assertThat(throwable).isExactlyInstanceOf(UnknownPersistenceException.class).hasMessageStartingWith("Failed to deserialize event 7 of Account acc-1");
    }

    @Test
    void state_is_converted_to_json_and_back() {
        // Given
        JacksonStateConverter<AccountState> converter = new JacksonStateConverter<>(objectMapper, AccountState.class);

        // When
        AccountState state = converter.fromJson(converter.toJson(new AccountState("Jane", 10, true)));

        // Then
        assertThat(state).isEqualTo(new AccountState("Jane", 10, true));
    }
}
