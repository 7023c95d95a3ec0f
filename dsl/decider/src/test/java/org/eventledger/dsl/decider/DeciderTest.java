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

package org.eventledger.dsl.decider;

import org.eventledger.dsl.decider.Decider.Decision;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class DeciderTest {

    // Commands are deltas, events are the resulting balance changes
    private final Decider<Integer, Integer, Integer> balance = Decider.create(0,
            (delta, current) -> {
                if (current + delta < 0) {
                    throw new IllegalStateException("Insufficient funds");
                }
                return delta == 0 ? List.of() : List.of(delta);
            },
            Integer::sum);

    @Test
    void decide_on_events_rebuilds_the_state_and_returns_only_the_new_events() {
        // When
        Decision<Integer, Integer> decision = balance.decideOnEvents(List.of(100, -30), -20);

        // Then
        assertThat(decision.events()).containsExactly(-20);
        assertThat(decision.state()).isEqualTo(50);
    }

    @Test
    void decide_on_state_evolves_the_state_through_the_new_events() {
        // When
        Decision<Integer, Integer> decision = balance.decideOnState(10, 5);

        // Then
        assertThat(decision).isEqualTo(new Decision<>(15, List.of(5)));
    }

    @Test
    void a_command_that_results_in_no_events_leaves_the_state_untouched() {
        // When
        Decision<Integer, Integer> decision = balance.decideOnState(10, 0);

        // Then
        assertThat(decision.events()).isEmpty();
        assertThat(decision.state()).isEqualTo(10);
    }

    @Test
    void rejected_commands_are_reported_by_the_exception_thrown_from_decide() {
        // When
        Throwable throwable = catchThrowable(() -> balance.decideOnEvents(List.of(10), -11));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class).hasMessage("Insufficient funds");
    }

    @Test
    void fold_applies_events_in_order() {
        // Given
        Decider<String, String, String> concatenate = Decider.create("", (command, state) -> List.of(command), String::concat);

        // When
        String state = concatenate.fold(concatenate.initialState(), List.of("a", "b", "c"));

        // Then
        assertThat(state).isEqualTo("abc");
    }

    @Test
    void aggregate_delegates_to_the_decider_and_carries_its_type() {
        // When
        Aggregate<Integer, Integer, Integer> account = Aggregate.of("Account", balance);

        // Then
        assertThat(account.aggregateType()).isEqualTo("Account");
        assertThat(account.initialState()).isZero();
        assertThat(account.decideOnEvents(List.of(5), 5).state()).isEqualTo(10);
    }
}
