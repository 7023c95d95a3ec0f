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

import org.eventledger.application.service.UserErrorException;
import org.eventledger.dsl.decider.Aggregate;
import org.eventledger.dsl.view.View;
import org.jspecify.annotations.NonNull;

import java.time.Instant;
import java.util.List;

/**
 * A small user registration domain used to exercise the assembled frameworks
 */
class UserDomain {

    interface UserCommand {
    }

    record Register(String email, Instant at) implements UserCommand {
    }

    record ChangeEmail(String email) implements UserCommand {
    }

    interface UserEvent {
    }

    public record UserRegistered(String email, Instant registeredAt) implements UserEvent {
    }

    public record EmailChanged(String email) implements UserEvent {
    }

    public record UserState(String email, Instant registeredAt) {
        static UserState unregistered() {
            return new UserState(null, null);
        }

        boolean registered() {
            return email != null;
        }
    }

    public record UserView(String email, int emailChanges) {
    }

    static final View<UserView, UserEvent> USER_VIEW = View.create(new UserView(null, 0), (view, envelope) -> {
        UserEvent event = envelope.payload();
        if (event instanceof UserRegistered) {
            return new UserView(((UserRegistered) event).email(), 0);
        } else if (event instanceof EmailChanged) {
            return new UserView(((EmailChanged) event).email(), view.emailChanges() + 1);
        }
        return view;
    });

    static class User implements Aggregate<UserCommand, UserState, UserEvent> {

        @Override
        public String aggregateType() {
            return "User";
        }

        @Override
        public UserState initialState() {
            return UserState.unregistered();
        }

        @NonNull
        @Override
        public List<UserEvent> decide(@NonNull UserCommand command, UserState state) {
            if (command instanceof Register) {
                if (state.registered()) {
                    throw new UserErrorException("User is already registered");
                }
                Register register = (Register) command;
                return List.of(new UserRegistered(register.email(), register.at()));
            } else if (command instanceof ChangeEmail) {
                if (!state.registered()) {
                    throw new UserErrorException("User is not registered");
                }
                String email = ((ChangeEmail) command).email();
                return email.equals(state.email()) ? List.of() : List.of(new EmailChanged(email));
            }
            throw new IllegalArgumentException("Unknown command " + command);
        }

        @Override
        public UserState evolve(UserState state, @NonNull UserEvent event) {
            if (event instanceof UserRegistered) {
                return new UserState(((UserRegistered) event).email(), ((UserRegistered) event).registeredAt());
            } else if (event instanceof EmailChanged) {
                return new UserState(((EmailChanged) event).email(), state.registeredAt());
            }
            return state;
        }
    }
}
