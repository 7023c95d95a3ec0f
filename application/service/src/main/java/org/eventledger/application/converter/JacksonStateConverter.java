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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventledger.eventstore.api.UnknownPersistenceException;

import static java.util.Objects.requireNonNull;

/**
 * A {@link StateConverter} that uses a Jackson {@link ObjectMapper}
 *
 * @param <S> The type of the aggregate state
 */
public class JacksonStateConverter<S> implements StateConverter<S> {

    private final ObjectMapper objectMapper;
    private final Class<S> stateType;

    public JacksonStateConverter(ObjectMapper objectMapper, Class<S> stateType) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(stateType, "State type cannot be null");
        this.objectMapper = objectMapper;
        this.stateType = stateType;
    }

    @Override
    public JsonNode toJson(S state) {
        requireNonNull(state, "State cannot be null");
        try {
            return objectMapper.valueToTree(state);
        } catch (IllegalArgumentException e) {
            throw new UnknownPersistenceException("Failed to serialize state " + stateType.getName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public S fromJson(JsonNode json) {
        requireNonNull(json, "Json cannot be null");
        try {
            return objectMapper.treeToValue(json, stateType);
        } catch (JsonProcessingException e) {
            throw new UnknownPersistenceException("Failed to deserialize state " + stateType.getName() + ": " + e.getOriginalMessage(), e);
        }
    }
}
