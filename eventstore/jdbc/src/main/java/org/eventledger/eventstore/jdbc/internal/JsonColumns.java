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

package org.eventledger.eventstore.jdbc.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventledger.eventstore.api.UnknownPersistenceException;

import java.util.Collections;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Reads and writes the JSON text stored in payload and metadata columns. Serialization failures are reported
 * as {@link UnknownPersistenceException} since they are neither conflicts nor connectivity problems.
 */
public class JsonColumns {
    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<Map<String, String>>() {
    };

    private final ObjectMapper objectMapper;

    public JsonColumns(ObjectMapper objectMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        this.objectMapper = objectMapper;
    }

    public String writeJson(JsonNode json) {
        try {
            return objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new UnknownPersistenceException("Failed to serialize payload: " + e.getOriginalMessage(), e);
        }
    }

    public JsonNode readJson(String column, String text) {
        if (text == null) {
            throw new UnknownPersistenceException("Column " + column + " was null");
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new UnknownPersistenceException("Failed to deserialize column " + column + ": " + e.getOriginalMessage(), e);
        }
    }

    public String writeMetadata(Map<String, String> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new UnknownPersistenceException("Failed to serialize metadata: " + e.getOriginalMessage(), e);
        }
    }

    public Map<String, String> readMetadata(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(text, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new UnknownPersistenceException("Failed to deserialize metadata: " + e.getOriginalMessage(), e);
        }
    }

    public <T> T readValue(String column, String text, Class<T> type) {
        if (text == null) {
            throw new UnknownPersistenceException("Column " + column + " was null");
        }
        try {
            return objectMapper.readValue(text, type);
        } catch (JsonProcessingException e) {
            throw new UnknownPersistenceException("Failed to deserialize column " + column + " to " + type.getName() + ": " + e.getOriginalMessage(), e);
        }
    }

    public String writeValue(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UnknownPersistenceException("Failed to serialize " + value.getClass().getName() + ": " + e.getOriginalMessage(), e);
        }
    }
}
