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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts aggregate state to the JSON that is stored in a snapshot and back.
 *
 * @param <S> The type of the aggregate state
 */
public interface StateConverter<S> {

    JsonNode toJson(S state);

    S fromJson(JsonNode json);
}
