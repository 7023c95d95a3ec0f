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

import org.eventledger.eventstore.api.PersistenceException;

/**
 * Decides what happens when a view couldn't be stored. The events have already been committed when this happens,
 * so the command that produced them is not affected.
 */
@FunctionalInterface
public interface ViewErrorHandler {

    void onError(String queryName, String viewId, PersistenceException e);
}
