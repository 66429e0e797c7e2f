/*
 * Copyright 2024 The Tributary Authors
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

package org.tributary.eventstore.api;

import java.util.List;

/**
 * An append-only, totally ordered log of events.
 */
public interface EventStore {

    /**
     * Append events atomically. Either all events are stored or none.
     *
     * @param events The events to append
     * @return The stored events, with ids assigned in the order of the supplied list.
     * @throws ConcurrencyException If an event with the same stream name, aggregate id and sequence number is already stored.
     */
    List<StoredEvent> append(List<UncommittedEvent> events);
}
