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

package org.tributary.catchup;

import org.tributary.eventstore.api.StoredEvent;

import static java.util.Objects.requireNonNull;

/**
 * A deserialized event delivered to {@link Projector}s during a catchup.
 *
 * @param storedEvent The event as it's stored in the event store
 * @param payload     The deserialized event body
 */
public record CatchupEvent(StoredEvent storedEvent, Object payload) {

    public CatchupEvent {
        requireNonNull(storedEvent, StoredEvent.class.getSimpleName() + " cannot be null");
        requireNonNull(payload, "Payload cannot be null");
    }

    public long id() {
        return storedEvent.id();
    }

    public <T> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }
}
