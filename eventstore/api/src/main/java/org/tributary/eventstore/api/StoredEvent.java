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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * An event as it is persisted in the event store. The {@code id} is assigned by the store when the event is appended and
 * totally orders all events across all streams.
 *
 * @param id             The global position of the event, starts at {@code 1}.
 * @param streamName     The stream (typically the aggregate type) the event belongs to.
 * @param type           The event type name within the stream.
 * @param aggregateId    The id of the aggregate that recorded the event.
 * @param sequenceNumber The position of the event within its aggregate.
 * @param body           The serialized (JSON) event.
 * @param timestamp      When the event was recorded.
 * @param etag           Optional etag used to check whether an event has been recorded.
 * @param actor          Optional name of the actor that caused the event.
 */
@NullMarked
public record StoredEvent(long id, String streamName, String type, UUID aggregateId, long sequenceNumber, String body, Instant timestamp,
                          @Nullable String etag, @Nullable String actor) {

    public StoredEvent {
        requireNonNull(streamName, "Stream name cannot be null");
        requireNonNull(type, "Type cannot be null");
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(body, "Body cannot be null");
        requireNonNull(timestamp, "Timestamp cannot be null");
    }

    public StoredEvent withType(String type) {
        return new StoredEvent(id, streamName, type, aggregateId, sequenceNumber, body, timestamp, etag, actor);
    }
}
