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
 * An event that has not yet been appended to the event store, i.e. a {@link StoredEvent} without an id.
 */
@NullMarked
public record UncommittedEvent(String streamName, String type, UUID aggregateId, long sequenceNumber, String body, Instant timestamp,
                               @Nullable String etag, @Nullable String actor) {

    public UncommittedEvent {
        requireNonNull(streamName, "Stream name cannot be null");
        requireNonNull(type, "Type cannot be null");
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(body, "Body cannot be null");
        requireNonNull(timestamp, "Timestamp cannot be null");
    }

    public static UncommittedEvent of(String streamName, String type, UUID aggregateId, long sequenceNumber, String body, Instant timestamp) {
        return new UncommittedEvent(streamName, type, aggregateId, sequenceNumber, body, timestamp, null, null);
    }

    public UncommittedEvent withETag(@Nullable String etag) {
        return new UncommittedEvent(streamName, type, aggregateId, sequenceNumber, body, timestamp, etag, actor);
    }

    public UncommittedEvent withActor(@Nullable String actor) {
        return new UncommittedEvent(streamName, type, aggregateId, sequenceNumber, body, timestamp, etag, actor);
    }

    public StoredEvent toStoredEvent(long id) {
        return new StoredEvent(id, streamName, type, aggregateId, sequenceNumber, body, timestamp, etag, actor);
    }
}
