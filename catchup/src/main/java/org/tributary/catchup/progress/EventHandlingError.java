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

package org.tributary.catchup.progress;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * A record of an event that could not be deserialized or that a projector failed to handle.
 *
 * @param handler The name of the projector that failed, {@code null} if the event could not be deserialized
 * @param error   A JSON description of the exception
 */
public record EventHandlingError(UUID aggregateId, long sequenceNumber, String streamName, String eventTypeName, String serializedEvent,
                                 String error, @Nullable String actor, long originalId, @Nullable String handler, Instant utcTime) {

    public EventHandlingError {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(streamName, "Stream name cannot be null");
        requireNonNull(eventTypeName, "Event type name cannot be null");
        requireNonNull(serializedEvent, "Serialized event cannot be null");
        requireNonNull(error, "Error cannot be null");
        requireNonNull(utcTime, "UTC time cannot be null");
    }
}
