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

import java.util.UUID;
import java.util.stream.Stream;

/**
 * Queries used by read model catchups and the command scheduler.
 */
public interface EventStoreQueries {

    /**
     * Read events ordered by id.
     * <p>
     * The returned stream is lazy and may fail with an {@link EventReaderClosedException} while it's being consumed
     * if the underlying reader is closed. Callers that want to resume must re-query from the id after the last event they received.
     * </p>
     *
     * @param startAtId Include events with an id greater than or equal to this id
     * @param filter    The filter that events must match
     * @param limit     The max number of events to return
     */
    Stream<StoredEvent> eventsFrom(long startAtId, EventFilter filter, int limit);

    /**
     * @return The number of events with an id greater than or equal to {@code startAtId} matching the {@code filter}.
     */
    long count(long startAtId, EventFilter filter);

    /**
     * @return The id of the latest stored event or {@code 0} if the event store is empty.
     */
    long latestEventId();

    /**
     * @return {@code true} if an event with the given {@code etag} has been recorded by the aggregate.
     */
    boolean hasBeenRecorded(UUID aggregateId, String etag);
}
