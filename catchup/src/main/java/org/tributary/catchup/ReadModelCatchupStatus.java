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

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * The status of a catchup, reported once when a batch starts and once after each processed event.
 *
 * @param catchupName             The name of the catchup
 * @param batchCount              The number of events in the current batch
 * @param currentEventId          The id of the event that was just processed, or the id the batch starts from if no event has been processed
 * @param numberOfEventsProcessed The number of events processed so far in the batch
 * @param eventTimestamp          When the current event was recorded, {@code null} before the first event
 * @param statusTimestamp         When this status was created
 */
public record ReadModelCatchupStatus(String catchupName, long batchCount, long currentEventId, long numberOfEventsProcessed,
                                     @Nullable Instant eventTimestamp, Instant statusTimestamp) {

    public ReadModelCatchupStatus {
        requireNonNull(catchupName, "Catchup name cannot be null");
        requireNonNull(statusTimestamp, "Status timestamp cannot be null");
    }

    public boolean isStartOfBatch() {
        return numberOfEventsProcessed == 0;
    }

    public boolean isEndOfBatch() {
        return batchCount == numberOfEventsProcessed;
    }

    /**
     * @return The time between the event being recorded and being processed, or {@code null} before the first event.
     */
    public @Nullable Duration latency() {
        return eventTimestamp == null ? null : Duration.between(eventTimestamp, statusTimestamp);
    }

    @Override
    public String toString() {
        if (numberOfEventsProcessed > 0) {
            Duration latency = latency();
            return String.format(Locale.ROOT, "Catchup %s: Processed %d of %d (event id: %d / recorded: %s / latency: %.3fs)",
                    catchupName, numberOfEventsProcessed, batchCount, currentEventId, eventTimestamp,
                    latency == null ? 0d : latency.toMillis() / 1000d);
        } else if (batchCount == 0) {
            return "Catchup " + catchupName + ": Found no new events after " + (currentEventId - 1) + ".";
        }
        return "Catchup " + catchupName + ": Starting from event " + currentEventId + " for " + batchCount + " events";
    }
}
