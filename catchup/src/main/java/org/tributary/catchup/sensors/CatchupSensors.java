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

package org.tributary.catchup.sensors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.tributary.catchup.progress.ProjectorProgress;
import org.tributary.catchup.progress.ProjectorProgressStorage;
import org.tributary.eventstore.api.EventFilter;
import org.tributary.eventstore.api.EventStoreQueries;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Read-only diagnostics computed from the stored projector progress. Projectors that haven't processed any event are left out.
 */
@NullMarked
public class CatchupSensors {
    private final ProjectorProgressStorage progressStorage;
    private final EventStoreQueries queries;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public CatchupSensors(ProjectorProgressStorage progressStorage, EventStoreQueries queries, Clock clock) {
        requireNonNull(progressStorage, ProjectorProgressStorage.class.getSimpleName() + " cannot be null");
        requireNonNull(queries, EventStoreQueries.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.progressStorage = progressStorage;
        this.queries = queries;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    public CatchupDiagnostics readModelProgress() {
        long latestEventId = queries.latestEventId();
        long eventStoreCount = queries.count(0, EventFilter.all());
        Map<String, ReadModelDiagnostics> readModels = new LinkedHashMap<>();
        if (eventStoreCount > 0) {
            Instant now = clock.instant();
            for (ProjectorProgress progress : progressStorage.loadAll()) {
                ReadModelDiagnostics diagnostics = diagnose(progress, eventStoreCount, now);
                if (diagnostics != null) {
                    readModels.put(progress.getName(), diagnostics);
                }
            }
        }
        return new CatchupDiagnostics(latestEventId, readModels);
    }

    public String readModelProgressAsJson() {
        try {
            return objectMapper.writeValueAsString(readModelProgress());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    static @Nullable ReadModelDiagnostics diagnose(ProjectorProgress progress, long eventStoreCount, Instant now) {
        Instant initialStart = progress.getInitialCatchupStartTime();
        Instant initialEnd = progress.getInitialCatchupEndTime();
        Instant batchStart = progress.getBatchStartTime();
        long eventsProcessed = initialEnd != null
                ? progress.getBatchTotalEvents() - progress.getBatchRemainingEvents()
                : progress.getInitialCatchupEvents() - progress.getBatchRemainingEvents();
        if (eventsProcessed == 0 || batchStart == null || initialStart == null) {
            return null;
        }

        Duration timeTaken = Duration.between(initialEnd != null ? batchStart : initialStart, now);
        Duration timeRemaining = Duration.ofNanos((long) (timeTaken.toNanos() * ((double) progress.getBatchRemainingEvents() / eventsProcessed)));
        return new ReadModelDiagnostics(
                progress.getName(),
                progress.getInitialCatchupEvents(),
                Duration.between(initialStart, initialEnd == null ? now : initialEnd),
                timeRemaining,
                progress.getBatchRemainingEvents(),
                percent(eventStoreCount - progress.getBatchRemainingEvents(), eventStoreCount),
                progress.getLatencyInMilliseconds(),
                progress.getLastUpdated(),
                progress.getCurrentAsOfEventId(),
                progress.getFailedOnEventId(),
                progress.getError());
    }

    static double percent(long completed, long total) {
        return total == 0 ? 100d : (double) completed / total * 100d;
    }
}
