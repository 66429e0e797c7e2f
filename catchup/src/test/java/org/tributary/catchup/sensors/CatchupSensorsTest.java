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

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.tributary.catchup.progress.InMemoryProjectorProgressStorage;
import org.tributary.catchup.progress.ProgressTransaction;
import org.tributary.catchup.progress.ProjectorProgress;
import org.tributary.eventstore.api.UncommittedEvent;
import org.tributary.eventstore.inmemory.InMemoryEventStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class CatchupSensorsTest {
    private static final Instant NOW = Instant.parse("2020-06-01T12:00:00Z");

    private final InMemoryEventStore eventStore = new InMemoryEventStore();
    private final InMemoryProjectorProgressStorage progressStorage = new InMemoryProjectorProgressStorage();
    private final CatchupSensors sensors = new CatchupSensors(progressStorage, eventStore, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void an_empty_event_store_has_no_read_model_diagnostics() {
        // Given
        store(progress("orders", p -> p.setCurrentAsOfEventId(0)));

        // When
        CatchupDiagnostics diagnostics = sensors.readModelProgress();

        // Then
        assertAll(
                () -> assertThat(diagnostics.latestEventId()).isZero(),
                () -> assertThat(diagnostics.readModels()).isEmpty()
        );
    }

    @Test
    void estimates_the_remaining_time_of_an_initial_catchup() {
        // Given
        writeEvents(100);
        store(progress("orders", p -> {
            p.setCurrentAsOfEventId(40);
            p.setInitialCatchupStartTime(NOW.minusSeconds(40));
            p.setInitialCatchupEvents(100);
            p.setBatchStartTime(NOW.minusSeconds(40));
            p.setBatchTotalEvents(100);
            p.setBatchRemainingEvents(60);
        }));

        // When
        ReadModelDiagnostics diagnostics = sensors.readModelProgress().readModels().get("orders");

        // Then
        assertAll(
                () -> assertThat(diagnostics.timeRemaining()).isEqualTo(Duration.ofSeconds(60)),
                () -> assertThat(diagnostics.timeTakenForInitialCatchup()).isEqualTo(Duration.ofSeconds(40)),
                () -> assertThat(diagnostics.eventsRemaining()).isEqualTo(60),
                () -> assertThat(diagnostics.percentageCompleted()).isCloseTo(40d, within(0.001)),
                () -> assertThat(diagnostics.currentAsOfEventId()).isEqualTo(40)
        );
    }

    @Test
    void uses_the_current_batch_once_the_initial_catchup_has_ended() {
        // Given
        writeEvents(10);
        store(progress("orders", p -> {
            p.setCurrentAsOfEventId(8);
            p.setInitialCatchupStartTime(NOW.minusSeconds(100));
            p.setInitialCatchupEndTime(NOW.minusSeconds(90));
            p.setInitialCatchupEvents(6);
            p.setBatchStartTime(NOW.minusSeconds(2));
            p.setBatchTotalEvents(4);
            p.setBatchRemainingEvents(2);
        }));

        // When
        ReadModelDiagnostics diagnostics = sensors.readModelProgress().readModels().get("orders");

        // Then
        assertAll(
                () -> assertThat(diagnostics.timeRemaining()).isEqualTo(Duration.ofSeconds(2)),
                () -> assertThat(diagnostics.timeTakenForInitialCatchup()).isEqualTo(Duration.ofSeconds(10)),
                () -> assertThat(diagnostics.percentageCompleted()).isCloseTo(80d, within(0.001))
        );
    }

    @Test
    void leaves_out_projectors_that_have_not_processed_any_event() {
        // Given
        writeEvents(5);
        store(progress("idle", p -> {
        }));

        // When
        CatchupDiagnostics diagnostics = sensors.readModelProgress();

        // Then
        assertAll(
                () -> assertThat(diagnostics.latestEventId()).isEqualTo(5),
                () -> assertThat(diagnostics.readModels()).isEmpty()
        );
    }

    @Test
    void renders_diagnostics_as_json() {
        // Given
        writeEvents(2);
        store(progress("orders", p -> {
            p.setCurrentAsOfEventId(2);
            p.setInitialCatchupStartTime(NOW.minusSeconds(1));
            p.setInitialCatchupEndTime(NOW);
            p.setInitialCatchupEvents(2);
            p.setBatchStartTime(NOW.minusSeconds(1));
            p.setBatchTotalEvents(2);
            p.setError("{\"type\":\"java.lang.IllegalStateException\"}");
        }));

        // When
        String json = sensors.readModelProgressAsJson();

        // Then
        assertAll(
                () -> assertThat(json).contains("\"latestEventId\":2"),
                () -> assertThat(json).contains("\"orders\""),
                () -> assertThat(json).contains("\"percentageCompleted\":100.0"),
                () -> assertThat(json).contains("\"lastUpdated\":null")
        );
    }

    private ProjectorProgress progress(String name, java.util.function.Consumer<ProjectorProgress> customizer) {
        ProjectorProgress progress = progressStorage.loadOrCreate(List.of(name)).get(0);
        customizer.accept(progress);
        return progress;
    }

    private void store(ProjectorProgress progress) {
        try (ProgressTransaction transaction = progressStorage.beginTransaction()) {
            transaction.save(progress);
            transaction.commit();
        }
    }

    private void writeEvents(int count) {
        UUID aggregateId = UUID.randomUUID();
        List<UncommittedEvent> events = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            events.add(UncommittedEvent.of("Order", "ItemAdded", aggregateId, i, "{}", NOW));
        }
        eventStore.append(events);
    }
}
