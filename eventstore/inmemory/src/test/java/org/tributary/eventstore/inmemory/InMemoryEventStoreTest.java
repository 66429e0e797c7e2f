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

package org.tributary.eventstore.inmemory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.tributary.eventstore.api.ConcurrencyException;
import org.tributary.eventstore.api.EventFilter;
import org.tributary.eventstore.api.StoredEvent;
import org.tributary.eventstore.api.UncommittedEvent;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.tributary.eventstore.api.EventFilter.streamName;
import static org.tributary.eventstore.api.EventFilter.type;
import static org.tributary.eventstore.api.EventFilter.typeIn;

@DisplayNameGeneration(ReplaceUnderscores.class)
class InMemoryEventStoreTest {
    private static final Instant NOW = Instant.parse("2020-01-01T10:00:00Z");

    @Test
    void assigns_monotonically_increasing_ids_across_streams() {
        // Given
        InMemoryEventStore eventStore = new InMemoryEventStore();
        UUID orderId = UUID.randomUUID();
        UUID customerId = UUID.randomUUID();

        // When
        eventStore.append(List.of(event("Order", "Placed", orderId, 1), event("Order", "Paid", orderId, 2)));
        List<StoredEvent> appended = eventStore.append(List.of(event("Customer", "Registered", customerId, 1)));

        // Then
        assertAll(
                () -> assertThat(appended).extracting(StoredEvent::id).containsExactly(3L),
                () -> assertThat(eventStore.all()).extracting(StoredEvent::id).containsExactly(1L, 2L, 3L),
                () -> assertThat(eventStore.latestEventId()).isEqualTo(3)
        );
    }

    @Test
    void rejects_duplicate_sequence_numbers_within_an_aggregate_and_appends_nothing() {
        // Given
        InMemoryEventStore eventStore = new InMemoryEventStore();
        UUID orderId = UUID.randomUUID();
        eventStore.append(List.of(event("Order", "Placed", orderId, 1)));

        // When
        Throwable throwable = catchThrowable(() -> eventStore.append(List.of(event("Order", "Paid", orderId, 2), event("Order", "Shipped", orderId, 1))));

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(ConcurrencyException.class),
                () -> assertThat(eventStore.latestEventId()).isEqualTo(1)
        );
    }

    @Test
    void invokes_listener_with_appended_events() {
        // Given
        CopyOnWriteArrayList<StoredEvent> received = new CopyOnWriteArrayList<>();
        InMemoryEventStore eventStore = new InMemoryEventStore(received::addAll);

        // When
        eventStore.append(List.of(event("Order", "Placed", UUID.randomUUID(), 1)));

        // Then
        assertThat(received).extracting(StoredEvent::type).containsExactly("Placed");
    }

    @Test
    void renaming_an_event_type_keeps_ids_and_order() {
        // Given
        InMemoryEventStore eventStore = new InMemoryEventStore();
        UUID orderId = UUID.randomUUID();
        eventStore.append(List.of(event("Order", "Placed", orderId, 1), event("Order", "Cancelled", orderId, 2)));

        // When
        int renamed = eventStore.renameEventType("Order", "Placed", "Created");

        // Then
        assertAll(
                () -> assertThat(renamed).isEqualTo(1),
                () -> assertThat(eventStore.all()).extracting(StoredEvent::id, StoredEvent::type).containsExactly(
                        tuple(1L, "Created"), tuple(2L, "Cancelled"))
        );
    }

    @Test
    void has_been_recorded_matches_aggregate_id_and_etag() {
        // Given
        InMemoryEventStore eventStore = new InMemoryEventStore();
        UUID orderId = UUID.randomUUID();
        eventStore.append(List.of(event("Order", "Placed", orderId, 1).withETag("etag-1")));

        // Then
        assertAll(
                () -> assertThat(eventStore.hasBeenRecorded(orderId, "etag-1")).isTrue(),
                () -> assertThat(eventStore.hasBeenRecorded(orderId, "etag-2")).isFalse(),
                () -> assertThat(eventStore.hasBeenRecorded(UUID.randomUUID(), "etag-1")).isFalse()
        );
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        void events_from_returns_matching_events_from_the_start_id_limited() {
            // Given
            InMemoryEventStore eventStore = storeWithMixedEvents();

            // When
            List<Long> ids = eventStore.eventsFrom(2, streamName("Order"), 2).map(StoredEvent::id).collect(Collectors.toList());

            // Then
            assertThat(ids).containsExactly(3L, 4L);
        }

        @Test
        void count_includes_the_start_id() {
            // Given
            InMemoryEventStore eventStore = storeWithMixedEvents();

            // Then
            assertAll(
                    () -> assertThat(eventStore.count(1, EventFilter.all())).isEqualTo(5),
                    () -> assertThat(eventStore.count(3, streamName("Order"))).isEqualTo(3),
                    () -> assertThat(eventStore.count(6, EventFilter.all())).isZero()
            );
        }

        @Test
        void composed_filters_match_stream_and_type_sets() {
            // Given
            InMemoryEventStore eventStore = storeWithMixedEvents();
            EventFilter filter = streamName("Order").and(typeIn(List.of("Placed", "Shipped"))).or(streamName("Customer").and(type("Registered")));

            // When
            List<String> types = eventStore.eventsFrom(1, filter, Integer.MAX_VALUE).map(StoredEvent::type).collect(Collectors.toList());

            // Then
            assertThat(types).containsExactly("Placed", "Registered", "Shipped");
        }

        @Test
        void wildcard_values_match_prefixes_and_everything() {
            // Given
            InMemoryEventStore eventStore = storeWithMixedEvents();

            // Then
            assertAll(
                    () -> assertThat(eventStore.count(1, streamName("Sched*"))).isEqualTo(1),
                    () -> assertThat(eventStore.count(1, streamName("*").and(type("*")))).isEqualTo(5)
            );
        }

        private InMemoryEventStore storeWithMixedEvents() {
            InMemoryEventStore eventStore = new InMemoryEventStore();
            UUID orderId = UUID.randomUUID();
            eventStore.append(List.of(
                    event("Order", "Placed", orderId, 1),
                    event("Customer", "Registered", UUID.randomUUID(), 1),
                    event("Order", "Paid", orderId, 2),
                    event("Order", "Shipped", orderId, 3),
                    event("Scheduled:Order", "Ship", orderId, 4)));
            return eventStore;
        }
    }

    private static UncommittedEvent event(String streamName, String type, UUID aggregateId, long sequenceNumber) {
        return UncommittedEvent.of(streamName, type, aggregateId, sequenceNumber, "{}", NOW);
    }
}
