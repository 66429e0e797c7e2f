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

import org.tributary.eventstore.api.ConcurrencyException;
import org.tributary.eventstore.api.EventFilter;
import org.tributary.eventstore.api.EventStore;
import org.tributary.eventstore.api.EventStoreQueries;
import org.tributary.eventstore.api.StoredEvent;
import org.tributary.eventstore.api.UncommittedEvent;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;
import static org.tributary.eventstore.inmemory.EventFilterMatcher.matchesFilter;

/**
 * This is an {@link EventStore} that stores events in-memory. This is mainly useful for testing
 * and/or demo purposes.
 */
public class InMemoryEventStore implements EventStore, EventStoreQueries {

    private final List<StoredEvent> events = new ArrayList<>();
    private final Set<AggregateSequence> aggregateSequences = new HashSet<>();
    private final Consumer<List<StoredEvent>> listener;

    public InMemoryEventStore() {
        // @formatter:off
        this(__ -> {});
        // @formatter:on
    }

    /**
     * @param listener A listener that will be invoked (synchronously) after events have been appended to the event store.
     */
    public InMemoryEventStore(Consumer<List<StoredEvent>> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.listener = listener;
    }

    @Override
    public List<StoredEvent> append(List<UncommittedEvent> uncommittedEvents) {
        requireNonNull(uncommittedEvents, "Events cannot be null");
        final List<StoredEvent> appended;
        synchronized (events) {
            Set<AggregateSequence> newSequences = new HashSet<>();
            for (UncommittedEvent e : uncommittedEvents) {
                AggregateSequence key = new AggregateSequence(e.streamName(), e.aggregateId(), e.sequenceNumber());
                if (aggregateSequences.contains(key) || !newSequences.add(key)) {
                    throw new ConcurrencyException(key.toString(), String.format("Event with sequence number %d already exists for aggregate %s in stream %s.",
                            e.sequenceNumber(), e.aggregateId(), e.streamName()));
                }
            }
            long nextId = events.size() + 1;
            appended = new ArrayList<>(uncommittedEvents.size());
            for (UncommittedEvent e : uncommittedEvents) {
                appended.add(e.toStoredEvent(nextId++));
            }
            events.addAll(appended);
            aggregateSequences.addAll(newSequences);
        }
        if (!appended.isEmpty()) {
            listener.accept(appended);
        }
        return appended;
    }

    @Override
    public Stream<StoredEvent> eventsFrom(long startAtId, EventFilter filter, int limit) {
        requireNonNull(filter, EventFilter.class.getSimpleName() + " cannot be null");
        if (limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative");
        }
        return snapshotFrom(startAtId).filter(e -> matchesFilter(e, filter)).limit(limit);
    }

    @Override
    public long count(long startAtId, EventFilter filter) {
        requireNonNull(filter, EventFilter.class.getSimpleName() + " cannot be null");
        return snapshotFrom(startAtId).filter(e -> matchesFilter(e, filter)).count();
    }

    @Override
    public long latestEventId() {
        synchronized (events) {
            return events.size();
        }
    }

    @Override
    public boolean hasBeenRecorded(UUID aggregateId, String etag) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        if (etag == null) {
            return false;
        }
        return snapshotFrom(1).anyMatch(e -> e.aggregateId().equals(aggregateId) && etag.equals(e.etag()));
    }

    /**
     * Rename the type of all events of type {@code from} to {@code to}. Ids and ordering are retained.
     *
     * @return The number of renamed events
     */
    public int renameEventType(String streamName, String from, String to) {
        requireNonNull(streamName, "Stream name cannot be null");
        requireNonNull(from, "From cannot be null");
        requireNonNull(to, "To cannot be null");
        int renamed = 0;
        synchronized (events) {
            for (int i = 0; i < events.size(); i++) {
                StoredEvent event = events.get(i);
                if (event.streamName().equals(streamName) && event.type().equals(from)) {
                    events.set(i, event.withType(to));
                    renamed++;
                }
            }
        }
        return renamed;
    }

    public List<StoredEvent> all() {
        return snapshotFrom(1).collect(Collectors.toList());
    }

    private Stream<StoredEvent> snapshotFrom(long startAtId) {
        final List<StoredEvent> copy;
        synchronized (events) {
            int fromIndex = (int) Math.min(Math.max(startAtId - 1, 0), events.size());
            copy = new ArrayList<>(events.subList(fromIndex, events.size()));
        }
        return copy.stream();
    }

    private record AggregateSequence(String streamName, UUID aggregateId, long sequenceNumber) {
        private AggregateSequence {
            Objects.requireNonNull(streamName);
            Objects.requireNonNull(aggregateId);
        }
    }
}
