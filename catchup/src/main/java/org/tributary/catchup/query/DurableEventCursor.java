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

package org.tributary.catchup.query;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.eventstore.api.EventFilter;
import org.tributary.eventstore.api.EventReaderClosedException;
import org.tributary.eventstore.api.EventStoreQueries;
import org.tributary.eventstore.api.StoredEvent;
import org.tributary.lock.LockGuard;
import org.tributary.lock.LostLockException;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Iterates over a bounded number of events while holding a lock. The id of the next event to fetch is tracked explicitly so that,
 * if the underlying reader is closed mid-stream, the cursor refreshes the lock and re-queries from the event after the last one it returned.
 * <p>
 * The cursor ends when the expected number of events have been returned, when the event store has no more matching events,
 * or when the lock is released (which is how a running catchup is cancelled). The lease is checked before each event is fetched,
 * and a cursor whose lock has expired or been taken over fails with {@link LostLockException}.
 * </p>
 */
public class DurableEventCursor implements Iterator<StoredEvent>, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DurableEventCursor.class);

    private final EventStoreQueries queries;
    private final EventFilter filter;
    private final LockGuard lockGuard;
    private final long expectedNumberOfEvents;
    private final int maxReconnectAttempts;

    private long nextIdToFetch;
    private long numberOfEventsReturned;
    private int reconnects;
    private @Nullable Stream<StoredEvent> currentStream;
    private @Nullable Iterator<StoredEvent> currentIterator;
    private @Nullable StoredEvent nextEvent;
    private boolean exhausted;

    public DurableEventCursor(EventStoreQueries queries, EventFilter filter, LockGuard lockGuard, long startAtId, long expectedNumberOfEvents, int maxReconnectAttempts) {
        requireNonNull(queries, EventStoreQueries.class.getSimpleName() + " cannot be null");
        requireNonNull(filter, EventFilter.class.getSimpleName() + " cannot be null");
        requireNonNull(lockGuard, LockGuard.class.getSimpleName() + " cannot be null");
        if (maxReconnectAttempts < 0) {
            throw new IllegalArgumentException("Max reconnect attempts cannot be negative");
        }
        this.queries = queries;
        this.filter = filter;
        this.lockGuard = lockGuard;
        this.nextIdToFetch = startAtId;
        this.expectedNumberOfEvents = expectedNumberOfEvents;
        this.maxReconnectAttempts = maxReconnectAttempts;
    }

    @Override
    public boolean hasNext() {
        if (nextEvent != null) {
            return true;
        } else if (exhausted) {
            return false;
        }

        for (; ; ) {
            if (numberOfEventsReturned >= expectedNumberOfEvents || lockGuard.isReleased()) {
                finish();
                return false;
            } else if (!lockGuard.isHeld()) {
                finish();
                log.warn("Lost lock {} after {} of {} events", lockGuard.name(), numberOfEventsReturned, expectedNumberOfEvents);
                throw new LostLockException(lockGuard.name(), lockGuard.fencingToken());
            }

            try {
                Iterator<StoredEvent> iterator = currentIterator == null ? open() : currentIterator;
                if (!iterator.hasNext()) {
                    finish();
                    return false;
                }
                nextEvent = iterator.next();
                return true;
            } catch (EventReaderClosedException e) {
                closeCurrentStream();
                reconnect(e);
            }
        }
    }

    @Override
    public StoredEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        StoredEvent event = nextEvent;
        nextEvent = null;
        nextIdToFetch = event.id() + 1;
        numberOfEventsReturned++;
        return event;
    }

    public long nextIdToFetch() {
        return nextIdToFetch;
    }

    public long numberOfEventsReturned() {
        return numberOfEventsReturned;
    }

    public int reconnects() {
        return reconnects;
    }

    @Override
    public void close() {
        finish();
    }

    private void reconnect(EventReaderClosedException cause) {
        if (reconnects >= maxReconnectAttempts) {
            log.error("Event reader closed after {} events and {} reconnects, giving up", numberOfEventsReturned, reconnects);
            throw cause;
        }
        reconnects++;
        if (lockGuard.isReleased()) {
            return;
        }
        if (!lockGuard.refresh()) {
            throw new LostLockException(lockGuard.name(), lockGuard.fencingToken());
        }
        log.warn("Event reader closed after {} of {} events, re-querying from event {} (reconnect {} of {})",
                numberOfEventsReturned, expectedNumberOfEvents, nextIdToFetch, reconnects, maxReconnectAttempts);
    }

    private Iterator<StoredEvent> open() {
        long remaining = expectedNumberOfEvents - numberOfEventsReturned;
        currentStream = queries.eventsFrom(nextIdToFetch, filter, (int) Math.min(Integer.MAX_VALUE, remaining));
        currentIterator = currentStream.iterator();
        return currentIterator;
    }

    private void finish() {
        exhausted = true;
        nextEvent = null;
        closeCurrentStream();
    }

    private void closeCurrentStream() {
        Stream<StoredEvent> stream = currentStream;
        currentStream = null;
        currentIterator = null;
        if (stream != null) {
            stream.close();
        }
    }
}
