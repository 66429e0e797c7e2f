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
import org.tributary.eventstore.api.EventStoreQueries;
import org.tributary.eventstore.api.StoredEvent;
import org.tributary.lock.LockGuard;
import org.tributary.lock.LostLockException;
import org.tributary.lock.NamedMutex;

import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.function.LongSupplier;

import static java.util.Objects.requireNonNull;

/**
 * A query over the event store that is only executed if a named lock can be acquired. The lock is held until the query is closed.
 * If the lock cannot be acquired within the timeout the query contains no events, meaning that another instance is running the same catchup.
 */
public class ExclusiveEventStoreCatchupQuery implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExclusiveEventStoreCatchupQuery.class);

    private final @Nullable LockGuard lockGuard;
    private final @Nullable DurableEventCursor cursor;
    private final long startAtId;
    private final long expectedNumberOfEvents;

    private ExclusiveEventStoreCatchupQuery(@Nullable LockGuard lockGuard, @Nullable DurableEventCursor cursor, long startAtId, long expectedNumberOfEvents) {
        this.lockGuard = lockGuard;
        this.cursor = cursor;
        this.startAtId = startAtId;
        this.expectedNumberOfEvents = expectedNumberOfEvents;
    }

    /**
     * @param startingId Invoked once the lock is held to get the id of the first event to include
     * @param batchSize  The max number of events included in the query
     */
    public static ExclusiveEventStoreCatchupQuery open(EventStoreQueries queries, NamedMutex mutex, String lockName, Duration lockTimeout,
                                                       LongSupplier startingId, EventFilter filter, int batchSize, int maxReconnectAttempts) {
        requireNonNull(queries, EventStoreQueries.class.getSimpleName() + " cannot be null");
        requireNonNull(mutex, NamedMutex.class.getSimpleName() + " cannot be null");
        requireNonNull(startingId, "Starting id supplier cannot be null");
        requireNonNull(filter, EventFilter.class.getSimpleName() + " cannot be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be greater than zero");
        }

        LockGuard lockGuard = mutex.tryAcquire(lockName, lockTimeout).orElse(null);
        if (lockGuard == null) {
            log.debug("Couldn't acquire lock {} within {}, another instance is running the catchup", lockName, lockTimeout);
            return new ExclusiveEventStoreCatchupQuery(null, null, 0, 0);
        }

        try {
            long startAtId = startingId.getAsLong();
            long matching = queries.count(startAtId, filter);
            long expectedNumberOfEvents = Math.min(matching, batchSize);
            log.debug("Lock {} acquired, {} matching events from id {} ({} in this batch)", lockName, matching, startAtId, expectedNumberOfEvents);
            DurableEventCursor cursor = new DurableEventCursor(queries, filter, lockGuard, startAtId, expectedNumberOfEvents, maxReconnectAttempts);
            return new ExclusiveEventStoreCatchupQuery(lockGuard, cursor, startAtId, expectedNumberOfEvents);
        } catch (RuntimeException e) {
            lockGuard.release();
            throw e;
        }
    }

    public boolean isLockAcquired() {
        return lockGuard != null;
    }

    public long startAtId() {
        return startAtId;
    }

    public long expectedNumberOfEvents() {
        return expectedNumberOfEvents;
    }

    public Iterator<StoredEvent> events() {
        return cursor == null ? Collections.emptyIterator() : cursor;
    }

    /**
     * Call before writing anything that only the holder of the lock may write.
     *
     * @throws LostLockException If the lock has been released, has expired or has been taken over
     */
    public void ensureLockHeld() {
        if (lockGuard == null) {
            throw new IllegalStateException("The lock was never acquired");
        } else if (!lockGuard.isHeld()) {
            throw new LostLockException(lockGuard.name(), lockGuard.fencingToken());
        }
    }

    /**
     * Releases the lock, a competing instance may take over immediately. The cursor stops at its next step.
     * May be called from another thread than the one iterating over the events.
     */
    public void releaseLock() {
        if (lockGuard != null) {
            lockGuard.release();
        }
    }

    /**
     * Releases the lock and closes the cursor. Calling this method more than once has no effect.
     */
    @Override
    public void close() {
        releaseLock();
        if (cursor != null) {
            cursor.close();
        }
    }
}
