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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.catchup.bus.InProcessEventBus;
import org.tributary.catchup.bus.ProjectorFailedException;
import org.tributary.catchup.progress.DiagnosticJson;
import org.tributary.catchup.progress.EventHandlingError;
import org.tributary.catchup.progress.EventHandlingErrorLog;
import org.tributary.catchup.progress.ProgressTransaction;
import org.tributary.catchup.progress.ProjectorProgress;
import org.tributary.catchup.progress.ProjectorProgressStorage;
import org.tributary.catchup.progress.SideEffectFailure;
import org.tributary.catchup.query.CatchupEventFilter;
import org.tributary.catchup.query.ExclusiveEventStoreCatchupQuery;
import org.tributary.catchup.serialization.EventDeserializer;
import org.tributary.eventstore.api.EventFilter;
import org.tributary.eventstore.api.EventStoreQueries;
import org.tributary.eventstore.api.StoredEvent;
import org.tributary.lock.LostLockException;
import org.tributary.lock.NamedMutex;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Catches up a set of {@link Projector}s with the event store, one batch per {@link #run()}.
 * <p>
 * A run acquires the lock {@code "<lockNamePrefix>:<name>"}, resumes from the lowest progress of the projectors and delivers the events
 * that any projector is interested in. Each event is handled in one {@link ProgressTransaction}: the side effects registered by the
 * projectors and the progress of every subscribed projector are committed together, or not at all if a projector fails. Failures are
 * recorded in the {@link EventHandlingErrorLog} and the batch continues with the next event.
 * </p>
 * <p>
 * The lease of the lock is checked before each event is fetched and again before it's committed. A batch whose lock has expired
 * or been taken over by a competing instance stops without committing the event it was handling.
 * </p>
 * <p>
 * A projector whose progress is ahead of the batch start is subscribed when the batch reaches the event after its progress, so it's
 * never offered the same event twice.
 * </p>
 */
@NullMarked
public class ReadModelCatchup implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReadModelCatchup.class);

    private final EventStoreQueries queries;
    private final NamedMutex mutex;
    private final ProjectorProgressStorage progressStorage;
    private final EventHandlingErrorLog errorLog;
    private final EventDeserializer deserializer;
    private final ReadModelCatchupConfig config;
    private final Map<String, Projector> projectorsByName;
    private final EventFilter filter;
    private final List<Consumer<ReadModelCatchupStatus>> statusListeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<@Nullable Object> runningToken = new AtomicReference<>();
    private final AtomicReference<@Nullable ExclusiveEventStoreCatchupQuery> activeQuery = new AtomicReference<>();

    private volatile boolean closed;
    private long eventStoreEventCount = -1;

    public ReadModelCatchup(EventStoreQueries queries, NamedMutex mutex, ProjectorProgressStorage progressStorage, EventHandlingErrorLog errorLog,
                            EventDeserializer deserializer, ReadModelCatchupConfig config, List<? extends Projector> projectors) {
        requireNonNull(queries, EventStoreQueries.class.getSimpleName() + " cannot be null");
        requireNonNull(mutex, NamedMutex.class.getSimpleName() + " cannot be null");
        requireNonNull(progressStorage, ProjectorProgressStorage.class.getSimpleName() + " cannot be null");
        requireNonNull(errorLog, EventHandlingErrorLog.class.getSimpleName() + " cannot be null");
        requireNonNull(deserializer, EventDeserializer.class.getSimpleName() + " cannot be null");
        requireNonNull(config, ReadModelCatchupConfig.class.getSimpleName() + " cannot be null");
        requireNonNull(projectors, "Projectors cannot be null");
        if (projectors.isEmpty()) {
            throw new IllegalArgumentException("At least one projector is required");
        }

        this.queries = queries;
        this.mutex = mutex;
        this.progressStorage = progressStorage;
        this.errorLog = errorLog;
        this.deserializer = deserializer;
        this.config = config;
        this.projectorsByName = indexByUniqueName(projectors);
        this.filter = CatchupEventFilter.forProjectors(projectors);
    }

    public String name() {
        return config.name;
    }

    public ReadModelCatchupConfig config() {
        return config;
    }

    public List<Projector> projectors() {
        return List.copyOf(projectorsByName.values());
    }

    public boolean isRunning() {
        return runningToken.get() != null;
    }

    /**
     * Register a listener that receives a status when a batch starts and after each event. Exceptions thrown by the listener are logged and ignored.
     */
    public Registration onStatus(Consumer<ReadModelCatchupStatus> listener) {
        requireNonNull(listener, "Listener cannot be null");
        statusListeners.add(listener);
        return () -> statusListeners.remove(listener);
    }

    /**
     * Run a single batch. Returns immediately with {@link CatchupResult#ALREADY_IN_PROGRESS} if a batch is running.
     *
     * @throws IllegalStateException If the catchup is closed
     */
    public CatchupResult run() {
        if (closed) {
            throw new IllegalStateException("The catchup has been closed. (" + this + ")");
        }

        Object token = new Object();
        if (!runningToken.compareAndSet(null, token)) {
            log.debug("Catchup {}: already in progress, skipping", config.name);
            return CatchupResult.ALREADY_IN_PROGRESS;
        }

        long eventsProcessed = 0;
        long startedAt = System.nanoTime();
        try {
            ensureEventStoreEventCount();
            Batch batch = new Batch();
            try (ExclusiveEventStoreCatchupQuery query = ExclusiveEventStoreCatchupQuery.open(queries, mutex, config.lockName(), config.lockTimeout,
                    batch::startingId, filter, config.batchSize, config.maxReconnectAttempts)) {
                activeQuery.set(query);
                try {
                    if (closed) {
                        return CatchupResult.RAN_BUT_NO_NEW_EVENTS;
                    }
                    reportStatus(new ReadModelCatchupStatus(config.name, query.expectedNumberOfEvents(), query.startAtId(), 0, null, config.clock.instant()));
                    if (query.expectedNumberOfEvents() == 0) {
                        return CatchupResult.RAN_BUT_NO_NEW_EVENTS;
                    }
                    log.debug("Catchup {}: beginning replay of {} events from {}", config.name, query.expectedNumberOfEvents(), query.startAtId());
                    eventsProcessed = streamEventsToProjectors(query, batch, token);
                } finally {
                    // A run that started after this batch released its lock may have replaced the query already
                    activeQuery.compareAndSet(query, null);
                }
            }
        } catch (RuntimeException e) {
            log.error("Catchup {}: failed after {}ms at {} events", config.name, elapsedMillis(startedAt), eventsProcessed, e);
        } finally {
            runningToken.compareAndSet(token, null);
        }

        if (eventsProcessed > 0) {
            long elapsed = elapsedMillis(startedAt);
            log.info("Catchup {}: {} events projected in {}ms ({}ms/event)", config.name, eventsProcessed, elapsed, elapsed / eventsProcessed);
        }
        return CatchupResult.RAN_AND_HANDLED_NEW_EVENTS;
    }

    /**
     * Stops a running batch and releases its lock. The event being handled when the lock is released isn't committed.
     * Further calls to {@link #run()} fail.
     */
    @Override
    public void close() {
        closed = true;
        ExclusiveEventStoreCatchupQuery query = activeQuery.get();
        if (query != null) {
            query.releaseLock();
        }
        statusListeners.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    private long streamEventsToProjectors(ExclusiveEventStoreCatchupQuery query, Batch batch, Object token) {
        long expected = query.expectedNumberOfEvents();
        long eventsProcessed = 0;
        Iterator<StoredEvent> events = query.events();
        try {
            while (events.hasNext()) {
                StoredEvent storedEvent = events.next();
                eventsProcessed++;
                batch.subscribeProjectorsNeeding(storedEvent);
                if (closed) {
                    break;
                }

                Instant now = config.clock.instant();
                Object payload = null;
                try {
                    payload = deserializer.deserialize(storedEvent);
                    handle(new CatchupEvent(storedEvent, payload), query, batch, expected, eventsProcessed, now);
                } catch (ProjectorFailedException e) {
                    reportProjectorFailure(storedEvent, query, batch, e.projectorName, e.getCause(), now);
                } catch (LostLockException e) {
                    throw e;
                } catch (RuntimeException e) {
                    if (payload == null) {
                        log.warn("Catchup {}: couldn't deserialize event {} ({}.{})", config.name, storedEvent.id(), storedEvent.streamName(), storedEvent.type(), e);
                    } else {
                        log.error("Catchup {}: couldn't commit event {}", config.name, storedEvent.id(), e);
                    }
                    recordError(storedEvent, e, null, now);
                }

                ReadModelCatchupStatus status = new ReadModelCatchupStatus(config.name, expected, storedEvent.id(), eventsProcessed, storedEvent.timestamp(), now);
                if (status.isEndOfBatch()) {
                    // Allow the next batch to start while listeners are notified
                    runningToken.compareAndSet(token, null);
                    query.releaseLock();
                }
                reportStatus(status);
            }
        } catch (LostLockException e) {
            if (!closed) {
                log.warn("Catchup {}: lost lock {} after {} of {} events, stopping the batch", config.name, e.lockName, eventsProcessed, expected);
            }
        }
        return eventsProcessed;
    }

    private void handle(CatchupEvent event, ExclusiveEventStoreCatchupQuery query, Batch batch, long expected, long eventsProcessed, Instant now) {
        List<ProjectorProgress> updated = new ArrayList<>(batch.subscribed.size());
        List<SideEffectFailure> failures;
        try (ProgressTransaction transaction = progressStorage.beginTransaction()) {
            batch.bus.publish(event, transaction);
            long eventsRemaining = expected - eventsProcessed;
            for (ProjectorProgress current : batch.subscribed.values()) {
                ProjectorProgress progress = current.copy();
                progress.setLastUpdated(now);
                progress.setCurrentAsOfEventId(event.id());
                progress.setLatencyInMilliseconds(Duration.between(event.storedEvent().timestamp(), now).toMillis());
                progress.setBatchRemainingEvents(eventsRemaining);
                if (eventsProcessed == 1) {
                    progress.setBatchStartTime(now);
                    progress.setBatchTotalEvents(expected);
                }
                if (progress.getInitialCatchupStartTime() == null) {
                    progress.setInitialCatchupStartTime(now);
                    progress.setInitialCatchupEvents(eventStoreEventCount);
                }
                if (eventsRemaining == 0 && progress.getInitialCatchupEndTime() == null) {
                    progress.setInitialCatchupEndTime(now);
                }
                transaction.save(progress);
                updated.add(progress);
            }
            query.ensureLockHeld();
            failures = transaction.commit();
        }
        updated.forEach(progress -> batch.subscribed.put(progress.getName(), progress));
        for (SideEffectFailure failure : failures) {
            reportProjectorFailure(event.storedEvent(), query, batch, failure.owner(), failure.cause(), now);
        }
    }

    private void reportProjectorFailure(StoredEvent storedEvent, ExclusiveEventStoreCatchupQuery query, Batch batch, @Nullable String projectorName,
                                        Throwable cause, Instant now) {
        log.warn("Catchup {}: projector {} failed on event {}", config.name, projectorName, storedEvent.id(), cause);
        String error = recordError(storedEvent, cause, projectorName, now);
        ProjectorProgress current = projectorName == null ? null : batch.subscribed.get(projectorName);
        if (current == null) {
            return;
        }
        ProjectorProgress progress = current.copy();
        progress.setFailedOnEventId(storedEvent.id());
        progress.setError(error);
        query.ensureLockHeld();
        try (ProgressTransaction transaction = progressStorage.beginTransaction()) {
            transaction.save(progress);
            transaction.commit();
            batch.subscribed.put(progress.getName(), progress);
        } catch (RuntimeException saveFailure) {
            log.error("Catchup {}: couldn't record failure of {} on event {}", config.name, projectorName, storedEvent.id(), saveFailure);
        }
    }

    private String recordError(StoredEvent storedEvent, Throwable cause, @Nullable String handler, Instant now) {
        String error = DiagnosticJson.toJson(cause);
        try {
            errorLog.record(new EventHandlingError(storedEvent.aggregateId(), storedEvent.sequenceNumber(), storedEvent.streamName(), storedEvent.type(),
                    storedEvent.body(), error, storedEvent.actor(), storedEvent.id(), handler, now));
        } catch (RuntimeException logFailure) {
            log.error("Catchup {}: couldn't record error for event {}", config.name, storedEvent.id(), logFailure);
        }
        return error;
    }

    private void reportStatus(ReadModelCatchupStatus status) {
        log.debug("{}", status);
        for (Consumer<ReadModelCatchupStatus> listener : statusListeners) {
            try {
                listener.accept(status);
            } catch (RuntimeException e) {
                log.warn("Catchup {}: exception while reporting status {}", config.name, status, e);
            }
        }
    }

    private void ensureEventStoreEventCount() {
        if (eventStoreEventCount < 0) {
            eventStoreEventCount = queries.count(0, EventFilter.all());
        }
    }

    private static long elapsedMillis(long startedAtNanos) {
        return (System.nanoTime() - startedAtNanos) / 1_000_000;
    }

    private static Map<String, Projector> indexByUniqueName(List<? extends Projector> projectors) {
        Map<String, Projector> byName = new LinkedHashMap<>();
        List<String> duplicates = new ArrayList<>();
        for (Projector projector : projectors) {
            requireNonNull(projector, Projector.class.getSimpleName() + " cannot be null");
            if (byName.putIfAbsent(projector.name(), projector) != null && !duplicates.contains(projector.name())) {
                duplicates.add(projector.name());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new DuplicateReadModelNamesException(duplicates);
        }
        return byName;
    }

    @Override
    public String toString() {
        return "ReadModelCatchup{name='" + config.name + "', projectors=" + projectorsByName.keySet() + "}";
    }

    /**
     * Working state of a single run. Progress is replaced only after it has been committed.
     */
    private class Batch {
        private final InProcessEventBus bus = new InProcessEventBus();
        private final Map<String, ProjectorProgress> subscribed = new LinkedHashMap<>();
        private final Map<String, ProjectorProgress> unsubscribed = new LinkedHashMap<>();

        /**
         * Invoked once the lock is held, so the progress can't be changed by a competing instance.
         */
        private long startingId() {
            for (ProjectorProgress progress : progressStorage.loadOrCreate(projectorsByName.keySet())) {
                unsubscribed.put(progress.getName(), progress);
            }
            long lowest = unsubscribed.values().stream().mapToLong(ProjectorProgress::getCurrentAsOfEventId).min().orElse(0);
            return Math.max(lowest + 1, config.startAtEventId);
        }

        private void subscribeProjectorsNeeding(StoredEvent storedEvent) {
            if (unsubscribed.isEmpty()) {
                return;
            }
            for (Iterator<ProjectorProgress> iterator = unsubscribed.values().iterator(); iterator.hasNext(); ) {
                ProjectorProgress progress = iterator.next();
                if (storedEvent.id() >= progress.getCurrentAsOfEventId() + 1) {
                    bus.subscribe(projectorsByName.get(progress.getName()));
                    subscribed.put(progress.getName(), progress);
                    iterator.remove();
                }
            }
        }
    }
}
