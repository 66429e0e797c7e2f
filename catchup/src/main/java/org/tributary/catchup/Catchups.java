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
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.eventstore.api.EventStoreQueries;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;

/**
 * Reactive helpers for running {@link ReadModelCatchup}s.
 */
@NullMarked
public final class Catchups {
    private static final Logger log = LoggerFactory.getLogger(Catchups.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);
    private static final Duration IN_FLIGHT_CHECK_INTERVAL = Duration.ofMillis(50);

    private Catchups() {
    }

    /**
     * Run a single batch, or wait for the batch that is already running to end.
     *
     * @return The last status of the batch. Empty if the batch already in flight ended before reporting any status to this caller.
     */
    public static Mono<ReadModelCatchupStatus> singleBatch(ReadModelCatchup catchup) {
        requireNonNull(catchup, ReadModelCatchup.class.getSimpleName() + " cannot be null");
        return Mono.defer(() -> {
            Sinks.One<ReadModelCatchupStatus> endOfBatch = Sinks.one();
            AtomicReference<ReadModelCatchupStatus> lastStatus = new AtomicReference<>();
            Registration registration = catchup.onStatus(status -> {
                lastStatus.set(status);
                if (status.isEndOfBatch()) {
                    endOfBatch.tryEmitValue(status);
                }
            });

            return Mono.fromCallable(catchup::run)
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(result -> {
                        if (result == CatchupResult.ALREADY_IN_PROGRESS) {
                            // The in-flight batch may fail without reporting an end of batch
                            Mono<ReadModelCatchupStatus> whenIdle = Flux.interval(IN_FLIGHT_CHECK_INTERVAL)
                                    .filter(__ -> !catchup.isRunning())
                                    .next()
                                    .flatMap(__ -> Mono.justOrEmpty(lastStatus.get()));
                            return Mono.firstWithSignal(endOfBatch.asMono(), whenIdle);
                        }
                        return Mono.justOrEmpty(lastStatus.get());
                    })
                    .doFinally(__ -> registration.cancel());
        });
    }

    /**
     * Run a single batch of each catchup in parallel, completes when all batches have ended.
     */
    public static Mono<Void> singleBatch(List<ReadModelCatchup> catchups) {
        requireNonNull(catchups, "Catchups cannot be null");
        return Flux.fromIterable(catchups).flatMap(Catchups::singleBatch).then();
    }

    public static Disposable pollEventStore(ReadModelCatchup catchup, EventStoreQueries queries) {
        return pollEventStore(catchup, queries, DEFAULT_POLL_INTERVAL);
    }

    public static Disposable pollEventStore(ReadModelCatchup catchup, EventStoreQueries queries, Duration interval) {
        requireNonNull(interval, "Interval cannot be null");
        return pollEventStore(catchup, queries, Flux.interval(Duration.ZERO, interval));
    }

    /**
     * Run a batch each time {@code trigger} emits. When a batch ends and the event store has events beyond it, another batch is
     * started right away. Failing runs are logged and don't stop the polling.
     *
     * @return Dispose to stop polling
     */
    public static Disposable pollEventStore(ReadModelCatchup catchup, EventStoreQueries queries, Publisher<?> trigger) {
        requireNonNull(catchup, ReadModelCatchup.class.getSimpleName() + " cannot be null");
        requireNonNull(queries, EventStoreQueries.class.getSimpleName() + " cannot be null");
        requireNonNull(trigger, "Trigger cannot be null");

        Sinks.Many<Boolean> tryAgain = Sinks.many().multicast().directBestEffort();
        Registration registration = catchup.onStatus(status -> {
            if (status.isEndOfBatch() && status.batchCount() > 0 && queries.latestEventId() > status.currentEventId()) {
                log.debug("Catchup {}: more events after {}, trying again", catchup.name(), status.currentEventId());
                tryAgain.tryEmitNext(Boolean.TRUE);
            }
        });

        Scheduler scheduler = Schedulers.newSingle("catchup-" + catchup.name(), true);
        Disposable polling = Flux.merge(Flux.from(trigger).map(__ -> Boolean.TRUE), tryAgain.asFlux())
                .onBackpressureLatest()
                .publishOn(scheduler, 1)
                .takeWhile(__ -> !catchup.isClosed())
                .subscribe(__ -> runSafely(catchup), error -> log.error("Catchup {}: polling stopped", catchup.name(), error));
        return Disposables.composite(polling, registration::cancel, scheduler);
    }

    private static void runSafely(ReadModelCatchup catchup) {
        try {
            catchup.run();
        } catch (RuntimeException e) {
            log.error("Catchup {}: run failed", catchup.name(), e);
        }
    }
}
