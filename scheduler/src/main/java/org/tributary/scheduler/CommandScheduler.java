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

package org.tributary.scheduler;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.catchup.progress.DiagnosticJson;
import org.tributary.eventstore.api.ConcurrencyException;
import org.tributary.eventstore.api.EventStoreQueries;
import org.tributary.scheduler.serialization.CommandSerializer;
import org.tributary.scheduler.storage.CommandSchedulerStorage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * Schedules commands for aggregates on named clocks and delivers them when their clock reaches their due time.
 * <p>
 * A delivery first claims the stored command by incrementing its attempts under optimistic concurrency. Of several callers advancing the
 * same clock only the one that claims a command delivers it, the others skip it. Successful deliveries set the applied time, failed
 * deliveries are retried or abandoned according to the {@link ScheduledCommandHandler#onFailure(CommandFailed)} decision or the default policy:
 * retry after {@code previousAttempts + 1} minutes while {@code previousAttempts} is lower than
 * {@link CommandSchedulerConfig#numberOfRetriesOnException}. {@link ConcurrencyException}s are always retried unless the handler cancels.
 * </p>
 */
@NullMarked
public class CommandScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CommandScheduler.class);

    private final CommandSchedulerStorage storage;
    private final EventStoreQueries queries;
    private final CommandSchedulerConfig config;
    private final CommandSerializer serializer;
    private final Map<String, ScheduledCommandHandler> handlers = new ConcurrentHashMap<>();
    private final Sinks.Many<SchedulerActivity> activity = Sinks.many().multicast().directBestEffort();

    public CommandScheduler(CommandSchedulerStorage storage, EventStoreQueries queries, CommandSchedulerConfig config) {
        this(storage, queries, config, new CommandSerializer());
    }

    public CommandScheduler(CommandSchedulerStorage storage, EventStoreQueries queries, CommandSchedulerConfig config, CommandSerializer serializer) {
        requireNonNull(storage, CommandSchedulerStorage.class.getSimpleName() + " cannot be null");
        requireNonNull(queries, EventStoreQueries.class.getSimpleName() + " cannot be null");
        requireNonNull(config, CommandSchedulerConfig.class.getSimpleName() + " cannot be null");
        requireNonNull(serializer, CommandSerializer.class.getSimpleName() + " cannot be null");
        this.storage = storage;
        this.queries = queries;
        this.config = config;
        this.serializer = serializer;
    }

    public CommandScheduler register(String aggregateType, ScheduledCommandHandler handler) {
        requireNonNull(aggregateType, "Aggregate type cannot be null");
        requireNonNull(handler, ScheduledCommandHandler.class.getSimpleName() + " cannot be null");
        handlers.put(aggregateType, handler);
        return this;
    }

    /**
     * @throws ConcurrencyException If a clock with the same name exists
     */
    public SchedulerClock createClock(String name, Instant startTime) {
        SchedulerClock clock = SchedulerClock.startingAt(name, startTime);
        storage.createClock(clock);
        log.info("Created clock {} starting at {}", name, startTime);
        return clock;
    }

    /**
     * @throws ClockNotFoundException If there's no such clock
     */
    public SchedulerClock readClock(String name) {
        return storage.findClock(name).orElseThrow(() -> new ClockNotFoundException(name));
    }

    /**
     * Schedule commands for the aggregate identified by {@code lookupKey} (the aggregate id as text) on the clock, unless a request names its clock.
     *
     * @throws ClockNotFoundException If there's no such clock
     * @throws ConcurrencyException   If the key is associated with another clock
     */
    public void associateWithClock(String clockName, String lookupKey) {
        readClock(clockName);
        storage.associateWithClock(clockName, lookupKey);
    }

    public ScheduledCommandHandle schedule(ScheduleCommandRequest request) {
        requireNonNull(request, ScheduleCommandRequest.class.getSimpleName() + " cannot be null");
        String etag = request.etag();
        if (etag != null && storage.hasETag(request.aggregateId(), etag)) {
            return deduplicated(request, etag);
        }

        SchedulerClock clock = ensureClock(resolveClockName(request));
        Instant now = config.clock.instant();
        Instant dueTime = request.dueTime() == null ? clock.utcNow() : request.dueTime();
        ScheduledCommand command = new ScheduledCommand(request.aggregateId(), 0, request.aggregateType(), request.commandName(),
                serializer.serialize(request.command()), clock.name(), now, dueTime, null, null, 0, request.deliveryDependsOn(), etag, null, 0);
        boolean isDue = command.isDue(clock.utcNow());
        boolean isAwaitingPrecondition = isDue && !isPreconditionMet(command);

        if (!request.durable() && isDue && !isAwaitingPrecondition) {
            return deliverWithoutStoring(command, request.sequenceNumber(), clock.utcNow());
        }

        ScheduledCommand stored = insert(command, request.sequenceNumber());
        if (stored == null) {
            return deduplicated(request, etag);
        }
        publish(SchedulerActivity.Type.SCHEDULED, stored, null);

        if (!isDue) {
            return new ScheduledCommandHandle(stored.key(), ScheduleOutcome.SCHEDULED, stored);
        } else if (isAwaitingPrecondition) {
            log.debug("Command {} is awaiting its precondition {}", stored.key(), stored.deliveryDependsOn());
            return new ScheduledCommandHandle(stored.key(), ScheduleOutcome.AWAITING_PRECONDITION, stored);
        }

        DeliveryResult result = deliver(stored, clock.utcNow(), false);
        ScheduleOutcome outcome = switch (result) {
            case DELIVERED -> ScheduleOutcome.DELIVERED;
            case FAILED -> ScheduleOutcome.FAILED;
            case SKIPPED -> ScheduleOutcome.SCHEDULED;
        };
        return new ScheduledCommandHandle(stored.key(), outcome, storage.find(stored.key()).orElse(stored));
    }

    /**
     * Move the clock to {@code to} and deliver the commands that are due.
     *
     * @throws ClockNotFoundException If there's no such clock
     * @throws IllegalStateException  If {@code to} is before the current time of the clock
     */
    public SchedulingResult advanceClock(String clockName, Instant to) {
        requireNonNull(to, "Target time cannot be null");
        return deliverDue(storage.advanceClock(clockName, __ -> to));
    }

    /**
     * Move the clock forward by {@code by} and deliver the commands that are due.
     */
    public SchedulingResult advanceClockBy(String clockName, Duration by) {
        requireNonNull(by, "Duration cannot be null");
        return deliverDue(storage.advanceClock(clockName, current -> current.plus(by)));
    }

    /**
     * Deliver the stored commands matching the predicate regardless of their due time. Delivered commands are skipped,
     * abandoned commands are attempted again.
     */
    public SchedulingResult trigger(Predicate<ScheduledCommand> predicate) {
        requireNonNull(predicate, "Predicate cannot be null");
        List<ScheduledCommand> commands = storage.findMatching(command -> !command.isDelivered() && predicate.test(command));
        return deliverAll(commands, true, false);
    }

    /**
     * Deliver the due commands that were waiting for the aggregate to record an event with the etag.
     */
    public SchedulingResult deliverCommandsAwaiting(UUID aggregateId, String etag) {
        List<ScheduledCommand> awaiting = storage.findAwaiting(new CommandPrecondition(aggregateId, etag));
        if (!awaiting.isEmpty()) {
            log.debug("{} commands were awaiting {} of {}", awaiting.size(), etag, aggregateId);
        }
        return deliverAll(awaiting, false, true);
    }

    public Optional<ScheduledCommand> find(ScheduledCommandKey key) {
        return storage.find(key);
    }

    public List<CommandExecutionError> errorsFor(ScheduledCommandKey key) {
        return storage.errorsFor(key);
    }

    /**
     * A hot stream of what happens to scheduled commands. Best effort, subscribers that can't keep up miss activity.
     */
    public Flux<SchedulerActivity> activity() {
        return activity.asFlux();
    }

    @Override
    public void close() {
        activity.tryEmitComplete();
    }

    private SchedulingResult deliverDue(SchedulerClock clock) {
        List<ScheduledCommand> due = storage.findDue(clock.name(), clock.utcNow());
        log.debug("Clock {} is at {}, {} commands are due", clock.name(), clock.utcNow(), due.size());
        List<ScheduledCommandKey> successful = new ArrayList<>();
        List<ScheduledCommandKey> failed = new ArrayList<>();
        for (ScheduledCommand command : due) {
            collect(command, deliver(command, clock.utcNow(), false), successful, failed);
        }
        return new SchedulingResult(successful, failed);
    }

    private SchedulingResult deliverAll(List<ScheduledCommand> commands, boolean includeAbandoned, boolean onlyIfDue) {
        List<ScheduledCommandKey> successful = new ArrayList<>();
        List<ScheduledCommandKey> failed = new ArrayList<>();
        for (ScheduledCommand command : commands) {
            Instant clockNow = readClock(command.clockName()).utcNow();
            if (onlyIfDue && !command.isDue(clockNow)) {
                continue;
            }
            collect(command, deliver(command, clockNow, includeAbandoned), successful, failed);
        }
        return new SchedulingResult(successful, failed);
    }

    private static void collect(ScheduledCommand command, DeliveryResult result, List<ScheduledCommandKey> successful, List<ScheduledCommandKey> failed) {
        if (result == DeliveryResult.DELIVERED) {
            successful.add(command.key());
        } else if (result == DeliveryResult.FAILED) {
            failed.add(command.key());
        }
    }

    private DeliveryResult deliver(ScheduledCommand command, Instant clockNow, boolean includeAbandoned) {
        if (command.isDelivered() || (command.isAbandoned() && !includeAbandoned)) {
            return DeliveryResult.SKIPPED;
        }
        Instant now = config.clock.instant();
        if (command.isClaimed(now)) {
            log.debug("Command {} is being delivered by another caller", command.key());
            return DeliveryResult.SKIPPED;
        } else if (!isPreconditionMet(command)) {
            log.debug("Command {} is awaiting its precondition {}", command.key(), command.deliveryDependsOn());
            return DeliveryResult.SKIPPED;
        }

        ScheduledCommand claimed = command.claim(now.plus(config.claimLease));
        if (!storage.update(claimed, command.version())) {
            log.debug("Lost the claim of command {} to another caller", command.key());
            return DeliveryResult.SKIPPED;
        }

        try {
            invokeHandler(claimed, command.attempts(), clockNow);
        } catch (Exception e) {
            ScheduledCommand next = afterFailure(claimed, e, command.attempts(), clockNow);
            if (!storage.update(next, claimed.version())) {
                log.warn("The claim of command {} expired before its failure could be recorded", command.key());
            }
            recordFailure(next, e);
            return DeliveryResult.FAILED;
        }

        ScheduledCommand applied = claimed.applied(config.clock.instant());
        if (!storage.update(applied, claimed.version())) {
            log.warn("The claim of command {} expired before it was marked as applied", command.key());
        }
        publish(SchedulerActivity.Type.DELIVERED, applied, null);
        return DeliveryResult.DELIVERED;
    }

    private ScheduledCommandHandle deliverWithoutStoring(ScheduledCommand command, @Nullable Long callerSequenceNumber, Instant clockNow) {
        long sequenceNumber = callerSequenceNumber == null ? schedulerAssignedSequenceNumber(command.createdTime()) : callerSequenceNumber;
        ScheduledCommand attempted = command.withSequenceNumber(sequenceNumber).claim(config.clock.instant().plus(config.claimLease));
        try {
            invokeHandler(attempted, 0, clockNow);
        } catch (Exception e) {
            ScheduledCommand next = afterFailure(attempted, e, 0, clockNow);
            // A scheduler-assigned sequence number is renumbered if another command has taken it
            ScheduledCommand stored = insert(next, callerSequenceNumber);
            ScheduledCommand failed = stored == null ? next : stored;
            recordFailure(failed, e);
            return new ScheduledCommandHandle(failed.key(), ScheduleOutcome.FAILED, stored);
        }
        ScheduledCommand applied = attempted.applied(config.clock.instant());
        publish(SchedulerActivity.Type.DELIVERED, applied, null);
        return new ScheduledCommandHandle(applied.key(), ScheduleOutcome.DELIVERED, null);
    }

    private void invokeHandler(ScheduledCommand command, int numberOfPreviousAttempts, Instant clockNow) throws Exception {
        ScheduledCommandHandler handler = handlers.get(command.aggregateType());
        if (handler == null) {
            throw new IllegalStateException("No handler is registered for aggregate type " + command.aggregateType());
        }
        handler.deliver(new CommandDelivery(command, numberOfPreviousAttempts, clockNow, serializer));
    }

    private ScheduledCommand afterFailure(ScheduledCommand attempted, Exception exception, int numberOfPreviousAttempts, Instant clockNow) {
        CommandFailed failure = new CommandFailed(attempted, exception, numberOfPreviousAttempts);
        ScheduledCommandHandler handler = handlers.get(attempted.aggregateType());
        if (handler != null) {
            try {
                handler.onFailure(failure);
            } catch (RuntimeException e) {
                log.warn("Failure handler of {} threw while handling the failure of {}", attempted.aggregateType(), attempted.key(), e);
            }
        }
        if (!failure.isDecided() && (exception instanceof ConcurrencyException || numberOfPreviousAttempts < config.numberOfRetriesOnException)) {
            failure.retry(Duration.ofMinutes(numberOfPreviousAttempts + 1L));
        }

        Duration retryAfter = failure.retryAfter();
        if (failure.isCanceled() || retryAfter == null) {
            log.warn("Delivery of command {} ({}) failed after {} attempts, giving up", attempted.key(), attempted.commandName(), attempted.attempts(), exception);
            return attempted.abandoned(config.clock.instant());
        }
        log.info("Delivery of command {} ({}) failed, retrying in {}: {}", attempted.key(), attempted.commandName(), retryAfter, exception.toString());
        return attempted.rescheduled(clockNow.plus(retryAfter));
    }

    /**
     * Record the error under the key the failed command is stored with.
     */
    private void recordFailure(ScheduledCommand failed, Exception exception) {
        storage.recordError(new CommandExecutionError(failed.aggregateId(), failed.sequenceNumber(), DiagnosticJson.toJson(exception), config.clock.instant()));
        SchedulerActivity.Type type = failed.isAbandoned() ? SchedulerActivity.Type.ABANDONED : SchedulerActivity.Type.FAILED;
        publish(type, failed, exception.getMessage());
    }

    /**
     * @return The stored command or {@code null} if an equivalent command is already stored
     */
    private @Nullable ScheduledCommand insert(ScheduledCommand command, @Nullable Long callerSequenceNumber) {
        if (callerSequenceNumber != null) {
            ScheduledCommand numbered = command.withSequenceNumber(callerSequenceNumber);
            try {
                storage.insert(numbered);
                return numbered;
            } catch (ConcurrencyException e) {
                log.debug("Command {} is already scheduled: {}", numbered.key(), e.getMessage());
                return null;
            }
        }

        long firstCandidate = schedulerAssignedSequenceNumber(command.createdTime());
        return config.renumberRetryStrategy.execute(retryInfo -> {
            ScheduledCommand numbered = command.withSequenceNumber(firstCandidate - retryInfo.getRetryCount());
            try {
                storage.insert(numbered);
                return numbered;
            } catch (ConcurrencyException e) {
                String etag = command.etag();
                if (etag != null && CommandSchedulerStorage.etagKey(command.aggregateId(), etag).equals(e.conflictingKey)) {
                    return null;
                }
                log.debug("Sequence number {} of {} is taken, renumbering", numbered.sequenceNumber(), command.aggregateId());
                throw e;
            }
        });
    }

    private ScheduledCommandHandle deduplicated(ScheduleCommandRequest request, @Nullable String etag) {
        Long sequenceNumber = request.sequenceNumber();
        ScheduledCommand existing = null;
        if (etag != null) {
            existing = storage.findMatching(command -> command.aggregateId().equals(request.aggregateId()) && etag.equals(command.etag()))
                    .stream().findFirst().orElse(null);
        }
        if (existing == null && sequenceNumber != null) {
            existing = storage.find(new ScheduledCommandKey(request.aggregateId(), sequenceNumber)).orElse(null);
        }
        ScheduledCommandKey key = existing == null ? new ScheduledCommandKey(request.aggregateId(), sequenceNumber == null ? 0 : sequenceNumber) : existing.key();
        log.debug("Command {} ({}) is already scheduled", key, request.commandName());
        activity.tryEmitNext(new SchedulerActivity(SchedulerActivity.Type.DEDUPLICATED, key, request.commandName(), config.clock.instant(), null));
        return new ScheduledCommandHandle(key, ScheduleOutcome.DEDUPLICATED, existing);
    }

    private boolean isPreconditionMet(ScheduledCommand command) {
        CommandPrecondition precondition = command.deliveryDependsOn();
        return precondition == null || queries.hasBeenRecorded(precondition.aggregateId(), precondition.etag());
    }

    private String resolveClockName(ScheduleCommandRequest request) {
        String clockName = request.clockName();
        if (clockName != null) {
            return clockName;
        }
        return storage.clockNameFor(request.aggregateId().toString()).orElse(SchedulerClock.DEFAULT_CLOCK_NAME);
    }

    private SchedulerClock ensureClock(String name) {
        Optional<SchedulerClock> existing = storage.findClock(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            return createClock(name, config.clock.instant());
        } catch (ConcurrencyException e) {
            return readClock(name);
        }
    }

    private static long schedulerAssignedSequenceNumber(Instant now) {
        return -ChronoUnit.MICROS.between(Instant.EPOCH, now);
    }

    private void publish(SchedulerActivity.Type type, ScheduledCommand command, @Nullable String detail) {
        Sinks.EmitResult result = activity.tryEmitNext(new SchedulerActivity(type, command.key(), command.commandName(), config.clock.instant(), detail));
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Couldn't publish {} activity for {}: {}", type, command.key(), result);
        }
    }

    private enum DeliveryResult {
        DELIVERED, FAILED, SKIPPED
    }
}
