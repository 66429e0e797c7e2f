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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.tributary.eventstore.api.ConcurrencyException;
import org.tributary.eventstore.api.UncommittedEvent;
import org.tributary.eventstore.inmemory.InMemoryEventStore;
import org.tributary.scheduler.storage.InMemoryCommandSchedulerStorage;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static java.time.temporal.ChronoUnit.DAYS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
@Timeout(value = 20, unit = SECONDS)
class CommandSchedulerTest {
    private static final Instant WALL = Instant.parse("2024-03-01T08:00:00Z");
    private static final Instant T0 = Instant.parse("2030-01-01T00:00:00Z");
    private static final String ORDER = "Order";

    private InMemoryEventStore eventStore;
    private InMemoryCommandSchedulerStorage storage;
    private RecordingHandler handler;
    private CommandScheduler scheduler;

    @BeforeEach
    void create_scheduler() {
        eventStore = new InMemoryEventStore();
        storage = new InMemoryCommandSchedulerStorage();
        handler = new RecordingHandler();
        scheduler = new CommandScheduler(storage, eventStore, new CommandSchedulerConfig().withClock(Clock.fixed(WALL, ZoneOffset.UTC)))
                .register(ORDER, handler);
    }

    @Test
    void command_due_in_ten_days_is_delivered_once_the_clock_has_passed_its_due_time() {
        // Given
        scheduler.createClock("tests", T0);
        ScheduledCommandHandle handle = scheduler.schedule(ship(UUID.randomUUID()).onClock("tests").dueAt(T0.plus(10, DAYS)));

        // When
        SchedulingResult afterFiveDays = scheduler.advanceClockBy("tests", Duration.ofDays(5));
        long deliveriesAfterFiveDays = handler.deliveries.size();
        SchedulingResult afterElevenDays = scheduler.advanceClockBy("tests", Duration.ofDays(6));

        // Then
        ScheduledCommand command = scheduler.find(handle.key()).orElseThrow();
        assertAll(
                () -> assertThat(handle.outcome()).isEqualTo(ScheduleOutcome.SCHEDULED),
                () -> assertThat(afterFiveDays.successfulCommands()).isEmpty(),
                () -> assertThat(deliveriesAfterFiveDays).isZero(),
                () -> assertThat(afterElevenDays.successfulCommands()).containsExactly(handle.key()),
                () -> assertThat(handler.deliveries).hasSize(1),
                () -> assertThat(handler.deliveries.get(0).commandAs(Ship.class)).isEqualTo(new Ship("TN-1")),
                () -> assertThat(handler.deliveries.get(0).clockNow()).isEqualTo(T0.plus(11, DAYS)),
                () -> assertThat(command.appliedTime()).isEqualTo(WALL),
                () -> assertThat(command.attempts()).isEqualTo(1),
                () -> assertThat(scheduler.readClock("tests").utcNow()).isEqualTo(T0.plus(11, DAYS))
        );
    }

    @Test
    void command_without_due_time_is_delivered_right_away() {
        // When
        ScheduledCommandHandle handle = scheduler.schedule(ship(UUID.randomUUID()));

        // Then
        assertAll(
                () -> assertThat(handle.outcome()).isEqualTo(ScheduleOutcome.DELIVERED),
                () -> assertThat(handle.command()).isNotNull(),
                () -> assertThat(handle.command().isDelivered()).isTrue(),
                () -> assertThat(handle.command().clockName()).isEqualTo(SchedulerClock.DEFAULT_CLOCK_NAME),
                () -> assertThat(scheduler.readClock(SchedulerClock.DEFAULT_CLOCK_NAME).utcNow()).isEqualTo(WALL)
        );
    }

    @Test
    void delivered_command_is_not_delivered_again_when_the_clock_moves_on() {
        // Given
        scheduler.createClock("tests", T0);
        scheduler.schedule(ship(UUID.randomUUID()).onClock("tests").dueAt(T0.plusSeconds(60)));
        scheduler.advanceClockBy("tests", Duration.ofMinutes(2));

        // When
        SchedulingResult result = scheduler.advanceClockBy("tests", Duration.ofDays(2));

        // Then
        assertAll(
                () -> assertThat(result.successfulCommands()).isEmpty(),
                () -> assertThat(handler.deliveries).hasSize(1)
        );
    }

    @Nested
    @DisplayName("clocks")
    class Clocks {

        @Test
        void moving_a_clock_backward_fails_and_leaves_the_clock_unchanged() {
            // Given
            scheduler.createClock("tests", T0);
            scheduler.advanceClock("tests", T0.plus(1, DAYS));

            // When
            Throwable throwable = catchThrowable(() -> scheduler.advanceClock("tests", T0));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class).hasMessage("A clock cannot be moved backward."),
                    () -> assertThat(scheduler.readClock("tests").utcNow()).isEqualTo(T0.plus(1, DAYS))
            );
        }

        @Test
        void creating_a_clock_with_a_name_that_exists_fails() {
            // Given
            scheduler.createClock("tests", T0);

            // When
            Throwable throwable = catchThrowable(() -> scheduler.createClock("tests", T0.plusSeconds(10)));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(ConcurrencyException.class).hasMessage("A clock named 'tests' already exists."),
                    () -> assertThat(scheduler.readClock("tests").startTime()).isEqualTo(T0)
            );
        }

        @Test
        void advancing_a_clock_that_does_not_exist_fails() {
            // When
            Throwable throwable = catchThrowable(() -> scheduler.advanceClockBy("missing", Duration.ofSeconds(1)));

            // Then
            assertThat(throwable).isExactlyInstanceOf(ClockNotFoundException.class).hasMessage("No clock named missing was found.");
        }

        @Test
        void commands_of_an_associated_aggregate_are_scheduled_on_its_clock() {
            // Given
            UUID orderId = UUID.randomUUID();
            scheduler.createClock("tenant-a", T0);
            scheduler.associateWithClock("tenant-a", orderId.toString());

            // When
            ScheduledCommandHandle handle = scheduler.schedule(ship(orderId).dueAt(T0.plus(1, DAYS)));

            // Then
            assertThat(scheduler.find(handle.key()).orElseThrow().clockName()).isEqualTo("tenant-a");
        }

        @Test
        void associating_a_key_with_a_second_clock_fails() {
            // Given
            String lookupKey = UUID.randomUUID().toString();
            scheduler.createClock("tenant-a", T0);
            scheduler.createClock("tenant-b", T0);
            scheduler.associateWithClock("tenant-a", lookupKey);

            // When
            scheduler.associateWithClock("tenant-a", lookupKey);
            Throwable throwable = catchThrowable(() -> scheduler.associateWithClock("tenant-b", lookupKey));

            // Then
            assertThat(throwable).isExactlyInstanceOf(ConcurrencyException.class)
                    .hasMessage("Value '" + lookupKey + "' is already associated with another clock");
        }

        @Test
        void associating_a_key_with_a_missing_clock_fails() {
            // When
            Throwable throwable = catchThrowable(() -> scheduler.associateWithClock("missing", "key"));

            // Then
            assertThat(throwable).isExactlyInstanceOf(ClockNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("idempotency")
    class Idempotency {

        @Test
        void scheduling_the_same_caller_assigned_sequence_number_twice_delivers_once() {
            // Given
            UUID orderId = UUID.randomUUID();
            scheduler.createClock("tests", T0);
            ScheduleCommandRequest request = ship(orderId).onClock("tests").dueAt(T0.plusSeconds(30)).withSequenceNumber(3);

            // When
            ScheduledCommandHandle first = scheduler.schedule(request);
            ScheduledCommandHandle second = scheduler.schedule(request);
            scheduler.advanceClockBy("tests", Duration.ofMinutes(1));
            scheduler.advanceClockBy("tests", Duration.ofMinutes(1));

            // Then
            assertAll(
                    () -> assertThat(first.outcome()).isEqualTo(ScheduleOutcome.SCHEDULED),
                    () -> assertThat(second.outcome()).isEqualTo(ScheduleOutcome.DEDUPLICATED),
                    () -> assertThat(second.key()).isEqualTo(new ScheduledCommandKey(orderId, 3)),
                    () -> assertThat(handler.deliveries).hasSize(1)
            );
        }

        @Test
        void request_with_an_etag_that_the_aggregate_has_used_is_deduplicated() {
            // Given
            UUID orderId = UUID.randomUUID();
            scheduler.createClock("tests", T0);
            ScheduledCommandHandle first = scheduler.schedule(ship(orderId).onClock("tests").dueAt(T0.plus(1, DAYS)).withETag("ship-once"));

            // When
            ScheduledCommandHandle second = scheduler.schedule(ship(orderId).onClock("tests").dueAt(T0.plus(2, DAYS)).withETag("ship-once"));

            // Then
            assertAll(
                    () -> assertThat(second.outcome()).isEqualTo(ScheduleOutcome.DEDUPLICATED),
                    () -> assertThat(second.key()).isEqualTo(first.key()),
                    () -> assertThat(storage.findMatching(command -> command.aggregateId().equals(orderId))).hasSize(1)
            );
        }

        @Test
        void scheduler_assigned_sequence_numbers_are_negative_and_renumbered_on_collision() {
            // Given
            UUID orderId = UUID.randomUUID();
            long firstCandidate = -ChronoUnit.MICROS.between(Instant.EPOCH, WALL);
            scheduler.createClock("tests", T0);

            // When
            List<ScheduledCommandKey> keys = IntStream.range(0, 3)
                    .mapToObj(__ -> scheduler.schedule(ship(orderId).onClock("tests").dueAt(T0.plus(1, DAYS))).key())
                    .collect(Collectors.toList());

            // Then
            assertAll(
                    () -> assertThat(keys).allMatch(ScheduledCommandKey::isAssignedByScheduler),
                    () -> assertThat(keys).extracting(ScheduledCommandKey::sequenceNumber)
                            .containsExactly(firstCandidate, firstCandidate - 1, firstCandidate - 2)
            );
        }

        @Test
        void same_etag_on_another_aggregate_is_scheduled() {
            // Given
            scheduler.createClock("tests", T0);
            scheduler.schedule(ship(UUID.randomUUID()).onClock("tests").dueAt(T0.plus(1, DAYS)).withETag("ship"));

            // When
            ScheduledCommandHandle handle = scheduler.schedule(ship(UUID.randomUUID()).onClock("tests").dueAt(T0.plus(1, DAYS)).withETag("ship"));

            // Then
            assertThat(handle.outcome()).isEqualTo(ScheduleOutcome.SCHEDULED);
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @BeforeEach
        void create_clock() {
            scheduler.createClock("tests", T0);
        }

        @Test
        void failed_delivery_is_retried_after_previous_attempts_plus_one_minutes() {
            // Given
            handler.failWith = delivery -> delivery.numberOfPreviousAttempts() == 0 ? new IllegalStateException("boom") : null;

            // When
            ScheduledCommandHandle handle = scheduler.schedule(ship(UUID.randomUUID()).onClock("tests"));
            ScheduledCommand afterFailure = scheduler.find(handle.key()).orElseThrow();
            SchedulingResult tooEarly = scheduler.advanceClockBy("tests", Duration.ofSeconds(59));
            SchedulingResult onTime = scheduler.advanceClockBy("tests", Duration.ofSeconds(1));

            // Then
            ScheduledCommand delivered = scheduler.find(handle.key()).orElseThrow();
            assertAll(
                    () -> assertThat(handle.outcome()).isEqualTo(ScheduleOutcome.FAILED),
                    () -> assertThat(afterFailure.isPending()).isTrue(),
                    () -> assertThat(afterFailure.attempts()).isEqualTo(1),
                    () -> assertThat(afterFailure.dueTime()).isEqualTo(T0.plusSeconds(60)),
                    () -> assertThat(tooEarly.successfulCommands()).isEmpty(),
                    () -> assertThat(onTime.successfulCommands()).containsExactly(handle.key()),
                    () -> assertThat(delivered.attempts()).isEqualTo(2),
                    () -> assertThat(delivered.isDelivered()).isTrue(),
                    () -> assertThat(handler.deliveries).extracting(CommandDelivery::numberOfPreviousAttempts).containsExactly(0, 1),
                    () -> assertThat(scheduler.errorsFor(handle.key())).singleElement()
                            .satisfies(error -> assertThat(error.error()).contains("java.lang.IllegalStateException").contains("boom"))
            );
        }

        @Test
        void command_is_abandoned_after_the_retries_are_used_up() {
            // Given
            handler.failWith = __ -> new IllegalStateException("always");
            ScheduledCommandHandle handle = scheduler.schedule(ship(UUID.randomUUID()).onClock("tests"));

            // When
            for (int i = 0; i < 5; i++) {
                scheduler.advanceClockBy("tests", Duration.ofMinutes(10));
            }
            SchedulingResult afterAbandoning = scheduler.advanceClockBy("tests", Duration.ofMinutes(10));

            // Then
            ScheduledCommand command = scheduler.find(handle.key()).orElseThrow();
            assertAll(
                    () -> assertThat(handler.deliveries).extracting(CommandDelivery::numberOfPreviousAttempts).containsExactly(0, 1, 2, 3, 4, 5),
                    () -> assertThat(command.isAbandoned()).isTrue(),
                    () -> assertThat(command.finalAttemptTime()).isEqualTo(WALL),
                    () -> assertThat(command.attempts()).isEqualTo(6),
                    () -> assertThat(afterAbandoning.failedCommands()).isEmpty(),
                    () -> assertThat(scheduler.errorsFor(handle.key())).hasSize(6)
            );
        }

        @Test
        void handler_can_cancel_a_failed_command() {
            // Given
            handler.failWith = __ -> new IllegalArgumentException("invalid");
            handler.onFailure = CommandFailed::cancel;

            // When
            ScheduledCommandHandle handle = scheduler.schedule(ship(UUID.randomUUID()).onClock("tests"));

            // Then
            ScheduledCommand command = scheduler.find(handle.key()).orElseThrow();
            assertAll(
                    () -> assertThat(handle.outcome()).isEqualTo(ScheduleOutcome.FAILED),
                    () -> assertThat(command.isAbandoned()).isTrue(),
                    () -> assertThat(handler.failures).singleElement().satisfies(failure -> {
                        assertThat(failure.isCanceled()).isTrue();
                        assertThat(failure.exception()).hasMessage("invalid");
                        assertThat(failure.numberOfPreviousAttempts()).isZero();
                    })
            );
        }

        @Test
        void handler_can_choose_the_retry_delay() {
            // Given
            handler.failWith = __ -> new IllegalStateException("later");
            handler.onFailure = failure -> failure.retry(Duration.ofHours(3));

            // When
            ScheduledCommandHandle handle = scheduler.schedule(ship(UUID.randomUUID()).onClock("tests"));

            // Then
            assertThat(scheduler.find(handle.key()).orElseThrow().dueTime()).isEqualTo(T0.plus(Duration.ofHours(3)));
        }

        @Test
        void concurrency_exceptions_are_retried_when_other_failures_are_not() {
            // Given
            scheduler = new CommandScheduler(storage, eventStore, new CommandSchedulerConfig()
                    .withClock(Clock.fixed(WALL, ZoneOffset.UTC))
                    .withNumberOfRetriesOnException(0))
                    .register(ORDER, handler);
            UUID concurrentlyModified = UUID.randomUUID();
            handler.failWith = delivery -> delivery.command().aggregateId().equals(concurrentlyModified)
                    ? new ConcurrencyException(concurrentlyModified.toString(), "Aggregate was modified")
                    : new IllegalStateException("broken");

            // When
            ScheduledCommandHandle retried = scheduler.schedule(ship(concurrentlyModified).onClock("tests"));
            ScheduledCommandHandle abandoned = scheduler.schedule(ship(UUID.randomUUID()).onClock("tests"));

            // Then
            assertAll(
                    () -> assertThat(scheduler.find(retried.key()).orElseThrow().isPending()).isTrue(),
                    () -> assertThat(scheduler.find(abandoned.key()).orElseThrow().isAbandoned()).isTrue()
            );
        }

        @Test
        void command_without_a_registered_handler_fails() {
            // When
            ScheduledCommandHandle handle = scheduler.schedule(ScheduleCommandRequest.of("Unknown", UUID.randomUUID(), "Ship", new Ship("TN-2")).onClock("tests"));

            // Then
            assertAll(
                    () -> assertThat(handle.outcome()).isEqualTo(ScheduleOutcome.FAILED),
                    () -> assertThat(scheduler.errorsFor(handle.key())).singleElement()
                            .satisfies(error -> assertThat(error.error()).contains("No handler is registered for aggregate type Unknown"))
            );
        }
    }

    @Nested
    @DisplayName("preconditions")
    class Preconditions {

        @Test
        void command_is_not_delivered_until_its_precondition_is_recorded() {
            // Given
            UUID customerId = UUID.randomUUID();
            scheduler.createClock("tests", T0);
            ScheduledCommandHandle handle = scheduler.schedule(ship(UUID.randomUUID()).onClock("tests").deliveryDependsOn(customerId, "customer-created"));
            scheduler.advanceClockBy("tests", Duration.ofMinutes(5));
            int attemptsBeforeEvent = scheduler.find(handle.key()).orElseThrow().attempts();

            // When
            eventStore.append(List.of(UncommittedEvent.of("Customer", "Created", customerId, 0, "{}", WALL).withETag("customer-created")));
            SchedulingResult result = scheduler.deliverCommandsAwaiting(customerId, "customer-created");

            // Then
            assertAll(
                    () -> assertThat(handle.outcome()).isEqualTo(ScheduleOutcome.AWAITING_PRECONDITION),
                    () -> assertThat(attemptsBeforeEvent).isZero(),
                    () -> assertThat(result.successfulCommands()).containsExactly(handle.key()),
                    () -> assertThat(handler.deliveries).hasSize(1)
            );
        }

        @Test
        void awaiting_command_that_is_not_due_yet_is_left_for_the_clock() {
            // Given
            UUID customerId = UUID.randomUUID();
            scheduler.createClock("tests", T0);
            ScheduledCommandHandle handle = scheduler.schedule(ship(UUID.randomUUID()).onClock("tests").dueAt(T0.plus(1, DAYS))
                    .deliveryDependsOn(customerId, "customer-created"));
            eventStore.append(List.of(UncommittedEvent.of("Customer", "Created", customerId, 0, "{}", WALL).withETag("customer-created")));

            // When
            SchedulingResult early = scheduler.deliverCommandsAwaiting(customerId, "customer-created");
            SchedulingResult onTime = scheduler.advanceClockBy("tests", Duration.ofDays(1));

            // Then
            assertAll(
                    () -> assertThat(early.successfulCommands()).isEmpty(),
                    () -> assertThat(onTime.successfulCommands()).containsExactly(handle.key())
            );
        }

        @Test
        void precondition_that_is_already_met_does_not_hold_the_command_back() {
            // Given
            UUID customerId = UUID.randomUUID();
            eventStore.append(List.of(UncommittedEvent.of("Customer", "Created", customerId, 0, "{}", WALL).withETag("customer-created")));

            // When
            ScheduledCommandHandle handle = scheduler.schedule(ship(UUID.randomUUID()).deliveryDependsOn(customerId, "customer-created"));

            // Then
            assertThat(handle.outcome()).isEqualTo(ScheduleOutcome.DELIVERED);
        }
    }

    @Nested
    @DisplayName("non-durable commands")
    class NonDurable {

        @Test
        void successful_non_durable_command_is_not_stored() {
            // When
            ScheduledCommandHandle handle = scheduler.schedule(ship(UUID.randomUUID()).nonDurable());

            // Then
            assertAll(
                    () -> assertThat(handle.outcome()).isEqualTo(ScheduleOutcome.DELIVERED),
                    () -> assertThat(handle.command()).isNull(),
                    () -> assertThat(scheduler.find(handle.key())).isEmpty(),
                    () -> assertThat(handler.deliveries).hasSize(1)
            );
        }

        @Test
        void failed_non_durable_command_is_stored_for_retry() {
            // Given
            handler.failWith = __ -> new IllegalStateException("down");

            // When
            ScheduledCommandHandle handle = scheduler.schedule(ship(UUID.randomUUID()).nonDurable());

            // Then
            ScheduledCommand stored = scheduler.find(handle.key()).orElseThrow();
            assertAll(
                    () -> assertThat(handle.outcome()).isEqualTo(ScheduleOutcome.FAILED),
                    () -> assertThat(stored.isPending()).isTrue(),
                    () -> assertThat(stored.attempts()).isEqualTo(1),
                    () -> assertThat(scheduler.errorsFor(handle.key())).hasSize(1)
            );
        }

        @Test
        void failed_non_durable_commands_for_the_same_aggregate_in_the_same_instant_are_renumbered_and_both_stored() {
            // Given
            handler.failWith = __ -> new IllegalStateException("down");
            UUID orderId = UUID.randomUUID();

            // When
            ScheduledCommandHandle first = scheduler.schedule(ship(orderId).nonDurable());
            ScheduledCommandHandle second = scheduler.schedule(ship(orderId).nonDurable());

            // Then
            long firstCandidate = -ChronoUnit.MICROS.between(Instant.EPOCH, WALL);
            assertAll(
                    () -> assertThat(first.outcome()).isEqualTo(ScheduleOutcome.FAILED),
                    () -> assertThat(second.outcome()).isEqualTo(ScheduleOutcome.FAILED),
                    () -> assertThat(first.key().sequenceNumber()).isEqualTo(firstCandidate),
                    () -> assertThat(second.key().sequenceNumber()).isEqualTo(firstCandidate - 1),
                    () -> assertThat(scheduler.find(first.key())).hasValueSatisfying(command -> assertThat(command.isPending()).isTrue()),
                    () -> assertThat(scheduler.find(second.key())).hasValueSatisfying(command -> assertThat(command.isPending()).isTrue()),
                    () -> assertThat(scheduler.errorsFor(first.key())).hasSize(1),
                    () -> assertThat(scheduler.errorsFor(second.key())).hasSize(1)
            );
        }

        @Test
        void non_durable_command_due_later_is_stored() {
            // When
            ScheduledCommandHandle handle = scheduler.schedule(ship(UUID.randomUUID()).nonDurable().dueAt(WALL.plus(1, DAYS)));

            // Then
            assertAll(
                    () -> assertThat(handle.outcome()).isEqualTo(ScheduleOutcome.SCHEDULED),
                    () -> assertThat(scheduler.find(handle.key())).isPresent()
            );
        }
    }

    @Nested
    @DisplayName("trigger")
    class Trigger {

        @Test
        void trigger_delivers_matching_commands_before_they_are_due() {
            // Given
            scheduler.createClock("tests", T0);
            UUID orderId = UUID.randomUUID();
            ScheduledCommandHandle matching = scheduler.schedule(ship(orderId).onClock("tests").dueAt(T0.plus(3, DAYS)));
            scheduler.schedule(ship(UUID.randomUUID()).onClock("tests").dueAt(T0.plus(3, DAYS)));

            // When
            SchedulingResult result = scheduler.trigger(command -> command.aggregateId().equals(orderId));

            // Then
            assertAll(
                    () -> assertThat(result.successfulCommands()).containsExactly(matching.key()),
                    () -> assertThat(handler.deliveries).hasSize(1),
                    () -> assertThat(scheduler.readClock("tests").utcNow()).isEqualTo(T0)
            );
        }

        @Test
        void trigger_attempts_abandoned_commands_again() {
            // Given
            scheduler.createClock("tests", T0);
            handler.failWith = delivery -> delivery.numberOfPreviousAttempts() == 0 ? new IllegalStateException("first") : null;
            handler.onFailure = CommandFailed::cancel;
            ScheduledCommandHandle handle = scheduler.schedule(ship(UUID.randomUUID()).onClock("tests"));

            // When
            SchedulingResult result = scheduler.trigger(command -> true);

            // Then
            assertAll(
                    () -> assertThat(result.successfulCommands()).containsExactly(handle.key()),
                    () -> assertThat(scheduler.find(handle.key()).orElseThrow().isDelivered()).isTrue()
            );
        }
    }

    @Test
    void concurrent_advancers_deliver_each_due_command_exactly_once() throws Exception {
        // Given
        scheduler.createClock("race", T0);
        Map<ScheduledCommandKey, Integer> deliveries = new ConcurrentHashMap<>();
        scheduler.register(ORDER, delivery -> {
            deliveries.merge(delivery.command().key(), 1, Integer::sum);
            Thread.sleep(1);
        });
        List<ScheduledCommandKey> keys = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            keys.add(scheduler.schedule(ship(UUID.randomUUID()).onClock("race").dueAt(T0.plusSeconds(i))).key());
        }
        CountDownLatch start = new CountDownLatch(1);

        // When
        List<CompletableFuture<SchedulingResult>> advancers = IntStream.range(0, 2)
                .mapToObj(__ -> CompletableFuture.supplyAsync(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        throw new RuntimeException(e);
                    }
                    return scheduler.advanceClock("race", T0.plus(1, DAYS));
                }))
                .collect(Collectors.toList());
        start.countDown();
        int delivered = 0;
        for (CompletableFuture<SchedulingResult> advancer : advancers) {
            delivered += advancer.get().successfulCommands().size();
        }

        // Then
        int totalDelivered = delivered;
        assertAll(
                () -> assertThat(deliveries.keySet()).containsExactlyInAnyOrderElementsOf(keys),
                () -> assertThat(deliveries.values()).containsOnly(1),
                () -> assertThat(totalDelivered).isEqualTo(50)
        );
    }

    @Test
    void activity_is_published_for_scheduled_and_delivered_commands() {
        // Given
        UUID orderId = UUID.randomUUID();

        // Then
        StepVerifier.create(scheduler.activity().take(3))
                .then(() -> {
                    scheduler.schedule(ship(orderId).withETag("once"));
                    scheduler.schedule(ship(orderId).withETag("once"));
                })
                .assertNext(activity -> assertThat(activity.type()).isEqualTo(SchedulerActivity.Type.SCHEDULED))
                .assertNext(activity -> assertAll(
                        () -> assertThat(activity.type()).isEqualTo(SchedulerActivity.Type.DELIVERED),
                        () -> assertThat(activity.key().aggregateId()).isEqualTo(orderId),
                        () -> assertThat(activity.commandName()).isEqualTo("Ship")
                ))
                .assertNext(activity -> assertThat(activity.type()).isEqualTo(SchedulerActivity.Type.DEDUPLICATED))
                .verifyComplete();
    }

    @Test
    void closing_completes_the_activity_stream() {
        // Then
        StepVerifier.create(scheduler.activity())
                .then(scheduler::close)
                .verifyComplete();
    }

    private static ScheduleCommandRequest ship(UUID orderId) {
        return ScheduleCommandRequest.of(ORDER, orderId, "Ship", new Ship("TN-1"));
    }
}
