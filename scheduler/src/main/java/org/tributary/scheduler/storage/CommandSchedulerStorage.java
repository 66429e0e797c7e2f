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

package org.tributary.scheduler.storage;

import org.tributary.eventstore.api.ConcurrencyException;
import org.tributary.scheduler.ClockNotFoundException;
import org.tributary.scheduler.CommandExecutionError;
import org.tributary.scheduler.CommandPrecondition;
import org.tributary.scheduler.ScheduledCommand;
import org.tributary.scheduler.ScheduledCommandKey;
import org.tributary.scheduler.SchedulerClock;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Stores clocks, clock mappings, scheduled commands and delivery errors.
 */
public interface CommandSchedulerStorage {

    /**
     * @throws ConcurrencyException If a clock with the same name exists
     */
    void createClock(SchedulerClock clock);

    Optional<SchedulerClock> findClock(String name);

    /**
     * Atomically move a clock to the time computed from its current time.
     *
     * @throws ClockNotFoundException If there's no such clock
     * @throws IllegalStateException  If the computed time is before the current time of the clock
     */
    SchedulerClock advanceClock(String name, UnaryOperator<Instant> to);

    /**
     * Route commands for {@code lookupKey} to the clock. Associating a key with the clock it's already associated with has no effect.
     *
     * @throws ConcurrencyException If the key is associated with another clock
     */
    void associateWithClock(String clockName, String lookupKey);

    Optional<String> clockNameFor(String lookupKey);

    /**
     * @throws ConcurrencyException If a command with the same key exists, {@link ConcurrencyException#conflictingKey} is the key.
     *                              If the aggregate already has a command with the same etag the conflicting key is {@link #etagKey(UUID, String)}.
     */
    void insert(ScheduledCommand command);

    Optional<ScheduledCommand> find(ScheduledCommandKey key);

    /**
     * Replace the stored command if its version is {@code expectedVersion}.
     *
     * @return {@code false} if the command was changed or removed concurrently
     */
    boolean update(ScheduledCommand command, long expectedVersion);

    boolean hasETag(UUID aggregateId, String etag);

    /**
     * @return Pending commands on the clock that are due at {@code clockNow}, ordered by due time and sequence number
     */
    List<ScheduledCommand> findDue(String clockName, Instant clockNow);

    /**
     * @return Commands matching the predicate, ordered by due time and sequence number
     */
    List<ScheduledCommand> findMatching(Predicate<ScheduledCommand> predicate);

    /**
     * @return Pending commands waiting for the precondition, ordered by due time and sequence number
     */
    List<ScheduledCommand> findAwaiting(CommandPrecondition precondition);

    void recordError(CommandExecutionError error);

    List<CommandExecutionError> errorsFor(ScheduledCommandKey key);

    static String etagKey(UUID aggregateId, String etag) {
        return "etag:" + aggregateId + ":" + etag;
    }
}
