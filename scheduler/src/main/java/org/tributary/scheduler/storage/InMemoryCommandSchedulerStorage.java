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

import org.jspecify.annotations.NullMarked;
import org.tributary.eventstore.api.ConcurrencyException;
import org.tributary.scheduler.ClockNotFoundException;
import org.tributary.scheduler.CommandExecutionError;
import org.tributary.scheduler.CommandPrecondition;
import org.tributary.scheduler.ScheduledCommand;
import org.tributary.scheduler.ScheduledCommandKey;
import org.tributary.scheduler.SchedulerClock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

@NullMarked
public class InMemoryCommandSchedulerStorage implements CommandSchedulerStorage {
    private static final Comparator<ScheduledCommand> DELIVERY_ORDER = Comparator.comparing(ScheduledCommand::dueTime)
            .thenComparingLong(ScheduledCommand::sequenceNumber);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, SchedulerClock> clocks = new HashMap<>();
    private final Map<String, String> clockMappings = new HashMap<>();
    private final Map<ScheduledCommandKey, ScheduledCommand> commands = new HashMap<>();
    private final Set<String> etags = new HashSet<>();
    private final List<CommandExecutionError> errors = new ArrayList<>();

    @Override
    public void createClock(SchedulerClock clock) {
        requireNonNull(clock, SchedulerClock.class.getSimpleName() + " cannot be null");
        locked(() -> {
            if (clocks.putIfAbsent(clock.name(), clock) != null) {
                throw new ConcurrencyException(clock.name(), "A clock named '" + clock.name() + "' already exists.");
            }
        });
    }

    @Override
    public Optional<SchedulerClock> findClock(String name) {
        return locked(() -> Optional.ofNullable(clocks.get(name)));
    }

    @Override
    public SchedulerClock advanceClock(String name, UnaryOperator<Instant> to) {
        requireNonNull(to, "Target time function cannot be null");
        return locked(() -> {
            SchedulerClock clock = clocks.get(name);
            if (clock == null) {
                throw new ClockNotFoundException(name);
            }
            Instant target = requireNonNull(to.apply(clock.utcNow()), "Target time cannot be null");
            if (target.isBefore(clock.utcNow())) {
                throw new IllegalStateException("A clock cannot be moved backward.");
            }
            SchedulerClock advanced = clock.withUtcNow(target);
            clocks.put(name, advanced);
            return advanced;
        });
    }

    @Override
    public void associateWithClock(String clockName, String lookupKey) {
        requireNonNull(clockName, "Clock name cannot be null");
        requireNonNull(lookupKey, "Lookup key cannot be null");
        locked(() -> {
            String existing = clockMappings.putIfAbsent(lookupKey, clockName);
            if (existing != null && !existing.equals(clockName)) {
                throw new ConcurrencyException(lookupKey, "Value '" + lookupKey + "' is already associated with another clock");
            }
        });
    }

    @Override
    public Optional<String> clockNameFor(String lookupKey) {
        return locked(() -> Optional.ofNullable(clockMappings.get(lookupKey)));
    }

    @Override
    public void insert(ScheduledCommand command) {
        requireNonNull(command, ScheduledCommand.class.getSimpleName() + " cannot be null");
        locked(() -> {
            if (commands.containsKey(command.key())) {
                throw new ConcurrencyException(command.key().toString(), "Command " + command.key() + " is already scheduled");
            }
            String etag = command.etag();
            if (etag != null && !etags.add(CommandSchedulerStorage.etagKey(command.aggregateId(), etag))) {
                throw new ConcurrencyException(CommandSchedulerStorage.etagKey(command.aggregateId(), etag),
                        "Aggregate " + command.aggregateId() + " already has a command with etag " + etag);
            }
            commands.put(command.key(), command);
        });
    }

    @Override
    public Optional<ScheduledCommand> find(ScheduledCommandKey key) {
        return locked(() -> Optional.ofNullable(commands.get(key)));
    }

    @Override
    public boolean update(ScheduledCommand command, long expectedVersion) {
        requireNonNull(command, ScheduledCommand.class.getSimpleName() + " cannot be null");
        return locked(() -> {
            ScheduledCommand current = commands.get(command.key());
            if (current == null || current.version() != expectedVersion) {
                return false;
            }
            commands.put(command.key(), command);
            return true;
        });
    }

    @Override
    public boolean hasETag(UUID aggregateId, String etag) {
        return locked(() -> etags.contains(CommandSchedulerStorage.etagKey(aggregateId, etag)));
    }

    @Override
    public List<ScheduledCommand> findDue(String clockName, Instant clockNow) {
        return findMatching(command -> command.clockName().equals(clockName) && command.isPending() && command.isDue(clockNow));
    }

    @Override
    public List<ScheduledCommand> findMatching(Predicate<ScheduledCommand> predicate) {
        requireNonNull(predicate, "Predicate cannot be null");
        List<ScheduledCommand> snapshot = locked(() -> new ArrayList<>(commands.values()));
        return snapshot.stream().filter(predicate).sorted(DELIVERY_ORDER).collect(Collectors.toList());
    }

    @Override
    public List<ScheduledCommand> findAwaiting(CommandPrecondition precondition) {
        return findMatching(command -> command.isPending() && Objects.equals(command.deliveryDependsOn(), precondition));
    }

    @Override
    public void recordError(CommandExecutionError error) {
        requireNonNull(error, CommandExecutionError.class.getSimpleName() + " cannot be null");
        locked(() -> errors.add(error));
    }

    @Override
    public List<CommandExecutionError> errorsFor(ScheduledCommandKey key) {
        return locked(() -> errors.stream()
                .filter(error -> error.aggregateId().equals(key.aggregateId()) && error.sequenceNumber() == key.sequenceNumber())
                .collect(Collectors.toList()));
    }

    private void locked(Runnable runnable) {
        locked(() -> {
            runnable.run();
            return null;
        });
    }

    private <T> T locked(Supplier<T> supplier) {
        lock.lock();
        try {
            return supplier.get();
        } finally {
            lock.unlock();
        }
    }
}
