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

import java.time.Instant;
import java.util.StringJoiner;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * A durably scheduled command.
 * <p>
 * A command is pending until either {@code appliedTime} is set (it was delivered) or {@code finalAttemptTime} is set (delivery was
 * abandoned). Rows are updated with optimistic concurrency on {@code version}. {@code claimedUntil} is set while a delivery is in
 * progress so that concurrent advancers skip the command.
 * </p>
 */
@NullMarked
public record ScheduledCommand(UUID aggregateId, long sequenceNumber, String aggregateType, String commandName, String serializedCommand,
                               String clockName, Instant createdTime, Instant dueTime, @Nullable Instant appliedTime,
                               @Nullable Instant finalAttemptTime, int attempts, @Nullable CommandPrecondition deliveryDependsOn,
                               @Nullable String etag, @Nullable Instant claimedUntil, long version) {

    public ScheduledCommand {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(aggregateType, "Aggregate type cannot be null");
        requireNonNull(commandName, "Command name cannot be null");
        requireNonNull(serializedCommand, "Serialized command cannot be null");
        requireNonNull(clockName, "Clock name cannot be null");
        requireNonNull(createdTime, "Created time cannot be null");
        requireNonNull(dueTime, "Due time cannot be null");
        if (attempts < 0) {
            throw new IllegalArgumentException("Attempts cannot be negative");
        }
    }

    public ScheduledCommandKey key() {
        return new ScheduledCommandKey(aggregateId, sequenceNumber);
    }

    public boolean isPending() {
        return appliedTime == null && finalAttemptTime == null;
    }

    public boolean isDelivered() {
        return appliedTime != null;
    }

    public boolean isAbandoned() {
        return appliedTime == null && finalAttemptTime != null;
    }

    public boolean isDue(Instant clockNow) {
        return !dueTime.isAfter(clockNow);
    }

    public boolean isClaimed(Instant now) {
        return claimedUntil != null && claimedUntil.isAfter(now);
    }

    ScheduledCommand claim(Instant claimedUntil) {
        return new ScheduledCommand(aggregateId, sequenceNumber, aggregateType, commandName, serializedCommand, clockName, createdTime, dueTime,
                appliedTime, finalAttemptTime, attempts + 1, deliveryDependsOn, etag, claimedUntil, version + 1);
    }

    ScheduledCommand applied(Instant appliedTime) {
        return new ScheduledCommand(aggregateId, sequenceNumber, aggregateType, commandName, serializedCommand, clockName, createdTime, dueTime,
                appliedTime, finalAttemptTime, attempts, deliveryDependsOn, etag, null, version + 1);
    }

    ScheduledCommand abandoned(Instant finalAttemptTime) {
        return new ScheduledCommand(aggregateId, sequenceNumber, aggregateType, commandName, serializedCommand, clockName, createdTime, dueTime,
                appliedTime, finalAttemptTime, attempts, deliveryDependsOn, etag, null, version + 1);
    }

    ScheduledCommand rescheduled(Instant dueTime) {
        return new ScheduledCommand(aggregateId, sequenceNumber, aggregateType, commandName, serializedCommand, clockName, createdTime, dueTime,
                appliedTime, finalAttemptTime, attempts, deliveryDependsOn, etag, null, version + 1);
    }

    ScheduledCommand withSequenceNumber(long sequenceNumber) {
        return new ScheduledCommand(aggregateId, sequenceNumber, aggregateType, commandName, serializedCommand, clockName, createdTime, dueTime,
                appliedTime, finalAttemptTime, attempts, deliveryDependsOn, etag, claimedUntil, version);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ScheduledCommand.class.getSimpleName() + "[", "]")
                .add("key=" + key())
                .add("aggregateType='" + aggregateType + "'")
                .add("commandName='" + commandName + "'")
                .add("clockName='" + clockName + "'")
                .add("dueTime=" + dueTime)
                .add("appliedTime=" + appliedTime)
                .add("finalAttemptTime=" + finalAttemptTime)
                .add("attempts=" + attempts)
                .add("version=" + version)
                .toString();
    }
}
