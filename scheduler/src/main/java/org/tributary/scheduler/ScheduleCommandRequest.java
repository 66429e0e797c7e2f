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
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * A request to schedule a command for an aggregate.
 *
 * @param command        The command, serialized to JSON when the request is stored
 * @param dueTime        When the command is due on its clock, {@code null} means now
 * @param sequenceNumber A caller-assigned sequence number, {@code null} lets the scheduler assign a negative one
 * @param clockName      The clock to schedule on, {@code null} resolves the clock from the aggregate id
 * @param etag           Identifies the request, a request with an etag that the aggregate has already used is deduplicated
 * @param durable        A non-durable command that is delivered successfully right away is never stored
 */
@NullMarked
public record ScheduleCommandRequest(String aggregateType, UUID aggregateId, String commandName, Object command, @Nullable Instant dueTime,
                                     @Nullable Long sequenceNumber, @Nullable String clockName, @Nullable CommandPrecondition deliveryDependsOn,
                                     @Nullable String etag, boolean durable) {

    public ScheduleCommandRequest {
        requireNonNull(aggregateType, "Aggregate type cannot be null");
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(commandName, "Command name cannot be null");
        requireNonNull(command, "Command cannot be null");
        if (sequenceNumber != null && sequenceNumber < 0) {
            throw new IllegalArgumentException("Caller-assigned sequence numbers cannot be negative");
        }
    }

    public static ScheduleCommandRequest of(String aggregateType, UUID aggregateId, String commandName, Object command) {
        return new ScheduleCommandRequest(aggregateType, aggregateId, commandName, command, null, null, null, null, null, true);
    }

    public ScheduleCommandRequest dueAt(@Nullable Instant dueTime) {
        return new ScheduleCommandRequest(aggregateType, aggregateId, commandName, command, dueTime, sequenceNumber, clockName, deliveryDependsOn, etag, durable);
    }

    public ScheduleCommandRequest withSequenceNumber(long sequenceNumber) {
        return new ScheduleCommandRequest(aggregateType, aggregateId, commandName, command, dueTime, sequenceNumber, clockName, deliveryDependsOn, etag, durable);
    }

    public ScheduleCommandRequest onClock(String clockName) {
        return new ScheduleCommandRequest(aggregateType, aggregateId, commandName, command, dueTime, sequenceNumber, clockName, deliveryDependsOn, etag, durable);
    }

    public ScheduleCommandRequest deliveryDependsOn(UUID aggregateId, String etag) {
        return new ScheduleCommandRequest(aggregateType, this.aggregateId, commandName, command, dueTime, sequenceNumber, clockName,
                new CommandPrecondition(aggregateId, etag), this.etag, durable);
    }

    public ScheduleCommandRequest withETag(@Nullable String etag) {
        return new ScheduleCommandRequest(aggregateType, aggregateId, commandName, command, dueTime, sequenceNumber, clockName, deliveryDependsOn, etag, durable);
    }

    public ScheduleCommandRequest nonDurable() {
        return new ScheduleCommandRequest(aggregateType, aggregateId, commandName, command, dueTime, sequenceNumber, clockName, deliveryDependsOn, etag, false);
    }
}
