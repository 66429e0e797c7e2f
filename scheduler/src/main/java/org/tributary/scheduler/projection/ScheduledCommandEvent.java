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

package org.tributary.scheduler.projection;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.tributary.scheduler.CommandPrecondition;

import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * The body of an event in a {@value CommandSchedulingProjector#STREAM_PREFIX}{@code <AggregateType>} stream. The event type is the command name,
 * the aggregate id and sequence number of the event identify the scheduled command.
 *
 * @param command The command as JSON
 * @param dueTime {@code null} means now on the command's clock
 */
@NullMarked
public record ScheduledCommandEvent(JsonNode command, @Nullable Instant dueTime, @Nullable String clockName, @Nullable CommandPrecondition deliveryDependsOn) {

    public ScheduledCommandEvent {
        requireNonNull(command, "Command cannot be null");
    }
}
