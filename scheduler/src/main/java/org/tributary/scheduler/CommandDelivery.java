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
import org.tributary.scheduler.serialization.CommandSerializer;

import java.time.Instant;

/**
 * A command being delivered to a {@link ScheduledCommandHandler}.
 *
 * @param command                  The stored command
 * @param numberOfPreviousAttempts How many deliveries of this command have failed before
 * @param clockNow                 The time of the command's clock
 */
@NullMarked
public record CommandDelivery(ScheduledCommand command, int numberOfPreviousAttempts, Instant clockNow, CommandSerializer serializer) {

    public <T> T commandAs(Class<T> type) {
        return serializer.deserialize(command.serializedCommand(), type);
    }
}
