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

/**
 * Something that happened to a scheduled command, published on {@link CommandScheduler#activity()}.
 *
 * @param detail The failure message for {@link Type#FAILED}, otherwise {@code null}
 */
@NullMarked
public record SchedulerActivity(Type type, ScheduledCommandKey key, String commandName, Instant time, @Nullable String detail) {

    public enum Type {
        SCHEDULED, DELIVERED, FAILED, ABANDONED, DEDUPLICATED
    }
}
