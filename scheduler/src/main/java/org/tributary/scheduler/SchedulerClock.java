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

import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * A named logical clock. Commands scheduled on a clock are due when their due time is at or before {@code utcNow}.
 */
@NullMarked
public record SchedulerClock(String name, Instant utcNow, Instant startTime) {
    public static final String DEFAULT_CLOCK_NAME = "default";

    public SchedulerClock {
        requireNonNull(name, "Name cannot be null");
        requireNonNull(utcNow, "UTC now cannot be null");
        requireNonNull(startTime, "Start time cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Name cannot be blank");
        }
    }

    public static SchedulerClock startingAt(String name, Instant startTime) {
        return new SchedulerClock(name, startTime, startTime);
    }

    public SchedulerClock withUtcNow(Instant utcNow) {
        return new SchedulerClock(name, utcNow, startTime);
    }
}
