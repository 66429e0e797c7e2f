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

package org.tributary.catchup.sensors;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * How far a single projector has come.
 *
 * @param timeTakenForInitialCatchup Time from the first event of the initial catchup until it ended, or until now if it hasn't
 * @param timeRemaining              Estimated time left, extrapolated from the events processed so far
 * @param eventsRemaining            Events remaining in the current batch
 */
@NullMarked
public record ReadModelDiagnostics(String name, long initialCatchupEvents, @Nullable Duration timeTakenForInitialCatchup, Duration timeRemaining,
                                   long eventsRemaining, double percentageCompleted, long latencyInMilliseconds, @Nullable Instant lastUpdated,
                                   long currentAsOfEventId, @Nullable Long failedOnEventId, @Nullable String error) {
}
