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

package org.tributary.retry;

import java.time.Duration;

/**
 * Information about the current attempt of an operation executed by a {@link RetryStrategy}.
 */
public interface RetryInfo {

    /**
     * @return The number of <i>this</i> attempt, {@code 1} if first attempt.
     */
    int getAttemptNumber();

    default int getRetryCount() {
        return getAttemptNumber() - 1;
    }

    /**
     * @return The maximum number of attempts, {@code Integer.MAX_VALUE} if infinite.
     */
    int getMaxAttempts();

    /**
     * @return The backoff that was waited before <i>this</i> attempt.
     */
    Duration getBackoff();

    default boolean isFirstAttempt() {
        return getAttemptNumber() == 1;
    }

    default boolean isLastAttempt() {
        return getAttemptNumber() == getMaxAttempts();
    }
}
