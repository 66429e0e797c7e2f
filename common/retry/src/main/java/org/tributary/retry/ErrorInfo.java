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
import java.util.Optional;

/**
 * The state of a retry when an attempt has failed.
 */
public interface ErrorInfo extends RetryInfo {

    /**
     * @return How long to wait before the next attempt, or empty if no more attempts will be made.
     */
    Optional<Duration> getBackoffBeforeNextRetryAttempt();

    boolean isRetryable();
}
