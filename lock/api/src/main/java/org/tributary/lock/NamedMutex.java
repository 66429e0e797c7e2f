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

package org.tributary.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * A named mutual exclusion primitive that can be shared by several processes, for example to make sure that only one
 * instance advances a read model catchup or a scheduler clock at a time.
 */
public interface NamedMutex {

    /**
     * Try to acquire the lock with the given {@code name}, waiting at most {@code timeout} for a competing holder to release it.
     * A {@code timeout} of {@link Duration#ZERO} makes a single attempt.
     *
     * @param name    The name of the lock
     * @param timeout How long to wait for the lock
     * @return A {@link LockGuard} if the lock was acquired, otherwise {@link Optional#empty()}.
     */
    Optional<LockGuard> tryAcquire(String name, Duration timeout);
}
