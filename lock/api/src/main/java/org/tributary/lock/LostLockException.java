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

/**
 * Thrown when an operation required a lock that is no longer held.
 */
public class LostLockException extends RuntimeException {
    public final String lockName;
    public final long fencingToken;

    public LostLockException(String lockName, long fencingToken) {
        super("Lost lock " + lockName + " (fencingToken=" + fencingToken + ")");
        this.lockName = lockName;
        this.fencingToken = fencingToken;
    }
}
