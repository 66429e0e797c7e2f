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
 * Represents a held lock. Closing the guard releases the lock so that a waiting competitor can take over immediately.
 */
public interface LockGuard extends AutoCloseable {

    String name();

    /**
     * A fencing token that is greater than the token of any previous holder of the same lock. Use it to fence
     * writes made by a holder whose lease might have expired.
     */
    long fencingToken();

    /**
     * Extend the lease of the lock.
     *
     * @return {@code true} if the lock is still held, {@code false} if it was released or lost to another holder.
     */
    boolean refresh();

    boolean isReleased();

    /**
     * Checks the lease locally, without contacting the lock's backing store.
     *
     * @return {@code false} if the lock was released, if its lease has expired or if a refresh found it taken by another holder.
     */
    boolean isHeld();

    /**
     * Release the lock. Calling this method more than once has no effect.
     */
    void release();

    @Override
    default void close() {
        release();
    }
}
