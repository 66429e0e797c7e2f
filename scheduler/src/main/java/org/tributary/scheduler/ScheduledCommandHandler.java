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

/**
 * Delivers scheduled commands to the aggregates of one type.
 */
public interface ScheduledCommandHandler {

    /**
     * Apply the command. Throwing means that the delivery failed, throw a
     * {@link org.tributary.eventstore.api.ConcurrencyException} when the aggregate was modified concurrently.
     */
    void deliver(CommandDelivery delivery) throws Exception;

    /**
     * Decide what happens after a failed delivery by calling {@link CommandFailed#cancel()} or {@link CommandFailed#retry(java.time.Duration)}.
     * If neither is called the default policy applies.
     */
    default void onFailure(CommandFailed failure) {
    }
}
