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

package org.tributary.catchup;

/**
 * The outcome of {@link ReadModelCatchup#run()}.
 */
public enum CatchupResult {
    /**
     * Another run of the same catchup instance was already in progress, nothing was done.
     */
    ALREADY_IN_PROGRESS,
    /**
     * No new events were found (or the lock was held by another instance).
     */
    RAN_BUT_NO_NEW_EVENTS,
    RAN_AND_HANDLED_NEW_EVENTS
}
