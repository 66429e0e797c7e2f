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

public enum ScheduleOutcome {
    /**
     * Stored for later delivery
     */
    SCHEDULED,
    /**
     * Due right away and delivered successfully
     */
    DELIVERED,
    /**
     * Due right away but delivery failed. The command may be retried later.
     */
    FAILED,
    /**
     * Already scheduled, with the same sequence number or etag
     */
    DEDUPLICATED,
    /**
     * Due but waiting for its precondition
     */
    AWAITING_PRECONDITION
}
