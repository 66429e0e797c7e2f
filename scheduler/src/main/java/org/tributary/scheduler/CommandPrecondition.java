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

import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * A command with a precondition isn't delivered until the aggregate has recorded an event with the given etag.
 */
@NullMarked
public record CommandPrecondition(UUID aggregateId, String etag) {

    public CommandPrecondition {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(etag, "ETag cannot be null");
    }
}
