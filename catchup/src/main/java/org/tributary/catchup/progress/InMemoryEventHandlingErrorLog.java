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

package org.tributary.catchup.progress;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.Objects.requireNonNull;

public class InMemoryEventHandlingErrorLog implements EventHandlingErrorLog {
    private final List<EventHandlingError> errors = new CopyOnWriteArrayList<>();

    @Override
    public void record(EventHandlingError error) {
        requireNonNull(error, EventHandlingError.class.getSimpleName() + " cannot be null");
        errors.add(error);
    }

    @Override
    public List<EventHandlingError> findAll() {
        return List.copyOf(errors);
    }
}
