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

package org.tributary.eventstore.inmemory;

import org.tributary.eventstore.api.EventFilter;
import org.tributary.eventstore.api.EventFilter.All;
import org.tributary.eventstore.api.EventFilter.CompositionFilter;
import org.tributary.eventstore.api.EventFilter.FieldFilter;
import org.tributary.eventstore.api.EventFilter.None;
import org.tributary.eventstore.api.StoredEvent;

import java.util.function.Predicate;

/**
 * Evaluates an {@link EventFilter} against a {@link StoredEvent} in memory.
 */
public class EventFilterMatcher {

    public static boolean matchesFilter(StoredEvent event, EventFilter filter) {
        if (filter == null) {
            throw new IllegalArgumentException(EventFilter.class.getSimpleName() + " cannot be null");
        }

        final boolean matches;
        if (filter instanceof All) {
            matches = true;
        } else if (filter instanceof None) {
            matches = false;
        } else if (filter instanceof FieldFilter fieldFilter) {
            String actual = switch (fieldFilter.field()) {
                case STREAM_NAME -> event.streamName();
                case TYPE -> event.type();
            };
            matches = fieldFilter.matches(actual);
        } else if (filter instanceof CompositionFilter cf) {
            Predicate<EventFilter> matchingPredicate = f -> matchesFilter(event, f);
            matches = switch (cf.operator()) {
                case AND -> cf.filters().stream().allMatch(matchingPredicate);
                case OR -> cf.filters().stream().anyMatch(matchingPredicate);
            };
        } else {
            throw new IllegalArgumentException("Unrecognized filter: " + filter.getClass().getName());
        }
        return matches;
    }
}
