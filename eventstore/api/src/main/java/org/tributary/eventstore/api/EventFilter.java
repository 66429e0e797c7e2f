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

package org.tributary.eventstore.api;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;
import static org.tributary.eventstore.api.EventFilter.CompositionOperator.AND;
import static org.tributary.eventstore.api.EventFilter.CompositionOperator.OR;

/**
 * Filters events by stream name and type. Values are matched exactly, except that {@value #WILDCARD} matches any value
 * and a value ending with {@value #WILDCARD} matches values starting with what precedes it (for example {@code "Scheduled:*"}).
 */
public sealed interface EventFilter {
    String WILDCARD = "*";

    record All() implements EventFilter {
    }

    record None() implements EventFilter {
    }

    /**
     * Matches if the field matches any of the {@code values}.
     */
    record FieldFilter(Field field, Set<String> values) implements EventFilter {
        public FieldFilter {
            requireNonNull(field, "Field cannot be null");
            requireNonNull(values, "Values cannot be null");
            if (values.isEmpty()) {
                throw new IllegalArgumentException("Values cannot be empty");
            }
            values = Collections.unmodifiableSet(new LinkedHashSet<>(values));
        }

        public boolean matches(String actual) {
            return values.stream().anyMatch(pattern -> matchesPattern(pattern, actual));
        }

        @Override
        public String toString() {
            return field.name().toLowerCase() + (values.size() == 1 ? " = " + values.iterator().next() : " in " + values);
        }
    }

    record CompositionFilter(CompositionOperator operator, List<EventFilter> filters) implements EventFilter {
        public CompositionFilter {
            requireNonNull(operator, "Operator cannot be null");
            requireNonNull(filters, "Filters cannot be null");
            filters = List.copyOf(filters);
        }

        @Override
        public String toString() {
            return filters.stream().map(f -> f instanceof CompositionFilter ? "(" + f + ")" : f.toString())
                    .collect(Collectors.joining(" " + operator.name().toLowerCase() + " "));
        }
    }

    enum Field {
        STREAM_NAME, TYPE
    }

    enum CompositionOperator {
        AND, OR
    }

    static EventFilter all() {
        return new All();
    }

    static EventFilter none() {
        return new None();
    }

    static EventFilter streamName(String streamName) {
        requireNonNull(streamName, "Stream name cannot be null");
        return new FieldFilter(Field.STREAM_NAME, Set.of(streamName));
    }

    static EventFilter type(String type) {
        requireNonNull(type, "Type cannot be null");
        return new FieldFilter(Field.TYPE, Set.of(type));
    }

    static EventFilter typeIn(Collection<String> types) {
        requireNonNull(types, "Types cannot be null");
        return new FieldFilter(Field.TYPE, new LinkedHashSet<>(types));
    }

    static EventFilter or(List<EventFilter> filters) {
        requireNonNull(filters, "Filters cannot be null");
        return filters.size() == 1 ? filters.get(0) : new CompositionFilter(OR, filters);
    }

    static EventFilter and(List<EventFilter> filters) {
        requireNonNull(filters, "Filters cannot be null");
        return filters.size() == 1 ? filters.get(0) : new CompositionFilter(AND, filters);
    }

    default EventFilter and(EventFilter filter, EventFilter... filters) {
        return new CompositionFilter(AND, toList(this, filter, filters));
    }

    default EventFilter or(EventFilter filter, EventFilter... filters) {
        return new CompositionFilter(OR, toList(this, filter, filters));
    }

    /**
     * @return {@code true} if {@code actual} matches {@code pattern} according to the wildcard rules of this filter.
     */
    static boolean matchesPattern(String pattern, String actual) {
        if (WILDCARD.equals(pattern)) {
            return true;
        } else if (pattern.endsWith(WILDCARD)) {
            return actual.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return pattern.equals(actual);
    }

    private static List<EventFilter> toList(EventFilter firstFilter, EventFilter secondFilter, EventFilter[] moreFilters) {
        requireNonNull(secondFilter, "Filter cannot be null");
        List<EventFilter> allFilters = new ArrayList<>(2 + (moreFilters == null ? 0 : moreFilters.length));
        allFilters.add(firstFilter);
        allFilters.add(secondFilter);
        if (moreFilters != null) {
            Collections.addAll(allFilters, moreFilters);
        }
        return allFilters;
    }
}
