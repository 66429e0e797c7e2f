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

import org.tributary.eventstore.api.EventFilter;
import org.tributary.eventstore.api.StoredEvent;

import static java.util.Objects.requireNonNull;
import static org.tributary.eventstore.api.EventFilter.WILDCARD;

/**
 * A {@code (streamName, type)} tag that a {@link Projector} declares interest in. Both parts may be {@value EventFilter#WILDCARD}
 * (any value) or end with {@value EventFilter#WILDCARD} (prefix).
 */
public record EventInterest(String streamName, String type) {

    public EventInterest {
        requireNonNull(streamName, "Stream name cannot be null");
        requireNonNull(type, "Type cannot be null");
        if (streamName.isBlank() || type.isBlank()) {
            throw new IllegalArgumentException("Stream name and type cannot be blank");
        }
    }

    public static EventInterest of(String streamName, String type) {
        return new EventInterest(streamName, type);
    }

    public static EventInterest allTypesIn(String streamName) {
        return new EventInterest(streamName, WILDCARD);
    }

    public static EventInterest everything() {
        return new EventInterest(WILDCARD, WILDCARD);
    }

    public boolean isUniversal() {
        return WILDCARD.equals(streamName) && WILDCARD.equals(type);
    }

    public boolean matchesAnyType() {
        return WILDCARD.equals(type);
    }

    /**
     * @return {@code true} if either part is a pattern rather than a single value
     */
    public boolean isPattern() {
        return streamName.endsWith(WILDCARD) || type.endsWith(WILDCARD);
    }

    public boolean matches(StoredEvent event) {
        return EventFilter.matchesPattern(streamName, event.streamName()) && EventFilter.matchesPattern(type, event.type());
    }

    @Override
    public String toString() {
        return streamName + "." + type;
    }
}
