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

package org.tributary.catchup.query;

import org.tributary.catchup.EventInterest;
import org.tributary.catchup.Projector;
import org.tributary.eventstore.api.EventFilter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.tributary.eventstore.api.EventFilter.WILDCARD;

/**
 * Builds the query filter of a catchup from the interests declared by its projectors. The result is an {@code or} over
 * {@code streamName = s and type in (...)} groups, one group per stream name.
 */
public final class CatchupEventFilter {

    private CatchupEventFilter() {
    }

    public static EventFilter forProjectors(Collection<? extends Projector> projectors) {
        return forInterests(projectors.stream().flatMap(p -> p.interests().stream()).collect(Collectors.toList()));
    }

    public static EventFilter forInterests(Collection<EventInterest> interests) {
        if (interests.isEmpty()) {
            return EventFilter.none();
        } else if (interests.stream().anyMatch(EventInterest::isUniversal)) {
            return EventFilter.all();
        }

        Map<String, Set<String>> typesByStream = new LinkedHashMap<>();
        for (EventInterest interest : interests) {
            typesByStream.computeIfAbsent(interest.streamName(), __ -> new LinkedHashSet<>()).add(interest.type());
        }

        List<EventFilter> groups = new ArrayList<>(typesByStream.size());
        typesByStream.forEach((streamName, types) -> groups.add(group(streamName, types)));
        return EventFilter.or(groups);
    }

    private static EventFilter group(String streamName, Set<String> types) {
        boolean anyType = types.contains(WILDCARD);
        if (WILDCARD.equals(streamName)) {
            return EventFilter.typeIn(types);
        } else if (anyType) {
            return EventFilter.streamName(streamName);
        }
        return EventFilter.streamName(streamName).and(EventFilter.typeIn(types));
    }
}
