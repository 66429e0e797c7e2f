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

package org.tributary.catchup.bus;

import org.tributary.catchup.CatchupEvent;
import org.tributary.catchup.EventInterest;
import org.tributary.catchup.ProjectionTransaction;
import org.tributary.catchup.Projector;
import org.tributary.eventstore.api.StoredEvent;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;
import static org.tributary.eventstore.api.EventFilter.WILDCARD;

/**
 * Dispatches events synchronously to subscribed {@link Projector}s. Projectors are looked up by the {@link EventInterest}s they
 * declared, in the order they were subscribed. Not thread-safe, a bus is used by one catchup run at a time.
 */
public class InProcessEventBus {
    private final Map<EventInterest, List<Projector>> projectorsByInterest = new HashMap<>();
    private final Map<EventInterest, List<Projector>> projectorsByPattern = new HashMap<>();
    private final Set<Projector> subscribed = new LinkedHashSet<>();

    public void subscribe(Projector projector) {
        requireNonNull(projector, Projector.class.getSimpleName() + " cannot be null");
        if (!subscribed.add(projector)) {
            return;
        }
        for (EventInterest interest : projector.interests()) {
            boolean isExactOrPlainWildcard = !interest.isPattern() || isPlainWildcardOnly(interest);
            Map<EventInterest, List<Projector>> index = isExactOrPlainWildcard ? projectorsByInterest : projectorsByPattern;
            index.computeIfAbsent(interest, __ -> new ArrayList<>()).add(projector);
        }
    }

    public boolean isSubscribed(Projector projector) {
        return subscribed.contains(projector);
    }

    /**
     * @return The subscribed projectors interested in {@code event}, in subscription order
     */
    public List<Projector> projectorsFor(StoredEvent event) {
        Set<Projector> matching = new LinkedHashSet<>();
        addAll(matching, projectorsByInterest.get(EventInterest.of(event.streamName(), event.type())));
        addAll(matching, projectorsByInterest.get(EventInterest.of(event.streamName(), WILDCARD)));
        addAll(matching, projectorsByInterest.get(EventInterest.of(WILDCARD, event.type())));
        addAll(matching, projectorsByInterest.get(EventInterest.everything()));
        projectorsByPattern.forEach((interest, projectors) -> {
            if (interest.matches(event)) {
                matching.addAll(projectors);
            }
        });
        List<Projector> ordered = new ArrayList<>(matching.size());
        for (Projector projector : subscribed) {
            if (matching.contains(projector)) {
                ordered.add(projector);
            }
        }
        return ordered;
    }

    /**
     * Deliver {@code event} to every interested projector. Side effects are registered in {@code transaction} on behalf of
     * the projector that registers them.
     *
     * @throws ProjectorFailedException If a projector throws. Remaining projectors are not invoked.
     */
    public void publish(CatchupEvent event, ProjectionTransaction transaction) {
        for (Projector projector : projectorsFor(event.storedEvent())) {
            try {
                projector.handle(event, transaction.ownedBy(projector.name()));
            } catch (Exception e) {
                throw new ProjectorFailedException(projector.name(), event.id(), e);
            }
        }
    }

    private static boolean isPlainWildcardOnly(EventInterest interest) {
        return (WILDCARD.equals(interest.streamName()) || !interest.streamName().endsWith(WILDCARD))
                && (WILDCARD.equals(interest.type()) || !interest.type().endsWith(WILDCARD));
    }

    private static void addAll(Set<Projector> target, List<Projector> projectors) {
        if (projectors != null) {
            target.addAll(projectors);
        }
    }
}
