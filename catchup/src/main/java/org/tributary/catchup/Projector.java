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

import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Builds a read model from events. A projector declares the events it's interested in up front, the catchup only
 * queries and delivers those.
 */
public interface Projector {

    /**
     * @return A name that is unique and stable across restarts. The name identifies the progress of the projector.
     */
    default String name() {
        return getClass().getName();
    }

    /**
     * @return The events this projector handles. An empty set means the projector receives nothing.
     */
    Set<EventInterest> interests();

    /**
     * Handle an event. Throwing rolls back the {@code transaction}, the failure is recorded and the catchup continues with the next event.
     */
    void handle(CatchupEvent event, ProjectionTransaction transaction) throws Exception;

    static Projector of(String name, Set<EventInterest> interests, ProjectionHandler handler) {
        return new SimpleProjector(name, interests, handler);
    }

    @FunctionalInterface
    interface ProjectionHandler {
        void handle(CatchupEvent event, ProjectionTransaction transaction) throws Exception;
    }

    record SimpleProjector(String name, Set<EventInterest> interests, ProjectionHandler handler) implements Projector {
        public SimpleProjector {
            requireNonNull(name, "Name cannot be null");
            requireNonNull(interests, "Interests cannot be null");
            requireNonNull(handler, ProjectionHandler.class.getSimpleName() + " cannot be null");
            interests = Set.copyOf(interests);
        }

        @Override
        public void handle(CatchupEvent event, ProjectionTransaction transaction) throws Exception {
            handler.handle(event, transaction);
        }
    }
}
