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

package org.tributary.scheduler.projection;

import org.jspecify.annotations.NullMarked;
import org.tributary.catchup.CatchupEvent;
import org.tributary.catchup.EventInterest;
import org.tributary.catchup.ProjectionTransaction;
import org.tributary.catchup.Projector;
import org.tributary.scheduler.CommandScheduler;

import java.util.Set;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Delivers the due commands that were waiting for an event with an etag once the catchup sees that event.
 */
@NullMarked
public class PreconditionProjector implements Projector {
    private final CommandScheduler scheduler;

    public PreconditionProjector(CommandScheduler scheduler) {
        requireNonNull(scheduler, CommandScheduler.class.getSimpleName() + " cannot be null");
        this.scheduler = scheduler;
    }

    @Override
    public String name() {
        return "CommandPreconditions";
    }

    @Override
    public Set<EventInterest> interests() {
        return Set.of(EventInterest.everything());
    }

    @Override
    public void handle(CatchupEvent event, ProjectionTransaction transaction) {
        String etag = event.storedEvent().etag();
        if (etag != null) {
            UUID aggregateId = event.storedEvent().aggregateId();
            transaction.onCommit(() -> scheduler.deliverCommandsAwaiting(aggregateId, etag));
        }
    }
}
