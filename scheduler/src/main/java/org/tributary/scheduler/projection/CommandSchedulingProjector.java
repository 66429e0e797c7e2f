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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.catchup.CatchupEvent;
import org.tributary.catchup.EventInterest;
import org.tributary.catchup.ProjectionTransaction;
import org.tributary.catchup.Projector;
import org.tributary.eventstore.api.StoredEvent;
import org.tributary.scheduler.CommandScheduler;
import org.tributary.scheduler.ScheduleCommandRequest;
import org.tributary.scheduler.ScheduledCommandHandle;
import org.tributary.scheduler.serialization.CommandSerializer;

import java.util.Set;

import static java.util.Objects.requireNonNull;
import static org.tributary.eventstore.api.EventFilter.WILDCARD;

/**
 * Schedules the commands recorded as events in {@value #STREAM_PREFIX}{@code <AggregateType>} streams. The event's sequence number becomes the
 * caller-assigned sequence number of the command, so replaying the events schedules every command once.
 */
@NullMarked
public class CommandSchedulingProjector implements Projector {
    private static final Logger log = LoggerFactory.getLogger(CommandSchedulingProjector.class);
    public static final String STREAM_PREFIX = "Scheduled:";

    private final CommandScheduler scheduler;
    private final CommandSerializer serializer;
    private final Set<EventInterest> interests;

    public CommandSchedulingProjector(CommandScheduler scheduler) {
        this(scheduler, new CommandSerializer());
    }

    public CommandSchedulingProjector(CommandScheduler scheduler, CommandSerializer serializer) {
        requireNonNull(scheduler, CommandScheduler.class.getSimpleName() + " cannot be null");
        requireNonNull(serializer, CommandSerializer.class.getSimpleName() + " cannot be null");
        this.scheduler = scheduler;
        this.serializer = serializer;
        this.interests = Set.of(EventInterest.allTypesIn(STREAM_PREFIX + WILDCARD));
    }

    public static String streamNameFor(String aggregateType) {
        return STREAM_PREFIX + aggregateType;
    }

    @Override
    public String name() {
        return "CommandScheduling";
    }

    @Override
    public Set<EventInterest> interests() {
        return interests;
    }

    @Override
    public void handle(CatchupEvent event, ProjectionTransaction transaction) {
        StoredEvent stored = event.storedEvent();
        ScheduledCommandEvent scheduled = event.payload() instanceof ScheduledCommandEvent payload
                ? payload
                : serializer.deserialize(stored.body(), ScheduledCommandEvent.class);

        String aggregateType = stored.streamName().substring(STREAM_PREFIX.length());
        ScheduleCommandRequest request = ScheduleCommandRequest.of(aggregateType, stored.aggregateId(), stored.type(), scheduled.command())
                .dueAt(scheduled.dueTime())
                .withSequenceNumber(stored.sequenceNumber())
                .withETag(stored.etag());
        if (scheduled.clockName() != null) {
            request = request.onClock(scheduled.clockName());
        }
        if (scheduled.deliveryDependsOn() != null) {
            request = request.deliveryDependsOn(scheduled.deliveryDependsOn().aggregateId(), scheduled.deliveryDependsOn().etag());
        }

        ScheduleCommandRequest toSchedule = request;
        transaction.onCommit(() -> {
            ScheduledCommandHandle handle = scheduler.schedule(toSchedule);
            if (log.isDebugEnabled()) {
                log.debug("Event {} scheduled {} ({}): {}", stored.id(), handle.key(), stored.type(), handle.outcome());
            }
        });
    }
}
