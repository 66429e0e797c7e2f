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

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * The progress of a single projector. {@code currentAsOfEventId} is the id of the last event that was offered to the projector
 * and only ever increases.
 */
public class ProjectorProgress {
    private final String name;
    private @Nullable Instant lastUpdated;
    private long currentAsOfEventId;
    private @Nullable Long failedOnEventId;
    private @Nullable String error;
    private long latencyInMilliseconds;
    private @Nullable Instant initialCatchupStartTime;
    private long initialCatchupEvents;
    private @Nullable Instant initialCatchupEndTime;
    private long batchRemainingEvents;
    private @Nullable Instant batchStartTime;
    private long batchTotalEvents;

    public ProjectorProgress(String name) {
        requireNonNull(name, "Name cannot be null");
        this.name = name;
    }

    public ProjectorProgress copy() {
        ProjectorProgress copy = new ProjectorProgress(name);
        copy.lastUpdated = lastUpdated;
        copy.currentAsOfEventId = currentAsOfEventId;
        copy.failedOnEventId = failedOnEventId;
        copy.error = error;
        copy.latencyInMilliseconds = latencyInMilliseconds;
        copy.initialCatchupStartTime = initialCatchupStartTime;
        copy.initialCatchupEvents = initialCatchupEvents;
        copy.initialCatchupEndTime = initialCatchupEndTime;
        copy.batchRemainingEvents = batchRemainingEvents;
        copy.batchStartTime = batchStartTime;
        copy.batchTotalEvents = batchTotalEvents;
        return copy;
    }

    public String getName() {
        return name;
    }

    public @Nullable Instant getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(@Nullable Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    public long getCurrentAsOfEventId() {
        return currentAsOfEventId;
    }

    public void setCurrentAsOfEventId(long currentAsOfEventId) {
        if (currentAsOfEventId < this.currentAsOfEventId) {
            throw new IllegalArgumentException(String.format("Progress of %s cannot move backwards from %d to %d", name, this.currentAsOfEventId, currentAsOfEventId));
        }
        this.currentAsOfEventId = currentAsOfEventId;
    }

    public @Nullable Long getFailedOnEventId() {
        return failedOnEventId;
    }

    public void setFailedOnEventId(@Nullable Long failedOnEventId) {
        this.failedOnEventId = failedOnEventId;
    }

    public @Nullable String getError() {
        return error;
    }

    public void setError(@Nullable String error) {
        this.error = error;
    }

    public long getLatencyInMilliseconds() {
        return latencyInMilliseconds;
    }

    public void setLatencyInMilliseconds(long latencyInMilliseconds) {
        this.latencyInMilliseconds = latencyInMilliseconds;
    }

    public @Nullable Instant getInitialCatchupStartTime() {
        return initialCatchupStartTime;
    }

    public void setInitialCatchupStartTime(@Nullable Instant initialCatchupStartTime) {
        this.initialCatchupStartTime = initialCatchupStartTime;
    }

    public long getInitialCatchupEvents() {
        return initialCatchupEvents;
    }

    public void setInitialCatchupEvents(long initialCatchupEvents) {
        this.initialCatchupEvents = initialCatchupEvents;
    }

    public @Nullable Instant getInitialCatchupEndTime() {
        return initialCatchupEndTime;
    }

    public void setInitialCatchupEndTime(@Nullable Instant initialCatchupEndTime) {
        this.initialCatchupEndTime = initialCatchupEndTime;
    }

    public long getBatchRemainingEvents() {
        return batchRemainingEvents;
    }

    public void setBatchRemainingEvents(long batchRemainingEvents) {
        this.batchRemainingEvents = batchRemainingEvents;
    }

    public @Nullable Instant getBatchStartTime() {
        return batchStartTime;
    }

    public void setBatchStartTime(@Nullable Instant batchStartTime) {
        this.batchStartTime = batchStartTime;
    }

    public long getBatchTotalEvents() {
        return batchTotalEvents;
    }

    public void setBatchTotalEvents(long batchTotalEvents) {
        this.batchTotalEvents = batchTotalEvents;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectorProgress)) return false;
        ProjectorProgress that = (ProjectorProgress) o;
        return currentAsOfEventId == that.currentAsOfEventId && latencyInMilliseconds == that.latencyInMilliseconds
                && initialCatchupEvents == that.initialCatchupEvents && batchRemainingEvents == that.batchRemainingEvents
                && batchTotalEvents == that.batchTotalEvents && name.equals(that.name) && Objects.equals(lastUpdated, that.lastUpdated)
                && Objects.equals(failedOnEventId, that.failedOnEventId) && Objects.equals(error, that.error)
                && Objects.equals(initialCatchupStartTime, that.initialCatchupStartTime) && Objects.equals(initialCatchupEndTime, that.initialCatchupEndTime)
                && Objects.equals(batchStartTime, that.batchStartTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, currentAsOfEventId, lastUpdated);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ProjectorProgress.class.getSimpleName() + "[", "]")
                .add("name='" + name + "'")
                .add("currentAsOfEventId=" + currentAsOfEventId)
                .add("lastUpdated=" + lastUpdated)
                .add("failedOnEventId=" + failedOnEventId)
                .add("batchRemainingEvents=" + batchRemainingEvents)
                .add("batchTotalEvents=" + batchTotalEvents)
                .toString();
    }
}
