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

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Configuration of a {@link ReadModelCatchup}. Catchups with the same {@code lockNamePrefix} and {@code name} never run at the
 * same time, give catchups different names to let them run in parallel.
 */
public class ReadModelCatchupConfig {
    public static final String DEFAULT_LOCK_NAME_PREFIX = "read-model-catchup";
    public static final int DEFAULT_BATCH_SIZE = 10_000;
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 10;

    public final String name;
    public final String lockNamePrefix;
    public final long startAtEventId;
    public final int batchSize;
    public final Duration lockTimeout;
    public final int maxReconnectAttempts;
    public final Clock clock;

    public ReadModelCatchupConfig(String name) {
        this(name, DEFAULT_LOCK_NAME_PREFIX, 0, DEFAULT_BATCH_SIZE, DEFAULT_LOCK_TIMEOUT, DEFAULT_MAX_RECONNECT_ATTEMPTS, Clock.systemUTC());
    }

    private ReadModelCatchupConfig(String name, String lockNamePrefix, long startAtEventId, int batchSize, Duration lockTimeout, int maxReconnectAttempts, Clock clock) {
        requireNonNull(name, "Name cannot be null");
        requireNonNull(lockNamePrefix, "Lock name prefix cannot be null");
        requireNonNull(lockTimeout, "Lock timeout cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Name cannot be blank");
        }
        if (startAtEventId < 0) {
            throw new IllegalArgumentException("Start at event id cannot be negative");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be greater than or equal to 1");
        }
        if (lockTimeout.isNegative()) {
            throw new IllegalArgumentException("Lock timeout cannot be negative");
        }
        if (maxReconnectAttempts < 0) {
            throw new IllegalArgumentException("Max reconnect attempts cannot be negative");
        }
        this.name = name;
        this.lockNamePrefix = lockNamePrefix;
        this.startAtEventId = startAtEventId;
        this.batchSize = batchSize;
        this.lockTimeout = lockTimeout;
        this.maxReconnectAttempts = maxReconnectAttempts;
        this.clock = clock;
    }

    public ReadModelCatchupConfig withLockNamePrefix(String lockNamePrefix) {
        return new ReadModelCatchupConfig(name, lockNamePrefix, startAtEventId, batchSize, lockTimeout, maxReconnectAttempts, clock);
    }

    /**
     * @param startAtEventId Never start before this event id, even if projectors are behind it
     */
    public ReadModelCatchupConfig withStartAtEventId(long startAtEventId) {
        return new ReadModelCatchupConfig(name, lockNamePrefix, startAtEventId, batchSize, lockTimeout, maxReconnectAttempts, clock);
    }

    /**
     * @param batchSize The max number of events processed by a single run
     */
    public ReadModelCatchupConfig withBatchSize(int batchSize) {
        return new ReadModelCatchupConfig(name, lockNamePrefix, startAtEventId, batchSize, lockTimeout, maxReconnectAttempts, clock);
    }

    public ReadModelCatchupConfig withLockTimeout(Duration lockTimeout) {
        return new ReadModelCatchupConfig(name, lockNamePrefix, startAtEventId, batchSize, lockTimeout, maxReconnectAttempts, clock);
    }

    /**
     * @param maxReconnectAttempts How many times a run re-queries the event store after the event reader was closed
     */
    public ReadModelCatchupConfig withMaxReconnectAttempts(int maxReconnectAttempts) {
        return new ReadModelCatchupConfig(name, lockNamePrefix, startAtEventId, batchSize, lockTimeout, maxReconnectAttempts, clock);
    }

    public ReadModelCatchupConfig withClock(Clock clock) {
        return new ReadModelCatchupConfig(name, lockNamePrefix, startAtEventId, batchSize, lockTimeout, maxReconnectAttempts, clock);
    }

    public String lockName() {
        return lockNamePrefix + ":" + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReadModelCatchupConfig)) return false;
        ReadModelCatchupConfig that = (ReadModelCatchupConfig) o;
        return startAtEventId == that.startAtEventId && batchSize == that.batchSize && maxReconnectAttempts == that.maxReconnectAttempts
                && name.equals(that.name) && lockNamePrefix.equals(that.lockNamePrefix) && lockTimeout.equals(that.lockTimeout) && clock.equals(that.clock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, lockNamePrefix, startAtEventId, batchSize, lockTimeout, maxReconnectAttempts, clock);
    }

    @Override
    public String toString() {
        return "ReadModelCatchupConfig{" +
                "name='" + name + '\'' +
                ", lockNamePrefix='" + lockNamePrefix + '\'' +
                ", startAtEventId=" + startAtEventId +
                ", batchSize=" + batchSize +
                ", lockTimeout=" + lockTimeout +
                ", maxReconnectAttempts=" + maxReconnectAttempts +
                '}';
    }
}
