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

package org.tributary.lock.mongodb;

import com.mongodb.MongoCommandException;
import org.tributary.retry.RetryStrategy;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Configuration of {@link MongoNamedMutex}. Instances are immutable, use the {@code withX} methods to derive a new configuration.
 */
public class MongoNamedMutexConfig {
    public static final String DEFAULT_COLLECTION_NAME = "tributary-locks";
    public static final Duration DEFAULT_LEASE_TIME = Duration.ofSeconds(20);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(200);

    public final String collectionName;
    public final Duration leaseTime;
    public final Duration pollInterval;
    public final Clock clock;
    public final RetryStrategy retryStrategy;

    public MongoNamedMutexConfig() {
        this(DEFAULT_COLLECTION_NAME, DEFAULT_LEASE_TIME, DEFAULT_POLL_INTERVAL, Clock.systemUTC(),
                RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(2), 2.0f)
                        .maxAttempts(5)
                        .retryIf(t -> !(t instanceof MongoCommandException)));
    }

    private MongoNamedMutexConfig(String collectionName, Duration leaseTime, Duration pollInterval, Clock clock, RetryStrategy retryStrategy) {
        requireNonNull(collectionName, "Collection name cannot be null");
        requireNonNull(leaseTime, "Lease time cannot be null");
        requireNonNull(pollInterval, "Poll interval cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        requireNonNull(retryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        if (leaseTime.isNegative() || leaseTime.isZero()) {
            throw new IllegalArgumentException("Lease time must be greater than zero");
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be greater than zero");
        }
        this.collectionName = collectionName;
        this.leaseTime = leaseTime;
        this.pollInterval = pollInterval;
        this.clock = clock;
        this.retryStrategy = retryStrategy;
    }

    public MongoNamedMutexConfig withCollectionName(String collectionName) {
        return new MongoNamedMutexConfig(collectionName, leaseTime, pollInterval, clock, retryStrategy);
    }

    /**
     * @param leaseTime How long a lock is held without being refreshed. Held locks are refreshed in the background every {@code leaseTime / 2}.
     */
    public MongoNamedMutexConfig withLeaseTime(Duration leaseTime) {
        return new MongoNamedMutexConfig(collectionName, leaseTime, pollInterval, clock, retryStrategy);
    }

    /**
     * @param pollInterval How often to retry acquiring a lock held by someone else while waiting
     */
    public MongoNamedMutexConfig withPollInterval(Duration pollInterval) {
        return new MongoNamedMutexConfig(collectionName, leaseTime, pollInterval, clock, retryStrategy);
    }

    public MongoNamedMutexConfig withClock(Clock clock) {
        return new MongoNamedMutexConfig(collectionName, leaseTime, pollInterval, clock, retryStrategy);
    }

    /**
     * @param retryStrategy Retry strategy used for each MongoDB operation
     */
    public MongoNamedMutexConfig withRetryStrategy(RetryStrategy retryStrategy) {
        return new MongoNamedMutexConfig(collectionName, leaseTime, pollInterval, clock, retryStrategy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MongoNamedMutexConfig)) return false;
        MongoNamedMutexConfig that = (MongoNamedMutexConfig) o;
        return collectionName.equals(that.collectionName) && leaseTime.equals(that.leaseTime) && pollInterval.equals(that.pollInterval)
                && clock.equals(that.clock) && retryStrategy.equals(that.retryStrategy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collectionName, leaseTime, pollInterval, clock, retryStrategy);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", MongoNamedMutexConfig.class.getSimpleName() + "[", "]")
                .add("collectionName='" + collectionName + "'")
                .add("leaseTime=" + leaseTime)
                .add("pollInterval=" + pollInterval)
                .add("clock=" + clock)
                .add("retryStrategy=" + retryStrategy)
                .toString();
    }
}
