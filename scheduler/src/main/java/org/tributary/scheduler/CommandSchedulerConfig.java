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

package org.tributary.scheduler;

import org.tributary.eventstore.api.ConcurrencyException;
import org.tributary.retry.RetryStrategy;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Configuration of a {@link CommandScheduler}.
 */
public class CommandSchedulerConfig {
    public static final Duration DEFAULT_CLAIM_LEASE = Duration.ofMinutes(1);
    public static final int DEFAULT_NUMBER_OF_RETRIES_ON_EXCEPTION = 5;

    /**
     * The wall clock, used for created, applied and final attempt times and for scheduler-assigned sequence numbers.
     */
    public final Clock clock;
    /**
     * How long a delivery may take before a concurrent advancer may deliver the command again.
     */
    public final Duration claimLease;
    /**
     * Failed deliveries are retried by default while the number of previous attempts is lower than this.
     */
    public final int numberOfRetriesOnException;
    /**
     * How scheduler-assigned sequence numbers are renumbered when they collide.
     */
    public final RetryStrategy renumberRetryStrategy;

    public CommandSchedulerConfig() {
        this(Clock.systemUTC(), DEFAULT_CLAIM_LEASE, DEFAULT_NUMBER_OF_RETRIES_ON_EXCEPTION, RetryStrategy.retry().maxAttempts(100).retryIf(ConcurrencyException.class::isInstance));
    }

    private CommandSchedulerConfig(Clock clock, Duration claimLease, int numberOfRetriesOnException, RetryStrategy renumberRetryStrategy) {
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        requireNonNull(claimLease, "Claim lease cannot be null");
        requireNonNull(renumberRetryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        if (claimLease.isNegative() || claimLease.isZero()) {
            throw new IllegalArgumentException("Claim lease must be greater than zero");
        }
        if (numberOfRetriesOnException < 0) {
            throw new IllegalArgumentException("Number of retries on exception cannot be negative");
        }
        this.clock = clock;
        this.claimLease = claimLease;
        this.numberOfRetriesOnException = numberOfRetriesOnException;
        this.renumberRetryStrategy = renumberRetryStrategy;
    }

    public CommandSchedulerConfig withClock(Clock clock) {
        return new CommandSchedulerConfig(clock, claimLease, numberOfRetriesOnException, renumberRetryStrategy);
    }

    public CommandSchedulerConfig withClaimLease(Duration claimLease) {
        return new CommandSchedulerConfig(clock, claimLease, numberOfRetriesOnException, renumberRetryStrategy);
    }

    public CommandSchedulerConfig withNumberOfRetriesOnException(int numberOfRetriesOnException) {
        return new CommandSchedulerConfig(clock, claimLease, numberOfRetriesOnException, renumberRetryStrategy);
    }

    public CommandSchedulerConfig withRenumberRetryStrategy(RetryStrategy renumberRetryStrategy) {
        return new CommandSchedulerConfig(clock, claimLease, numberOfRetriesOnException, renumberRetryStrategy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommandSchedulerConfig)) return false;
        CommandSchedulerConfig that = (CommandSchedulerConfig) o;
        return numberOfRetriesOnException == that.numberOfRetriesOnException && clock.equals(that.clock) && claimLease.equals(that.claimLease)
                && renumberRetryStrategy.equals(that.renumberRetryStrategy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clock, claimLease, numberOfRetriesOnException, renumberRetryStrategy);
    }

    @Override
    public String toString() {
        return "CommandSchedulerConfig{" +
                "clock=" + clock +
                ", claimLease=" + claimLease +
                ", numberOfRetriesOnException=" + numberOfRetriesOnException +
                ", renumberRetryStrategy=" + renumberRetryStrategy +
                '}';
    }
}
