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

package org.tributary.lock.inmemory;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.lock.LockGuard;
import org.tributary.lock.NamedMutex;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * A {@link NamedMutex} for a single JVM. Locks are held until they are released unless a lease time is configured,
 * in which case a holder that doesn't {@link LockGuard#refresh() refresh} its lease in time loses the lock to the next acquirer.
 */
public class InMemoryNamedMutex implements NamedMutex {
    private static final Logger log = LoggerFactory.getLogger(InMemoryNamedMutex.class);
    private static final long MAX_WAIT_BETWEEN_CHECKS_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final ReentrantLock monitor = new ReentrantLock();
    private final Condition released = monitor.newCondition();
    private final Map<String, Lease> leases = new HashMap<>();
    private final Map<String, Long> versions = new HashMap<>();
    private final Clock clock;
    private final @Nullable Duration leaseTime;

    /**
     * Create a mutex whose locks never expire.
     */
    public InMemoryNamedMutex() {
        this(Clock.systemUTC(), null);
    }

    /**
     * @param clock     The clock used to determine whether a lease has expired
     * @param leaseTime The lease time, {@code null} means that locks never expire
     */
    public InMemoryNamedMutex(Clock clock, @Nullable Duration leaseTime) {
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        if (leaseTime != null && (leaseTime.isNegative() || leaseTime.isZero())) {
            throw new IllegalArgumentException("Lease time must be greater than zero");
        }
        this.clock = clock;
        this.leaseTime = leaseTime;
    }

    @Override
    public Optional<LockGuard> tryAcquire(String name, Duration timeout) {
        requireNonNull(name, "Name cannot be null");
        requireNonNull(timeout, "Timeout cannot be null");
        long deadline = System.nanoTime() + timeout.toNanos();
        monitor.lock();
        try {
            for (; ; ) {
                Lease current = leases.get(name);
                if (current == null || current.isExpired(clock.instant())) {
                    if (current != null) {
                        log.warn("Lease of lock {} held by {} has expired, taking over", name, current.owner);
                    }
                    long version = versions.merge(name, 0L, (previous, __) -> previous + 1);
                    Lease lease = new Lease(UUID.randomUUID().toString(), version, expiresAt());
                    leases.put(name, lease);
                    log.debug("Acquired lock {} (fencingToken={})", name, version);
                    return Optional.of(new Guard(name, lease));
                }

                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.debug("Timed out waiting for lock {}", name);
                    return Optional.empty();
                }
                try {
                    released.awaitNanos(Math.min(remaining, MAX_WAIT_BETWEEN_CHECKS_NANOS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Optional.empty();
                }
            }
        } finally {
            monitor.unlock();
        }
    }

    /**
     * @return {@code true} if a lock with the given name is currently held (and not expired).
     */
    public boolean isLocked(String name) {
        monitor.lock();
        try {
            Lease lease = leases.get(name);
            return lease != null && !lease.isExpired(clock.instant());
        } finally {
            monitor.unlock();
        }
    }

    private @Nullable Instant expiresAt() {
        return leaseTime == null ? null : clock.instant().plus(leaseTime);
    }

    private static class Lease {
        private final String owner;
        private final long version;
        private @Nullable Instant expiresAt;

        private Lease(String owner, long version, @Nullable Instant expiresAt) {
            this.owner = owner;
            this.version = version;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    private class Guard implements LockGuard {
        private final String name;
        private final Lease lease;
        private volatile boolean isReleased;

        private Guard(String name, Lease lease) {
            this.name = name;
            this.lease = lease;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public long fencingToken() {
            return lease.version;
        }

        @Override
        public boolean refresh() {
            monitor.lock();
            try {
                if (isReleased || leases.get(name) != lease) {
                    return false;
                }
                lease.expiresAt = expiresAt();
                return true;
            } finally {
                monitor.unlock();
            }
        }

        @Override
        public boolean isReleased() {
            return isReleased;
        }

        @Override
        public boolean isHeld() {
            monitor.lock();
            try {
                return !isReleased && leases.get(name) == lease && !lease.isExpired(clock.instant());
            } finally {
                monitor.unlock();
            }
        }

        @Override
        public void release() {
            monitor.lock();
            try {
                if (isReleased) {
                    return;
                }
                isReleased = true;
                if (leases.get(name) == lease) {
                    leases.remove(name);
                    log.debug("Released lock {} (fencingToken={})", name, lease.version);
                }
                released.signalAll();
            } finally {
                monitor.unlock();
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Guard)) return false;
            Guard guard = (Guard) o;
            return Objects.equals(name, guard.name) && lease == guard.lease;
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, lease.owner);
        }

        @Override
        public String toString() {
            return "InMemoryLockGuard{name='" + name + "', fencingToken=" + lease.version + ", released=" + isReleased + '}';
        }
    }
}
