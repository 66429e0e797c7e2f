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

import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import org.bson.BsonDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.lock.LockGuard;
import org.tributary.lock.NamedMutex;
import org.tributary.lock.mongodb.internal.MongoLockDocuments;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * A {@link NamedMutex} backed by a MongoDB collection. Each lock is a lease that the holder refreshes in the background
 * every {@code leaseTime / 2}. If the holder dies its lease expires and a competitor can take over the lock.
 */
public class MongoNamedMutex implements NamedMutex, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MongoNamedMutex.class);

    private final MongoCollection<BsonDocument> collection;
    private final MongoNamedMutexConfig config;
    private final ScheduledExecutorService refreshExecutor;

    public MongoNamedMutex(MongoDatabase database) {
        this(database, new MongoNamedMutexConfig());
    }

    public MongoNamedMutex(MongoDatabase database, MongoNamedMutexConfig config) {
        requireNonNull(database, MongoDatabase.class.getSimpleName() + " cannot be null");
        requireNonNull(config, MongoNamedMutexConfig.class.getSimpleName() + " cannot be null");
        this.collection = database.getCollection(config.collectionName, BsonDocument.class);
        this.config = config;
        this.refreshExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "tributary-lock-refresh");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public Optional<LockGuard> tryAcquire(String name, Duration timeout) {
        requireNonNull(name, "Name cannot be null");
        requireNonNull(timeout, "Timeout cannot be null");
        String owner = UUID.randomUUID().toString();
        long deadline = System.nanoTime() + timeout.toNanos();
        for (; ; ) {
            Instant attemptedAt = config.clock.instant();
            OptionalLong version = MongoLockDocuments.acquireOrRefresh(collection, config.clock, config.retryStrategy, config.leaseTime, name, owner);
            if (version.isPresent()) {
                log.debug("Acquired lock {} (fencingToken={})", name, version.getAsLong());
                return Optional.of(new MongoLockGuard(name, owner, version.getAsLong(), attemptedAt));
            }
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis <= 0) {
                return Optional.empty();
            }
            try {
                Thread.sleep(Math.min(remainingMillis, config.pollInterval.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    /**
     * Stops refreshing the leases of held locks. Locks that are not released expire after the lease time.
     */
    @Override
    public void close() {
        refreshExecutor.shutdown();
        try {
            if (!refreshExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                refreshExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            refreshExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private class MongoLockGuard implements LockGuard {
        private final String name;
        private final String owner;
        private final long version;
        private final AtomicBoolean released = new AtomicBoolean(false);
        private final AtomicBoolean lost = new AtomicBoolean(false);
        private final ScheduledFuture<?> scheduledRefresh;
        private volatile Instant heldUntil;

        private MongoLockGuard(String name, String owner, long version, Instant acquiredAt) {
            this.name = name;
            this.owner = owner;
            this.version = version;
            this.heldUntil = acquiredAt.plus(config.leaseTime);
            long period = Math.max(1, config.leaseTime.dividedBy(2).toMillis());
            this.scheduledRefresh = refreshExecutor.scheduleAtFixedRate(this::refreshInBackground, period, period, TimeUnit.MILLISECONDS);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public long fencingToken() {
            return version;
        }

        @Override
        public boolean refresh() {
            if (released.get() || lost.get()) {
                return false;
            }
            Instant attemptedAt = config.clock.instant();
            if (MongoLockDocuments.refresh(collection, config.clock, config.retryStrategy, config.leaseTime, name, owner)) {
                heldUntil = attemptedAt.plus(config.leaseTime);
                return true;
            }
            lost.set(true);
            return false;
        }

        @Override
        public boolean isReleased() {
            return released.get();
        }

        /**
         * The lease is counted from the start of the last successful refresh.
         */
        @Override
        public boolean isHeld() {
            return !released.get() && !lost.get() && config.clock.instant().isBefore(heldUntil);
        }

        @Override
        public void release() {
            if (released.compareAndSet(false, true)) {
                scheduledRefresh.cancel(false);
                MongoLockDocuments.release(collection, config.retryStrategy, name, owner);
                log.debug("Released lock {} (fencingToken={})", name, version);
            }
        }

        private void refreshInBackground() {
            try {
                if (!refresh() && !released.get()) {
                    log.warn("Lost lock {} (fencingToken={}), stopping refresh", name, version);
                    scheduledRefresh.cancel(false);
                }
            } catch (Exception e) {
                log.error("Failed to refresh lock {} (fencingToken={})", name, version, e);
            }
        }

        @Override
        public String toString() {
            return "MongoLockGuard{name='" + name + "', fencingToken=" + version + ", released=" + released.get() + ", lost=" + lost.get() + '}';
        }
    }
}
