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

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.tributary.lock.LockGuard;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
@Timeout(10)
class InMemoryNamedMutexTest {

    @Test
    void only_one_guard_can_hold_a_named_lock() {
        // Given
        InMemoryNamedMutex mutex = new InMemoryNamedMutex();
        Optional<LockGuard> first = mutex.tryAcquire("catchup", Duration.ZERO);

        // When
        Optional<LockGuard> second = mutex.tryAcquire("catchup", Duration.ofMillis(100));
        Optional<LockGuard> other = mutex.tryAcquire("other", Duration.ZERO);

        // Then
        assertAll(
                () -> assertThat(first).isPresent(),
                () -> assertThat(second).isEmpty(),
                () -> assertThat(other).isPresent()
        );
    }

    @Test
    void waiting_acquirer_takes_over_when_the_holder_releases() throws Exception {
        // Given
        InMemoryNamedMutex mutex = new InMemoryNamedMutex();
        LockGuard first = mutex.tryAcquire("catchup", Duration.ZERO).orElseThrow();
        CompletableFuture<Optional<LockGuard>> waiting = CompletableFuture.supplyAsync(() -> mutex.tryAcquire("catchup", Duration.ofSeconds(5)));

        // When
        Thread.sleep(100);
        first.close();

        // Then
        Optional<LockGuard> second = waiting.get(5, TimeUnit.SECONDS);
        assertAll(
                () -> assertThat(second).isPresent(),
                () -> assertThat(second.orElseThrow().fencingToken()).isGreaterThan(first.fencingToken()),
                () -> assertThat(first.isReleased()).isTrue(),
                () -> assertThat(first.refresh()).isFalse()
        );
    }

    @Test
    void release_is_idempotent_and_does_not_release_a_lock_taken_by_someone_else() {
        // Given
        InMemoryNamedMutex mutex = new InMemoryNamedMutex();
        LockGuard first = mutex.tryAcquire("catchup", Duration.ZERO).orElseThrow();
        first.release();
        LockGuard second = mutex.tryAcquire("catchup", Duration.ZERO).orElseThrow();

        // When
        first.release();

        // Then
        assertAll(
                () -> assertThat(mutex.isLocked("catchup")).isTrue(),
                () -> assertThat(second.refresh()).isTrue()
        );
    }

    @Test
    void expired_lease_is_taken_over_by_the_next_acquirer() {
        // Given
        MutableClock clock = new MutableClock(Instant.parse("2020-01-01T10:00:00Z"));
        InMemoryNamedMutex mutex = new InMemoryNamedMutex(clock, Duration.ofSeconds(10));
        LockGuard first = mutex.tryAcquire("catchup", Duration.ZERO).orElseThrow();

        // When
        clock.advance(Duration.ofSeconds(11));
        Optional<LockGuard> second = mutex.tryAcquire("catchup", Duration.ZERO);

        // Then
        assertAll(
                () -> assertThat(second).isPresent(),
                () -> assertThat(first.refresh()).isFalse()
        );
    }

    @Test
    void a_guard_is_not_held_once_its_lease_has_expired_or_it_has_been_released() {
        // Given
        MutableClock clock = new MutableClock(Instant.parse("2020-01-01T10:00:00Z"));
        InMemoryNamedMutex mutex = new InMemoryNamedMutex(clock, Duration.ofSeconds(10));
        LockGuard expiring = mutex.tryAcquire("expiring", Duration.ZERO).orElseThrow();
        LockGuard released = mutex.tryAcquire("released", Duration.ZERO).orElseThrow();
        boolean heldBeforeExpiry = expiring.isHeld();

        // When
        clock.advance(Duration.ofSeconds(10));
        released.release();

        // Then
        assertAll(
                () -> assertThat(heldBeforeExpiry).isTrue(),
                () -> assertThat(expiring.isHeld()).isFalse(),
                () -> assertThat(expiring.isReleased()).isFalse(),
                () -> assertThat(released.isHeld()).isFalse()
        );
    }

    @Test
    void refreshing_extends_the_lease() {
        // Given
        MutableClock clock = new MutableClock(Instant.parse("2020-01-01T10:00:00Z"));
        InMemoryNamedMutex mutex = new InMemoryNamedMutex(clock, Duration.ofSeconds(10));
        LockGuard first = mutex.tryAcquire("catchup", Duration.ZERO).orElseThrow();

        // When
        clock.advance(Duration.ofSeconds(8));
        boolean refreshed = first.refresh();
        clock.advance(Duration.ofSeconds(8));

        // Then
        assertAll(
                () -> assertThat(refreshed).isTrue(),
                () -> assertThat(mutex.tryAcquire("catchup", Duration.ZERO)).isEmpty()
        );
    }

    private static class MutableClock extends Clock {
        private volatile Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
