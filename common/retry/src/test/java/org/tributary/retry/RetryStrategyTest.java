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

package org.tributary.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.tributary.retry.RetryStrategy.Retry;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
@Timeout(10)
public class RetryStrategyTest {

    @Test
    void does_not_retry_when_retry_strategy_is_none() {
        // Given
        RetryStrategy retryStrategy = RetryStrategy.none();
        AtomicInteger counter = new AtomicInteger(0);

        // When
        Throwable throwable = catchThrowable(() -> retryStrategy.execute(() -> {
            if (counter.incrementAndGet() == 1) {
                throw new IllegalArgumentException("expected");
            }
        }));

        // Then
        assertAll(
                () -> assertThat(counter).hasValue(1),
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("expected")
        );
    }

    @Test
    void retries_until_the_supplier_succeeds() {
        // Given
        RetryStrategy retryStrategy = RetryStrategy.retry();
        AtomicInteger counter = new AtomicInteger(0);

        // When
        String result = retryStrategy.execute(() -> {
            if (counter.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
            return "done";
        });

        // Then
        assertAll(
                () -> assertThat(result).isEqualTo("done"),
                () -> assertThat(counter).hasValue(3)
        );
    }

    @Test
    void retry_info_describes_each_attempt() {
        // Given
        CopyOnWriteArrayList<RetryInfo> retryInfos = new CopyOnWriteArrayList<>();
        Retry retryStrategy = RetryStrategy.retry().maxAttempts(4);

        // When
        Throwable throwable = catchThrowable(() -> retryStrategy.execute(info -> {
            retryInfos.add(info);
            throw new IllegalArgumentException("expected");
        }));

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("expected"),
                () -> assertThat(retryInfos).extracting(RetryInfo::getAttemptNumber).containsExactly(1, 2, 3, 4),
                () -> assertThat(retryInfos).extracting(RetryInfo::getRetryCount).containsExactly(0, 1, 2, 3),
                () -> assertThat(retryInfos).extracting(RetryInfo::getMaxAttempts).containsOnly(4),
                () -> assertThat(retryInfos).extracting(RetryInfo::isFirstAttempt).containsExactly(true, false, false, false),
                () -> assertThat(retryInfos).extracting(RetryInfo::isLastAttempt).containsExactly(false, false, false, true)
        );
    }

    @Test
    void only_retries_exceptions_matching_the_retry_predicate() {
        // Given
        Retry retryStrategy = RetryStrategy.retry().retryIf(IllegalStateException.class::isInstance);
        AtomicInteger counter = new AtomicInteger(0);

        // When
        Throwable throwable = catchThrowable(() -> retryStrategy.execute(() -> {
            if (counter.incrementAndGet() == 1) {
                throw new IllegalStateException("retryable");
            }
            throw new IllegalArgumentException("fatal");
        }));

        // Then
        assertAll(
                () -> assertThat(counter).hasValue(2),
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("fatal")
        );
    }

    @Test
    void exponential_backoff_is_reported_to_the_error_listener_and_capped_at_max() {
        // Given
        CopyOnWriteArrayList<Duration> backoffs = new CopyOnWriteArrayList<>();
        Retry retryStrategy = RetryStrategy.exponentialBackoff(Duration.ofMillis(1), Duration.ofMillis(4), 2.0)
                .maxAttempts(5)
                .onError((info, throwable) -> info.getBackoffBeforeNextRetryAttempt().ifPresent(backoffs::add));

        // When
        catchThrowable(() -> retryStrategy.execute(() -> {
            throw new IllegalStateException("expected");
        }));

        // Then
        assertThat(backoffs).containsExactly(Duration.ofMillis(1), Duration.ofMillis(2), Duration.ofMillis(4), Duration.ofMillis(4));
    }

    @Nested
    @DisplayName("listeners and error mapping")
    class ListenersAndErrorMapping {

        @Test
        void retryable_error_listener_is_not_invoked_for_the_final_error() {
            // Given
            AtomicInteger retryableErrors = new AtomicInteger();
            Retry retryStrategy = RetryStrategy.fixed(Duration.ZERO).maxAttempts(3).onRetryableError(__ -> retryableErrors.incrementAndGet());

            // When
            catchThrowable(() -> retryStrategy.execute(() -> {
                throw new IllegalStateException("expected");
            }));

            // Then
            assertThat(retryableErrors).hasValue(2);
        }

        @Test
        void maps_the_error_that_is_rethrown_when_giving_up() {
            // Given
            Retry retryStrategy = RetryStrategy.retry().maxAttempts(2).mapError(e -> new UnsupportedOperationException(e.getMessage()));

            // When
            Throwable throwable = catchThrowable(() -> retryStrategy.execute(() -> {
                throw new IllegalStateException("expected");
            }));

            // Then
            assertThat(throwable).isExactlyInstanceOf(UnsupportedOperationException.class).hasMessage("expected");
        }

        @Test
        void max_attempts_must_be_positive() {
            // When
            Throwable throwable = catchThrowable(() -> RetryStrategy.retry().maxAttempts(0));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
        }
    }
}
