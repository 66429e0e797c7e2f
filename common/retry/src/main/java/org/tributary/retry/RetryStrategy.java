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

import org.jspecify.annotations.NullMarked;
import org.tributary.retry.internal.RetryImpl;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.tributary.retry.internal.RetryExecution.executeWithRetry;

/**
 * Retry strategy to use when an infrastructure operation (acquiring a lock, re-opening an event reader, saving a scheduled command) throws.
 * <p>
 * A {@code RetryStrategy} is immutable, every configuration method returns a new instance:
 * <pre>
 * RetryStrategy retryStrategy = RetryStrategy.fixed(200).maxAttempts(5);
 * retryStrategy.execute(() -> lockService.refresh());
 * </pre>
 */
@NullMarked
public interface RetryStrategy {

    /**
     * @return A retry strategy that retries all exceptions, forever, without backoff. Use the {@link Retry} methods to narrow it down.
     */
    static Retry retry() {
        return new RetryImpl();
    }

    /**
     * @return A retry strategy that never retries, the exception is rethrown immediately.
     */
    static DontRetry none() {
        return DontRetry.INSTANCE;
    }

    static Retry exponentialBackoff(Duration initial, Duration max, double multiplier) {
        return RetryStrategy.retry().backoff(Backoff.exponential(initial, max, multiplier));
    }

    static Retry fixed(Duration duration) {
        return RetryStrategy.retry().backoff(Backoff.fixed(duration));
    }

    static Retry fixed(long millis) {
        return RetryStrategy.retry().backoff(Backoff.fixed(millis));
    }

    /**
     * Execute a function that receives the {@link RetryInfo} of the current attempt.
     * Rethrows the last exception if the retry strategy is exhausted.
     */
    default <T> T execute(Function<RetryInfo, T> function) {
        Objects.requireNonNull(function, Function.class.getSimpleName() + " cannot be null");
        return executeWithRetry(function, this).apply(null);
    }

    /**
     * Execute a {@link Supplier} with the configured retry settings.
     * Rethrows the last exception if the retry strategy is exhausted.
     */
    default <T> T execute(Supplier<T> supplier) {
        Objects.requireNonNull(supplier, Supplier.class.getSimpleName() + " cannot be null");
        return executeWithRetry((Function<RetryInfo, T>) __ -> supplier.get(), this).apply(null);
    }

    /**
     * Execute a {@link Runnable} with the configured retry settings.
     * Rethrows the last exception if the retry strategy is exhausted.
     */
    default void execute(Runnable runnable) {
        Objects.requireNonNull(runnable, Runnable.class.getSimpleName() + " cannot be null");
        executeWithRetry((Function<RetryInfo, Void>) __ -> {
            runnable.run();
            return null;
        }, this).apply(null);
    }

    /**
     * A retry strategy that doesn't retry at all. Just rethrows the exception.
     */
    final class DontRetry implements RetryStrategy {
        private static final DontRetry INSTANCE = new DontRetry();

        private DontRetry() {
        }

        @Override
        public String toString() {
            return DontRetry.class.getSimpleName();
        }
    }

    interface Retry extends RetryStrategy {
        /**
         * @return A new instance of {@link Retry} with the given backoff
         */
        Retry backoff(Backoff backoff);

        /**
         * Retry an infinite number of times (this is default).
         */
        Retry infiniteAttempts();

        /**
         * @param maxAttempts The max number of times the operation is invoked before giving up, including the first attempt.
         */
        Retry maxAttempts(int maxAttempts);

        /**
         * Only retry if the specified predicate is {@code true}. Will override previous retry predicate.
         */
        Retry retryIf(Predicate<Throwable> retryPredicate);

        /**
         * Maps the exception that is rethrown when the retry strategy gives up.
         */
        Retry mapError(Function<Throwable, Throwable> errorMapper);

        /**
         * Add a listener that is invoked for every error, retryable or not.
         */
        Retry onError(BiConsumer<ErrorInfo, Throwable> errorListener);

        /**
         * Add a listener that is invoked only for errors that will be retried.
         */
        Retry onRetryableError(Consumer<Throwable> retryableErrorListener);
    }
}
