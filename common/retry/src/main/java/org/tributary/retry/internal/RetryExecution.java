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

package org.tributary.retry.internal;

import org.tributary.retry.Backoff;
import org.tributary.retry.ErrorInfo;
import org.tributary.retry.MaxAttempts;
import org.tributary.retry.RetryInfo;
import org.tributary.retry.RetryStrategy;
import org.tributary.retry.RetryStrategy.DontRetry;

import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Internal class for executing functions with retry capability. Never use this class directly from your own code!
 */
public class RetryExecution {

    public static <T> Function<RetryInfo, T> executeWithRetry(Function<RetryInfo, T> function, RetryStrategy retryStrategy) {
        if (retryStrategy instanceof DontRetry) {
            return function;
        }
        RetryImpl retry = (RetryImpl) retryStrategy;
        return ignored -> {
            Iterator<Long> delay = convertToDelayStream(retry.backoff);
            int currentAttempt = 1;
            Duration prevBackoff = Duration.ZERO;
            for (; ; ) {
                RetryInfoImpl retryInfo = new RetryInfoImpl(currentAttempt, maxAttemptsAsInt(retry.maxAttempts), prevBackoff);
                try {
                    return function.apply(retryInfo);
                } catch (Throwable e) {
                    boolean shouldRetryAgain = !isExhausted(currentAttempt, retry.maxAttempts) && retry.retryPredicate.test(e);
                    Duration nextBackoff = Duration.ofMillis(delay.next());
                    retry.errorListener.accept(new ErrorInfoImpl(retryInfo, shouldRetryAgain ? nextBackoff : null), e);
                    if (!shouldRetryAgain) {
                        return SafeExceptionRethrower.safeRethrow(retry.errorMapper.apply(e));
                    }
                    retry.retryableErrorListener.accept(e);

                    long backoffMillis = nextBackoff.toMillis();
                    if (backoffMillis > 0) {
                        try {
                            TimeUnit.MILLISECONDS.sleep(backoffMillis);
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            throw new RuntimeException(e);
                        }
                    }
                    currentAttempt++;
                    prevBackoff = nextBackoff;
                }
            }
        };
    }

    private static int maxAttemptsAsInt(MaxAttempts maxAttempts) {
        return maxAttempts instanceof MaxAttempts.Limit limit ? limit.limit() : Integer.MAX_VALUE;
    }

    private static boolean isExhausted(int attempt, MaxAttempts maxAttempts) {
        if (maxAttempts instanceof MaxAttempts.Infinite) {
            return false;
        }
        return attempt >= ((MaxAttempts.Limit) maxAttempts).limit();
    }

    private static Iterator<Long> convertToDelayStream(Backoff backoff) {
        final Stream<Long> delay;
        if (backoff instanceof Backoff.None) {
            delay = Stream.iterate(0L, __ -> 0L);
        } else if (backoff instanceof Backoff.Fixed fixed) {
            long millis = fixed.millis;
            delay = Stream.iterate(millis, __ -> millis);
        } else if (backoff instanceof Backoff.Exponential strategy) {
            long initialMillis = strategy.initial.toMillis();
            long maxMillis = strategy.max.toMillis();
            double multiplier = strategy.multiplier;
            delay = Stream.iterate(initialMillis, current -> Math.min(maxMillis, Math.round(current * multiplier)));
        } else {
            throw new IllegalStateException("Invalid backoff: " + backoff.getClass().getName());
        }
        return delay.iterator();
    }

    private record RetryInfoImpl(int attemptNumber, int maxAttempts, Duration backoff) implements RetryInfo {
        @Override
        public int getAttemptNumber() {
            return attemptNumber;
        }

        @Override
        public int getMaxAttempts() {
            return maxAttempts;
        }

        @Override
        public Duration getBackoff() {
            return backoff;
        }
    }

    private record ErrorInfoImpl(RetryInfo retryInfo, Duration backoffBeforeNextRetryAttempt) implements ErrorInfo {
        @Override
        public Optional<Duration> getBackoffBeforeNextRetryAttempt() {
            return Optional.ofNullable(backoffBeforeNextRetryAttempt);
        }

        @Override
        public boolean isRetryable() {
            return backoffBeforeNextRetryAttempt != null;
        }

        @Override
        public int getAttemptNumber() {
            return retryInfo.getAttemptNumber();
        }

        @Override
        public int getMaxAttempts() {
            return retryInfo.getMaxAttempts();
        }

        @Override
        public Duration getBackoff() {
            return retryInfo.getBackoff();
        }
    }
}
