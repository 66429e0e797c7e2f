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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.tributary.retry.Backoff;
import org.tributary.retry.ErrorInfo;
import org.tributary.retry.MaxAttempts;
import org.tributary.retry.RetryStrategy;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

import static org.tributary.retry.MaxAttempts.Infinite.infinite;

/**
 * A retry strategy that does retry. By default, the following settings are used:
 *
 * <ul>
 *     <li>No backoff</li>
 *     <li>Infinite number of retries</li>
 *     <li>Retries all exceptions</li>
 * </ul>
 */
@NullMarked
public final class RetryImpl implements RetryStrategy.Retry {
    private static final BiConsumer<ErrorInfo, Throwable> NOOP_ERROR_LISTENER = (__, ___) -> {
    };
    private static final Consumer<Throwable> NOOP_RETRYABLE_ERROR_LISTENER = __ -> {
    };

    final Backoff backoff;
    final MaxAttempts maxAttempts;
    final Predicate<Throwable> retryPredicate;
    final Function<Throwable, Throwable> errorMapper;
    final BiConsumer<ErrorInfo, Throwable> errorListener;
    final Consumer<Throwable> retryableErrorListener;

    private RetryImpl(Backoff backoff, MaxAttempts maxAttempts, Predicate<Throwable> retryPredicate, Function<Throwable, Throwable> errorMapper,
                      @Nullable BiConsumer<ErrorInfo, Throwable> errorListener, @Nullable Consumer<Throwable> retryableErrorListener) {
        Objects.requireNonNull(backoff, Backoff.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(maxAttempts, MaxAttempts.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(retryPredicate, "Retry predicate cannot be null");
        Objects.requireNonNull(errorMapper, "Error mapper cannot be null");
        this.backoff = backoff;
        this.maxAttempts = maxAttempts;
        this.retryPredicate = retryPredicate;
        this.errorMapper = errorMapper;
        this.errorListener = errorListener == null ? NOOP_ERROR_LISTENER : errorListener;
        this.retryableErrorListener = retryableErrorListener == null ? NOOP_RETRYABLE_ERROR_LISTENER : retryableErrorListener;
    }

    public RetryImpl() {
        this(Backoff.none(), infinite(), __ -> true, Function.identity(), NOOP_ERROR_LISTENER, NOOP_RETRYABLE_ERROR_LISTENER);
    }

    @Override
    public Retry backoff(Backoff backoff) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorMapper, errorListener, retryableErrorListener);
    }

    @Override
    public Retry infiniteAttempts() {
        return new RetryImpl(backoff, infinite(), retryPredicate, errorMapper, errorListener, retryableErrorListener);
    }

    @Override
    public Retry maxAttempts(int maxAttempts) {
        return new RetryImpl(backoff, new MaxAttempts.Limit(maxAttempts), retryPredicate, errorMapper, errorListener, retryableErrorListener);
    }

    @Override
    public Retry retryIf(Predicate<Throwable> retryPredicate) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorMapper, errorListener, retryableErrorListener);
    }

    @Override
    public Retry mapError(Function<Throwable, Throwable> errorMapper) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorMapper, errorListener, retryableErrorListener);
    }

    @Override
    public Retry onError(BiConsumer<ErrorInfo, Throwable> errorListener) {
        Objects.requireNonNull(errorListener, "Error listener cannot be null");
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorMapper, this.errorListener.andThen(errorListener), retryableErrorListener);
    }

    @Override
    public Retry onRetryableError(Consumer<Throwable> retryableErrorListener) {
        Objects.requireNonNull(retryableErrorListener, "Retryable error listener cannot be null");
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorMapper, errorListener, this.retryableErrorListener.andThen(retryableErrorListener));
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RetryImpl.class.getSimpleName() + "[", "]")
                .add("backoff=" + backoff)
                .add("maxAttempts=" + maxAttempts)
                .toString();
    }
}
