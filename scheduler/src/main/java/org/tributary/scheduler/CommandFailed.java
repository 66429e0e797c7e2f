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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * The failure of a delivery. Either cancel the command, which abandons it, or retry it after a delay.
 */
@NullMarked
public class CommandFailed {
    private final ScheduledCommand command;
    private final Throwable exception;
    private final int numberOfPreviousAttempts;
    private boolean canceled;
    private @Nullable Duration retryAfter;

    public CommandFailed(ScheduledCommand command, Throwable exception, int numberOfPreviousAttempts) {
        requireNonNull(command, ScheduledCommand.class.getSimpleName() + " cannot be null");
        requireNonNull(exception, "Exception cannot be null");
        this.command = command;
        this.exception = exception;
        this.numberOfPreviousAttempts = numberOfPreviousAttempts;
    }

    public ScheduledCommand command() {
        return command;
    }

    public Throwable exception() {
        return exception;
    }

    public int numberOfPreviousAttempts() {
        return numberOfPreviousAttempts;
    }

    public void cancel() {
        canceled = true;
        retryAfter = null;
    }

    public void retry(Duration after) {
        requireNonNull(after, "Retry delay cannot be null");
        if (after.isNegative()) {
            throw new IllegalArgumentException("Retry delay cannot be negative");
        }
        canceled = false;
        retryAfter = after;
    }

    public boolean isCanceled() {
        return canceled;
    }

    public @Nullable Duration retryAfter() {
        return retryAfter;
    }

    boolean isDecided() {
        return canceled || retryAfter != null;
    }

    @Override
    public String toString() {
        return "CommandFailed{command=" + command.key() + ", exception=" + exception + ", numberOfPreviousAttempts=" + numberOfPreviousAttempts
                + ", canceled=" + canceled + ", retryAfter=" + retryAfter + '}';
    }
}
