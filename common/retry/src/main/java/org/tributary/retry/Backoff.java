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

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * The backoff to use between retry attempts.
 */
@NullMarked
public abstract class Backoff {

    private Backoff() {
    }

    public static Backoff none() {
        return None.INSTANCE;
    }

    public static Backoff fixed(Duration duration) {
        Objects.requireNonNull(duration, "Duration cannot be null");
        return new Fixed(duration.toMillis());
    }

    public static Backoff fixed(long millis) {
        return new Fixed(millis);
    }

    public static Backoff exponential(Duration initial, Duration max, double multiplier) {
        return new Exponential(initial, max, multiplier);
    }

    public static final class None extends Backoff {
        private static final None INSTANCE = new None();

        private None() {
        }

        @Override
        public String toString() {
            return None.class.getSimpleName();
        }
    }

    public static final class Fixed extends Backoff {
        public final long millis;

        private Fixed(long millis) {
            if (millis < 0) {
                throw new IllegalArgumentException("Millis cannot be less than zero");
            }
            this.millis = millis;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Fixed)) return false;
            Fixed fixed = (Fixed) o;
            return millis == fixed.millis;
        }

        @Override
        public int hashCode() {
            return Objects.hash(millis);
        }

        @Override
        public String toString() {
            return new StringJoiner(", ", Fixed.class.getSimpleName() + "[", "]")
                    .add("millis=" + millis)
                    .toString();
        }
    }

    public static final class Exponential extends Backoff {
        public final Duration initial;
        public final Duration max;
        public final double multiplier;

        private Exponential(Duration initial, Duration max, double multiplier) {
            Objects.requireNonNull(initial, "Initial duration cannot be null");
            Objects.requireNonNull(max, "Max duration cannot be null");
            if (multiplier <= 0) {
                throw new IllegalArgumentException("Multiplier must be greater than zero");
            }
            if (max.compareTo(initial) < 0) {
                throw new IllegalArgumentException("Max duration cannot be less than initial duration");
            }
            this.initial = initial;
            this.max = max;
            this.multiplier = multiplier;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Exponential)) return false;
            Exponential that = (Exponential) o;
            return Double.compare(that.multiplier, multiplier) == 0 && initial.equals(that.initial) && max.equals(that.max);
        }

        @Override
        public int hashCode() {
            return Objects.hash(initial, max, multiplier);
        }

        @Override
        public String toString() {
            return new StringJoiner(", ", Exponential.class.getSimpleName() + "[", "]")
                    .add("initial=" + initial)
                    .add("max=" + max)
                    .add("multiplier=" + multiplier)
                    .toString();
        }
    }
}
