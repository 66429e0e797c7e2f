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

package org.tributary.reservation;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * A value reserved within a scope.
 *
 * @param ownerToken        The owner of the reservation, {@code null} for a pooled value nobody has reserved yet
 * @param confirmationToken The token {@link ReservationService#confirm(String, String, String)} is called with, the value itself unless
 *                          {@link ReservationService#reserveAny(String, String, java.time.Duration, String)} was given one
 * @param expiration        When the reservation lapses, {@code null} once it's confirmed
 * @param version           Incremented on every change
 */
@NullMarked
public record ReservedValue(String value, String scope, @Nullable String ownerToken, String confirmationToken, @Nullable Instant expiration,
                            long version) {

    public ReservedValue {
        requireNonNull(value, "Value cannot be null");
        requireNonNull(scope, "Scope cannot be null");
        requireNonNull(confirmationToken, "Confirmation token cannot be null");
    }

    public boolean isConfirmed() {
        return expiration == null;
    }

    public boolean isExpired(Instant now) {
        return expiration != null && expiration.isBefore(now);
    }

    public boolean isOwnedBy(String ownerToken) {
        return ownerToken.equals(this.ownerToken);
    }

    ReservedValue reservedBy(String ownerToken, Instant expiration) {
        return new ReservedValue(value, scope, ownerToken, confirmationToken, expiration, version + 1);
    }

    ReservedValue withConfirmationToken(String confirmationToken) {
        return new ReservedValue(value, scope, ownerToken, confirmationToken, expiration, version + 1);
    }

    ReservedValue confirmed() {
        return new ReservedValue(value, scope, ownerToken, confirmationToken, null, version + 1);
    }
}
