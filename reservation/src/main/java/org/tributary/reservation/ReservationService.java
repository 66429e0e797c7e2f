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

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Optional;

/**
 * Reserves values that must be unique within a scope, such as user names or idempotency tokens.
 * <p>
 * A reservation is held by an owner token for the duration of its lease and becomes permanent when it's confirmed. A reservation
 * whose lease has expired can be taken over by another owner. Concurrent changes to the same value are resolved optimistically,
 * the loser is told that the value wasn't reserved.
 * </p>
 */
public interface ReservationService {
    Duration DEFAULT_LEASE = Duration.ofMinutes(1);

    /**
     * Reserve {@code value} in {@code scope} for {@link #DEFAULT_LEASE}.
     */
    default boolean reserve(String value, String scope, String ownerToken) {
        return reserve(value, scope, ownerToken, DEFAULT_LEASE);
    }

    /**
     * Reserve {@code value} in {@code scope}. Reserving a value the owner already holds extends the lease.
     *
     * @return {@code true} if the value is now reserved by, or confirmed for, {@code ownerToken}
     */
    boolean reserve(String value, String scope, String ownerToken, Duration lease);

    /**
     * Make the reservation permanent.
     *
     * @param confirmationToken The value, or the confirmation token given to {@link #reserveAny(String, String, Duration, String)}
     * @return {@code false} if {@code ownerToken} doesn't hold a reservation with the confirmation token
     */
    boolean confirm(String confirmationToken, String scope, String ownerToken);

    /**
     * Remove the reservation so that the value can be reserved by anyone.
     *
     * @return {@code false} if {@code ownerToken} doesn't hold {@code value}
     */
    boolean cancel(String value, String scope, String ownerToken);

    /**
     * Reserve any value of the pool of the scope whose reservation has expired, see {@link #addToPool(String, String)}. If the owner
     * already holds an unconfirmed reservation with the same confirmation token, that reservation is extended instead.
     *
     * @param confirmationToken A token to confirm the reservation with, unique within the scope. {@code null} means the value itself.
     * @return The reserved value or empty if no value is available
     */
    Optional<String> reserveAny(String scope, String ownerToken, Duration lease, @Nullable String confirmationToken);

    Optional<ReservedValue> reservedValue(String value, String scope);

    /**
     * Add a value that {@link #reserveAny(String, String, Duration, String)} may hand out. Adding a value that exists has no effect.
     */
    void addToPool(String value, String scope);
}
