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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.util.Objects.requireNonNull;

/**
 * A {@link ReservationService} that keeps reservations in memory. Every change replaces the stored {@link ReservedValue} only if
 * it's still the one that was read.
 */
@NullMarked
public class InMemoryReservationService implements ReservationService {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReservationService.class);

    private final ConcurrentMap<Key, ReservedValue> reservedValues = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryReservationService() {
        this(Clock.systemUTC());
    }

    public InMemoryReservationService(Clock clock) {
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.clock = clock;
    }

    @Override
    public boolean reserve(String value, String scope, String ownerToken, Duration lease) {
        requireArguments(value, scope, ownerToken);
        requireNonNull(lease, "Lease cannot be null");
        Instant now = clock.instant();
        Instant expiration = now.plus(lease);
        Key key = new Key(value, scope);

        ReservedValue existing = reservedValues.get(key);
        if (existing == null) {
            return reservedValues.putIfAbsent(key, new ReservedValue(value, scope, ownerToken, value, expiration, 0)) == null;
        } else if (existing.isConfirmed()) {
            return existing.isOwnedBy(ownerToken);
        } else if (existing.isOwnedBy(ownerToken) || existing.ownerToken() == null || existing.isExpired(now)) {
            if (!existing.isOwnedBy(ownerToken) && existing.ownerToken() != null) {
                log.debug("Reservation of {} in {} expired at {}, taken over", value, scope, existing.expiration());
            }
            return reservedValues.replace(key, existing, existing.reservedBy(ownerToken, expiration));
        }
        return false;
    }

    @Override
    public boolean confirm(String confirmationToken, String scope, String ownerToken) {
        requireArguments(confirmationToken, scope, ownerToken);
        return reservedValues.entrySet().stream()
                .filter(entry -> entry.getValue().scope().equals(scope)
                        && entry.getValue().confirmationToken().equals(confirmationToken)
                        && entry.getValue().isOwnedBy(ownerToken))
                .findFirst()
                .map(entry -> reservedValues.replace(entry.getKey(), entry.getValue(), entry.getValue().confirmed()))
                .orElse(false);
    }

    @Override
    public boolean cancel(String value, String scope, String ownerToken) {
        requireArguments(value, scope, ownerToken);
        Key key = new Key(value, scope);
        ReservedValue existing = reservedValues.get(key);
        return existing != null && existing.isOwnedBy(ownerToken) && reservedValues.remove(key, existing);
    }

    @Override
    public Optional<String> reserveAny(String scope, String ownerToken, Duration lease, @Nullable String confirmationToken) {
        requireNonNull(scope, "Scope cannot be null");
        requireNonNull(ownerToken, "Owner token cannot be null");
        requireNonNull(lease, "Lease cannot be null");

        for (; ; ) {
            Instant now = clock.instant();
            ReservedValue candidate = confirmationToken == null ? null : heldBy(scope, ownerToken, confirmationToken);
            if (candidate == null) {
                candidate = firstAvailable(scope, now);
            }
            if (candidate == null) {
                return Optional.empty();
            }
            if (confirmationToken != null && !confirmationToken.equals(candidate.confirmationToken()) && isConfirmationTokenTaken(scope, confirmationToken)) {
                log.debug("Confirmation token {} is already used in {}", confirmationToken, scope);
                return Optional.empty();
            }

            ReservedValue reserved = candidate.reservedBy(ownerToken, now.plus(lease));
            if (confirmationToken != null && !confirmationToken.equals(candidate.confirmationToken())) {
                reserved = reserved.withConfirmationToken(confirmationToken);
            }
            if (reservedValues.replace(new Key(candidate.value(), scope), candidate, reserved)) {
                return Optional.of(candidate.value());
            }
            log.debug("{} in {} was reserved concurrently, trying another value", candidate.value(), scope);
        }
    }

    @Override
    public Optional<ReservedValue> reservedValue(String value, String scope) {
        requireNonNull(value, "Value cannot be null");
        requireNonNull(scope, "Scope cannot be null");
        return Optional.ofNullable(reservedValues.get(new Key(value, scope)));
    }

    @Override
    public void addToPool(String value, String scope) {
        requireNonNull(value, "Value cannot be null");
        requireNonNull(scope, "Scope cannot be null");
        reservedValues.putIfAbsent(new Key(value, scope), new ReservedValue(value, scope, null, value, Instant.EPOCH, 0));
    }

    private @Nullable ReservedValue heldBy(String scope, String ownerToken, String confirmationToken) {
        return reservedValues.values().stream()
                .filter(reserved -> reserved.scope().equals(scope)
                        && reserved.isOwnedBy(ownerToken)
                        && reserved.confirmationToken().equals(confirmationToken)
                        && !reserved.isConfirmed())
                .findFirst()
                .orElse(null);
    }

    private @Nullable ReservedValue firstAvailable(String scope, Instant now) {
        return reservedValues.values().stream()
                .filter(reserved -> reserved.scope().equals(scope) && reserved.isExpired(now))
                .min(Comparator.comparing(ReservedValue::value))
                .orElse(null);
    }

    private boolean isConfirmationTokenTaken(String scope, String confirmationToken) {
        return reservedValues.values().stream().anyMatch(reserved -> reserved.scope().equals(scope) && reserved.confirmationToken().equals(confirmationToken));
    }

    private static void requireArguments(String value, String scope, String ownerToken) {
        requireNonNull(value, "Value cannot be null");
        requireNonNull(scope, "Scope cannot be null");
        requireNonNull(ownerToken, "Owner token cannot be null");
    }

    private record Key(String value, String scope) {
    }
}
