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

package org.tributary.eventstore.api;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Thrown when a write is rejected because another writer got there first, for example when two events are appended with the same
 * aggregate sequence number or when a row was updated since it was read. This is effectively an optimistic locking exception
 * and a retry is typically appropriate.
 */
public class ConcurrencyException extends RuntimeException {
    public final String conflictingKey;

    public ConcurrencyException(String conflictingKey, String message) {
        super(message);
        this.conflictingKey = conflictingKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConcurrencyException)) return false;
        ConcurrencyException that = (ConcurrencyException) o;
        return Objects.equals(conflictingKey, that.conflictingKey) && Objects.equals(getMessage(), that.getMessage());
    }

    @Override
    public int hashCode() {
        return Objects.hash(conflictingKey, getMessage());
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ConcurrencyException.class.getSimpleName() + "[", "]")
                .add("conflictingKey='" + conflictingKey + "'")
                .add("message=" + super.getMessage())
                .toString();
    }
}
