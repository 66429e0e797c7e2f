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

/**
 * The reader backing a stream returned from {@link EventStoreQueries#eventsFrom(long, EventFilter, int)} was closed
 * before the stream was fully consumed. This is a transient fault, re-issuing the query is expected to succeed.
 */
public class EventReaderClosedException extends RuntimeException {

    public EventReaderClosedException(String message) {
        super(message);
    }

    public EventReaderClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
