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

package org.tributary.catchup.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jspecify.annotations.Nullable;
import org.tributary.catchup.EventInterest;
import org.tributary.eventstore.api.StoredEvent;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * An {@link EventDeserializer} that maps {@code (streamName, type)} to a Java class and reads the JSON body with Jackson.
 * Registrations may use wildcards, an exact registration wins over a pattern.
 */
public class JacksonEventDeserializer implements EventDeserializer {
    private final ObjectMapper objectMapper;
    private final Map<EventInterest, Class<?>> exactTypes = new ConcurrentHashMap<>();
    private final Map<EventInterest, Class<?>> patternTypes = new LinkedHashMap<>();

    public JacksonEventDeserializer() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public JacksonEventDeserializer(ObjectMapper objectMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        this.objectMapper = objectMapper;
    }

    public JacksonEventDeserializer register(String streamName, String type, Class<?> eventClass) {
        requireNonNull(eventClass, "Event class cannot be null");
        EventInterest key = EventInterest.of(streamName, type);
        if (key.isPattern()) {
            synchronized (patternTypes) {
                patternTypes.put(key, eventClass);
            }
        } else {
            exactTypes.put(key, eventClass);
        }
        return this;
    }

    @Override
    public Object deserialize(StoredEvent event) {
        Class<?> eventClass = findClass(event);
        if (eventClass == null) {
            throw new EventDeserializationException(event.streamName(), event.type(),
                    "Deserialization: Event type '" + event.streamName() + "." + event.type() + "' not found");
        }
        try {
            return objectMapper.readValue(event.body(), eventClass);
        } catch (IOException e) {
            throw new EventDeserializationException(event.streamName(), event.type(),
                    "Deserialization: Could not read event " + event.id() + " of type '" + event.streamName() + "." + event.type() + "'", e);
        }
    }

    private @Nullable Class<?> findClass(StoredEvent event) {
        Class<?> exact = exactTypes.get(EventInterest.of(event.streamName(), event.type()));
        if (exact != null) {
            return exact;
        }
        synchronized (patternTypes) {
            return patternTypes.entrySet().stream()
                    .filter(entry -> entry.getKey().matches(event))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(null);
        }
    }
}
