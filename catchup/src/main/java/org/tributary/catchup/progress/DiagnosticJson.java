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

package org.tributary.catchup.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders exceptions as JSON for error records.
 */
public final class DiagnosticJson {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final int MAX_CAUSE_DEPTH = 5;

    private DiagnosticJson() {
    }

    public static String toJson(Throwable throwable) {
        try {
            return objectMapper.writeValueAsString(toNode(throwable, 0));
        } catch (JsonProcessingException e) {
            return "{\"type\":\"" + throwable.getClass().getName() + "\"}";
        }
    }

    private static ObjectNode toNode(Throwable throwable, int depth) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", throwable.getClass().getName());
        node.put("message", throwable.getMessage());
        StackTraceElement[] stackTrace = throwable.getStackTrace();
        if (stackTrace.length > 0) {
            node.put("at", stackTrace[0].toString());
        }
        Throwable cause = throwable.getCause();
        if (cause != null && cause != throwable && depth < MAX_CAUSE_DEPTH) {
            node.set("cause", toNode(cause, depth + 1));
        }
        return node;
    }
}
