package me.golemcore.thread.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the bounded preview that accompanies {@code part.created} events.
 * Previews never carry a full payload.
 */
public final class PartPreviewSupport {

    public static final int DEFAULT_PREVIEW_CHARS = 240;
    private static final String ELLIPSIS = "...";
    private static final String TOOL_PART_PREFIX = "tool-";

    private PartPreviewSupport() {
    }

    public static String clip(String value, int maxChars) {
        if (value == null || value.length() <= maxChars) {
            return value;
        }
        return value.substring(0, maxChars) + ELLIPSIS;
    }

    public static PartPreview summarize(Map<String, Object> part, int maxChars, ObjectMapper objectMapper) {
        if (part == null) {
            return new PartPreview(null, null, null);
        }
        String type = part.get("type") instanceof String value ? value : "";
        String state = part.get("state") instanceof String value ? value : null;
        String toolCallId = part.get("toolCallId") instanceof String value
                ? value
                : part.get("id") instanceof String id ? id : null;

        if (part.get("text") instanceof String text && !text.isBlank()) {
            return new PartPreview(clip(text, maxChars), state, toolCallId);
        }

        if (type.startsWith(TOOL_PART_PREFIX)) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("tool", type);
            payload.put("state", state);
            payload.put("input", part.get("input"));
            payload.put("output", part.get("output"));
            payload.put("errorText", part.get("errorText"));
            return new PartPreview(clip(toJson(PayloadSanitizer.sanitize(payload), objectMapper), maxChars),
                    state, toolCallId);
        }

        return new PartPreview(null, state, toolCallId);
    }

    private static String toJson(Object value, ObjectMapper objectMapper) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    /**
     * Preview text plus the state and tool call id of a part, each possibly null.
     */
    public record PartPreview(String preview, String state, String toolCallId) {
    }
}
