package me.golemcore.thread.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A conversational message unit: the trigger of a turn or its single reaction.
 *
 * <p>
 * Content is an ordered list of parts. Each part is a JSON-shaped map with at
 * least a {@code type}; text parts carry {@code text}, action parts use
 * {@code tool-<name>} types with {@code toolCallId}, {@code state},
 * {@code input} and either {@code output} or {@code errorText}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ThreadItem {

    public static final String PART_TYPE = "type";
    public static final String PART_TEXT = "text";

    private String id;
    private ItemType type;
    private ItemChannel channel;
    private ItemStatus status;
    @Builder.Default
    private List<Map<String, Object>> parts = new ArrayList<>();
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private Instant createdAt;

    public static Map<String, Object> textPart(String text) {
        Map<String, Object> part = new LinkedHashMap<>();
        part.put(PART_TYPE, PART_TEXT);
        part.put(PART_TEXT, text);
        return part;
    }

    /**
     * Concatenated text of all text parts, or an empty string.
     */
    public String textContent() {
        StringBuilder builder = new StringBuilder();
        if (parts == null) {
            return "";
        }
        for (Map<String, Object> part : parts) {
            if (PART_TEXT.equals(part.get(PART_TYPE)) && part.get(PART_TEXT) instanceof String text) {
                if (builder.length() > 0) {
                    builder.append('\n');
                }
                builder.append(text);
            }
        }
        return builder.toString();
    }
}
