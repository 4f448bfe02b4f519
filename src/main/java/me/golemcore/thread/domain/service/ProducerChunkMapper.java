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

import me.golemcore.thread.domain.model.ChunkType;
import me.golemcore.thread.domain.model.StreamEventType;
import me.golemcore.thread.domain.model.ThreadStreamEvent;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps producer-specific chunk vocabularies onto the canonical
 * {@link ChunkType} taxonomy.
 *
 * <p>
 * The producer type is lower-cased and its separators ({@code - . space})
 * normalized to {@code _}. The result then runs through an ordered cascade of
 * equality and substring rules in which specific rules precede generic ones,
 * so {@code reasoning_delta} is matched before any text delta rule. Anything
 * unrecognized maps to {@link ChunkType#UNKNOWN}; mapping never fails.
 */
public final class ProducerChunkMapper {

    public static final String UNKNOWN_PRODUCER_TYPE = "unknown";

    private static final List<String> NORMALIZED_FIELDS = List.of(
            "id", "text", "delta", "state", "toolName", "toolCallId",
            "finishReason", "url", "title", "name", "mimeType");

    private ProducerChunkMapper() {
    }

    public static ChunkType mapProducerChunkType(String producerChunkType) {
        if (producerChunkType == null || producerChunkType.isBlank()) {
            return ChunkType.UNKNOWN;
        }
        String type = producerChunkType.trim().toLowerCase(Locale.ROOT).replaceAll("[-. ]", "_");

        if (type.contains("start_step")) {
            return ChunkType.START_STEP;
        }
        if ("start".equals(type) || "stream_start".equals(type)) {
            return ChunkType.START;
        }
        if (type.contains("finish_step")) {
            return ChunkType.FINISH_STEP;
        }
        if ("finish".equals(type)) {
            return ChunkType.FINISH;
        }

        if (type.contains("reasoning")) {
            ChunkType reasoning = mapReasoning(type);
            if (reasoning != null) {
                return reasoning;
            }
        }

        if (type.contains("tool") || type.contains("action") || type.contains("function_call")) {
            ChunkType action = mapAction(type);
            if (action != null) {
                return action;
            }
        }

        if (type.contains("message_metadata")) {
            return ChunkType.MESSAGE_METADATA;
        }
        if (type.contains("response_metadata")) {
            return ChunkType.RESPONSE_METADATA;
        }

        if (type.contains("text_start")) {
            return ChunkType.TEXT_START;
        }
        if (type.contains("text_delta") || (type.contains("message") && type.contains("delta"))) {
            return ChunkType.TEXT_DELTA;
        }
        if (type.contains("text_end") || type.contains("text_done")) {
            return ChunkType.TEXT_END;
        }

        if (type.contains("source_url")) {
            return ChunkType.SOURCE_URL;
        }
        if (type.contains("source_document")) {
            return ChunkType.SOURCE_DOCUMENT;
        }
        if ("file".equals(type) || type.startsWith("file_")) {
            return ChunkType.FILE;
        }
        if (type.contains("error")) {
            return ChunkType.ERROR;
        }
        return ChunkType.UNKNOWN;
    }

    private static ChunkType mapReasoning(String type) {
        if (type.contains("start")) {
            return ChunkType.REASONING_START;
        }
        if (type.contains("delta")) {
            return ChunkType.REASONING_DELTA;
        }
        if (type.contains("end") || type.contains("done")) {
            return ChunkType.REASONING_END;
        }
        return null;
    }

    private static ChunkType mapAction(String type) {
        if (type.contains("input_start") || type.contains("call_start")) {
            return ChunkType.ACTION_INPUT_START;
        }
        if (type.contains("input_delta") || type.contains("call_delta") || type.contains("arguments_delta")) {
            return ChunkType.ACTION_INPUT_DELTA;
        }
        if (type.contains("input_available") || type.contains("input_end") || type.contains("call_end")
                || type.endsWith("_call") || type.contains("arguments_done")) {
            return ChunkType.ACTION_INPUT_AVAILABLE;
        }
        if (type.contains("output_available")) {
            return ChunkType.ACTION_OUTPUT_AVAILABLE;
        }
        if (type.contains("output_error")) {
            return ChunkType.ACTION_OUTPUT_ERROR;
        }
        return null;
    }

    /**
     * Builds the {@code chunk.emitted} event for a raw producer chunk.
     *
     * @param chunk
     *            producer chunk; its {@code type} selects the canonical type
     * @param origin
     *            ids of the turn the chunk belongs to
     * @param sequence
     *            per-context sequence assigned by the caller
     */
    public static ThreadStreamEvent toChunkEvent(Map<String, Object> chunk, ChunkOrigin origin, long sequence,
            Instant at, int maxRawStringChars) {
        Map<String, Object> source = chunk != null ? chunk : Map.of();
        String producerType = readString(source, "type");
        if (producerType == null) {
            producerType = UNKNOWN_PRODUCER_TYPE;
        }
        ChunkType chunkType = mapProducerChunkType(producerType);

        String actionRef = null;
        if (chunkType.isAction()) {
            actionRef = readString(source, "toolCallId");
            if (actionRef == null) {
                actionRef = readString(source, "id");
            }
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> raw = (Map<String, Object>) PayloadSanitizer.sanitize(source, maxRawStringChars);

        return ThreadStreamEvent.builder()
                .type(StreamEventType.CHUNK_EMITTED)
                .at(at.toString())
                .chunkType(chunkType)
                .contextId(origin.contextId())
                .executionId(origin.executionId())
                .stepId(origin.stepId())
                .itemId(origin.itemId())
                .actionRef(actionRef)
                .provider(origin.provider())
                .providerChunkType(producerType)
                .sequence(sequence)
                .data(normalizedData(source, maxRawStringChars))
                .raw(raw)
                .build();
    }

    private static Map<String, Object> normalizedData(Map<String, Object> chunk, int maxRawStringChars) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (String field : NORMALIZED_FIELDS) {
            Object value = chunk.get(field);
            if (value != null) {
                normalized.put(field, PayloadSanitizer.sanitize(value, maxRawStringChars));
            }
        }
        return normalized;
    }

    private static String readString(Map<String, Object> chunk, String key) {
        return chunk.get(key) instanceof String value && !value.isEmpty() ? value : null;
    }

    /**
     * Ids stamped on every chunk event of one reactor invocation.
     */
    public record ChunkOrigin(String contextId, String executionId, String stepId, String itemId,
            String provider) {
    }
}
