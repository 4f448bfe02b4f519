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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.thread.domain.model.ChunkType;
import me.golemcore.thread.domain.model.EntityKind;
import me.golemcore.thread.domain.model.StreamEventParseException;
import me.golemcore.thread.domain.model.StreamEventType;
import me.golemcore.thread.domain.model.ThreadStreamEvent;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses, validates and serializes thread stream events.
 *
 * <p>
 * Parsing dispatches on the required {@code type} against the closed
 * {@link StreamEventType} taxonomy and checks the per-type field schema. Every
 * violation raises a {@link StreamEventParseException} naming the field.
 * Timeline validation applies the {@link TransitionContract} to the status
 * carried by consecutive events of the same entity within one list.
 */
@Component
public class StreamEventCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private static final String TYPE = "type";
    private static final String AT = "at";
    private static final String CONTEXT_ID = "contextId";
    private static final String THREAD_ID = "threadId";
    private static final String EXECUTION_ID = "executionId";
    private static final String ITEM_ID = "itemId";
    private static final String STEP_ID = "stepId";
    private static final String STATUS = "status";
    private static final String ITERATION = "iteration";
    private static final String CHUNK_TYPE = "chunkType";

    private static final Map<StreamEventType, List<FieldRule>> SCHEMAS = new EnumMap<>(StreamEventType.class);

    static {
        List<FieldRule> contextWithStatus = List.of(
                required(CONTEXT_ID), required(THREAD_ID), required(STATUS));
        SCHEMAS.put(StreamEventType.CONTEXT_CREATED, contextWithStatus);
        SCHEMAS.put(StreamEventType.CONTEXT_RESOLVED, contextWithStatus);
        SCHEMAS.put(StreamEventType.CONTEXT_CLOSED, contextWithStatus);
        SCHEMAS.put(StreamEventType.CONTEXT_CONTENT_UPDATED, List.of(required(CONTEXT_ID), required(THREAD_ID)));

        List<FieldRule> thread = List.of(required(THREAD_ID), required(STATUS));
        SCHEMAS.put(StreamEventType.THREAD_CREATED, thread);
        SCHEMAS.put(StreamEventType.THREAD_RESOLVED, thread);
        SCHEMAS.put(StreamEventType.THREAD_STREAMING_STARTED, thread);
        SCHEMAS.put(StreamEventType.THREAD_IDLE, thread);

        List<FieldRule> execution = List.of(
                required(EXECUTION_ID), required(CONTEXT_ID), required(THREAD_ID), required(STATUS));
        SCHEMAS.put(StreamEventType.EXECUTION_CREATED, execution);
        SCHEMAS.put(StreamEventType.EXECUTION_COMPLETED, execution);
        SCHEMAS.put(StreamEventType.EXECUTION_FAILED, execution);

        SCHEMAS.put(StreamEventType.ITEM_CREATED, List.of(
                required(ITEM_ID), required(CONTEXT_ID), required(THREAD_ID), required(STATUS),
                optional(EXECUTION_ID), optional("itemType")));
        SCHEMAS.put(StreamEventType.ITEM_UPDATED, List.of(
                required(ITEM_ID), required(CONTEXT_ID), required(THREAD_ID),
                optional(EXECUTION_ID), optional(STATUS)));
        SCHEMAS.put(StreamEventType.ITEM_COMPLETED, List.of(
                required(ITEM_ID), required(CONTEXT_ID), required(THREAD_ID),
                optional(EXECUTION_ID), required(STATUS)));

        SCHEMAS.put(StreamEventType.STEP_CREATED, List.of(
                required(STEP_ID), required(EXECUTION_ID), requiredNumber(ITERATION), required(STATUS)));
        SCHEMAS.put(StreamEventType.STEP_UPDATED, List.of(
                required(STEP_ID), required(EXECUTION_ID), optionalNumber(ITERATION),
                optional(STATUS), optional("kind"), optional("actionName")));
        SCHEMAS.put(StreamEventType.STEP_COMPLETED, List.of(
                required(STEP_ID), required(EXECUTION_ID), optionalNumber(ITERATION), required(STATUS)));
        SCHEMAS.put(StreamEventType.STEP_FAILED, List.of(
                required(STEP_ID), required(EXECUTION_ID), optionalNumber(ITERATION), required(STATUS),
                optional("errorText")));

        List<FieldRule> part = List.of(
                required("partKey"), required(STEP_ID), requiredNumber("idx"),
                optional("partType"), optional("partPreview"), optional("partState"),
                optional("partToolCallId"));
        SCHEMAS.put(StreamEventType.PART_CREATED, part);
        SCHEMAS.put(StreamEventType.PART_UPDATED, part);

        SCHEMAS.put(StreamEventType.CHUNK_EMITTED, List.of(
                required(CHUNK_TYPE), required(CONTEXT_ID), optional(EXECUTION_ID), optional(STEP_ID),
                optional(ITEM_ID), optional("partKey"), optional("actionRef"), optional("provider"),
                optional("providerChunkType"), optionalNumber("sequence")));
    }

    private final ObjectMapper objectMapper;

    public StreamEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    // ==================== parsing ====================

    public ThreadStreamEvent parseEvent(String json) {
        Map<String, Object> record;
        try {
            record = objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            throw new StreamEventParseException("thread stream event",
                    "Invalid thread stream event: expected object.");
        }
        return parseEvent(record);
    }

    public ThreadStreamEvent parseEvent(Map<String, ?> record) {
        if (record == null) {
            throw new StreamEventParseException("thread stream event",
                    "Invalid thread stream event: expected object.");
        }
        String typeValue = requireString(record.get(TYPE), "thread stream event.type");
        requireString(record.get(AT), "thread stream event.at");

        StreamEventType type = StreamEventType.find(typeValue)
                .orElseThrow(() -> new StreamEventParseException(TYPE,
                        "Unsupported thread stream event type: " + typeValue));

        for (FieldRule rule : SCHEMAS.get(type)) {
            rule.check(type, record);
        }
        if (type == StreamEventType.CHUNK_EMITTED) {
            String chunkType = (String) record.get(CHUNK_TYPE);
            if (!ChunkType.isCanonical(chunkType)) {
                throw new StreamEventParseException(type + "." + CHUNK_TYPE,
                        "Invalid " + type + "." + CHUNK_TYPE + ": " + chunkType);
            }
        }
        return objectMapper.convertValue(record, ThreadStreamEvent.class);
    }

    // ==================== serialization ====================

    public Map<String, Object> serialize(ThreadStreamEvent event) {
        return objectMapper.convertValue(event, MAP_TYPE_REF);
    }

    public String toJson(ThreadStreamEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stream event " + event.getType(), e);
        }
    }

    // ==================== timeline ====================

    /**
     * Checks every status-bearing event against the transition table of its
     * entity, in list order. Entity state is tracked only within {@code events}.
     *
     * @throws me.golemcore.thread.domain.model.InvalidTransitionException
     *             on the first illegal transition
     */
    public void validateTimeline(List<ThreadStreamEvent> events) {
        Map<String, String> lastStatus = new HashMap<>();
        for (ThreadStreamEvent event : events) {
            if (event.getType() == null || event.getStatus() == null) {
                continue;
            }
            EntityKind kind = event.getType().getEntityKind().orElse(null);
            String entityId = kind != null ? entityId(kind, event) : null;
            if (entityId == null) {
                continue;
            }
            String key = kind.getLabel() + ":" + entityId;
            String previous = lastStatus.get(key);
            if (previous != null && !event.getType().establishesStatus() && !previous.equals(event.getStatus())) {
                TransitionContract.assertTransition(kind, previous, event.getStatus());
            }
            lastStatus.put(key, event.getStatus());
        }
    }

    /**
     * Verifies that chunk sequences advance by exactly one per context with no
     * gaps or repeats.
     */
    public static void assertContiguousSequences(List<ThreadStreamEvent> events) {
        Map<String, Long> lastSequence = new LinkedHashMap<>();
        for (ThreadStreamEvent event : events) {
            if (event.getType() != StreamEventType.CHUNK_EMITTED) {
                continue;
            }
            Long sequence = event.getSequence();
            if (sequence == null || sequence < 1) {
                throw new IllegalStateException("Chunk without a valid sequence on context "
                        + event.getContextId() + ": " + sequence);
            }
            Long previous = lastSequence.get(event.getContextId());
            if (previous != null && sequence != previous + 1) {
                throw new IllegalStateException("Chunk sequence gap on context " + event.getContextId()
                        + ": expected " + (previous + 1) + " got " + sequence);
            }
            lastSequence.put(event.getContextId(), sequence);
        }
    }

    private static String entityId(EntityKind kind, ThreadStreamEvent event) {
        return switch (kind) {
        case THREAD -> event.getThreadId();
        case CONTEXT -> event.getContextId();
        case EXECUTION -> event.getExecutionId();
        case STEP -> event.getStepId();
        case ITEM -> event.getItemId();
        };
    }

    // ==================== field rules ====================

    private static String requireString(Object value, String label) {
        if (!(value instanceof String text) || text.isEmpty()) {
            throw new StreamEventParseException(label, "Invalid " + label + ": expected non-empty string.");
        }
        return text;
    }

    private static void requireNumber(Object value, String label) {
        if (!(value instanceof Number number) || (number instanceof Double d && d.isNaN())) {
            throw new StreamEventParseException(label, "Invalid " + label + ": expected number.");
        }
    }

    private static FieldRule required(String name) {
        return new FieldRule(name, false, true);
    }

    private static FieldRule optional(String name) {
        return new FieldRule(name, false, false);
    }

    private static FieldRule requiredNumber(String name) {
        return new FieldRule(name, true, true);
    }

    private static FieldRule optionalNumber(String name) {
        return new FieldRule(name, true, false);
    }

    private record FieldRule(String name, boolean numeric, boolean mandatory) {

        void check(StreamEventType type, Map<String, ?> record) {
            Object value = record.get(name);
            if (value == null && !mandatory) {
                return;
            }
            String label = type.getValue() + "." + name;
            if (numeric) {
                requireNumber(value, label);
            } else {
                requireString(value, label);
            }
        }
    }
}
