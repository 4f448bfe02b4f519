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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Closed taxonomy of thread stream events.
 */
public enum StreamEventType {
    CONTEXT_CREATED("context.created", EntityKind.CONTEXT),
    CONTEXT_RESOLVED("context.resolved", EntityKind.CONTEXT),
    CONTEXT_CONTENT_UPDATED("context.content_updated", EntityKind.CONTEXT),
    CONTEXT_CLOSED("context.closed", EntityKind.CONTEXT),
    THREAD_CREATED("thread.created", EntityKind.THREAD),
    THREAD_RESOLVED("thread.resolved", EntityKind.THREAD),
    THREAD_STREAMING_STARTED("thread.streaming_started", EntityKind.THREAD),
    THREAD_IDLE("thread.idle", EntityKind.THREAD),
    EXECUTION_CREATED("execution.created", EntityKind.EXECUTION),
    EXECUTION_COMPLETED("execution.completed", EntityKind.EXECUTION),
    EXECUTION_FAILED("execution.failed", EntityKind.EXECUTION),
    ITEM_CREATED("item.created", EntityKind.ITEM),
    ITEM_UPDATED("item.updated", EntityKind.ITEM),
    ITEM_COMPLETED("item.completed", EntityKind.ITEM),
    STEP_CREATED("step.created", EntityKind.STEP),
    STEP_UPDATED("step.updated", EntityKind.STEP),
    STEP_COMPLETED("step.completed", EntityKind.STEP),
    STEP_FAILED("step.failed", EntityKind.STEP),
    PART_CREATED("part.created", null),
    PART_UPDATED("part.updated", null),
    CHUNK_EMITTED("chunk.emitted", null);

    private final String value;
    private final EntityKind entityKind;

    StreamEventType(String value, EntityKind entityKind) {
        this.value = value;
        this.entityKind = entityKind;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Entity whose status this event reports, empty for part and chunk events.
     */
    public Optional<EntityKind> getEntityKind() {
        return Optional.ofNullable(entityKind);
    }

    /**
     * Whether the event introduces an entity to an observer rather than moving
     * its status.
     */
    public boolean establishesStatus() {
        return value.endsWith(".created") || value.endsWith(".resolved");
    }

    public static Optional<StreamEventType> find(String value) {
        for (StreamEventType candidate : values()) {
            if (candidate.value.equals(value)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static StreamEventType fromValue(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException(
                "Unsupported thread stream event type: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
