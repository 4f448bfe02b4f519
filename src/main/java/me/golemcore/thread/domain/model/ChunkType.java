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

/**
 * Canonical chunk taxonomy. Wire values carry the {@code chunk.} prefix.
 */
public enum ChunkType {
    // lifecycle
    START("start"),
    START_STEP("start_step"),
    FINISH_STEP("finish_step"),
    FINISH("finish"),
    // text
    TEXT_START("text_start"),
    TEXT_DELTA("text_delta"),
    TEXT_END("text_end"),
    // reasoning
    REASONING_START("reasoning_start"),
    REASONING_DELTA("reasoning_delta"),
    REASONING_END("reasoning_end"),
    // action I/O
    ACTION_INPUT_START("action_input_start"),
    ACTION_INPUT_DELTA("action_input_delta"),
    ACTION_INPUT_AVAILABLE("action_input_available"),
    ACTION_OUTPUT_AVAILABLE("action_output_available"),
    ACTION_OUTPUT_ERROR("action_output_error"),
    // sources and files
    SOURCE_URL("source_url"),
    SOURCE_DOCUMENT("source_document"),
    FILE("file"),
    // metadata
    MESSAGE_METADATA("message_metadata"),
    RESPONSE_METADATA("response_metadata"),
    // terminal bucket
    ERROR("error"),
    UNKNOWN("unknown");

    public static final String WIRE_PREFIX = "chunk.";

    private final String canonicalName;

    ChunkType(String canonicalName) {
        this.canonicalName = canonicalName;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    @JsonValue
    public String getValue() {
        return WIRE_PREFIX + canonicalName;
    }

    public boolean isAction() {
        return canonicalName.startsWith("action_");
    }

    public static boolean isCanonical(String value) {
        for (ChunkType candidate : values()) {
            if (candidate.getValue().equals(value)) {
                return true;
            }
        }
        return false;
    }

    @JsonCreator
    public static ChunkType fromValue(String value) {
        for (ChunkType candidate : values()) {
            if (candidate.getValue().equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown chunk type: " + value);
    }

    @Override
    public String toString() {
        return getValue();
    }
}
