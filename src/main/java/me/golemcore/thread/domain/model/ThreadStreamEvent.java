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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Observable record of a state change or a streamed chunk.
 *
 * <p>
 * One flat shape covers the whole taxonomy; which fields are required depends
 * on {@link #type} and is enforced by the stream event codec. Status values are
 * the wire strings of the matching entity status enum.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ThreadStreamEvent {

    private StreamEventType type;
    private String at;

    private String contextId;
    private String threadId;
    private String executionId;
    private String itemId;
    private String stepId;
    private String status;

    private String itemType;
    private Integer iteration;
    private String kind;
    private String actionName;
    private String errorText;

    private String partKey;
    private Integer idx;
    private String partType;
    private String partPreview;
    private String partState;
    private String partToolCallId;

    private ChunkType chunkType;
    private String actionRef;
    private String provider;
    private String providerChunkType;
    private Long sequence;
    private Map<String, Object> data;
    private Object raw;
}
