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

import me.golemcore.thread.domain.service.TransitionContract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One normalized content fragment produced by a step. Immutable once created.
 *
 * @param key
 *            always {@code <stepId>:<idx>}
 */
public record ThreadPart(String key, String stepId, int idx, String type, Map<String, Object> payload) {

    public ThreadPart {
        TransitionContract.assertPartKey(stepId, idx, key);
        payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Map.of();
    }

    public static ThreadPart of(String stepId, int idx, Map<String, Object> payload) {
        Object type = payload != null ? payload.get(ThreadItem.PART_TYPE) : null;
        return new ThreadPart(TransitionContract.partKey(stepId, idx), stepId, idx,
                type instanceof String value ? value : null, payload);
    }
}
