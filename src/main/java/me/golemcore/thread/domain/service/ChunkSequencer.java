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

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Assigns per-context chunk sequence numbers. The first chunk of a context is
 * 1 and every following chunk, in this or a later turn, is exactly one more.
 */
@Component
public class ChunkSequencer {

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    public long next(String contextId) {
        return counters.computeIfAbsent(contextId, key -> new AtomicLong()).incrementAndGet();
    }

    public long current(String contextId) {
        AtomicLong counter = counters.get(contextId);
        return counter != null ? counter.get() : 0L;
    }
}
