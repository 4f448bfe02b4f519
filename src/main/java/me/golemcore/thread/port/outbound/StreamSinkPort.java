package me.golemcore.thread.port.outbound;

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

import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * Namespaced per-context streams used when a turn is started without an
 * explicit sink.
 */
public interface StreamSinkPort {

    /**
     * Returns the namespace a context's records are published under, e.g.
     * {@code context:abc}.
     */
    static String namespace(String contextId) {
        return "context:" + contextId;
    }

    /**
     * Opens the default sink for a context. Closing the returned sink completes
     * the stream observed by current subscribers.
     */
    StreamSink openContextStream(String contextId);

    /**
     * Subscribes to the records of a context's current (or next) turn. Records
     * already written in the current turn are replayed up to the configured
     * buffer size.
     */
    Flux<Map<String, Object>> subscribe(String contextId);
}
