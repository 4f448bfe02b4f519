package me.golemcore.thread.domain.component;

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

import java.util.Map;

/**
 * Handle a reactor uses to publish producer-shaped chunks while it computes
 * its result. Chunks are normalized and sequenced by the receiving side.
 */
@FunctionalInterface
public interface ChunkEmitter {

    void emit(Map<String, Object> producerChunk);

    default boolean isSilent() {
        return false;
    }

    static ChunkEmitter silent() {
        return new ChunkEmitter() {
            @Override
            public void emit(Map<String, Object> producerChunk) {
                // silent turns publish nothing
            }

            @Override
            public boolean isSilent() {
                return true;
            }
        };
    }
}
