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

/**
 * Context selector: either a concrete context id or a thread key, never both.
 */
public record ContextIdentifier(String id, String key) {

    public ContextIdentifier {
        boolean hasId = id != null && !id.isBlank();
        boolean hasKey = key != null && !key.isBlank();
        if (hasId == hasKey) {
            throw new IllegalArgumentException("Context identifier requires exactly one of id or key");
        }
    }

    public static ContextIdentifier byId(String id) {
        return new ContextIdentifier(id, null);
    }

    public static ContextIdentifier byKey(String key) {
        return new ContextIdentifier(null, key);
    }

    public boolean isById() {
        return id != null;
    }

    /**
     * Stable string used to serialize turns that target the same context.
     */
    public String runKey() {
        return isById() ? "id:" + id : "key:" + key;
    }
}
