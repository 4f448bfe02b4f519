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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller environment passed explicitly through every engine call and into
 * every collaborator that needs it.
 */
public record ThreadEnvironment(String orgId, Map<String, Object> attributes) {

    public ThreadEnvironment {
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
    }

    public static ThreadEnvironment of(String orgId) {
        return new ThreadEnvironment(orgId, Map.of());
    }

    public Object attribute(String name) {
        return attributes.get(name);
    }

    public ThreadEnvironment withAttribute(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.put(name, value);
        return new ThreadEnvironment(orgId, copy);
    }
}
