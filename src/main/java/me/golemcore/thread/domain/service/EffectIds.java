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

/**
 * Stable effect ids. Every id is scoped by the trigger item, so replaying a
 * trigger reuses the ids of its first run.
 */
public final class EffectIds {

    private static final String PREFIX = "effect";

    private EffectIds() {
    }

    public static String of(String triggerItemId, String operation, Object... qualifiers) {
        StringBuilder id = new StringBuilder(PREFIX).append(':').append(triggerItemId).append(':').append(operation);
        for (Object qualifier : qualifiers) {
            id.append(':').append(qualifier);
        }
        return id.toString();
    }
}
