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

import lombok.Builder;
import me.golemcore.thread.domain.component.ChunkEmitter;

import java.util.List;

/**
 * Everything a reactor receives for one iteration.
 *
 * @param history
 *            context items as expanded by the definition, oldest first
 * @param sendStart
 *            true only for the first iteration of a turn; the {@code start}
 *            chunk is published once per turn
 */
@Builder
public record ReactorRequest(
        ThreadEnvironment environment,
        StoredContext context,
        ThreadItem trigger,
        List<ThreadItem> history,
        String systemPrompt,
        List<ActionDefinition> actions,
        int iteration,
        int maxModelSteps,
        String executionId,
        String stepId,
        ChunkEmitter chunks,
        boolean silent,
        boolean sendStart) {
}
