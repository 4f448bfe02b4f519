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

import java.util.List;
import java.util.Map;

/**
 * Call-site information handed to an action when it executes. The iteration
 * scopes the action's effect id, so a ref reused by a later iteration runs
 * again instead of replaying the earlier result.
 */
@Builder(toBuilder = true)
public record ActionInvocation(
        String actionRef,
        String executionId,
        String contextId,
        String triggerItemId,
        String reactionItemId,
        int iteration,
        List<Map<String, Object>> promptMessages,
        ThreadEnvironment environment) {

    public ActionInvocation forAction(String ref) {
        return new ActionInvocation(ref, executionId, contextId, triggerItemId, reactionItemId, iteration,
                promptMessages, environment);
    }
}
