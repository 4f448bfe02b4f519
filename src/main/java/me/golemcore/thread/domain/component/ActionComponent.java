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

import me.golemcore.thread.domain.model.ActionDefinition;
import me.golemcore.thread.domain.model.ActionInvocation;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * An action a reactor can request. The definition names the action, its input
 * schema and whether it runs without approval.
 */
public interface ActionComponent {

    ActionDefinition getDefinition();

    /**
     * Executes the action. Failures may be signalled either by throwing or by
     * completing the future exceptionally; both become failed results.
     *
     * @param input
     *            requested input, or the approver's replacement args
     * @param invocation
     *            ids of the turn requesting the action
     * @return future with the action output
     */
    CompletableFuture<Object> execute(Map<String, Object> input, ActionInvocation invocation);

    default boolean isEnabled() {
        return true;
    }

    default String getActionName() {
        return getDefinition().getName();
    }

    default boolean isAuto() {
        return getDefinition().isAuto();
    }
}
