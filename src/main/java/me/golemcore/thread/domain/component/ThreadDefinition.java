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

import me.golemcore.thread.domain.model.ActionResult;
import me.golemcore.thread.domain.model.ContinuationRequest;
import me.golemcore.thread.domain.model.StoredContext;
import me.golemcore.thread.domain.model.ThreadEnvironment;
import me.golemcore.thread.domain.model.ThreadItem;

import java.util.List;
import java.util.Map;

/**
 * Caller-supplied behavior of a thread: how its context content is built,
 * which prompt and actions each iteration gets, and when the loop stops.
 *
 * <p>
 * Only the first three methods are mandatory. The defaults end a turn as soon
 * as an iteration requests no actions, and otherwise keep looping.
 */
public interface ThreadDefinition {

    /**
     * Rebuilds the context content. Called at the start of every iteration; the
     * result replaces the stored content.
     */
    Map<String, Object> initialize(ThreadEnvironment environment, StoredContext context, ThreadItem trigger);

    String buildSystemPrompt(ThreadEnvironment environment, StoredContext context);

    List<ActionComponent> buildActions(ThreadEnvironment environment, StoredContext context);

    /**
     * Rewrites the item history before the reactor sees it.
     */
    default List<ThreadItem> expandItems(ThreadEnvironment environment, StoredContext context,
            List<ThreadItem> items) {
        return items;
    }

    /**
     * Reactor for this thread, or {@code null} to use the engine's default.
     */
    default ThreadReactor getReactor() {
        return null;
    }

    /**
     * Continuation policy, asked after actions ran.
     */
    default boolean shouldContinue(ContinuationRequest request) {
        return true;
    }

    /**
     * Asked when an iteration requested no actions. Returning {@code false}
     * vetoes finalization.
     */
    default boolean onEnd(ContinuationRequest request) {
        return true;
    }

    default void onContextCreated(ThreadEnvironment environment, StoredContext context) {
        // no-op
    }

    default void onContextUpdated(ThreadEnvironment environment, StoredContext context) {
        // no-op
    }

    default void onItemCreated(ThreadEnvironment environment, ThreadItem item) {
        // no-op
    }

    default void onActionExecuted(ThreadEnvironment environment, ActionResult result) {
        // no-op
    }
}
