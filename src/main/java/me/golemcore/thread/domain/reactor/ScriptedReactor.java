package me.golemcore.thread.domain.reactor;

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

import me.golemcore.thread.domain.component.ChunkEmitter;
import me.golemcore.thread.domain.component.ThreadReactor;
import me.golemcore.thread.domain.model.ActionRequest;
import me.golemcore.thread.domain.model.ItemType;
import me.golemcore.thread.domain.model.ReactorRequest;
import me.golemcore.thread.domain.model.ReactorResult;
import me.golemcore.thread.domain.model.ScriptExhaustedException;
import me.golemcore.thread.domain.model.ThreadItem;
import me.golemcore.thread.domain.service.ReactionPartsSupport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic reactor that replays a fixed script, one {@link Step} per
 * iteration. It publishes the same chunk shapes a live producer would, so
 * stream consumers can be exercised without a generation backend.
 */
public class ScriptedReactor implements ThreadReactor {

    public static final String PROVIDER = "scripted";

    private final List<Step> steps;
    private final boolean repeatLast;

    public ScriptedReactor(List<Step> steps, boolean repeatLast) {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Scripted reactor requires at least one step");
        }
        this.steps = List.copyOf(steps);
        this.repeatLast = repeatLast;
    }

    public static ScriptedReactor of(Step... steps) {
        return new ScriptedReactor(Arrays.asList(steps), false);
    }

    public static ScriptedReactor repeating(Step... steps) {
        return new ScriptedReactor(Arrays.asList(steps), true);
    }

    @Override
    public String getProvider() {
        return PROVIDER;
    }

    @Override
    public ReactorResult react(ReactorRequest request) {
        int iteration = request.iteration();
        Step step = resolveStep(iteration);

        List<ActionRequest> actionRequests = new ArrayList<>();
        for (int i = 0; i < step.actions().size(); i++) {
            ActionRequest scripted = step.actions().get(i);
            String actionRef = scripted.actionRef() != null
                    ? scripted.actionRef()
                    : "call_" + iteration + "_" + i;
            actionRequests.add(new ActionRequest(actionRef, scripted.actionName(), scripted.input()));
        }

        List<Map<String, Object>> parts = ReactionPartsSupport.copyParts(step.parts());
        for (ActionRequest actionRequest : actionRequests) {
            parts.add(ReactionPartsSupport.toolPart(actionRequest));
        }

        publish(request, step, actionRequests);

        ThreadItem fragment = ThreadItem.builder()
                .type(ItemType.OUTPUT)
                .parts(parts)
                .build();

        return ReactorResult.builder()
                .fragment(fragment)
                .actionRequests(actionRequests)
                .promptMessages(promptMessages(request))
                .build();
    }

    private Step resolveStep(int iteration) {
        if (iteration < steps.size()) {
            return steps.get(iteration);
        }
        if (repeatLast) {
            return steps.get(steps.size() - 1);
        }
        throw new ScriptExhaustedException(iteration, steps.size());
    }

    private void publish(ReactorRequest request, Step step, List<ActionRequest> actionRequests) {
        ChunkEmitter chunks = request.chunks();
        if (chunks == null || chunks.isSilent()) {
            return;
        }
        if (request.sendStart()) {
            chunks.emit(Map.of("type", "start"));
        }
        chunks.emit(Map.of("type", "start-step"));

        int textIndex = 0;
        for (Map<String, Object> part : step.parts()) {
            if (part.get(ThreadItem.PART_TEXT) instanceof String text) {
                String id = "text_" + request.iteration() + "_" + textIndex++;
                chunks.emit(Map.of("type", "text-start", "id", id));
                chunks.emit(Map.of("type", "text-delta", "id", id, "delta", text));
                chunks.emit(Map.of("type", "text-end", "id", id));
            }
        }

        for (ActionRequest actionRequest : actionRequests) {
            chunks.emit(Map.of("type", "tool-input-start",
                    "toolCallId", actionRequest.actionRef(),
                    "toolName", actionRequest.actionName()));
            chunks.emit(Map.of("type", "tool-input-available",
                    "toolCallId", actionRequest.actionRef(),
                    "toolName", actionRequest.actionName(),
                    "input", actionRequest.input()));
        }

        for (Map<String, Object> extra : step.chunks()) {
            chunks.emit(extra);
        }

        chunks.emit(Map.of("type", "finish-step",
                "finishReason", actionRequests.isEmpty() ? "stop" : "tool-calls"));
    }

    private List<Map<String, Object>> promptMessages(ReactorRequest request) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(message("system", request.systemPrompt()));
        }
        if (request.trigger() != null) {
            messages.add(message("user", request.trigger().textContent()));
        }
        return messages;
    }

    private static Map<String, Object> message(String role, String content) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }

    /**
     * One scripted iteration.
     *
     * @param parts
     *            fragment parts (text parts are streamed as text chunks)
     * @param actions
     *            requested actions; a null action ref becomes
     *            {@code call_<iteration>_<index>}
     * @param chunks
     *            extra producer chunks published verbatim
     */
    public record Step(List<Map<String, Object>> parts, List<ActionRequest> actions,
            List<Map<String, Object>> chunks) {

        public Step {
            parts = parts != null ? List.copyOf(parts) : List.of();
            actions = actions != null ? List.copyOf(actions) : List.of();
            chunks = chunks != null ? List.copyOf(chunks) : List.of();
        }

        public static Step text(String text) {
            return new Step(List.of(ThreadItem.textPart(text)), List.of(), List.of());
        }

        public static Step action(String text, String actionName, Map<String, Object> input) {
            List<Map<String, Object>> parts = text != null ? List.of(ThreadItem.textPart(text)) : List.of();
            return new Step(parts, List.of(new ActionRequest(null, actionName, input)), List.of());
        }

        public Step withChunk(Map<String, Object> chunk) {
            List<Map<String, Object>> extra = new ArrayList<>(chunks);
            extra.add(chunk);
            return new Step(parts, actions, extra);
        }
    }
}
