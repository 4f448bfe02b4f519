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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.thread.domain.component.ChunkEmitter;
import me.golemcore.thread.domain.component.ThreadReactor;
import me.golemcore.thread.domain.model.ActionRequest;
import me.golemcore.thread.domain.model.GenerationMessage;
import me.golemcore.thread.domain.model.GenerationRequest;
import me.golemcore.thread.domain.model.GenerationResponse;
import me.golemcore.thread.domain.model.ItemType;
import me.golemcore.thread.domain.model.ReactorRequest;
import me.golemcore.thread.domain.model.ReactorResult;
import me.golemcore.thread.domain.model.ThreadItem;
import me.golemcore.thread.domain.service.ReactionPartsSupport;
import me.golemcore.thread.infrastructure.config.ThreadProperties;
import me.golemcore.thread.port.outbound.GenerationPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Reactor backed by a live generation provider. Converts the context's item
 * history into a prompt, calls {@link GenerationPort} and publishes the answer
 * as producer chunks.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GenerationReactor implements ThreadReactor {

    private static final String TOOL_CALL_ID = "toolCallId";
    private static final String STATE = "state";

    private final GenerationPort generationPort;
    private final ThreadProperties properties;

    @Override
    public String getProvider() {
        return generationPort.getProviderId();
    }

    @Override
    public ReactorResult react(ReactorRequest request) {
        ChunkEmitter chunks = request.chunks() != null ? request.chunks() : ChunkEmitter.silent();
        if (request.sendStart()) {
            chunks.emit(Map.of("type", "start"));
        }
        chunks.emit(Map.of("type", "start-step"));

        GenerationRequest generationRequest = GenerationRequest.builder()
                .systemPrompt(request.systemPrompt())
                .messages(toMessages(request.history()))
                .actions(request.actions() != null ? request.actions() : List.of())
                .temperature(properties.getGeneration().getTemperature())
                .build();

        log.debug("[Generation] Iteration {} with {} message(s), {} action(s)", request.iteration(),
                generationRequest.getMessages().size(), generationRequest.getActions().size());
        GenerationResponse response = await(generationRequest);

        List<Map<String, Object>> parts = new ArrayList<>();
        String content = response.getContent();
        if (content != null && !content.isBlank()) {
            String textId = "text_" + request.stepId();
            chunks.emit(Map.of("type", "text-start", "id", textId));
            chunks.emit(Map.of("type", "text-delta", "id", textId, "delta", content));
            chunks.emit(Map.of("type", "text-end", "id", textId));
            parts.add(ThreadItem.textPart(content));
        }

        List<ActionRequest> actionRequests = new ArrayList<>();
        List<ActionRequest> calls = response.getActionCalls() != null ? response.getActionCalls() : List.of();
        for (int i = 0; i < calls.size(); i++) {
            ActionRequest call = calls.get(i);
            String actionRef = call.actionRef() != null && !call.actionRef().isBlank()
                    ? call.actionRef()
                    : "call_" + request.iteration() + "_" + i;
            ActionRequest actionRequest = new ActionRequest(actionRef, call.actionName(), call.input());
            actionRequests.add(actionRequest);
            parts.add(ReactionPartsSupport.toolPart(actionRequest));
            chunks.emit(Map.of("type", "tool-input-start", TOOL_CALL_ID, actionRef,
                    "toolName", actionRequest.actionName()));
            chunks.emit(Map.of("type", "tool-input-available", TOOL_CALL_ID, actionRef,
                    "toolName", actionRequest.actionName(), "input", actionRequest.input()));
        }

        String finishReason = response.getFinishReason() != null ? response.getFinishReason() : "stop";
        chunks.emit(Map.of("type", "finish-step", "finishReason", finishReason));

        return ReactorResult.builder()
                .fragment(ThreadItem.builder().type(ItemType.OUTPUT).parts(parts).build())
                .actionRequests(actionRequests)
                .promptMessages(promptMessages(request.systemPrompt(), generationRequest.getMessages()))
                .usage(response.getUsage())
                .build();
    }

    private GenerationResponse await(GenerationRequest generationRequest) {
        try {
            return generationPort.generate(generationRequest).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Input items become user messages. Output items become an assistant message
     * (text plus action calls) followed by one tool message per settled action.
     */
    List<GenerationMessage> toMessages(List<ThreadItem> history) {
        List<GenerationMessage> messages = new ArrayList<>();
        if (history == null) {
            return messages;
        }
        for (ThreadItem item : history) {
            if (item.getType() == ItemType.INPUT) {
                messages.add(GenerationMessage.builder()
                        .role(GenerationMessage.ROLE_USER)
                        .content(item.textContent())
                        .build());
                continue;
            }

            List<ActionRequest> calls = new ArrayList<>();
            List<GenerationMessage> results = new ArrayList<>();
            for (Map<String, Object> part : item.getParts()) {
                if (!(part.get(ThreadItem.PART_TYPE) instanceof String type)
                        || !type.startsWith(ReactionPartsSupport.TOOL_PART_PREFIX)) {
                    continue;
                }
                String actionName = type.substring(ReactionPartsSupport.TOOL_PART_PREFIX.length());
                String actionRef = part.get(TOOL_CALL_ID) instanceof String ref ? ref : null;
                calls.add(new ActionRequest(actionRef, actionName, inputOf(part)));
                String result = describeOutcome(part);
                if (result != null) {
                    results.add(GenerationMessage.builder()
                            .role(GenerationMessage.ROLE_TOOL)
                            .actionRef(actionRef)
                            .actionName(actionName)
                            .content(result)
                            .build());
                }
            }

            messages.add(GenerationMessage.builder()
                    .role(GenerationMessage.ROLE_ASSISTANT)
                    .content(item.textContent())
                    .actionCalls(calls.isEmpty() ? null : calls)
                    .build());
            messages.addAll(results);
        }
        return messages;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> inputOf(Map<String, Object> part) {
        return part.get("input") instanceof Map<?, ?> input ? (Map<String, Object>) input : Map.of();
    }

    private static String describeOutcome(Map<String, Object> part) {
        Object state = part.get(STATE);
        if (ReactionPartsSupport.STATE_OUTPUT_AVAILABLE.equals(state)) {
            return String.valueOf(part.get("output"));
        }
        if (ReactionPartsSupport.STATE_OUTPUT_ERROR.equals(state)) {
            return "Error: " + part.get("errorText");
        }
        return null;
    }

    private static List<Map<String, Object>> promptMessages(String systemPrompt, List<GenerationMessage> messages) {
        List<Map<String, Object>> prompt = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            prompt.add(message(GenerationMessage.ROLE_SYSTEM, systemPrompt));
        }
        for (GenerationMessage message : messages) {
            prompt.add(message(message.getRole(), message.getContent()));
        }
        return prompt;
    }

    private static Map<String, Object> message(String role, String content) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }
}
