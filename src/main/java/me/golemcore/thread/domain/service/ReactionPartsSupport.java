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

import me.golemcore.thread.domain.component.ActionComponent;
import me.golemcore.thread.domain.model.ActionRequest;
import me.golemcore.thread.domain.model.ActionResult;
import me.golemcore.thread.domain.model.ReviewRequest;
import me.golemcore.thread.domain.model.ThreadItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the parts of a reaction item. Action parts follow the
 * {@code tool-<name>} convention with a {@code toolCallId} and a {@code state}
 * of {@code input-available}, {@code output-available} or
 * {@code output-error}.
 */
public final class ReactionPartsSupport {

    public static final String TOOL_PART_PREFIX = "tool-";
    public static final String STATE_INPUT_AVAILABLE = "input-available";
    public static final String STATE_OUTPUT_AVAILABLE = "output-available";
    public static final String STATE_OUTPUT_ERROR = "output-error";

    private static final String TOOL_CALL_ID = "toolCallId";
    private static final String STATE = "state";

    private ReactionPartsSupport() {
    }

    public static List<Map<String, Object>> copyParts(List<Map<String, Object>> parts) {
        List<Map<String, Object>> copy = new ArrayList<>();
        if (parts == null) {
            return copy;
        }
        for (Map<String, Object> part : parts) {
            copy.add(new LinkedHashMap<>(part));
        }
        return copy;
    }

    public static Map<String, Object> toolPart(ActionRequest request) {
        Map<String, Object> part = new LinkedHashMap<>();
        part.put(ThreadItem.PART_TYPE, TOOL_PART_PREFIX + request.actionName());
        part.put(TOOL_CALL_ID, request.actionRef());
        part.put(STATE, STATE_INPUT_AVAILABLE);
        part.put("input", request.input());
        return part;
    }

    /**
     * Writes one action outcome into the parts: the tool part with the same call
     * id gets the output or error, or a new part is appended when none exists.
     *
     * @return index of the part that now holds the outcome
     */
    public static int mergeActionResult(List<Map<String, Object>> parts, ActionResult result) {
        ActionRequest request = result.getActionRequest();
        int index = findToolPart(parts, request.actionRef());
        Map<String, Object> part;
        if (index >= 0) {
            part = new LinkedHashMap<>(parts.get(index));
            parts.set(index, part);
        } else {
            part = toolPart(request);
            parts.add(part);
            index = parts.size() - 1;
        }
        if (result.isSuccess()) {
            part.put(STATE, STATE_OUTPUT_AVAILABLE);
            part.put("output", result.getOutput());
            part.remove("errorText");
        } else {
            part.put(STATE, STATE_OUTPUT_ERROR);
            part.put("errorText", result.getErrorText());
        }
        return index;
    }

    /**
     * Index of the latest tool part for the ref, or {@code -1}.
     */
    public static int findToolPart(List<Map<String, Object>> parts, String actionRef) {
        if (actionRef == null) {
            return -1;
        }
        for (int i = parts.size() - 1; i >= 0; i--) {
            Map<String, Object> part = parts.get(i);
            if (part.get(ThreadItem.PART_TYPE) instanceof String type && type.startsWith(TOOL_PART_PREFIX)
                    && actionRef.equals(part.get(TOOL_CALL_ID))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Requests whose action exists and needs approval.
     */
    public static List<ReviewRequest> reviewRequests(List<ActionRequest> requests, List<ActionComponent> actions) {
        List<ReviewRequest> reviews = new ArrayList<>();
        if (requests == null || actions == null) {
            return reviews;
        }
        for (ActionRequest request : requests) {
            for (ActionComponent action : actions) {
                if (request.actionName().equals(action.getActionName()) && action.isEnabled() && !action.isAuto()) {
                    reviews.add(new ReviewRequest(request.actionRef(), request.actionName()));
                    break;
                }
            }
        }
        return reviews;
    }
}
