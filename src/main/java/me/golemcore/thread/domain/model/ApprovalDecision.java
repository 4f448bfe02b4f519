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

import java.util.Map;

/**
 * Decision delivered to an approval wait. An approval may carry replacement
 * arguments for the action input.
 */
public record ApprovalDecision(boolean approved, String comment, Map<String, Object> args) {

    public static ApprovalDecision approve() {
        return new ApprovalDecision(true, null, null);
    }

    public static ApprovalDecision approve(Map<String, Object> args) {
        return new ApprovalDecision(true, null, args);
    }

    public static ApprovalDecision reject(String comment) {
        return new ApprovalDecision(false, comment, null);
    }

    /**
     * Stand-in for a payload that could not be parsed. Treated as a rejection
     * without comment.
     */
    public static ApprovalDecision malformed() {
        return new ApprovalDecision(false, null, null);
    }

    public boolean hasComment() {
        return comment != null && !comment.isBlank();
    }
}
