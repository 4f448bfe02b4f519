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
 * Deterministic approval tokens. A token names the source, the execution and
 * the iteration-scoped action ref, so equal action names in different
 * iterations or executions never share a wait.
 */
public final class ApprovalTokens {

    public static final String PREFIX = "action-approval";
    public static final String HOOK_SOURCE = "hook";
    public static final String WEBHOOK_SOURCE = "webhook";

    private ApprovalTokens() {
    }

    public static String token(String source, String executionId, String actionRef) {
        return PREFIX + ":" + source + ":" + executionId + ":" + actionRef;
    }

    public static boolean isApprovalToken(String token) {
        return token != null && token.startsWith(PREFIX + ":");
    }

    public static boolean belongsTo(String token, String source) {
        return token != null && token.startsWith(PREFIX + ":" + source + ":");
    }
}
