package me.golemcore.thread.adapter.outbound.approval;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.thread.domain.model.ApprovalDecision;
import me.golemcore.thread.domain.service.ApprovalTokens;
import me.golemcore.thread.infrastructure.config.ThreadProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Approval source fed by inbound HTTP requests. The request body is
 * {@code {"approved": true|false, "comment": "...", "args": {...}}}; anything
 * that does not parse to that shape counts as a rejection.
 */
@Component
@Slf4j
public class WebhookApprovalAdapter extends PendingApprovalRegistry {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public WebhookApprovalAdapter(Clock clock, ThreadProperties properties, ObjectMapper objectMapper) {
        super(clock, properties);
        this.objectMapper = objectMapper;
    }

    @Override
    public String getSourceName() {
        return ApprovalTokens.WEBHOOK_SOURCE;
    }

    /**
     * Resolves a webhook token from a raw request body. Tokens nobody is
     * waiting on are left alone so stray requests never create waits.
     *
     * @return the decision that was delivered, or empty when the token was
     *         already resolved or is not awaited
     * @throws IllegalArgumentException
     *             if the token is not a webhook approval token
     */
    public Optional<ApprovalDecision> resolveFromBody(String token, byte[] body) {
        if (!ApprovalTokens.belongsTo(token, getSourceName())) {
            throw new IllegalArgumentException("Not a webhook approval token: " + token);
        }
        ApprovalDecision decision = parseDecision(body);
        return resolveAwaited(token, decision) ? Optional.of(decision) : Optional.empty();
    }

    @SuppressWarnings("unchecked")
    ApprovalDecision parseDecision(byte[] body) {
        if (body == null || body.length == 0) {
            return ApprovalDecision.malformed();
        }
        Map<String, Object> payload;
        try {
            payload = objectMapper.readValue(body, MAP_TYPE_REF);
        } catch (IOException e) {
            log.warn("[Approval] Malformed webhook approval payload: {}", e.getMessage());
            return ApprovalDecision.malformed();
        }
        if (payload == null || !Boolean.TRUE.equals(payload.get("approved"))) {
            String comment = payload != null && payload.get("comment") instanceof String text ? text : null;
            return ApprovalDecision.reject(comment);
        }
        Map<String, Object> args = payload.get("args") instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
        return ApprovalDecision.approve(args);
    }
}
