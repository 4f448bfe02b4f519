package me.golemcore.thread.adapter.inbound.web.controller;

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
import me.golemcore.thread.adapter.inbound.web.dto.ApprovalWebhookResponse;
import me.golemcore.thread.adapter.outbound.approval.WebhookApprovalAdapter;
import me.golemcore.thread.domain.model.ApprovalDecision;
import me.golemcore.thread.domain.service.ApprovalTokens;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Delivers approval decisions for actions waiting on a webhook token.
 *
 * <p>
 * {@code POST /api/threads/approvals/{token}} with a JSON body
 * {@code {"approved": true|false, "comment": "...", "args": {...}}}. A body
 * that cannot be parsed counts as a rejection. Tokens no action is waiting on
 * return {@code 404}; repeated deliveries for an already resolved token return
 * {@code 409}.
 */
@RestController
@RequestMapping("/api/threads/approvals")
@RequiredArgsConstructor
@Slf4j
public class ApprovalWebhookController {

    private final WebhookApprovalAdapter webhookApprovalAdapter;

    @PostMapping("/{token}")
    public Mono<ResponseEntity<ApprovalWebhookResponse>> resolve(
            @PathVariable String token,
            @RequestBody(required = false) byte[] body) {
        return Mono.fromCallable(() -> {
            if (!ApprovalTokens.belongsTo(token, ApprovalTokens.WEBHOOK_SOURCE)
                    || !webhookApprovalAdapter.hasWait(token)) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApprovalWebhookResponse.error("Unknown approval token"));
            }
            Optional<ApprovalDecision> decision = webhookApprovalAdapter.resolveFromBody(token, body);
            if (decision.isEmpty()) {
                return ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(ApprovalWebhookResponse.duplicate(token));
            }
            log.info("[Approval] Webhook decision accepted: token={}, approved={}", token,
                    decision.get().approved());
            return ResponseEntity.ok(ApprovalWebhookResponse.accepted(token, decision.get().approved()));
        });
    }
}
