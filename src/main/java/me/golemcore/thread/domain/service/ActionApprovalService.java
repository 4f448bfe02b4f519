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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.thread.domain.model.ActionApprovalEvent;
import me.golemcore.thread.domain.model.ApprovalDecision;
import me.golemcore.thread.infrastructure.config.ThreadProperties;
import me.golemcore.thread.infrastructure.event.SpringEventBus;
import me.golemcore.thread.port.outbound.ApprovalSourcePort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Waits for an approval decision on every configured source at once and takes
 * the first one that arrives.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionApprovalService {

    static final String TIMED_OUT_COMMENT = "Approval timed out";

    private final List<ApprovalSourcePort> approvalSources;
    private final ThreadProperties properties;
    private final SpringEventBus eventBus;

    public CompletableFuture<ApprovalDecision> awaitApproval(String executionId, String actionRef) {
        if (approvalSources.isEmpty()) {
            log.warn("[Approval] No approval sources configured, rejecting {}", actionRef);
            return CompletableFuture.completedFuture(ApprovalDecision.reject("No approval source available"));
        }

        List<CompletableFuture<ApprovalDecision>> waits = new ArrayList<>(approvalSources.size());
        for (ApprovalSourcePort source : approvalSources) {
            String token = ApprovalTokens.token(source.getSourceName(), executionId, actionRef);
            log.debug("[Approval] Waiting on {}", token);
            waits.add(source.awaitDecision(token));
        }

        CompletableFuture<ApprovalDecision> decision = FutureSupport.firstOf(waits);
        long timeoutSeconds = properties.getActions().getApprovalTimeoutSeconds();
        if (timeoutSeconds > 0) {
            decision = decision.completeOnTimeout(ApprovalDecision.reject(TIMED_OUT_COMMENT), timeoutSeconds,
                    TimeUnit.SECONDS);
        }
        return decision.exceptionally(error -> {
            log.warn("[Approval] Approval wait failed for {}: {}", actionRef,
                    FutureSupport.safeCauseMessage(error));
            return ApprovalDecision.malformed();
        });
    }

    /**
     * Delivers a decision through the internal hook source. Safe to call before
     * the action starts waiting.
     */
    public void publishHookDecision(String executionId, String actionRef, ApprovalDecision decision) {
        String token = ApprovalTokens.token(ApprovalTokens.HOOK_SOURCE, executionId, actionRef);
        log.info("[Approval] Publishing hook decision for {}: approved={}", token, decision.approved());
        eventBus.publish(new ActionApprovalEvent(token, decision));
    }

    public List<String> tokensFor(String executionId, String actionRef) {
        return approvalSources.stream()
                .map(source -> ApprovalTokens.token(source.getSourceName(), executionId, actionRef))
                .toList();
    }
}
