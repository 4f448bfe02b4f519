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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.thread.domain.component.ActionComponent;
import me.golemcore.thread.domain.model.ActionFailureKind;
import me.golemcore.thread.domain.model.ActionInvocation;
import me.golemcore.thread.domain.model.ActionRequest;
import me.golemcore.thread.domain.model.ActionResult;
import me.golemcore.thread.domain.model.ApprovalDecision;
import me.golemcore.thread.infrastructure.config.ThreadProperties;
import me.golemcore.thread.port.outbound.EffectJournalPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Executes the actions requested in one iteration.
 *
 * <p>
 * All requests run concurrently and are joined before returning. Results come
 * back in request order. Nothing thrown by an action, and no rejected approval,
 * leaves this service as an exception: every outcome is an
 * {@link ActionResult}.
 */
@Service
@Slf4j
public class ActionExecutionService {

    static final String NOT_APPROVED = "Action execution not approved";

    private final ActionApprovalService approvalService;
    private final EffectJournalPort effectJournal;
    private final ExecutorService threadActionExecutor;
    private final ThreadProperties properties;

    public ActionExecutionService(ActionApprovalService approvalService, EffectJournalPort effectJournal,
            ExecutorService threadActionExecutor, ThreadProperties properties) {
        this.approvalService = approvalService;
        this.effectJournal = effectJournal;
        this.threadActionExecutor = threadActionExecutor;
        this.properties = properties;
    }

    public List<ActionResult> executeAll(List<ActionRequest> requests, List<ActionComponent> actions,
            ActionInvocation invocation) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        Map<String, ActionComponent> registry = index(actions);

        List<CompletableFuture<ActionResult>> futures = new ArrayList<>(requests.size());
        for (ActionRequest request : requests) {
            String effectId = EffectIds.of(invocation.triggerItemId(), "action", invocation.iteration(),
                    request.actionRef());
            futures.add(effectJournal.runAsync(effectId,
                    () -> execute(request, registry.get(request.actionName()),
                            invocation.forAction(request.actionRef())))
                    .exceptionally(error -> failed(request, error)));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<ActionResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ActionResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    /**
     * Executes a single request, gating it on approval when its action is not
     * auto.
     */
    public CompletableFuture<ActionResult> execute(ActionRequest request, ActionComponent action,
            ActionInvocation invocation) {
        if (action == null || !action.isEnabled()) {
            log.warn("[Actions] Unknown or disabled action requested: {}", request.actionName());
            return CompletableFuture.completedFuture(ActionResult.failure(request, ActionFailureKind.NOT_FOUND,
                    "Action \"" + request.actionName() + "\" not found or not executable."));
        }

        if (action.isAuto()) {
            return run(action, request, request.input(), invocation);
        }

        log.info("[Actions] Action '{}' ({}) waits for approval", request.actionName(), request.actionRef());
        return approvalService.awaitApproval(invocation.executionId(), request.actionRef())
                .thenCompose(decision -> onDecision(action, request, decision, invocation));
    }

    private CompletableFuture<ActionResult> onDecision(ActionComponent action, ActionRequest request,
            ApprovalDecision decision, ActionInvocation invocation) {
        if (decision == null || !decision.approved()) {
            String errorText = decision != null && decision.hasComment()
                    ? NOT_APPROVED + ": " + decision.comment()
                    : NOT_APPROVED;
            log.info("[Actions] Action '{}' ({}) rejected", request.actionName(), request.actionRef());
            return CompletableFuture.completedFuture(
                    ActionResult.failure(request, ActionFailureKind.APPROVAL_DENIED, errorText));
        }
        Map<String, Object> input = decision.args() != null ? decision.args() : request.input();
        return run(action, request, input, invocation);
    }

    private CompletableFuture<ActionResult> run(ActionComponent action, ActionRequest request,
            Map<String, Object> input, ActionInvocation invocation) {
        return CompletableFuture
                .supplyAsync(() -> action.execute(input, invocation), threadActionExecutor)
                .thenCompose(future -> future != null ? future : CompletableFuture.completedFuture(null))
                .orTimeout(properties.getActions().getTimeoutSeconds(), TimeUnit.SECONDS)
                .handle((output, error) -> {
                    if (error != null) {
                        return failed(request, error);
                    }
                    log.debug("[Actions] Action '{}' ({}) completed", request.actionName(), request.actionRef());
                    return ActionResult.success(request, output);
                });
    }

    private ActionResult failed(ActionRequest request, Throwable error) {
        String message = FutureSupport.safeCauseMessage(error);
        log.warn("[Actions] Action '{}' ({}) failed: {}", request.actionName(), request.actionRef(), message);
        return ActionResult.failure(request, ActionFailureKind.EXECUTION_FAILED, message);
    }

    private Map<String, ActionComponent> index(List<ActionComponent> actions) {
        Map<String, ActionComponent> registry = new LinkedHashMap<>();
        if (actions == null) {
            return registry;
        }
        for (ActionComponent action : actions) {
            String name = action.getActionName();
            if (name != null && !name.isBlank()) {
                registry.putIfAbsent(name, action);
            }
        }
        return registry;
    }
}
