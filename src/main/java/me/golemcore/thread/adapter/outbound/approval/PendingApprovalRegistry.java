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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.thread.domain.model.ApprovalDecision;
import me.golemcore.thread.infrastructure.config.ThreadProperties;
import me.golemcore.thread.port.outbound.ApprovalSourcePort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Token-addressed approval waits shared by the approval sources.
 *
 * <p>
 * The wait for a token is created by whichever comes first, the waiter or the
 * decision, so a decision delivered early is not lost. Waiters get a copy of
 * the shared future; dropping or cancelling it leaves the token untouched.
 * Once a wait has been claimed by a waiter and resolved, the next waiter on
 * the same token starts a new wait instead of inheriting the old decision.
 * Waits older than {@code thread.actions.approval-retention-minutes} are
 * failed and removed by a background task.
 */
@Slf4j
public abstract class PendingApprovalRegistry implements ApprovalSourcePort {

    private final Map<String, PendingApproval> pending = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration retention;

    private ScheduledExecutorService cleanupExecutor;

    protected PendingApprovalRegistry(Clock clock, ThreadProperties properties) {
        this.clock = clock;
        this.retention = Duration.ofMinutes(properties.getActions().getApprovalRetentionMinutes());
    }

    @PostConstruct
    public void init() {
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, getSourceName() + "-approval-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleAtFixedRate(this::evictStale, 1, 1, TimeUnit.MINUTES);
    }

    @PreDestroy
    public void destroy() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
            try {
                cleanupExecutor.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public CompletableFuture<ApprovalDecision> awaitDecision(String token) {
        PendingApproval approval = pending.compute(token, (key, existing) -> existing == null
                || (existing.claimed().get() && existing.future().isDone()) ? newEntry() : existing);
        approval.claimed().set(true);
        return approval.future().copy();
    }

    @Override
    public boolean resolve(String token, ApprovalDecision decision) {
        return complete(token, pending.computeIfAbsent(token, key -> newEntry()), decision);
    }

    /**
     * Resolves a token only if a waiter already registered it. Unlike
     * {@link #resolve}, never creates a wait.
     *
     * @return {@code false} when the token is unknown or already resolved
     */
    public boolean resolveAwaited(String token, ApprovalDecision decision) {
        PendingApproval approval = pending.get(token);
        if (approval == null || !approval.claimed().get()) {
            log.debug("[Approval] {} has no waiter, ignoring decision", token);
            return false;
        }
        return complete(token, approval, decision);
    }

    /**
     * Whether a waiter registered this token and it has not been evicted yet.
     */
    public boolean hasWait(String token) {
        PendingApproval approval = pending.get(token);
        return approval != null && approval.claimed().get();
    }

    private boolean complete(String token, PendingApproval approval, ApprovalDecision decision) {
        boolean completed = approval.future().complete(decision);
        if (completed) {
            log.info("[Approval] {} resolved via {}: approved={}", token, getSourceName(), decision.approved());
        } else {
            log.debug("[Approval] {} already resolved, ignoring duplicate", token);
        }
        return completed;
    }

    public boolean isPending(String token) {
        PendingApproval approval = pending.get(token);
        return approval != null && !approval.future().isDone();
    }

    int evictStale() {
        Instant cutoff = clock.instant().minus(retention);
        int[] evicted = new int[1];
        pending.entrySet().removeIf(e -> {
            if (e.getValue().createdAt().isBefore(cutoff)) {
                e.getValue().future().completeExceptionally(new TimeoutException("Stale approval cleaned up"));
                evicted[0]++;
                return true;
            }
            return false;
        });
        if (evicted[0] > 0) {
            log.debug("[Approval] Evicted {} stale {} wait(s)", evicted[0], getSourceName());
        }
        return evicted[0];
    }

    private PendingApproval newEntry() {
        return new PendingApproval(new CompletableFuture<>(), clock.instant(), new AtomicBoolean());
    }

    private record PendingApproval(CompletableFuture<ApprovalDecision> future, Instant createdAt,
            AtomicBoolean claimed) {
    }
}
