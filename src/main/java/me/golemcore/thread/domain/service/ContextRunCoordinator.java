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
import me.golemcore.thread.domain.loop.ThreadEngine;
import me.golemcore.thread.domain.model.ContextIdentifier;
import me.golemcore.thread.domain.model.ReactRequest;
import me.golemcore.thread.domain.model.TurnResult;
import me.golemcore.thread.infrastructure.config.ThreadProperties;
import me.golemcore.thread.port.outbound.ThreadStorePort;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs {@link ThreadEngine} turns one at a time per context.
 *
 * <p>
 * Turns that target the same context are queued behind the running turn and
 * executed in submission order. A turn addressed by context id is keyed by
 * that context's thread key, so it queues with turns addressed by key. Turns
 * for different contexts
 * run concurrently on {@code contextRunExecutor}. Requests without a context
 * identifier always create a new context and never wait.
 */
@Service
@Slf4j
public class ContextRunCoordinator {

    private final ThreadEngine threadEngine;
    private final ThreadStorePort threadStore;
    private final ExecutorService contextRunExecutor;
    private final int maxQueuedTurns;

    private final Map<String, ContextRunner> runners = new ConcurrentHashMap<>();

    public ContextRunCoordinator(ThreadEngine threadEngine, ThreadStorePort threadStore,
            ExecutorService contextRunExecutor, ThreadProperties properties) {
        this.threadEngine = threadEngine;
        this.threadStore = threadStore;
        this.contextRunExecutor = contextRunExecutor;
        this.maxQueuedTurns = properties.getCoordinator().getMaxQueuedTurns();
    }

    public CompletableFuture<TurnResult> submit(ReactRequest request) {
        Objects.requireNonNull(request, "request");
        String runKey = runKey(request.getContext());
        PendingTurn turn = new PendingTurn(request, new CompletableFuture<>());
        while (!runners.computeIfAbsent(runKey, ContextRunner::new).enqueue(turn)) {
            log.trace("[Coordinator] runner retired during submit, retrying: key={}", runKey);
        }
        return turn.result();
    }

    private String runKey(ContextIdentifier identifier) {
        if (identifier == null) {
            return "new:" + UUID.randomUUID();
        }
        if (identifier.isById()) {
            return threadStore.findContext(identifier.id())
                    .map(context -> ContextIdentifier.byKey(context.getKey()).runKey())
                    .orElse(identifier.runKey());
        }
        return identifier.runKey();
    }

    boolean hasRunner(String runKey) {
        return runners.containsKey(runKey);
    }

    private final class ContextRunner {

        private final String key;
        private final Object lock = new Object();
        private final Deque<PendingTurn> queued = new ArrayDeque<>();

        private Future<?> runningTask;
        private boolean starting;
        private boolean retired;

        private ContextRunner(String key) {
            this.key = key;
        }

        /**
         * @return false when this runner was already evicted and the caller must
         *         resolve a fresh one
         */
        boolean enqueue(PendingTurn turn) {
            synchronized (lock) {
                if (retired) {
                    return false;
                }
                if (isRunning()) {
                    if (queued.size() >= maxQueuedTurns) {
                        turn.result().completeExceptionally(new RejectedExecutionException(
                                "Too many queued turns for context " + key + " (limit " + maxQueuedTurns + ")"));
                        log.warn("[Coordinator] queue limit reached ({}), rejected turn: key={}",
                                maxQueuedTurns, key);
                        return true;
                    }
                    queued.addLast(turn);
                    log.debug("[Coordinator] turn queued: key={}, queued={}", key, queued.size());
                    return true;
                }
                starting = true;
            }
            startRun(turn);
            return true;
        }

        private boolean isRunning() {
            return starting || (runningTask != null && !runningTask.isDone());
        }

        private void startRun(PendingTurn turn) {
            try {
                Future<?> task = contextRunExecutor.submit(() -> {
                    try {
                        turn.result().complete(threadEngine.react(turn.request()));
                    } catch (Exception e) { // NOSONAR - must not kill executor thread
                        log.error("[Coordinator] run failed: key={}: {}", key, e.getMessage());
                        turn.result().completeExceptionally(e);
                    } finally {
                        onRunComplete();
                    }
                });
                synchronized (lock) {
                    if (starting) {
                        runningTask = task;
                    }
                }
            } catch (RejectedExecutionException e) {
                turn.result().completeExceptionally(e);
                onRunComplete();
            }
        }

        private void onRunComplete() {
            PendingTurn next;
            synchronized (lock) {
                starting = false;
                runningTask = null;
                next = queued.pollFirst();
                if (next != null) {
                    starting = true;
                }
            }
            if (next != null) {
                startRun(next);
                return;
            }
            evictIfIdle();
        }

        private void evictIfIdle() {
            synchronized (lock) {
                if (isRunning() || !queued.isEmpty()) {
                    return;
                }
                retired = true;
            }
            boolean removed = runners.remove(key, this);
            if (removed) {
                log.debug("[Coordinator] evicted idle runner: key={}", key);
            }
        }
    }

    private record PendingTurn(ReactRequest request, CompletableFuture<TurnResult> result) {
    }
}
