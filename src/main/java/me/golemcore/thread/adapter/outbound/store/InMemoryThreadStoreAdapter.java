package me.golemcore.thread.adapter.outbound.store;

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
import me.golemcore.thread.domain.model.ContextIdentifier;
import me.golemcore.thread.domain.model.ContextInitialization;
import me.golemcore.thread.domain.model.ContextStatus;
import me.golemcore.thread.domain.model.ExecutionOpening;
import me.golemcore.thread.domain.model.ExecutionStatus;
import me.golemcore.thread.domain.model.ReviewRequest;
import me.golemcore.thread.domain.model.StepStatus;
import me.golemcore.thread.domain.model.StepUpdate;
import me.golemcore.thread.domain.model.StoredContext;
import me.golemcore.thread.domain.model.StoredThread;
import me.golemcore.thread.domain.model.ThreadEnvironment;
import me.golemcore.thread.domain.model.ThreadExecution;
import me.golemcore.thread.domain.model.ThreadItem;
import me.golemcore.thread.domain.model.ThreadPart;
import me.golemcore.thread.domain.model.ThreadSnapshot;
import me.golemcore.thread.domain.model.ThreadStatus;
import me.golemcore.thread.domain.model.ThreadStep;
import me.golemcore.thread.domain.service.ReactionPartsSupport;
import me.golemcore.thread.domain.service.TransitionContract;
import me.golemcore.thread.port.outbound.ThreadStorePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Process-local implementation of {@link ThreadStorePort}.
 *
 * <p>
 * All operations are serialized on the adapter's monitor, which makes every
 * multi-entity call atomic. Stored objects are copied on the way in and out so
 * callers never share mutable state with the store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryThreadStoreAdapter implements ThreadStorePort {

    private final Clock clock;

    private final Map<String, StoredThread> threads = new HashMap<>();
    private final Map<String, String> threadIdsByKey = new HashMap<>();
    private final Map<String, StoredContext> contexts = new HashMap<>();
    private final Map<String, String> contextIdsByKey = new HashMap<>();
    private final Map<String, String> contextIdsByThread = new HashMap<>();
    private final Map<String, ThreadExecution> executions = new HashMap<>();
    private final Map<String, ThreadStep> steps = new HashMap<>();
    private final Map<String, List<String>> stepIdsByExecution = new HashMap<>();
    private final Map<String, Map<String, ThreadPart>> partsByStep = new HashMap<>();
    private final Map<String, ThreadItem> items = new HashMap<>();
    private final Map<String, List<String>> itemIdsByContext = new HashMap<>();
    private final Map<String, List<ReviewRequest>> reviewRequestsByItem = new HashMap<>();

    @Override
    public synchronized ContextInitialization initializeContext(ThreadEnvironment environment,
            ContextIdentifier identifier) {
        if (identifier != null && identifier.isById()) {
            StoredContext existing = contexts.get(identifier.id());
            if (existing == null) {
                throw new IllegalArgumentException("Unknown context id: " + identifier.id());
            }
            return new ContextInitialization(copy(existing), copy(threads.get(existing.getThreadId())), false);
        }

        if (identifier != null) {
            String contextId = contextIdsByKey.get(identifier.key());
            if (contextId != null) {
                StoredContext existing = contexts.get(contextId);
                return new ContextInitialization(copy(existing), copy(threads.get(existing.getThreadId())), false);
            }
        }

        String key = identifier != null ? identifier.key() : UUID.randomUUID().toString();
        Instant now = clock.instant();
        StoredThread thread = StoredThread.builder()
                .id(UUID.randomUUID().toString())
                .key(key)
                .status(ThreadStatus.IDLE)
                .createdAt(now)
                .updatedAt(now)
                .build();
        StoredContext context = StoredContext.builder()
                .id(UUID.randomUUID().toString())
                .key(key)
                .threadId(thread.getId())
                .status(ContextStatus.OPEN)
                .createdAt(now)
                .updatedAt(now)
                .build();

        threads.put(thread.getId(), thread);
        threadIdsByKey.put(key, thread.getId());
        contexts.put(context.getId(), context);
        contextIdsByKey.put(key, context.getId());
        contextIdsByThread.put(thread.getId(), context.getId());
        log.debug("[Store] Created context {} for thread {}", context.getId(), thread.getId());
        return new ContextInitialization(copy(context), copy(thread), true);
    }

    @Override
    public synchronized ExecutionOpening saveTriggerAndCreateExecution(ThreadEnvironment environment,
            String contextId, ThreadItem trigger) {
        StoredContext context = requireContext(contextId);
        StoredThread thread = threads.get(context.getThreadId());
        Instant now = clock.instant();

        TransitionContract.assertTransition(thread.getStatus(), ThreadStatus.STREAMING);
        if (context.getStatus() == ContextStatus.CLOSED) {
            TransitionContract.assertTransition(context.getStatus(), ContextStatus.OPEN);
            context.setStatus(ContextStatus.OPEN);
            context.setUpdatedAt(now);
        }
        thread.setStatus(ThreadStatus.STREAMING);
        thread.setUpdatedAt(now);

        ThreadItem stored = copy(trigger);
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID().toString());
        }
        items.put(stored.getId(), stored);
        itemIdsByContext.computeIfAbsent(contextId, id -> new ArrayList<>()).add(stored.getId());

        ThreadExecution execution = ThreadExecution.builder()
                .id(UUID.randomUUID().toString())
                .threadId(thread.getId())
                .contextId(contextId)
                .triggerItemId(stored.getId())
                .reactionItemId(UUID.randomUUID().toString())
                .status(ExecutionStatus.EXECUTING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        executions.put(execution.getId(), execution);
        return new ExecutionOpening(stored.getId(), execution.getReactionItemId(), execution.getId());
    }

    @Override
    public synchronized ThreadStep createStep(ThreadEnvironment environment, String executionId, int iteration) {
        requireExecution(executionId);
        Instant now = clock.instant();
        ThreadStep step = ThreadStep.builder()
                .id(UUID.randomUUID().toString())
                .executionId(executionId)
                .iteration(iteration)
                .status(StepStatus.RUNNING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        steps.put(step.getId(), step);
        stepIdsByExecution.computeIfAbsent(executionId, id -> new ArrayList<>()).add(step.getId());
        return copy(step);
    }

    @Override
    public synchronized StoredContext updateContextContent(ThreadEnvironment environment, String contextId,
            Map<String, Object> content) {
        StoredContext context = requireContext(contextId);
        context.setContent(content != null ? new LinkedHashMap<>(content) : new LinkedHashMap<>());
        context.setUpdatedAt(clock.instant());
        return copy(context);
    }

    @Override
    public synchronized ThreadStep updateStep(ThreadEnvironment environment, String stepId, StepUpdate update) {
        ThreadStep step = steps.get(stepId);
        if (step == null) {
            throw new IllegalArgumentException("Unknown step id: " + stepId);
        }
        if (update.getStatus() != null && update.getStatus() != step.getStatus()) {
            TransitionContract.assertTransition(step.getStatus(), update.getStatus());
            step.setStatus(update.getStatus());
        }
        if (update.getKind() != null) {
            step.setKind(update.getKind());
        }
        if (update.getActionName() != null) {
            step.setActionName(update.getActionName());
        }
        if (update.getActionInput() != null) {
            step.setActionInput(update.getActionInput());
        }
        if (update.getActionOutput() != null) {
            step.setActionOutput(update.getActionOutput());
        }
        if (update.getActionError() != null) {
            step.setActionError(update.getActionError());
        }
        if (update.getActionRequests() != null) {
            step.setActionRequests(new ArrayList<>(update.getActionRequests()));
        }
        if (update.getActionResults() != null) {
            step.setActionResults(new ArrayList<>(update.getActionResults()));
        }
        if (update.getContinueLoop() != null) {
            step.setContinueLoop(update.getContinueLoop());
        }
        if (update.getErrorText() != null) {
            step.setErrorText(update.getErrorText());
        }
        step.setUpdatedAt(clock.instant());
        return copy(step);
    }

    @Override
    public synchronized void saveStepParts(ThreadEnvironment environment, String stepId, List<ThreadPart> parts) {
        if (!steps.containsKey(stepId)) {
            throw new IllegalArgumentException("Unknown step id: " + stepId);
        }
        Map<String, ThreadPart> stored = partsByStep.computeIfAbsent(stepId, id -> new LinkedHashMap<>());
        for (ThreadPart part : parts) {
            if (!stepId.equals(part.stepId())) {
                throw new IllegalArgumentException("Part " + part.key() + " does not belong to step " + stepId);
            }
            TransitionContract.assertPartKey(part.stepId(), part.idx(), part.key());
            stored.putIfAbsent(part.key(), part);
        }
    }

    @Override
    public synchronized ThreadItem saveReactionItem(ThreadEnvironment environment, String contextId,
            ThreadItem item, String executionId, List<ReviewRequest> reviewRequests) {
        requireContext(contextId);
        ThreadExecution execution = requireExecution(executionId);
        if (!execution.getReactionItemId().equals(item.getId())) {
            throw new IllegalArgumentException("Reaction item " + item.getId() + " does not belong to execution "
                    + executionId);
        }
        ThreadItem stored = copy(item);
        if (!items.containsKey(stored.getId())) {
            itemIdsByContext.computeIfAbsent(contextId, id -> new ArrayList<>()).add(stored.getId());
        }
        items.put(stored.getId(), stored);
        reviewRequestsByItem.put(stored.getId(),
                reviewRequests != null ? List.copyOf(reviewRequests) : List.of());
        return copy(stored);
    }

    @Override
    public synchronized ThreadItem updateItem(ThreadEnvironment environment, ThreadItem item) {
        ThreadItem existing = items.get(item.getId());
        if (existing == null) {
            throw new IllegalArgumentException("Unknown item id: " + item.getId());
        }
        if (item.getStatus() != null && item.getStatus() != existing.getStatus()) {
            TransitionContract.assertTransition(existing.getStatus(), item.getStatus());
        }
        ThreadItem stored = copy(item);
        items.put(stored.getId(), stored);
        return copy(stored);
    }

    @Override
    public synchronized ThreadExecution completeExecution(ThreadEnvironment environment, String contextId,
            String executionId, ExecutionStatus status) {
        ThreadExecution execution = requireExecution(executionId);
        StoredContext context = requireContext(contextId);
        StoredThread thread = threads.get(context.getThreadId());

        TransitionContract.assertTransition(execution.getStatus(), status);
        TransitionContract.assertTransition(context.getStatus(), ContextStatus.CLOSED);
        TransitionContract.assertTransition(thread.getStatus(), ThreadStatus.IDLE);

        Instant now = clock.instant();
        execution.setStatus(status);
        execution.setUpdatedAt(now);
        context.setStatus(ContextStatus.CLOSED);
        context.setUpdatedAt(now);
        thread.setStatus(ThreadStatus.IDLE);
        thread.setUpdatedAt(now);
        return execution.toBuilder().build();
    }

    @Override
    public synchronized List<ThreadItem> listItems(ThreadEnvironment environment, String contextId) {
        List<ThreadItem> result = new ArrayList<>();
        for (String itemId : itemIdsByContext.getOrDefault(contextId, List.of())) {
            result.add(copy(items.get(itemId)));
        }
        return result;
    }

    @Override
    public synchronized Optional<StoredContext> findContext(String contextId) {
        StoredContext context = contexts.get(contextId);
        return context != null ? Optional.of(copy(context)) : Optional.empty();
    }

    @Override
    public synchronized Optional<ThreadExecution> findExecution(String executionId) {
        ThreadExecution execution = executions.get(executionId);
        return execution != null ? Optional.of(execution.toBuilder().build()) : Optional.empty();
    }

    @Override
    public synchronized List<ThreadStep> listSteps(String executionId) {
        List<ThreadStep> result = new ArrayList<>();
        for (String stepId : stepIdsByExecution.getOrDefault(executionId, List.of())) {
            result.add(copy(steps.get(stepId)));
        }
        return result;
    }

    @Override
    public synchronized List<ThreadPart> listParts(String stepId) {
        return new ArrayList<>(partsByStep.getOrDefault(stepId, Map.of()).values());
    }

    @Override
    public synchronized List<ReviewRequest> listReviewRequests(String itemId) {
        return reviewRequestsByItem.getOrDefault(itemId, List.of());
    }

    @Override
    public synchronized Optional<ThreadSnapshot> findSnapshot(String threadKey) {
        String threadId = threadIdsByKey.get(threadKey);
        if (threadId == null) {
            return Optional.empty();
        }
        StoredThread thread = threads.get(threadId);
        StoredContext context = contexts.get(contextIdsByThread.get(threadId));
        return Optional.of(new ThreadSnapshot(copy(thread), copy(context), listItems(null, context.getId())));
    }

    private StoredContext requireContext(String contextId) {
        StoredContext context = contexts.get(contextId);
        if (context == null) {
            throw new IllegalArgumentException("Unknown context id: " + contextId);
        }
        return context;
    }

    private ThreadExecution requireExecution(String executionId) {
        ThreadExecution execution = executions.get(executionId);
        if (execution == null) {
            throw new IllegalArgumentException("Unknown execution id: " + executionId);
        }
        return execution;
    }

    private static StoredThread copy(StoredThread thread) {
        return thread.toBuilder().build();
    }

    private static StoredContext copy(StoredContext context) {
        return context.toBuilder()
                .content(context.getContent() != null ? new LinkedHashMap<>(context.getContent()) : null)
                .build();
    }

    private static ThreadStep copy(ThreadStep step) {
        return step.toBuilder()
                .actionRequests(new ArrayList<>(step.getActionRequests()))
                .actionResults(new ArrayList<>(step.getActionResults()))
                .build();
    }

    private static ThreadItem copy(ThreadItem item) {
        return item.toBuilder()
                .parts(ReactionPartsSupport.copyParts(item.getParts()))
                .metadata(item.getMetadata() != null ? new LinkedHashMap<>(item.getMetadata()) : null)
                .build();
    }
}
