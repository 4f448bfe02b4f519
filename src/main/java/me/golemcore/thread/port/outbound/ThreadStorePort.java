package me.golemcore.thread.port.outbound;

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

import me.golemcore.thread.domain.model.ContextIdentifier;
import me.golemcore.thread.domain.model.ContextInitialization;
import me.golemcore.thread.domain.model.ExecutionOpening;
import me.golemcore.thread.domain.model.ExecutionStatus;
import me.golemcore.thread.domain.model.ReviewRequest;
import me.golemcore.thread.domain.model.StepUpdate;
import me.golemcore.thread.domain.model.StoredContext;
import me.golemcore.thread.domain.model.ThreadEnvironment;
import me.golemcore.thread.domain.model.ThreadExecution;
import me.golemcore.thread.domain.model.ThreadItem;
import me.golemcore.thread.domain.model.ThreadPart;
import me.golemcore.thread.domain.model.ThreadSnapshot;
import me.golemcore.thread.domain.model.ThreadStep;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence boundary of the loop controller. Each operation is atomic at the
 * granularity it names. Implementations validate every status change against
 * the transition contract.
 */
public interface ThreadStorePort {

    /**
     * Resolves an existing context or creates one (with its thread).
     *
     * @param identifier
     *            null creates a fresh context; an unknown key creates a context
     *            with that key; an unknown id is an error
     */
    ContextInitialization initializeContext(ThreadEnvironment environment, ContextIdentifier identifier);

    /**
     * Stores the trigger item and opens an execution in one step. The thread
     * moves to streaming, so a second concurrent turn on the same thread is
     * rejected, and a closed context is reopened.
     */
    ExecutionOpening saveTriggerAndCreateExecution(ThreadEnvironment environment, String contextId,
            ThreadItem trigger);

    ThreadStep createStep(ThreadEnvironment environment, String executionId, int iteration);

    StoredContext updateContextContent(ThreadEnvironment environment, String contextId,
            Map<String, Object> content);

    /**
     * Applies the non-null fields of {@code update} to a step.
     */
    ThreadStep updateStep(ThreadEnvironment environment, String stepId, StepUpdate update);

    void saveStepParts(ThreadEnvironment environment, String stepId, List<ThreadPart> parts);

    /**
     * Stores the turn's reaction item for the first time.
     *
     * @param reviewRequests
     *            actions of the first iteration that wait for approval
     */
    ThreadItem saveReactionItem(ThreadEnvironment environment, String contextId, ThreadItem item,
            String executionId, List<ReviewRequest> reviewRequests);

    ThreadItem updateItem(ThreadEnvironment environment, ThreadItem item);

    /**
     * Sets the execution's terminal status, closes the context and returns the
     * thread to idle.
     */
    ThreadExecution completeExecution(ThreadEnvironment environment, String contextId, String executionId,
            ExecutionStatus status);

    List<ThreadItem> listItems(ThreadEnvironment environment, String contextId);

    Optional<StoredContext> findContext(String contextId);

    Optional<ThreadExecution> findExecution(String executionId);

    List<ThreadStep> listSteps(String executionId);

    List<ThreadPart> listParts(String stepId);

    List<ReviewRequest> listReviewRequests(String itemId);

    Optional<ThreadSnapshot> findSnapshot(String threadKey);
}
