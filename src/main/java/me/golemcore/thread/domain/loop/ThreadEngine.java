package me.golemcore.thread.domain.loop;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.thread.domain.component.ActionComponent;
import me.golemcore.thread.domain.component.ThreadDefinition;
import me.golemcore.thread.domain.component.ThreadReactor;
import me.golemcore.thread.domain.model.ActionInvocation;
import me.golemcore.thread.domain.model.ActionRequest;
import me.golemcore.thread.domain.model.ActionResult;
import me.golemcore.thread.domain.model.ContextInitialization;
import me.golemcore.thread.domain.model.ContextStatus;
import me.golemcore.thread.domain.model.ContinuationRequest;
import me.golemcore.thread.domain.model.ExecutionOpening;
import me.golemcore.thread.domain.model.ExecutionStatus;
import me.golemcore.thread.domain.model.ItemChannel;
import me.golemcore.thread.domain.model.ItemStatus;
import me.golemcore.thread.domain.model.ItemType;
import me.golemcore.thread.domain.model.IterationBudgetExhaustedException;
import me.golemcore.thread.domain.model.ReactRequest;
import me.golemcore.thread.domain.model.ReactorRequest;
import me.golemcore.thread.domain.model.ReactorResult;
import me.golemcore.thread.domain.model.ReviewRequest;
import me.golemcore.thread.domain.model.StepKind;
import me.golemcore.thread.domain.model.StepStatus;
import me.golemcore.thread.domain.model.StepUpdate;
import me.golemcore.thread.domain.model.StoredContext;
import me.golemcore.thread.domain.model.StreamEventType;
import me.golemcore.thread.domain.model.ThreadEnvironment;
import me.golemcore.thread.domain.model.ThreadItem;
import me.golemcore.thread.domain.model.ThreadOptions;
import me.golemcore.thread.domain.model.ThreadPart;
import me.golemcore.thread.domain.model.ThreadStatus;
import me.golemcore.thread.domain.model.ThreadStep;
import me.golemcore.thread.domain.model.ThreadStreamEvent;
import me.golemcore.thread.domain.model.TurnResult;
import me.golemcore.thread.domain.service.ActionExecutionService;
import me.golemcore.thread.domain.service.ChunkSequencer;
import me.golemcore.thread.domain.service.EffectIds;
import me.golemcore.thread.domain.service.PartPreviewSupport;
import me.golemcore.thread.domain.service.ProducerChunkMapper.ChunkOrigin;
import me.golemcore.thread.domain.service.ReactionPartsSupport;
import me.golemcore.thread.domain.service.StreamEventCodec;
import me.golemcore.thread.domain.service.StreamEventEmitter;
import me.golemcore.thread.domain.service.TransitionContract;
import me.golemcore.thread.infrastructure.config.ThreadProperties;
import me.golemcore.thread.port.outbound.EffectJournalPort;
import me.golemcore.thread.port.outbound.StreamSink;
import me.golemcore.thread.port.outbound.StreamSinkPort;
import me.golemcore.thread.port.outbound.ThreadStorePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Loop controller that runs one turn of a thread.
 *
 * <p>
 * A turn resolves the context, stores the trigger and opens an execution, then
 * iterates: create a step, rebuild context content, invoke the reactor, merge
 * its fragment into the turn's single reaction item, execute requested
 * actions, and ask the definition whether to go on. The turn ends when an
 * iteration without actions is allowed to finish or the continuation policy
 * declines; running out of iterations is fatal.
 *
 * <p>
 * Every status change is checked against {@link TransitionContract} before it
 * is written. Store writes, reactor calls and action executions run through
 * the {@link EffectJournalPort} under ids derived from the trigger item, so
 * replaying a trigger does not repeat completed I/O.
 *
 * <p>
 * On failure the current step, the execution, the context and the thread are
 * marked best-effort and the original exception is rethrown.
 */
@Component
@Slf4j
public class ThreadEngine {

    private static final String FINISH_CHUNK = "finish";

    private final ThreadStorePort store;
    private final EffectJournalPort effectJournal;
    private final StreamSinkPort streamSinkPort;
    private final StreamEventCodec codec;
    private final ChunkSequencer sequencer;
    private final ActionExecutionService actionExecutionService;
    private final ThreadReactor defaultReactor;
    private final ThreadProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ThreadEngine(ThreadStorePort store, EffectJournalPort effectJournal, StreamSinkPort streamSinkPort,
            StreamEventCodec codec, ChunkSequencer sequencer, ActionExecutionService actionExecutionService,
            ThreadReactor defaultReactor, ThreadProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.effectJournal = effectJournal;
        this.streamSinkPort = streamSinkPort;
        this.codec = codec;
        this.sequencer = sequencer;
        this.actionExecutionService = actionExecutionService;
        this.defaultReactor = defaultReactor;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public TurnResult react(ReactRequest request) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(request.getDefinition(), "definition");
        Objects.requireNonNull(request.getTrigger(), "trigger");

        Turn turn = new Turn();
        turn.definition = request.getDefinition();
        turn.environment = request.getEnvironment() != null
                ? request.getEnvironment()
                : ThreadEnvironment.of(null);
        turn.options = resolveOptions(request.getOptions());
        turn.reactor = turn.definition.getReactor() != null ? turn.definition.getReactor() : defaultReactor;
        turn.trigger = prepareTrigger(request.getTrigger());

        ContextInitialization initialization = effect(turn, "initialize-context",
                () -> store.initializeContext(turn.environment, request.getContext()));
        turn.context = initialization.context();
        turn.contextId = initialization.context().getId();
        turn.threadId = initialization.thread().getId();
        turn.contextStatus = initialization.context().getStatus();
        turn.threadStatus = initialization.thread().getStatus();
        turn.stream = openStream(request.getSink(), turn.options, turn.contextId);

        log.info("[Thread] Turn started: context={}, thread={}, trigger={}", turn.contextId, turn.threadId,
                turn.trigger.getId());

        emit(turn, event(initialization.isNew() ? StreamEventType.CONTEXT_CREATED : StreamEventType.CONTEXT_RESOLVED)
                .contextId(turn.contextId)
                .threadId(turn.threadId)
                .status(turn.contextStatus.getValue()));
        emit(turn, event(initialization.isNew() ? StreamEventType.THREAD_CREATED : StreamEventType.THREAD_RESOLVED)
                .threadId(turn.threadId)
                .status(turn.threadStatus.getValue()));
        if (initialization.isNew()) {
            turn.definition.onContextCreated(turn.environment, turn.context);
        }

        try {
            openExecution(turn);
            for (int iteration = 0; iteration < turn.options.maxIterations(); iteration++) {
                if (runIteration(turn, iteration)) {
                    return finish(turn);
                }
            }
            throw new IterationBudgetExhaustedException(turn.options.maxIterations());
        } catch (RuntimeException e) {
            fail(turn, e);
            throw e;
        }
    }

    // ==================== Opening ====================

    private void openExecution(Turn turn) {
        ExecutionOpening opening = effect(turn, "open-execution",
                () -> store.saveTriggerAndCreateExecution(turn.environment, turn.contextId, turn.trigger));
        turn.threadStatus = advance(turn.threadStatus, ThreadStatus.STREAMING);
        if (turn.contextStatus == ContextStatus.CLOSED) {
            turn.contextStatus = advance(turn.contextStatus, ContextStatus.OPEN);
        }
        turn.executionId = opening.executionId();
        turn.reactionItemId = opening.reactionItemId();
        turn.executionStatus = ExecutionStatus.EXECUTING;

        emit(turn, event(StreamEventType.ITEM_CREATED)
                .itemId(opening.triggerItemId())
                .contextId(turn.contextId)
                .threadId(turn.threadId)
                .executionId(turn.executionId)
                .itemType(ItemType.INPUT.getValue())
                .status(ItemStatus.STORED.getValue()));
        turn.definition.onItemCreated(turn.environment, turn.trigger);
        emit(turn, event(StreamEventType.THREAD_STREAMING_STARTED)
                .threadId(turn.threadId)
                .status(turn.threadStatus.getValue()));
        emit(turn, event(StreamEventType.EXECUTION_CREATED)
                .executionId(turn.executionId)
                .contextId(turn.contextId)
                .threadId(turn.threadId)
                .status(turn.executionStatus.getValue()));
    }

    // ==================== Iteration ====================

    /**
     * Runs one iteration.
     *
     * @return true when the turn should finalize
     */
    private boolean runIteration(Turn turn, int iteration) {
        ThreadStep step = effect(turn, "create-step", iteration,
                () -> store.createStep(turn.environment, turn.executionId, iteration));
        turn.stepId = step.getId();
        turn.iteration = iteration;
        turn.stepStatus = StepStatus.RUNNING;
        emit(turn, event(StreamEventType.STEP_CREATED)
                .stepId(turn.stepId)
                .executionId(turn.executionId)
                .iteration(iteration)
                .status(turn.stepStatus.getValue()));

        rebuildContext(turn, iteration);

        String systemPrompt = turn.definition.buildSystemPrompt(turn.environment, turn.context);
        List<ActionComponent> actions = turn.definition.buildActions(turn.environment, turn.context);
        List<ActionComponent> availableActions = actions != null ? actions : List.of();

        ReactorResult result = invokeReactor(turn, iteration, systemPrompt, availableActions);
        List<ThreadPart> stepParts = saveParts(turn, iteration, result);
        mergeFragment(turn, iteration, result, availableActions);

        List<ActionRequest> requests = result.hasActionRequests() ? result.getActionRequests() : List.of();
        StepKind kind = requests.isEmpty() ? StepKind.MESSAGE : StepKind.ACTION_EXECUTE;
        ActionRequest firstRequest = requests.isEmpty() ? null : requests.get(0);
        effect(turn, "step-kind", iteration, () -> store.updateStep(turn.environment, turn.stepId,
                StepUpdate.builder()
                        .kind(kind)
                        .actionName(firstRequest != null ? firstRequest.actionName() : null)
                        .actionInput(firstRequest != null ? firstRequest.input() : null)
                        .build()));
        turn.stepKind = kind;
        emit(turn, event(StreamEventType.STEP_UPDATED)
                .stepId(turn.stepId)
                .executionId(turn.executionId)
                .iteration(iteration)
                .kind(kind.getValue())
                .actionName(firstRequest != null ? firstRequest.actionName() : null));

        if (requests.isEmpty()) {
            ContinuationRequest endRequest = continuation(turn, result, List.of(), List.of());
            if (turn.definition.onEnd(endRequest)) {
                completeStep(turn, iteration, List.of(), List.of(), false);
                return true;
            }
            log.debug("[Thread] End vetoed at iteration {}, continuing without actions", iteration);
        }

        List<ActionResult> results = executeActions(turn, iteration, requests, availableActions, result,
                stepParts);

        ContinuationRequest continuationRequest = continuation(turn, result, requests, results);
        boolean continueLoop = turn.definition.shouldContinue(continuationRequest);
        completeStep(turn, iteration, requests, results, continueLoop);

        if (!continueLoop) {
            return true;
        }

        ThreadItem pending = turn.reactionItem.toBuilder().status(ItemStatus.PENDING).build();
        turn.reactionItem = effect(turn, "reaction-pending", iteration,
                () -> store.updateItem(turn.environment, pending));
        emit(turn, event(StreamEventType.ITEM_UPDATED)
                .itemId(turn.reactionItemId)
                .contextId(turn.contextId)
                .threadId(turn.threadId)
                .executionId(turn.executionId)
                .status(turn.reactionStatus.getValue()));
        return false;
    }

    private void rebuildContext(Turn turn, int iteration) {
        Map<String, Object> content = turn.definition.initialize(turn.environment, turn.context, turn.trigger);
        Map<String, Object> nextContent = content != null ? content : new LinkedHashMap<>();
        turn.context = effect(turn, "update-context", iteration,
                () -> store.updateContextContent(turn.environment, turn.contextId, nextContent));
        emit(turn, event(StreamEventType.CONTEXT_CONTENT_UPDATED)
                .contextId(turn.contextId)
                .threadId(turn.threadId));
        turn.definition.onContextUpdated(turn.environment, turn.context);
    }

    private ReactorResult invokeReactor(Turn turn, int iteration, String systemPrompt,
            List<ActionComponent> actions) {
        List<ThreadItem> history = turn.definition.expandItems(turn.environment, turn.context,
                store.listItems(turn.environment, turn.contextId));
        turn.origin = new ChunkOrigin(turn.contextId, turn.executionId, turn.stepId, turn.reactionItemId,
                turn.reactor.getProvider());

        boolean sendStart = !turn.startSent;
        turn.startSent = true;
        ReactorRequest reactorRequest = ReactorRequest.builder()
                .environment(turn.environment)
                .context(turn.context)
                .trigger(turn.trigger)
                .history(history != null ? history : List.of())
                .systemPrompt(systemPrompt)
                .actions(actions.stream().map(ActionComponent::getDefinition).toList())
                .iteration(iteration)
                .maxModelSteps(turn.options.maxModelSteps())
                .executionId(turn.executionId)
                .stepId(turn.stepId)
                .chunks(turn.stream.chunkEmitter(turn.origin))
                .silent(turn.options.silent())
                .sendStart(sendStart)
                .build();

        ReactorResult result = effect(turn, "react", iteration, () -> turn.reactor.react(reactorRequest));
        if (result == null) {
            throw new IllegalStateException("Reactor returned no result at iteration " + iteration);
        }
        return result;
    }

    private List<ThreadPart> saveParts(Turn turn, int iteration, ReactorResult result) {
        List<Map<String, Object>> fragmentParts = result.fragmentParts();
        List<ThreadPart> parts = new ArrayList<>(fragmentParts.size());
        for (int idx = 0; idx < fragmentParts.size(); idx++) {
            parts.add(ThreadPart.of(turn.stepId, idx, fragmentParts.get(idx)));
        }
        effect(turn, "save-parts", iteration, () -> {
            store.saveStepParts(turn.environment, turn.stepId, parts);
            return Boolean.TRUE;
        });
        for (ThreadPart part : parts) {
            emitPartEvent(turn, StreamEventType.PART_CREATED, part.key(), part.idx(), part.payload());
        }
        return parts;
    }

    private void mergeFragment(Turn turn, int iteration, ReactorResult result, List<ActionComponent> actions) {
        List<Map<String, Object>> fragmentParts = ReactionPartsSupport.copyParts(result.fragmentParts());

        if (turn.reactionItem == null) {
            ThreadItem item = ThreadItem.builder()
                    .id(turn.reactionItemId)
                    .type(ItemType.OUTPUT)
                    .channel(turn.trigger.getChannel())
                    .status(ItemStatus.PENDING)
                    .parts(fragmentParts)
                    .createdAt(clock.instant())
                    .build();
            List<ReviewRequest> reviewRequests = ReactionPartsSupport.reviewRequests(result.getActionRequests(),
                    actions);
            turn.reactionItem = effect(turn, "save-reaction", iteration,
                    () -> store.saveReactionItem(turn.environment, turn.contextId, item, turn.executionId,
                            reviewRequests));
            turn.reactionStatus = ItemStatus.PENDING;
            emit(turn, event(StreamEventType.ITEM_CREATED)
                    .itemId(turn.reactionItemId)
                    .contextId(turn.contextId)
                    .threadId(turn.threadId)
                    .executionId(turn.executionId)
                    .itemType(ItemType.OUTPUT.getValue())
                    .status(turn.reactionStatus.getValue()));
            turn.definition.onItemCreated(turn.environment, turn.reactionItem);
            return;
        }

        List<Map<String, Object>> merged = ReactionPartsSupport.copyParts(turn.reactionItem.getParts());
        merged.addAll(fragmentParts);
        ThreadItem appended = turn.reactionItem.toBuilder().parts(merged).status(turn.reactionStatus).build();
        turn.reactionItem = effect(turn, "append-reaction", iteration,
                () -> store.updateItem(turn.environment, appended));
        emit(turn, event(StreamEventType.ITEM_UPDATED)
                .itemId(turn.reactionItemId)
                .contextId(turn.contextId)
                .threadId(turn.threadId)
                .executionId(turn.executionId)
                .status(turn.reactionStatus.getValue()));
    }

    private List<ActionResult> executeActions(Turn turn, int iteration, List<ActionRequest> requests,
            List<ActionComponent> actions, ReactorResult result, List<ThreadPart> stepParts) {
        if (requests.isEmpty()) {
            return List.of();
        }

        ActionInvocation invocation = ActionInvocation.builder()
                .executionId(turn.executionId)
                .contextId(turn.contextId)
                .triggerItemId(turn.trigger.getId())
                .reactionItemId(turn.reactionItemId)
                .iteration(iteration)
                .promptMessages(result.getPromptMessages())
                .environment(turn.environment)
                .build();

        log.debug("[Thread] Executing {} action(s) at iteration {}", requests.size(), iteration);
        List<ActionResult> results = actionExecutionService.executeAll(requests, actions, invocation);

        List<Map<String, Object>> parts = ReactionPartsSupport.copyParts(turn.reactionItem.getParts());
        for (ActionResult actionResult : results) {
            int index = ReactionPartsSupport.mergeActionResult(parts, actionResult);
            turn.definition.onActionExecuted(turn.environment, actionResult);
            publishActionOutcome(turn, actionResult);

            String actionRef = actionResult.getActionRequest().actionRef();
            for (ThreadPart stepPart : stepParts) {
                if (actionRef != null && actionRef.equals(stepPart.payload().get("toolCallId"))) {
                    emitPartEvent(turn, StreamEventType.PART_UPDATED, stepPart.key(), stepPart.idx(),
                            parts.get(index));
                }
            }
        }

        ThreadItem merged = turn.reactionItem.toBuilder().parts(parts).build();
        turn.reactionItem = effect(turn, "merge-results", iteration,
                () -> store.updateItem(turn.environment, merged));
        emit(turn, event(StreamEventType.ITEM_UPDATED)
                .itemId(turn.reactionItemId)
                .contextId(turn.contextId)
                .threadId(turn.threadId)
                .executionId(turn.executionId)
                .status(turn.reactionStatus.getValue()));
        return results;
    }

    private void publishActionOutcome(Turn turn, ActionResult actionResult) {
        Map<String, Object> chunk = new LinkedHashMap<>();
        chunk.put("toolCallId", actionResult.getActionRequest().actionRef());
        chunk.put("toolName", actionResult.getActionRequest().actionName());
        if (actionResult.isSuccess()) {
            chunk.put("type", "tool-output-available");
            chunk.put("output", actionResult.getOutput());
        } else {
            chunk.put("type", "tool-output-error");
            chunk.put("errorText", actionResult.getErrorText());
        }
        turn.stream.emitChunk(chunk, turn.origin);
    }

    private void completeStep(Turn turn, int iteration, List<ActionRequest> requests, List<ActionResult> results,
            boolean continueLoop) {
        StepStatus completed = advance(turn.stepStatus, StepStatus.COMPLETED);
        ActionRequest firstRequest = requests.isEmpty() ? null : requests.get(0);
        ActionResult firstResult = results.isEmpty() ? null : results.get(0);
        StepUpdate outcome = StepUpdate.builder()
                .status(StepStatus.COMPLETED)
                .kind(turn.stepKind)
                .actionName(firstRequest != null ? firstRequest.actionName() : null)
                .actionInput(firstRequest != null ? firstRequest.input() : null)
                .actionOutput(firstResult != null && firstResult.isSuccess() ? firstResult.getOutput() : null)
                .actionError(firstResult != null && !firstResult.isSuccess() ? firstResult.getErrorText() : null)
                .actionRequests(requests)
                .actionResults(results)
                .continueLoop(continueLoop)
                .build();
        effect(turn, "step-outcome", iteration, () -> store.updateStep(turn.environment, turn.stepId, outcome));
        // only after the write, so a failed write leaves the step for fail() to mark
        turn.stepStatus = completed;

        emit(turn, event(StreamEventType.STEP_UPDATED)
                .stepId(turn.stepId)
                .executionId(turn.executionId)
                .iteration(iteration)
                .kind(turn.stepKind.getValue())
                .actionName(firstRequest != null ? firstRequest.actionName() : null)
                .status(turn.stepStatus.getValue()));
        emit(turn, event(StreamEventType.STEP_COMPLETED)
                .stepId(turn.stepId)
                .executionId(turn.executionId)
                .iteration(iteration)
                .status(turn.stepStatus.getValue()));
    }

    private ContinuationRequest continuation(Turn turn, ReactorResult result, List<ActionRequest> requests,
            List<ActionResult> results) {
        return ContinuationRequest.builder()
                .environment(turn.environment)
                .context(turn.context)
                .iteration(turn.iteration)
                .reactionItem(turn.reactionItem)
                .fragment(result.getFragment())
                .actionRequests(requests)
                .actionResults(results)
                .build();
    }

    // ==================== Ending ====================

    private TurnResult finish(Turn turn) {
        ItemStatus reactionStatus = advance(turn.reactionStatus, ItemStatus.COMPLETED);
        ThreadItem completed = turn.reactionItem.toBuilder().status(reactionStatus).build();
        turn.reactionItem = effect(turn, "reaction-completed", () -> store.updateItem(turn.environment, completed));
        turn.reactionStatus = reactionStatus;
        emit(turn, event(StreamEventType.ITEM_COMPLETED)
                .itemId(turn.reactionItemId)
                .contextId(turn.contextId)
                .threadId(turn.threadId)
                .executionId(turn.executionId)
                .status(turn.reactionStatus.getValue()));

        closeExecution(turn, ExecutionStatus.COMPLETED, true);

        turn.stream.emitChunk(Map.of("type", FINISH_CHUNK), turn.origin);
        turn.stream.close(turn.options.sendFinish(), turn.options.preventClose());

        log.info("[Thread] Turn completed: context={}, execution={}, iterations={}", turn.contextId,
                turn.executionId, turn.iteration + 1);
        StoredContext context = turn.context.toBuilder().status(turn.contextStatus).build();
        return new TurnResult(turn.contextId, context, turn.trigger.getId(), turn.reactionItemId,
                turn.executionId);
    }

    private void closeExecution(Turn turn, ExecutionStatus status, boolean journaled) {
        ExecutionStatus closed = advance(turn.executionStatus, status);
        if (journaled) {
            effect(turn, "complete-execution",
                    () -> store.completeExecution(turn.environment, turn.contextId, turn.executionId, status));
        } else {
            store.completeExecution(turn.environment, turn.contextId, turn.executionId, status);
        }
        // still EXECUTING when the write above throws, so fail() closes it as failed
        turn.executionStatus = closed;
        turn.contextStatus = advance(turn.contextStatus, ContextStatus.CLOSED);
        turn.threadStatus = advance(turn.threadStatus, ThreadStatus.IDLE);

        emit(turn, event(status == ExecutionStatus.COMPLETED
                ? StreamEventType.EXECUTION_COMPLETED
                : StreamEventType.EXECUTION_FAILED)
                .executionId(turn.executionId)
                .contextId(turn.contextId)
                .threadId(turn.threadId)
                .status(turn.executionStatus.getValue()));
        emit(turn, event(StreamEventType.CONTEXT_CLOSED)
                .contextId(turn.contextId)
                .threadId(turn.threadId)
                .status(turn.contextStatus.getValue()));
        emit(turn, event(StreamEventType.THREAD_IDLE)
                .threadId(turn.threadId)
                .status(turn.threadStatus.getValue()));
    }

    private void fail(Turn turn, RuntimeException error) {
        log.error("[Thread] Turn failed: context={}, execution={}, step={}: {}", turn.contextId, turn.executionId,
                turn.stepId, error.getMessage(), error);
        String errorText = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();

        if (turn.stepId != null && turn.stepStatus == StepStatus.RUNNING) {
            try {
                store.updateStep(turn.environment, turn.stepId,
                        StepUpdate.builder().status(StepStatus.FAILED).errorText(errorText).build());
                turn.stepStatus = StepStatus.FAILED;
                emit(turn, event(StreamEventType.STEP_FAILED)
                        .stepId(turn.stepId)
                        .executionId(turn.executionId)
                        .iteration(turn.iteration)
                        .status(turn.stepStatus.getValue())
                        .errorText(errorText));
            } catch (RuntimeException secondary) { // NOSONAR - must not mask the original error
                log.warn("[Thread] Failed to mark step {} failed: {}", turn.stepId, secondary.getMessage());
            }
        }

        if (turn.executionStatus == ExecutionStatus.EXECUTING) {
            try {
                closeExecution(turn, ExecutionStatus.FAILED, false);
            } catch (RuntimeException secondary) { // NOSONAR - must not mask the original error
                log.warn("[Thread] Failed to mark execution {} failed: {}", turn.executionId,
                        secondary.getMessage());
            }
        }

        try {
            turn.stream.close(turn.options.sendFinish(), turn.options.preventClose());
        } catch (RuntimeException secondary) { // NOSONAR - must not mask the original error
            log.warn("[Thread] Failed to close stream for context {}: {}", turn.contextId, secondary.getMessage());
        }
    }

    // ==================== Support ====================

    private StreamEventEmitter openStream(StreamSink sink, Options options, String contextId) {
        if (options.silent()) {
            return StreamEventEmitter.silent(codec, sequencer, clock);
        }
        StreamSink target = sink != null ? sink : streamSinkPort.openContextStream(contextId);
        return new StreamEventEmitter(target, codec, sequencer, clock,
                properties.getStream().getMaxRawStringChars());
    }

    private ThreadItem prepareTrigger(ThreadItem trigger) {
        return trigger.toBuilder()
                .id(trigger.getId() != null ? trigger.getId() : UUID.randomUUID().toString())
                .type(ItemType.INPUT)
                .status(ItemStatus.STORED)
                .channel(trigger.getChannel() != null ? trigger.getChannel() : ItemChannel.WEB)
                .createdAt(trigger.getCreatedAt() != null ? trigger.getCreatedAt() : clock.instant())
                .build();
    }

    private Options resolveOptions(ThreadOptions options) {
        ThreadProperties.LoopProperties loop = properties.getLoop();
        ThreadOptions source = options != null ? options : ThreadOptions.defaults();
        int maxIterations = source.getMaxIterations() != null ? source.getMaxIterations() : loop.getMaxIterations();
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        return new Options(
                maxIterations,
                source.getMaxModelSteps() != null ? source.getMaxModelSteps() : loop.getMaxModelSteps(),
                source.getPreventClose() != null ? source.getPreventClose() : loop.isPreventClose(),
                source.getSendFinish() != null ? source.getSendFinish() : loop.isSendFinish(),
                source.getSilent() != null ? source.getSilent() : loop.isSilent());
    }

    private ThreadStreamEvent.ThreadStreamEventBuilder event(StreamEventType type) {
        return ThreadStreamEvent.builder().type(type).at(clock.instant().toString());
    }

    private void emit(Turn turn, ThreadStreamEvent.ThreadStreamEventBuilder builder) {
        turn.stream.emit(builder.build());
    }

    private void emitPartEvent(Turn turn, StreamEventType type, String partKey, int idx, Map<String, Object> part) {
        PartPreviewSupport.PartPreview preview = PartPreviewSupport.summarize(part,
                properties.getStream().getPreviewChars(), objectMapper);
        emit(turn, event(type)
                .partKey(partKey)
                .stepId(turn.stepId)
                .idx(idx)
                .partType(part.get(ThreadItem.PART_TYPE) instanceof String partType ? partType : null)
                .partPreview(preview.preview())
                .partState(preview.state())
                .partToolCallId(preview.toolCallId()));
    }

    private <T> T effect(Turn turn, String operation, Supplier<T> supplier) {
        return effectJournal.run(EffectIds.of(turn.trigger.getId(), operation), supplier);
    }

    private <T> T effect(Turn turn, String operation, int iteration, Supplier<T> supplier) {
        return effectJournal.run(EffectIds.of(turn.trigger.getId(), operation, iteration), supplier);
    }

    private static ThreadStatus advance(ThreadStatus from, ThreadStatus to) {
        TransitionContract.assertTransition(from, to);
        return to;
    }

    private static ContextStatus advance(ContextStatus from, ContextStatus to) {
        TransitionContract.assertTransition(from, to);
        return to;
    }

    private static ExecutionStatus advance(ExecutionStatus from, ExecutionStatus to) {
        TransitionContract.assertTransition(from, to);
        return to;
    }

    private static StepStatus advance(StepStatus from, StepStatus to) {
        TransitionContract.assertTransition(from, to);
        return to;
    }

    private static ItemStatus advance(ItemStatus from, ItemStatus to) {
        TransitionContract.assertTransition(from, to);
        return to;
    }

    private record Options(int maxIterations, int maxModelSteps, boolean preventClose, boolean sendFinish,
            boolean silent) {
    }

    /**
     * Mutable state of the turn in progress. Confined to the calling thread.
     */
    private static final class Turn {
        private ThreadDefinition definition;
        private ThreadEnvironment environment;
        private Options options;
        private ThreadReactor reactor;
        private ThreadItem trigger;
        private StreamEventEmitter stream;
        private ChunkOrigin origin;

        private String contextId;
        private String threadId;
        private String executionId;
        private String reactionItemId;
        private String stepId;
        private int iteration;
        private boolean startSent;

        private StoredContext context;
        private ThreadItem reactionItem;
        private StepKind stepKind;

        private ContextStatus contextStatus;
        private ThreadStatus threadStatus;
        private ExecutionStatus executionStatus;
        private StepStatus stepStatus;
        private ItemStatus reactionStatus;
    }
}
