package me.golemcore.thread.adapter.outbound.store;

import me.golemcore.thread.domain.model.ContextIdentifier;
import me.golemcore.thread.domain.model.ContextInitialization;
import me.golemcore.thread.domain.model.ContextStatus;
import me.golemcore.thread.domain.model.ExecutionOpening;
import me.golemcore.thread.domain.model.ExecutionStatus;
import me.golemcore.thread.domain.model.InvalidTransitionException;
import me.golemcore.thread.domain.model.ItemStatus;
import me.golemcore.thread.domain.model.ItemType;
import me.golemcore.thread.domain.model.ReviewRequest;
import me.golemcore.thread.domain.model.StepStatus;
import me.golemcore.thread.domain.model.StepUpdate;
import me.golemcore.thread.domain.model.ThreadEnvironment;
import me.golemcore.thread.domain.model.ThreadItem;
import me.golemcore.thread.domain.model.ThreadPart;
import me.golemcore.thread.domain.model.ThreadSnapshot;
import me.golemcore.thread.domain.model.ThreadStatus;
import me.golemcore.thread.domain.model.ThreadStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryThreadStoreAdapterTest {

    private static final ThreadEnvironment ENV = ThreadEnvironment.of("org-1");

    private InMemoryThreadStoreAdapter store;

    @BeforeEach
    void setUp() {
        store = new InMemoryThreadStoreAdapter(Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    // ==================== contexts ====================

    @Test
    void shouldCreateContextAndThreadForNewKey() {
        ContextInitialization created = store.initializeContext(ENV, ContextIdentifier.byKey("support-42"));

        assertTrue(created.isNew());
        assertEquals(ContextStatus.OPEN, created.context().getStatus());
        assertEquals(ThreadStatus.IDLE, created.thread().getStatus());
        assertEquals("support-42", created.thread().getKey());
        assertEquals(created.thread().getId(), created.context().getThreadId());
    }

    @Test
    void shouldResolveExistingContextByKeyAndId() {
        ContextInitialization created = store.initializeContext(ENV, ContextIdentifier.byKey("k"));

        ContextInitialization byKey = store.initializeContext(ENV, ContextIdentifier.byKey("k"));
        ContextInitialization byId = store.initializeContext(ENV,
                ContextIdentifier.byId(created.context().getId()));

        assertFalse(byKey.isNew());
        assertFalse(byId.isNew());
        assertEquals(created.context().getId(), byKey.context().getId());
        assertEquals(created.thread().getId(), byId.thread().getId());
    }

    @Test
    void shouldRejectUnknownContextId() {
        assertThrows(IllegalArgumentException.class,
                () -> store.initializeContext(ENV, ContextIdentifier.byId("nope")));
    }

    @Test
    void shouldCreateAnonymousContextWhenIdentifierMissing() {
        ContextInitialization first = store.initializeContext(ENV, null);
        ContextInitialization second = store.initializeContext(ENV, null);

        assertTrue(first.isNew());
        assertNotEquals(first.context().getId(), second.context().getId());
    }

    // ==================== executions ====================

    @Test
    void shouldOpenExecutionAndMarkThreadStreaming() {
        String contextId = store.initializeContext(ENV, ContextIdentifier.byKey("k")).context().getId();

        ExecutionOpening opening = store.saveTriggerAndCreateExecution(ENV, contextId, trigger("t1"));

        assertEquals("t1", opening.triggerItemId());
        assertEquals(ExecutionStatus.EXECUTING, store.findExecution(opening.executionId()).orElseThrow().getStatus());
        assertEquals(ThreadStatus.STREAMING, store.findSnapshot("k").orElseThrow().thread().getStatus());
        assertEquals(List.of("t1"), store.listItems(ENV, contextId).stream().map(ThreadItem::getId).toList());
    }

    @Test
    void shouldRejectSecondExecutionWhileStreaming() {
        String contextId = store.initializeContext(ENV, ContextIdentifier.byKey("k")).context().getId();
        store.saveTriggerAndCreateExecution(ENV, contextId, trigger("t1"));

        assertThrows(InvalidTransitionException.class,
                () -> store.saveTriggerAndCreateExecution(ENV, contextId, trigger("t2")));
    }

    @Test
    void shouldCloseContextOnCompletionAndReopenOnNextTrigger() {
        String contextId = store.initializeContext(ENV, ContextIdentifier.byKey("k")).context().getId();
        ExecutionOpening opening = store.saveTriggerAndCreateExecution(ENV, contextId, trigger("t1"));

        store.completeExecution(ENV, contextId, opening.executionId(), ExecutionStatus.COMPLETED);
        ThreadSnapshot closed = store.findSnapshot("k").orElseThrow();
        store.saveTriggerAndCreateExecution(ENV, contextId, trigger("t2"));
        ThreadSnapshot reopened = store.findSnapshot("k").orElseThrow();

        assertEquals(ContextStatus.CLOSED, closed.context().getStatus());
        assertEquals(ThreadStatus.IDLE, closed.thread().getStatus());
        assertEquals(ContextStatus.OPEN, reopened.context().getStatus());
        assertEquals(ThreadStatus.STREAMING, reopened.thread().getStatus());
    }

    @Test
    void shouldNotCompleteExecutionTwice() {
        String contextId = store.initializeContext(ENV, ContextIdentifier.byKey("k")).context().getId();
        ExecutionOpening opening = store.saveTriggerAndCreateExecution(ENV, contextId, trigger("t1"));
        store.completeExecution(ENV, contextId, opening.executionId(), ExecutionStatus.FAILED);

        assertThrows(InvalidTransitionException.class,
                () -> store.completeExecution(ENV, contextId, opening.executionId(), ExecutionStatus.COMPLETED));
    }

    // ==================== steps and parts ====================

    @Test
    void shouldRecordStepOutcomeAndGuardStatus() {
        String contextId = store.initializeContext(ENV, ContextIdentifier.byKey("k")).context().getId();
        ExecutionOpening opening = store.saveTriggerAndCreateExecution(ENV, contextId, trigger("t1"));
        ThreadStep step = store.createStep(ENV, opening.executionId(), 0);

        store.updateStep(ENV, step.getId(), StepUpdate.builder()
                .status(StepStatus.COMPLETED)
                .actionName("lookup")
                .continueLoop(false)
                .build());

        ThreadStep stored = store.listSteps(opening.executionId()).get(0);
        assertEquals(StepStatus.COMPLETED, stored.getStatus());
        assertEquals("lookup", stored.getActionName());
        assertEquals(Boolean.FALSE, stored.getContinueLoop());
        assertThrows(InvalidTransitionException.class, () -> store.updateStep(ENV, step.getId(),
                StepUpdate.builder().status(StepStatus.FAILED).build()));
    }

    @Test
    void shouldKeepFirstWriteOfEachPartKey() {
        String contextId = store.initializeContext(ENV, ContextIdentifier.byKey("k")).context().getId();
        ExecutionOpening opening = store.saveTriggerAndCreateExecution(ENV, contextId, trigger("t1"));
        ThreadStep step = store.createStep(ENV, opening.executionId(), 0);

        store.saveStepParts(ENV, step.getId(), List.of(ThreadPart.of(step.getId(), 0, ThreadItem.textPart("a"))));
        store.saveStepParts(ENV, step.getId(), List.of(
                ThreadPart.of(step.getId(), 0, ThreadItem.textPart("changed")),
                ThreadPart.of(step.getId(), 1, ThreadItem.textPart("b"))));

        List<ThreadPart> parts = store.listParts(step.getId());
        assertEquals(2, parts.size());
        assertEquals("a", parts.get(0).payload().get("text"));
        assertEquals(step.getId() + ":1", parts.get(1).key());
    }

    @Test
    void shouldRejectPartsOfAnotherStep() {
        String contextId = store.initializeContext(ENV, ContextIdentifier.byKey("k")).context().getId();
        ExecutionOpening opening = store.saveTriggerAndCreateExecution(ENV, contextId, trigger("t1"));
        ThreadStep step = store.createStep(ENV, opening.executionId(), 0);

        assertThrows(IllegalArgumentException.class, () -> store.saveStepParts(ENV, step.getId(),
                List.of(ThreadPart.of("other", 0, ThreadItem.textPart("a")))));
    }

    // ==================== items ====================

    @Test
    void shouldSaveReactionItemWithReviewRequestsAndGuardStatus() {
        String contextId = store.initializeContext(ENV, ContextIdentifier.byKey("k")).context().getId();
        ExecutionOpening opening = store.saveTriggerAndCreateExecution(ENV, contextId, trigger("t1"));
        ThreadItem reaction = ThreadItem.builder()
                .id(opening.reactionItemId())
                .type(ItemType.OUTPUT)
                .status(ItemStatus.PENDING)
                .parts(List.of(ThreadItem.textPart("working")))
                .build();

        store.saveReactionItem(ENV, contextId, reaction, opening.executionId(),
                List.of(new ReviewRequest("call_0_0", "deploy")));
        store.updateItem(ENV, reaction.toBuilder().status(ItemStatus.COMPLETED).build());

        assertEquals(List.of(new ReviewRequest("call_0_0", "deploy")),
                store.listReviewRequests(opening.reactionItemId()));
        assertEquals(2, store.listItems(ENV, contextId).size());
        assertThrows(InvalidTransitionException.class,
                () -> store.updateItem(ENV, reaction.toBuilder().status(ItemStatus.PENDING).build()));
    }

    @Test
    void shouldRejectForeignReactionItem() {
        String contextId = store.initializeContext(ENV, ContextIdentifier.byKey("k")).context().getId();
        ExecutionOpening opening = store.saveTriggerAndCreateExecution(ENV, contextId, trigger("t1"));
        ThreadItem foreign = ThreadItem.builder().id("someone-else").status(ItemStatus.PENDING).build();

        assertThrows(IllegalArgumentException.class,
                () -> store.saveReactionItem(ENV, contextId, foreign, opening.executionId(), List.of()));
    }

    @Test
    void shouldReturnCopiesNotLiveState() {
        String contextId = store.initializeContext(ENV, ContextIdentifier.byKey("k")).context().getId();
        store.saveTriggerAndCreateExecution(ENV, contextId, trigger("t1"));

        store.listItems(ENV, contextId).get(0).getParts().add(Map.of("type", "text", "text", "injected"));

        assertEquals(1, store.listItems(ENV, contextId).get(0).getParts().size());
    }

    private static ThreadItem trigger(String id) {
        return ThreadItem.builder()
                .id(id)
                .type(ItemType.INPUT)
                .status(ItemStatus.STORED)
                .parts(List.of(ThreadItem.textPart("hello")))
                .build();
    }
}
