package me.golemcore.thread.domain.service;

import me.golemcore.thread.adapter.outbound.effect.InMemoryEffectJournalAdapter;
import me.golemcore.thread.domain.component.ActionComponent;
import me.golemcore.thread.domain.component.RecordingAction;
import me.golemcore.thread.domain.model.ActionFailureKind;
import me.golemcore.thread.domain.model.ActionInvocation;
import me.golemcore.thread.domain.model.ActionRequest;
import me.golemcore.thread.domain.model.ActionResult;
import me.golemcore.thread.domain.model.ApprovalDecision;
import me.golemcore.thread.infrastructure.config.ThreadProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ActionExecutionServiceTest {

    private static final ActionInvocation INVOCATION = ActionInvocation.builder()
            .executionId("exec-1")
            .contextId("ctx-1")
            .triggerItemId("trigger-1")
            .reactionItemId("reaction-1")
            .build();

    private ActionApprovalService approvalService;
    private InMemoryEffectJournalAdapter effectJournal;
    private ExecutorService executor;
    private ActionExecutionService service;

    @BeforeEach
    void setUp() {
        approvalService = mock(ActionApprovalService.class);
        ThreadProperties properties = new ThreadProperties();
        effectJournal = new InMemoryEffectJournalAdapter(Clock.systemUTC(), properties);
        executor = Executors.newCachedThreadPool();
        service = new ActionExecutionService(approvalService, effectJournal, executor, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // ==================== auto actions ====================

    @Test
    void shouldRunAutoActionWithoutApproval() {
        RecordingAction lookup = RecordingAction.auto("lookup", Map.of("hits", 3));
        ActionRequest request = new ActionRequest("call_0_0", "lookup", Map.of("q", "x"));

        List<ActionResult> results = service.executeAll(List.of(request), List.of(lookup), INVOCATION);

        assertEquals(1, results.size());
        assertTrue(results.get(0).isSuccess());
        assertEquals(Map.of("hits", 3), results.get(0).getOutput());
        assertEquals("call_0_0", lookup.getInvocations().get(0).actionRef());
        verify(approvalService, never()).awaitApproval(anyString(), anyString());
    }

    @Test
    void shouldReturnResultsInRequestOrder() {
        RecordingAction slow = new RecordingAction("slow", true, input -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "slow";
        });
        RecordingAction fast = RecordingAction.auto("fast", "fast");

        List<ActionResult> results = service.executeAll(List.of(
                new ActionRequest("a", "slow", Map.of()),
                new ActionRequest("b", "fast", Map.of())), List.of(slow, fast), INVOCATION);

        assertEquals("slow", results.get(0).getOutput());
        assertEquals("fast", results.get(1).getOutput());
    }

    @Test
    void shouldConvertThrownErrorToFailedResult() {
        RecordingAction broken = new RecordingAction("broken", true, input -> {
            throw new IllegalStateException("disk full");
        });

        ActionResult result = service.executeAll(List.of(new ActionRequest("a", "broken", Map.of())),
                List.of(broken), INVOCATION).get(0);

        assertFalse(result.isSuccess());
        assertEquals(ActionFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("disk full", result.getErrorText());
    }

    @Test
    void shouldConvertFailedFutureToFailedResult() {
        ActionComponent failing = new RecordingAction("failing", true, input -> null) {
            @Override
            public CompletableFuture<Object> execute(Map<String, Object> input, ActionInvocation invocation) {
                return CompletableFuture.failedFuture(new IllegalArgumentException("bad input"));
            }
        };

        ActionResult result = service.executeAll(List.of(new ActionRequest("a", "failing", Map.of())),
                List.of(failing), INVOCATION).get(0);

        assertEquals("bad input", result.getErrorText());
    }

    @Test
    void shouldReportUnknownAction() {
        ActionResult result = service.executeAll(List.of(new ActionRequest("a", "missing", Map.of())),
                List.of(), INVOCATION).get(0);

        assertFalse(result.isSuccess());
        assertEquals(ActionFailureKind.NOT_FOUND, result.getFailureKind());
        assertEquals("Action \"missing\" not found or not executable.", result.getErrorText());
    }

    @Test
    void shouldReportDisabledAction() {
        RecordingAction disabled = new RecordingAction("off", true, input -> "x") {
            @Override
            public boolean isEnabled() {
                return false;
            }
        };

        ActionResult result = service.executeAll(List.of(new ActionRequest("a", "off", Map.of())),
                List.of(disabled), INVOCATION).get(0);

        assertEquals(ActionFailureKind.NOT_FOUND, result.getFailureKind());
        assertTrue(disabled.getInputs().isEmpty());
    }

    // ==================== gated actions ====================

    @Test
    void shouldRunGatedActionWithApproverArgs() {
        RecordingAction deploy = RecordingAction.gated("deploy", "deployed");
        when(approvalService.awaitApproval("exec-1", "call_0_0"))
                .thenReturn(CompletableFuture.completedFuture(ApprovalDecision.approve(Map.of("env", "staging"))));

        ActionResult result = service.executeAll(
                List.of(new ActionRequest("call_0_0", "deploy", Map.of("env", "prod"))),
                List.of(deploy), INVOCATION).get(0);

        assertTrue(result.isSuccess());
        assertEquals(Map.of("env", "staging"), deploy.getInputs().get(0));
    }

    @Test
    void shouldFailGatedActionOnRejectionWithComment() {
        RecordingAction deploy = RecordingAction.gated("deploy", "deployed");
        when(approvalService.awaitApproval("exec-1", "call_0_0"))
                .thenReturn(CompletableFuture.completedFuture(ApprovalDecision.reject("no")));

        ActionResult result = service.executeAll(List.of(new ActionRequest("call_0_0", "deploy", Map.of())),
                List.of(deploy), INVOCATION).get(0);

        assertFalse(result.isSuccess());
        assertEquals(ActionFailureKind.APPROVAL_DENIED, result.getFailureKind());
        assertEquals("Action execution not approved: no", result.getErrorText());
        assertTrue(deploy.getInputs().isEmpty());
    }

    @Test
    void shouldTreatMalformedDecisionAsRejection() {
        RecordingAction deploy = RecordingAction.gated("deploy", "deployed");
        when(approvalService.awaitApproval("exec-1", "call_0_0"))
                .thenReturn(CompletableFuture.completedFuture(ApprovalDecision.malformed()));

        ActionResult result = service.executeAll(List.of(new ActionRequest("call_0_0", "deploy", Map.of())),
                List.of(deploy), INVOCATION).get(0);

        assertEquals(ActionExecutionService.NOT_APPROVED, result.getErrorText());
    }

    // ==================== journal ====================

    @Test
    void shouldNotRerunRecordedAction() {
        RecordingAction lookup = RecordingAction.auto("lookup", "once");
        ActionRequest request = new ActionRequest("call_0_0", "lookup", Map.of());

        service.executeAll(List.of(request), List.of(lookup), INVOCATION);
        List<ActionResult> replayed = service.executeAll(List.of(request), List.of(lookup), INVOCATION);

        assertEquals("once", replayed.get(0).getOutput());
        assertEquals(1, lookup.getInputs().size());
        assertTrue(effectJournal.isRecorded(EffectIds.of("trigger-1", "action", 0, "call_0_0")));
    }

    @Test
    void shouldRunSameRefAgainInLaterIteration() {
        RecordingAction lookup = RecordingAction.auto("lookup", "fresh");
        ActionRequest request = new ActionRequest("c1", "lookup", Map.of());

        service.executeAll(List.of(request), List.of(lookup), INVOCATION);
        service.executeAll(List.of(request), List.of(lookup), INVOCATION.toBuilder().iteration(1).build());

        assertEquals(2, lookup.getInputs().size());
        assertTrue(effectJournal.isRecorded(EffectIds.of("trigger-1", "action", 1, "c1")));
    }
}
