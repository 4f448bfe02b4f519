package me.golemcore.thread.domain.service;

import me.golemcore.thread.adapter.outbound.approval.HookApprovalAdapter;
import me.golemcore.thread.adapter.outbound.approval.WebhookApprovalAdapter;
import me.golemcore.thread.domain.model.ActionApprovalEvent;
import me.golemcore.thread.domain.model.ApprovalDecision;
import me.golemcore.thread.infrastructure.config.AutoConfiguration;
import me.golemcore.thread.infrastructure.config.ThreadProperties;
import me.golemcore.thread.infrastructure.event.SpringEventBus;
import me.golemcore.thread.port.outbound.ApprovalSourcePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ActionApprovalServiceTest {

    private ThreadProperties properties;
    private HookApprovalAdapter hookSource;
    private WebhookApprovalAdapter webhookSource;
    private ActionApprovalService service;

    @BeforeEach
    void setUp() {
        properties = new ThreadProperties();
        hookSource = new HookApprovalAdapter(Clock.systemUTC(), properties);
        webhookSource = new WebhookApprovalAdapter(Clock.systemUTC(), properties, AutoConfiguration.objectMapper());
        SpringEventBus eventBus = mock(SpringEventBus.class);
        doAnswer(invocation -> {
            hookSource.onApproval(invocation.getArgument(0));
            return null;
        }).when(eventBus).publish(any(ActionApprovalEvent.class));
        service = new ActionApprovalService(List.of(hookSource, webhookSource), properties, eventBus);
    }

    // ==================== racing sources ====================

    @Test
    void shouldResolveThroughHookDecision() throws Exception {
        CompletableFuture<ApprovalDecision> wait = service.awaitApproval("exec-1", "call_0_0");
        assertFalse(wait.isDone());

        service.publishHookDecision("exec-1", "call_0_0", ApprovalDecision.approve());

        assertTrue(wait.get(1, TimeUnit.SECONDS).approved());
    }

    @Test
    void shouldResolveThroughWebhookBody() throws Exception {
        CompletableFuture<ApprovalDecision> wait = service.awaitApproval("exec-1", "call_0_0");

        webhookSource.resolveFromBody("action-approval:webhook:exec-1:call_0_0",
                "{\"approved\":false,\"comment\":\"no\"}".getBytes(StandardCharsets.UTF_8));

        ApprovalDecision decision = wait.get(1, TimeUnit.SECONDS);
        assertFalse(decision.approved());
        assertEquals("no", decision.comment());
    }

    @Test
    void shouldKeepFirstDecisionWhenBothSourcesAnswer() throws Exception {
        CompletableFuture<ApprovalDecision> wait = service.awaitApproval("exec-1", "call_0_0");

        service.publishHookDecision("exec-1", "call_0_0", ApprovalDecision.reject("first"));
        webhookSource.resolveFromBody("action-approval:webhook:exec-1:call_0_0",
                "{\"approved\":true}".getBytes(StandardCharsets.UTF_8));

        assertEquals("first", wait.get(1, TimeUnit.SECONDS).comment());
    }

    @Test
    void shouldKeepDecisionDeliveredBeforeWait() throws Exception {
        service.publishHookDecision("exec-1", "call_0_0", ApprovalDecision.approve());

        assertTrue(service.awaitApproval("exec-1", "call_0_0").get(1, TimeUnit.SECONDS).approved());
    }

    @Test
    void shouldNotShareWaitsAcrossActionRefs() {
        CompletableFuture<ApprovalDecision> first = service.awaitApproval("exec-1", "call_0_0");
        CompletableFuture<ApprovalDecision> second = service.awaitApproval("exec-1", "call_1_0");

        service.publishHookDecision("exec-1", "call_0_0", ApprovalDecision.approve());

        assertTrue(first.isDone());
        assertFalse(second.isDone());
        assertEquals(List.of("action-approval:hook:exec-1:call_1_0", "action-approval:webhook:exec-1:call_1_0"),
                service.tokensFor("exec-1", "call_1_0"));
    }

    // ==================== degraded paths ====================

    @Test
    void shouldRejectWhenNoSourceIsConfigured() {
        ActionApprovalService empty = new ActionApprovalService(List.of(), properties, mock(SpringEventBus.class));

        ApprovalDecision decision = empty.awaitApproval("exec-1", "call_0_0").join();

        assertFalse(decision.approved());
    }

    @Test
    void shouldTreatFailedSourcesAsMalformedDecision() {
        ApprovalSourcePort broken = mock(ApprovalSourcePort.class);
        when(broken.getSourceName()).thenReturn("broken");
        when(broken.awaitDecision(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("x")));
        ActionApprovalService failing = new ActionApprovalService(List.of(broken), properties,
                mock(SpringEventBus.class));

        ApprovalDecision decision = failing.awaitApproval("exec-1", "call_0_0").join();

        assertFalse(decision.approved());
        assertFalse(decision.hasComment());
    }

    @Test
    void shouldRejectOnTimeout() throws Exception {
        properties.getActions().setApprovalTimeoutSeconds(1);

        ApprovalDecision decision = service.awaitApproval("exec-1", "call_0_0").get(3, TimeUnit.SECONDS);

        assertFalse(decision.approved());
        assertEquals(ActionApprovalService.TIMED_OUT_COMMENT, decision.comment());
    }
}
