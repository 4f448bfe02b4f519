package me.golemcore.thread.adapter.inbound.web.controller;

import me.golemcore.thread.adapter.inbound.web.dto.ApprovalWebhookResponse;
import me.golemcore.thread.adapter.outbound.approval.WebhookApprovalAdapter;
import me.golemcore.thread.domain.model.ApprovalDecision;
import me.golemcore.thread.infrastructure.config.AutoConfiguration;
import me.golemcore.thread.infrastructure.config.ThreadProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApprovalWebhookControllerTest {

    private static final String TOKEN = "action-approval:webhook:exec-1:call_0_0";

    private WebhookApprovalAdapter adapter;
    private ApprovalWebhookController controller;

    @BeforeEach
    void setUp() {
        adapter = new WebhookApprovalAdapter(Clock.systemUTC(), new ThreadProperties(),
                AutoConfiguration.objectMapper());
        controller = new ApprovalWebhookController(adapter);
    }

    @Test
    void shouldAcceptDecisionForPendingToken() {
        CompletableFuture<ApprovalDecision> wait = adapter.awaitDecision(TOKEN);

        StepVerifier.create(controller.resolve(TOKEN, bytes("{\"approved\":true}")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    ApprovalWebhookResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("accepted", body.getStatus());
                    assertEquals(Boolean.TRUE, body.getApproved());
                })
                .verifyComplete();
        assertTrue(wait.join().approved());
    }

    @Test
    void shouldReportDuplicateDelivery() {
        CompletableFuture<ApprovalDecision> wait = adapter.awaitDecision(TOKEN);
        adapter.resolve(TOKEN, ApprovalDecision.reject("no"));

        StepVerifier.create(controller.resolve(TOKEN, bytes("{\"approved\":true}")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    assertEquals("already-resolved", response.getBody().getStatus());
                })
                .verifyComplete();
        assertFalse(wait.join().approved());
    }

    @Test
    void shouldTreatUnparseableBodyAsRejection() {
        adapter.awaitDecision(TOKEN);

        StepVerifier.create(controller.resolve(TOKEN, bytes("not json")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(Boolean.FALSE, response.getBody().getApproved());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForForeignToken() {
        StepVerifier.create(controller.resolve("action-approval:hook:exec-1:call_0_0", bytes("{}")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    assertEquals("error", response.getBody().getStatus());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForTokenNobodyAwaits() {
        StepVerifier.create(controller.resolve(TOKEN, bytes("{\"approved\":true}")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    assertEquals("error", response.getBody().getStatus());
                })
                .verifyComplete();
        assertFalse(adapter.hasWait(TOKEN));
    }

    private static byte[] bytes(String body) {
        return body.getBytes(StandardCharsets.UTF_8);
    }
}
