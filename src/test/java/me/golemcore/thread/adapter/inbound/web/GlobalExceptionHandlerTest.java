package me.golemcore.thread.adapter.inbound.web;

import me.golemcore.thread.adapter.inbound.web.dto.ApiErrorResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.NOT_FOUND, "Thread not found: x");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(404, body.getStatus());
                    assertEquals("Thread not found: x", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalStateToConflict() {
        StepVerifier.create(handler.handleIllegalState(new IllegalStateException("Context already streaming")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    assertEquals("Context already streaming", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrorDetails() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("secret detail")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
