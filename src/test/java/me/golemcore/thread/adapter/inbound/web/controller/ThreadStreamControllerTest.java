package me.golemcore.thread.adapter.inbound.web.controller;

import me.golemcore.thread.port.outbound.StreamSinkPort;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ThreadStreamControllerTest {

    @Test
    void shouldNameEventsAfterRecordType() {
        StreamSinkPort streamSinkPort = mock(StreamSinkPort.class);
        Map<String, Object> created = Map.of("type", "data-execution.created", "data", Map.of("executionId", "e1"));
        Map<String, Object> finish = Map.of("type", "finish");
        when(streamSinkPort.subscribe("c1")).thenReturn(Flux.just(created, finish));
        ThreadStreamController controller = new ThreadStreamController(streamSinkPort);

        StepVerifier.create(controller.stream("c1"))
                .assertNext(event -> {
                    assertEquals("data-execution.created", event.event());
                    assertEquals(created, event.data());
                })
                .assertNext(event -> assertEquals("finish", event.event()))
                .verifyComplete();
    }
}
