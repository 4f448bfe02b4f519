package me.golemcore.thread.adapter.outbound.stream;

import me.golemcore.thread.infrastructure.config.ThreadProperties;
import me.golemcore.thread.port.outbound.StreamSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextStreamBroadcasterTest {

    private ContextStreamBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new ContextStreamBroadcaster(new ThreadProperties());
    }

    @Test
    void shouldRemoveChannelWhenStreamCloses() {
        StreamSink sink = broadcaster.openContextStream("c1");
        write(sink, Map.of("type", "data-thread.idle"));
        write(sink, Map.of("type", "finish"));
        sink.close();

        assertFalse(broadcaster.hasChannel("c1"));
    }

    @Test
    void shouldDeliverRecordsToSubscriberWaitingForNextTurn() {
        StepVerifier.create(broadcaster.subscribe("c1"))
                .then(() -> {
                    StreamSink sink = broadcaster.openContextStream("c1");
                    write(sink, Map.of("type", "data-execution.created"));
                    write(sink, Map.of("type", "finish"));
                    sink.close();
                })
                .expectNextMatches(record -> "data-execution.created".equals(record.get("type")))
                .expectNextMatches(record -> "finish".equals(record.get("type")))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldReplayWrittenRecordsWhileTurnIsInFlight() {
        StreamSink sink = broadcaster.openContextStream("c1");
        write(sink, Map.of("type", "data-context.created"));

        StepVerifier.create(broadcaster.subscribe("c1"))
                .expectNextMatches(record -> "data-context.created".equals(record.get("type")))
                .then(sink::close)
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldKeepContextsSeparate() {
        StreamSink first = broadcaster.openContextStream("c1");
        broadcaster.openContextStream("c2");

        first.close();

        assertFalse(broadcaster.hasChannel("c1"));
        assertTrue(broadcaster.hasChannel("c2"));
    }

    private static void write(StreamSink sink, Map<String, Object> record) {
        try (StreamSink.SinkWriter writer = sink.acquireWriter()) {
            writer.write(record);
        }
    }
}
