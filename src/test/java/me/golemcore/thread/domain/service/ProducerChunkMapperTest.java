package me.golemcore.thread.domain.service;

import me.golemcore.thread.domain.model.ChunkType;
import me.golemcore.thread.domain.model.StreamEventType;
import me.golemcore.thread.domain.model.ThreadStreamEvent;
import me.golemcore.thread.domain.service.ProducerChunkMapper.ChunkOrigin;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ProducerChunkMapperTest {

    private static final ChunkOrigin ORIGIN = new ChunkOrigin("c1", "e1", "s1", "i1", "scripted");
    private static final Instant AT = Instant.parse("2026-01-01T00:00:00Z");

    // ==================== type cascade ====================

    @Test
    void shouldMapLifecycleTypes() {
        assertEquals(ChunkType.START, ProducerChunkMapper.mapProducerChunkType("start"));
        assertEquals(ChunkType.START_STEP, ProducerChunkMapper.mapProducerChunkType("start-step"));
        assertEquals(ChunkType.FINISH_STEP, ProducerChunkMapper.mapProducerChunkType("finish-step"));
        assertEquals(ChunkType.FINISH, ProducerChunkMapper.mapProducerChunkType("finish"));
    }

    @Test
    void shouldPreferReasoningOverText() {
        assertEquals(ChunkType.REASONING_DELTA, ProducerChunkMapper.mapProducerChunkType("reasoning-delta"));
        assertEquals(ChunkType.REASONING_START, ProducerChunkMapper.mapProducerChunkType("reasoning.start"));
        assertEquals(ChunkType.REASONING_END, ProducerChunkMapper.mapProducerChunkType("reasoning_end"));
        assertEquals(ChunkType.TEXT_DELTA, ProducerChunkMapper.mapProducerChunkType("text-delta"));
    }

    @Test
    void shouldMapToolVocabulariesToActionTypes() {
        assertEquals(ChunkType.ACTION_INPUT_START, ProducerChunkMapper.mapProducerChunkType("tool-input-start"));
        assertEquals(ChunkType.ACTION_INPUT_DELTA, ProducerChunkMapper.mapProducerChunkType("tool-input-delta"));
        assertEquals(ChunkType.ACTION_INPUT_AVAILABLE,
                ProducerChunkMapper.mapProducerChunkType("tool-input-available"));
        assertEquals(ChunkType.ACTION_INPUT_DELTA,
                ProducerChunkMapper.mapProducerChunkType("response.function_call_arguments.delta"));
        assertEquals(ChunkType.ACTION_OUTPUT_AVAILABLE,
                ProducerChunkMapper.mapProducerChunkType("tool-output-available"));
        assertEquals(ChunkType.ACTION_OUTPUT_ERROR, ProducerChunkMapper.mapProducerChunkType("tool-output-error"));
    }

    @Test
    void shouldMapSourcesFilesAndMetadata() {
        assertEquals(ChunkType.SOURCE_URL, ProducerChunkMapper.mapProducerChunkType("source-url"));
        assertEquals(ChunkType.SOURCE_DOCUMENT, ProducerChunkMapper.mapProducerChunkType("source-document"));
        assertEquals(ChunkType.FILE, ProducerChunkMapper.mapProducerChunkType("file"));
        assertEquals(ChunkType.MESSAGE_METADATA, ProducerChunkMapper.mapProducerChunkType("message-metadata"));
        assertEquals(ChunkType.ERROR, ProducerChunkMapper.mapProducerChunkType("error"));
    }

    @Test
    void shouldBucketUnrecognizedTypesWithoutThrowing() {
        assertEquals(ChunkType.UNKNOWN, ProducerChunkMapper.mapProducerChunkType("weird-vendor-thing"));
        assertEquals(ChunkType.UNKNOWN, ProducerChunkMapper.mapProducerChunkType(""));
        assertEquals(ChunkType.UNKNOWN, ProducerChunkMapper.mapProducerChunkType(null));
    }

    // ==================== chunk events ====================

    @Test
    void shouldBuildChunkEventForUnknownProducerType() {
        ThreadStreamEvent event = ProducerChunkMapper.toChunkEvent(Map.of("type", "x-vendor-ping", "id", "p1"),
                ORIGIN, 5, AT, 100);

        assertEquals(StreamEventType.CHUNK_EMITTED, event.getType());
        assertEquals(ChunkType.UNKNOWN, event.getChunkType());
        assertEquals("x-vendor-ping", event.getProviderChunkType());
        assertEquals(5L, event.getSequence());
        assertNull(event.getActionRef());
    }

    @Test
    void shouldStampOriginAndNormalizeFields() {
        ThreadStreamEvent event = ProducerChunkMapper.toChunkEvent(
                Map.of("type", "text-delta", "id", "text_0", "delta", "Hel", "extra", 1), ORIGIN, 1, AT, 100);

        assertEquals("c1", event.getContextId());
        assertEquals("e1", event.getExecutionId());
        assertEquals("s1", event.getStepId());
        assertEquals("i1", event.getItemId());
        assertEquals("scripted", event.getProvider());
        assertEquals(AT.toString(), event.getAt());
        assertEquals(Map.of("id", "text_0", "delta", "Hel"), event.getData());
    }

    @Test
    void shouldSetActionRefOnlyForActionChunks() {
        ThreadStreamEvent action = ProducerChunkMapper.toChunkEvent(
                Map.of("type", "tool-input-available", "toolCallId", "call_0_0", "id", "other"), ORIGIN, 1, AT,
                100);
        ThreadStreamEvent actionById = ProducerChunkMapper.toChunkEvent(
                Map.of("type", "tool-input-start", "id", "call_1"), ORIGIN, 2, AT, 100);
        ThreadStreamEvent text = ProducerChunkMapper.toChunkEvent(
                Map.of("type", "text-start", "toolCallId", "ignored"), ORIGIN, 3, AT, 100);

        assertEquals("call_0_0", action.getActionRef());
        assertEquals("call_1", actionById.getActionRef());
        assertNull(text.getActionRef());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSanitizeRawPayload() {
        ThreadStreamEvent event = ProducerChunkMapper.toChunkEvent(
                Map.of("type", "text-delta", "delta", "x".repeat(20), "apiKey", "sk"), ORIGIN, 1, AT, 10);

        Map<String, Object> raw = (Map<String, Object>) event.getRaw();
        assertEquals(PayloadSanitizer.REDACTED, raw.get("apiKey"));
        assertEquals(PayloadSanitizer.TRUNCATED, raw.get("delta"));
        assertEquals(PayloadSanitizer.TRUNCATED, event.getData().get("delta"));
    }

    @Test
    void shouldTreatMissingTypeAsUnknown() {
        ThreadStreamEvent event = ProducerChunkMapper.toChunkEvent(Map.of("delta", "?"), ORIGIN, 1, AT, 100);

        assertEquals(ChunkType.UNKNOWN, event.getChunkType());
        assertEquals(ProducerChunkMapper.UNKNOWN_PRODUCER_TYPE, event.getProviderChunkType());
    }
}
