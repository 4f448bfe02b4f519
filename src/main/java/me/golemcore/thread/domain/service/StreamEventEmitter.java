package me.golemcore.thread.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.thread.domain.component.ChunkEmitter;
import me.golemcore.thread.domain.model.ThreadStreamEvent;
import me.golemcore.thread.domain.service.ProducerChunkMapper.ChunkOrigin;
import me.golemcore.thread.port.outbound.StreamSink;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes one turn's canonical events to its sink.
 *
 * <p>
 * Lifecycle events are written as {@code {type: "data-<event type>", data}}
 * records and the stream ends with a {@code {type: "finish"}} sentinel unless
 * suppressed. A silent emitter writes nothing and assigns no chunk sequences.
 */
@Slf4j
public class StreamEventEmitter {

    public static final String DATA_RECORD_PREFIX = "data-";
    public static final String FINISH_RECORD_TYPE = "finish";

    private final StreamSink sink;
    private final StreamEventCodec codec;
    private final ChunkSequencer sequencer;
    private final Clock clock;
    private final int maxRawStringChars;
    private final ReentrantLock chunkLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public StreamEventEmitter(StreamSink sink, StreamEventCodec codec, ChunkSequencer sequencer, Clock clock,
            int maxRawStringChars) {
        this.sink = sink;
        this.codec = codec;
        this.sequencer = sequencer;
        this.clock = clock;
        this.maxRawStringChars = maxRawStringChars;
    }

    public static StreamEventEmitter silent(StreamEventCodec codec, ChunkSequencer sequencer, Clock clock) {
        return new StreamEventEmitter(null, codec, sequencer, clock, PayloadSanitizer.DEFAULT_MAX_STRING_CHARS);
    }

    public boolean isSilent() {
        return sink == null;
    }

    public String now() {
        return clock.instant().toString();
    }

    public void emit(ThreadStreamEvent event) {
        if (isSilent()) {
            return;
        }
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("type", DATA_RECORD_PREFIX + event.getType().getValue());
        record.put("data", codec.serialize(event));
        write(record);
    }

    /**
     * Normalizes, sequences and writes one producer chunk. Sequence assignment
     * and the write happen under one lock so observers see sequences in order.
     *
     * @return the emitted event, or {@code null} when silent
     */
    public ThreadStreamEvent emitChunk(Map<String, Object> producerChunk, ChunkOrigin origin) {
        if (isSilent()) {
            return null;
        }
        chunkLock.lock();
        try {
            long sequence = sequencer.next(origin.contextId());
            ThreadStreamEvent event = ProducerChunkMapper.toChunkEvent(producerChunk, origin, sequence,
                    clock.instant(), maxRawStringChars);
            emit(event);
            return event;
        } finally {
            chunkLock.unlock();
        }
    }

    public ChunkEmitter chunkEmitter(ChunkOrigin origin) {
        if (isSilent()) {
            return ChunkEmitter.silent();
        }
        return chunk -> emitChunk(chunk, origin);
    }

    /**
     * Sends the finish sentinel (when requested) and closes the sink (unless
     * prevented). Only the first call has an effect.
     */
    public void close(boolean sendFinish, boolean preventClose) {
        if (isSilent() || !closed.compareAndSet(false, true)) {
            return;
        }
        if (sendFinish) {
            Map<String, Object> finish = new LinkedHashMap<>();
            finish.put("type", FINISH_RECORD_TYPE);
            write(finish);
        }
        if (!preventClose) {
            sink.close();
        }
    }

    private void write(Map<String, Object> record) {
        if (closed.get() && !FINISH_RECORD_TYPE.equals(record.get("type"))) {
            log.debug("[Stream] Dropping {} after close", record.get("type"));
            return;
        }
        try (StreamSink.SinkWriter writer = sink.acquireWriter()) {
            writer.write(record);
        }
    }
}
