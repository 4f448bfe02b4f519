package me.golemcore.thread.adapter.outbound.stream;

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

import me.golemcore.thread.port.outbound.StreamSink;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sink that keeps every record in memory. Useful as an explicit turn sink when
 * the caller wants the records rather than a live stream.
 */
public class InMemoryStreamSink implements StreamSink {

    private final List<Map<String, Object>> records = new ArrayList<>();
    private final AtomicInteger openWriters = new AtomicInteger();
    private volatile boolean closed;

    @Override
    public SinkWriter acquireWriter() {
        openWriters.incrementAndGet();
        return new SinkWriter() {
            private boolean released;

            @Override
            public void write(Map<String, Object> record) {
                if (closed) {
                    throw new IllegalStateException("Stream sink is closed");
                }
                synchronized (records) {
                    records.add(record);
                }
            }

            @Override
            public void close() {
                if (!released) {
                    released = true;
                    openWriters.decrementAndGet();
                }
            }
        };
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<Map<String, Object>> getRecords() {
        synchronized (records) {
            return new ArrayList<>(records);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Writers acquired and not yet released. Zero whenever no write is in
     * progress.
     */
    public int getOpenWriters() {
        return openWriters.get();
    }
}
