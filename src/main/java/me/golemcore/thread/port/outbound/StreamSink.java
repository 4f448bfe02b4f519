package me.golemcore.thread.port.outbound;

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

import java.util.Map;

/**
 * Destination for the structured records of one turn.
 *
 * <p>
 * Every write goes through a {@link SinkWriter} acquired for that write and
 * released on every exit path, so a writer is never held between records.
 */
public interface StreamSink {

    SinkWriter acquireWriter();

    /**
     * Ends the stream. Records written afterwards are ignored.
     */
    void close();

    /**
     * Scoped write handle. Use in try-with-resources.
     */
    interface SinkWriter extends AutoCloseable {

        void write(Map<String, Object> record);

        @Override
        void close();
    }

    static StreamSink discarding() {
        return DiscardingSink.INSTANCE;
    }

    /**
     * Sink that accepts and drops every record.
     */
    final class DiscardingSink implements StreamSink {

        private static final DiscardingSink INSTANCE = new DiscardingSink();

        private DiscardingSink() {
        }

        @Override
        public SinkWriter acquireWriter() {
            return new SinkWriter() {
                @Override
                public void write(Map<String, Object> record) {
                    // dropped
                }

                @Override
                public void close() {
                    // nothing held
                }
            };
        }

        @Override
        public void close() {
            // nothing to release
        }
    }
}
