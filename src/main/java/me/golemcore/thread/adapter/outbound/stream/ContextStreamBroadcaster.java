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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.thread.infrastructure.config.ThreadProperties;
import me.golemcore.thread.port.outbound.StreamSink;
import me.golemcore.thread.port.outbound.StreamSinkPort;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default per-context streams backed by Reactor replay sinks.
 *
 * <p>
 * One sink exists per context namespace while a turn is in flight or a
 * subscriber is waiting for one. Closing the turn's stream completes the sink
 * and removes it, so the next turn starts a fresh stream.
 */
@Component
@Slf4j
public class ContextStreamBroadcaster implements StreamSinkPort {

    private final Map<String, ContextChannel> channels = new ConcurrentHashMap<>();
    private final int replayBufferSize;

    public ContextStreamBroadcaster(ThreadProperties properties) {
        this.replayBufferSize = Math.max(1, properties.getStream().getReplayBufferSize());
    }

    @Override
    public StreamSink openContextStream(String contextId) {
        String namespace = StreamSinkPort.namespace(contextId);
        ContextChannel channel = channels.computeIfAbsent(namespace, this::newChannel);
        log.debug("[Stream] Opened {}", namespace);
        return new ChannelSink(namespace, channel);
    }

    @Override
    public Flux<Map<String, Object>> subscribe(String contextId) {
        String namespace = StreamSinkPort.namespace(contextId);
        return channels.computeIfAbsent(namespace, this::newChannel).sink().asFlux();
    }

    boolean hasChannel(String contextId) {
        return channels.containsKey(StreamSinkPort.namespace(contextId));
    }

    private ContextChannel newChannel(String namespace) {
        return new ContextChannel(Sinks.many().replay().limit(replayBufferSize), new ReentrantLock());
    }

    private record ContextChannel(Sinks.Many<Map<String, Object>> sink, ReentrantLock lock) {
    }

    private final class ChannelSink implements StreamSink {

        private final String namespace;
        private final ContextChannel channel;

        private ChannelSink(String namespace, ContextChannel channel) {
            this.namespace = namespace;
            this.channel = channel;
        }

        @Override
        public SinkWriter acquireWriter() {
            channel.lock().lock();
            return new SinkWriter() {
                private boolean released;

                @Override
                public void write(Map<String, Object> record) {
                    Sinks.EmitResult result = channel.sink().tryEmitNext(record);
                    if (result.isFailure()) {
                        log.warn("[Stream] Dropped record on {}: {}", namespace, result);
                    }
                }

                @Override
                public void close() {
                    if (!released) {
                        released = true;
                        channel.lock().unlock();
                    }
                }
            };
        }

        @Override
        public void close() {
            channel.lock().lock();
            try {
                channel.sink().tryEmitComplete();
                channels.remove(namespace, channel);
                log.debug("[Stream] Closed {}", namespace);
            } finally {
                channel.lock().unlock();
            }
        }
    }
}
