package me.golemcore.thread.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.thread.port.outbound.StreamSinkPort;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * Server-Sent Events view of a context's default stream. Each sink record is
 * one event named after its {@code type}.
 */
@RestController
@RequestMapping("/api/threads/contexts")
@RequiredArgsConstructor
public class ThreadStreamController {

    private final StreamSinkPort streamSinkPort;

    @GetMapping(value = "/{contextId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Map<String, Object>>> stream(@PathVariable String contextId) {
        return streamSinkPort.subscribe(contextId)
                .map(record -> ServerSentEvent.<Map<String, Object>>builder()
                        .event(String.valueOf(record.get("type")))
                        .data(record)
                        .build());
    }
}
