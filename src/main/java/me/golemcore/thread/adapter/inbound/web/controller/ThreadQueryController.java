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
import me.golemcore.thread.domain.model.ThreadSnapshot;
import me.golemcore.thread.port.outbound.ThreadStorePort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Read access to persisted threads.
 */
@RestController
@RequestMapping("/api/threads")
@RequiredArgsConstructor
public class ThreadQueryController {

    private final ThreadStorePort threadStorePort;

    @GetMapping("/{threadKey}")
    public Mono<ResponseEntity<ThreadSnapshot>> getThread(@PathVariable String threadKey) {
        ThreadSnapshot snapshot = threadStorePort.findSnapshot(threadKey)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Thread not found: " + threadKey));
        return Mono.just(ResponseEntity.ok(snapshot));
    }
}
