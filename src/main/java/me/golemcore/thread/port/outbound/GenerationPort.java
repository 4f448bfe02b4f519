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

import me.golemcore.thread.domain.model.GenerationRequest;
import me.golemcore.thread.domain.model.GenerationResponse;

import java.util.concurrent.CompletableFuture;

/**
 * External generation capability behind the live reactor.
 */
public interface GenerationPort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    CompletableFuture<GenerationResponse> generate(GenerationRequest request);

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
