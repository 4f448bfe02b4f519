package me.golemcore.thread.domain.model;

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

import lombok.Builder;
import lombok.Value;
import me.golemcore.thread.domain.component.ThreadDefinition;
import me.golemcore.thread.port.outbound.StreamSink;

/**
 * Input of one turn.
 *
 * <ul>
 * <li>{@code context} - existing context by id or key; null creates one</li>
 * <li>{@code sink} - explicit sink; null uses the context's default stream</li>
 * <li>{@code options} - per-turn overrides; null uses configured defaults</li>
 * </ul>
 */
@Value
@Builder
public class ReactRequest {

    ThreadDefinition definition;
    ThreadItem trigger;
    ThreadEnvironment environment;
    ContextIdentifier context;
    ThreadOptions options;
    StreamSink sink;
}
