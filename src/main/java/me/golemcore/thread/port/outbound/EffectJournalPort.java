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

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Records the results of operations with external effects under stable ids.
 * Running an id that already succeeded returns the recorded result without
 * repeating the operation. Failed operations are not recorded.
 */
public interface EffectJournalPort {

    <T> T run(String effectId, Supplier<T> operation);

    /**
     * Asynchronous variant. The result is recorded when the returned future
     * completes normally.
     */
    <T> CompletableFuture<T> runAsync(String effectId, Supplier<CompletableFuture<T>> operation);

    boolean isRecorded(String effectId);
}
