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

import me.golemcore.thread.domain.model.ApprovalDecision;

import java.util.concurrent.CompletableFuture;

/**
 * One channel approval decisions can arrive through. Waits are addressed by a
 * deterministic token, so awaiting or resolving the same token twice is safe.
 */
public interface ApprovalSourcePort {

    /**
     * Short source name used in tokens, e.g. {@code hook} or {@code webhook}.
     */
    String getSourceName();

    /**
     * Returns a future completed when a decision for the token arrives. A
     * decision that arrived before the wait started is delivered immediately.
     */
    CompletableFuture<ApprovalDecision> awaitDecision(String token);

    /**
     * Delivers a decision. Returns false when the token already has one.
     */
    boolean resolve(String token, ApprovalDecision decision);
}
