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

import java.util.List;

/**
 * What the continuation policy and the end hook see after an iteration.
 *
 * @param reactionItem
 *            the turn's reaction item with this iteration's parts and action
 *            outcomes merged in
 * @param fragment
 *            the reactor's raw fragment for this iteration
 */
@Builder
public record ContinuationRequest(
        ThreadEnvironment environment,
        StoredContext context,
        int iteration,
        ThreadItem reactionItem,
        ThreadItem fragment,
        List<ActionRequest> actionRequests,
        List<ActionResult> actionResults) {
}
