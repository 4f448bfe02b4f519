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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Output of one reactor invocation: the iteration's reaction fragment, the
 * actions it requests in order, and the prompt it actually used.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReactorResult {

    private ThreadItem fragment;
    @Builder.Default
    private List<ActionRequest> actionRequests = new ArrayList<>();
    @Builder.Default
    private List<Map<String, Object>> promptMessages = new ArrayList<>();
    private ReactorUsage usage;

    public boolean hasActionRequests() {
        return actionRequests != null && !actionRequests.isEmpty();
    }

    public List<Map<String, Object>> fragmentParts() {
        return fragment != null && fragment.getParts() != null ? fragment.getParts() : List.of();
    }
}
