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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One loop iteration within an execution, including its recorded outcome.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ThreadStep {

    private String id;
    private String executionId;
    private int iteration;
    private StepStatus status;
    private StepKind kind;
    private String actionName;
    private Object actionInput;
    private Object actionOutput;
    private String actionError;
    @Builder.Default
    private List<ActionRequest> actionRequests = new ArrayList<>();
    @Builder.Default
    private List<ActionResult> actionResults = new ArrayList<>();
    private Boolean continueLoop;
    private String errorText;
    private Instant createdAt;
    private Instant updatedAt;
}
