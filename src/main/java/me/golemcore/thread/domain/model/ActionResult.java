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

/**
 * Outcome of one requested action. Failures are data merged into the reaction
 * item, never exceptions reaching the loop.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionResult {

    private ActionRequest actionRequest;
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private Object output;
    private String errorText;
    private ActionFailureKind failureKind;

    public static ActionResult success(ActionRequest request, Object output) {
        return ActionResult.builder()
                .actionRequest(request)
                .success(true)
                .output(output)
                .build();
    }

    public static ActionResult failure(ActionRequest request, ActionFailureKind kind, String errorText) {
        return ActionResult.builder()
                .actionRequest(request)
                .success(false)
                .errorText(errorText)
                .failureKind(kind)
                .build();
    }
}
