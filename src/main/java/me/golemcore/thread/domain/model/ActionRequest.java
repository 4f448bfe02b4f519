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

import java.util.Map;

/**
 * An action the reactor asked for in one iteration.
 *
 * @param actionRef
 *            iteration-scoped call id, unique within the execution
 * @param actionName
 *            name of the requested action definition
 * @param input
 *            arguments produced by the reactor
 */
public record ActionRequest(String actionRef, String actionName, Map<String, Object> input) {

    public ActionRequest {
        input = input != null ? input : Map.of();
    }
}
