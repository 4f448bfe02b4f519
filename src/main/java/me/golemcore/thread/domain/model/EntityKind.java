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

import java.util.Arrays;
import java.util.List;

/**
 * Entity kinds whose status is governed by the transition contract.
 */
public enum EntityKind {
    THREAD("thread", ThreadStatus.values()),
    CONTEXT("context", ContextStatus.values()),
    EXECUTION("execution", ExecutionStatus.values()),
    STEP("step", StepStatus.values()),
    ITEM("item", ItemStatus.values());

    private final String label;
    private final List<String> statuses;

    EntityKind(String label, Enum<?>[] statuses) {
        this.label = label;
        this.statuses = Arrays.stream(statuses).map(Object::toString).toList();
    }

    public String getLabel() {
        return label;
    }

    /**
     * Name of the status attribute as it appears in transition errors, e.g.
     * {@code step.status}.
     */
    public String getStatusField() {
        return label + ".status";
    }

    public List<String> getStatuses() {
        return statuses;
    }
}
