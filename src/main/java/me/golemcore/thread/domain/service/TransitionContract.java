package me.golemcore.thread.domain.service;

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

import me.golemcore.thread.domain.model.ContextStatus;
import me.golemcore.thread.domain.model.EntityKind;
import me.golemcore.thread.domain.model.ExecutionStatus;
import me.golemcore.thread.domain.model.InvalidPartKeyException;
import me.golemcore.thread.domain.model.InvalidTransitionException;
import me.golemcore.thread.domain.model.ItemStatus;
import me.golemcore.thread.domain.model.StepStatus;
import me.golemcore.thread.domain.model.ThreadStatus;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single source of truth for legal status transitions.
 *
 * <p>
 * Pure and side-effect free. The loop controller, the store adapters and the
 * stream timeline validator all call {@link #assertTransition} rather than
 * deciding legality on their own.
 *
 * <pre>
 * thread     idle -> streaming, streaming -> idle
 * context    open -> closed, closed -> open
 * execution  executing -> completed | failed
 * step       running -> completed | failed
 * item       stored -> pending | completed, pending -> completed
 * </pre>
 */
public final class TransitionContract {

    private static final Map<EntityKind, List<Transition>> TABLES = new EnumMap<>(EntityKind.class);

    static {
        TABLES.put(EntityKind.THREAD, List.of(
                transition(ThreadStatus.IDLE, ThreadStatus.STREAMING),
                transition(ThreadStatus.STREAMING, ThreadStatus.IDLE)));
        TABLES.put(EntityKind.CONTEXT, List.of(
                transition(ContextStatus.OPEN, ContextStatus.CLOSED),
                transition(ContextStatus.CLOSED, ContextStatus.OPEN)));
        TABLES.put(EntityKind.EXECUTION, List.of(
                transition(ExecutionStatus.EXECUTING, ExecutionStatus.COMPLETED),
                transition(ExecutionStatus.EXECUTING, ExecutionStatus.FAILED)));
        TABLES.put(EntityKind.STEP, List.of(
                transition(StepStatus.RUNNING, StepStatus.COMPLETED),
                transition(StepStatus.RUNNING, StepStatus.FAILED)));
        TABLES.put(EntityKind.ITEM, List.of(
                transition(ItemStatus.STORED, ItemStatus.PENDING),
                transition(ItemStatus.STORED, ItemStatus.COMPLETED),
                transition(ItemStatus.PENDING, ItemStatus.COMPLETED)));
    }

    private TransitionContract() {
    }

    public static List<Transition> transitions(EntityKind kind) {
        return TABLES.get(kind);
    }

    public static boolean can(EntityKind kind, String from, String to) {
        Objects.requireNonNull(kind, "kind");
        return TABLES.get(kind).stream()
                .anyMatch(transition -> transition.from().equals(from) && transition.to().equals(to));
    }

    public static void assertTransition(EntityKind kind, String from, String to) {
        if (!can(kind, from, to)) {
            throw new InvalidTransitionException(kind, from, to);
        }
    }

    public static void assertTransition(ThreadStatus from, ThreadStatus to) {
        assertTransition(EntityKind.THREAD, String.valueOf(from), String.valueOf(to));
    }

    public static void assertTransition(ContextStatus from, ContextStatus to) {
        assertTransition(EntityKind.CONTEXT, String.valueOf(from), String.valueOf(to));
    }

    public static void assertTransition(ExecutionStatus from, ExecutionStatus to) {
        assertTransition(EntityKind.EXECUTION, String.valueOf(from), String.valueOf(to));
    }

    public static void assertTransition(StepStatus from, StepStatus to) {
        assertTransition(EntityKind.STEP, String.valueOf(from), String.valueOf(to));
    }

    public static void assertTransition(ItemStatus from, ItemStatus to) {
        assertTransition(EntityKind.ITEM, String.valueOf(from), String.valueOf(to));
    }

    public static String partKey(String stepId, int idx) {
        return stepId + ":" + idx;
    }

    public static void assertPartKey(String stepId, int idx, String key) {
        String expected = partKey(stepId, idx);
        if (!expected.equals(key)) {
            throw new InvalidPartKeyException(expected, key);
        }
    }

    private static Transition transition(Enum<?> from, Enum<?> to) {
        return new Transition(from.toString(), to.toString());
    }

    /**
     * One permitted {@code (from, to)} pair, in wire values.
     */
    public record Transition(String from, String to) {
    }
}
