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

/**
 * Raised when a status change is not present in the transition table of its
 * entity kind. Always indicates a logic bug upstream and is never coerced.
 */
public class InvalidTransitionException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final EntityKind kind;
    private final String from;
    private final String to;

    public InvalidTransitionException(EntityKind kind, String from, String to) {
        super("Invalid " + kind.getStatusField() + " transition: " + from + " -> " + to);
        this.kind = kind;
        this.from = from;
        this.to = to;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }
}
