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

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Combinators over {@link CompletableFuture}.
 */
public final class FutureSupport {

    private FutureSupport() {
    }

    /**
     * Completes with the value of the first future that completes normally. Fails
     * only when every future failed, with the last failure. The other futures
     * are left running and their outcome is ignored.
     */
    public static <T> CompletableFuture<T> firstOf(List<? extends CompletableFuture<? extends T>> futures) {
        if (futures == null || futures.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("firstOf requires at least one future"));
        }
        CompletableFuture<T> winner = new CompletableFuture<>();
        AtomicInteger failures = new AtomicInteger();
        int total = futures.size();
        for (CompletableFuture<? extends T> future : futures) {
            future.whenComplete((value, error) -> {
                if (error == null) {
                    winner.complete(value);
                } else if (failures.incrementAndGet() == total) {
                    winner.completeExceptionally(error);
                }
            });
        }
        return winner;
    }

    /**
     * Unwraps completion wrappers and returns the innermost message, or the
     * exception's simple class name when it has none.
     */
    public static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
