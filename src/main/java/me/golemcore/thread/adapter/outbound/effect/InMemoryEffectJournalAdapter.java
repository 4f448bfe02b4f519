package me.golemcore.thread.adapter.outbound.effect;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.thread.infrastructure.config.ThreadProperties;
import me.golemcore.thread.port.outbound.EffectJournalPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Process-local effect journal. Successful results are kept for
 * {@code thread.effects.retention-minutes} and evicted by a background task.
 */
@Component
@Slf4j
public class InMemoryEffectJournalAdapter implements EffectJournalPort {

    private final Map<String, RecordedEffect> effects = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration retention;

    private ScheduledExecutorService cleanupExecutor;

    public InMemoryEffectJournalAdapter(Clock clock, ThreadProperties properties) {
        this.clock = clock;
        this.retention = Duration.ofMinutes(properties.getEffects().getRetentionMinutes());
    }

    @PostConstruct
    public void init() {
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "effect-journal-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleAtFixedRate(this::evictExpired, 1, 1, TimeUnit.MINUTES);
    }

    @PreDestroy
    public void destroy() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
            try {
                cleanupExecutor.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T run(String effectId, Supplier<T> operation) {
        RecordedEffect recorded = effects.get(effectId);
        if (recorded != null) {
            log.debug("[Effects] Replaying recorded result of {}", effectId);
            return (T) recorded.value();
        }
        T value = operation.get();
        effects.put(effectId, new RecordedEffect(value, clock.instant()));
        return value;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> runAsync(String effectId, Supplier<CompletableFuture<T>> operation) {
        RecordedEffect recorded = effects.get(effectId);
        if (recorded != null) {
            log.debug("[Effects] Replaying recorded result of {}", effectId);
            return CompletableFuture.completedFuture((T) recorded.value());
        }
        CompletableFuture<T> future = operation.get();
        if (future == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Effect " + effectId
                    + " returned no future"));
        }
        return future.thenApply(value -> {
            effects.put(effectId, new RecordedEffect(value, clock.instant()));
            return value;
        });
    }

    @Override
    public boolean isRecorded(String effectId) {
        return effects.containsKey(effectId);
    }

    int evictExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int before = effects.size();
        effects.entrySet().removeIf(entry -> entry.getValue().recordedAt().isBefore(cutoff));
        int evicted = before - effects.size();
        if (evicted > 0) {
            log.debug("[Effects] Evicted {} expired effect(s)", evicted);
        }
        return evicted;
    }

    private record RecordedEffect(Object value, Instant recordedAt) {
    }
}
