package me.golemcore.thread.adapter.outbound.effect;

import me.golemcore.thread.infrastructure.config.ThreadProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InMemoryEffectJournalAdapterTest {

    @Test
    void shouldRunOperationOnceAndReplayResult() {
        InMemoryEffectJournalAdapter journal = new InMemoryEffectJournalAdapter(Clock.systemUTC(),
                new ThreadProperties());
        AtomicInteger calls = new AtomicInteger();

        String first = journal.run("effect:t1:react:0", () -> "result-" + calls.incrementAndGet());
        String second = journal.run("effect:t1:react:0", () -> "result-" + calls.incrementAndGet());

        assertEquals("result-1", first);
        assertEquals("result-1", second);
        assertEquals(1, calls.get());
        assertTrue(journal.isRecorded("effect:t1:react:0"));
    }

    @Test
    void shouldNotRecordFailedOperation() {
        InMemoryEffectJournalAdapter journal = new InMemoryEffectJournalAdapter(Clock.systemUTC(),
                new ThreadProperties());

        assertThrows(IllegalStateException.class, () -> journal.run("effect:t1:save", () -> {
            throw new IllegalStateException("boom");
        }));

        assertFalse(journal.isRecorded("effect:t1:save"));
        assertEquals("ok", journal.run("effect:t1:save", () -> "ok"));
    }

    @Test
    void shouldRecordAsyncResultOnlyOnSuccess() {
        InMemoryEffectJournalAdapter journal = new InMemoryEffectJournalAdapter(Clock.systemUTC(),
                new ThreadProperties());

        CompletableFuture<String> failed = journal.runAsync("effect:t1:action:a",
                () -> CompletableFuture.failedFuture(new IllegalStateException("nope")));
        CompletableFuture<String> succeeded = journal.runAsync("effect:t1:action:b",
                () -> CompletableFuture.completedFuture("done"));

        assertTrue(failed.isCompletedExceptionally());
        assertFalse(journal.isRecorded("effect:t1:action:a"));
        assertEquals("done", succeeded.join());
        assertEquals("done", journal.runAsync("effect:t1:action:b",
                () -> CompletableFuture.completedFuture("again")).join());
    }

    @Test
    void shouldEvictExpiredEffects() {
        Clock clock = mock(Clock.class);
        Instant start = Instant.parse("2026-01-01T00:00:00Z");
        when(clock.instant()).thenReturn(start, start.plusSeconds(61 * 60));
        InMemoryEffectJournalAdapter journal = new InMemoryEffectJournalAdapter(clock, new ThreadProperties());
        journal.run("effect:t1:react:0", () -> "x");

        int evicted = journal.evictExpired();

        assertEquals(1, evicted);
        assertFalse(journal.isRecorded("effect:t1:react:0"));
    }
}
