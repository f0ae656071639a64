package com.nodeflow.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeoutGuardTest {

    private final TimeoutGuard guard = new TimeoutGuard();

    @AfterEach
    void close() {
        guard.close();
    }

    @Test
    void withTimeout_neverSettling_rejectsAtDeadlineAndIgnoresLateValue() {
        CompletableFuture<String> source = new CompletableFuture<>();
        long startNanos = System.nanoTime();

        CompletableFuture<String> guarded = guard.withTimeout(() -> source, 50);
        CompletionException e = assertThrows(CompletionException.class, guarded::join);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        NodeTimeoutException timeout = assertInstanceOf(NodeTimeoutException.class, e.getCause());
        assertEquals(50, timeout.getTimeoutMs());
        assertTrue(elapsedMs >= 45, "rejected too early: " + elapsedMs);
        assertTrue(elapsedMs < 2000, "rejected too late: " + elapsedMs);

        assertFalse(source.complete("late"));
        assertTrue(source.isCancelled());
        assertTrue(guarded.isCompletedExceptionally());
        assertTrue(NodeTimeoutException.isTimeout(assertThrows(CompletionException.class, guarded::join)));
    }

    @Test
    void withTimeout_settlesFirst_passesValueThrough() {
        CompletableFuture<String> guarded = guard.withTimeout(() -> CompletableFuture.supplyAsync(() -> "ok"), 5000);

        assertEquals("ok", guarded.join());
    }

    @Test
    void withTimeout_sourceFails_passesCauseUnwrapped() {
        IllegalStateException failure = new IllegalStateException("nope");

        CompletableFuture<String> guarded = guard.withTimeout(
                () -> CompletableFuture.supplyAsync(() -> {
                    throw failure;
                }), 5000);

        CompletionException e = assertThrows(CompletionException.class, guarded::join);
        assertSame(failure, e.getCause());
    }

    @Test
    void withTimeout_synchronousThrow_yieldsFailedFuture() {
        IllegalArgumentException failure = new IllegalArgumentException("bad");

        CompletableFuture<String> guarded = guard.withTimeout(() -> {
            throw failure;
        }, 1000);

        assertTrue(guarded.isCompletedExceptionally());
        assertSame(failure, assertThrows(CompletionException.class, guarded::join).getCause());
    }

    @Test
    void withTimeout_nonPositiveDeadline_neverTimesOut() throws Exception {
        CompletableFuture<String> source = new CompletableFuture<>();

        CompletableFuture<String> guarded = guard.withTimeout(() -> source, 0);
        Thread.sleep(100);

        assertFalse(guarded.isDone());
        source.complete("eventually");
        assertEquals("eventually", guarded.join());
    }

    @Test
    void withTimeout_blockingSupplier_stillTimesOut() {
        CompletableFuture<String> guarded = guard.withTimeout(() -> {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return CompletableFuture.completedFuture("too slow");
        }, 50, "Blocking call");

        CompletionException e = assertThrows(CompletionException.class, guarded::join);
        assertEquals("Blocking call timed out after 50ms", e.getCause().getMessage());
    }
}
