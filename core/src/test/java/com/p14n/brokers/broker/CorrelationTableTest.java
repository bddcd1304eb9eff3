package com.p14n.brokers.broker;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class CorrelationTableTest {

    private DefaultExecutor executor;
    private CorrelationTable<String> table;

    @BeforeEach
    void setUp() {
        executor = new DefaultExecutor();
        table = new CorrelationTable<>(executor);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void shouldCompleteCallWithReply() {
        CompletableFuture<String> f = table.register("a", Duration.ofSeconds(1), null);

        assertTrue(table.resolve("a", "pong"));
        assertEquals("pong", f.join());
        assertEquals(0, table.size());
    }

    @Test
    void shouldIgnoreReplyForUnknownId() {
        CompletableFuture<String> f = table.register("a", null, null);

        assertFalse(table.resolve("b", "stray"));
        assertFalse(table.resolve(null, "stray"));
        assertFalse(f.isDone());
        assertTrue(table.isPending("a"));
    }

    @Test
    void shouldIgnoreSecondReply() {
        CompletableFuture<String> f = table.register("a", null, null);

        assertTrue(table.resolve("a", "first"));
        assertFalse(table.resolve("a", "second"));
        assertEquals("first", f.join());
    }

    @Test
    void shouldTimeOutNoEarlierThanWindow() {
        long start = System.nanoTime();
        CompletableFuture<String> f = table.register("a", Duration.ofMillis(100), null);

        CompletionException e = assertThrows(CompletionException.class, f::join);
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertInstanceOf(CallTimeoutException.class, e.getCause());
        assertEquals("a", ((CallTimeoutException) e.getCause()).correlationId());
        assertTrue(elapsed >= 100, "timed out after " + elapsed + "ms");
        assertTrue(elapsed < 600, "timed out after " + elapsed + "ms");
        assertFalse(table.isPending("a"));
    }

    @Test
    void shouldIgnoreReplyAfterTimeout() {
        CompletableFuture<String> f = table.register("a", Duration.ofMillis(20), null);

        assertThrows(CompletionException.class, f::join);
        assertFalse(table.resolve("a", "late"));
    }

    @Test
    void shouldRejectWhenCancellationCompletes() {
        var cancel = new CompletableFuture<Void>();
        CompletableFuture<String> f = table.register("a", Duration.ofSeconds(5), cancel);

        cancel.complete(null);

        CompletionException e = assertThrows(CompletionException.class, f::join);
        assertInstanceOf(CallCancelledException.class, e.getCause());
        assertEquals(0, table.size());
    }

    @Test
    void shouldDiscardEntryWhenCallerCancels() {
        CompletableFuture<String> f = table.register("a", Duration.ofSeconds(5), null);

        f.cancel(false);

        assertFalse(table.isPending("a"));
        assertFalse(table.resolve("a", "late"));
    }

    @Test
    void shouldFailAllPendingCalls() {
        CompletableFuture<String> a = table.register("a", null, null);
        CompletableFuture<String> b = table.register("b", Duration.ofSeconds(5), null);
        var cause = new ConnectionLostException("gone");

        assertEquals(2, table.failAll(cause));

        assertSame(cause, assertThrows(CompletionException.class, a::join).getCause());
        assertSame(cause, assertThrows(CompletionException.class, b::join).getCause());
        assertEquals(0, table.size());
    }

    @Test
    void shouldRejectDuplicateId() {
        table.register("a", null, null);

        assertThrows(IllegalArgumentException.class, () -> table.register("a", null, null));
    }
}
