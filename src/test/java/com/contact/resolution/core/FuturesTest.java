package com.contact.resolution.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Futures Tests")
class FuturesTest {

    @Test
    @DisplayName("Unwrap strips nested completion wrappers")
    void unwrap() {
        IllegalStateException root = new IllegalStateException("root");
        Throwable wrapped = new CompletionException(new ExecutionException(root));

        assertSame(root, Futures.unwrap(wrapped));
        assertSame(root, Futures.unwrap(root));
    }

    @Test
    @DisplayName("Join rethrows the original runtime exception")
    void joinRethrowsCause() {
        CompletableFuture<String> failed = CompletableFuture.failedFuture(new IllegalArgumentException("bad"));

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> Futures.join(failed));
        assertEquals("bad", error.getMessage());
        assertEquals("ok", Futures.join(CompletableFuture.completedFuture("ok")));
    }

    @Test
    @DisplayName("Call turns throws and missing futures into failed futures")
    void call() {
        CompletableFuture<String> thrown = Futures.call(() -> {
            throw new IllegalStateException("sync");
        });
        CompletableFuture<String> missing = Futures.call(() -> null);

        assertTrue(thrown.isCompletedExceptionally());
        assertTrue(missing.isCompletedExceptionally());
        assertThrows(IllegalStateException.class, () -> Futures.join(missing));
    }
}
