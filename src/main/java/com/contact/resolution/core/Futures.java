package com.contact.resolution.core;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Small helpers for working with {@link CompletableFuture} results at
 * synchronous call sites.
 */
public final class Futures {

    private Futures() {
        // Utility class
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Waits for the future and rethrows a failure as its original runtime exception
     * rather than as a {@link CompletionException}.
     */
    public static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    /**
     * Calls the supplier, turning a synchronous throw into a failed future so that
     * callers only ever deal with one failure channel.
     */
    public static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> supplier) {
        try {
            CompletableFuture<T> future = supplier.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("operation returned no future"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
