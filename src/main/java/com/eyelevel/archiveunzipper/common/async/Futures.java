package com.eyelevel.archiveunzipper.common.async;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Waits on SDK futures one at a time. Waiting is interruptible: an interrupted caller cancels the
 * in-flight call instead of blocking until it finishes.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Blocks until the future completes and returns its value.
     *
     * @throws CompletionException   wrapping the interrupt when the waiting thread is interrupted; the
     *                               interrupt flag is restored and the future cancelled.
     * @throws CancellationException if the future was cancelled.
     * @throws RuntimeException      the future's own failure, unwrapped when it is unchecked.
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CompletionException("Interrupted while waiting for a remote call", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new CompletionException(cause);
        }
    }
}
