package org.stianloader.picodep.internal;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;

public class ConcurrencyUtil {

    @NotNull
    public static <T> CompletableFuture<T> schedule(@NotNull Callable<T> source, @NotNull Executor executor) {
        Objects.requireNonNull(source, "source may not be null");

        CompletableFuture<T> cf = new CompletableFuture<>();
        executor.execute(() -> {
            if (cf.isDone()) {
                return;
            }
            try {
                cf.complete(source.call());
            } catch (Throwable t) {
                cf.completeExceptionally(t);
            }
        });
        return cf;
    }

    /**
     * Obtains the cause of a failed future, unwrapping the {@link CompletionException}
     * layers that {@link CompletableFuture} adds.
     *
     * @param t The throwable a future completed with
     * @return The innermost throwable that is not a completion wrapper
     */
    @NotNull
    public static Throwable unwrap(@NotNull Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
