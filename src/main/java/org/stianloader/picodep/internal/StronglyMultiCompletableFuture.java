package org.stianloader.picodep.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A {@link CompletableFuture} that only completes when all futures complete,
 * exceptionally or not. The resulting future will only exceptionally complete if all
 * other futures complete exceptionally, otherwise it will complete normally once the last
 * future completes. The results of the normally completed futures are listed in the order
 * the futures were passed in.
 */
public class StronglyMultiCompletableFuture<T> extends CompletableFuture<List<T>> {

    private final T[] results;
    private final Throwable[] exceptions;
    private final AtomicInteger completions = new AtomicInteger();
    private int exceptionally = 0;

    @SuppressWarnings("unchecked")
    public StronglyMultiCompletableFuture(List<CompletableFuture<T>> sources) {
        this.exceptions = new Throwable[sources.size()];
        this.results = (T[]) new Object[sources.size()];
        for (int i = 0; i < sources.size(); i++) {
            CompletableFuture<T> future = sources.get(i);
            final int futureIndex = i;
            future.whenComplete((res, ex) -> {
                if (ex == null) {
                    this.sourceCompleted(futureIndex, res);
                } else {
                    this.sourceException(futureIndex, ex);
                }
            });
        }
        if (sources.isEmpty()) {
            this.complete(new ArrayList<>());
        }
    }

    private void sourceCompleted(int i, T result) {
        Objects.requireNonNull(result);
        synchronized (this) {
            if (this.exceptions[i] != null || this.results[i] != null) {
                return;
            }
            this.results[i] = result;
            this.completeIfDone();
        }
    }

    private void sourceException(int i, Throwable exception) {
        Objects.requireNonNull(exception);
        synchronized (this) {
            if (this.exceptions[i] != null || this.results[i] != null) {
                return;
            }
            this.exceptions[i] = exception;
            if (++this.exceptionally == this.exceptions.length) {
                if (!this.isDone()) {
                    this.completeExceptionally(this.generateException().fillInStackTrace());
                }
            }
            this.completeIfDone();
        }
    }

    private void completeIfDone() {
        if (this.completions.incrementAndGet() == this.results.length && !this.isDone()) {
            List<T> results = new ArrayList<>();
            for (T t : this.results) {
                if (t != null) {
                    results.add(t);
                }
            }
            this.complete(results);
        }
    }

    protected CompletionException generateException() {
        return new MultiCompletionException(this.exceptions);
    }
}
