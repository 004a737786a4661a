package com.brewuv.input;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.function.Supplier;

/**
 * Single-flight lazy value. The first caller computes it, concurrent callers wait for that computation,
 * and later callers get the stored value. A failure is stored too and re-thrown to every caller.
 */
public final class Memoized<T> {
    private final FutureTask<T> task;

    public Memoized(Supplier<T> supplier) {
        this.task = new FutureTask<>(supplier::get);
    }

    public T get() {
        // no-op unless this is the first call
        task.run();
        try {
            return task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for a shared input", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(cause);
        }
    }

    public boolean isDone() {
        return task.isDone();
    }
}
