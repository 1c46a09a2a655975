package com.dumpstermap.cleaner;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handle on an in-progress website validation started by {@link WebsiteValidator#start(List)}.
 * <p>
 * Progress can be polled without blocking; {@link #await()} blocks until every probe has produced its verdict.
 */
public final class ValidationRun {
    private final int total;
    private final AtomicInteger completed;
    private final CompletableFuture<List<Listing>> result;

    ValidationRun(int total, AtomicInteger completed, CompletableFuture<List<Listing>> result) {
        this.total = total;
        this.completed = completed;
        this.result = result;
    }

    /** Number of probes in this run (listings with a website). */
    public int total() {
        return total;
    }

    /** Number of probes that have produced a verdict so far. */
    public int completed() {
        return completed.get();
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * Waits for every verdict.
     * @return all listings of the run in input order, probed ones carrying a {@link WebsiteCheck}
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public List<Listing> await() throws InterruptedException {
        try {
            return result.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Website validation did not complete", e.getCause());
        }
    }
}
