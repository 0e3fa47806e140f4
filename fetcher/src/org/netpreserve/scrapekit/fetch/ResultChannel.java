package org.netpreserve.scrapekit.fetch;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers the outcomes of a batch of fetches in completion order. Every request in the batch yields exactly
 * one outcome, cancelled ones included.
 */
public class ResultChannel {
    private final BlockingQueue<FetchOutcome> queue = new LinkedBlockingQueue<>();
    private final int expected;
    private final AtomicInteger taken = new AtomicInteger();

    ResultChannel(int expected) {
        this.expected = expected;
    }

    void deliver(FetchOutcome outcome) {
        queue.add(outcome);
    }

    public int expected() {
        return expected;
    }

    /**
     * Outcomes not yet taken, delivered or not.
     */
    public int remaining() {
        return expected - taken.get();
    }

    public boolean hasNext() {
        return remaining() > 0;
    }

    /**
     * Waits for the next outcome.
     *
     * @throws NoSuchElementException if all outcomes have been taken
     */
    public FetchOutcome next() throws InterruptedException {
        if (taken.getAndIncrement() >= expected) {
            taken.decrementAndGet();
            throw new NoSuchElementException("All " + expected + " outcomes already taken");
        }
        try {
            return queue.take();
        } catch (InterruptedException e) {
            taken.decrementAndGet();
            throw e;
        }
    }

    /**
     * Waits up to the timeout for the next outcome.
     *
     * @return the outcome, or null if none arrived in time or all have been taken
     */
    public @Nullable FetchOutcome poll(Duration timeout) throws InterruptedException {
        if (taken.getAndIncrement() >= expected) {
            taken.decrementAndGet();
            return null;
        }
        FetchOutcome outcome;
        try {
            outcome = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            taken.decrementAndGet();
            throw e;
        }
        if (outcome == null) taken.decrementAndGet();
        return outcome;
    }

    /**
     * Waits for every remaining outcome.
     */
    public List<FetchOutcome> awaitAll() throws InterruptedException {
        var outcomes = new ArrayList<FetchOutcome>();
        while (hasNext()) outcomes.add(next());
        return outcomes;
    }
}
