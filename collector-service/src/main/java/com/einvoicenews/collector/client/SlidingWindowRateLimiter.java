package com.einvoicenews.collector.client;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Admits at most {@code maxCalls} acquisitions in any rolling window.
 * Callers block until a slot frees up and are served in arrival order.
 */
public class SlidingWindowRateLimiter {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxCalls;
    private final long windowNanos;
    private final LongSupplier ticker;
    private final Sleeper sleeper;

    // admission times, oldest first
    private final Deque<Long> admitted = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock(true);

    public SlidingWindowRateLimiter(int maxCalls, Duration window) {
        this(maxCalls, window, System::nanoTime, d -> TimeUnit.NANOSECONDS.sleep(d.toNanos()));
    }

    public SlidingWindowRateLimiter(int maxCalls, Duration window, LongSupplier ticker, Sleeper sleeper) {
        if (maxCalls < 1) {
            throw new IllegalArgumentException("maxCalls must be positive: " + maxCalls);
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.maxCalls = maxCalls;
        this.windowNanos = window.toNanos();
        this.ticker = ticker;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until the call may proceed.
     *
     * @return how long the caller waited
     */
    public Duration acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            long start = ticker.getAsLong();
            while (true) {
                long now = ticker.getAsLong();
                evictExpired(now);
                if (admitted.size() < maxCalls) {
                    admitted.addLast(now);
                    return Duration.ofNanos(now - start);
                }
                long waitNanos = admitted.peekFirst() + windowNanos - now;
                if (waitNanos > 0) {
                    sleeper.sleep(Duration.ofNanos(waitNanos));
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void evictExpired(long now) {
        while (!admitted.isEmpty() && now - admitted.peekFirst() >= windowNanos) {
            admitted.removeFirst();
        }
    }
}
