package com.tdnet.ingestion.transfer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Sliding-window limiter: at most {@code maxPerSecond} admissions in any trailing one-second window,
 * shared by every transfer worker. Waiting happens while holding the lock, so callers queue up behind it.
 */
public class RateLimiter {

    private static final long WINDOW_NANOS = TimeUnit.SECONDS.toNanos(1);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long nanos) throws InterruptedException;
    }

    private final int maxPerSecond;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private final Deque<Long> window = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock(true);

    public RateLimiter(int maxPerSecond) {
        this(maxPerSecond, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    }

    public RateLimiter(int maxPerSecond, LongSupplier nanoClock, Sleeper sleeper) {
        if (maxPerSecond < 1) {
            throw new IllegalArgumentException("maxPerSecond must be >= 1 but was " + maxPerSecond);
        }
        this.maxPerSecond = maxPerSecond;
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until one more request fits in the window, records it and returns its admission time
     * (in the limiter's clock).
     */
    public long acquire() {
        lock.lock();
        try {
            long now = nanoClock.getAsLong();
            evict(now);
            while (window.size() >= maxPerSecond) {
                long waitNanos = window.peekFirst() + WINDOW_NANOS - now;
                if (waitNanos > 0) {
                    sleeper.sleep(waitNanos);
                }
                now = nanoClock.getAsLong();
                evict(now);
            }
            window.addLast(now);
            return now;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a request slot", e);
        } finally {
            lock.unlock();
        }
    }

    private void evict(long now) {
        while (!window.isEmpty() && now - window.peekFirst() >= WINDOW_NANOS) {
            window.pollFirst();
        }
    }
}
