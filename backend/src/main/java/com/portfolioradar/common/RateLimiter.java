package com.portfolioradar.common;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimum-interval rate limiter. Used for CoinGecko calls and for pacing assets during snapshot backfill.
 */
public class RateLimiter {

    private final long minIntervalNanos;
    private final AtomicLong nextFreeAtNanos = new AtomicLong(0);

    public RateLimiter(Duration minInterval) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must be non-negative");
        }
        this.minIntervalNanos = minInterval.toNanos();
    }

    /**
     * @param permitsPerMinute e.g. 30 for one permit every two seconds
     */
    public static RateLimiter perMinute(int permitsPerMinute) {
        if (permitsPerMinute <= 0) {
            throw new IllegalArgumentException("permitsPerMinute must be positive");
        }
        return new RateLimiter(Duration.ofNanos(60_000_000_000L / permitsPerMinute));
    }

    /**
     * Blocks until a permit is available.
     *
     * @throws IllegalStateException if interrupted while waiting (interrupt flag is restored)
     */
    public void acquire() {
        while (true) {
            long now = System.nanoTime();
            long next = nextFreeAtNanos.get();
            if (now >= next) {
                if (nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos)) {
                    return;
                }
                continue;
            }
            long waitNanos = next - now;
            try {
                Thread.sleep(waitNanos / 1_000_000, (int) (waitNanos % 1_000_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Rate limiter interrupted", e);
            }
        }
    }

    /**
     * Non-blocking variant: true if a permit was taken.
     */
    public boolean tryAcquire() {
        long now = System.nanoTime();
        long next = nextFreeAtNanos.get();
        return now >= next && nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos);
    }

    public Duration getMinInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }
}
