package com.cryptoledger.common;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Evenly spaced request limiter for the CoinGecko API. Each permit reserves the next free slot, so
 * concurrent callers queue up one interval apart.
 */
public class RateLimiter {

    private static final long NANOS_PER_MINUTE = TimeUnit.MINUTES.toNanos(1);

    private final long intervalNanos;
    private final LongSupplier nanoClock;
    private long nextSlotNanos;
    private boolean started;

    /**
     * @param permitsPerMinute e.g. 30 for the public CoinGecko tier
     */
    public RateLimiter(int permitsPerMinute) {
        this(permitsPerMinute, System::nanoTime);
    }

    RateLimiter(int permitsPerMinute, LongSupplier nanoClock) {
        if (permitsPerMinute <= 0) {
            throw new IllegalArgumentException("permitsPerMinute must be positive");
        }
        this.intervalNanos = NANOS_PER_MINUTE / permitsPerMinute;
        this.nanoClock = nanoClock;
    }

    /**
     * Blocks until the reserved slot is reached.
     */
    public void acquire() {
        long waitNanos = reserve();
        if (waitNanos <= 0) {
            return;
        }
        try {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for rate limiter", e);
        }
    }

    /**
     * Takes a permit only when one is free right now.
     */
    public synchronized boolean tryAcquire() {
        long now = nanoClock.getAsLong();
        if (started && now - nextSlotNanos < 0) {
            return false;
        }
        started = true;
        nextSlotNanos = now + intervalNanos;
        return true;
    }

    public long intervalNanos() {
        return intervalNanos;
    }

    private synchronized long reserve() {
        long now = nanoClock.getAsLong();
        if (!started || now - nextSlotNanos >= 0) {
            started = true;
            nextSlotNanos = now + intervalNanos;
            return 0;
        }
        long slot = nextSlotNanos;
        nextSlotNanos = slot + intervalNanos;
        return slot - now;
    }
}
