package com.flightphotos.scraper.ratelimit;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-window limiter for one photo site: at most maxRequests slots are
 * handed out in any window-long interval.
 *
 * A caller that finds the window full sleeps until the oldest slot expires and
 * then competes again. Callers block, they are never rejected. The lock only
 * guards the bookkeeping, nobody sleeps while holding it.
 */
@Slf4j
public class SlidingWindowRateLimiter {

    @Getter
    private final String domain;
    @Getter
    private final int maxRequests;
    private final long windowNanos;
    private final TimeSource time;

    private final Deque<Long> grants = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock(true);

    public SlidingWindowRateLimiter(String domain, int maxRequests, Duration window, TimeSource time) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1 for " + domain);
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive for " + domain);
        }
        this.domain = domain;
        this.maxRequests = maxRequests;
        this.windowNanos = window.toNanos();
        this.time = time;
    }

    /**
     * Take a slot, waiting as long as needed for one to free up.
     */
    public void acquire() throws InterruptedException {
        while (true) {
            long waitNanos;
            lock.lock();
            try {
                long now = time.nanoTime();
                evictExpired(now);
                if (grants.size() < maxRequests) {
                    grants.addLast(now);
                    return;
                }
                waitNanos = grants.peekFirst() + windowNanos - now;
            } finally {
                lock.unlock();
            }

            log.debug("Rate limit reached for {} ({} per window), waiting {}ms",
                    domain, maxRequests, waitNanos / 1_000_000);
            time.sleepNanos(Math.max(waitNanos, 1));
        }
    }

    /** Slots currently counted against the window */
    public int inWindow() {
        lock.lock();
        try {
            evictExpired(time.nanoTime());
            return grants.size();
        } finally {
            lock.unlock();
        }
    }

    private void evictExpired(long now) {
        while (!grants.isEmpty() && now - grants.peekFirst() >= windowNanos) {
            grants.pollFirst();
        }
    }
}
