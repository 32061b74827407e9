package com.flightphotos.scraper.ratelimit;

import java.util.concurrent.TimeUnit;

/**
 * Monotonic clock plus sleep, split out so the limiter can be driven by a fake clock.
 */
public interface TimeSource {

    long nanoTime();

    void sleepNanos(long nanos) throws InterruptedException;

    TimeSource SYSTEM = new TimeSource() {
        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public void sleepNanos(long nanos) throws InterruptedException {
            TimeUnit.NANOSECONDS.sleep(nanos);
        }
    };
}
