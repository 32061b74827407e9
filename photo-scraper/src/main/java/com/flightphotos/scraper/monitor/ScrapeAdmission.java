package com.flightphotos.scraper.monitor;

import com.flightphotos.scraper.config.FlightPhotoProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Global admission control for scrape tasks: how many may be in flight, and
 * whether new ones may start at all. Independent of the per-site rate limiters.
 */
@Component
public class ScrapeAdmission {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final int maxPoolSize;

    private boolean paused;
    private int maxConcurrency;
    private int inFlight;

    public ScrapeAdmission(FlightPhotoProperties properties) {
        this.maxPoolSize = properties.getOrchestrator().getMaxPoolSize();
        this.maxConcurrency = Math.max(1, Math.min(properties.getOrchestrator().getMaxConcurrency(), maxPoolSize));
    }

    /** Blocks while paused or at the concurrency limit, then takes a slot */
    public void acquire() throws InterruptedException {
        lock.lock();
        try {
            while (paused || inFlight >= maxConcurrency) {
                changed.await();
            }
            inFlight++;
        } finally {
            lock.unlock();
        }
    }

    public void release() {
        lock.lock();
        try {
            if (inFlight > 0) inFlight--;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void pause() {
        lock.lock();
        try {
            paused = true;
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            paused = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void setMaxConcurrency(int value) {
        if (value < 1 || value > maxPoolSize) {
            throw new IllegalArgumentException("Concurrency must be between 1 and " + maxPoolSize + ", got " + value);
        }
        lock.lock();
        try {
            maxConcurrency = value;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    public int getMaxConcurrency() {
        lock.lock();
        try {
            return maxConcurrency;
        } finally {
            lock.unlock();
        }
    }

    public int getInFlight() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }
}
