package com.flightphotos.scraper.monitor;

import com.flightphotos.scraper.model.ScrapeJobState;
import com.flightphotos.scraper.store.ScrapeJobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Progress and control surface for the scrape queue.
 *
 * Counts come straight from the job store on every snapshot, the timing figures
 * from the last {@value #DURATION_SAMPLES} finished tasks.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JobMonitor {

    static final int DURATION_SAMPLES = 50;

    private final ScrapeJobStore jobStore;
    private final ScrapeAdmission admission;

    private final Deque<Long> durationsMillis = new ArrayDeque<>();
    private final AtomicLong failedTotal = new AtomicLong();

    public void recordDuration(Duration duration) {
        synchronized (durationsMillis) {
            durationsMillis.addLast(duration.toMillis());
            while (durationsMillis.size() > DURATION_SAMPLES) {
                durationsMillis.removeFirst();
            }
        }
    }

    /** Called exactly once for each job that reaches FAILED */
    public void recordFailure(String registration, String source, String reason) {
        long total = failedTotal.incrementAndGet();
        log.warn("Scrape job {}/{} failed ({} failed so far): {}", registration, source, total, reason);
    }

    public long getFailedTotal() {
        return failedTotal.get();
    }

    public JobMonitorSnapshot snapshot() {
        Map<ScrapeJobState, Integer> counts = jobStore.countByState();
        boolean paused = admission.isPaused();
        int maxConcurrency = admission.getMaxConcurrency();
        Long average = averageMillis();

        Long eta = null;
        if (!paused && average != null) {
            int queued = counts.getOrDefault(ScrapeJobState.QUEUED, 0);
            int effective = Math.max(1, Math.min(maxConcurrency, queued));
            eta = Math.round(queued * (average / 1000.0) / effective);
        }

        return JobMonitorSnapshot.builder()
                .counts(counts)
                .paused(paused)
                .maxConcurrency(maxConcurrency)
                .inFlight(admission.getInFlight())
                .averageTaskMillis(average)
                .etaSeconds(eta)
                .failedTotal(failedTotal.get())
                .takenAt(Instant.now())
                .build();
    }

    public void pause() {
        admission.pause();
        log.info("Scraping paused, running tasks will finish");
    }

    public void resume() {
        admission.resume();
        log.info("Scraping resumed");
    }

    public void setMaxConcurrency(int value) {
        admission.setMaxConcurrency(value);
        log.info("Scrape concurrency set to {}", value);
    }

    private Long averageMillis() {
        synchronized (durationsMillis) {
            if (durationsMillis.isEmpty()) return null;
            long sum = 0;
            for (long d : durationsMillis) sum += d;
            return sum / durationsMillis.size();
        }
    }
}
