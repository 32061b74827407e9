package com.flightphotos.scraper.scheduler;

import com.flightphotos.scraper.config.FlightPhotoProperties;
import com.flightphotos.scraper.model.ScrapeJob;
import com.flightphotos.scraper.model.ScrapeJobState;
import com.flightphotos.scraper.store.SchemaInitializer;
import com.flightphotos.scraper.store.ScrapeJobStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Startup wiring and periodic rescans.
 *
 * Finished jobs are requeued as a new generation once they are old enough:
 * SUCCEEDED after rescan-interval (default 7 days, zero disables),
 * FAILED after failed-retry-delay (default 1 hour, zero disables).
 *
 * Override the sweep period with flight-photos.orchestrator.rescan-sweep-delay.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RescanScheduler {

    private final SchemaInitializer schemaInitializer;
    private final ScrapeOrchestrator orchestrator;
    private final ScrapeJobStore jobStore;
    private final FlightPhotoProperties properties;

    /**
     * On application startup:
     *  1. Ensure the database schema exists
     *  2. Start the dispatcher and worker pool
     *  3. Re-dispatch jobs interrupted by the last shutdown, if enabled
     */
    @PostConstruct
    public void onStartup() {
        try {
            schemaInitializer.ensureSchema();
        } catch (Exception e) {
            log.error("Could not initialise database schema: {}", e.getMessage(), e);
        }

        orchestrator.start();

        if (properties.getOrchestrator().isRecoverOnStartup()) {
            try {
                orchestrator.recover();
            } catch (Exception e) {
                log.error("Startup job recovery failed: {}", e.getMessage(), e);
            }
        }
    }

    @Scheduled(fixedDelayString = "${flight-photos.orchestrator.rescan-sweep-delay:PT5M}",
            initialDelayString = "${flight-photos.orchestrator.rescan-sweep-delay:PT5M}")
    public void scheduledSweep() {
        try {
            int requeued = rescanDue(Instant.now());
            if (requeued > 0) {
                log.info("Rescan sweep requeued {} jobs", requeued);
            }
        } catch (Exception e) {
            log.error("Rescan sweep failed: {}", e.getMessage(), e);
        }
    }

    /** Requeues every finished job that is due at {@code now} */
    public int rescanDue(Instant now) {
        FlightPhotoProperties.Orchestrator config = properties.getOrchestrator();
        return requeueOlderThan(ScrapeJobState.SUCCEEDED, config.getRescanInterval(), now)
                + requeueOlderThan(ScrapeJobState.FAILED, config.getFailedRetryDelay(), now);
    }

    private int requeueOlderThan(ScrapeJobState state, Duration age, Instant now) {
        if (age == null || age.isZero() || age.isNegative()) return 0;

        int requeued = 0;
        for (ScrapeJob job : jobStore.findCompletedBefore(state, now.minus(age))) {
            if (orchestrator.requeue(job.getRegistration(), job.getSource())) {
                log.debug("Requeued {} job {}/{}", state, job.getRegistration(), job.getSource());
                requeued++;
            }
        }
        return requeued;
    }
}
