package com.flightphotos.scraper.store;

import com.flightphotos.scraper.model.ScrapeJob;
import com.flightphotos.scraper.model.ScrapeJobState;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable scrape job state. Every state change is a conditional update on
 * (id, generation, current state), so stale or duplicate work loses the race.
 */
public interface ScrapeJobStore {

    /**
     * Creates the (registration, source) job at generation 1, or requeues a finished
     * one as generation + 1.
     *
     * @return the queued job, or empty when the job is already queued or running
     */
    Optional<ScrapeJob> createOrRequeue(String registration, String source, Instant now);

    Optional<ScrapeJob> findById(long id);

    Optional<ScrapeJob> find(String registration, String source);

    /** QUEUED -> RUNNING for the given generation */
    boolean markRunning(long id, long generation, Instant now);

    /** Records the attempt number about to run */
    boolean recordAttempt(long id, long generation, int attempt);

    /** RUNNING/RETRYING -> RETRYING after a transient failure */
    boolean markRetrying(long id, long generation, int attempts, String error);

    boolean markSucceeded(long id, long generation, int photosFound, Instant now);

    boolean markFailed(long id, long generation, String error, Instant now);

    Map<ScrapeJobState, Integer> countByState();

    List<ScrapeJob> findByState(ScrapeJobState state);

    List<ScrapeJob> findAll();

    /** Jobs in {@code state} that completed before the cutoff */
    List<ScrapeJob> findCompletedBefore(ScrapeJobState state, Instant cutoff);

    /** RUNNING/RETRYING -> QUEUED, for jobs orphaned by a restart */
    int resetActiveToQueued();

    void deleteAll();
}
