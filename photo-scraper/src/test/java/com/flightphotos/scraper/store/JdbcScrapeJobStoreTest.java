package com.flightphotos.scraper.store;

import com.flightphotos.scraper.model.ScrapeJob;
import com.flightphotos.scraper.model.ScrapeJobState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcScrapeJobStoreTest {

    private TestDatabase db;
    private JdbcScrapeJobStore store;
    private final Instant now = Instant.parse("2024-03-01T12:00:00Z");

    @BeforeEach
    void setUp() {
        db = new TestDatabase();
        store = db.jobs();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void createsGenerationOneAndIgnoresActiveJobs() {
        ScrapeJob job = store.createOrRequeue("G-XLEA", "jetphotos", now).orElseThrow();

        assertThat(job.getGeneration()).isEqualTo(1);
        assertThat(job.getState()).isEqualTo(ScrapeJobState.QUEUED);
        assertThat(store.createOrRequeue("G-XLEA", "jetphotos", now)).isEmpty();

        store.markRunning(job.getId(), 1, now);
        assertThat(store.createOrRequeue("G-XLEA", "jetphotos", now)).isEmpty();
    }

    @Test
    void requeueOfFinishedJobBumpsGenerationAndFencesOldWork() {
        ScrapeJob job = store.createOrRequeue("G-XLEA", "jetphotos", now).orElseThrow();
        assertThat(store.markRunning(job.getId(), 1, now)).isTrue();
        assertThat(store.markSucceeded(job.getId(), 1, 12, now)).isTrue();

        ScrapeJob requeued = store.createOrRequeue("G-XLEA", "jetphotos", now.plusSeconds(60)).orElseThrow();

        assertThat(requeued.getId()).isEqualTo(job.getId());
        assertThat(requeued.getGeneration()).isEqualTo(2);
        assertThat(requeued.getState()).isEqualTo(ScrapeJobState.QUEUED);
        assertThat(requeued.getPhotosFound()).isZero();
        assertThat(store.markRunning(job.getId(), 1, now)).isFalse();
        assertThat(store.markRunning(job.getId(), 2, now)).isTrue();
    }

    @Test
    void claimSucceedsOnlyOnce() {
        ScrapeJob job = store.createOrRequeue("N12345", "planespotters", now).orElseThrow();

        assertThat(store.markRunning(job.getId(), 1, now)).isTrue();
        assertThat(store.markRunning(job.getId(), 1, now)).isFalse();
    }

    @Test
    void retryingAndFailureAreRecorded() {
        ScrapeJob job = store.createOrRequeue("N12345", "airlinersnet", now).orElseThrow();
        store.markRunning(job.getId(), 1, now);
        store.recordAttempt(job.getId(), 1, 1);
        assertThat(store.markRetrying(job.getId(), 1, 1, "HTTP 503")).isTrue();

        ScrapeJob retrying = store.findById(job.getId()).orElseThrow();
        assertThat(retrying.getState()).isEqualTo(ScrapeJobState.RETRYING);
        assertThat(retrying.getLastError()).isEqualTo("HTTP 503");

        assertThat(store.markFailed(job.getId(), 1, "gave up", now)).isTrue();
        assertThat(store.markFailed(job.getId(), 1, "again", now)).isFalse();
        assertThat(store.findById(job.getId()).orElseThrow().getLastError()).isEqualTo("gave up");
    }

    @Test
    void countsByStateIncludeZeroes() {
        ScrapeJob a = store.createOrRequeue("A", "jetphotos", now).orElseThrow();
        store.createOrRequeue("B", "jetphotos", now);
        store.markRunning(a.getId(), 1, now);

        assertThat(store.countByState())
                .containsEntry(ScrapeJobState.QUEUED, 1)
                .containsEntry(ScrapeJobState.RUNNING, 1)
                .containsEntry(ScrapeJobState.FAILED, 0);
    }

    @Test
    void findsJobsDueForRescan() {
        ScrapeJob old = store.createOrRequeue("OLD", "jetphotos", now).orElseThrow();
        ScrapeJob fresh = store.createOrRequeue("NEW", "jetphotos", now).orElseThrow();
        store.markRunning(old.getId(), 1, now);
        store.markSucceeded(old.getId(), 1, 1, now.minus(Duration.ofDays(10)));
        store.markRunning(fresh.getId(), 1, now);
        store.markSucceeded(fresh.getId(), 1, 1, now);

        assertThat(store.findCompletedBefore(ScrapeJobState.SUCCEEDED, now.minus(Duration.ofDays(7))))
                .extracting(ScrapeJob::getRegistration)
                .containsExactly("OLD");
    }

    @Test
    void orphanedJobsGoBackToQueued() {
        ScrapeJob job = store.createOrRequeue("G-XLEA", "jetphotos", now).orElseThrow();
        store.markRunning(job.getId(), 1, now);

        assertThat(store.resetActiveToQueued()).isEqualTo(1);

        ScrapeJob reset = store.find("G-XLEA", "jetphotos").orElseThrow();
        assertThat(reset.getState()).isEqualTo(ScrapeJobState.QUEUED);
        assertThat(reset.getGeneration()).isEqualTo(1);
    }
}
