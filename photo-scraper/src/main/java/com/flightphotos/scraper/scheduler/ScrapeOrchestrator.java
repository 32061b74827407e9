package com.flightphotos.scraper.scheduler;

import com.flightphotos.scraper.config.FlightPhotoProperties;
import com.flightphotos.scraper.itinerary.AirportDirectory;
import com.flightphotos.scraper.matching.CandidateMatcher;
import com.flightphotos.scraper.model.CandidatePhoto;
import com.flightphotos.scraper.model.Flight;
import com.flightphotos.scraper.model.PhotoSource;
import com.flightphotos.scraper.model.ScrapeJob;
import com.flightphotos.scraper.model.ScrapeJobState;
import com.flightphotos.scraper.model.ScrapedPhoto;
import com.flightphotos.scraper.monitor.JobMonitor;
import com.flightphotos.scraper.monitor.ScrapeAdmission;
import com.flightphotos.scraper.source.NoResultsException;
import com.flightphotos.scraper.source.PhotoSourceAdapter;
import com.flightphotos.scraper.source.ScrapeInterruptedException;
import com.flightphotos.scraper.source.SourceBlockedException;
import com.flightphotos.scraper.source.StructuralParseException;
import com.flightphotos.scraper.source.TransientScrapeException;
import com.flightphotos.scraper.store.CandidatePhotoStore;
import com.flightphotos.scraper.store.FlightStore;
import com.flightphotos.scraper.store.SchemaInitializer;
import com.flightphotos.scraper.store.ScrapeJobStore;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs scrape jobs: one per (registration, source), durable in the job store,
 * dispatched through an in-process channel to a fixed worker pool.
 *
 * Flow:
 *  1. scheduleRegistration() creates or requeues a job per enabled source and
 *     publishes (job, generation) to the channel
 *  2. The dispatcher thread waits for an admission slot (pause / concurrency limit)
 *     and hands the message to a worker
 *  3. The worker claims the job (QUEUED -> RUNNING at that generation), calls the
 *     adapter through the "photoSource" retry, then upserts and scores candidates
 *
 * The channel is not durable. Jobs stranded by a restart are re-published by recover().
 */
@Service
@Slf4j
public class ScrapeOrchestrator {

    static final String RETRY_NAME = "photoSource";

    private final Map<PhotoSource, PhotoSourceAdapter> adapters = new EnumMap<>(PhotoSource.class);
    private final ScrapeJobStore jobStore;
    private final FlightStore flightStore;
    private final CandidatePhotoStore candidateStore;
    private final CandidateMatcher matcher;
    private final AirportDirectory airports;
    private final JobMonitor monitor;
    private final ScrapeAdmission admission;
    private final FlightPhotoProperties properties;
    private final Retry retry;

    private final BlockingQueue<DispatchMessage> channel = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ExecutorService workers;
    private Thread dispatcher;

    public ScrapeOrchestrator(List<PhotoSourceAdapter> adapters,
                              ScrapeJobStore jobStore,
                              FlightStore flightStore,
                              CandidatePhotoStore candidateStore,
                              CandidateMatcher matcher,
                              AirportDirectory airports,
                              JobMonitor monitor,
                              ScrapeAdmission admission,
                              FlightPhotoProperties properties,
                              RetryRegistry retryRegistry) {
        for (PhotoSourceAdapter adapter : adapters) {
            this.adapters.put(adapter.source(), adapter);
        }
        this.jobStore = jobStore;
        this.flightStore = flightStore;
        this.candidateStore = candidateStore;
        this.matcher = matcher;
        this.airports = airports;
        this.monitor = monitor;
        this.admission = admission;
        this.properties = properties;
        this.retry = retryRegistry.retry(RETRY_NAME);
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) return;

        int poolSize = admission.getMaxPoolSize();
        AtomicInteger threadCounter = new AtomicInteger();
        workers = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "scrape-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        dispatcher = new Thread(this::dispatchLoop, "scrape-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();

        log.info("Scrape orchestrator started: {} workers, concurrency {}, sources {}",
                poolSize, admission.getMaxConcurrency(), adapters.keySet());
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (!running.compareAndSet(true, false)) return;

        dispatcher.interrupt();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Scrape workers did not finish within 30s, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Scrape orchestrator stopped");
    }

    /**
     * Puts jobs orphaned in RUNNING/RETRYING back to QUEUED and re-publishes every
     * queued job. Startup only: every active job is treated as orphaned, so a job a
     * worker of this process is running would be reset and run a second time.
     */
    public int recover() {
        int reset = jobStore.resetActiveToQueued();
        if (reset > 0) {
            log.info("Reset {} interrupted scrape jobs to QUEUED", reset);
        }
        List<ScrapeJob> queued = jobStore.findByState(ScrapeJobState.QUEUED);
        queued.forEach(this::publish);
        if (!queued.isEmpty()) {
            log.info("Re-dispatched {} queued scrape jobs", queued.size());
        }
        return queued.size();
    }

    // ── Scheduling ───────────────────────────────────────────────────────────

    /**
     * Queues a scrape of every enabled source for the registration. Sources with a
     * job already queued or running are left alone.
     *
     * @return number of jobs queued
     */
    public int scheduleRegistration(String registration) {
        if (registration == null || registration.isBlank()) {
            throw new IllegalArgumentException("Registration is required");
        }
        String reg = registration.trim().toUpperCase();
        if (reg.length() > SchemaInitializer.MAX_REGISTRATION) {
            throw new IllegalArgumentException("Registration longer than "
                    + SchemaInitializer.MAX_REGISTRATION + " characters");
        }

        int queued = 0;
        for (PhotoSource source : adapters.keySet()) {
            if (!properties.sourceFor(source.key()).isEnabled()) continue;
            if (requeue(reg, source.key())) queued++;
        }
        log.info("Scheduled {} scrape jobs for {}", queued, reg);
        return queued;
    }

    /** Create-or-requeue of a single job, publishing it if it was queued */
    public boolean requeue(String registration, String source) {
        Optional<ScrapeJob> job = jobStore.createOrRequeue(registration, source, Instant.now());
        job.ifPresent(this::publish);
        return job.isPresent();
    }

    public List<ScrapeJob> jobs(ScrapeJobState state) {
        return state == null ? jobStore.findAll() : jobStore.findByState(state);
    }

    private void publish(ScrapeJob job) {
        channel.add(new DispatchMessage(job.getId(), job.getRegistration(), job.getSource(), job.getGeneration()));
    }

    // ── Dispatch ─────────────────────────────────────────────────────────────

    private void dispatchLoop() {
        while (running.get()) {
            DispatchMessage message;
            try {
                message = channel.take();
                admission.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            try {
                workers.execute(() -> {
                    try {
                        runTask(message);
                    } catch (Exception e) {
                        log.error("Scrape task {}/{} crashed: {}", message.registration(), message.source(),
                                e.getMessage(), e);
                    } finally {
                        admission.release();
                    }
                });
            } catch (RejectedExecutionException e) {
                admission.release();
                log.warn("Worker pool rejected {}/{}, orchestrator is shutting down",
                        message.registration(), message.source());
                break;
            }
        }
        log.debug("Dispatcher exiting");
    }

    // ── Task ─────────────────────────────────────────────────────────────────

    void runTask(DispatchMessage message) {
        long id = message.jobId();
        long generation = message.generation();
        String registration = message.registration();

        if (!jobStore.markRunning(id, generation, Instant.now())) {
            log.debug("Dropping stale dispatch of {}/{} generation {}", registration, message.source(), generation);
            return;
        }

        PhotoSourceAdapter adapter = adapters.values().stream()
                .filter(a -> a.source().key().equals(message.source()))
                .findFirst()
                .orElse(null);
        if (adapter == null) {
            fail(message, "No adapter registered for " + message.source());
            return;
        }
        PhotoSource source = adapter.source();

        long startNanos = System.nanoTime();
        int maxAttempts = retry.getRetryConfig().getMaxAttempts();
        AtomicInteger attempts = new AtomicInteger();
        Set<String> hints = airportHints(registration);

        try {
            List<ScrapedPhoto> photos = retry.executeCallable(() -> {
                int attempt = attempts.incrementAndGet();
                jobStore.recordAttempt(id, generation, attempt);
                try {
                    return adapter.search(registration, hints);
                } catch (TransientScrapeException e) {
                    if (attempt < maxAttempts) {
                        log.warn("{} search for {} failed (attempt {}/{}), retrying: {}",
                                source.key(), registration, attempt, maxAttempts, e.getMessage());
                        jobStore.markRetrying(id, generation, attempt, e.getMessage());
                    }
                    throw e;
                }
            });

            int stored = storeCandidates(registration, photos);
            if (jobStore.markSucceeded(id, generation, stored, Instant.now())) {
                log.info("{} scrape for {} succeeded: {} photos", source.key(), registration, stored);
            }

        } catch (NoResultsException e) {
            jobStore.markSucceeded(id, generation, 0, Instant.now());
            log.info("{} has no photos for {}", source.key(), registration);

        } catch (StructuralParseException e) {
            log.error("{} page structure not recognised for {}, adapter needs updating: {}",
                    source.key(), registration, e.getMessage());
            fail(message, "Structural parse failure: " + e.getMessage());

        } catch (SourceBlockedException e) {
            log.error("{} blocked the scrape for {}: {}", source.key(), registration, e.getMessage());
            fail(message, "Blocked: " + e.getMessage());

        } catch (TransientScrapeException e) {
            fail(message, "Gave up after " + attempts.get() + " attempts: " + e.getMessage());

        } catch (ScrapeInterruptedException e) {
            Thread.currentThread().interrupt();
            fail(message, "Interrupted");

        } catch (Exception e) {
            log.error("{} scrape for {} failed unexpectedly: {}", source.key(), registration, e.getMessage(), e);
            fail(message, e.getClass().getSimpleName() + ": " + e.getMessage());

        } finally {
            monitor.recordDuration(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    private void fail(DispatchMessage message, String reason) {
        if (jobStore.markFailed(message.jobId(), message.generation(), reason, Instant.now())) {
            monitor.recordFailure(message.registration(), message.source(), reason);
        }
    }

    private int storeCandidates(String registration, List<ScrapedPhoto> photos) {
        List<Flight> flights = flightStore.findByRegistration(registration);
        int stored = 0;
        for (ScrapedPhoto photo : photos) {
            String photoId = photo.getSourcePhotoId();
            if (photoId == null || photoId.isBlank()) continue;
            if (photoId.length() > SchemaInitializer.MAX_SOURCE_PHOTO_ID) {
                log.warn("Skipping {} photo with an oversized id ({} chars)", photo.getSource(), photoId.length());
                continue;
            }

            String airportCode = fitOrNull(photo.getAirportCode(), SchemaInitializer.MAX_AIRPORT_CODE);
            try {
                CandidatePhoto candidate = candidateStore.upsert(CandidatePhoto.builder()
                        .source(photo.getSource())
                        .sourcePhotoId(photoId)
                        .registration(registration)
                        .sourceUrl(fitOrNull(photo.getSourceUrl(), SchemaInitializer.MAX_URL))
                        .thumbnailUrl(fitOrNull(photo.getThumbnailUrl(), SchemaInitializer.MAX_URL))
                        .fullImageUrl(fitOrNull(photo.getFullImageUrl(), SchemaInitializer.MAX_URL))
                        .photographer(clip(photo.getPhotographer(), SchemaInitializer.MAX_PHOTOGRAPHER))
                        .airportCodeRaw(airportCode)
                        .airportCode(airports.canonical(airportCode))
                        .photoDate(photo.getPhotoDate())
                        .build());
                matcher.match(candidate, flights);
                stored++;
            } catch (DataIntegrityViolationException e) {
                log.warn("Skipping {} photo {} for {}: {}", photo.getSource(), photoId, registration,
                        e.getMostSpecificCause().getMessage());
            }
        }
        return stored;
    }

    // Codes and URLs are useless once cut, free text is kept truncated
    private static String fitOrNull(String val, int max) {
        return val != null && val.length() > max ? null : val;
    }

    private static String clip(String val, int max) {
        return val != null && val.length() > max ? val.substring(0, max).trim() : val;
    }

    /** One code per flight end, IATA preferred since that is what the search forms take */
    Set<String> airportHints(String registration) {
        Set<String> hints = new LinkedHashSet<>();
        for (Flight f : flightStore.findByRegistration(registration)) {
            addHint(hints, f.getOriginIata(), f.getOriginIcao(), f.getOriginRaw());
            addHint(hints, f.getDestinationIata(), f.getDestinationIcao(), f.getDestinationRaw());
        }
        return hints;
    }

    private void addHint(Set<String> hints, String... candidates) {
        for (String code : candidates) {
            if (code != null && !code.isBlank()) {
                hints.add(code.trim().toUpperCase());
                return;
            }
        }
    }
}
