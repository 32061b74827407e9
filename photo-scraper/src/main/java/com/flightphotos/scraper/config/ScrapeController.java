package com.flightphotos.scraper.config;

import com.flightphotos.scraper.model.ScrapeJob;
import com.flightphotos.scraper.model.ScrapeJobState;
import com.flightphotos.scraper.monitor.JobMonitor;
import com.flightphotos.scraper.monitor.JobMonitorSnapshot;
import com.flightphotos.scraper.scheduler.ScrapeOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ScrapeController {

    private final ScrapeOrchestrator orchestrator;
    private final JobMonitor monitor;

    // ── Scrape triggers ───────────────────────────────────────────────────────

    @PostMapping("/scrape/registrations/{registration}")
    public ResponseEntity<?> scrapeRegistration(@PathVariable String registration) {
        try {
            int queued = orchestrator.scheduleRegistration(registration);
            return ResponseEntity.accepted().body(Map.of(
                    "status", "accepted",
                    "registration", registration.trim().toUpperCase(),
                    "jobsQueued", queued));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Scheduling scrape for {} failed: {}", registration, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    // ── Monitor ───────────────────────────────────────────────────────────────

    @GetMapping("/scrape/status")
    public ResponseEntity<JobMonitorSnapshot> status() {
        return ResponseEntity.ok(monitor.snapshot());
    }

    /**
     * GET /scrape/jobs?state=FAILED
     */
    @GetMapping("/scrape/jobs")
    public ResponseEntity<?> jobs(@RequestParam(required = false) String state) {
        try {
            ScrapeJobState filter = state == null || state.isBlank() ? null : ScrapeJobState.valueOf(state.toUpperCase());
            List<ScrapeJob> jobs = orchestrator.jobs(filter);
            return ResponseEntity.ok(jobs);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown job state: " + state));
        } catch (Exception e) {
            log.error("Job listing failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @PostMapping("/scrape/pause")
    public ResponseEntity<JobMonitorSnapshot> pause() {
        monitor.pause();
        return ResponseEntity.ok(monitor.snapshot());
    }

    @PostMapping("/scrape/resume")
    public ResponseEntity<JobMonitorSnapshot> resume() {
        monitor.resume();
        return ResponseEntity.ok(monitor.snapshot());
    }

    /**
     * PUT /scrape/concurrency?value=5
     */
    @PutMapping("/scrape/concurrency")
    public ResponseEntity<?> setConcurrency(@RequestParam int value) {
        try {
            monitor.setMaxConcurrency(value);
            return ResponseEntity.ok(monitor.snapshot());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
