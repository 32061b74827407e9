package com.flightphotos.scraper.service;

import com.flightphotos.scraper.itinerary.DataQualityException;
import com.flightphotos.scraper.itinerary.ItineraryCalculator;
import com.flightphotos.scraper.matching.CandidateMatcher;
import com.flightphotos.scraper.model.Flight;
import com.flightphotos.scraper.model.ImportResult;
import com.flightphotos.scraper.model.RawFlightRow;
import com.flightphotos.scraper.scheduler.ScrapeOrchestrator;
import com.flightphotos.scraper.store.CandidatePhotoStore;
import com.flightphotos.scraper.store.FlightStore;
import com.flightphotos.scraper.store.ScrapeJobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Imports flight rows already in the common raw schema.
 *
 * Per batch:
 *  1. Normalise each row (bad rows are counted and skipped, the batch continues)
 *  2. Insert unless the natural key exists, so re-importing a log is a no-op
 *  3. For every registration that gained flights, rescore its existing candidates
 *     and queue a scrape of every source
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FlightImportService {

    private final ItineraryCalculator calculator;
    private final FlightStore flightStore;
    private final CandidatePhotoStore candidateStore;
    private final ScrapeJobStore jobStore;
    private final CandidateMatcher matcher;
    private final ScrapeOrchestrator orchestrator;

    public ImportResult importFlights(List<RawFlightRow> rows) {
        if (rows == null) {
            throw new IllegalArgumentException("No flight rows supplied");
        }

        int imported = 0;
        int duplicates = 0;
        List<ImportResult.RowError> errors = new ArrayList<>();
        Set<String> touched = new LinkedHashSet<>();

        for (int i = 0; i < rows.size(); i++) {
            RawFlightRow row = rows.get(i);
            try {
                if (row == null) throw new DataQualityException("Empty row");
                Flight flight = calculator.calculate(row);
                if (flightStore.insertIfAbsent(flight)) {
                    imported++;
                    touched.add(flight.getRegistration());
                } else {
                    duplicates++;
                }
            } catch (DataQualityException e) {
                log.warn("Skipping flight row {}: {}", i, e.getMessage());
                errors.add(new ImportResult.RowError(i, e.getMessage()));
            } catch (DataIntegrityViolationException e) {
                log.error("Flight row {} rejected by the store: {}", i, e.getMostSpecificCause().getMessage());
                errors.add(new ImportResult.RowError(i, "Rejected by the store: " + e.getMostSpecificCause().getMessage()));
            }
        }

        int jobsQueued = 0;
        for (String registration : touched) {
            matcher.rescoreRegistration(registration);
            jobsQueued += orchestrator.scheduleRegistration(registration);
        }

        log.info("Flight import: {} imported, {} duplicates, {} rejected, {} registrations, {} jobs queued",
                imported, duplicates, errors.size(), touched.size(), jobsQueued);

        return ImportResult.builder()
                .imported(imported)
                .duplicates(duplicates)
                .rejected(errors.size())
                .errors(errors)
                .registrations(touched.size())
                .jobsQueued(jobsQueued)
                .build();
    }

    public List<Flight> flights(String registration) {
        if (registration == null || registration.isBlank()) {
            return flightStore.findAll();
        }
        return flightStore.findByRegistration(registration.trim().toUpperCase());
    }

    /** Removes one flight and rescores the candidates that may have matched it */
    public void deleteFlight(long id) {
        Flight flight = flightStore.findById(id)
                .orElseThrow(() -> new NoSuchElementException("No flight " + id));
        flightStore.delete(id);
        matcher.rescoreRegistration(flight.getRegistration());
        log.info("Deleted flight {} ({})", id, flight.getNaturalKey());
    }

    /** Drops all flights, candidates and scrape jobs */
    public void resetAll() {
        log.warn("Resetting all flight, candidate and scrape job data");
        jobStore.deleteAll();
        candidateStore.deleteAll();
        flightStore.deleteAll();
    }
}
