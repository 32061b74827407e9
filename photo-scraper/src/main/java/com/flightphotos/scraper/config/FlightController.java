package com.flightphotos.scraper.config;

import com.flightphotos.scraper.model.ImportResult;
import com.flightphotos.scraper.model.RawFlightRow;
import com.flightphotos.scraper.service.FlightImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

@RestController
@Slf4j
@RequiredArgsConstructor
public class FlightController {

    private final FlightImportService importService;

    /**
     * Import flights already mapped to the common row format.
     *
     * POST /flights/import
     * [{"registration":"G-XLEA","origin":"LHR","destination":"JFK",
     *   "departureDate":"2024-03-01","departureTime":"10:30","arrivalTime":"13:35","flightNumber":"BA117"}]
     */
    @PostMapping("/flights/import")
    public ResponseEntity<?> importFlights(@RequestBody List<RawFlightRow> rows) {
        try {
            ImportResult result = importService.importFlights(rows);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Flight import failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/flights")
    public ResponseEntity<?> flights(@RequestParam(required = false) String registration) {
        return ResponseEntity.ok(importService.flights(registration));
    }

    @DeleteMapping("/flights/{id}")
    public ResponseEntity<?> deleteFlight(@PathVariable long id) {
        try {
            importService.deleteFlight(id);
            return ResponseEntity.ok(Map.of("status", "deleted", "id", id));
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Deleting flight {} failed: {}", id, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Full reset: flights, candidate photos and scrape jobs.
     */
    @DeleteMapping("/flights")
    public ResponseEntity<?> resetAll() {
        importService.resetAll();
        return ResponseEntity.ok(Map.of("status", "reset"));
    }
}
