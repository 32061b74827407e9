package com.flightphotos.scraper.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Normalised flight with absolute UTC instants.
 *
 * Schema design notes:
 *  - natural_key (departure date, flight number, registration, route) makes re-imports idempotent
 *  - airport codes are kept raw plus both code systems so matching is code-system agnostic
 *  - arrival_date is the destination-local calendar date of arrival_utc, nothing else
 *  - degraded_precision marks flights where an airport timezone could not be resolved (UTC assumed)
 */
@Data
@Builder(toBuilder = true)
public class Flight {

    private Long id;
    private String naturalKey;

    // ── Aircraft ────────────────────────────────────────────────────────────
    private String registration;
    private String flightNumber;

    // ── Origin ──────────────────────────────────────────────────────────────
    private String originRaw;
    private String originIcao;
    private String originIata;
    private String originTimezone;

    // ── Destination ─────────────────────────────────────────────────────────
    private String destinationRaw;
    private String destinationIcao;
    private String destinationIata;
    private String destinationTimezone;

    // ── Time ────────────────────────────────────────────────────────────────
    private LocalDateTime departureLocal;
    private LocalDateTime arrivalLocal;
    private Instant departureUtc;
    private Instant arrivalUtc;

    /** Calendar date of arrival in destination local time, may be after the departure date */
    private LocalDate arrivalDate;

    private boolean degradedPrecision;
    private Instant importedAt;

    /** Local departure date, the date spotter sites report against */
    public LocalDate getDepartureDate() {
        return departureLocal == null ? null : departureLocal.toLocalDate();
    }

    /** Every known code for either end of the flight, upper-cased */
    public Set<String> airportCodes() {
        Set<String> codes = new LinkedHashSet<>();
        for (String code : new String[]{originIcao, originIata, originRaw,
                destinationIcao, destinationIata, destinationRaw}) {
            if (code != null && !code.isBlank()) {
                codes.add(code.trim().toUpperCase());
            }
        }
        return codes;
    }
}
