package com.flightphotos.scraper.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A flight log row after the import collaborator has mapped its source format
 * (AirTrail, FR24, OpenFlights...) onto the common raw schema.
 *
 * Clock times are local to their airports. arrivalDate is usually absent since
 * most logs only carry the arrival time of day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawFlightRow {

    private String registration;
    private String origin;
    private String destination;
    private LocalDate departureDate;
    private LocalTime departureTime;
    private LocalTime arrivalTime;

    /** Optional, only when the source exports a full arrival timestamp */
    private LocalDate arrivalDate;

    /** Optional, e.g. "DL1234" */
    private String flightNumber;
}
