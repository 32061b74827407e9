package com.flightphotos.scraper.itinerary;

import com.flightphotos.scraper.config.FlightPhotoProperties;
import com.flightphotos.scraper.model.Flight;
import com.flightphotos.scraper.model.RawFlightRow;
import com.flightphotos.scraper.store.SchemaInitializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Turns a raw flight row into a normalised Flight with UTC instants and the
 * destination-local arrival date.
 *
 * Logs usually carry arrival as a time of day only. When that time is earlier
 * than the departure time the flight is assumed to land the next day (red-eyes).
 * Everything is converted through absolute UTC instants, never by subtracting
 * date fields, so date-line crossings come out right without special cases.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ItineraryCalculator {

    private final AirportDirectory airports;
    private final FlightPhotoProperties properties;

    private record Endpoint(String raw, String icao, String iata, ZoneId zone, boolean resolved) {}

    public Flight calculate(RawFlightRow row) throws DataQualityException {
        validate(row);

        Endpoint origin = resolve(row.getOrigin());
        Endpoint destination = resolve(row.getDestination());
        boolean degraded = !origin.resolved() || !destination.resolved();

        Instant departureUtc = ZonedDateTime.of(row.getDepartureDate(), row.getDepartureTime(), origin.zone())
                .toInstant();
        Instant arrivalUtc = row.getArrivalDate() != null
                ? explicitArrival(row, departureUtc, destination.zone())
                : inferArrival(row, departureUtc, destination.zone(), !degraded);

        ZonedDateTime arrivalAtDestination = arrivalUtc.atZone(destination.zone());

        if (degraded) {
            log.debug("Degraded precision for {} {} -> {}: unknown airport, assuming UTC",
                    row.getRegistration(), row.getOrigin(), row.getDestination());
        }

        return Flight.builder()
                .naturalKey(naturalKey(row, origin, destination))
                .registration(normaliseRegistration(row.getRegistration()))
                .flightNumber(emptyToNull(row.getFlightNumber()))
                .originRaw(row.getOrigin().trim())
                .originIcao(origin.icao())
                .originIata(origin.iata())
                .originTimezone(origin.resolved() ? origin.zone().getId() : null)
                .destinationRaw(row.getDestination().trim())
                .destinationIcao(destination.icao())
                .destinationIata(destination.iata())
                .destinationTimezone(destination.resolved() ? destination.zone().getId() : null)
                .departureLocal(row.getDepartureDate().atTime(row.getDepartureTime()))
                .arrivalLocal(arrivalAtDestination.toLocalDateTime())
                .departureUtc(departureUtc)
                .arrivalUtc(arrivalUtc)
                .arrivalDate(arrivalAtDestination.toLocalDate())
                .degradedPrecision(degraded)
                .build();
    }

    // ── Arrival resolution ───────────────────────────────────────────────────

    private Instant explicitArrival(RawFlightRow row, Instant departureUtc, ZoneId zone) throws DataQualityException {
        Instant arrival = ZonedDateTime.of(row.getArrivalDate(), row.getArrivalTime(), zone).toInstant();
        if (arrival.isBefore(departureUtc)) {
            throw new DataQualityException(String.format("Arrival %s %s is before departure %s %s",
                    row.getArrivalDate(), row.getArrivalTime(), row.getDepartureDate(), row.getDepartureTime()));
        }
        return arrival;
    }

    /**
     * Only two readings are ever considered: landing on the departure date or the
     * day after. A wrapped clock (arrival time earlier than departure time) prefers
     * the next day. The other reading is used when the preferred one lands before
     * take-off, or when it implies a block time no airliner flies while the other
     * one does not (westbound over the date line, e.g. NRT 17:00 -> HNL 05:30).
     */
    private Instant inferArrival(RawFlightRow row, Instant departureUtc, ZoneId zone, boolean checkBlockTime)
            throws DataQualityException {
        LocalDate departureDate = row.getDepartureDate();
        boolean clockWrapped = row.getArrivalTime().isBefore(row.getDepartureTime());

        Instant sameDay = ZonedDateTime.of(departureDate, row.getArrivalTime(), zone).toInstant();
        Instant nextDay = ZonedDateTime.of(departureDate.plusDays(1), row.getArrivalTime(), zone).toInstant();

        Instant preferred = clockWrapped ? nextDay : sameDay;
        Instant alternative = clockWrapped ? sameDay : nextDay;

        if (plausible(departureUtc, preferred, checkBlockTime)) return preferred;
        if (plausible(departureUtc, alternative, checkBlockTime)) return alternative;
        if (!preferred.isBefore(departureUtc)) return preferred;
        if (!alternative.isBefore(departureUtc)) return alternative;

        throw new DataQualityException(String.format(
                "Arrival %s at %s cannot follow departure %s %s at %s within one day",
                row.getArrivalTime(), row.getDestination(), departureDate, row.getDepartureTime(), row.getOrigin()));
    }

    private boolean plausible(Instant departure, Instant arrival, boolean checkBlockTime) {
        if (arrival.isBefore(departure)) return false;
        if (!checkBlockTime) return true;
        return Duration.between(departure, arrival).toHours() < properties.getItinerary().getMaxBlockHours();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Endpoint resolve(String raw) {
        Optional<AirportDirectory.Airport> airport = airports.lookup(raw);
        if (airport.isPresent()) {
            AirportDirectory.Airport a = airport.get();
            return new Endpoint(raw, a.icao(), a.iata(), a.zone(), true);
        }
        String code = raw.trim().toUpperCase();
        return new Endpoint(raw,
                code.length() == 4 ? code : null,
                code.length() == 3 ? code : null,
                ZoneOffset.UTC, false);
    }

    private void validate(RawFlightRow row) throws DataQualityException {
        if (isBlank(row.getRegistration())) throw new DataQualityException("Missing registration");
        if (isBlank(row.getOrigin())) throw new DataQualityException("Missing origin airport");
        if (isBlank(row.getDestination())) throw new DataQualityException("Missing destination airport");
        if (row.getDepartureDate() == null) throw new DataQualityException("Missing departure date");
        if (row.getDepartureTime() == null) throw new DataQualityException("Missing departure time");
        if (row.getArrivalTime() == null) throw new DataQualityException("Missing arrival time");

        checkLength("Registration", row.getRegistration(), SchemaInitializer.MAX_REGISTRATION);
        checkLength("Flight number", row.getFlightNumber(), SchemaInitializer.MAX_FLIGHT_NUMBER);
        checkLength("Origin airport", row.getOrigin(), SchemaInitializer.MAX_AIRPORT_CODE);
        checkLength("Destination airport", row.getDestination(), SchemaInitializer.MAX_AIRPORT_CODE);
    }

    private void checkLength(String field, String val, int max) throws DataQualityException {
        if (val != null && val.trim().length() > max) {
            throw new DataQualityException(String.format("%s longer than %d characters: '%s...'",
                    field, max, val.trim().substring(0, 16)));
        }
    }

    private String naturalKey(RawFlightRow row, Endpoint origin, Endpoint destination) {
        return String.join("|",
                row.getDepartureDate().toString(),
                row.getFlightNumber() == null ? "" : row.getFlightNumber().trim().toUpperCase(),
                normaliseRegistration(row.getRegistration()),
                origin.icao() != null ? origin.icao() : origin.raw().trim().toUpperCase(),
                destination.icao() != null ? destination.icao() : destination.raw().trim().toUpperCase());
    }

    private String normaliseRegistration(String registration) {
        return registration.trim().toUpperCase();
    }

    private boolean isBlank(String val) {
        return val == null || val.isBlank();
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val.trim().toUpperCase();
    }
}
