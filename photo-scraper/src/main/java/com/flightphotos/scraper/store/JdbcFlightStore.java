package com.flightphotos.scraper.store;

import com.flightphotos.scraper.model.Flight;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.flightphotos.scraper.store.JdbcSupport.*;

@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcFlightStore implements FlightStore {

    private static final String COLUMNS = """
            id, natural_key, registration, flight_number,
            origin_raw, origin_icao, origin_iata, origin_timezone,
            destination_raw, destination_icao, destination_iata, destination_timezone,
            departure_local, arrival_local, departure_utc, arrival_utc, arrival_date,
            degraded_precision, imported_at
            """;

    private static final RowMapper<Flight> ROW_MAPPER = (rs, i) -> Flight.builder()
            .id(rs.getLong("id"))
            .naturalKey(rs.getString("natural_key"))
            .registration(rs.getString("registration"))
            .flightNumber(rs.getString("flight_number"))
            .originRaw(rs.getString("origin_raw"))
            .originIcao(rs.getString("origin_icao"))
            .originIata(rs.getString("origin_iata"))
            .originTimezone(rs.getString("origin_timezone"))
            .destinationRaw(rs.getString("destination_raw"))
            .destinationIcao(rs.getString("destination_icao"))
            .destinationIata(rs.getString("destination_iata"))
            .destinationTimezone(rs.getString("destination_timezone"))
            .departureLocal(localDateTime(rs, "departure_local"))
            .arrivalLocal(localDateTime(rs, "arrival_local"))
            .departureUtc(instant(rs, "departure_utc"))
            .arrivalUtc(instant(rs, "arrival_utc"))
            .arrivalDate(localDate(rs, "arrival_date"))
            .degradedPrecision(rs.getBoolean("degraded_precision"))
            .importedAt(instant(rs, "imported_at"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public boolean insertIfAbsent(Flight f) {
        if (findIdByNaturalKey(f.getNaturalKey()).isPresent()) {
            return false;
        }
        Instant importedAt = f.getImportedAt() != null ? f.getImportedAt() : Instant.now();
        try {
            jdbcTemplate.update("""
                INSERT INTO flights
                (natural_key, registration, flight_number,
                 origin_raw, origin_icao, origin_iata, origin_timezone,
                 destination_raw, destination_icao, destination_iata, destination_timezone,
                 departure_local, arrival_local, departure_utc, arrival_utc, arrival_date,
                 degraded_precision, imported_at)
                VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                """,
                    f.getNaturalKey(), f.getRegistration(), f.getFlightNumber(),
                    f.getOriginRaw(), f.getOriginIcao(), f.getOriginIata(), f.getOriginTimezone(),
                    f.getDestinationRaw(), f.getDestinationIcao(), f.getDestinationIata(), f.getDestinationTimezone(),
                    ts(f.getDepartureLocal()), ts(f.getArrivalLocal()),
                    ts(f.getDepartureUtc()), ts(f.getArrivalUtc()), date(f.getArrivalDate()),
                    f.isDegradedPrecision(), ts(importedAt));
        } catch (DuplicateKeyException e) {
            log.debug("Flight {} inserted concurrently, treating as duplicate", f.getNaturalKey());
            return false;
        }
        f.setImportedAt(importedAt);
        findIdByNaturalKey(f.getNaturalKey()).ifPresent(f::setId);
        return true;
    }

    @Override
    public Optional<Flight> findById(long id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM flights WHERE id = ?", ROW_MAPPER, id)
                .stream().findFirst();
    }

    @Override
    public List<Flight> findByRegistration(String registration) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM flights WHERE registration = ? ORDER BY departure_local, id",
                ROW_MAPPER, registration);
    }

    @Override
    public List<Flight> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM flights ORDER BY departure_local, id", ROW_MAPPER);
    }

    @Override
    public boolean delete(long id) {
        return jdbcTemplate.update("DELETE FROM flights WHERE id = ?", id) > 0;
    }

    @Override
    public void deleteAll() {
        int n = jdbcTemplate.update("DELETE FROM flights");
        log.info("Deleted {} flights", n);
    }

    private Optional<Long> findIdByNaturalKey(String naturalKey) {
        return jdbcTemplate.queryForList("SELECT id FROM flights WHERE natural_key = ?", Long.class, naturalKey)
                .stream().findFirst();
    }
}
