package com.flightphotos.scraper.itinerary;

import com.flightphotos.scraper.config.FlightPhotoProperties;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static IATA <-> ICAO lookup with the IANA timezone of each airport.
 *
 * Columns are found by header name, so both the bundled table
 * (icao, iata, tz, name) and a full airportsdata export
 * (icao, iata, name, city, subd, country, elevation, lat, lon, tz, lid) load as-is.
 * The bundled classpath table is read first, then the optional airports-file
 * whose rows add to or replace it. The iata column may be empty.
 */
@Component
@Slf4j
public class AirportDirectory {

    private final Map<String, Airport> byIcao = new HashMap<>();
    private final Map<String, Airport> byIata = new HashMap<>();

    public record Airport(String icao, String iata, ZoneId zone, String name) {}

    public AirportDirectory(FlightPhotoProperties properties) {
        FlightPhotoProperties.Itinerary itinerary = properties.getItinerary();

        String resource = itinerary.getAirportsResource();
        InputStream in = AirportDirectory.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalStateException("Airport table not found on classpath: " + resource);
        }
        load(in, resource);

        String file = itinerary.getAirportsFile();
        if (file != null && !file.isBlank()) {
            Path path = Path.of(file.trim());
            try {
                load(Files.newInputStream(path), path.toString());
            } catch (IOException e) {
                throw new IllegalStateException("Failed to open airport table " + path, e);
            }
        }
    }

    /**
     * Resolve an IATA (3 char) or ICAO (4 char) code. Codes of any other length
     * are tried against both tables.
     */
    public Optional<Airport> lookup(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        String normalised = code.trim().toUpperCase();

        if (normalised.length() == 4) {
            return Optional.ofNullable(byIcao.get(normalised));
        }
        if (normalised.length() == 3) {
            return Optional.ofNullable(byIata.get(normalised));
        }
        return Optional.ofNullable(byIcao.getOrDefault(normalised, byIata.get(normalised)));
    }

    /**
     * Code-system agnostic form used for matching: the ICAO code when known,
     * otherwise the raw code upper-cased. Null stays null.
     */
    public String canonical(String code) {
        if (code == null || code.isBlank()) return null;
        return lookup(code)
                .map(Airport::icao)
                .orElse(code.trim().toUpperCase());
    }

    public int size() {
        return byIcao.size();
    }

    // ── Loading ──────────────────────────────────────────────────────────────

    private void load(InputStream in, String label) {
        int loaded = 0;
        int skipped = 0;
        try (CSVReader reader = new CSVReaderBuilder(new InputStreamReader(in, StandardCharsets.UTF_8)).build()) {

            String[] header = reader.readNext();
            if (header == null) {
                throw new IllegalStateException("Airport table " + label + " is empty");
            }
            Map<String, Integer> columns = new HashMap<>();
            for (int i = 0; i < header.length; i++) {
                columns.put(header[i].trim().toLowerCase(), i);
            }
            int colIcao = column(columns, "icao", label);
            int colIata = column(columns, "iata", label);
            int colTz = column(columns, "tz", label);
            Integer colName = columns.get("name");
            int minWidth = Math.max(colIcao, Math.max(colIata, colTz)) + 1;

            List<String[]> rows = reader.readAll();
            for (String[] cols : rows) {
                if (cols.length < minWidth || cols[colIcao].isBlank()) {
                    skipped++;
                    continue;
                }

                ZoneId zone;
                try {
                    zone = ZoneId.of(cols[colTz].trim());
                } catch (Exception e) {
                    log.warn("Unknown timezone '{}' for airport {} in {}", cols[colTz], cols[colIcao], label);
                    skipped++;
                    continue;
                }

                String icao = cols[colIcao].trim().toUpperCase();
                String iata = cols[colIata].isBlank() ? null : cols[colIata].trim().toUpperCase();
                String name = colName != null && cols.length > colName ? cols[colName].trim() : icao;

                Airport airport = new Airport(icao, iata, zone, name);
                Airport previous = byIcao.put(icao, airport);
                if (previous != null && previous.iata() != null && !previous.iata().equals(iata)) {
                    byIata.remove(previous.iata());
                }
                if (iata != null) byIata.put(iata, airport);
                loaded++;
            }

        } catch (IOException | CsvException e) {
            throw new IllegalStateException("Failed to read airport table " + label, e);
        }

        log.info("Loaded {} airports ({} rows skipped) from {}", loaded, skipped, label);
    }

    private int column(Map<String, Integer> columns, String name, String label) {
        Integer index = columns.get(name);
        if (index == null) {
            throw new IllegalStateException("Airport table " + label + " has no '" + name + "' column");
        }
        return index;
    }
}
