package com.flightphotos.scraper.itinerary;

import com.flightphotos.scraper.config.FlightPhotoProperties;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AirportDirectoryTest {

    private static AirportDirectory airports;

    @BeforeAll
    static void load() {
        airports = new AirportDirectory(new FlightPhotoProperties());
    }

    @Test
    void resolvesIataAndIcaoToTheSameAirport() {
        AirportDirectory.Airport byIata = airports.lookup("lhr").orElseThrow();
        AirportDirectory.Airport byIcao = airports.lookup("EGLL").orElseThrow();

        assertThat(byIata).isEqualTo(byIcao);
        assertThat(byIata.zone()).isEqualTo(ZoneId.of("Europe/London"));
    }

    @Test
    void canonicalPrefersIcaoAndPassesUnknownCodesThrough() {
        assertThat(airports.canonical("NRT")).isEqualTo("RJAA");
        assertThat(airports.canonical(" kjfk ")).isEqualTo("KJFK");
        assertThat(airports.canonical("zzz")).isEqualTo("ZZZ");
        assertThat(airports.canonical(null)).isNull();
    }

    @Test
    void icaoOnlyAirportHasNoIata() {
        AirportDirectory.Airport northolt = airports.lookup("EGWU").orElseThrow();
        assertThat(northolt.iata()).isNull();
    }

    @Test
    void unknownAndBlankCodesAreEmpty() {
        assertThat(airports.lookup("QQQ")).isEmpty();
        assertThat(airports.lookup(" ")).isEmpty();
        assertThat(airports.size()).isGreaterThan(600);
    }

    @Test
    void regionalAirportsResolveToTheirOwnZone() {
        assertThat(airports.lookup("BUR").orElseThrow().zone()).isEqualTo(ZoneId.of("America/Los_Angeles"));
        assertThat(airports.lookup("PHKO").orElseThrow().iata()).isEqualTo("KOA");
        assertThat(airports.lookup("NZCI").orElseThrow().zone()).isEqualTo(ZoneId.of("Pacific/Chatham"));
    }

    @Test
    void airportsdataExportIsLayeredOverTheBundledTable(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("airports.csv");
        Files.writeString(file, String.join("\n",
                "\"icao\",\"iata\",\"name\",\"city\",\"subd\",\"country\",\"elevation\",\"lat\",\"lon\",\"tz\",\"lid\"",
                "\"KSEE\",\"SEE\",\"Gillespie Field\",\"San Diego/El Cajon\",\"California\",\"US\",\"388\","
                        + "\"32.826\",\"-116.972\",\"America/Los_Angeles\",\"SEE\"",
                "\"EGLL\",\"LHR\",\"London Heathrow Airport\",\"London\",\"England\",\"GB\",\"83\","
                        + "\"51.4706\",\"-0.461941\",\"Europe/London\",\"\"",
                "\"XXXX\",\"\",\"Nowhere\",\"\",\"\",\"\",\"0\",\"0\",\"0\",\"Mars/Olympus\",\"\""));
        FlightPhotoProperties properties = new FlightPhotoProperties();
        properties.getItinerary().setAirportsFile(file.toString());

        AirportDirectory full = new AirportDirectory(properties);

        assertThat(full.lookup("SEE").orElseThrow().icao()).isEqualTo("KSEE");
        assertThat(full.lookup("LHR").orElseThrow().name()).isEqualTo("London Heathrow Airport");
        assertThat(full.lookup("XXXX")).isEmpty();
        assertThat(full.size()).isEqualTo(airports.size() + 1);
    }

    @Test
    void tableWithoutTimezoneColumnFailsFast(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("codes.csv");
        Files.writeString(file, "icao,iata,name\nKSEE,SEE,Gillespie Field\n");
        FlightPhotoProperties properties = new FlightPhotoProperties();
        properties.getItinerary().setAirportsFile(file.toString());

        assertThatThrownBy(() -> new AirportDirectory(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'tz'");
    }

    @Test
    void missingTableFailsFast() {
        FlightPhotoProperties properties = new FlightPhotoProperties();
        properties.getItinerary().setAirportsResource("no-such-airports.csv");

        assertThatThrownBy(() -> new AirportDirectory(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no-such-airports.csv");
    }
}
