package com.flightphotos.scraper.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "flight-photos")
@Data
public class FlightPhotoProperties {

    private Orchestrator orchestrator = new Orchestrator();
    private Matching matching = new Matching();
    private Itinerary itinerary = new Itinerary();
    private Http http = new Http();
    private Map<String, Source> sources = new HashMap<>();
    private Source defaultSource = new Source();

    /** Limits for a source key, falling back to the defaults when not configured */
    public Source sourceFor(String key) {
        return sources.getOrDefault(key, defaultSource);
    }

    @Data
    public static class Orchestrator {
        private int maxConcurrency = 3;
        private int maxPoolSize = 10;
        private Duration rescanInterval = Duration.ofHours(168);
        private Duration failedRetryDelay = Duration.ofHours(1);
        private String rescanSweepDelay = "PT5M";
        private boolean recoverOnStartup = true;
    }

    @Data
    public static class Matching {
        private int registrationWeight = 30;
        private int airportWeight = 30;
        private int dateWeight = 40;
        private int maxDateWindowDays = 3;
        private int reviewThreshold = 70;
    }

    @Data
    public static class Itinerary {
        private int maxBlockHours = 20;
        private String airportsResource = "airports.csv";
        /** Optional airportsdata-format CSV on disk, layered over the bundled table */
        private String airportsFile;
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private String userAgent = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) "
                + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36";
    }

    @Data
    public static class Source {
        private boolean enabled = true;
        private int maxRequests = 30;
        private Duration window = Duration.ofSeconds(60);
        private int maxPages = 5;
    }
}
