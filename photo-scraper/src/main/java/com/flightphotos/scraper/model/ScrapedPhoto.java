package com.flightphotos.scraper.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * Raw photo record as returned by a source adapter.
 * Kept separate from CandidatePhoto to isolate the per-site parsing.
 */
@Data
@Builder
public class ScrapedPhoto {

    private String source;
    private String sourcePhotoId;
    private String sourceUrl;
    private String thumbnailUrl;
    private String fullImageUrl;
    private String registration;
    private String airportCode;     // IATA or ICAO as printed by the site, nullable
    private LocalDate photoDate;    // date as reported by the spotter, nullable
    private String photographer;
}
