package com.flightphotos.scraper.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A scraped photo not yet confirmed to show one of the user's flights.
 *
 * Identity is (source, source_photo_id). Rescans refresh the raw fields and
 * the score, the review fields only ever change through the review queue.
 */
@Data
@Builder(toBuilder = true)
public class CandidatePhoto {

    private Long id;

    // ── Source identifiers ──────────────────────────────────────────────────
    private String source;
    private String sourcePhotoId;

    // ── Raw fields (refreshed on rescan) ────────────────────────────────────
    private String registration;
    private String sourceUrl;
    private String thumbnailUrl;
    private String fullImageUrl;
    private String photographer;
    private String airportCodeRaw;
    private LocalDate photoDate;

    // ── Matching ────────────────────────────────────────────────────────────
    /** ICAO code when the directory knows the airport, otherwise the raw code upper-cased */
    private String airportCode;
    private int score;
    private Long matchedFlightId;
    private LocalDate matchedFlightDate;
    private String matchReasons;

    // ── Review ──────────────────────────────────────────────────────────────
    @Builder.Default
    private ReviewState reviewState = ReviewState.PENDING;
    private String reviewComment;
    private Instant reviewedAt;

    private Instant createdAt;
    private Instant updatedAt;
}
