package com.flightphotos.scraper.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * One row per (registration, source). Every rescan bumps the generation so
 * work dispatched for an older generation can be recognised and dropped.
 */
@Data
@Builder(toBuilder = true)
public class ScrapeJob {

    private Long id;
    private String registration;
    private String source;          // PhotoSource key, e.g. "jetphotos"
    private long generation;
    private ScrapeJobState state;
    private int attempts;
    private String lastError;       // null on success
    private int photosFound;
    private Instant scheduledAt;
    private Instant startedAt;
    private Instant completedAt;
}
