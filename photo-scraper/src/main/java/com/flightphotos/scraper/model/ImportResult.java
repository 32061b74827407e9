package com.flightphotos.scraper.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ImportResult {

    private int imported;
    private int duplicates;
    private int rejected;
    private List<RowError> errors;
    private int registrations;
    private int jobsQueued;

    /** A row skipped for data quality reasons, row is the 0-based index in the submitted batch */
    public record RowError(int row, String message) {}
}
