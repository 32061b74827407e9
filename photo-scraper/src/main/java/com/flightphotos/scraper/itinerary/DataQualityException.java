package com.flightphotos.scraper.itinerary;

/**
 * A raw flight row that cannot be turned into a consistent itinerary.
 * The importer skips the row, counts it and carries on with the batch.
 */
public class DataQualityException extends Exception {

    public DataQualityException(String message) {
        super(message);
    }
}
