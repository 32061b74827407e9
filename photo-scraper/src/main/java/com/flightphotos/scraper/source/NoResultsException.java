package com.flightphotos.scraper.source;

/**
 * The site positively said it has no photos for the registration.
 * A successful scrape with zero candidates, never retried.
 */
public class NoResultsException extends ScrapeException {

    public NoResultsException(String source, String registration) {
        super(source, "No photos for " + registration + " on " + source);
    }
}
