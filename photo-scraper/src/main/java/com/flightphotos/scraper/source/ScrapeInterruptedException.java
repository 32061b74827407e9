package com.flightphotos.scraper.source;

/**
 * The worker thread was interrupted while waiting for a rate-limit slot or a response,
 * which only happens when the pool is shutting down.
 */
public class ScrapeInterruptedException extends ScrapeException {

    public ScrapeInterruptedException(String source, InterruptedException cause) {
        super(source, "Interrupted while scraping " + source, cause);
    }
}
