package com.flightphotos.scraper.source;

/**
 * Timeouts, connection resets and 5xx responses. Retried with backoff.
 */
public class TransientScrapeException extends ScrapeException {

    public TransientScrapeException(String source, String message) {
        super(source, message);
    }

    public TransientScrapeException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
