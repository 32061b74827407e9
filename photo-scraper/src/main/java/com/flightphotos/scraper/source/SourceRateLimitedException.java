package com.flightphotos.scraper.source;

/**
 * The site answered 429. Treated like any other transient failure, the retry
 * backoff is what slows us down.
 */
public class SourceRateLimitedException extends TransientScrapeException {

    public SourceRateLimitedException(String source, String message) {
        super(source, message);
    }
}
