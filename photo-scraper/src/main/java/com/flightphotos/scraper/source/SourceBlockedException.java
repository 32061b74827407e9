package com.flightphotos.scraper.source;

/**
 * The site refused us outright (403, typically a Cloudflare challenge). Not retried.
 */
public class SourceBlockedException extends ScrapeException {

    public SourceBlockedException(String source, String message) {
        super(source, message);
    }
}
