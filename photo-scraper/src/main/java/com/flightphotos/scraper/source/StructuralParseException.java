package com.flightphotos.scraper.source;

/**
 * The page no longer looks like what the adapter expects, usually a site redesign.
 * Terminal for the job, the adapter needs updating.
 */
public class StructuralParseException extends ScrapeException {

    public StructuralParseException(String source, String message) {
        super(source, message);
    }
}
