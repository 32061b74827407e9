package com.flightphotos.scraper.source;

import lombok.Getter;

/**
 * Base for every way a source search can end other than returning photos.
 * The orchestrator decides retry vs. terminal from the subclass.
 */
@Getter
public abstract class ScrapeException extends RuntimeException {

    private final String source;

    protected ScrapeException(String source, String message) {
        super(message);
        this.source = source;
    }

    protected ScrapeException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }
}
