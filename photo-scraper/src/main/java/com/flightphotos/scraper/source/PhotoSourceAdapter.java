package com.flightphotos.scraper.source;

import com.flightphotos.scraper.model.PhotoSource;
import com.flightphotos.scraper.model.ScrapedPhoto;

import java.util.List;
import java.util.Set;

/**
 * One implementation per photo site. Everything site specific (URLs, markup,
 * what "no results" looks like) stays behind this interface so the orchestrator,
 * rate limiting and retry policy never need to know which site they are driving.
 */
public interface PhotoSourceAdapter {

    PhotoSource source();

    /**
     * Search the site for photos of a registration.
     *
     * @param registration Tail number, e.g. "N506DN"
     * @param airportHints Airport codes from the user's flights on this aircraft. Sites with
     *                     server-side filtering may use them to fetch less, others ignore them.
     * @return Photos in site order, never empty
     * @throws TransientScrapeException  timeout, 5xx or 429, worth retrying
     * @throws NoResultsException        the site has nothing for this registration
     * @throws StructuralParseException  the page could not be understood
     * @throws SourceBlockedException    the site refuses to serve us
     */
    List<ScrapedPhoto> search(String registration, Set<String> airportHints);
}
