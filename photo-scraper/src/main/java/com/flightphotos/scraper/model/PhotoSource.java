package com.flightphotos.scraper.model;

/**
 * The photo sites we scrape. The key is what gets stored on jobs and candidates,
 * the domain is what the rate limiter is keyed on.
 */
public enum PhotoSource {

    JETPHOTOS("jetphotos", "jetphotos.com"),
    AIRLINERS_NET("airlinersnet", "airliners.net"),
    PLANESPOTTERS("planespotters", "planespotters.net"),
    AIRPLANE_PICTURES("airplane_pictures", "airplane-pictures.net");

    private final String key;
    private final String domain;

    PhotoSource(String key, String domain) {
        this.key = key;
        this.domain = domain;
    }

    public String key() {
        return key;
    }

    public String domain() {
        return domain;
    }
}
