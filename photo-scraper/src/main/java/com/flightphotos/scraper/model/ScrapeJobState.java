package com.flightphotos.scraper.model;

public enum ScrapeJobState {
    QUEUED, RUNNING, RETRYING, SUCCEEDED, FAILED;

    public boolean isActive() {
        return this == QUEUED || this == RUNNING || this == RETRYING;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
