package com.flightphotos.scraper.model;

public enum ReviewState {
    PENDING, APPROVED, REJECTED
}
