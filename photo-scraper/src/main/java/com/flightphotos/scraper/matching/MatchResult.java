package com.flightphotos.scraper.matching;

import java.time.LocalDate;

/**
 * Best flight for a candidate photo. flightId and flightDate are null when the
 * registration has no flights.
 */
public record MatchResult(int score, Long flightId, LocalDate flightDate, String reasons) {

    public static MatchResult noMatch() {
        return new MatchResult(0, null, null, "no flights for registration");
    }

    public boolean matched() {
        return flightId != null;
    }
}
