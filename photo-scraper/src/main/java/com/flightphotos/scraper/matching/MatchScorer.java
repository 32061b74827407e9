package com.flightphotos.scraper.matching;

import com.flightphotos.scraper.config.FlightPhotoProperties;
import com.flightphotos.scraper.model.CandidatePhoto;
import com.flightphotos.scraper.model.Flight;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Scores a candidate photo against each flight of its registration and keeps the best.
 *
 * Per flight (defaults in brackets):
 *   registration  fixed weight when the registrations agree   [30]
 *   airport       photo airport is the flight's origin or destination, any code system [30]
 *   date          weight * (W + 1 - d) / (W + 1) for d days between photo and local
 *                 departure date, 0 beyond W or without a photo date  [40, W = 3]
 *
 * Ties on score go to the earliest departure, then the lowest flight id.
 */
@Component
@RequiredArgsConstructor
public class MatchScorer {

    private final FlightPhotoProperties properties;

    public MatchResult score(CandidatePhoto candidate, List<Flight> flights) {
        if (flights == null || flights.isEmpty()) {
            return MatchResult.noMatch();
        }

        Comparator<Scored> best = Comparator.comparingInt(Scored::score).reversed()
                .thenComparing((Scored s) -> s.flight().getDepartureLocal(),
                        Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
                .thenComparing((Scored s) -> s.flight().getId(),
                        Comparator.nullsLast(Comparator.<Long>naturalOrder()));

        Scored top = flights.stream()
                .map(f -> scoreFlight(candidate, f))
                .min(best)
                .orElseThrow();

        return new MatchResult(top.score(), top.flight().getId(), top.flight().getDepartureDate(), top.reasons());
    }

    /** Score of the candidate against a single flight, clamped to 0..100 */
    public int scoreAgainst(CandidatePhoto candidate, Flight flight) {
        return scoreFlight(candidate, flight).score();
    }

    private record Scored(Flight flight, int score, String reasons) {}

    private Scored scoreFlight(CandidatePhoto candidate, Flight flight) {
        FlightPhotoProperties.Matching weights = properties.getMatching();
        List<String> reasons = new ArrayList<>();
        int score = 0;

        if (candidate.getRegistration() != null
                && candidate.getRegistration().equalsIgnoreCase(flight.getRegistration())) {
            score += weights.getRegistrationWeight();
            reasons.add("registration");
        }

        String airport = airportMatch(candidate, flight);
        if (airport != null) {
            score += weights.getAirportWeight();
            reasons.add("airport " + airport);
        }

        if (candidate.getPhotoDate() != null && flight.getDepartureDate() != null) {
            long days = Math.abs(ChronoUnit.DAYS.between(candidate.getPhotoDate(), flight.getDepartureDate()));
            int window = weights.getMaxDateWindowDays();
            if (days <= window) {
                score += (int) Math.round(weights.getDateWeight() * (double) (window + 1 - days) / (window + 1));
                reasons.add(days == 0 ? "same date" : "date ±" + days + "d");
            }
        }

        return new Scored(flight, Math.max(0, Math.min(100, score)), String.join(", ", reasons));
    }

    private String airportMatch(CandidatePhoto candidate, Flight flight) {
        Set<String> codes = flight.airportCodes();
        for (String code : new String[]{candidate.getAirportCode(), candidate.getAirportCodeRaw()}) {
            if (code != null && !code.isBlank() && codes.contains(code.trim().toUpperCase())) {
                return code.trim().toUpperCase();
            }
        }
        return null;
    }
}
