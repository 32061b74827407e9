package com.flightphotos.scraper.matching;

import com.flightphotos.scraper.model.CandidatePhoto;
import com.flightphotos.scraper.model.Flight;
import com.flightphotos.scraper.store.CandidatePhotoStore;
import com.flightphotos.scraper.store.FlightStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Stores the best flight match for candidates. Never touches review state.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CandidateMatcher {

    private final FlightStore flightStore;
    private final CandidatePhotoStore candidateStore;
    private final MatchScorer scorer;

    public MatchResult match(CandidatePhoto candidate) {
        return match(candidate, flightStore.findByRegistration(candidate.getRegistration()));
    }

    public MatchResult match(CandidatePhoto candidate, List<Flight> flights) {
        MatchResult result = scorer.score(candidate, flights);
        candidateStore.updateMatch(candidate.getId(), result.score(), result.flightId(), result.flightDate(),
                result.reasons());
        candidate.setScore(result.score());
        candidate.setMatchedFlightId(result.flightId());
        candidate.setMatchedFlightDate(result.flightDate());
        candidate.setMatchReasons(result.reasons());
        return result;
    }

    /** Rescores every candidate of the registration, e.g. after new flights were imported */
    public int rescoreRegistration(String registration) {
        List<Flight> flights = flightStore.findByRegistration(registration);
        List<CandidatePhoto> candidates = candidateStore.findByRegistration(registration);
        for (CandidatePhoto candidate : candidates) {
            match(candidate, flights);
        }
        if (!candidates.isEmpty()) {
            log.info("Rescored {} candidates for {} against {} flights", candidates.size(), registration, flights.size());
        }
        return candidates.size();
    }
}
