package com.flightphotos.scraper.store;

import com.flightphotos.scraper.model.CandidatePhoto;
import com.flightphotos.scraper.model.ReviewState;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface CandidatePhotoStore {

    /**
     * Inserts the candidate or refreshes the raw fields of the existing row with the
     * same (source, sourcePhotoId). Score, match and review fields of an existing
     * row are left alone.
     *
     * @return the stored row
     */
    CandidatePhoto upsert(CandidatePhoto candidate);

    Optional<CandidatePhoto> findById(long id);

    Optional<CandidatePhoto> findBySourcePhotoId(String source, String sourcePhotoId);

    List<CandidatePhoto> findByRegistration(String registration);

    /** Ordered by score desc, matched flight date asc (nulls last), id asc */
    List<CandidatePhoto> findByReviewState(ReviewState state);

    void updateMatch(long id, int score, Long matchedFlightId, LocalDate matchedFlightDate, String matchReasons);

    /**
     * Moves the candidate from {@code from} to {@code to} only if it is still in {@code from}.
     *
     * @return false if the candidate was missing or in another state
     */
    boolean transitionReview(long id, ReviewState from, ReviewState to, String comment, Instant reviewedAt);

    boolean delete(long id);

    void deleteAll();

    int count();
}
