package com.flightphotos.scraper.review;

import com.flightphotos.scraper.config.FlightPhotoProperties;
import com.flightphotos.scraper.model.CandidatePhoto;
import com.flightphotos.scraper.model.ReviewState;
import com.flightphotos.scraper.store.CandidatePhotoStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Review queue over candidate photos.
 *
 * PENDING moves to APPROVED or REJECTED once and never back. Rejected photos stay
 * stored so rescans recognise them, they are just never shown again.
 * Every listing is ordered score desc, matched flight date asc (undated last), id.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReviewQueueService {

    private final CandidatePhotoStore candidateStore;
    private final FlightPhotoProperties properties;

    /** Pending candidates at or above the review threshold */
    public List<CandidatePhoto> queue() {
        int threshold = threshold();
        return candidateStore.findByReviewState(ReviewState.PENDING).stream()
                .filter(c -> c.getScore() >= threshold)
                .toList();
    }

    /** Pending candidates below the review threshold */
    public List<CandidatePhoto> lowConfidence() {
        int threshold = threshold();
        return candidateStore.findByReviewState(ReviewState.PENDING).stream()
                .filter(c -> c.getScore() < threshold)
                .toList();
    }

    /** Approved photos */
    public List<CandidatePhoto> library() {
        return candidateStore.findByReviewState(ReviewState.APPROVED);
    }

    public CandidatePhoto get(long id) {
        return candidateStore.findById(id)
                .orElseThrow(() -> new NoSuchElementException("No candidate photo " + id));
    }

    /**
     * Where the candidate sits in its pending list: the default queue, or the
     * low-confidence list when it scores below the threshold. A reviewed candidate
     * is returned with index -1.
     */
    public ReviewCursor position(long id) {
        CandidatePhoto candidate = get(id);
        if (candidate.getReviewState() != ReviewState.PENDING) {
            return new ReviewCursor(candidate, -1, 0, null, null);
        }

        List<CandidatePhoto> list = candidate.getScore() >= threshold() ? queue() : lowConfidence();
        int index = -1;
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).getId().equals(candidate.getId())) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            return new ReviewCursor(candidate, -1, list.size(), null, null);
        }
        Long previous = index > 0 ? list.get(index - 1).getId() : null;
        Long next = index < list.size() - 1 ? list.get(index + 1).getId() : null;
        return new ReviewCursor(candidate, index, list.size(), previous, next);
    }

    public CandidatePhoto approve(long id, String comment) {
        return transition(id, ReviewState.APPROVED, comment);
    }

    public CandidatePhoto reject(long id, String comment) {
        return transition(id, ReviewState.REJECTED, comment);
    }

    public void delete(long id) {
        if (!candidateStore.delete(id)) {
            throw new NoSuchElementException("No candidate photo " + id);
        }
        log.info("Deleted candidate photo {}", id);
    }

    private CandidatePhoto transition(long id, ReviewState to, String comment) {
        CandidatePhoto current = get(id);
        String note = comment == null || comment.isBlank() ? null : comment.trim();

        if (!candidateStore.transitionReview(id, ReviewState.PENDING, to, note, Instant.now())) {
            ReviewState actual = candidateStore.findById(id).map(CandidatePhoto::getReviewState)
                    .orElse(current.getReviewState());
            throw new IllegalStateException("Candidate " + id + " is " + actual + ", cannot move to " + to);
        }
        log.info("Candidate {} ({}/{}) {}", id, current.getSource(), current.getSourcePhotoId(), to);
        return get(id);
    }

    private int threshold() {
        return properties.getMatching().getReviewThreshold();
    }
}
