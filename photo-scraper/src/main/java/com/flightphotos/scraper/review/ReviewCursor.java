package com.flightphotos.scraper.review;

import com.flightphotos.scraper.model.CandidatePhoto;

/**
 * A candidate's place in the review queue, for deep links.
 * index is 0-based. previousId/nextId are null at the ends.
 */
public record ReviewCursor(CandidatePhoto candidate, int index, int total, Long previousId, Long nextId) {}
