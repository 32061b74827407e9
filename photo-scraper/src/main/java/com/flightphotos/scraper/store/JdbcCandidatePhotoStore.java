package com.flightphotos.scraper.store;

import com.flightphotos.scraper.model.CandidatePhoto;
import com.flightphotos.scraper.model.ReviewState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.flightphotos.scraper.store.JdbcSupport.*;

/**
 * Upsert is update-then-insert so it works the same on PostgreSQL and H2.
 * Two workers racing on the same photo both end up updating a single row,
 * the loser of the insert race falls back to the update.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcCandidatePhotoStore implements CandidatePhotoStore {

    private static final String COLUMNS = """
            id, source, source_photo_id, registration, source_url, thumbnail_url, full_image_url,
            photographer, airport_code_raw, airport_code, photo_date, score, matched_flight_id,
            matched_flight_date, match_reasons, review_state, review_comment, reviewed_at,
            created_at, updated_at
            """;

    private static final String ORDER_BY =
            " ORDER BY score DESC, matched_flight_date ASC NULLS LAST, id ASC";

    private static final RowMapper<CandidatePhoto> ROW_MAPPER = (rs, i) -> CandidatePhoto.builder()
            .id(rs.getLong("id"))
            .source(rs.getString("source"))
            .sourcePhotoId(rs.getString("source_photo_id"))
            .registration(rs.getString("registration"))
            .sourceUrl(rs.getString("source_url"))
            .thumbnailUrl(rs.getString("thumbnail_url"))
            .fullImageUrl(rs.getString("full_image_url"))
            .photographer(rs.getString("photographer"))
            .airportCodeRaw(rs.getString("airport_code_raw"))
            .airportCode(rs.getString("airport_code"))
            .photoDate(localDate(rs, "photo_date"))
            .score(rs.getInt("score"))
            .matchedFlightId(nullableLong(rs, "matched_flight_id"))
            .matchedFlightDate(localDate(rs, "matched_flight_date"))
            .matchReasons(rs.getString("match_reasons"))
            .reviewState(ReviewState.valueOf(rs.getString("review_state")))
            .reviewComment(rs.getString("review_comment"))
            .reviewedAt(instant(rs, "reviewed_at"))
            .createdAt(instant(rs, "created_at"))
            .updatedAt(instant(rs, "updated_at"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public CandidatePhoto upsert(CandidatePhoto c) {
        Instant now = Instant.now();
        if (updateRawFields(c, now) == 0) {
            try {
                jdbcTemplate.update("""
                    INSERT INTO candidate_photos
                    (source, source_photo_id, registration, source_url, thumbnail_url, full_image_url,
                     photographer, airport_code_raw, airport_code, photo_date, score,
                     review_state, created_at, updated_at)
                    VALUES (?,?,?,?,?,?,?,?,?,?,0,?,?,?)
                    """,
                        c.getSource(), c.getSourcePhotoId(), c.getRegistration(),
                        c.getSourceUrl(), c.getThumbnailUrl(), c.getFullImageUrl(),
                        c.getPhotographer(), c.getAirportCodeRaw(), c.getAirportCode(), date(c.getPhotoDate()),
                        ReviewState.PENDING.name(), ts(now), ts(now));
            } catch (DuplicateKeyException e) {
                log.debug("Candidate {}/{} inserted concurrently, updating instead", c.getSource(), c.getSourcePhotoId());
                updateRawFields(c, now);
            }
        }
        return findBySourcePhotoId(c.getSource(), c.getSourcePhotoId())
                .orElseThrow(() -> new IllegalStateException(
                        "Candidate " + c.getSource() + "/" + c.getSourcePhotoId() + " vanished after upsert"));
    }

    private int updateRawFields(CandidatePhoto c, Instant now) {
        return jdbcTemplate.update("""
            UPDATE candidate_photos
            SET registration = ?, source_url = ?, thumbnail_url = ?, full_image_url = ?,
                photographer = ?, airport_code_raw = ?, airport_code = ?, photo_date = ?, updated_at = ?
            WHERE source = ? AND source_photo_id = ?
            """,
                c.getRegistration(), c.getSourceUrl(), c.getThumbnailUrl(), c.getFullImageUrl(),
                c.getPhotographer(), c.getAirportCodeRaw(), c.getAirportCode(), date(c.getPhotoDate()), ts(now),
                c.getSource(), c.getSourcePhotoId());
    }

    @Override
    public Optional<CandidatePhoto> findById(long id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM candidate_photos WHERE id = ?", ROW_MAPPER, id)
                .stream().findFirst();
    }

    @Override
    public Optional<CandidatePhoto> findBySourcePhotoId(String source, String sourcePhotoId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM candidate_photos WHERE source = ? AND source_photo_id = ?",
                ROW_MAPPER, source, sourcePhotoId).stream().findFirst();
    }

    @Override
    public List<CandidatePhoto> findByRegistration(String registration) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM candidate_photos WHERE registration = ?" + ORDER_BY,
                ROW_MAPPER, registration);
    }

    @Override
    public List<CandidatePhoto> findByReviewState(ReviewState state) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM candidate_photos WHERE review_state = ?" + ORDER_BY,
                ROW_MAPPER, state.name());
    }

    @Override
    public void updateMatch(long id, int score, Long matchedFlightId, LocalDate matchedFlightDate, String matchReasons) {
        jdbcTemplate.update("""
            UPDATE candidate_photos
            SET score = ?, matched_flight_id = ?, matched_flight_date = ?, match_reasons = ?
            WHERE id = ?
            """, score, matchedFlightId, date(matchedFlightDate), matchReasons, id);
    }

    @Override
    public boolean transitionReview(long id, ReviewState from, ReviewState to, String comment, Instant reviewedAt) {
        return jdbcTemplate.update("""
            UPDATE candidate_photos
            SET review_state = ?, review_comment = ?, reviewed_at = ?
            WHERE id = ? AND review_state = ?
            """, to.name(), comment, ts(reviewedAt), id, from.name()) == 1;
    }

    @Override
    public boolean delete(long id) {
        return jdbcTemplate.update("DELETE FROM candidate_photos WHERE id = ?", id) > 0;
    }

    @Override
    public void deleteAll() {
        int n = jdbcTemplate.update("DELETE FROM candidate_photos");
        log.info("Deleted {} candidate photos", n);
    }

    @Override
    public int count() {
        Integer n = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM candidate_photos", Integer.class);
        return n == null ? 0 : n;
    }
}
