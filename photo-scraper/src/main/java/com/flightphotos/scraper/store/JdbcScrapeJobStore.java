package com.flightphotos.scraper.store;

import com.flightphotos.scraper.model.ScrapeJob;
import com.flightphotos.scraper.model.ScrapeJobState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.flightphotos.scraper.store.JdbcSupport.*;

@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcScrapeJobStore implements ScrapeJobStore {

    private static final int MAX_ERROR_LENGTH = 2000;

    private static final String COLUMNS = """
            id, registration, source, generation, state, attempts, last_error, photos_found,
            scheduled_at, started_at, completed_at
            """;

    private static final RowMapper<ScrapeJob> ROW_MAPPER = (rs, i) -> ScrapeJob.builder()
            .id(rs.getLong("id"))
            .registration(rs.getString("registration"))
            .source(rs.getString("source"))
            .generation(rs.getLong("generation"))
            .state(ScrapeJobState.valueOf(rs.getString("state")))
            .attempts(rs.getInt("attempts"))
            .lastError(rs.getString("last_error"))
            .photosFound(rs.getInt("photos_found"))
            .scheduledAt(instant(rs, "scheduled_at"))
            .startedAt(instant(rs, "started_at"))
            .completedAt(instant(rs, "completed_at"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<ScrapeJob> createOrRequeue(String registration, String source, Instant now) {
        int requeued = jdbcTemplate.update("""
            UPDATE scrape_jobs
            SET generation = generation + 1, state = 'QUEUED', attempts = 0, last_error = NULL,
                photos_found = 0, scheduled_at = ?, started_at = NULL, completed_at = NULL
            WHERE registration = ? AND source = ? AND state IN ('SUCCEEDED', 'FAILED')
            """, ts(now), registration, source);
        if (requeued == 1) {
            return find(registration, source);
        }

        if (find(registration, source).isPresent()) {
            return Optional.empty();
        }
        try {
            jdbcTemplate.update("""
                INSERT INTO scrape_jobs
                (registration, source, generation, state, attempts, photos_found, scheduled_at)
                VALUES (?, ?, 1, 'QUEUED', 0, 0, ?)
                """, registration, source, ts(now));
        } catch (DuplicateKeyException e) {
            log.debug("Job {}/{} created concurrently", registration, source);
            return Optional.empty();
        }
        return find(registration, source);
    }

    @Override
    public Optional<ScrapeJob> findById(long id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM scrape_jobs WHERE id = ?", ROW_MAPPER, id)
                .stream().findFirst();
    }

    @Override
    public Optional<ScrapeJob> find(String registration, String source) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM scrape_jobs WHERE registration = ? AND source = ?",
                ROW_MAPPER, registration, source).stream().findFirst();
    }

    @Override
    public boolean markRunning(long id, long generation, Instant now) {
        return jdbcTemplate.update("""
            UPDATE scrape_jobs SET state = 'RUNNING', started_at = ?
            WHERE id = ? AND generation = ? AND state = 'QUEUED'
            """, ts(now), id, generation) == 1;
    }

    @Override
    public boolean recordAttempt(long id, long generation, int attempt) {
        return jdbcTemplate.update("""
            UPDATE scrape_jobs SET attempts = ?
            WHERE id = ? AND generation = ? AND state IN ('RUNNING', 'RETRYING')
            """, attempt, id, generation) == 1;
    }

    @Override
    public boolean markRetrying(long id, long generation, int attempts, String error) {
        return jdbcTemplate.update("""
            UPDATE scrape_jobs SET state = 'RETRYING', attempts = ?, last_error = ?
            WHERE id = ? AND generation = ? AND state IN ('RUNNING', 'RETRYING')
            """, attempts, truncate(error), id, generation) == 1;
    }

    @Override
    public boolean markSucceeded(long id, long generation, int photosFound, Instant now) {
        return jdbcTemplate.update("""
            UPDATE scrape_jobs SET state = 'SUCCEEDED', photos_found = ?, last_error = NULL, completed_at = ?
            WHERE id = ? AND generation = ? AND state IN ('RUNNING', 'RETRYING')
            """, photosFound, ts(now), id, generation) == 1;
    }

    @Override
    public boolean markFailed(long id, long generation, String error, Instant now) {
        return jdbcTemplate.update("""
            UPDATE scrape_jobs SET state = 'FAILED', last_error = ?, completed_at = ?
            WHERE id = ? AND generation = ? AND state IN ('RUNNING', 'RETRYING')
            """, truncate(error), ts(now), id, generation) == 1;
    }

    @Override
    public Map<ScrapeJobState, Integer> countByState() {
        Map<ScrapeJobState, Integer> counts = new EnumMap<>(ScrapeJobState.class);
        for (ScrapeJobState state : ScrapeJobState.values()) {
            counts.put(state, 0);
        }
        jdbcTemplate.query("SELECT state, COUNT(*) AS n FROM scrape_jobs GROUP BY state",
                (RowCallbackHandler) rs -> counts.put(ScrapeJobState.valueOf(rs.getString("state")), rs.getInt("n")));
        return counts;
    }

    @Override
    public List<ScrapeJob> findByState(ScrapeJobState state) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM scrape_jobs WHERE state = ? ORDER BY scheduled_at, id",
                ROW_MAPPER, state.name());
    }

    @Override
    public List<ScrapeJob> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM scrape_jobs ORDER BY registration, source", ROW_MAPPER);
    }

    @Override
    public List<ScrapeJob> findCompletedBefore(ScrapeJobState state, Instant cutoff) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM scrape_jobs WHERE state = ? AND completed_at < ? ORDER BY completed_at",
                ROW_MAPPER, state.name(), ts(cutoff));
    }

    @Override
    public int resetActiveToQueued() {
        return jdbcTemplate.update(
                "UPDATE scrape_jobs SET state = 'QUEUED', started_at = NULL WHERE state IN ('RUNNING', 'RETRYING')");
    }

    @Override
    public void deleteAll() {
        int n = jdbcTemplate.update("DELETE FROM scrape_jobs");
        log.info("Deleted {} scrape jobs", n);
    }

    private String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) return error;
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
