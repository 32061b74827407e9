package com.flightphotos.scraper.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the tables on startup. Plain SQL that PostgreSQL and H2 both accept.
 *
 * Column widths are the limits callers enforce: {@link #MAX_REGISTRATION},
 * {@link #MAX_FLIGHT_NUMBER} and {@link #MAX_AIRPORT_CODE} on import, and the
 * candidate limits when scraped photos are stored.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaInitializer {

    public static final int MAX_REGISTRATION = 20;
    public static final int MAX_FLIGHT_NUMBER = 20;
    public static final int MAX_AIRPORT_CODE = 64;
    public static final int MAX_SOURCE_PHOTO_ID = 128;
    public static final int MAX_URL = 2048;
    public static final int MAX_PHOTOGRAPHER = 200;

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring database schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS flights
            (
                id                      BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                natural_key             VARCHAR(255) NOT NULL UNIQUE,
                registration            VARCHAR(20)  NOT NULL,
                flight_number           VARCHAR(20),
                origin_raw              VARCHAR(64)  NOT NULL,
                origin_icao             VARCHAR(4),
                origin_iata             VARCHAR(3),
                origin_timezone         VARCHAR(64),
                destination_raw         VARCHAR(64)  NOT NULL,
                destination_icao        VARCHAR(4),
                destination_iata        VARCHAR(3),
                destination_timezone    VARCHAR(64),
                departure_local         TIMESTAMP    NOT NULL,
                arrival_local           TIMESTAMP    NOT NULL,
                departure_utc           TIMESTAMP    NOT NULL,
                arrival_utc             TIMESTAMP    NOT NULL,
                arrival_date            DATE         NOT NULL,
                degraded_precision      BOOLEAN      NOT NULL,
                imported_at             TIMESTAMP    NOT NULL
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_flights_registration ON flights (registration)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS candidate_photos
            (
                id                      BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                source                  VARCHAR(32)   NOT NULL,
                source_photo_id         VARCHAR(128)  NOT NULL,
                registration            VARCHAR(20)   NOT NULL,
                source_url              VARCHAR(2048),
                thumbnail_url           VARCHAR(2048),
                full_image_url          VARCHAR(2048),
                photographer            VARCHAR(200),
                airport_code_raw        VARCHAR(64),
                airport_code            VARCHAR(64),
                photo_date              DATE,
                score                   INT           NOT NULL,
                matched_flight_id       BIGINT,
                matched_flight_date     DATE,
                match_reasons           VARCHAR(500),
                review_state            VARCHAR(16)   NOT NULL,
                review_comment          VARCHAR(1000),
                reviewed_at             TIMESTAMP,
                created_at              TIMESTAMP     NOT NULL,
                updated_at              TIMESTAMP     NOT NULL,
                CONSTRAINT uq_candidate_source UNIQUE (source, source_photo_id)
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_candidates_registration ON candidate_photos (registration)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_candidates_review ON candidate_photos (review_state, score)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS scrape_jobs
            (
                id                      BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                registration            VARCHAR(20)   NOT NULL,
                source                  VARCHAR(32)   NOT NULL,
                generation              BIGINT        NOT NULL,
                state                   VARCHAR(16)   NOT NULL,
                attempts                INT           NOT NULL,
                last_error              VARCHAR(2000),
                photos_found            INT           NOT NULL,
                scheduled_at            TIMESTAMP     NOT NULL,
                started_at              TIMESTAMP,
                completed_at            TIMESTAMP,
                CONSTRAINT uq_job_registration_source UNIQUE (registration, source)
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_jobs_state ON scrape_jobs (state)");

        log.info("Database schema ready.");
    }
}
