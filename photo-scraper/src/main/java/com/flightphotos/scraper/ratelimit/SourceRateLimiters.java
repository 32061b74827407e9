package com.flightphotos.scraper.ratelimit;

import com.flightphotos.scraper.config.FlightPhotoProperties;
import com.flightphotos.scraper.model.PhotoSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * One limiter per photo site, shared by every worker that talks to that site.
 */
@Component
@Slf4j
public class SourceRateLimiters {

    private final Map<PhotoSource, SlidingWindowRateLimiter> limiters = new EnumMap<>(PhotoSource.class);

    @Autowired
    public SourceRateLimiters(FlightPhotoProperties properties) {
        this(properties, TimeSource.SYSTEM);
    }

    public SourceRateLimiters(FlightPhotoProperties properties, TimeSource time) {
        for (PhotoSource source : PhotoSource.values()) {
            FlightPhotoProperties.Source config = properties.sourceFor(source.key());
            limiters.put(source, new SlidingWindowRateLimiter(
                    source.domain(), config.getMaxRequests(), config.getWindow(), time));
            log.info("Rate limit for {}: {} requests per {}s",
                    source.domain(), config.getMaxRequests(), config.getWindow().toSeconds());
        }
    }

    public SlidingWindowRateLimiter forSource(PhotoSource source) {
        return limiters.get(source);
    }
}
