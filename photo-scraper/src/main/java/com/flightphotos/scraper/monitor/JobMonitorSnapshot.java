package com.flightphotos.scraper.monitor;

import com.flightphotos.scraper.model.ScrapeJobState;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
public class JobMonitorSnapshot {

    private Map<ScrapeJobState, Integer> counts;
    private boolean paused;
    private int maxConcurrency;
    private int inFlight;

    /** Moving average over the most recent task durations, null before the first task finishes */
    private Long averageTaskMillis;

    /** Null while paused or when no task has finished yet */
    private Long etaSeconds;

    /** Jobs that reached FAILED since startup */
    private long failedTotal;

    private Instant takenAt;
}
