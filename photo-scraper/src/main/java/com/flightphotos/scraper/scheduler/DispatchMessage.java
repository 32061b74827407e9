package com.flightphotos.scraper.scheduler;

/**
 * A request to run one generation of a scrape job. May be delivered more than
 * once, the worker drops it unless the job is still QUEUED at that generation.
 */
public record DispatchMessage(long jobId, String registration, String source, long generation) {}
