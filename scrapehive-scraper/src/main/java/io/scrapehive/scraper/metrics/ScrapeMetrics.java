package io.scrapehive.scraper.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Meters describing the scraper itself.
 */
public class ScrapeMetrics {

    public static final String GATHER_DURATION = "scrapehive.gather.duration";
    public static final String TARGETS_RESOLVED = "scrapehive.targets.resolved";
    public static final String SCRAPE_ERRORS = "scrapehive.scrape.errors";
    public static final String GATHER_FAILURES = "scrapehive.gather.failures";

    private final Timer gatherDuration;
    private final Counter targetsResolved;
    private final Counter scrapeErrors;
    private final Counter gatherFailures;

    public ScrapeMetrics(MeterRegistry registry) {
        this.gatherDuration = Timer.builder(GATHER_DURATION)
                .description("Time taken by one collection cycle")
                .register(registry);
        this.targetsResolved = Counter.builder(TARGETS_RESOLVED)
                .description("Targets scraped across all cycles")
                .register(registry);
        this.scrapeErrors = Counter.builder(SCRAPE_ERRORS)
                .description("Targets that failed to scrape")
                .register(registry);
        this.gatherFailures = Counter.builder(GATHER_FAILURES)
                .description("Cycles that could not run")
                .register(registry);
    }

    public void recordCycle(Duration duration, int targets, int failures) {
        gatherDuration.record(duration);
        targetsResolved.increment(targets);
        scrapeErrors.increment(failures);
    }

    public void recordGatherFailure() {
        gatherFailures.increment();
    }
}
