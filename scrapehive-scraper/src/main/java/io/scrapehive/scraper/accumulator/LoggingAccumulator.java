package io.scrapehive.scraper.accumulator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every record to the log. Used when no output endpoint is configured.
 */
public class LoggingAccumulator extends RecordingAccumulator {

    private static final Logger log = LoggerFactory.getLogger(LoggingAccumulator.class);

    @Override
    protected void record(CollectedMetric metric) {
        log.info("{} {} {} {} {}", metric.kind().typeName(), metric.name(), metric.tags(), metric.fields(),
                metric.timestamp().toEpochMilli());
    }

    @Override
    public void addError(Throwable error) {
        if (error != null) {
            log.warn("Scrape failed: {}", error.getMessage());
        }
    }
}
