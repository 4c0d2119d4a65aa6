package io.scrapehive.scraper.accumulator;

import java.time.Instant;
import java.util.Map;

/**
 * Receives typed, tagged records from the scrape tasks. Every method may be called from many
 * threads at once.
 */
public interface Accumulator {

    void addCounter(String name, Map<String, Double> fields, Map<String, String> tags, Instant timestamp);

    void addGauge(String name, Map<String, Double> fields, Map<String, String> tags, Instant timestamp);

    void addSummary(String name, Map<String, Double> fields, Map<String, String> tags, Instant timestamp);

    void addHistogram(String name, Map<String, Double> fields, Map<String, String> tags, Instant timestamp);

    /**
     * Records with no more specific kind.
     */
    void addFields(String name, Map<String, Double> fields, Map<String, String> tags, Instant timestamp);

    void addError(Throwable error);
}
