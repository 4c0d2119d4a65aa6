package io.scrapehive.scraper.accumulator;

import io.scrapehive.scraper.parse.MetricKind;

import java.time.Instant;
import java.util.Map;

/**
 * A record as handed to an {@link Accumulator}.
 */
public record CollectedMetric(
    Instant timestamp,
    MetricKind kind,
    String name,
    Map<String, String> tags,
    Map<String, Double> fields
) {
    public CollectedMetric {
        tags = Map.copyOf(tags);
        fields = Map.copyOf(fields);
    }
}
