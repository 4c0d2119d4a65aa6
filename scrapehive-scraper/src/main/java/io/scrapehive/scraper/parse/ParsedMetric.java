package io.scrapehive.scraper.parse;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One metric produced by an {@link ExpositionParser}.
 * <p>
 * The tag map is a private mutable copy so that tag normalization can rewrite it in place
 * without touching anything shared with another target.
 */
public record ParsedMetric(
        String name,
        MetricKind kind,
        Map<String, Double> fields,
        Map<String, String> tags,
        Instant timestamp
) {
    public ParsedMetric {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        fields = new LinkedHashMap<>(fields);
        tags = new LinkedHashMap<>(tags);
    }
}
