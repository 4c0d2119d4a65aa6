package io.scrapehive.scraper.parse;

import java.util.Locale;

/**
 * Value type of an exposed metric family.
 */
public enum MetricKind {
    COUNTER,
    GAUGE,
    SUMMARY,
    HISTOGRAM,
    UNTYPED;

    /**
     * Maps a {@code # TYPE} keyword to a kind; anything unknown is {@link #UNTYPED}.
     */
    public static MetricKind fromTypeName(String typeName) {
        if (typeName == null) {
            return UNTYPED;
        }
        return switch (typeName.toLowerCase(Locale.ROOT)) {
            case "counter" -> COUNTER;
            case "gauge" -> GAUGE;
            case "summary" -> SUMMARY;
            case "histogram" -> HISTOGRAM;
            default -> UNTYPED;
        };
    }

    public String typeName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
