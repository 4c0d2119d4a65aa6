package io.scrapehive.scraper.target;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * An endpoint to scrape in one collection cycle.
 *
 * @param originalUrl the configured or discovered URL, used for the {@code url} tag
 * @param url         the URL actually dialed; differs from {@code originalUrl} when a service
 *                    name was expanded to one of its addresses
 * @param address     resolved address, or {@code null} when the target was not expanded
 * @param tags        extra tags applied to every metric scraped from this target
 */
public record ScrapeTarget(URI originalUrl, URI url, String address, Map<String, String> tags) {

    public static final String UNIX_SCHEME = "unix";

    public ScrapeTarget {
        Objects.requireNonNull(url, "url");
        if (url.toString().isEmpty()) {
            throw new IllegalArgumentException("target url must not be empty");
        }
        if (originalUrl == null) {
            originalUrl = url;
        }
        if (address != null && address.isEmpty()) {
            address = null;
        }
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public static ScrapeTarget of(URI url) {
        return new ScrapeTarget(url, url, null, Map.of());
    }

    public boolean isUnixSocket() {
        return UNIX_SCHEME.equalsIgnoreCase(url.getScheme());
    }
}
