package io.scrapehive.scraper.scrape;

import java.net.URI;

/**
 * A single target could not be scraped. Reported through the accumulator; never fails the cycle.
 */
public class ScrapeException extends Exception {

    private final URI targetUrl;

    public ScrapeException(URI targetUrl, String message) {
        super(message);
        this.targetUrl = targetUrl;
    }

    public ScrapeException(URI targetUrl, String message, Throwable cause) {
        super(message, cause);
        this.targetUrl = targetUrl;
    }

    public URI getTargetUrl() {
        return targetUrl;
    }
}
