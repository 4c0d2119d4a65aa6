package io.scrapehive.scraper.parse;

import java.util.List;
import java.util.Map;

/**
 * Turns a scraped response body into metrics.
 * Implementations must be safe to call from many scrape tasks at once.
 */
public interface ExpositionParser {

    /**
     * @param body    the full response body
     * @param headers response headers; look names up case-insensitively
     */
    List<ParsedMetric> parse(byte[] body, Map<String, List<String>> headers) throws ExpositionParseException;
}
