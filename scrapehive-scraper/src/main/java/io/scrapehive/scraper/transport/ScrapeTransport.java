package io.scrapehive.scraper.transport;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Issues a GET for a scrape and returns the open response.
 */
public interface ScrapeTransport {

    ScrapeResponse get(URI uri, Map<String, String> headers) throws IOException, InterruptedException;
}
