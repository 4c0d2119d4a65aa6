package io.scrapehive.scraper.scrape;

import io.scrapehive.scraper.parse.ParsedMetric;
import io.scrapehive.scraper.target.ScrapeTarget;
import io.scrapehive.scraper.target.UriUtils;

import java.util.Map;

/**
 * Stamps target identity onto the tags of each metric scraped from it.
 * <p>
 * Order: {@code url} (credentials removed), then {@code address} when the target was expanded
 * from a service, then the target's own tags, which may overwrite both.
 */
public class TagNormalizer {

    public static final String URL_TAG = "url";
    public static final String ADDRESS_TAG = "address";

    private final String url;
    private final String address;
    private final Map<String, String> extraTags;

    public TagNormalizer(ScrapeTarget target) {
        this.url = UriUtils.withoutUserInfo(target.originalUrl()).toString();
        this.address = target.address();
        this.extraTags = target.tags();
    }

    public ParsedMetric apply(ParsedMetric metric) {
        Map<String, String> tags = metric.tags();
        tags.put(URL_TAG, url);
        if (address != null) {
            tags.put(ADDRESS_TAG, address);
        }
        tags.putAll(extraTags);
        return metric;
    }
}
