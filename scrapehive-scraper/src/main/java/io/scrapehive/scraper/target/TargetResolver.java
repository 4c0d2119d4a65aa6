package io.scrapehive.scraper.target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the list of targets for one collection cycle from the static URLs, the DNS-expanded
 * service URLs and a snapshot of the discovered targets.
 * <p>
 * No de-duplication happens: a URL that is both configured and discovered is scraped twice.
 */
public class TargetResolver {

    private static final Logger log = LoggerFactory.getLogger(TargetResolver.class);

    private final List<String> urls;
    private final List<String> serviceUrls;
    private final DynamicTargetSet dynamicTargets;
    private final HostResolver hostResolver;

    public TargetResolver(List<String> urls, List<String> serviceUrls, DynamicTargetSet dynamicTargets,
                          HostResolver hostResolver) {
        this.urls = List.copyOf(urls);
        this.serviceUrls = List.copyOf(serviceUrls);
        this.dynamicTargets = dynamicTargets;
        this.hostResolver = hostResolver;
    }

    public List<ScrapeTarget> resolve() throws TargetResolutionException {
        List<ScrapeTarget> all = new ArrayList<>();
        for (String url : urls) {
            try {
                all.add(ScrapeTarget.of(new URI(url)));
            } catch (URISyntaxException e) {
                log.warn("Could not parse {}, skipping it. Error: {}", url, e.getMessage());
            }
        }

        all.addAll(dynamicTargets.snapshot());

        for (String service : serviceUrls) {
            URI serviceUrl;
            try {
                serviceUrl = new URI(service);
            } catch (URISyntaxException e) {
                throw new TargetResolutionException("invalid service url " + service + ": " + e.getMessage(), e);
            }
            if (serviceUrl.getHost() == null) {
                throw new TargetResolutionException("invalid service url " + service + ": no host");
            }
            List<String> addresses;
            try {
                addresses = hostResolver.lookupHost(serviceUrl.getHost());
            } catch (UnknownHostException e) {
                log.warn("Could not resolve {}, skipping it. Error: {}", serviceUrl.getAuthority(), e.getMessage());
                continue;
            }
            for (String address : addresses) {
                all.add(new ScrapeTarget(serviceUrl, UriUtils.withHost(serviceUrl, address), address, Map.of()));
            }
        }
        return all;
    }
}
