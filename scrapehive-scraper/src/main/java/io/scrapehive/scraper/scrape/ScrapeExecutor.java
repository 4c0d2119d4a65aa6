package io.scrapehive.scraper.scrape;

import io.scrapehive.common.tls.TlsConfigurationException;
import io.scrapehive.scraper.parse.ExpositionParseException;
import io.scrapehive.scraper.parse.ExpositionParser;
import io.scrapehive.scraper.parse.ParsedMetric;
import io.scrapehive.scraper.target.ScrapeTarget;
import io.scrapehive.scraper.target.UriUtils;
import io.scrapehive.scraper.transport.ClientConfig;
import io.scrapehive.scraper.transport.ScrapeResponse;
import io.scrapehive.scraper.transport.ScrapeTransport;
import io.scrapehive.scraper.transport.TransportFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scrapes one target: builds the request, checks the response and hands the body to the parser.
 */
public class ScrapeExecutor {

    public static final String DEFAULT_METRICS_PATH = "/metrics";

    /** Text format preferred over the delimited protobuf encoding. */
    public static final String ACCEPT_HEADER =
            "application/vnd.google.protobuf;proto=io.prometheus.client.MetricFamily;encoding=delimited;q=0.3,"
                    + "text/plain;version=0.0.4;q=0.7";

    private final TransportFactory transportFactory;
    private final ExpositionParser parser;
    private final String bearerTokenPath;

    public ScrapeExecutor(TransportFactory transportFactory, ExpositionParser parser) {
        this.transportFactory = transportFactory;
        this.parser = parser;
        ClientConfig clientConfig = transportFactory.clientConfig();
        this.bearerTokenPath = clientConfig.hasBearerToken() ? clientConfig.bearerTokenPath() : null;
    }

    public List<ParsedMetric> scrape(ScrapeTarget target) throws ScrapeException {
        URI targetUrl = target.url();
        URI requestUri = requestUri(target);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", ACCEPT_HEADER);
        if (bearerTokenPath != null) {
            headers.put("Authorization", "Bearer " + readBearerToken(targetUrl));
        } else if (targetUrl.getRawUserInfo() != null && !target.isUnixSocket()) {
            headers.put("Authorization", basicAuth(targetUrl.getRawUserInfo()));
        }

        ScrapeResponse response = execute(target, requestUri, headers);
        byte[] body;
        Map<String, List<String>> responseHeaders;
        try (response) {
            if (!response.isSuccess()) {
                throw new ScrapeException(targetUrl, targetUrl + " returned HTTP status " + response.statusCode());
            }
            try {
                body = response.readBody();
            } catch (IOException e) {
                throw new ScrapeException(targetUrl, "error reading body from " + targetUrl + ": " + e.getMessage(), e);
            }
            responseHeaders = response.headers();
        } catch (IOException e) {
            throw new ScrapeException(targetUrl, "error closing response from " + targetUrl + ": " + e.getMessage(), e);
        }

        try {
            return parser.parse(body, responseHeaders);
        } catch (ExpositionParseException e) {
            throw new ScrapeException(targetUrl, "error reading metrics for " + targetUrl + ": " + e.getMessage(), e);
        }
    }

    private ScrapeResponse execute(ScrapeTarget target, URI requestUri, Map<String, String> headers)
            throws ScrapeException {
        URI targetUrl = target.url();
        try {
            ScrapeTransport transport = transportFactory.transportFor(target);
            return transport.get(requestUri, headers);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScrapeException(targetUrl, "error making HTTP request to " + targetUrl + ": interrupted", e);
        } catch (IOException | IllegalArgumentException | TlsConfigurationException e) {
            throw new ScrapeException(targetUrl, "error making HTTP request to " + targetUrl + ": " + describe(e), e);
        }
    }

    /**
     * The URI put on the wire. Unix socket targets carry the HTTP path in their {@code path} query
     * parameter; network targets default to {@value #DEFAULT_METRICS_PATH} and drop credentials.
     */
    static URI requestUri(ScrapeTarget target) throws ScrapeException {
        URI url = target.url();
        if (target.isUnixSocket()) {
            if (url.getPath() == null || url.getPath().isEmpty()) {
                throw new ScrapeException(url, "error making HTTP request to " + url + ": no socket path");
            }
            String path = UriUtils.queryParameter(url, "path");
            if (path == null || path.isEmpty()) {
                path = DEFAULT_METRICS_PATH;
            }
            try {
                return URI.create("http://localhost" + (path.startsWith("/") ? path : "/" + path));
            } catch (IllegalArgumentException e) {
                throw new ScrapeException(url, "error making HTTP request to " + url + ": invalid path " + path, e);
            }
        }
        URI requestUri = UriUtils.withoutUserInfo(url);
        if (!url.isOpaque() && (url.getRawPath() == null || url.getRawPath().isEmpty())) {
            requestUri = UriUtils.withPath(requestUri, DEFAULT_METRICS_PATH);
        }
        return requestUri;
    }

    private String readBearerToken(URI targetUrl) throws ScrapeException {
        try {
            return Files.readString(Path.of(bearerTokenPath)).trim();
        } catch (IOException e) {
            throw new ScrapeException(targetUrl,
                    "error reading bearer token " + bearerTokenPath + " for " + targetUrl + ": " + describe(e), e);
        }
    }

    private static String basicAuth(String rawUserInfo) {
        String userInfo = URLDecoder.decode(rawUserInfo, StandardCharsets.UTF_8);
        return "Basic " + Base64.getEncoder().encodeToString(userInfo.getBytes(StandardCharsets.UTF_8));
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
