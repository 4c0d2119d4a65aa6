package io.scrapehive.scraper.transport;

import io.scrapehive.common.tls.TlsClientConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Transport and authentication settings shared by every scrape of a run.
 *
 * @param bearerTokenPath file holding the bearer token, or empty for none
 */
public record ClientConfig(TlsClientConfig tls, Duration responseTimeout, String bearerTokenPath) {

    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(3);

    public ClientConfig {
        tls = tls == null ? TlsClientConfig.none() : tls;
        responseTimeout = responseTimeout == null ? DEFAULT_RESPONSE_TIMEOUT : responseTimeout;
        bearerTokenPath = bearerTokenPath == null ? "" : bearerTokenPath.trim();
        if (responseTimeout.isNegative() || responseTimeout.isZero()) {
            throw new IllegalArgumentException("response timeout must be positive: " + responseTimeout);
        }
        Objects.requireNonNull(tls);
    }

    public boolean hasBearerToken() {
        return !bearerTokenPath.isEmpty();
    }
}
