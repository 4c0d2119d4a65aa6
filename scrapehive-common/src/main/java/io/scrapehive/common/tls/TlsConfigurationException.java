package io.scrapehive.common.tls;

/**
 * Raised when TLS client material (CA bundle, certificate or key) cannot be loaded.
 * A collection cycle cannot run without a working client, so callers treat this as fatal.
 */
public class TlsConfigurationException extends Exception {

    public TlsConfigurationException(String message) {
        super(message);
    }

    public TlsConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
