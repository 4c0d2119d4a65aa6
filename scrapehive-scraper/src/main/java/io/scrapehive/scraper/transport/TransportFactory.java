package io.scrapehive.scraper.transport;

import io.scrapehive.common.tls.TlsConfigurationException;
import io.scrapehive.scraper.target.ScrapeTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Hands out the transport for a target.
 * <p>
 * HTTP(S) targets share one {@link HttpScrapeTransport}, built on first use and kept for the
 * lifetime of the factory. Unix socket targets get a fresh transport per scrape because the
 * socket path comes from the target itself.
 */
public class TransportFactory {

    private static final Logger log = LoggerFactory.getLogger(TransportFactory.class);

    static {
        HttpScrapeTransport.allowConnectionHeader();
    }

    private final ClientConfig clientConfig;
    private volatile ScrapeTransport shared;

    public TransportFactory(ClientConfig clientConfig) {
        this.clientConfig = clientConfig;
    }

    public ScrapeTransport sharedTransport() throws TlsConfigurationException {
        ScrapeTransport transport = shared;
        if (transport == null) {
            synchronized (this) {
                transport = shared;
                if (transport == null) {
                    transport = new HttpScrapeTransport(clientConfig.tls().createSslContext(),
                            clientConfig.responseTimeout());
                    shared = transport;
                    log.info("HTTP scrape client created: responseTimeout={}, tls={}",
                            clientConfig.responseTimeout(), !clientConfig.tls().isEmpty());
                }
            }
        }
        return transport;
    }

    public ScrapeTransport transportFor(ScrapeTarget target) throws TlsConfigurationException {
        if (target.isUnixSocket()) {
            return new UnixSocketScrapeTransport(Path.of(target.url().getPath()), clientConfig.responseTimeout());
        }
        return sharedTransport();
    }

    public ClientConfig clientConfig() {
        return clientConfig;
    }
}
