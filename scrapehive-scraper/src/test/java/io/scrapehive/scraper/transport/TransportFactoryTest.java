package io.scrapehive.scraper.transport;

import io.scrapehive.common.tls.TlsClientConfig;
import io.scrapehive.common.tls.TlsConfigurationException;
import io.scrapehive.scraper.target.ScrapeTarget;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class TransportFactoryTest {

    private static TransportFactory factory(TlsClientConfig tls) {
        return new TransportFactory(new ClientConfig(tls, Duration.ofSeconds(3), ""));
    }

    @Test
    void testSharedTransportIsBuiltOnce() throws Exception {
        var factory = factory(TlsClientConfig.none());
        ScrapeTransport first = factory.sharedTransport();
        assertSame(first, factory.sharedTransport());
        assertSame(first, factory.transportFor(ScrapeTarget.of(URI.create("https://host/metrics"))));
    }

    @Test
    void testUnixTargetsGetTheirOwnTransport() throws Exception {
        var factory = factory(TlsClientConfig.none());
        var target = ScrapeTarget.of(URI.create("unix:///run/app/metrics.sock"));

        ScrapeTransport first = factory.transportFor(target);
        ScrapeTransport second = factory.transportFor(target);

        assertInstanceOf(UnixSocketScrapeTransport.class, first);
        assertNotSame(first, second);
        assertEquals(Path.of("/run/app/metrics.sock"), ((UnixSocketScrapeTransport) first).socketPath());
    }

    @Test
    void testBadTlsFailsSharedTransport() {
        var factory = factory(new TlsClientConfig("/does/not/exist.pem", "", "", false));
        assertThrows(TlsConfigurationException.class, factory::sharedTransport);
    }

    @Test
    void testDefaultResponseTimeout() {
        var config = new ClientConfig(null, null, null);
        assertEquals(Duration.ofSeconds(3), config.responseTimeout());
        assertFalse(config.hasBearerToken());
        assertTrue(config.tls().isEmpty());
    }

    @Test
    void testNonPositiveTimeoutIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new ClientConfig(TlsClientConfig.none(), Duration.ZERO, ""));
    }
}
