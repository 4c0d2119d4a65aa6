package io.scrapehive.scraper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.scrapehive.common.ConfigUtils;
import io.scrapehive.scraper.transport.HttpScrapeTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Entry point for the standalone scraper.
 * <p>
 * Usage:
 * <pre>
 * java -jar scrapehive-scraper.jar
 * java -jar scrapehive-scraper.jar --config /path/to/scraper.conf
 * java -jar scrapehive-scraper.jar --conf 'scrapehive.urls=["http://localhost:9100/metrics"]'
 * </pre>
 * Configuration is HOCON; see reference.conf for the defaults.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        HttpScrapeTransport.allowConnectionHeader();
        ScraperConfig config = ScraperConfig.fromConfig(ConfigUtils.scraperConfig(args));
        ScraperServer server = new ScraperServer(config, new SimpleMeterRegistry());

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (Exception e) {
                log.error("Error during shutdown", e);
            } finally {
                shutdown.countDown();
            }
        }, "scraper-shutdown"));

        server.start();
        shutdown.await();
    }
}
