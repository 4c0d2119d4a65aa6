package io.scrapehive.scraper;

import io.micrometer.core.instrument.MeterRegistry;
import io.scrapehive.common.tls.TlsConfigurationException;
import io.scrapehive.scraper.accumulator.Accumulator;
import io.scrapehive.scraper.accumulator.LoggingAccumulator;
import io.scrapehive.scraper.accumulator.MetricsForwarder;
import io.scrapehive.scraper.accumulator.MetricsHttpPoster;
import io.scrapehive.scraper.discovery.DiscoveryWatcher;
import io.scrapehive.scraper.parse.TextExpositionParser;
import io.scrapehive.scraper.target.HostResolver;
import io.scrapehive.scraper.target.TargetResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@link MetricsScraper#gather} on a fixed schedule and owns the output accumulator.
 */
public class ScraperServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScraperServer.class);

    private final ScraperConfig config;
    private final MetricsScraper scraper;
    private final Accumulator accumulator;
    private final ScheduledExecutorService scheduler;

    public ScraperServer(ScraperConfig config, MeterRegistry meterRegistry) throws Exception {
        this(config, new MetricsScraper(config, new TextExpositionParser(), DiscoveryWatcher.load(config.discovery()),
                HostResolver.SYSTEM, meterRegistry), createAccumulator(config));
    }

    ScraperServer(ScraperConfig config, MetricsScraper scraper, Accumulator accumulator) {
        this.config = config;
        this.scraper = scraper;
        this.accumulator = accumulator;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "scrape-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    static Accumulator createAccumulator(ScraperConfig config) {
        if (config.outputHttpPostUrl().isBlank()) {
            return new LoggingAccumulator();
        }
        MetricsHttpPoster poster = new MetricsHttpPoster(config.outputHttpPostUrl(), config.outputQueueCapacity(),
                config.outputMaxBatchRows(), config.outputFlushInterval());
        log.info("Forwarding metrics to {}", config.outputHttpPostUrl());
        return new MetricsForwarder(poster);
    }

    public void start() {
        scraper.start();
        long intervalMs = config.scrapeInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::gatherOnce, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Scraper started: urls={}, services={}, podDiscovery={}, interval={}",
                config.urls().size(), config.kubernetesServices().size(), config.monitorKubernetesPods(),
                config.scrapeInterval());
    }

    void gatherOnce() {
        try {
            scraper.gather(accumulator);
        } catch (TlsConfigurationException e) {
            log.error("TLS configuration error, cycle skipped: {}", e.getMessage());
        } catch (TargetResolutionException e) {
            log.error("Could not build target list, cycle skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            // keep the schedule alive; an escaped exception would cancel it
            log.error("Collection cycle failed", e);
        }
    }

    @Override
    public void close() throws Exception {
        scheduler.shutdownNow();
        scheduler.awaitTermination(config.responseTimeout().toMillis() * 2, TimeUnit.MILLISECONDS);
        scraper.close();
        if (accumulator instanceof AutoCloseable closeable) {
            closeable.close();
        }
        log.info("Scraper stopped");
    }
}
