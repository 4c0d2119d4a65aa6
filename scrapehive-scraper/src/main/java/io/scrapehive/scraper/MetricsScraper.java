package io.scrapehive.scraper;

import io.micrometer.core.instrument.MeterRegistry;
import io.scrapehive.common.tls.TlsConfigurationException;
import io.scrapehive.scraper.accumulator.Accumulator;
import io.scrapehive.scraper.discovery.DiscoveryLifecycle;
import io.scrapehive.scraper.discovery.DiscoveryWatcher;
import io.scrapehive.scraper.metrics.ScrapeMetrics;
import io.scrapehive.scraper.parse.ExpositionParser;
import io.scrapehive.scraper.scrape.FanOutCoordinator;
import io.scrapehive.scraper.scrape.ScrapeExecutor;
import io.scrapehive.scraper.target.DynamicTargetSet;
import io.scrapehive.scraper.target.HostResolver;
import io.scrapehive.scraper.target.ScrapeTarget;
import io.scrapehive.scraper.target.TargetResolutionException;
import io.scrapehive.scraper.target.TargetResolver;
import io.scrapehive.scraper.transport.TransportFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collects metrics from every configured, service-expanded and discovered target.
 * <p>
 * {@link #gather(Accumulator)} runs one cycle. It fails only when the cycle cannot run at all
 * (bad TLS material, malformed service URL); scrape failures of single targets are reported to the
 * accumulator.
 */
public class MetricsScraper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsScraper.class);

    private final TransportFactory transportFactory;
    private final TargetResolver targetResolver;
    private final FanOutCoordinator coordinator;
    private final DiscoveryLifecycle discovery;
    private final ScrapeMetrics scrapeMetrics;
    private final ExecutorService workers;

    public MetricsScraper(ScraperConfig config, ExpositionParser parser, DiscoveryWatcher watcher,
                          HostResolver hostResolver, MeterRegistry meterRegistry) {
        DynamicTargetSet dynamicTargets = new DynamicTargetSet();
        this.transportFactory = new TransportFactory(config.clientConfig());
        this.targetResolver = new TargetResolver(config.urls(), config.kubernetesServices(), dynamicTargets,
                hostResolver);
        this.workers = Executors.newCachedThreadPool(new ScrapeThreadFactory());
        this.coordinator = new FanOutCoordinator(new ScrapeExecutor(transportFactory, parser), workers);
        this.discovery = new DiscoveryLifecycle(config.monitorKubernetesPods(), watcher, dynamicTargets);
        this.scrapeMetrics = new ScrapeMetrics(meterRegistry);
    }

    MetricsScraper(TransportFactory transportFactory, TargetResolver targetResolver, FanOutCoordinator coordinator,
                   DiscoveryLifecycle discovery, ScrapeMetrics scrapeMetrics, ExecutorService workers) {
        this.transportFactory = transportFactory;
        this.targetResolver = targetResolver;
        this.coordinator = coordinator;
        this.discovery = discovery;
        this.scrapeMetrics = scrapeMetrics;
        this.workers = workers;
    }

    public void start() {
        discovery.start();
    }

    public void stop() {
        discovery.stop();
    }

    public void gather(Accumulator acc) throws TlsConfigurationException, TargetResolutionException {
        long startNanos = System.nanoTime();
        List<ScrapeTarget> targets;
        try {
            transportFactory.sharedTransport();
            targets = targetResolver.resolve();
        } catch (TlsConfigurationException | TargetResolutionException e) {
            scrapeMetrics.recordGatherFailure();
            throw e;
        }

        int failures = coordinator.scrapeAll(targets, acc);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        scrapeMetrics.recordCycle(elapsed, targets.size(), failures);
        log.debug("Gathered {} targets in {} ms, {} failed", targets.size(), elapsed.toMillis(), failures);
    }

    @Override
    public void close() {
        stop();
        workers.shutdownNow();
    }

    private static final class ScrapeThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "scrape-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
