package io.scrapehive.scraper.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ScrapeMetricsTest {

    @Test
    void testCyclesAccumulate() {
        var registry = new SimpleMeterRegistry();
        var metrics = new ScrapeMetrics(registry);

        metrics.recordCycle(Duration.ofMillis(120), 3, 1);
        metrics.recordCycle(Duration.ofMillis(80), 3, 0);
        metrics.recordGatherFailure();

        assertEquals(2L, registry.get(ScrapeMetrics.GATHER_DURATION).timer().count());
        assertEquals(200.0, registry.get(ScrapeMetrics.GATHER_DURATION).timer().totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertEquals(6.0, registry.get(ScrapeMetrics.TARGETS_RESOLVED).counter().count());
        assertEquals(1.0, registry.get(ScrapeMetrics.SCRAPE_ERRORS).counter().count());
        assertEquals(1.0, registry.get(ScrapeMetrics.GATHER_FAILURES).counter().count());
    }
}
