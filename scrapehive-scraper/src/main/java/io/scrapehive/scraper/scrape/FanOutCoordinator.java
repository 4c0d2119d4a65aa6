package io.scrapehive.scraper.scrape;

import io.scrapehive.scraper.accumulator.Accumulator;
import io.scrapehive.scraper.parse.ParsedMetric;
import io.scrapehive.scraper.target.ScrapeTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scrapes all targets of a cycle in parallel, one task per target.
 * <p>
 * Every task is submitted before any is awaited, and {@link #scrapeAll} returns only once all of
 * them are done. A task's failure goes to {@link Accumulator#addError} and nowhere else; its
 * metrics go to the accumulator as soon as that task finishes.
 */
public class FanOutCoordinator {

    private static final Logger log = LoggerFactory.getLogger(FanOutCoordinator.class);

    private final ScrapeExecutor executor;
    private final ExecutorService workers;

    /**
     * @param workers must not bound concurrency below the number of targets, e.g. a cached pool
     */
    public FanOutCoordinator(ScrapeExecutor executor, ExecutorService workers) {
        this.executor = executor;
        this.workers = workers;
    }

    /**
     * @return number of targets that failed
     */
    public int scrapeAll(List<ScrapeTarget> targets, Accumulator acc) {
        AtomicInteger failures = new AtomicInteger();
        List<CompletableFuture<Void>> tasks = new ArrayList<>(targets.size());
        for (ScrapeTarget target : targets) {
            tasks.add(CompletableFuture.runAsync(() -> scrapeOne(target, acc, failures), workers));
        }
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
        return failures.get();
    }

    private void scrapeOne(ScrapeTarget target, Accumulator acc, AtomicInteger failures) {
        try {
            List<ParsedMetric> metrics = executor.scrape(target);
            TagNormalizer normalizer = new TagNormalizer(target);
            for (ParsedMetric metric : metrics) {
                route(normalizer.apply(metric), acc);
            }
            log.debug("Scraped {} metrics from {}", metrics.size(), target.url());
        } catch (ScrapeException e) {
            failures.incrementAndGet();
            acc.addError(e);
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            acc.addError(new ScrapeException(target.url(),
                    "unexpected error scraping " + target.url() + ": " + e, e));
        }
    }

    static void route(ParsedMetric metric, Accumulator acc) {
        switch (metric.kind()) {
            case COUNTER -> acc.addCounter(metric.name(), metric.fields(), metric.tags(), metric.timestamp());
            case GAUGE -> acc.addGauge(metric.name(), metric.fields(), metric.tags(), metric.timestamp());
            case SUMMARY -> acc.addSummary(metric.name(), metric.fields(), metric.tags(), metric.timestamp());
            case HISTOGRAM -> acc.addHistogram(metric.name(), metric.fields(), metric.tags(), metric.timestamp());
            case UNTYPED -> acc.addFields(metric.name(), metric.fields(), metric.tags(), metric.timestamp());
        }
    }
}
