package io.scrapehive.scraper.accumulator;

import io.scrapehive.scraper.parse.MetricKind;

import java.time.Instant;
import java.util.Map;

/**
 * Base for accumulators that treat every kind the same way: each add is turned into a
 * {@link CollectedMetric} and passed to {@link #record(CollectedMetric)}.
 */
public abstract class RecordingAccumulator implements Accumulator {

    protected abstract void record(CollectedMetric metric);

    @Override
    public void addCounter(String name, Map<String, Double> fields, Map<String, String> tags, Instant timestamp) {
        record(new CollectedMetric(timestamp, MetricKind.COUNTER, name, tags, fields));
    }

    @Override
    public void addGauge(String name, Map<String, Double> fields, Map<String, String> tags, Instant timestamp) {
        record(new CollectedMetric(timestamp, MetricKind.GAUGE, name, tags, fields));
    }

    @Override
    public void addSummary(String name, Map<String, Double> fields, Map<String, String> tags, Instant timestamp) {
        record(new CollectedMetric(timestamp, MetricKind.SUMMARY, name, tags, fields));
    }

    @Override
    public void addHistogram(String name, Map<String, Double> fields, Map<String, String> tags, Instant timestamp) {
        record(new CollectedMetric(timestamp, MetricKind.HISTOGRAM, name, tags, fields));
    }

    @Override
    public void addFields(String name, Map<String, Double> fields, Map<String, String> tags, Instant timestamp) {
        record(new CollectedMetric(timestamp, MetricKind.UNTYPED, name, tags, fields));
    }
}
