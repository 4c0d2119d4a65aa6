package io.scrapehive.scraper.accumulator;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Keeps everything it receives in memory.
 */
public class CollectingAccumulator extends RecordingAccumulator {

    private final ConcurrentLinkedQueue<CollectedMetric> metrics = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();

    @Override
    protected void record(CollectedMetric metric) {
        metrics.add(metric);
    }

    @Override
    public void addError(Throwable error) {
        if (error != null) {
            errors.add(error);
        }
    }

    public List<CollectedMetric> metrics() {
        return new ArrayList<>(metrics);
    }

    public List<Throwable> errors() {
        return new ArrayList<>(errors);
    }

    /**
     * Removes and returns the metrics collected so far.
     */
    public List<CollectedMetric> drainMetrics() {
        List<CollectedMetric> drained = new ArrayList<>();
        CollectedMetric metric;
        while ((metric = metrics.poll()) != null) {
            drained.add(metric);
        }
        return drained;
    }
}
