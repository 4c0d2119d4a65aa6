package io.scrapehive.scraper.accumulator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accumulator that serializes each record to a JSON row and hands it to a {@link MetricsHttpPoster}.
 * <p>
 * Row layout: {@code timestamp} (epoch millis), {@code name}, {@code type}, {@code tags},
 * {@code fields}. Non-finite field values are written as {@code null}.
 */
public class MetricsForwarder extends RecordingAccumulator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsForwarder.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final MetricsHttpPoster poster;

    private final AtomicLong metricsEnqueuedCount = new AtomicLong(0);
    private final AtomicLong metricsDroppedCount = new AtomicLong(0);
    private final AtomicLong errorCount = new AtomicLong(0);

    public MetricsForwarder(MetricsHttpPoster poster) {
        this.poster = poster;
    }

    @Override
    protected void record(CollectedMetric metric) {
        try {
            if (poster.enqueue(objectMapper.writeValueAsBytes(toRow(metric)))) {
                metricsEnqueuedCount.incrementAndGet();
            } else {
                metricsDroppedCount.incrementAndGet();
                log.debug("Output queue full, dropped {}", metric.name());
            }
        } catch (JsonProcessingException e) {
            metricsDroppedCount.incrementAndGet();
            log.error("Failed to serialize {}: {}", metric.name(), e.getMessage());
        }
    }

    @Override
    public void addError(Throwable error) {
        if (error != null) {
            errorCount.incrementAndGet();
            log.warn("Scrape failed: {}", error.getMessage());
        }
    }

    static Map<String, Object> toRow(CollectedMetric metric) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", metric.timestamp().toEpochMilli());
        row.put("name", metric.name());
        row.put("type", metric.kind().typeName());
        row.put("tags", metric.tags());

        Map<String, Double> fields = new LinkedHashMap<>();
        metric.fields().forEach((key, value) ->
                fields.put(key, (Double.isNaN(value) || Double.isInfinite(value)) ? null : value));
        row.put("fields", fields);
        return row;
    }

    @Override
    public void close() {
        poster.close();
        log.info("MetricsForwarder closed: enqueued={}, posted={}, postFailed={}, dropped={}, errors={}",
                metricsEnqueuedCount.get(), poster.getRowsPostedCount(), poster.getRowsFailedCount(),
                metricsDroppedCount.get(), errorCount.get());
    }

    public long getMetricsEnqueuedCount() {
        return metricsEnqueuedCount.get();
    }

    public long getMetricsDroppedCount() {
        return metricsDroppedCount.get();
    }

    public long getErrorCount() {
        return errorCount.get();
    }
}
