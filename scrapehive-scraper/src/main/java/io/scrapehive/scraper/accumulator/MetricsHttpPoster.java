package io.scrapehive.scraper.accumulator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Queues JSON lines and POSTs them in batches as {@code application/x-ndjson}.
 * <p>
 * A drain thread sends as soon as rows arrive; a periodic flush picks up anything left behind.
 */
public class MetricsHttpPoster implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsHttpPoster.class);

    static final String CONTENT_TYPE = "application/x-ndjson";

    private final BlockingQueue<byte[]> queue;
    private final ScheduledExecutorService scheduler;
    private final HttpClient httpClient;
    private final URI endpoint;
    private final int maxBatchRows;
    private volatile boolean running = true;

    private final AtomicLong rowsPostedCount = new AtomicLong(0);
    private final AtomicLong rowsFailedCount = new AtomicLong(0);

    public MetricsHttpPoster(String httpUrl, int queueCapacity, int maxBatchRows, Duration flushInterval) {
        this.endpoint = URI.create(httpUrl);
        this.httpClient = HttpClient.newHttpClient();
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.maxBatchRows = maxBatchRows;

        this.scheduler = createScheduler();

        scheduler.scheduleAtFixedRate(this::flushSafely,
                flushInterval.toMillis(), flushInterval.toMillis(), TimeUnit.MILLISECONDS);

        scheduler.execute(this::drainLoop);
    }

    protected ScheduledExecutorService createScheduler() {
        return Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "metrics-http-poster");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @return false when the queue is full or the poster is closed
     */
    public boolean enqueue(byte[] row) {
        return running && queue.offer(row);
    }

    public int pending() {
        return queue.size();
    }

    /**
     * Rows the endpoint accepted.
     */
    public long getRowsPostedCount() {
        return rowsPostedCount.get();
    }

    /**
     * Rows lost to a failed POST.
     */
    public long getRowsFailedCount() {
        return rowsFailedCount.get();
    }

    @Override
    public void close() {
        running = false;
        scheduler.shutdownNow();
        flushSafely();
    }

    private void drainLoop() {
        try {
            while (running) {
                byte[] first = queue.poll(1, TimeUnit.SECONDS);
                if (first == null) continue;

                List<byte[]> batch = new ArrayList<>();
                batch.add(first);
                queue.drainTo(batch, maxBatchRows - 1);

                sendSafely(batch);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void flushSafely() {
        List<byte[]> drained = new ArrayList<>();
        queue.drainTo(drained);
        for (int from = 0; from < drained.size(); from += maxBatchRows) {
            sendSafely(drained.subList(from, Math.min(drained.size(), from + maxBatchRows)));
        }
    }

    private void sendSafely(List<byte[]> batch) {
        try {
            sendHttpPost(batch);
            rowsPostedCount.addAndGet(batch.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            rowsFailedCount.addAndGet(batch.size());
            log.warn("Interrupted while posting {} rows to {}", batch.size(), endpoint);
        } catch (Exception e) {
            rowsFailedCount.addAndGet(batch.size());
            log.warn("Dropping {} rows, post to {} failed: {}", batch.size(), endpoint, e.getMessage());
        }
    }

    private void sendHttpPost(List<byte[]> rows) throws IOException, InterruptedException {
        ByteArrayOutputStream payload = new ByteArrayOutputStream();
        for (byte[] row : rows) {
            payload.write(row);
            payload.write('\n');
        }
        HttpRequest req = HttpRequest.newBuilder()
                .uri(endpoint)
                .header("Content-Type", CONTENT_TYPE)
                .POST(HttpRequest.BodyPublishers.ofByteArray(payload.toByteArray()))
                .build();

        HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 300) {
            throw new IOException("HTTP POST failed: " + resp.statusCode() + " " + resp.body());
        }
    }
}
