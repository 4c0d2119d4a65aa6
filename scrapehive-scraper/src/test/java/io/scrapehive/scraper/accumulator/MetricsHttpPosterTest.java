package io.scrapehive.scraper.accumulator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MetricsHttpPosterTest {

    private MetricsHttpPoster poster;
    private HttpClient mockClient;

    // no drain or flush threads, batches are pushed by hand
    static class ManualMetricsHttpPoster extends MetricsHttpPoster {
        ManualMetricsHttpPoster(String url, int queueCapacity, int maxBatchRows, Duration flushInterval) {
            super(url, queueCapacity, maxBatchRows, flushInterval);
        }

        @Override
        protected ScheduledExecutorService createScheduler() {
            return mock(ScheduledExecutorService.class);
        }
    }

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setup() throws Exception {
        poster = new ManualMetricsHttpPoster("http://localhost:9999/ingest", 3, 2, Duration.ofMillis(200));

        mockClient = mock(HttpClient.class);
        var field = MetricsHttpPoster.class.getDeclaredField("httpClient");
        field.setAccessible(true);
        field.set(poster, mockClient);

        HttpResponse<String> ok = mock(HttpResponse.class);
        when(ok.statusCode()).thenReturn(200);
        when(mockClient.send(any(), any(HttpResponse.BodyHandler.class))).thenReturn(ok);
    }

    @AfterEach
    void teardown() {
        poster.close();
    }

    private void invokeFlush() throws Exception {
        Method flush = MetricsHttpPoster.class.getDeclaredMethod("flushSafely");
        flush.setAccessible(true);
        flush.invoke(poster);
    }

    @Test
    void testEnqueueUntilFull() {
        assertTrue(poster.enqueue("{\"a\":1}".getBytes()));
        assertTrue(poster.enqueue("{\"a\":2}".getBytes()));
        assertTrue(poster.enqueue("{\"a\":3}".getBytes()));
        assertFalse(poster.enqueue("{\"a\":4}".getBytes()));
        assertEquals(3, poster.pending());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testFlushSplitsIntoBatches() throws Exception {
        poster.enqueue("{\"a\":1}".getBytes());
        poster.enqueue("{\"a\":2}".getBytes());
        poster.enqueue("{\"a\":3}".getBytes());

        invokeFlush();

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(mockClient, times(2)).send(captor.capture(), any(HttpResponse.BodyHandler.class));
        assertEquals(0, poster.pending());
        assertEquals(3, poster.getRowsPostedCount());
        assertEquals(0, poster.getRowsFailedCount());

        HttpRequest first = captor.getAllValues().get(0);
        assertEquals(URI.create("http://localhost:9999/ingest"), first.uri());
        assertEquals("POST", first.method());
        assertEquals("application/x-ndjson", first.headers().firstValue("Content-Type").orElseThrow());
        // two 7-byte rows, each newline terminated
        assertEquals(16L, first.bodyPublisher().orElseThrow().contentLength());
        assertEquals(8L, captor.getAllValues().get(1).bodyPublisher().orElseThrow().contentLength());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testHttpFailureStatusThrows() throws Exception {
        HttpResponse<String> bad = mock(HttpResponse.class);
        when(bad.statusCode()).thenReturn(500);
        when(bad.body()).thenReturn("failed");
        when(mockClient.send(any(), any(HttpResponse.BodyHandler.class))).thenReturn(bad);

        Method sendPost = MetricsHttpPoster.class.getDeclaredMethod("sendHttpPost", List.class);
        sendPost.setAccessible(true);

        var ex = assertThrows(InvocationTargetException.class,
                () -> sendPost.invoke(poster, List.of("{}".getBytes())));
        assertInstanceOf(IOException.class, ex.getCause());
        assertEquals("HTTP POST failed: 500 failed", ex.getCause().getMessage());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testSendFailureDropsBatchWithoutThrowing() throws Exception {
        when(mockClient.send(any(), any(HttpResponse.BodyHandler.class)))
                .thenThrow(new ConnectException("Connection refused"));
        poster.enqueue("{}".getBytes());

        assertDoesNotThrow(this::invokeFlush);
        assertEquals(0, poster.pending());
        assertEquals(0, poster.getRowsPostedCount());
        assertEquals(1, poster.getRowsFailedCount());
    }

    @Test
    void testCloseRejectsFurtherRows() throws Exception {
        poster.close();

        var field = MetricsHttpPoster.class.getDeclaredField("running");
        field.setAccessible(true);
        assertFalse(field.getBoolean(poster));
        assertFalse(poster.enqueue("{}".getBytes()));
    }
}
