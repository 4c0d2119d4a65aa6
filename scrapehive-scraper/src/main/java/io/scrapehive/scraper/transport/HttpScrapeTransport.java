package io.scrapehive.scraper.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP(S) transport backed by one {@link HttpClient}. Thread safe; shared by all scrape tasks.
 * <p>
 * The response timeout bounds the whole exchange, body included: the body is read into memory
 * before {@link #get} returns. Every request asks the server to close the connection afterwards.
 * The JDK treats {@code Connection} as a restricted header unless
 * {@value #RESTRICTED_HEADERS_PROPERTY} lists it before its HTTP classes load, see
 * {@link #allowConnectionHeader()}.
 */
public class HttpScrapeTransport implements ScrapeTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpScrapeTransport.class);

    static final String RESTRICTED_HEADERS_PROPERTY = "jdk.httpclient.allowRestrictedHeaders";

    private static volatile boolean connectionHeaderRejected;

    private final HttpClient httpClient;
    private final Duration responseTimeout;

    public HttpScrapeTransport(SSLContext sslContext, Duration responseTimeout) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .sslContext(sslContext)
                .connectTimeout(responseTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), responseTimeout);
    }

    HttpScrapeTransport(HttpClient httpClient, Duration responseTimeout) {
        this.httpClient = httpClient;
        this.responseTimeout = responseTimeout;
    }

    /**
     * Adds {@code connection} to {@value #RESTRICTED_HEADERS_PROPERTY}. Has no effect once the JDK
     * HTTP client classes are loaded, so call it at startup.
     */
    public static void allowConnectionHeader() {
        String current = System.getProperty(RESTRICTED_HEADERS_PROPERTY, "");
        for (String name : current.split(",")) {
            if (name.trim().equalsIgnoreCase("connection")) {
                return;
            }
        }
        System.setProperty(RESTRICTED_HEADERS_PROPERTY, current.isBlank() ? "connection" : current + ",connection");
    }

    @Override
    public ScrapeResponse get(URI uri, Map<String, String> headers) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(responseTimeout)
                .GET();
        headers.forEach(builder::header);
        requestConnectionClose(builder);

        CompletableFuture<HttpResponse<byte[]>> pending =
                httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        HttpResponse<byte[]> response;
        try {
            response = pending.get(responseTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new HttpTimeoutException("response not complete after " + responseTimeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            pending.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException ioException) {
                throw ioException;
            }
            throw new IOException(cause.getMessage(), cause);
        }

        return new ScrapeResponse(response.statusCode(), response.headers().map(),
                new ByteArrayInputStream(response.body()), () -> { });
    }

    private static void requestConnectionClose(HttpRequest.Builder builder) {
        if (connectionHeaderRejected) {
            return;
        }
        try {
            builder.header("Connection", "close");
        } catch (IllegalArgumentException e) {
            connectionHeaderRejected = true;
            log.warn("Connection header is restricted in this JVM, scrape connections will be reused. "
                    + "Start with -D{}=connection to close them. Error: {}", RESTRICTED_HEADERS_PROPERTY, e.getMessage());
        }
    }
}
