package io.scrapehive.scraper.transport;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;

/**
 * An open response. The body is streamed; {@link #close()} drains what is left and releases the
 * underlying connection, so use it in try-with-resources.
 */
public class ScrapeResponse implements Closeable {

    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final InputStream body;
    private final Closeable connection;

    public ScrapeResponse(int statusCode, Map<String, List<String>> headers, InputStream body, Closeable connection) {
        this.statusCode = statusCode;
        this.headers = headers;
        this.body = body;
        this.connection = connection;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public byte[] readBody() throws IOException {
        return body.readAllBytes();
    }

    @Override
    public void close() throws IOException {
        try (connection; body) {
            body.transferTo(OutputStream.nullOutputStream());
        }
    }
}
