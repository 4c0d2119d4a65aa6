package io.scrapehive.scraper.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.StandardProtocolFamily;
import java.net.URI;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * HTTP/1.1 over a Unix domain socket. The host part of the request URI is ignored; every request
 * connects to {@link #socketPath()} and asks the server to close the connection afterwards.
 * <p>
 * The response timeout covers the whole exchange: when it elapses the channel is closed, which
 * fails any blocked read.
 */
public class UnixSocketScrapeTransport implements ScrapeTransport {

    private static final Logger log = LoggerFactory.getLogger(UnixSocketScrapeTransport.class);

    private static final ScheduledExecutorService TIMEOUTS = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "unix-socket-timeout");
        t.setDaemon(true);
        return t;
    });

    private final Path socketPath;
    private final Duration responseTimeout;

    public UnixSocketScrapeTransport(Path socketPath, Duration responseTimeout) {
        this.socketPath = socketPath;
        this.responseTimeout = responseTimeout;
    }

    public Path socketPath() {
        return socketPath;
    }

    @Override
    public ScrapeResponse get(URI uri, Map<String, String> headers) throws IOException {
        SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        ScheduledFuture<?> watchdog = TIMEOUTS.schedule(() -> closeOnTimeout(channel),
                responseTimeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            channel.connect(UnixDomainSocketAddress.of(socketPath));
            writeRequest(Channels.newOutputStream(channel), uri, headers);

            InputStream in = new BufferedInputStream(Channels.newInputStream(channel));
            int status = readStatus(HttpLines.readLine(in));
            Map<String, List<String>> responseHeaders = readHeaders(in);

            InputStream body = bodyStream(in, responseHeaders);
            return new ScrapeResponse(status, responseHeaders, body, () -> {
                watchdog.cancel(false);
                channel.close();
            });
        } catch (IOException | RuntimeException e) {
            watchdog.cancel(false);
            try {
                channel.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    private void closeOnTimeout(SocketChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Closing {} after timeout failed: {}", socketPath, e.getMessage());
        }
    }

    private static void writeRequest(OutputStream out, URI uri, Map<String, String> headers) throws IOException {
        String target = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            target += "?" + uri.getRawQuery();
        }
        StringBuilder request = new StringBuilder()
                .append("GET ").append(target).append(" HTTP/1.1\r\n")
                .append("Host: ").append(uri.getHost() == null ? "localhost" : uri.getHost()).append("\r\n")
                .append("Connection: close\r\n");
        headers.forEach((name, value) -> request.append(name).append(": ").append(value).append("\r\n"));
        request.append("\r\n");
        out.write(request.toString().getBytes(StandardCharsets.ISO_8859_1));
        out.flush();
    }

    private static int readStatus(String statusLine) throws IOException {
        // HTTP/1.1 200 OK
        String[] parts = statusLine.split(" ", 3);
        if (parts.length < 2 || !parts[0].startsWith("HTTP/")) {
            throw new IOException("malformed status line \"" + statusLine + "\"");
        }
        try {
            return Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw new IOException("malformed status line \"" + statusLine + "\"", e);
        }
    }

    private static Map<String, List<String>> readHeaders(InputStream in) throws IOException {
        Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        String line;
        while (!(line = HttpLines.readLine(in)).isEmpty()) {
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new IOException("malformed header \"" + line + "\"");
            }
            headers.computeIfAbsent(line.substring(0, colon).trim(), k -> new ArrayList<>())
                    .add(line.substring(colon + 1).trim());
        }
        return headers;
    }

    private static InputStream bodyStream(InputStream in, Map<String, List<String>> headers) throws IOException {
        List<String> encoding = headers.get("Transfer-Encoding");
        if (encoding != null && encoding.get(encoding.size() - 1).toLowerCase(Locale.ROOT).contains("chunked")) {
            return new ChunkedInputStream(in);
        }
        List<String> length = headers.get("Content-Length");
        if (length != null) {
            try {
                return new FixedLengthInputStream(in, Long.parseLong(length.get(0)));
            } catch (NumberFormatException e) {
                throw new IOException("invalid Content-Length " + length.get(0), e);
            }
        }
        // Connection: close, so the body runs to end of stream
        return in;
    }

    private static final class FixedLengthInputStream extends FilterInputStream {
        private long remaining;

        FixedLengthInputStream(InputStream in, long length) {
            super(in);
            this.remaining = length;
        }

        @Override
        public int read() throws IOException {
            if (remaining <= 0) {
                return -1;
            }
            int c = super.read();
            if (c >= 0) {
                remaining--;
            }
            return c;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (remaining <= 0) {
                return -1;
            }
            int n = super.read(b, off, (int) Math.min(len, remaining));
            if (n > 0) {
                remaining -= n;
            }
            return n;
        }
    }
}
