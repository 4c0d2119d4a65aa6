package io.scrapehive.scraper.transport;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Decodes an HTTP/1.1 {@code Transfer-Encoding: chunked} body. Trailers are read and dropped.
 */
class ChunkedInputStream extends InputStream {

    private final InputStream in;
    private long remaining;
    private boolean finished;

    ChunkedInputStream(InputStream in) {
        this.in = in;
    }

    @Override
    public int read() throws IOException {
        byte[] one = new byte[1];
        int n = read(one, 0, 1);
        return n < 0 ? -1 : one[0] & 0xff;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        if (finished) {
            return -1;
        }
        if (remaining == 0) {
            remaining = nextChunkSize();
            if (remaining == 0) {
                // trailer section ends with an empty line
                String trailer;
                do {
                    trailer = HttpLines.readLine(in);
                } while (!trailer.isEmpty());
                finished = true;
                return -1;
            }
        }
        int n = in.read(b, off, (int) Math.min(len, remaining));
        if (n < 0) {
            throw new EOFException("connection closed inside a chunk");
        }
        remaining -= n;
        if (remaining == 0 && !HttpLines.readLine(in).isEmpty()) {
            throw new IOException("missing CRLF after chunk");
        }
        return n;
    }

    private long nextChunkSize() throws IOException {
        String line = HttpLines.readLine(in);
        int ext = line.indexOf(';');
        String size = (ext >= 0 ? line.substring(0, ext) : line).trim();
        try {
            return Long.parseLong(size, 16);
        } catch (NumberFormatException e) {
            throw new IOException("invalid chunk size \"" + line + "\"", e);
        }
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
