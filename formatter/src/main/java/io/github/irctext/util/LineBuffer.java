package io.github.irctext.util;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Accumulates raw bytes from a stream and hands out the complete lines received so far. A trailing carriage return is
 * removed from each line and undecodable bytes are replaced rather than rejected.
 *
 * <p>Not thread safe.
 */
public final class LineBuffer implements Iterator<String> {

    private final Charset charset;
    private final byte delimiter;
    private byte[] buffer = new byte[256];
    private int length;

    public LineBuffer() {
        this(StandardCharsets.UTF_8, (byte) '\n');
    }

    public LineBuffer(Charset charset, byte delimiter) {
        this.charset = charset;
        this.delimiter = delimiter;
    }

    /** Adds received bytes; returns {@code data} for chaining in read loops. */
    public byte[] append(byte[] data) {
        if (length + data.length > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, length + data.length));
        }
        System.arraycopy(data, 0, buffer, length, data.length);
        length += data.length;
        return data;
    }

    /** Bytes received after the last complete line. */
    public int pending() {
        return length;
    }

    @Override
    public boolean hasNext() {
        return indexOfDelimiter() >= 0;
    }

    @Override
    public String next() {
        int end = indexOfDelimiter();
        if (end < 0) {
            throw new NoSuchElementException("No complete line buffered");
        }
        int lineEnd = end;
        if (lineEnd > 0 && buffer[lineEnd - 1] == '\r') {
            lineEnd--;
        }
        String line = new String(buffer, 0, lineEnd, charset);
        int rest = length - end - 1;
        System.arraycopy(buffer, end + 1, buffer, 0, rest);
        length = rest;
        return line;
    }

    private int indexOfDelimiter() {
        for (int i = 0; i < length; i++) {
            if (buffer[i] == delimiter) {
                return i;
            }
        }
        return -1;
    }
}
