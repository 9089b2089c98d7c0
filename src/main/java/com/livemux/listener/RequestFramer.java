package com.livemux.listener;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits the byte stream of one connection into requests.
 *
 * A request ends with a blank line; blank lines before a request are skipped. Bytes of an
 * unfinished request are kept until more data arrives or the client stops sending.
 * One instance per connection, not thread-safe.
 */
public class RequestFramer {

    private static final int MAX_REQUEST_SIZE = 16 * 1024 * 1024;

    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

    /**
     * Append received bytes and return every request completed by them.
     *
     * @throws IllegalStateException if an unfinished request grows beyond the size limit
     */
    public List<String> feed(byte[] bytes) {
        pending.writeBytes(bytes);
        byte[] data = pending.toByteArray();
        List<String> frames = new ArrayList<>();
        int start = 0;
        int lineStart = 0;
        for (int i = 0; i < data.length; i++) {
            if (data[i] != '\n') {
                continue;
            }
            int lineEnd = i;
            if (lineEnd > lineStart && data[lineEnd - 1] == '\r') {
                lineEnd--;
            }
            if (lineEnd == lineStart) {
                if (lineStart > start) {
                    frames.add(new String(data, start, i + 1 - start, StandardCharsets.UTF_8));
                }
                start = i + 1;
            }
            lineStart = i + 1;
        }
        pending.reset();
        pending.write(data, start, data.length - start);
        if (pending.size() > MAX_REQUEST_SIZE) {
            throw new IllegalStateException("request exceeds " + MAX_REQUEST_SIZE + " bytes");
        }
        return frames;
    }

    /**
     * The unfinished request at end of input, or null if nothing but whitespace is left.
     */
    public String flush() {
        String rest = pending.toString(StandardCharsets.UTF_8);
        pending.reset();
        return rest.isBlank() ? null : rest;
    }
}
