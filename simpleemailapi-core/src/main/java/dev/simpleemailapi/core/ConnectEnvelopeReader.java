package dev.simpleemailapi.core;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Minimal reader of {@link ConnectEnvelope} frames from a streaming response body.
 */
public final class ConnectEnvelopeReader implements AutoCloseable {

    /** Upper bound for a single message; larger frames indicate a corrupt stream. */
    public static final int MAX_MESSAGE_BYTES = 16 * 1024 * 1024;

    private final InputStream in;

    /**
     * Creates a new reader.
     *
     * @param in the response body to read from
     */
    public ConnectEnvelopeReader(InputStream in) {
        this.in = in;
    }

    /**
     * Reads the next envelope.
     *
     * @return the next envelope, or {@code null} on a clean EOF between frames
     * @throws IOException if an I/O error occurs or the stream ends mid-frame
     */
    public ConnectEnvelope next() throws IOException {
        int flags = in.read();
        if (flags < 0) return null;

        byte[] header = in.readNBytes(4);
        if (header.length < 4) {
            throw new EOFException("truncated envelope header");
        }
        int length = ((header[0] & 0xff) << 24)
                | ((header[1] & 0xff) << 16)
                | ((header[2] & 0xff) << 8)
                | (header[3] & 0xff);
        if (length < 0 || length > MAX_MESSAGE_BYTES) {
            throw new IOException("envelope length out of range: " + length);
        }

        byte[] payload = in.readNBytes(length);
        if (payload.length < length) {
            throw new EOFException("truncated envelope payload, expected " + length + " bytes, got " + payload.length);
        }
        return new ConnectEnvelope(flags, payload);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
