package dev.simpleemailapi.core;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * One length-prefixed message of a streaming call.
 *
 * <p>Wire layout: {@code [flags:1][length:4, big-endian][payload:length]}.
 *
 * @param flags envelope flags
 * @param payload message bytes
 */
public record ConnectEnvelope(int flags, byte[] payload) {

    /** Set on the final message of a response stream, which carries the end-of-stream JSON. */
    public static final int FLAG_END_STREAM = 0x02;

    /** Set when the payload is compressed. */
    public static final int FLAG_COMPRESSED = 0x01;

    public ConnectEnvelope {
        Objects.requireNonNull(payload, "payload");
    }

    public boolean isEndStream() {
        return (flags & FLAG_END_STREAM) != 0;
    }

    public boolean isCompressed() {
        return (flags & FLAG_COMPRESSED) != 0;
    }

    /**
     * Encodes a single message envelope.
     *
     * @param flags envelope flags
     * @param payload message bytes
     * @return the framed bytes
     */
    public static byte[] encode(int flags, byte[] payload) {
        ByteBuffer buf = ByteBuffer.allocate(5 + payload.length);
        buf.put((byte) flags);
        buf.putInt(payload.length);
        buf.put(payload);
        return buf.array();
    }
}
