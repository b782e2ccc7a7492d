package dev.simpleemailapi.json.spi;

/**
 * Maps SDK message records to and from JSON bodies.
 *
 * <p>Records bind by component name. Unknown properties are ignored and null components are
 * left out on write, so requests only carry what the caller set.
 */
public interface JsonCodec {

    /**
     * Encodes a request message.
     *
     * @param value the message record, or a map for free-form bodies
     * @return UTF-8 JSON
     * @throws JsonException if the value cannot be encoded
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Decodes a response, stream message or error body.
     *
     * @param data UTF-8 JSON
     * @param type the record to bind
     * @return the decoded message
     * @throws JsonException if the body is malformed or does not fit {@code type}
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;
}
