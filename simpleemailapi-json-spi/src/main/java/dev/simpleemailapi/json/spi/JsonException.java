package dev.simpleemailapi.json.spi;

/**
 * A message could not be encoded or decoded.
 */
public class JsonException extends Exception {
    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
