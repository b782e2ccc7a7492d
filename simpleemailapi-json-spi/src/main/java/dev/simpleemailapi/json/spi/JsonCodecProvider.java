package dev.simpleemailapi.json.spi;

/**
 * ServiceLoader entry point for {@link JsonCodec} implementations.
 *
 * <p>Register implementations in {@code META-INF/services/dev.simpleemailapi.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    /**
     * Creates a codec instance.
     *
     * @return a new codec
     */
    JsonCodec create();

    /**
     * Providers with a higher priority win when several are on the classpath.
     *
     * @return the priority, {@code 0} by default
     */
    default int priority() {
        return 0;
    }
}
