package dev.simpleemailapi.json.spi;

import java.util.Comparator;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Discovers {@link JsonCodecProvider} implementations via {@link ServiceLoader}.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    /**
     * Finds the highest-priority provider on the classpath.
     *
     * @param classLoader the class loader to search (may be null for the context loader)
     * @return the provider, if any
     */
    public static Optional<JsonCodecProvider> findProvider(ClassLoader classLoader) {
        ServiceLoader<JsonCodecProvider> loader = classLoader == null
                ? ServiceLoader.load(JsonCodecProvider.class)
                : ServiceLoader.load(JsonCodecProvider.class, classLoader);
        return loader.stream()
                .map(ServiceLoader.Provider::get)
                .max(Comparator.comparingInt(JsonCodecProvider::priority));
    }

    /**
     * Creates a codec from the highest-priority provider on the classpath.
     *
     * @return the codec
     * @throws IllegalStateException if no provider is registered
     */
    public static JsonCodec load() {
        return findProvider(null)
                .map(JsonCodecProvider::create)
                .orElseThrow(() -> new IllegalStateException(
                        "No JsonCodecProvider found; add simpleemailapi-json-jackson to the classpath"));
    }
}
