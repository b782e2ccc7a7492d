package dev.simpleemailapi.client;

import dev.simpleemailapi.core.Protocol;
import dev.simpleemailapi.json.spi.JsonCodec;
import dev.simpleemailapi.json.spi.JsonCodecs;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

/**
 * Builder for {@link EmailApiClient}.
 *
 * <p>Allows configuring the transport layer (JDK HttpClient or custom) and streaming behaviour.
 */
public final class EmailApiClientBuilder {
    private String apiKey;
    private URI baseUrl = URI.create(Protocol.DEFAULT_BASE_URL);
    private HttpClient httpClient;
    private EmailApiTransport transport;
    private JsonCodec jsonCodec;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private StreamingOptions streamingOptions = StreamingOptions.defaults();

    /**
     * Sets the API key sent as bearer token. Required unless a custom transport is set.
     *
     * @param apiKey the API key ({@code em_...})
     * @return this builder
     */
    public EmailApiClientBuilder apiKey(String apiKey) {
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        return this;
    }

    public EmailApiClientBuilder baseUrl(String baseUrl) {
        this.baseUrl = URI.create(Objects.requireNonNull(baseUrl, "baseUrl"));
        return this;
    }

    public EmailApiClientBuilder baseUrl(URI baseUrl) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        return this;
    }

    /**
     * Uses the default Connect transport with a provided HttpClient instance.
     *
     * @param httpClient the JDK HttpClient to use
     * @return this builder
     */
    public EmailApiClientBuilder httpClient(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        return this;
    }

    /**
     * Sets a custom transport implementation; HTTP settings of this builder are then ignored.
     *
     * @param transport the transport to use
     * @return this builder
     */
    public EmailApiClientBuilder transport(EmailApiTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return this;
    }

    /**
     * Sets the JSON codec. Defaults to the highest-priority {@link dev.simpleemailapi.json.spi.JsonCodecProvider}
     * on the classpath.
     *
     * @param jsonCodec the codec
     * @return this builder
     */
    public EmailApiClientBuilder jsonCodec(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        return this;
    }

    public EmailApiClientBuilder requestTimeout(Duration requestTimeout) {
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        return this;
    }

    public EmailApiClientBuilder streamingOptions(StreamingOptions streamingOptions) {
        this.streamingOptions = Objects.requireNonNull(streamingOptions, "streamingOptions");
        return this;
    }

    /**
     * Builds the client.
     *
     * <p>If no transport is configured, a Connect transport over a JDK HttpClient is created.
     *
     * @return the new client instance
     */
    public EmailApiClient build() {
        EmailApiTransport resolved = transport;
        if (resolved == null) {
            if (apiKey == null || apiKey.isBlank()) {
                throw new IllegalStateException("apiKey is required");
            }
            HttpClient http = httpClient != null ? httpClient : HttpClient.newHttpClient();
            JsonCodec codec = jsonCodec != null ? jsonCodec : JsonCodecs.load();
            resolved = new JdkConnectTransport(http, baseUrl, apiKey, codec, requestTimeout);
        }
        return new DefaultEmailApiClient(resolved, streamingOptions);
    }
}
