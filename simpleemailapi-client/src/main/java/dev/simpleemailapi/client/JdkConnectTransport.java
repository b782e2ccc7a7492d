package dev.simpleemailapi.client;

import dev.simpleemailapi.core.ConnectEnvelope;
import dev.simpleemailapi.core.ConnectEnvelopeReader;
import dev.simpleemailapi.core.Event;
import dev.simpleemailapi.core.EventType;
import dev.simpleemailapi.core.Protocol;
import dev.simpleemailapi.core.RpcCode;
import dev.simpleemailapi.core.RpcException;
import dev.simpleemailapi.json.spi.JsonCodec;
import dev.simpleemailapi.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Transport implementation speaking the Connect protocol (JSON codec) over {@link java.net.http.HttpClient}.
 *
 * <p>Unary calls post a plain JSON body. {@code StreamEvents} posts a single enveloped message and
 * reads enveloped events until the end-of-stream message.
 */
public final class JdkConnectTransport implements EmailApiTransport {
    private static final Logger log = LoggerFactory.getLogger(JdkConnectTransport.class);

    private final HttpClient http;
    private final URI baseUrl;
    private final String apiKey;
    private final JsonCodec json;
    private final Duration requestTimeout;

    /**
     * Creates a new transport.
     *
     * @param http the JDK HttpClient to use
     * @param baseUrl the API endpoint, e.g. {@value Protocol#DEFAULT_BASE_URL}
     * @param apiKey the API key sent as bearer token
     * @param json the codec for request and response messages
     * @param requestTimeout default timeout of unary calls (may be null for none)
     */
    public JdkConnectTransport(HttpClient http, URI baseUrl, String apiKey, JsonCodec json, Duration requestTimeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.json = Objects.requireNonNull(json, "json");
        this.requestTimeout = requestTimeout;
    }

    @Override
    public EventStream openEventStream(StreamEventsRequest request) throws Exception {
        byte[] message = encode(ConnectWire.StreamEventsMessage.of(request));
        HttpRequest req = newRequest(Protocol.STREAM_EVENTS, Protocol.CT_CONNECT_JSON, null)
                .POST(HttpRequest.BodyPublishers.ofByteArray(ConnectEnvelope.encode(0, message)))
                .build();

        HttpResponse<InputStream> resp = http.send(req, HttpResponse.BodyHandlers.ofInputStream());
        if (resp.statusCode() != 200) {
            byte[] body;
            try (InputStream in = resp.body()) {
                body = in.readAllBytes();
            }
            throw errorFromBody(resp.statusCode(), body);
        }
        return new ConnectEventStream(new ConnectEnvelopeReader(resp.body()), json);
    }

    @Override
    public void ackEvents(AckEventsRequest request, Duration timeout) throws Exception {
        send(Protocol.ACK_EVENTS, new ConnectWire.AckEventsMessage(request.eventIds()), Void.class, timeout);
    }

    @Override
    public <T> T unary(String procedure, Object request, Class<T> responseType) throws Exception {
        return send(procedure, request, responseType, requestTimeout);
    }

    private <T> T send(String procedure, Object request, Class<T> responseType, Duration timeout) throws Exception {
        HttpRequest req = newRequest(procedure, Protocol.CT_JSON, timeout)
                .POST(HttpRequest.BodyPublishers.ofByteArray(encode(request)))
                .build();

        HttpResponse<byte[]> resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
        byte[] body = resp.body() == null ? new byte[0] : resp.body();
        if (resp.statusCode() != 200) {
            throw errorFromBody(resp.statusCode(), body);
        }
        if (responseType == Void.class || body.length == 0) {
            return null;
        }
        try {
            return json.readValue(body, responseType);
        } catch (JsonException e) {
            throw new RpcException(RpcCode.INTERNAL, "unmarshal " + procedure + " response: " + e.getMessage(), e);
        }
    }

    private HttpRequest.Builder newRequest(String procedure, String contentType, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(resolve(procedure))
                .header(Protocol.H_CONTENT_TYPE, contentType)
                .header(Protocol.H_CONNECT_PROTOCOL_VERSION, Protocol.CONNECT_PROTOCOL_VERSION)
                .header(Protocol.H_AUTHORIZATION, Protocol.BEARER_PREFIX + apiKey);
        if (timeout != null) {
            builder.timeout(timeout);
        }
        return builder;
    }

    private URI resolve(String procedure) {
        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/" + procedure);
    }

    private byte[] encode(Object message) {
        try {
            return json.writeBytes(message);
        } catch (JsonException e) {
            throw new RpcException(RpcCode.INTERNAL, "marshal request: " + e.getMessage(), e);
        }
    }

    private RpcException errorFromBody(int status, byte[] body) {
        RpcCode fallback = RpcCode.fromHttpStatus(status);
        if (body != null && body.length > 0) {
            try {
                ConnectWire.ErrorBody error = json.readValue(body, ConnectWire.ErrorBody.class);
                if (error != null) {
                    return error.toException(fallback);
                }
            } catch (JsonException e) {
                return new RpcException(fallback, "HTTP status " + status, e);
            }
        }
        return new RpcException(fallback, "HTTP status " + status);
    }

    static final class ConnectEventStream implements EventStream {
        private final ConnectEnvelopeReader reader;
        private final JsonCodec json;
        private volatile boolean closed;
        private boolean ended;

        ConnectEventStream(ConnectEnvelopeReader reader, JsonCodec json) {
            this.reader = reader;
            this.json = json;
        }

        @Override
        public Event next() throws Exception {
            if (ended) {
                return null;
            }
            ConnectEnvelope envelope = reader.next();
            if (envelope == null) {
                ended = true;
                throw new RpcException(RpcCode.UNAVAILABLE, "stream closed without end-of-stream message");
            }
            if (envelope.isCompressed()) {
                throw new RpcException(RpcCode.INTERNAL, "received compressed message but no compression was negotiated");
            }
            if (envelope.isEndStream()) {
                ended = true;
                ConnectWire.EndStreamMessage end = decode(envelope.payload(), ConnectWire.EndStreamMessage.class);
                if (end != null && end.error() != null) {
                    throw end.error().toException(RpcCode.UNKNOWN);
                }
                return null;
            }
            ConnectWire.EventMessage message = decode(envelope.payload(), ConnectWire.EventMessage.class);
            return message == null ? new Event("", EventType.UNSPECIFIED, null) : message.toEvent();
        }

        private <T> T decode(byte[] payload, Class<T> type) {
            if (payload.length == 0) {
                return null;
            }
            try {
                return json.readValue(payload, type);
            } catch (JsonException e) {
                throw new RpcException(RpcCode.INTERNAL, "unmarshal stream message: " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                reader.close();
            } catch (IOException e) {
                log.debug("closing event stream body failed", e);
            }
        }
    }
}
