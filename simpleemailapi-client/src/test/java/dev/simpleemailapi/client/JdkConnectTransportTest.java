package dev.simpleemailapi.client;

import dev.simpleemailapi.core.ConnectEnvelopeReader;
import dev.simpleemailapi.core.EmailApiErrors;
import dev.simpleemailapi.core.EmailApiException;
import dev.simpleemailapi.core.ErrorCategory;
import dev.simpleemailapi.core.ErrorCodes;
import dev.simpleemailapi.core.Event;
import dev.simpleemailapi.core.EventPayload;
import dev.simpleemailapi.core.EventType;
import dev.simpleemailapi.core.RpcCode;
import dev.simpleemailapi.core.RpcException;
import dev.simpleemailapi.json.spi.JsonCodecs;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdkConnectTransportTest {

    private static final String DELIVERED = "{\"id\":\"e1\",\"type\":\"EVENT_TYPE_DELIVERED\","
            + "\"emailDelivered\":{\"emailId\":\"m1\",\"recipients\":[\"a@example.com\"],\"timestamp\":\"2025-01-01T00:00:00Z\"}}";
    private static final String HEARTBEAT = "{\"type\":\"EVENT_TYPE_HEARTBEAT\"}";

    private MockWebServer server;
    private JdkConnectTransport transport;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        HttpClient http = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
        transport = new JdkConnectTransport(http, server.url("/").uri(), "em_test", JsonCodecs.load(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    static Buffer envelopes(Object... flagsAndPayloads) {
        Buffer buffer = new Buffer();
        for (int i = 0; i < flagsAndPayloads.length; i += 2) {
            byte[] payload = ((String) flagsAndPayloads[i + 1]).getBytes(StandardCharsets.UTF_8);
            buffer.writeByte((Integer) flagsAndPayloads[i]);
            buffer.writeInt(payload.length);
            buffer.write(payload);
        }
        return buffer;
    }

    private static MockResponse streamResponse(Buffer body) {
        return new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "application/connect+json")
                .setBody(body);
    }

    @Test
    void streamDecodesEventsUntilEndOfStream() throws Exception {
        server.enqueue(streamResponse(envelopes(0, DELIVERED, 0, HEARTBEAT, 2, "{}")));

        try (EventStream stream = transport.openEventStream(new StreamEventsRequest(Set.of(EventType.DELIVERED), 10))) {
            Event first = stream.next();
            assertThat(first.id()).isEqualTo("e1");
            assertThat(first.type()).isEqualTo(EventType.DELIVERED);
            assertThat(first.payload()).isInstanceOfSatisfying(EventPayload.EmailDelivered.class, p -> {
                assertThat(p.emailId()).isEqualTo("m1");
                assertThat(p.recipients()).containsExactly("a@example.com");
            });

            Event second = stream.next();
            assertThat(second.isHeartbeat()).isTrue();
            assertThat(second.isAckable()).isFalse();

            assertThat(stream.next()).isNull();
            assertThat(stream.next()).isNull();
        }

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getPath()).isEqualTo("/v1.EmailService/StreamEvents");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer em_test");
        assertThat(recorded.getHeader("Content-Type")).isEqualTo("application/connect+json");
        assertThat(recorded.getHeader("Connect-Protocol-Version")).isEqualTo("1");

        byte[] body = recorded.getBody().readByteArray();
        assertThat(body[0]).isEqualTo((byte) 0);
        String message = new String(body, 5, body.length - 5, StandardCharsets.UTF_8);
        assertThat(message).contains("\"batchSize\":10").contains("\"EVENT_TYPE_DELIVERED\"");
    }

    @Test
    void endOfStreamErrorIsThrownWithDetails() throws Exception {
        String end = "{\"error\":{\"code\":\"unauthenticated\",\"message\":\"unauthenticated\",\"details\":[{"
                + "\"type\":\"v1.ErrorDetail\",\"value\":\"CGU\","
                + "\"debug\":{\"code\":101,\"message\":\"invalid api key\",\"field\":\"\",\"metadata\":{\"hint\":\"rotate\"}}}]}}";
        server.enqueue(streamResponse(envelopes(0, DELIVERED, 2, end)));

        try (EventStream stream = transport.openEventStream(new StreamEventsRequest(Set.of(), 10))) {
            assertThat(stream.next().id()).isEqualTo("e1");
            assertThatThrownBy(stream::next)
                    .isInstanceOfSatisfying(RpcException.class, e -> {
                        assertThat(e.code()).isEqualTo(RpcCode.UNAUTHENTICATED);
                        EmailApiException parsed = EmailApiErrors.parse(e);
                        assertThat(parsed.is(ErrorCodes.INVALID_API_KEY)).isTrue();
                        assertThat(parsed.isCategory(ErrorCategory.AUTH)).isTrue();
                        assertThat(parsed.getMessage()).isEqualTo("invalid api key");
                        assertThat(parsed.metadata()).containsEntry("hint", "rotate");
                    });
        }
    }

    @Test
    void streamWithoutEndMessageIsUnavailable() throws Exception {
        server.enqueue(streamResponse(envelopes(0, DELIVERED)));

        try (EventStream stream = transport.openEventStream(new StreamEventsRequest(Set.of(), 10))) {
            stream.next();
            assertThatThrownBy(stream::next)
                    .isInstanceOfSatisfying(RpcException.class, e -> assertThat(e.code()).isEqualTo(RpcCode.UNAVAILABLE));
        }
    }

    @Test
    void openFailureDecodesErrorBody() {
        server.enqueue(new MockResponse()
                .setResponseCode(429)
                .addHeader("Content-Type", "application/json")
                .setBody("{\"code\":\"resource_exhausted\",\"message\":\"too many streams\"}"));

        assertThatThrownBy(() -> transport.openEventStream(new StreamEventsRequest(Set.of(), 10)))
                .isInstanceOfSatisfying(RpcException.class, e -> {
                    assertThat(e.code()).isEqualTo(RpcCode.RESOURCE_EXHAUSTED);
                    assertThat(e.getMessage()).isEqualTo("too many streams");
                });
    }

    @Test
    void unaryPostsJsonAndDecodesResponse() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "application/json")
                .setBody("{\"id\":\"msg_1\",\"ignored\":true}"));

        SendEmailResponse resp = transport.unary("v1.EmailService/SendEmail",
                SendEmailRequest.of("hi@example.com", List.of("a@example.com"), "Hello", "World"),
                SendEmailResponse.class);

        assertThat(resp.id()).isEqualTo("msg_1");
        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getPath()).isEqualTo("/v1.EmailService/SendEmail");
        assertThat(recorded.getHeader("Content-Type")).isEqualTo("application/json");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer em_test");
        String body = recorded.getBody().readUtf8();
        assertThat(body).contains("\"from\":\"hi@example.com\"").doesNotContain("\"html\"");
    }

    @Test
    void unaryErrorWithoutBodyFallsBackToHttpStatus() {
        server.enqueue(new MockResponse().setResponseCode(401));

        assertThatThrownBy(() -> transport.unary("v1.EmailService/SendEmail", java.util.Map.of(), SendEmailResponse.class))
                .isInstanceOfSatisfying(RpcException.class, e -> assertThat(e.code()).isEqualTo(RpcCode.UNAUTHENTICATED));
    }

    @Test
    void ackPostsEventIds() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

        transport.ackEvents(new AckEventsRequest(List.of("e1", "e2")), Duration.ofSeconds(5));

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getPath()).isEqualTo("/v1.EmailService/AckEvents");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"eventIds\":[\"e1\",\"e2\"]}");
    }

    @Test
    void cancellingDuringCloseFailureDoesNotThrow() {
        InputStream body = new ByteArrayInputStream(new byte[0]) {
            @Override
            public void close() throws IOException {
                throw new IOException("socket already gone");
            }
        };
        JdkConnectTransport.ConnectEventStream stream =
                new JdkConnectTransport.ConnectEventStream(new ConnectEnvelopeReader(body), JsonCodecs.load());
        CancellationScope scope = new CancellationScope();
        scope.onCancel(stream::close);

        assertThatCode(scope::cancel).doesNotThrowAnyException();
        assertThatCode(stream::close).doesNotThrowAnyException();
    }
}
