package dev.simpleemailapi.json.jackson;

import dev.simpleemailapi.json.spi.JsonCodec;
import dev.simpleemailapi.json.spi.JsonCodecs;
import dev.simpleemailapi.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    record AckMessage(String id, List<String> eventIds, Map<String, String> metadata) {}

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void serviceLoaderFindsJacksonProvider() {
        JsonCodec loaded = JsonCodecs.load();

        assertThat(loaded).isInstanceOf(JacksonJsonCodec.class);
    }

    @Test
    void readsRecordsAndIgnoresUnknownProperties() throws Exception {
        AckMessage m = codec.readValue(utf8("{\"id\":\"e1\",\"eventIds\":[\"a\",\"b\"],\"extra\":42}"), AckMessage.class);

        assertThat(m.id()).isEqualTo("e1");
        assertThat(m.eventIds()).containsExactly("a", "b");
        assertThat(m.metadata()).isNull();
    }

    @Test
    void writeOmitsNullComponents() throws Exception {
        byte[] json = codec.writeBytes(new AckMessage("e1", List.of("a"), null));

        assertThat(new String(json, StandardCharsets.UTF_8)).isEqualTo("{\"id\":\"e1\",\"eventIds\":[\"a\"]}");
    }

    @Test
    void writtenMessageDecodesToEqualRecord() throws Exception {
        AckMessage message = new AckMessage("e2", List.of(), Map.of("k", "v"));

        assertThat(codec.readValue(codec.writeBytes(message), AckMessage.class)).isEqualTo(message);
    }

    @Test
    void malformedJsonRaisesJsonException() {
        assertThatThrownBy(() -> codec.readValue(utf8("{not json"), AckMessage.class))
                .isInstanceOf(JsonException.class)
                .hasMessageContaining("AckMessage");
    }
}
