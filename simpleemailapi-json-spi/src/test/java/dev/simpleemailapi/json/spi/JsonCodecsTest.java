package dev.simpleemailapi.json.spi;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonCodecsTest {

    @Test
    void loadFailsWithoutProvider() {
        assertThat(JsonCodecs.findProvider(null)).isEmpty();
        assertThatThrownBy(JsonCodecs::load)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("simpleemailapi-json-jackson");
    }

    @Test
    void defaultPriorityIsZero() {
        JsonCodecProvider provider = () -> null;

        assertThat(provider.priority()).isZero();
    }
}
