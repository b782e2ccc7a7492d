package dev.simpleemailapi.json.jackson;

import dev.simpleemailapi.json.spi.JsonCodec;
import dev.simpleemailapi.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    @Override
    public JsonCodec create() {
        return new JacksonJsonCodec();
    }
}
