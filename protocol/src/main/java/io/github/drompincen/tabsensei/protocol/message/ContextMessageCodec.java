package io.github.drompincen.tabsensei.protocol.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.UncheckedIOException;

/**
 * JSON framing for {@link ContextMessage}. Variants without fields serialize to just their type tag.
 */
public final class ContextMessageCodec {

    private final ObjectMapper mapper;

    public ContextMessageCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ContextMessageCodec() {
        this(new ObjectMapper().findAndRegisterModules());
    }

    public String encode(ContextMessage message) {
        try {
            return mapper.writerFor(ContextMessage.class).writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot encode " + message, e);
        }
    }

    public ContextMessage decode(String json) {
        try {
            return mapper.readValue(json, ContextMessage.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed context message: " + e.getOriginalMessage(), e);
        }
    }
}
