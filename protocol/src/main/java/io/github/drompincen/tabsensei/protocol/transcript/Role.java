package io.github.drompincen.tabsensei.protocol.transcript;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
    USER, ASSISTANT, SYSTEM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Role fromWire(String value) {
        if (value == null) return SYSTEM;
        return switch (value.toLowerCase()) {
            case "user" -> USER;
            case "assistant" -> ASSISTANT;
            default -> SYSTEM;
        };
    }
}
