package io.github.drompincen.tabsensei.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a reasoning-service reply. Not a persistent state.
 */
public enum DispatchMode {
    SINGLE, MULTI, CLEANUP;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static DispatchMode fromWire(String value) {
        if (value == null) return SINGLE;
        return switch (value.toLowerCase()) {
            case "multi" -> MULTI;
            case "cleanup" -> CLEANUP;
            default -> SINGLE;
        };
    }
}
