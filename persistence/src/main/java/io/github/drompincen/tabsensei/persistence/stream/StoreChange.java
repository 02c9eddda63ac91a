package io.github.drompincen.tabsensei.persistence.stream;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Mutation notification for one key. {@code value} is null when the key was removed.
 */
public record StoreChange(String key, JsonNode value) {

    public boolean removed() {
        return value == null;
    }
}
