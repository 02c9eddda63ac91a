package io.github.drompincen.tabsensei.persistence.store;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.tabsensei.persistence.stream.StoreChangeListener;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous key-value store visible to every context. Last write wins per key; there are no
 * transactions. A multi-key write is applied key by key in the iteration order of the given map,
 * so callers order keys least-authoritative first.
 */
public interface SharedStore {

    CompletableFuture<Optional<JsonNode>> get(String key);

    CompletableFuture<Map<String, JsonNode>> getAll(Collection<String> keys);

    CompletableFuture<Void> setAll(Map<String, JsonNode> orderedEntries);

    CompletableFuture<Void> remove(Collection<String> keys);

    /** Registers a mutation listener. Notifications only fire for values that actually changed. */
    Subscription subscribe(StoreChangeListener listener);

    default CompletableFuture<Void> set(String key, JsonNode value) {
        return setAll(Map.of(key, value));
    }

    default CompletableFuture<Void> remove(String key) {
        return remove(java.util.List.of(key));
    }

    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
