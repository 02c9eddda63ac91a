package io.github.drompincen.tabsensei.persistence.store;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.tabsensei.persistence.stream.StoreChange;
import io.github.drompincen.tabsensei.persistence.stream.StoreChangeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local store. Notifications are delivered on the writer's thread, after each key is
 * written, so a listener never observes a later key of the same write before an earlier one.
 */
@Component
@ConditionalOnProperty(name = "tabsensei.store.provider", havingValue = "memory", matchIfMissing = true)
public class InMemorySharedStore implements SharedStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySharedStore.class);

    private final Map<String, JsonNode> entries = new ConcurrentHashMap<>();
    private final List<StoreChangeListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public CompletableFuture<Optional<JsonNode>> get(String key) {
        return CompletableFuture.completedFuture(Optional.ofNullable(entries.get(key)).map(JsonNode::deepCopy));
    }

    @Override
    public CompletableFuture<Map<String, JsonNode>> getAll(Collection<String> keys) {
        Map<String, JsonNode> result = new LinkedHashMap<>();
        for (String key : keys) {
            JsonNode value = entries.get(key);
            if (value != null) result.put(key, value.deepCopy());
        }
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<Void> setAll(Map<String, JsonNode> orderedEntries) {
        orderedEntries.forEach((key, value) -> {
            JsonNode copy = value.deepCopy();
            JsonNode previous = entries.put(key, copy);
            if (!Objects.equals(previous, copy)) {
                fire(new StoreChange(key, copy));
            }
        });
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> remove(Collection<String> keys) {
        for (String key : keys) {
            if (entries.remove(key) != null) {
                fire(new StoreChange(key, null));
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public Subscription subscribe(StoreChangeListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void fire(StoreChange change) {
        log.debug("Store change {} (removed={})", change.key(), change.removed());
        for (StoreChangeListener listener : listeners) {
            try {
                listener.onChange(change);
            } catch (Exception e) {
                log.error("Listener error for store key {}", change.key(), e);
                listener.onError(e);
            }
        }
    }
}
