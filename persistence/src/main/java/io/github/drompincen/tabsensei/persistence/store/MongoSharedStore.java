package io.github.drompincen.tabsensei.persistence.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tabsensei.persistence.document.StoreEntryDocument;
import io.github.drompincen.tabsensei.persistence.repository.StoreEntryRepository;
import io.github.drompincen.tabsensei.persistence.stream.StoreChangeListener;
import io.github.drompincen.tabsensei.persistence.stream.StoreChangeStreamTailer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Store backed by the {@code store_entries} collection. Writes are issued one key at a time on a
 * single I/O thread; mutation notifications come from {@link StoreChangeStreamTailer}, so every
 * process sharing the database observes them.
 */
@Component
@ConditionalOnProperty(name = "tabsensei.store.provider", havingValue = "mongo")
public class MongoSharedStore implements SharedStore {

    private static final Logger log = LoggerFactory.getLogger(MongoSharedStore.class);

    private final StoreEntryRepository repository;
    private final StoreChangeStreamTailer tailer;
    private final ObjectMapper objectMapper;
    private final ExecutorService io = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "store-io");
        t.setDaemon(true);
        return t;
    });

    public MongoSharedStore(StoreEntryRepository repository, StoreChangeStreamTailer tailer,
                            ObjectMapper objectMapper) {
        this.repository = repository;
        this.tailer = tailer;
        this.objectMapper = objectMapper;
    }

    @PreDestroy
    public void shutdown() {
        io.shutdown();
    }

    @Override
    public CompletableFuture<Optional<JsonNode>> get(String key) {
        return CompletableFuture.supplyAsync(() -> repository.findById(key)
                .filter(e -> !e.isTombstone())
                .map(this::parse), io);
    }

    @Override
    public CompletableFuture<Map<String, JsonNode>> getAll(Collection<String> keys) {
        return CompletableFuture.supplyAsync(() -> {
            Map<String, StoreEntryDocument> byKey = new LinkedHashMap<>();
            repository.findByKeyIn(keys).forEach(e -> byKey.put(e.getKey(), e));
            Map<String, JsonNode> result = new LinkedHashMap<>();
            for (String key : keys) {
                StoreEntryDocument entry = byKey.get(key);
                if (entry != null && !entry.isTombstone()) result.put(key, parse(entry));
            }
            return result;
        }, io);
    }

    @Override
    public CompletableFuture<Void> setAll(Map<String, JsonNode> orderedEntries) {
        Map<String, String> serialized = new LinkedHashMap<>();
        orderedEntries.forEach((key, value) -> serialized.put(key, write(value)));
        return CompletableFuture.runAsync(() -> serialized.forEach((key, json) -> {
            boolean unchanged = repository.findById(key)
                    .map(existing -> Objects.equals(existing.getValueJson(), json))
                    .orElse(false);
            if (unchanged) return;
            repository.save(new StoreEntryDocument(key, json, Instant.now()));
            log.debug("Stored {}", key);
        }), io);
    }

    @Override
    public CompletableFuture<Void> remove(Collection<String> keys) {
        return CompletableFuture.runAsync(() -> {
            for (String key : keys) {
                repository.findById(key)
                        .filter(e -> !e.isTombstone())
                        .ifPresent(e -> {
                            repository.save(new StoreEntryDocument(key, null, Instant.now()));
                            log.debug("Removed {}", key);
                        });
            }
        }, io);
    }

    @Override
    public Subscription subscribe(StoreChangeListener listener) {
        tailer.addListener(listener);
        return () -> tailer.removeListener(listener);
    }

    private JsonNode parse(StoreEntryDocument entry) {
        try {
            return objectMapper.readTree(entry.getValueJson());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Corrupt store entry " + entry.getKey(), e);
        }
    }

    private String write(JsonNode value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize value", e);
        }
    }
}
