package io.github.drompincen.tabsensei.persistence.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.changestream.FullDocument;
import io.github.drompincen.tabsensei.persistence.document.StoreEntryDocument;
import io.github.drompincen.tabsensei.persistence.repository.StoreEntryRepository;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Tails the {@code store_entries} collection and turns every insert, update or replace into a
 * {@link StoreChange}. Falls back to polling on {@code updatedAt} when change streams are not
 * available (standalone server without a replica set).
 */
@Component
@ConditionalOnProperty(name = "tabsensei.store.provider", havingValue = "mongo")
public class StoreChangeStreamTailer {

    private static final Logger log = LoggerFactory.getLogger(StoreChangeStreamTailer.class);
    static final String COLLECTION = "store_entries";

    private final MongoTemplate mongoTemplate;
    private final StoreEntryRepository repository;
    private final ObjectMapper objectMapper;
    private final List<StoreChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "store-change-tailer");
        t.setDaemon(true);
        return t;
    });
    private volatile boolean running = false;

    public StoreChangeStreamTailer(MongoTemplate mongoTemplate, StoreEntryRepository repository,
                                   ObjectMapper objectMapper) {
        this.mongoTemplate = mongoTemplate;
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    public void addListener(StoreChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(StoreChangeListener listener) {
        listeners.remove(listener);
    }

    @PostConstruct
    public void start() {
        running = true;
        executor.submit(this::tailChangeStream);
        log.info("Store change stream tailer started");
    }

    @PreDestroy
    public void stop() {
        running = false;
        executor.shutdownNow();
        log.info("Store change stream tailer stopped");
    }

    private void tailChangeStream() {
        while (running) {
            try {
                doTail();
            } catch (Exception e) {
                if (running) {
                    log.warn("Change stream interrupted, falling back to polling: {}", e.getMessage());
                    pollFallback();
                }
            }
        }
    }

    private void doTail() {
        var collection = mongoTemplate.getDb().getCollection(COLLECTION);
        var stream = collection.watch(
                List.of(Aggregates.match(Filters.in("operationType", "insert", "update", "replace")))
        ).fullDocument(FullDocument.UPDATE_LOOKUP);

        try (var cursor = stream.iterator()) {
            while (running && cursor.hasNext()) {
                var change = cursor.next();
                Document fullDoc = change.getFullDocument();
                if (fullDoc != null) {
                    StoreEntryDocument entry = mongoTemplate.getConverter().read(StoreEntryDocument.class, fullDoc);
                    notifyListeners(entry);
                }
            }
        }
    }

    private void pollFallback() {
        log.info("Using polling fallback for store notifications");
        PollCursor cursor = new PollCursor(Instant.now());
        while (running) {
            try {
                pollOnce(cursor);
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Polling fallback error", e);
                try { Thread.sleep(1000); } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    /**
     * Reads every entry written at or after the cursor. Entries sharing the cursor's timestamp are
     * re-read on the next poll, so the ones already delivered with the same value are skipped.
     */
    void pollOnce(PollCursor cursor) {
        for (StoreEntryDocument entry : repository.findByUpdatedAtGreaterThanEqualOrderByUpdatedAtAsc(cursor.lastSeen)) {
            if (cursor.alreadyDelivered(entry)) {
                continue;
            }
            notifyListeners(entry);
            cursor.advance(entry);
        }
    }

    static final class PollCursor {
        private Instant lastSeen;
        private final Map<String, String> valuesAtLastSeen = new HashMap<>();

        PollCursor(Instant start) {
            this.lastSeen = start;
        }

        boolean alreadyDelivered(StoreEntryDocument entry) {
            return entry.getUpdatedAt().equals(lastSeen)
                    && valuesAtLastSeen.containsKey(entry.getKey())
                    && Objects.equals(valuesAtLastSeen.get(entry.getKey()), entry.getValueJson());
        }

        void advance(StoreEntryDocument entry) {
            if (entry.getUpdatedAt().isAfter(lastSeen)) {
                lastSeen = entry.getUpdatedAt();
                valuesAtLastSeen.clear();
            }
            valuesAtLastSeen.put(entry.getKey(), entry.getValueJson());
        }
    }

    void notifyListeners(StoreEntryDocument entry) {
        StoreChange change;
        try {
            JsonNode value = entry.isTombstone() ? null : objectMapper.readTree(entry.getValueJson());
            change = new StoreChange(entry.getKey(), value);
        } catch (Exception e) {
            log.warn("Skipping unreadable store entry {}: {}", entry.getKey(), e.getMessage());
            return;
        }
        for (StoreChangeListener listener : listeners) {
            try {
                listener.onChange(change);
            } catch (Exception e) {
                log.error("Listener error for store key {}", entry.getKey(), e);
                listener.onError(e);
            }
        }
    }
}
