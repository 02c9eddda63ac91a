package io.github.drompincen.tabsensei.runtime.transcript;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.tabsensei.persistence.store.SharedStore;
import io.github.drompincen.tabsensei.protocol.store.StoreKeys;
import io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reads and writes the logical transcript. Every write touches all aliases in one ordered store
 * write: legacy alias first, canonical key last, so a reader of the canonical key never sees an
 * alias that is newer than it.
 */
@Service
public class TranscriptStore {

    private static final Logger log = LoggerFactory.getLogger(TranscriptStore.class);

    private final SharedStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TranscriptStore(SharedStore store, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public CompletableFuture<TranscriptSnapshot> read() {
        return store.getAll(List.of(StoreKeys.TRANSCRIPT, StoreKeys.TRANSCRIPT_LEGACY, StoreKeys.TRANSCRIPT_CLEARED_AT))
                .thenApply(values -> {
                    JsonNode canonical = values.get(StoreKeys.TRANSCRIPT);
                    // Installs that predate the canonical key only have the legacy alias.
                    if (canonical == null) canonical = values.get(StoreKeys.TRANSCRIPT_LEGACY);
                    return new TranscriptSnapshot(toMessages(canonical), toInstant(values.get(StoreKeys.TRANSCRIPT_CLEARED_AT)));
                });
    }

    public CompletableFuture<Void> write(List<TranscriptMessage> messages) {
        JsonNode value = objectMapper.valueToTree(messages);
        Map<String, JsonNode> entries = new LinkedHashMap<>();
        for (String alias : StoreKeys.TRANSCRIPT_ALIASES) entries.put(alias, value);
        return store.setAll(entries);
    }

    /**
     * Re-reads, merges {@code base} with what is stored, appends {@code turns} and writes the result.
     * Returns the written transcript.
     *
     * @param baseClearedAt the cleared marker the writer had seen when it took {@code base}. A newer
     *                      stored marker means {@code base} predates a clear and is dropped.
     */
    public CompletableFuture<List<TranscriptMessage>> append(List<TranscriptMessage> base, Instant baseClearedAt,
                                                             List<TranscriptMessage> turns) {
        return read().thenCompose(snapshot -> {
            List<TranscriptMessage> current;
            if (snapshot.clearedAt().isAfter(baseClearedAt != null ? baseClearedAt : Instant.EPOCH)) {
                log.info("Dropping {} messages written before the clear at {}", base.size(), snapshot.clearedAt());
                current = snapshot.messages();
            } else {
                current = TranscriptMerger.mergeLocal(snapshot.messages(), base);
            }
            List<TranscriptMessage> merged = new ArrayList<>(current);
            merged.addAll(turns);
            List<TranscriptMessage> result = List.copyOf(merged);
            return write(result).thenApply(v -> result);
        });
    }

    /**
     * Clears every alias. The cleared marker goes last: a reader that sees the new marker must
     * already see the empty canonical transcript, or it would adopt the marker with stale turns.
     */
    public CompletableFuture<Instant> clear() {
        Instant clearedAt = clock.instant();
        JsonNode empty = objectMapper.createArrayNode();
        Map<String, JsonNode> entries = new LinkedHashMap<>();
        entries.put(StoreKeys.TRANSCRIPT_LEGACY, empty);
        entries.put(StoreKeys.TRANSCRIPT, empty);
        entries.put(StoreKeys.TRANSCRIPT_CLEARED_AT, new TextNode(clearedAt.toString()));
        log.info("Clearing transcript at {}", clearedAt);
        return store.setAll(entries).thenApply(v -> clearedAt);
    }

    public List<TranscriptMessage> toMessages(JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        List<TranscriptMessage> messages = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            try {
                messages.add(objectMapper.treeToValue(item, TranscriptMessage.class));
            } catch (Exception e) {
                log.warn("Dropping unreadable transcript entry: {}", e.getMessage());
            }
        }
        return List.copyOf(messages);
    }

    public static Instant toInstant(JsonNode node) {
        if (node == null || !node.isTextual()) return Instant.EPOCH;
        try {
            return Instant.parse(node.asText());
        } catch (Exception e) {
            log.warn("Ignoring malformed cleared marker {}: {}", node.asText(), e.getMessage());
            return Instant.EPOCH;
        }
    }
}
