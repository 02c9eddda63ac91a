package io.github.drompincen.tabsensei.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One key of the shared store. A removed key is kept as a tombstone ({@code valueJson == null}) so
 * that the polling fallback of the change tailer also observes removals.
 */
@Document(collection = "store_entries")
public class StoreEntryDocument {

    @Id
    private String key;
    private String valueJson;

    @Indexed
    private Instant updatedAt;

    public StoreEntryDocument() {}

    public StoreEntryDocument(String key, String valueJson, Instant updatedAt) {
        this.key = key;
        this.valueJson = valueJson;
        this.updatedAt = updatedAt;
    }

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public String getValueJson() { return valueJson; }
    public void setValueJson(String valueJson) { this.valueJson = valueJson; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public boolean isTombstone() { return valueJson == null; }
}
