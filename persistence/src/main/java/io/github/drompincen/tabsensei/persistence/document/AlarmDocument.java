package io.github.drompincen.tabsensei.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "alarms")
public class AlarmDocument {

    @Id
    private String name;

    @Indexed
    private Instant fireAt;
    private boolean recurring;
    private String displayText;
    private Instant createdAt;

    public AlarmDocument() {}

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Instant getFireAt() { return fireAt; }
    public void setFireAt(Instant fireAt) { this.fireAt = fireAt; }

    public boolean isRecurring() { return recurring; }
    public void setRecurring(boolean recurring) { this.recurring = recurring; }

    public String getDisplayText() { return displayText; }
    public void setDisplayText(String displayText) { this.displayText = displayText; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
